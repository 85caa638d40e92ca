package dev.mars.notifybench.client.connection;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


import dev.mars.notifybench.client.config.ConnectionConfig;
import dev.mars.notifybench.client.exception.NotificationTimeoutException;
import dev.mars.notifybench.client.exception.NotifyBenchException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgConnection;
import io.vertx.sqlclient.PreparedStatement;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Blocking wrapper around a single dedicated Vert.x {@link PgConnection}.
 *
 * <p>The benchmarks drive the database from plain threads, one thread per connection, so
 * every call here waits for the underlying future. Notifications arrive on the Vert.x event
 * loop and are queued until {@link #waitForNotification(Duration)} takes them.</p>
 *
 * <p>Must not be called from a Vert.x event-loop thread.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class NotifyConnection implements NotificationSource, StatementExecutor, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(NotifyConnection.class);

    public static final Duration DEFAULT_OPERATION_TIMEOUT = Duration.ofSeconds(30);

    private final PgConnection connection;
    private final Duration operationTimeout;
    private final Map<String, PreparedStatement> preparedStatements = new HashMap<>();
    private final BlockingQueue<Notification> notifications = new LinkedBlockingQueue<>();
    private final AtomicReference<Throwable> connectionFailure = new AtomicReference<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private NotifyConnection(PgConnection connection, Duration operationTimeout) {
        this.connection = connection;
        this.operationTimeout = operationTimeout;

        connection.notificationHandler(notification -> notifications.offer(
                new Notification(notification.getProcessId(), notification.getChannel(), notification.getPayload())));
        connection.exceptionHandler(err -> {
            if (closed.get()) {
                logger.debug("Connection error after close: {}", err.getMessage());
            } else {
                logger.error("Connection error: {}", err.getMessage());
                connectionFailure.compareAndSet(null, err);
            }
        });
        connection.closeHandler(v -> {
            if (!closed.get()) {
                logger.error("Connection closed unexpectedly");
                connectionFailure.compareAndSet(null, new NotifyBenchException("Connection closed unexpectedly"));
            }
        });
    }

    /**
     * Opens a connection with the default per-call timeout.
     */
    public static NotifyConnection connect(Vertx vertx, ConnectionConfig config) {
        return connect(vertx, config, DEFAULT_OPERATION_TIMEOUT);
    }

    /**
     * Opens a connection.
     *
     * @param vertx            the Vert.x instance owning the connection's event loop
     * @param config           connection settings
     * @param operationTimeout upper bound for every blocking driver call
     * @return the open connection
     * @throws NotifyBenchException if the connection cannot be established
     */
    public static NotifyConnection connect(Vertx vertx, ConnectionConfig config, Duration operationTimeout) {
        logger.debug("Connecting to {}", config);
        PgConnection connection = await(PgConnection.connect(vertx, config.toConnectOptions()),
                operationTimeout, "connect");
        logger.debug("Connected to {}:{}/{} (backend pid {})",
                config.getHost(), config.getPort(), config.getDatabase(), connection.processId());
        return new NotifyConnection(connection, operationTimeout);
    }

    /**
     * Prepares {@code sql} and registers it under {@code name} for {@link #exec(String, Object...)}.
     * A statement already registered under the same name is closed and replaced.
     */
    public PreparedStatement prepare(String name, String sql) {
        ensureOpen();
        PreparedStatement statement = await(connection.prepare(sql), operationTimeout, "prepare " + name);
        PreparedStatement previous = preparedStatements.put(name, statement);
        if (previous != null) {
            previous.close();
        }
        logger.debug("Prepared statement '{}': {}", name, sql);
        return statement;
    }

    @Override
    public CommandTag exec(String nameOrSql, Object... args) {
        ensureOpen();
        PreparedStatement statement = preparedStatements.get(nameOrSql);
        Future<RowSet<Row>> result;
        if (statement != null) {
            result = statement.query().execute(Tuple.from(args));
        } else if (args.length > 0) {
            result = connection.preparedQuery(nameOrSql).execute(Tuple.from(args));
        } else {
            result = connection.query(nameOrSql).execute();
        }
        RowSet<Row> rows = await(result, operationTimeout, "exec " + describe(nameOrSql));
        return new CommandTag(rows.rowCount());
    }

    /**
     * Subscribes this connection to {@code channel}.
     */
    public void listen(String channel) {
        ensureOpen();
        await(connection.query("LISTEN " + quoteIdentifier(channel)).execute(), operationTimeout, "listen " + channel);
        logger.debug("Listening on channel: {}", channel);
    }

    /**
     * Unsubscribes this connection from {@code channel}.
     */
    public void unlisten(String channel) {
        ensureOpen();
        await(connection.query("UNLISTEN " + quoteIdentifier(channel)).execute(), operationTimeout, "unlisten " + channel);
        logger.debug("Stopped listening on channel: {}", channel);
    }

    @Override
    public Notification waitForNotification(Duration timeout) {
        // queued notifications win over a later failure
        Notification notification = notifications.poll();
        if (notification != null) {
            return notification;
        }
        rethrowConnectionFailure();
        try {
            notification = notifications.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotifyBenchException("wait interrupted", e);
        }
        if (notification == null) {
            rethrowConnectionFailure();
            throw new NotificationTimeoutException(timeout);
        }
        return notification;
    }

    /**
     * Backend process id of this session, as reported in the notifications it sends.
     */
    public int processId() {
        return connection.processId();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (PreparedStatement statement : preparedStatements.values()) {
            statement.close();
        }
        preparedStatements.clear();
        try {
            await(connection.close(), operationTimeout, "close");
        } catch (NotifyBenchException e) {
            logger.warn("Error closing connection: {}", e.getMessage());
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new NotifyBenchException("Connection already closed");
        }
        rethrowConnectionFailure();
    }

    private void rethrowConnectionFailure() {
        Throwable failure = connectionFailure.get();
        if (failure instanceof NotifyBenchException) {
            throw (NotifyBenchException) failure;
        }
        if (failure != null) {
            throw new NotifyBenchException("Connection failed: " + failure.getMessage(), failure);
        }
    }

    static String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    private static String describe(String nameOrSql) {
        String flat = nameOrSql.strip().replaceAll("\\s+", " ");
        return flat.length() > 60 ? flat.substring(0, 57) + "..." : flat;
    }

    private static <T> T await(Future<T> future, Duration timeout, String step) {
        try {
            return future.toCompletionStage().toCompletableFuture().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotifyBenchException(step + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new NotifyBenchException(step + " failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new NotifyBenchException(step + " timed out after " + timeout.toMillis() + " ms", e);
        }
    }
}
