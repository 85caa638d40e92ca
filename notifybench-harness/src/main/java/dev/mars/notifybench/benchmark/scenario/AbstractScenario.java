package dev.mars.notifybench.benchmark.scenario;

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

import dev.mars.notifybench.benchmark.config.BenchmarkConfig;
import dev.mars.notifybench.client.connection.NotifyConnection;
import dev.mars.notifybench.client.exception.NotifyBenchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Base class that tracks the connections and the listener thread a scenario opens, so
 * {@link #tearDown()} can release them whatever state set-up reached.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public abstract class AbstractScenario implements BenchmarkScenario {

    private static final Logger logger = LoggerFactory.getLogger(AbstractScenario.class);

    private final List<NotifyConnection> connections = new ArrayList<>();
    private ExecutorService listenerExecutor;
    private BenchmarkConfig config;

    @Override
    public final void setUp(BenchmarkContext context) {
        this.config = context.getBenchmarkConfig();
        doSetUp(context);
    }

    /**
     * Scenario specific set-up; connections must be opened through {@link #open(BenchmarkContext)}.
     */
    protected abstract void doSetUp(BenchmarkContext context);

    protected NotifyConnection open(BenchmarkContext context) {
        NotifyConnection connection = context.openConnection();
        connections.add(connection);
        return connection;
    }

    protected BenchmarkConfig config() {
        return config;
    }

    /**
     * Runs {@code task} on this scenario's listener thread. The returned future is the
     * completion signal the driving thread joins once it has finished sending.
     */
    protected CompletableFuture<Integer> startListener(Supplier<Integer> task) {
        if (listenerExecutor == null) {
            listenerExecutor = Executors.newSingleThreadExecutor(r -> {
                Thread thread = new Thread(r, "notifybench-listener-" + getName());
                thread.setDaemon(true);
                return thread;
            });
        }
        return CompletableFuture.supplyAsync(task, listenerExecutor);
    }

    /**
     * Blocks until the listener finishes and rethrows its failure unwrapped.
     */
    protected static int awaitListener(CompletableFuture<Integer> listenerDone) {
        try {
            return listenerDone.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new NotifyBenchException("Listener failed: " + cause, cause);
        }
    }

    @Override
    public void tearDown() {
        if (listenerExecutor != null) {
            listenerExecutor.shutdownNow();
            listenerExecutor = null;
        }
        for (int i = connections.size() - 1; i >= 0; i--) {
            NotifyConnection connection = connections.get(i);
            try {
                connection.close();
            } catch (RuntimeException e) {
                logger.warn("Error closing connection for scenario {}: {}", getName(), e.getMessage());
            }
        }
        connections.clear();
    }
}
