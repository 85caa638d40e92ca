package dev.mars.notifybench.benchmark;

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

import dev.mars.notifybench.benchmark.loop.NotifierLoop;
import dev.mars.notifybench.client.config.ConnectionConfig;
import dev.mars.notifybench.client.connection.Notification;
import dev.mars.notifybench.client.connection.NotifyConnection;
import dev.mars.notifybench.client.exception.NotifyBenchException;
import io.vertx.core.Vertx;

import java.io.PrintStream;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Sends one notification and waits for it: a quick check that LISTEN/NOTIFY works
 * against the database named by the {@code PG_*} environment variables.
 *
 * Prints the notification on success. On any failure prints the failed step to
 * standard error and exits with status 1.
 */
public class NotifyOnce {

    static final String CHANNEL = "bench";
    static final String PAYLOAD = "hello";
    static final Duration WAIT_TIMEOUT = Duration.ofSeconds(1);

    public static void main(String[] args) {
        Vertx vertx = Vertx.vertx();
        int status = run(vertx, System::getenv, System.out, System.err);
        vertx.close().toCompletionStage().toCompletableFuture().orTimeout(5, TimeUnit.SECONDS).exceptionally(e -> null).join();
        System.exit(status);
    }

    /**
     * Performs one notify/wait round trip against the database described by {@code env}.
     *
     * @param env variable lookup for the {@code PG_*} settings
     * @return the process exit status, 0 on success
     */
    static int run(Vertx vertx, Function<String, String> env, PrintStream out, PrintStream err) {
        ConnectionConfig config;
        try {
            config = ConnectionConfig.fromEnvironment(env);
        } catch (IllegalArgumentException e) {
            err.println("Config failed: " + e.getMessage());
            return 1;
        }

        String step = "Connect";
        NotifyConnection notifier = null;
        NotifyConnection listener = null;
        try {
            notifier = NotifyConnection.connect(vertx, config);
            listener = NotifyConnection.connect(vertx, config);

            step = "Listen";
            listener.listen(CHANNEL);

            step = "Prepare";
            notifier.prepare(NotifierLoop.NOTIFY_STATEMENT, NotifierLoop.NOTIFY_SQL);

            step = "Exec";
            notifier.exec(NotifierLoop.NOTIFY_STATEMENT, CHANNEL, PAYLOAD);

            step = "WaitForNotification";
            Notification notification = listener.waitForNotification(WAIT_TIMEOUT);

            out.println(notification);
            return 0;

        } catch (NotifyBenchException e) {
            err.println(step + " failed: " + e.getMessage());
            return 1;
        } finally {
            if (listener != null) {
                listener.close();
            }
            if (notifier != null) {
                notifier.close();
            }
        }
    }
}
