package dev.mars.notifybench.benchmark.loop;

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

import dev.mars.notifybench.client.connection.StatementExecutor;
import io.micrometer.core.instrument.Timer;

/**
 * Sends notifications through the prepared {@value #NOTIFY_STATEMENT} statement, encoding
 * the iteration counter as the payload.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class NotifierLoop {

    public static final String NOTIFY_STATEMENT = "notify";
    public static final String NOTIFY_SQL = "select pg_notify($1, $2)";

    private final StatementExecutor executor;
    private final String channel;

    public NotifierLoop(StatementExecutor executor, String channel) {
        this.executor = executor;
        this.channel = channel;
    }

    /**
     * Sends one notification with payload {@code index}.
     */
    public void send(int index) {
        executor.exec(NOTIFY_STATEMENT, channel, Integer.toString(index));
    }

    /**
     * Sends payloads {@code 0..iterations-1}, recording each send in {@code timer}.
     */
    public void run(int iterations, Timer timer) {
        for (int i = 0; i < iterations; i++) {
            final int index = i;
            timer.record(() -> send(index));
        }
    }

    public String getChannel() {
        return channel;
    }
}
