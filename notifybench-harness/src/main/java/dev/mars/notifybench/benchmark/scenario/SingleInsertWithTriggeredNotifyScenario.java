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

import dev.mars.notifybench.benchmark.loop.ListenerLoop;
import dev.mars.notifybench.benchmark.loop.PayloadExpectation;
import dev.mars.notifybench.client.connection.NotifyConnection;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.CompletableFuture;

/**
 * Single-row inserts where an AFTER INSERT trigger sends one notification per row.
 * The timed section ends when the listener has received all N.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class SingleInsertWithTriggeredNotifyScenario extends AbstractScenario {

    public static final String NAME = "SingleInsertWithTriggeredNotify";

    static final String INSERT_STATEMENT = "insertNotifyBench";
    static final String INSERT_SQL = "insert into notify_bench(n) values($1)";

    private NotifyConnection inserter;
    private ListenerLoop listener;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Single-row inserts that notify through a trigger";
    }

    @Override
    protected void doSetUp(BenchmarkContext context) {
        inserter = open(context);
        NotifyBenchSchema.createNotifyingTable(inserter, config().getChannel());
        inserter.prepare(INSERT_STATEMENT, INSERT_SQL);

        NotifyConnection listenerConnection = open(context);
        listenerConnection.listen(config().getChannel());
        listener = new ListenerLoop(listenerConnection, config().getChannel(),
                config().getWaitTimeout(), PayloadExpectation.sequence());
    }

    @Override
    public int run(int iterations, Timer iterationTimer) {
        CompletableFuture<Integer> listenerDone = startListener(() -> listener.run(iterations));

        for (int i = 0; i < iterations; i++) {
            final int n = i;
            iterationTimer.record(() -> inserter.exec(INSERT_STATEMENT, n));
        }

        return awaitListener(listenerDone);
    }
}
