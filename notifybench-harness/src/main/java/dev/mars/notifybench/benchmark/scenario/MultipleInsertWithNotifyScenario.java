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
import dev.mars.notifybench.client.exception.NotifyBenchException;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.CompletableFuture;

/**
 * Each iteration inserts a batch of K rows in one statement; the trigger sends one
 * notification per row, so the listener expects N * K notifications.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class MultipleInsertWithNotifyScenario extends AbstractScenario {

    public static final String NAME = "MultipleInsertWithNotify";

    static final String INSERT_STATEMENT = "insertMultipleNotifyBench";
    static final String INSERT_SQL = "insert into notify_bench(n) select generate_series(1,$1)";

    private NotifyConnection inserter;
    private ListenerLoop listener;
    private int batchSize;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Batch inserts of K rows, each row notifying through a trigger";
    }

    @Override
    protected void doSetUp(BenchmarkContext context) {
        batchSize = config().getBatchSize();

        inserter = open(context);
        NotifyBenchSchema.createNotifyingTable(inserter, config().getChannel());
        inserter.prepare(INSERT_STATEMENT, INSERT_SQL);

        NotifyConnection listenerConnection = open(context);
        listenerConnection.listen(config().getChannel());
        listener = new ListenerLoop(listenerConnection, config().getChannel(),
                config().getWaitTimeout(), PayloadExpectation.repeatingSeries(batchSize));
    }

    @Override
    public int run(int iterations, Timer iterationTimer) {
        final int expectedCount = expectedNotifications(iterations);
        CompletableFuture<Integer> listenerDone = startListener(() -> listener.run(expectedCount));

        for (int i = 0; i < iterations; i++) {
            iterationTimer.record(() -> {
                int inserted = inserter.exec(INSERT_STATEMENT, batchSize).rowCount();
                if (inserted != batchSize) {
                    throw new NotifyBenchException("Expected " + batchSize + " rows inserted, got " + inserted);
                }
            });
        }

        return awaitListener(listenerDone);
    }

    private int expectedNotifications(int iterations) {
        try {
            return Math.multiplyExact(iterations, batchSize);
        } catch (ArithmeticException e) {
            throw new NotifyBenchException("Too many notifications expected: " + iterations + " x " + batchSize, e);
        }
    }
}
