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

import dev.mars.notifybench.client.connection.NotifyConnection;
import io.micrometer.core.instrument.Timer;

/**
 * Baseline: single-row inserts into a table without a trigger.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class SingleInsertWithoutNotifyScenario extends AbstractScenario {

    public static final String NAME = "SingleInsertWithoutNotify";

    static final String INSERT_STATEMENT = "insertBench";
    static final String INSERT_SQL = "insert into notify_bench(id) values($1)";

    private NotifyConnection connection;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Single-row inserts with no notification, as a baseline";
    }

    @Override
    protected void doSetUp(BenchmarkContext context) {
        connection = open(context);
        NotifyBenchSchema.createPlainTable(connection);
        connection.prepare(INSERT_STATEMENT, INSERT_SQL);
    }

    @Override
    public int run(int iterations, Timer iterationTimer) {
        for (int i = 0; i < iterations; i++) {
            final int id = i;
            iterationTimer.record(() -> connection.exec(INSERT_STATEMENT, id));
        }
        return 0;
    }
}
