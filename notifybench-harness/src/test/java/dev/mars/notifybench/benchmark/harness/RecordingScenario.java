package dev.mars.notifybench.benchmark.harness;

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

import dev.mars.notifybench.benchmark.scenario.BenchmarkContext;
import dev.mars.notifybench.benchmark.scenario.BenchmarkScenario;
import io.micrometer.core.instrument.Timer;

import java.util.ArrayList;
import java.util.List;

/**
 * Scenario that records its lifecycle calls and optionally fails while running.
 */
class RecordingScenario implements BenchmarkScenario {

    private final String name;
    private final RuntimeException failure;
    final List<String> calls = new ArrayList<>();

    RecordingScenario(String name) {
        this(name, null);
    }

    RecordingScenario(String name, RuntimeException failure) {
        this.name = name;
        this.failure = failure;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return "recording scenario " + name;
    }

    @Override
    public void setUp(BenchmarkContext context) {
        calls.add("setUp");
    }

    @Override
    public int run(int iterations, Timer iterationTimer) {
        calls.add("run:" + iterations);
        if (failure != null) {
            throw failure;
        }
        for (int i = 0; i < iterations; i++) {
            iterationTimer.record(() -> { });
        }
        return iterations;
    }

    @Override
    public void tearDown() {
        calls.add("tearDown");
    }
}
