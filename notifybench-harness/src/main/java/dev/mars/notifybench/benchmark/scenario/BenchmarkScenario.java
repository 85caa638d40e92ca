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

import io.micrometer.core.instrument.Timer;

/**
 * A named benchmark.
 *
 * <p>The harness calls {@link #setUp(BenchmarkContext)}, then times
 * {@link #run(int, Timer)}, then always calls {@link #tearDown()}. Only {@code run} is
 * measured. Any exception from {@code setUp} or {@code run} fails the scenario.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public interface BenchmarkScenario {

    /**
     * Get the name of this scenario.
     */
    String getName();

    /**
     * Get a description of what this scenario measures.
     */
    String getDescription();

    /**
     * Opens connections, creates schema objects and prepares statements.
     */
    void setUp(BenchmarkContext context);

    /**
     * Runs {@code iterations} iterations, recording each one in {@code iterationTimer}.
     *
     * @return the number of notifications received and validated
     */
    int run(int iterations, Timer iterationTimer);

    /**
     * Releases everything opened by {@link #setUp(BenchmarkContext)}. Safe to call after a
     * failed or partial set-up.
     */
    void tearDown();
}
