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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Results container for a benchmark run.
 */
public class BenchmarkResults {
    private int totalScenarios = 0;
    private int successfulScenarios = 0;
    private int failedScenarios = 0;
    private final List<String> failures = new ArrayList<>();
    private final List<ScenarioResult> scenarioResults = new ArrayList<>();
    private final Instant startTime;
    private Instant endTime;

    public BenchmarkResults() {
        this.startTime = Instant.now();
    }

    public void addResult(ScenarioResult result) {
        totalScenarios++;
        scenarioResults.add(result);
        if (result.isSuccess()) {
            successfulScenarios++;
        } else {
            failedScenarios++;
            failures.add(result.getScenario() + ": " + result.getFailureMessage());
        }
    }

    /**
     * Records a failure that has no scenario result, such as an unknown scenario name.
     */
    public void addFailure(String name, Throwable error) {
        totalScenarios++;
        failedScenarios++;
        failures.add(name + ": " + error.getMessage());
    }

    public void setEndTime() {
        this.endTime = Instant.now();
    }

    public Duration getTotalDuration() {
        return endTime != null ? Duration.between(startTime, endTime) : Duration.ZERO;
    }

    public boolean hasFailures() {
        return failedScenarios > 0;
    }

    // Getters
    public int getTotalScenarios() { return totalScenarios; }
    public int getSuccessfulScenarios() { return successfulScenarios; }
    public int getFailedScenarios() { return failedScenarios; }
    public List<String> getFailures() { return new ArrayList<>(failures); }
    public List<ScenarioResult> getScenarioResults() { return new ArrayList<>(scenarioResults); }
    public Instant getStartTime() { return startTime; }
    public Instant getEndTime() { return endTime; }
}
