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

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.distribution.HistogramSnapshot;
import io.micrometer.core.instrument.distribution.ValueAtPercentile;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Outcome of one timed scenario run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class ScenarioResult {

    private final String scenario;
    private final int iterations;
    private final int notificationsReceived;
    private final long elapsedNanos;
    private final double meanLatencyMillis;
    private final double maxLatencyMillis;
    private final double p50LatencyMillis;
    private final double p99LatencyMillis;
    private final boolean success;
    private final String failureMessage;

    private ScenarioResult(String scenario, int iterations, int notificationsReceived, long elapsedNanos,
                           double meanLatencyMillis, double maxLatencyMillis,
                           double p50LatencyMillis, double p99LatencyMillis,
                           boolean success, String failureMessage) {
        this.scenario = scenario;
        this.iterations = iterations;
        this.notificationsReceived = notificationsReceived;
        this.elapsedNanos = elapsedNanos;
        this.meanLatencyMillis = meanLatencyMillis;
        this.maxLatencyMillis = maxLatencyMillis;
        this.p50LatencyMillis = p50LatencyMillis;
        this.p99LatencyMillis = p99LatencyMillis;
        this.success = success;
        this.failureMessage = failureMessage;
    }

    /**
     * Builds a successful result from the elapsed time and the per-iteration timer.
     */
    public static ScenarioResult succeeded(String scenario, int iterations, int notificationsReceived,
                                           long elapsedNanos, Timer iterationTimer) {
        HistogramSnapshot snapshot = iterationTimer.takeSnapshot();
        return new ScenarioResult(scenario, iterations, notificationsReceived, elapsedNanos,
                snapshot.mean(TimeUnit.MILLISECONDS),
                snapshot.max(TimeUnit.MILLISECONDS),
                percentile(snapshot, 0.5),
                percentile(snapshot, 0.99),
                true, null);
    }

    public static ScenarioResult failed(String scenario, int iterations, Throwable error) {
        return new ScenarioResult(scenario, iterations, 0, 0, 0, 0, 0, 0, false, error.getMessage());
    }

    private static double percentile(HistogramSnapshot snapshot, double percentile) {
        for (ValueAtPercentile value : snapshot.percentileValues()) {
            if (Math.abs(value.percentile() - percentile) < 1e-9) {
                return value.value(TimeUnit.MILLISECONDS);
            }
        }
        return Double.NaN;
    }

    // Getters
    public String getScenario() { return scenario; }
    public int getIterations() { return iterations; }
    public int getNotificationsReceived() { return notificationsReceived; }
    public long getElapsedNanos() { return elapsedNanos; }
    public double getMeanLatencyMillis() { return meanLatencyMillis; }
    public double getMaxLatencyMillis() { return maxLatencyMillis; }
    public double getP50LatencyMillis() { return p50LatencyMillis; }
    public double getP99LatencyMillis() { return p99LatencyMillis; }
    public boolean isSuccess() { return success; }
    public String getFailureMessage() { return failureMessage; }

    public Duration getElapsed() {
        return Duration.ofNanos(elapsedNanos);
    }

    /**
     * Elapsed nanoseconds of the timed section per iteration.
     */
    public double getNanosPerOp() {
        return iterations > 0 ? (double) elapsedNanos / iterations : 0;
    }

    public double getOpsPerSecond() {
        return elapsedNanos > 0 ? iterations * 1_000_000_000.0 / elapsedNanos : 0;
    }

    @Override
    public String toString() {
        return success
                ? String.format("%s: %d iterations, %.0f ns/op, %d notifications", scenario, iterations, getNanosPerOp(), notificationsReceived)
                : String.format("%s: FAILED (%s)", scenario, failureMessage);
    }
}
