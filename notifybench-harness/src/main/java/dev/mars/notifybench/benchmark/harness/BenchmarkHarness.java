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

import dev.mars.notifybench.benchmark.config.BenchmarkConfig;
import dev.mars.notifybench.benchmark.scenario.BenchmarkContext;
import dev.mars.notifybench.benchmark.scenario.BenchmarkScenario;
import dev.mars.notifybench.benchmark.scenario.ManualParallelListenNotifyScenario;
import dev.mars.notifybench.benchmark.scenario.ManualSequentialListenNotifyScenario;
import dev.mars.notifybench.benchmark.scenario.MultipleInsertWithNotifyScenario;
import dev.mars.notifybench.benchmark.scenario.SingleInsertWithTriggeredNotifyScenario;
import dev.mars.notifybench.benchmark.scenario.SingleInsertWithoutNotifyScenario;
import dev.mars.notifybench.client.config.ConnectionConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs the selected benchmark scenarios and aggregates their results.
 *
 * This class manages the lifecycle of each scenario run:
 * - Scenario selection by name or keyword
 * - Optional warmup run, discarded
 * - Timed run, measured from the end of set-up to the end of the last iteration
 * - Tear-down in all cases
 *
 * A failing scenario is recorded and the remaining scenarios still run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class BenchmarkHarness implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(BenchmarkHarness.class);

    static final String ITERATION_TIMER = "notifybench.iteration";

    private final BenchmarkConfig config;
    private final ConnectionConfig connectionConfig;
    private final ExecutorService executorService;
    private final List<BenchmarkScenario> scenarios;

    public BenchmarkHarness(BenchmarkConfig config, ConnectionConfig connectionConfig) {
        this(config, connectionConfig, defaultScenarios());
    }

    public BenchmarkHarness(BenchmarkConfig config, ConnectionConfig connectionConfig, List<BenchmarkScenario> scenarios) {
        this.config = config;
        this.connectionConfig = connectionConfig;
        this.scenarios = List.copyOf(scenarios);
        this.executorService = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "notifybench-driver");
            thread.setDaemon(true);
            return thread;
        });

        logger.info("Initialized BenchmarkHarness with {} scenarios", this.scenarios.size());
    }

    /**
     * Every scenario the harness knows, in execution order.
     */
    public static List<BenchmarkScenario> defaultScenarios() {
        List<BenchmarkScenario> all = new ArrayList<>();
        all.add(new ManualSequentialListenNotifyScenario());
        all.add(new ManualParallelListenNotifyScenario());
        all.add(new SingleInsertWithoutNotifyScenario());
        all.add(new SingleInsertWithTriggeredNotifyScenario());
        all.add(new MultipleInsertWithNotifyScenario());
        return all;
    }

    /**
     * Run the scenarios selected by the configured selector.
     */
    public CompletableFuture<BenchmarkResults> runAll() {
        return runSelected(config.getScenario());
    }

    /**
     * Run the scenarios matching {@code selector}: {@code all}, a scenario name, a keyword,
     * or a comma separated list of those.
     */
    public CompletableFuture<BenchmarkResults> runSelected(String selector) {
        logger.info("🚀 Starting benchmark run for selector: {}", selector);

        return CompletableFuture.supplyAsync(() -> {
            BenchmarkResults results = new BenchmarkResults();
            List<BenchmarkScenario> selected = selectScenarios(selector);

            if (selected.isEmpty()) {
                logger.error("❌ Scenario not found: {}", selector);
                results.addFailure(selector, new IllegalArgumentException("Scenario not found: " + selector));
                results.setEndTime();
                return results;
            }

            try (BenchmarkContext context = new BenchmarkContext(connectionConfig, config)) {
                for (BenchmarkScenario scenario : selected) {
                    ScenarioResult result = executeScenario(scenario, context);
                    results.addResult(result);
                }
            }

            results.setEndTime();
            logger.info("🎯 Benchmark run completed. Total: {}, Successful: {}, Failed: {}",
                       results.getTotalScenarios(), results.getSuccessfulScenarios(), results.getFailedScenarios());
            return results;
        }, executorService);
    }

    /**
     * Names of all scenarios this harness can run.
     */
    public List<String> getAvailableScenarios() {
        return scenarios.stream()
                .map(BenchmarkScenario::getName)
                .toList();
    }

    List<BenchmarkScenario> selectScenarios(String selector) {
        Set<BenchmarkScenario> selected = new LinkedHashSet<>();
        for (String part : selector.split(",")) {
            String requested = part.trim();
            if (requested.isEmpty()) {
                continue;
            }
            for (BenchmarkScenario scenario : scenarios) {
                if ("all".equalsIgnoreCase(requested) || matchesScenarioName(scenario.getName(), requested)) {
                    selected.add(scenario);
                }
            }
        }
        return new ArrayList<>(selected);
    }

    /**
     * Check if a scenario name matches the requested name (flexible matching).
     */
    static boolean matchesScenarioName(String scenarioName, String requestedName) {
        if (scenarioName.equalsIgnoreCase(requestedName)) {
            return true;
        }

        String lowerScenarioName = scenarioName.toLowerCase();
        String lowerRequestedName = requestedName.toLowerCase();

        return switch (lowerRequestedName) {
            case "sequential" -> lowerScenarioName.contains("sequential");
            case "parallel" -> lowerScenarioName.contains("parallel");
            case "notify", "listen" -> lowerScenarioName.contains("listennotify");
            case "baseline" -> lowerScenarioName.contains("withoutnotify");
            case "trigger", "triggered" -> lowerScenarioName.contains("triggered") || lowerScenarioName.contains("multiple");
            case "multi", "multiple", "batch" -> lowerScenarioName.contains("multiple");
            default -> lowerScenarioName.contains(lowerRequestedName);
        };
    }

    ScenarioResult executeScenario(BenchmarkScenario scenario, BenchmarkContext context) {
        String name = scenario.getName();
        int iterations = config.getIterations();
        logger.info("📊 Executing scenario: {} ({})", name, scenario.getDescription());

        try {
            if (config.getWarmupIterations() > 0) {
                logger.info("🔥 Warming up {} with {} iterations", name, config.getWarmupIterations());
                runOnce(scenario, context, config.getWarmupIterations(), newIterationTimer(new SimpleMeterRegistry(), name));
            }

            Timer timer = newIterationTimer(new SimpleMeterRegistry(), name);
            Measurement measurement = runOnce(scenario, context, iterations, timer);

            ScenarioResult result = ScenarioResult.succeeded(name, iterations,
                    measurement.notificationsReceived(), measurement.elapsedNanos(), timer);
            logger.info("✅ Completed scenario: {}", result);
            return result;

        } catch (RuntimeException e) {
            logger.error("❌ Scenario {} failed", name, e);
            return ScenarioResult.failed(name, iterations, e);
        }
    }

    private Measurement runOnce(BenchmarkScenario scenario, BenchmarkContext context, int iterations, Timer timer) {
        try {
            scenario.setUp(context);

            long start = System.nanoTime();
            int received = scenario.run(iterations, timer);
            long elapsed = System.nanoTime() - start;

            return new Measurement(received, elapsed);
        } finally {
            scenario.tearDown();
        }
    }

    private static Timer newIterationTimer(MeterRegistry registry, String scenarioName) {
        return Timer.builder(ITERATION_TIMER)
                .description("Duration of one benchmark iteration")
                .tag("scenario", scenarioName)
                .publishPercentiles(0.5, 0.99)
                .register(registry);
    }

    public BenchmarkConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        executorService.shutdown();
    }

    private record Measurement(int notificationsReceived, long elapsedNanos) {
    }
}
