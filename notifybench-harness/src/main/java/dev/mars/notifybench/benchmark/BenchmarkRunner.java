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

import dev.mars.notifybench.benchmark.config.BenchmarkConfig;
import dev.mars.notifybench.benchmark.harness.BenchmarkHarness;
import dev.mars.notifybench.benchmark.harness.BenchmarkResults;
import dev.mars.notifybench.benchmark.harness.ScenarioResult;
import dev.mars.notifybench.benchmark.report.BenchmarkReportGenerator;
import dev.mars.notifybench.client.config.ConnectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;

/**
 * Main entry point for running the LISTEN/NOTIFY benchmarks.
 *
 * Usage:
 * - Run all scenarios: java -cp ... dev.mars.notifybench.benchmark.BenchmarkRunner
 * - Run one scenario: java -cp ... dev.mars.notifybench.benchmark.BenchmarkRunner --scenario=parallel
 * - Custom configuration: java -cp ... dev.mars.notifybench.benchmark.BenchmarkRunner --config=bench.properties
 *
 * Connection settings come from PG_HOST, PG_PORT, PG_USER, PG_PASSWORD and PG_DATABASE.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class BenchmarkRunner {

    private static final Logger logger = LoggerFactory.getLogger(BenchmarkRunner.class);

    public static void main(String[] args) {
        logger.info("🚀 Starting LISTEN/NOTIFY benchmark");

        try {
            if (wantsHelp(args)) {
                printUsage(System.out);
                System.exit(0);
            }

            BenchmarkConfig config = parseArguments(args);
            ConnectionConfig connectionConfig = ConnectionConfig.fromEnvironment();
            logger.info("Benchmark configuration: {}", config);
            logger.info("Connection configuration: {}", connectionConfig);

            BenchmarkResults results;
            Instant startTime = Instant.now();
            try (BenchmarkHarness harness = new BenchmarkHarness(config, connectionConfig)) {
                results = harness.runAll().join();
            }
            Duration totalDuration = Duration.between(startTime, Instant.now());

            BenchmarkReportGenerator reportGenerator = new BenchmarkReportGenerator(config.getOutputDirectory());
            Path reportPath = reportGenerator.generateReport(results, config, totalDuration);
            reportGenerator.generateJson(results, config);

            printSummary(System.out, results, totalDuration, reportPath);

            System.exit(results.hasFailures() ? 1 : 0);

        } catch (Exception e) {
            logger.error("❌ Benchmark execution failed", e);
            System.err.println("Benchmark execution failed: " + e.getMessage());
            System.exit(1);
        }
    }

    static boolean wantsHelp(String[] args) {
        for (String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Builds the configuration: defaults, then the {@code --config} file, then system
     * properties, then the remaining options.
     *
     * @throws IOException if the {@code --config} file cannot be read
     */
    static BenchmarkConfig parseArguments(String[] args) throws IOException {
        BenchmarkConfig.Builder configBuilder = BenchmarkConfig.builder();

        for (String arg : args) {
            if (arg.startsWith("--config=")) {
                String configFile = arg.substring("--config=".length());
                configBuilder.configFile(configFile);
                configBuilder.applyProperties(BenchmarkConfig.loadProperties(Paths.get(configFile)));
            }
        }
        configBuilder.applySystemProperties();

        for (String arg : args) {
            if (arg.startsWith("--scenario=")) {
                configBuilder.scenario(arg.substring("--scenario=".length()));
            } else if (arg.startsWith("--iterations=")) {
                configBuilder.iterations(parseInt(arg, "--iterations="));
            } else if (arg.startsWith("--warmup=")) {
                configBuilder.warmupIterations(parseInt(arg, "--warmup="));
            } else if (arg.startsWith("--batch-size=")) {
                configBuilder.batchSize(parseInt(arg, "--batch-size="));
            } else if (arg.startsWith("--channel=")) {
                configBuilder.channel(arg.substring("--channel=".length()));
            } else if (arg.startsWith("--timeout=")) {
                configBuilder.waitTimeout(Duration.ofMillis(parseInt(arg, "--timeout=")));
            } else if (arg.startsWith("--output=")) {
                configBuilder.outputDirectory(arg.substring("--output=".length()));
            } else if (!arg.startsWith("--config=")) {
                throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        return configBuilder.build();
    }

    private static int parseInt(String arg, String prefix) {
        String value = arg.substring(prefix.length());
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + prefix + " " + value, e);
        }
    }

    static void printUsage(PrintStream out) {
        out.println("LISTEN/NOTIFY Benchmark");
        out.println("Usage: java -cp ... dev.mars.notifybench.benchmark.BenchmarkRunner [options]");
        out.println();
        out.println("Options:");
        out.println("  --scenario=<name>     Scenario name or keyword, comma separated (sequential, parallel, notify,");
        out.println("                        insert, baseline, trigger, multi, all; default: all)");
        out.println("  --iterations=<n>      Iterations per scenario (default: " + BenchmarkConfig.DEFAULT_ITERATIONS + ")");
        out.println("  --warmup=<n>          Warmup iterations, 0 to disable (default: " + BenchmarkConfig.DEFAULT_WARMUP_ITERATIONS + ")");
        out.println("  --batch-size=<k>      Rows per batch insert (default: " + BenchmarkConfig.DEFAULT_BATCH_SIZE + ")");
        out.println("  --channel=<name>      Notification channel (default: " + BenchmarkConfig.DEFAULT_CHANNEL + ")");
        out.println("  --timeout=<ms>        Wait-for-notification timeout (default: " + BenchmarkConfig.DEFAULT_WAIT_TIMEOUT.toMillis() + ")");
        out.println("  --config=<file>       Properties file with benchmark.* keys");
        out.println("  --output=<dir>        Report directory (default: " + BenchmarkConfig.DEFAULT_OUTPUT_DIRECTORY + ")");
        out.println("  --help, -h            Show this help message");
        out.println();
        out.println("Environment:");
        out.println("  PG_HOST (localhost), PG_PORT (5432), PG_USER (OS user), PG_PASSWORD (empty), PG_DATABASE (PG_USER)");
        out.println();
        out.println("Examples:");
        out.println("  # Sequential and parallel notify only, 10000 iterations");
        out.println("  java -cp ... dev.mars.notifybench.benchmark.BenchmarkRunner --scenario=notify --iterations=10000");
    }

    static void printSummary(PrintStream out, BenchmarkResults results, Duration totalDuration, Path reportPath) {
        out.println();
        for (ScenarioResult result : results.getScenarioResults()) {
            out.println(formatBenchmarkLine(result));
        }
        for (String failure : results.getFailures()) {
            out.println("--- FAIL: " + failure);
        }
        out.println();
        out.printf("Scenarios: %d, successful: %d, failed: %d, total time: %.3fs%n",
                results.getTotalScenarios(), results.getSuccessfulScenarios(), results.getFailedScenarios(),
                totalDuration.toMillis() / 1000.0);
        if (reportPath != null) {
            out.printf("Report: %s%n", reportPath);
        }
        out.println(results.hasFailures() ? "FAIL" : "ok");
    }

    /**
     * One line per scenario in the layout of Go benchmark output.
     */
    static String formatBenchmarkLine(ScenarioResult result) {
        if (!result.isSuccess()) {
            return String.format("Benchmark%-35s FAILED", result.getScenario());
        }
        return String.format("Benchmark%-35s %10d %15.0f ns/op", result.getScenario(), result.getIterations(), result.getNanosPerOp());
    }
}
