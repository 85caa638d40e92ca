package dev.mars.notifybench.benchmark.report;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.notifybench.benchmark.config.BenchmarkConfig;
import dev.mars.notifybench.benchmark.harness.BenchmarkResults;
import dev.mars.notifybench.benchmark.harness.ScenarioResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes benchmark results as a Markdown report and a JSON results file.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class BenchmarkReportGenerator {

    private static final Logger logger = LoggerFactory.getLogger(BenchmarkReportGenerator.class);
    private static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss")
            .withZone(ZoneId.systemDefault());

    private final Path outputDirectory;
    private final ObjectMapper objectMapper;

    public BenchmarkReportGenerator(String outputDirectory) {
        this.outputDirectory = Paths.get(outputDirectory);
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Generate the Markdown report.
     *
     * @return absolute path of the report, or null if it could not be written
     */
    public Path generateReport(BenchmarkResults results, BenchmarkConfig config, Duration totalDuration) {
        try {
            String timestamp = TIMESTAMP_FORMATTER.format(Instant.now());
            Path reportPath = outputDirectory.resolve(String.format("notify-bench-report_%s.md", timestamp));

            Files.createDirectories(outputDirectory);
            Files.writeString(reportPath, generateReportContent(results, config, totalDuration, timestamp));

            logger.info("📋 Benchmark report generated: {}", reportPath.toAbsolutePath());
            return reportPath.toAbsolutePath();

        } catch (IOException e) {
            logger.error("❌ Failed to generate benchmark report", e);
            return null;
        }
    }

    /**
     * Generate the JSON results file.
     *
     * @return absolute path of the file, or null if it could not be written
     */
    public Path generateJson(BenchmarkResults results, BenchmarkConfig config) {
        try {
            String timestamp = TIMESTAMP_FORMATTER.format(Instant.now());
            Path jsonPath = outputDirectory.resolve(String.format("notify-bench-results_%s.json", timestamp));

            Files.createDirectories(outputDirectory);
            objectMapper.writeValue(jsonPath.toFile(), toDocument(results, config));

            logger.info("📋 Benchmark results written: {}", jsonPath.toAbsolutePath());
            return jsonPath.toAbsolutePath();

        } catch (IOException e) {
            logger.error("❌ Failed to write benchmark results", e);
            return null;
        }
    }

    Map<String, Object> toDocument(BenchmarkResults results, BenchmarkConfig config) {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("scenario", config.getScenario());
        settings.put("iterations", config.getIterations());
        settings.put("warmupIterations", config.getWarmupIterations());
        settings.put("batchSize", config.getBatchSize());
        settings.put("channel", config.getChannel());
        settings.put("waitTimeoutMillis", config.getWaitTimeout().toMillis());

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("generatedAt", Instant.now());
        document.put("config", settings);
        document.put("totalScenarios", results.getTotalScenarios());
        document.put("successfulScenarios", results.getSuccessfulScenarios());
        document.put("failedScenarios", results.getFailedScenarios());
        document.put("failures", results.getFailures());
        document.put("scenarios", results.getScenarioResults());
        return document;
    }

    String generateReportContent(BenchmarkResults results, BenchmarkConfig config, Duration totalDuration, String timestamp) {
        StringBuilder report = new StringBuilder();

        // Header
        report.append("# LISTEN/NOTIFY Benchmark Report\n\n");
        report.append("**Generated:** ").append(timestamp.replace("_", " ")).append("\n");
        report.append("**Total Duration:** ").append(formatDuration(totalDuration)).append("\n");
        report.append("**Status:** ").append(results.hasFailures() ? "❌ FAILED" : "✅ PASSED").append("\n\n");

        // Summary
        report.append("## Summary\n\n");
        report.append("| Metric | Value |\n");
        report.append("|--------|-------|\n");
        report.append("| Scenarios | ").append(results.getTotalScenarios()).append(" |\n");
        report.append("| Successful | ").append(results.getSuccessfulScenarios()).append(" |\n");
        report.append("| Failed | ").append(results.getFailedScenarios()).append(" |\n");
        report.append("| Iterations (N) | ").append(config.getIterations()).append(" |\n");
        report.append("| Warmup Iterations | ").append(config.getWarmupIterations()).append(" |\n");
        report.append("| Batch Size (K) | ").append(config.getBatchSize()).append(" |\n");
        report.append("| Channel | ").append(config.getChannel()).append(" |\n");
        report.append("| Wait Timeout | ").append(config.getWaitTimeout().toMillis()).append(" ms |\n\n");

        // Scenarios
        report.append("## Scenarios\n\n");
        report.append("| Scenario | N | ns/op | ops/sec | Mean (ms) | p99 (ms) | Max (ms) | Notifications | Status |\n");
        report.append("|----------|---|-------|---------|-----------|----------|----------|---------------|--------|\n");
        for (ScenarioResult result : results.getScenarioResults()) {
            report.append("| ").append(result.getScenario());
            report.append(" | ").append(result.getIterations());
            if (result.isSuccess()) {
                report.append(" | ").append(String.format("%.0f", result.getNanosPerOp()));
                report.append(" | ").append(String.format("%.0f", result.getOpsPerSecond()));
                report.append(" | ").append(String.format("%.3f", result.getMeanLatencyMillis()));
                report.append(" | ").append(String.format("%.3f", result.getP99LatencyMillis()));
                report.append(" | ").append(String.format("%.3f", result.getMaxLatencyMillis()));
                report.append(" | ").append(result.getNotificationsReceived());
                report.append(" | ✅ |\n");
            } else {
                report.append(" | - | - | - | - | - | - | ❌ |\n");
            }
        }
        report.append("\n");

        // Failures
        if (results.hasFailures()) {
            report.append("## Failures\n\n");
            for (String failure : results.getFailures()) {
                report.append("- ").append(failure).append("\n");
            }
            report.append("\n");
        }

        return report.toString();
    }

    static String formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;

        if (hours > 0) {
            return String.format("%dh %dm %ds", hours, minutes, secs);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, secs);
        } else if (secs > 0) {
            return String.format("%ds", secs);
        } else {
            return String.format("%dms", duration.toMillis());
        }
    }
}
