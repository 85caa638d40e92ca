package dev.mars.notifybench.benchmark.config;

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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 * Configuration for a benchmark run.
 *
 * Settings are layered, lowest precedence first: built-in defaults, a properties file,
 * JVM system properties ({@code notifybench.*}) and finally command-line options applied
 * by the runner through the builder.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class BenchmarkConfig {

    public static final String DEFAULT_CHANNEL = "bench";
    public static final int DEFAULT_ITERATIONS = 1000;
    public static final int DEFAULT_WARMUP_ITERATIONS = 100;
    public static final int DEFAULT_BATCH_SIZE = 10;
    public static final Duration DEFAULT_WAIT_TIMEOUT = Duration.ofSeconds(1);
    public static final Duration DEFAULT_OPERATION_TIMEOUT = Duration.ofSeconds(30);
    public static final String DEFAULT_OUTPUT_DIRECTORY = "target/benchmark-reports";

    private final String scenario;
    private final int iterations;
    private final int warmupIterations;
    private final int batchSize;
    private final String channel;
    private final Duration waitTimeout;
    private final Duration operationTimeout;
    private final String outputDirectory;
    private final String configFile;

    private BenchmarkConfig(Builder builder) {
        this.scenario = builder.scenario;
        this.iterations = builder.iterations;
        this.warmupIterations = builder.warmupIterations;
        this.batchSize = builder.batchSize;
        this.channel = builder.channel;
        this.waitTimeout = builder.waitTimeout;
        this.operationTimeout = builder.operationTimeout;
        this.outputDirectory = builder.outputDirectory;
        this.configFile = builder.configFile;
    }

    public static Builder builder() {
        return new Builder();
    }

    // Getters
    public String getScenario() { return scenario; }
    public int getIterations() { return iterations; }
    public int getWarmupIterations() { return warmupIterations; }
    public int getBatchSize() { return batchSize; }
    public String getChannel() { return channel; }
    public Duration getWaitTimeout() { return waitTimeout; }
    public Duration getOperationTimeout() { return operationTimeout; }
    public String getOutputDirectory() { return outputDirectory; }
    public String getConfigFile() { return configFile; }

    @Override
    public String toString() {
        return "BenchmarkConfig{" +
                "scenario='" + scenario + '\'' +
                ", iterations=" + iterations +
                ", warmupIterations=" + warmupIterations +
                ", batchSize=" + batchSize +
                ", channel='" + channel + '\'' +
                ", waitTimeout=" + waitTimeout.toMillis() + "ms" +
                ", operationTimeout=" + operationTimeout.toMillis() + "ms" +
                ", outputDirectory='" + outputDirectory + '\'' +
                '}';
    }

    public static class Builder {
        private String scenario = "all";
        private int iterations = DEFAULT_ITERATIONS;
        private int warmupIterations = DEFAULT_WARMUP_ITERATIONS;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private String channel = DEFAULT_CHANNEL;
        private Duration waitTimeout = DEFAULT_WAIT_TIMEOUT;
        private Duration operationTimeout = DEFAULT_OPERATION_TIMEOUT;
        private String outputDirectory = DEFAULT_OUTPUT_DIRECTORY;
        private String configFile = null;

        public Builder scenario(String scenario) {
            this.scenario = scenario;
            return this;
        }

        public Builder iterations(int iterations) {
            this.iterations = iterations;
            return this;
        }

        public Builder warmupIterations(int warmupIterations) {
            this.warmupIterations = warmupIterations;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder channel(String channel) {
            this.channel = channel;
            return this;
        }

        public Builder waitTimeout(Duration waitTimeout) {
            this.waitTimeout = waitTimeout;
            return this;
        }

        public Builder operationTimeout(Duration operationTimeout) {
            this.operationTimeout = operationTimeout;
            return this;
        }

        public Builder outputDirectory(String outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder configFile(String configFile) {
            this.configFile = configFile;
            return this;
        }

        /**
         * Applies the keys present in {@code properties}; absent keys leave the current value.
         */
        public Builder applyProperties(Properties properties) {
            String value = properties.getProperty("benchmark.scenario");
            if (value != null) {
                scenario(value.trim());
            }
            value = properties.getProperty("benchmark.iterations");
            if (value != null) {
                iterations(parseInt("benchmark.iterations", value));
            }
            value = properties.getProperty("benchmark.warmup.iterations");
            if (value != null) {
                warmupIterations(parseInt("benchmark.warmup.iterations", value));
            }
            value = properties.getProperty("benchmark.batch.size");
            if (value != null) {
                batchSize(parseInt("benchmark.batch.size", value));
            }
            value = properties.getProperty("benchmark.channel");
            if (value != null) {
                channel(value.trim());
            }
            value = properties.getProperty("benchmark.wait.timeout.ms");
            if (value != null) {
                waitTimeout(Duration.ofMillis(parseInt("benchmark.wait.timeout.ms", value)));
            }
            value = properties.getProperty("benchmark.operation.timeout.ms");
            if (value != null) {
                operationTimeout(Duration.ofMillis(parseInt("benchmark.operation.timeout.ms", value)));
            }
            value = properties.getProperty("output.directory");
            if (value != null) {
                outputDirectory(value.trim());
            }
            return this;
        }

        /**
         * Applies the {@code notifybench.*} JVM system properties that are set.
         */
        public Builder applySystemProperties() {
            Properties mapped = new Properties();
            copySystemProperty(mapped, "notifybench.scenario", "benchmark.scenario");
            copySystemProperty(mapped, "notifybench.iterations", "benchmark.iterations");
            copySystemProperty(mapped, "notifybench.warmup", "benchmark.warmup.iterations");
            copySystemProperty(mapped, "notifybench.batch.size", "benchmark.batch.size");
            copySystemProperty(mapped, "notifybench.channel", "benchmark.channel");
            copySystemProperty(mapped, "notifybench.wait.timeout.ms", "benchmark.wait.timeout.ms");
            copySystemProperty(mapped, "notifybench.operation.timeout.ms", "benchmark.operation.timeout.ms");
            copySystemProperty(mapped, "notifybench.output", "output.directory");
            return applyProperties(mapped);
        }

        public BenchmarkConfig build() {
            if (scenario == null || scenario.isBlank()) {
                throw new IllegalArgumentException("Scenario selector cannot be blank");
            }
            if (iterations < 1) {
                throw new IllegalArgumentException("Iterations must be positive: " + iterations);
            }
            if (warmupIterations < 0) {
                throw new IllegalArgumentException("Warmup iterations cannot be negative: " + warmupIterations);
            }
            if (batchSize < 1) {
                throw new IllegalArgumentException("Batch size must be at least 1: " + batchSize);
            }
            if (channel == null || channel.isBlank()) {
                throw new IllegalArgumentException("Channel cannot be blank");
            }
            if (waitTimeout == null || waitTimeout.isZero() || waitTimeout.isNegative()) {
                throw new IllegalArgumentException("Wait timeout must be positive: " + waitTimeout);
            }
            if (operationTimeout == null || operationTimeout.isZero() || operationTimeout.isNegative()) {
                throw new IllegalArgumentException("Operation timeout must be positive: " + operationTimeout);
            }
            return new BenchmarkConfig(this);
        }

        private static void copySystemProperty(Properties target, String systemKey, String fileKey) {
            String value = System.getProperty(systemKey);
            if (value != null) {
                target.setProperty(fileKey, value);
            }
        }

        private static int parseInt(String key, String value) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
            }
        }
    }

    /**
     * Load configuration from system properties on top of the defaults.
     */
    public static BenchmarkConfig fromSystemProperties() {
        return builder().applySystemProperties().build();
    }

    /**
     * Load configuration from properties on top of the defaults.
     */
    public static BenchmarkConfig fromProperties(Properties properties) {
        return builder().applyProperties(properties).build();
    }

    /**
     * Reads a properties file.
     *
     * @throws IOException if the file cannot be read
     */
    public static Properties loadProperties(Path file) throws IOException {
        Properties properties = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            properties.load(in);
        }
        return properties;
    }
}
