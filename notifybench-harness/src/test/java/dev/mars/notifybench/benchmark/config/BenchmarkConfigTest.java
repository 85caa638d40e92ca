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

import dev.mars.notifybench.test.categories.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Core tests for BenchmarkConfig defaults, layering and validation.
 */
@Tag(TestCategories.CORE)
class BenchmarkConfigTest {

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("notifybench.scenario");
        System.clearProperty("notifybench.iterations");
        System.clearProperty("notifybench.channel");
        System.clearProperty("notifybench.wait.timeout.ms");
    }

    @Test
    void testDefaults() {
        BenchmarkConfig config = BenchmarkConfig.builder().build();

        assertEquals("all", config.getScenario());
        assertEquals(1000, config.getIterations());
        assertEquals(100, config.getWarmupIterations());
        assertEquals(10, config.getBatchSize());
        assertEquals("bench", config.getChannel());
        assertEquals(Duration.ofSeconds(1), config.getWaitTimeout());
        assertEquals(Duration.ofSeconds(30), config.getOperationTimeout());
        assertEquals("target/benchmark-reports", config.getOutputDirectory());
        assertNull(config.getConfigFile());
    }

    @Test
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty("benchmark.scenario", "parallel");
        properties.setProperty("benchmark.iterations", "250");
        properties.setProperty("benchmark.warmup.iterations", "0");
        properties.setProperty("benchmark.batch.size", "25");
        properties.setProperty("benchmark.channel", "other");
        properties.setProperty("benchmark.wait.timeout.ms", "2500");
        properties.setProperty("benchmark.operation.timeout.ms", "5000");
        properties.setProperty("output.directory", "build/reports");

        BenchmarkConfig config = BenchmarkConfig.fromProperties(properties);

        assertEquals("parallel", config.getScenario());
        assertEquals(250, config.getIterations());
        assertEquals(0, config.getWarmupIterations());
        assertEquals(25, config.getBatchSize());
        assertEquals("other", config.getChannel());
        assertEquals(Duration.ofMillis(2500), config.getWaitTimeout());
        assertEquals(Duration.ofMillis(5000), config.getOperationTimeout());
        assertEquals("build/reports", config.getOutputDirectory());
    }

    @Test
    void testMissingPropertiesKeepDefaults() {
        BenchmarkConfig config = BenchmarkConfig.fromProperties(new Properties());

        assertEquals(BenchmarkConfig.DEFAULT_ITERATIONS, config.getIterations());
        assertEquals(BenchmarkConfig.DEFAULT_CHANNEL, config.getChannel());
    }

    @Test
    void testFromSystemProperties() {
        System.setProperty("notifybench.scenario", "trigger");
        System.setProperty("notifybench.iterations", "42");
        System.setProperty("notifybench.channel", "sysprop");
        System.setProperty("notifybench.wait.timeout.ms", "1500");

        BenchmarkConfig config = BenchmarkConfig.fromSystemProperties();

        assertEquals("trigger", config.getScenario());
        assertEquals(42, config.getIterations());
        assertEquals("sysprop", config.getChannel());
        assertEquals(Duration.ofMillis(1500), config.getWaitTimeout());
    }

    @Test
    void testSystemPropertiesOverrideFileProperties() {
        Properties file = new Properties();
        file.setProperty("benchmark.iterations", "10");
        file.setProperty("benchmark.channel", "from_file");
        System.setProperty("notifybench.iterations", "20");

        BenchmarkConfig config = BenchmarkConfig.builder()
                .applyProperties(file)
                .applySystemProperties()
                .build();

        assertEquals(20, config.getIterations());
        assertEquals("from_file", config.getChannel());
    }

    @Test
    void testLoadProperties(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("bench.properties");
        Files.writeString(file, "benchmark.iterations=77\nbenchmark.batch.size=3\n");

        BenchmarkConfig config = BenchmarkConfig.fromProperties(BenchmarkConfig.loadProperties(file));

        assertEquals(77, config.getIterations());
        assertEquals(3, config.getBatchSize());
    }

    @Test
    void testNonNumericValueIsRejected() {
        Properties properties = new Properties();
        properties.setProperty("benchmark.iterations", "lots");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> BenchmarkConfig.fromProperties(properties));
        assertTrue(e.getMessage().contains("benchmark.iterations"));
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> BenchmarkConfig.builder().iterations(0).build());
        assertThrows(IllegalArgumentException.class, () -> BenchmarkConfig.builder().warmupIterations(-1).build());
        assertThrows(IllegalArgumentException.class, () -> BenchmarkConfig.builder().batchSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> BenchmarkConfig.builder().channel(" ").build());
        assertThrows(IllegalArgumentException.class, () -> BenchmarkConfig.builder().scenario("").build());
        assertThrows(IllegalArgumentException.class, () -> BenchmarkConfig.builder().waitTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> BenchmarkConfig.builder().operationTimeout(Duration.ofMillis(-1)).build());
    }

    @Test
    void testWarmupCanBeDisabled() {
        BenchmarkConfig config = BenchmarkConfig.builder().warmupIterations(0).build();

        assertEquals(0, config.getWarmupIterations());
    }
}
