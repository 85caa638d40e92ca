package dev.mars.notifybench.test;

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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PostgreSQLTestConstants. None of these need Docker: the container image
 * is never resolved.
 */
@Tag(TestCategories.CORE)
class PostgreSQLTestConstantsTest {

    @Test
    void testDefaultConstants() {
        assertEquals("notifybench_test", PostgreSQLTestConstants.DEFAULT_DATABASE_NAME);
        assertEquals("notifybench_test", PostgreSQLTestConstants.DEFAULT_USERNAME);
        assertEquals("notifybench_test", PostgreSQLTestConstants.DEFAULT_PASSWORD);
        assertEquals(256 * 1024 * 1024L, PostgreSQLTestConstants.DEFAULT_SHARED_MEMORY_SIZE);
    }

    @Test
    void testCreateStandardContainer() {
        PostgreSQLContainer<?> container = PostgreSQLTestConstants.createStandardContainer();

        assertEquals(PostgreSQLTestConstants.DEFAULT_DATABASE_NAME, container.getDatabaseName());
        assertEquals(PostgreSQLTestConstants.DEFAULT_USERNAME, container.getUsername());
        assertEquals(PostgreSQLTestConstants.DEFAULT_PASSWORD, container.getPassword());
    }

    @Test
    void testImageIsPinnedPostgres() {
        DockerImageName image = DockerImageName.parse(PostgreSQLTestConstants.POSTGRES_IMAGE);

        assertEquals("postgres", image.getRepository());
        assertEquals("15.13-alpine3.20", image.getVersionPart());
        assertTrue(image.isCompatibleWith(DockerImageName.parse("postgres")));
    }

    @Test
    void testCreateCustomContainer() {
        PostgreSQLContainer<?> container = PostgreSQLTestConstants.createContainer("bench_db", "bench_user", "bench_pw");

        assertEquals("bench_db", container.getDatabaseName());
        assertEquals("bench_user", container.getUsername());
        assertEquals("bench_pw", container.getPassword());
    }

    @Test
    void testBenchmarkContainerUsesDefaultCredentials() {
        PostgreSQLContainer<?> container = PostgreSQLTestConstants.createBenchmarkContainer();

        assertEquals(PostgreSQLTestConstants.DEFAULT_USERNAME, container.getUsername());
        assertEquals(PostgreSQLTestConstants.DEFAULT_DATABASE_NAME, container.getDatabaseName());
    }

    @Test
    void testUtilityClassCannotBeInstantiated() {
        var exception = assertThrows(Exception.class, () -> {
            var constructor = PostgreSQLTestConstants.class.getDeclaredConstructor();
            constructor.setAccessible(true);
            constructor.newInstance();
        });

        // wrapped in InvocationTargetException
        assertTrue(exception.getCause() instanceof UnsupportedOperationException);
    }
}
