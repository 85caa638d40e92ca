package dev.mars.notifybench.client.config;

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
import io.vertx.pgclient.PgConnectOptions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Core tests for ConnectionConfig environment resolution.
 */
@Tag(TestCategories.CORE)
class ConnectionConfigTest {

    @Test
    void testDefaultsWhenNothingIsSet() {
        Map<String, String> env = new HashMap<>();
        env.put("USER", "alice");

        ConnectionConfig config = ConnectionConfig.fromEnvironment(env::get);

        assertEquals("localhost", config.getHost());
        assertEquals(5432, config.getPort());
        assertEquals("alice", config.getUsername());
        assertEquals("", config.getPassword());
        assertEquals("alice", config.getDatabase(), "Database should default to the user name");
    }

    @Test
    void testFallsBackToUserNamePropertyWithoutUserVariable() {
        ConnectionConfig config = ConnectionConfig.fromEnvironment(name -> null);

        assertEquals(System.getProperty("user.name"), config.getUsername());
        assertEquals(config.getUsername(), config.getDatabase());
    }

    @Test
    void testExplicitVariablesWin() {
        Map<String, String> env = new HashMap<>();
        env.put("USER", "alice");
        env.put("PG_HOST", "db.internal");
        env.put("PG_PORT", "6543");
        env.put("PG_USER", "bench");
        env.put("PG_PASSWORD", "secret");
        env.put("PG_DATABASE", "benchdb");

        ConnectionConfig config = ConnectionConfig.fromEnvironment(env::get);

        assertEquals("db.internal", config.getHost());
        assertEquals(6543, config.getPort());
        assertEquals("bench", config.getUsername());
        assertEquals("secret", config.getPassword());
        assertEquals("benchdb", config.getDatabase());
    }

    @Test
    void testDatabaseDefaultsToPgUserNotOsUser() {
        Map<String, String> env = new HashMap<>();
        env.put("USER", "alice");
        env.put("PG_USER", "bench");

        ConnectionConfig config = ConnectionConfig.fromEnvironment(env::get);

        assertEquals("bench", config.getDatabase());
    }

    @Test
    void testEmptyValuesCountAsUnset() {
        Map<String, String> env = new HashMap<>();
        env.put("USER", "alice");
        env.put("PG_HOST", "");
        env.put("PG_USER", "  ");
        env.put("PG_DATABASE", "");

        ConnectionConfig config = ConnectionConfig.fromEnvironment(env::get);

        assertEquals("localhost", config.getHost());
        assertEquals("alice", config.getUsername());
        assertEquals("alice", config.getDatabase());
    }

    @Test
    void testInvalidPortIsRejected() {
        Map<String, String> env = new HashMap<>();
        env.put("USER", "alice");
        env.put("PG_PORT", "not-a-port");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConnectionConfig.fromEnvironment(env::get));
        assertTrue(e.getMessage().contains("PG_PORT"));
    }

    @Test
    void testBuilderRequiresUsername() {
        assertThrows(NullPointerException.class, () -> ConnectionConfig.builder().build());
    }

    @Test
    void testToConnectOptions() {
        ConnectionConfig config = ConnectionConfig.builder()
                .host("pg")
                .port(15432)
                .username("bench")
                .password("pw")
                .database("benchdb")
                .build();

        PgConnectOptions options = config.toConnectOptions();

        assertEquals("pg", options.getHost());
        assertEquals(15432, options.getPort());
        assertEquals("bench", options.getUser());
        assertEquals("pw", options.getPassword());
        assertEquals("benchdb", options.getDatabase());
    }

    @Test
    void testToStringHidesPassword() {
        ConnectionConfig config = ConnectionConfig.builder()
                .username("bench")
                .password("do-not-print")
                .build();

        assertFalse(config.toString().contains("do-not-print"));
    }
}
