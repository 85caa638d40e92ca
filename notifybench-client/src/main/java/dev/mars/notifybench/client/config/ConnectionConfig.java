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


import io.vertx.pgclient.PgConnectOptions;

import java.util.Objects;
import java.util.function.Function;

/**
 * Connection settings for the notifier and listener connections.
 *
 * Values are normally read from the {@code PG_*} environment variables through
 * {@link #fromEnvironment()}; the builder is used by tests that point at a container.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class ConnectionConfig {

    public static final String ENV_HOST = "PG_HOST";
    public static final String ENV_PORT = "PG_PORT";
    public static final String ENV_USER = "PG_USER";
    public static final String ENV_PASSWORD = "PG_PASSWORD";
    public static final String ENV_DATABASE = "PG_DATABASE";

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 5432;

    private final String host;
    private final int port;
    private final String database;
    private final String username;
    private final String password;

    private ConnectionConfig(Builder builder) {
        this.host = Objects.requireNonNull(builder.host, "Host cannot be null");
        this.port = builder.port;
        this.username = Objects.requireNonNull(builder.username, "Username cannot be null");
        this.database = builder.database != null ? builder.database : builder.username;
        this.password = builder.password != null ? builder.password : "";
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the configuration from the process environment.
     */
    public static ConnectionConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Reads the configuration from the given variable lookup.
     *
     * <p>{@code PG_HOST} defaults to {@code localhost}, {@code PG_PORT} to 5432,
     * {@code PG_USER} to the current OS user, {@code PG_PASSWORD} to empty and
     * {@code PG_DATABASE} to the user name. Empty values count as unset.</p>
     *
     * @param env variable lookup, returning null for unset variables
     * @return the resolved configuration
     */
    public static ConnectionConfig fromEnvironment(Function<String, String> env) {
        Builder builder = builder();

        builder.host(valueOrDefault(env.apply(ENV_HOST), DEFAULT_HOST));

        String port = env.apply(ENV_PORT);
        if (!isBlank(port)) {
            try {
                builder.port(Integer.parseInt(port.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + ENV_PORT + ": " + port, e);
            }
        }

        String user = env.apply(ENV_USER);
        if (isBlank(user)) {
            user = valueOrDefault(env.apply("USER"), System.getProperty("user.name"));
        }
        builder.username(user);

        builder.password(valueOrDefault(env.apply(ENV_PASSWORD), ""));
        builder.database(valueOrDefault(env.apply(ENV_DATABASE), user));

        return builder.build();
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getDatabase() {
        return database;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    /**
     * Builds the Vert.x connect options for a single, non-pooled connection.
     */
    public PgConnectOptions toConnectOptions() {
        return new PgConnectOptions()
                .setHost(host)
                .setPort(port)
                .setDatabase(database)
                .setUser(username)
                .setPassword(password);
    }

    @Override
    public String toString() {
        return "ConnectionConfig{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", database='" + database + '\'' +
                ", username='" + username + '\'' +
                '}';
    }

    private static String valueOrDefault(String value, String defaultValue) {
        return isBlank(value) ? defaultValue : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    /**
     * Builder for ConnectionConfig.
     */
    public static class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private String database;
        private String username;
        private String password;

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("Port out of range: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder database(String database) {
            this.database = database;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public ConnectionConfig build() {
            return new ConnectionConfig(this);
        }
    }
}
