package dev.mars.notifybench.benchmark.scenario;

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
import dev.mars.notifybench.client.config.ConnectionConfig;
import dev.mars.notifybench.client.connection.NotifyConnection;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Shared state for one benchmark run: the Vert.x instance every connection runs on,
 * plus the connection and benchmark settings.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class BenchmarkContext implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(BenchmarkContext.class);

    private final Vertx vertx;
    private final ConnectionConfig connectionConfig;
    private final BenchmarkConfig benchmarkConfig;

    public BenchmarkContext(ConnectionConfig connectionConfig, BenchmarkConfig benchmarkConfig) {
        this.vertx = Vertx.vertx();
        this.connectionConfig = connectionConfig;
        this.benchmarkConfig = benchmarkConfig;
    }

    /**
     * Opens a new dedicated connection. The caller closes it.
     */
    public NotifyConnection openConnection() {
        return NotifyConnection.connect(vertx, connectionConfig, benchmarkConfig.getOperationTimeout());
    }

    public BenchmarkConfig getBenchmarkConfig() {
        return benchmarkConfig;
    }

    @Override
    public void close() {
        try {
            vertx.close().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while closing Vert.x");
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("Error closing Vert.x: {}", e.getMessage());
        }
    }
}
