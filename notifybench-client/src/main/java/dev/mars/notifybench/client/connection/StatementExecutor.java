package dev.mars.notifybench.client.connection;

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

/**
 * Executes prepared statements by name, or plain SQL.
 */
@FunctionalInterface
public interface StatementExecutor {

    /**
     * Executes the statement prepared under {@code nameOrSql}, or {@code nameOrSql} itself
     * when no statement of that name has been prepared.
     *
     * @param nameOrSql prepared statement name or SQL text
     * @param args      positional parameters
     * @return the command tag of the execution
     * @throws dev.mars.notifybench.client.exception.NotifyBenchException on any failure
     */
    CommandTag exec(String nameOrSql, Object... args);
}
