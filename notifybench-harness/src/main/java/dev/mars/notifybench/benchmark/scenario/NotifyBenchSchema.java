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

import dev.mars.notifybench.client.connection.StatementExecutor;

/**
 * DDL for the {@value #TABLE} table used by the insert scenarios.
 */
public final class NotifyBenchSchema {

    public static final String TABLE = "notify_bench";

    static final String DROP_TABLE = "drop table if exists notify_bench";
    static final String CREATE_PLAIN_TABLE = "create table notify_bench(id serial primary key)";
    static final String CREATE_NOTIFYING_TABLE = "create table notify_bench(id serial primary key, n integer)";
    static final String CREATE_TRIGGER =
            "CREATE TRIGGER insert_notifier AFTER INSERT ON notify_bench FOR EACH ROW EXECUTE PROCEDURE insert_notifier()";

    private NotifyBenchSchema() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    /**
     * Recreates {@value #TABLE} with only a serial key and no trigger.
     */
    public static void createPlainTable(StatementExecutor executor) {
        executor.exec(DROP_TABLE);
        executor.exec(CREATE_PLAIN_TABLE);
    }

    /**
     * Recreates {@value #TABLE} with an integer column {@code n} and an AFTER INSERT trigger
     * that sends {@code n} as the payload of a notification on {@code channel}.
     */
    public static void createNotifyingTable(StatementExecutor executor, String channel) {
        executor.exec(DROP_TABLE);
        executor.exec(CREATE_NOTIFYING_TABLE);
        executor.exec(triggerFunctionSql(channel));
        executor.exec(CREATE_TRIGGER);
    }

    static String triggerFunctionSql(String channel) {
        return """
                CREATE OR REPLACE FUNCTION insert_notifier() RETURNS trigger
                    LANGUAGE plpgsql
                    AS $$
                  begin
                    perform pg_notify(%s, new.n::text);
                    return new;
                  end;
                $$;
                """.formatted(quoteLiteral(channel));
    }

    static String quoteLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
