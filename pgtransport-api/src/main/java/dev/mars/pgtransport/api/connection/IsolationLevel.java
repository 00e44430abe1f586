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
package dev.mars.pgtransport.api.connection;

/**
 * Transaction isolation levels understood by the transport.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public enum IsolationLevel {
    READ_UNCOMMITTED("READ UNCOMMITTED"),
    READ_COMMITTED("READ COMMITTED"),
    REPEATABLE_READ("REPEATABLE READ"),
    SERIALIZABLE("SERIALIZABLE");

    private final String sql;

    IsolationLevel(String sql) {
        this.sql = sql;
    }

    /**
     * @return the level as it appears in a {@code SET TRANSACTION ISOLATION LEVEL} statement
     */
    public String toSql() {
        return sql;
    }

    /**
     * Parses a configuration value such as {@code read-committed}, {@code READ_COMMITTED}
     * or {@code "read committed"}.
     *
     * @param value the configured value
     * @return the matching level
     * @throws IllegalArgumentException if the value does not name a level
     */
    public static IsolationLevel parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Isolation level cannot be null or empty");
        }
        String normalized = value.trim().toUpperCase().replace('-', '_').replace(' ', '_');
        return IsolationLevel.valueOf(normalized);
    }
}
