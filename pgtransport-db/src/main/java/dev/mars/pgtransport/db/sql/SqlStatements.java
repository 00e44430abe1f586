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
package dev.mars.pgtransport.db.sql;

import dev.mars.pgtransport.db.util.PostgreSqlIdentifierValidator;

/**
 * SQL used by the maintenance agent, bound to the transport schema.
 *
 * <p>The statements call stored functions installed with the transport schema; their
 * bodies are owned by the schema migrations, not by this module.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public final class SqlStatements {

    /**
     * Aggregates pending queue metrics. {@code $1} is the row limit.
     */
    private static final String PROCESS_METRICS_SQL = "SELECT %s.process_metrics($1)";

    private static final String PURGE_TOPOLOGY_SQL = "SELECT %s.purge_topology()";

    private SqlStatements() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String processMetrics(String schema) {
        return String.format(PROCESS_METRICS_SQL, PostgreSqlIdentifierValidator.quote(schema, "schema"));
    }

    public static String purgeTopology(String schema) {
        return String.format(PURGE_TOPOLOGY_SQL, PostgreSqlIdentifierValidator.quote(schema, "schema"));
    }
}
