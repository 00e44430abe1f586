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
package dev.mars.pgtransport.db.retry;

import io.vertx.pgclient.PgException;

import java.util.Set;

/**
 * Classifies PostgreSQL failures that are worth retrying immediately.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public final class PgTransientErrors {

    private static final Set<String> TRANSIENT_SQL_STATES = Set.of(
        "40001", // serialization_failure
        "40P01", // deadlock_detected
        "57P01", // admin_shutdown
        "57P02", // crash_shutdown
        "57P03", // cannot_connect_now
        "55P03", // lock_not_available
        "53300"  // too_many_connections
    );

    private static final String CONNECTION_EXCEPTION_CLASS = "08";

    private PgTransientErrors() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @return true if the failure, or one of its causes, is a PostgreSQL error with a transient SQLSTATE
     */
    public static boolean isTransient(Throwable t) {
        String code = sqlState(t);
        if (code == null) {
            return false;
        }
        return TRANSIENT_SQL_STATES.contains(code) || code.startsWith(CONNECTION_EXCEPTION_CLASS);
    }

    /**
     * @return the SQLSTATE of the first {@link PgException} in the cause chain, or {@code null}
     */
    public static String sqlState(Throwable t) {
        if (t == null) return null;
        // Unwrap
        Throwable cause = t;
        while (cause.getCause() != null && !(cause instanceof PgException) && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        if (cause instanceof PgException) {
            return ((PgException) cause).getSqlState();
        }
        return null;
    }
}
