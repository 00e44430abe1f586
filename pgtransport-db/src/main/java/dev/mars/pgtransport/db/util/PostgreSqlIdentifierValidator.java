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
package dev.mars.pgtransport.db.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Checks schema names before they are interpolated into SQL text.
 *
 * <p>An accepted identifier has at most {@value #MAX_IDENTIFIER_LENGTH} characters, starts with
 * a letter or underscore, continues with letters, digits or underscores, and does not name a
 * PostgreSQL system schema ({@code pg_*}, {@code information_schema}). Surrounding whitespace
 * is ignored.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public final class PostgreSqlIdentifierValidator {

    /**
     * Longest identifier PostgreSQL keeps without truncation (NAMEDATALEN - 1).
     */
    public static final int MAX_IDENTIFIER_LENGTH = 63;

    private static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    private PostgreSqlIdentifierValidator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @param identifier the identifier
     * @param kind       what the identifier names, used in error messages
     * @throws IllegalArgumentException if the identifier is not acceptable
     */
    public static void validate(String identifier, String kind) {
        String problem = problemWith(identifier);
        if (problem != null) {
            throw new IllegalArgumentException("Invalid " + kind + " name '" + identifier + "': " + problem);
        }
    }

    public static boolean isValid(String identifier) {
        return problemWith(identifier) == null;
    }

    /**
     * Validates the identifier and returns it double-quoted for use in SQL text.
     */
    public static String quote(String identifier, String kind) {
        validate(identifier, kind);
        return '"' + identifier.trim() + '"';
    }

    private static String problemWith(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return "must not be empty";
        }
        String name = identifier.trim();
        if (name.length() > MAX_IDENTIFIER_LENGTH) {
            return "longer than " + MAX_IDENTIFIER_LENGTH + " characters";
        }
        if (!IDENTIFIER.matcher(name).matches()) {
            return "must start with a letter or underscore and contain only letters, digits and underscores";
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.startsWith("pg_") || lower.equals("information_schema")) {
            return "reserved for PostgreSQL system schemas";
        }
        return null;
    }
}
