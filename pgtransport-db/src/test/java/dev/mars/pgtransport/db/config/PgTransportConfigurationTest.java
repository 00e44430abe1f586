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
package dev.mars.pgtransport.db.config;

import dev.mars.pgtransport.api.connection.IsolationLevel;
import dev.mars.pgtransport.test.categories.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link PgTransportConfiguration} layering and validation.
 */
@Tag(TestCategories.CORE)
class PgTransportConfigurationTest {

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty(PgTransportConfiguration.MAINTENANCE_BATCH_SIZE);
    }

    @Test
    void defaultsComeFromClasspathProperties() {
        PgTransportConfiguration configuration = new PgTransportConfiguration("default");
        PostgresHostSettings settings = configuration.getHostSettings();

        assertEquals("localhost", settings.getHost());
        assertEquals(5432, settings.getPort());
        assertEquals("transport", settings.getSchema());
        assertEquals(IsolationLevel.REPEATABLE_READ, settings.getIsolationLevel());
        assertEquals(Duration.ofMinutes(1), settings.getMaintenanceInterval());
        assertEquals(Duration.ofMinutes(10), settings.getQueueCleanupInterval());
        assertEquals(10_000, settings.getMaintenanceBatchSize());
        assertEquals(10, settings.getRetryAttempts());
        assertTrue(configuration.isMetricsEnabled());
    }

    @Test
    void profileOverridesDefaults() {
        PgTransportConfiguration configuration = new PgTransportConfiguration("test");
        PostgresHostSettings settings = configuration.getHostSettings();

        assertEquals("db.test.internal", settings.getHost());
        assertEquals(6543, settings.getPort());
        assertEquals("transport_test", settings.getDatabase());
        assertEquals("transport_test", settings.getSchema());
        assertEquals(IsolationLevel.READ_COMMITTED, settings.getIsolationLevel());
        assertEquals(Duration.ofSeconds(30), settings.getMaintenanceInterval());
        assertEquals(Duration.ofMinutes(5), settings.getQueueCleanupInterval());
        assertEquals(500, settings.getMaintenanceBatchSize());
        assertEquals(3, settings.getRetryAttempts());
        assertEquals(URI.create("postgres://db.test.internal:6543/transport_test"),
            configuration.getHostConfiguration().getHostAddress());
    }

    @Test
    void systemPropertiesOverrideProfile() {
        System.setProperty(PgTransportConfiguration.MAINTENANCE_BATCH_SIZE, "42");

        PgTransportConfiguration configuration = new PgTransportConfiguration("test");

        assertEquals(42, configuration.getHostSettings().getMaintenanceBatchSize());
    }

    @Test
    void explicitOverridesWinOverEverything() {
        System.setProperty(PgTransportConfiguration.MAINTENANCE_BATCH_SIZE, "42");
        Properties overrides = new Properties();
        overrides.setProperty(PgTransportConfiguration.MAINTENANCE_BATCH_SIZE, "7");
        overrides.setProperty(PgTransportConfiguration.ISOLATION_LEVEL, "serializable");

        PgTransportConfiguration configuration = new PgTransportConfiguration("default", overrides);

        assertEquals(7, configuration.getHostSettings().getMaintenanceBatchSize());
        assertEquals(IsolationLevel.SERIALIZABLE, configuration.getIsolationLevel());
    }

    @Test
    void invalidValuesAreReportedTogether() {
        Properties overrides = new Properties();
        overrides.setProperty(PgTransportConfiguration.PORT, "70000");
        overrides.setProperty(PgTransportConfiguration.SCHEMA, "pg_catalog");
        overrides.setProperty(PgTransportConfiguration.ISOLATION_LEVEL, "chaos");
        overrides.setProperty(PgTransportConfiguration.MAINTENANCE_INTERVAL, "PT0S");

        IllegalStateException exception = assertThrows(IllegalStateException.class,
            () -> new PgTransportConfiguration("default", overrides));

        assertTrue(exception.getMessage().startsWith("Configuration validation failed: "));
        assertTrue(exception.getMessage().contains("Database port must be between 1 and 65535"));
        assertTrue(exception.getMessage().contains("Schema must be a valid PostgreSQL identifier"));
        assertTrue(exception.getMessage().contains("Unknown transaction isolation level: chaos"));
        assertTrue(exception.getMessage().contains("Maintenance interval must be positive"));
    }

    @Test
    void malformedNumbersFallBackToDefaults() {
        Properties overrides = new Properties();
        overrides.setProperty("pgtransport.some.number", "not-a-number");
        overrides.setProperty("pgtransport.some.duration", "ten minutes");

        PgTransportConfiguration configuration = new PgTransportConfiguration("default", overrides);

        assertEquals(5, configuration.getInt("pgtransport.some.number", 5));
        assertEquals(Duration.ofSeconds(9), configuration.getDuration("pgtransport.some.duration", Duration.ofSeconds(9)));
        assertThrows(IllegalArgumentException.class, () -> configuration.getString("pgtransport.missing"));
    }
}
