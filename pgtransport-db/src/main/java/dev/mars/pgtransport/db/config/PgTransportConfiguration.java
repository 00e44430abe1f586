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
import dev.mars.pgtransport.db.PgTransportDefaults;
import dev.mars.pgtransport.db.util.PostgreSqlIdentifierValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Layered configuration of a PostgreSQL transport host.
 *
 * <p>Sources, last one wins: {@code /pgtransport-default.properties}, the profile file
 * {@code /pgtransport-<profile>.properties}, {@code PGTRANSPORT_*} environment variables,
 * {@code pgtransport.*} system properties and finally any explicit overrides.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class PgTransportConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(PgTransportConfiguration.class);

    public static final String HOST = "pgtransport.database.host";
    public static final String PORT = "pgtransport.database.port";
    public static final String DATABASE = "pgtransport.database.name";
    public static final String USERNAME = "pgtransport.database.username";
    public static final String PASSWORD = "pgtransport.database.password";
    public static final String SCHEMA = "pgtransport.database.schema";
    public static final String SSL_ENABLED = "pgtransport.database.ssl.enabled";
    public static final String APPLICATION_NAME = "pgtransport.database.application.name";
    public static final String ISOLATION_LEVEL = "pgtransport.transaction.isolation";
    public static final String MAINTENANCE_INTERVAL = "pgtransport.maintenance.interval";
    public static final String QUEUE_CLEANUP_INTERVAL = "pgtransport.maintenance.cleanup.interval";
    public static final String MAINTENANCE_BATCH_SIZE = "pgtransport.maintenance.batch.size";
    public static final String RETRY_ATTEMPTS = "pgtransport.retry.attempts";
    public static final String METRICS_ENABLED = "pgtransport.metrics.enabled";
    public static final String INSTANCE_ID = "pgtransport.instance.id";

    private final Properties properties;
    private final String profile;

    public PgTransportConfiguration() {
        this(getActiveProfile());
    }

    public PgTransportConfiguration(String profile) {
        this(profile, new Properties());
    }

    /**
     * Constructor for programmatic configuration. The overrides are applied after every other
     * source, so concurrent hosts need not touch system properties.
     *
     * @param profile   the configuration profile to use
     * @param overrides properties that take precedence over every other source
     */
    public PgTransportConfiguration(String profile, Properties overrides) {
        this.profile = profile;
        this.properties = loadProperties(profile);
        overrides.forEach((key, value) -> properties.setProperty(key.toString(), value.toString()));
        validateConfiguration();
        logger.info("Loaded pgtransport configuration for profile: {}", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("pgtransport.profile",
               System.getenv("PGTRANSPORT_PROFILE") != null ? System.getenv("PGTRANSPORT_PROFILE") : "default");
    }

    private Properties loadProperties(String profile) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/pgtransport-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/pgtransport-" + profile + ".properties");
        }

        // PGTRANSPORT_DATABASE_HOST -> pgtransport.database.host
        System.getenv().forEach((key, value) -> {
            if (key.startsWith("PGTRANSPORT_")) {
                String propKey = key.toLowerCase().replace("_", ".");
                props.setProperty(propKey, value);
            }
        });

        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("pgtransport.")) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    private void validateConfiguration() {
        List<String> errors = new ArrayList<>();

        validateDatabaseConfig(errors);
        validateMaintenanceConfig(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.debug("Configuration validation passed");
    }

    private void validateDatabaseConfig(List<String> errors) {
        if (getString(HOST, "").isEmpty()) {
            errors.add("Database host is required");
        }

        int port = getInt(PORT, 5432);
        if (port < 1 || port > 65535) {
            errors.add("Database port must be between 1 and 65535");
        }

        if (getString(DATABASE, "").isEmpty()) {
            errors.add("Database name is required");
        }

        if (getString(USERNAME, "").isEmpty()) {
            errors.add("Database username is required");
        }

        if (!PostgreSqlIdentifierValidator.isValid(getString(SCHEMA, PgTransportDefaults.DEFAULT_SCHEMA))) {
            errors.add("Schema must be a valid PostgreSQL identifier");
        }

        try {
            getIsolationLevel();
        } catch (IllegalArgumentException e) {
            errors.add("Unknown transaction isolation level: " + getString(ISOLATION_LEVEL, ""));
        }
    }

    private void validateMaintenanceConfig(List<String> errors) {
        Duration maintenanceInterval = getDuration(MAINTENANCE_INTERVAL, PgTransportDefaults.DEFAULT_MAINTENANCE_INTERVAL);
        if (maintenanceInterval.isNegative() || maintenanceInterval.isZero()) {
            errors.add("Maintenance interval must be positive");
        }

        Duration cleanupInterval = getDuration(QUEUE_CLEANUP_INTERVAL, PgTransportDefaults.DEFAULT_QUEUE_CLEANUP_INTERVAL);
        if (cleanupInterval.isNegative() || cleanupInterval.isZero()) {
            errors.add("Queue cleanup interval must be positive");
        }

        if (getInt(MAINTENANCE_BATCH_SIZE, PgTransportDefaults.DEFAULT_MAINTENANCE_BATCH_SIZE) < 1) {
            errors.add("Maintenance batch size must be at least 1");
        }

        if (getInt(RETRY_ATTEMPTS, PgTransportDefaults.DEFAULT_RETRY_ATTEMPTS) < 1) {
            errors.add("Retry attempts must be at least 1");
        }
    }

    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public String getString(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalArgumentException("Required configuration property not found: " + key);
        }
        return value;
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public Duration getDuration(String key, Duration defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Duration.parse(value.trim());
        } catch (Exception e) {
            logger.warn("Invalid duration value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public IsolationLevel getIsolationLevel() {
        String value = properties.getProperty(ISOLATION_LEVEL);
        return value == null ? PgTransportDefaults.DEFAULT_ISOLATION_LEVEL : IsolationLevel.parse(value);
    }

    public boolean isMetricsEnabled() {
        return getBoolean(METRICS_ENABLED, true);
    }

    public String getInstanceId() {
        return getString(INSTANCE_ID, "pgtransport-" + profile);
    }

    public PostgresHostSettings getHostSettings() {
        return PostgresHostSettings.builder()
            .host(getString(HOST, "localhost"))
            .port(getInt(PORT, 5432))
            .database(getString(DATABASE, "pgtransport"))
            .username(getString(USERNAME, "pgtransport"))
            .password(getString(PASSWORD, ""))
            .schema(getString(SCHEMA, PgTransportDefaults.DEFAULT_SCHEMA))
            .sslEnabled(getBoolean(SSL_ENABLED, false))
            .applicationName(getString(APPLICATION_NAME, "pgtransport"))
            .isolationLevel(getIsolationLevel())
            .maintenanceInterval(getDuration(MAINTENANCE_INTERVAL, PgTransportDefaults.DEFAULT_MAINTENANCE_INTERVAL))
            .queueCleanupInterval(getDuration(QUEUE_CLEANUP_INTERVAL, PgTransportDefaults.DEFAULT_QUEUE_CLEANUP_INTERVAL))
            .maintenanceBatchSize(getInt(MAINTENANCE_BATCH_SIZE, PgTransportDefaults.DEFAULT_MAINTENANCE_BATCH_SIZE))
            .retryAttempts(getInt(RETRY_ATTEMPTS, PgTransportDefaults.DEFAULT_RETRY_ATTEMPTS))
            .build();
    }

    public PostgresHostConfiguration getHostConfiguration() {
        return PostgresHostConfiguration.of(getHostSettings());
    }

    public String getProfile() {
        return profile;
    }

    public Properties getProperties() {
        Properties copy = new Properties();
        copy.putAll(properties);
        return copy;
    }
}
