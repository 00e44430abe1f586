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
import dev.mars.pgtransport.api.host.HostSettings;
import dev.mars.pgtransport.db.PgTransportDefaults;
import dev.mars.pgtransport.db.util.PostgreSqlIdentifierValidator;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.SslMode;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of a PostgreSQL transport host.
 *
 * <p>Holds the connection parameters together with the transport's own tuning: schema,
 * isolation level, maintenance cadence and retry attempts.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class PostgresHostSettings implements HostSettings {
    private final String host;
    private final int port;
    private final String database;
    private final String username;
    private final String password;
    private final String schema;
    private final boolean sslEnabled;
    private final String applicationName;
    private final IsolationLevel isolationLevel;
    private final Duration maintenanceInterval;
    private final Duration queueCleanupInterval;
    private final int maintenanceBatchSize;
    private final int retryAttempts;

    private PostgresHostSettings(Builder builder) {
        this.host = Objects.requireNonNull(builder.host, "Host cannot be null");
        this.port = builder.port;
        this.database = Objects.requireNonNull(builder.database, "Database cannot be null");
        this.username = Objects.requireNonNull(builder.username, "Username cannot be null");
        this.password = builder.password;
        this.schema = builder.schema;
        this.sslEnabled = builder.sslEnabled;
        this.applicationName = builder.applicationName;
        this.isolationLevel = Objects.requireNonNull(builder.isolationLevel, "Isolation level cannot be null");
        this.maintenanceInterval = Objects.requireNonNull(builder.maintenanceInterval, "Maintenance interval cannot be null");
        this.queueCleanupInterval = Objects.requireNonNull(builder.queueCleanupInterval, "Queue cleanup interval cannot be null");
        this.maintenanceBatchSize = builder.maintenanceBatchSize;
        this.retryAttempts = builder.retryAttempts;

        PostgreSqlIdentifierValidator.validate(schema, "schema");
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Port must be between 1 and 65535, was " + port);
        }
        if (maintenanceInterval.isNegative() || maintenanceInterval.isZero()) {
            throw new IllegalArgumentException("Maintenance interval must be positive");
        }
        if (queueCleanupInterval.isNegative() || queueCleanupInterval.isZero()) {
            throw new IllegalArgumentException("Queue cleanup interval must be positive");
        }
        if (maintenanceBatchSize <= 0) {
            throw new IllegalArgumentException("Maintenance batch size must be positive");
        }
        if (retryAttempts < 1) {
            throw new IllegalArgumentException("Retry attempts must be at least 1");
        }
    }

    @Override
    public String getHost() {
        return host;
    }

    @Override
    public int getPort() {
        return port;
    }

    @Override
    public String getDatabase() {
        return database;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    @Override
    public String getSchema() {
        return schema;
    }

    public boolean isSslEnabled() {
        return sslEnabled;
    }

    public String getApplicationName() {
        return applicationName;
    }

    @Override
    public IsolationLevel getIsolationLevel() {
        return isolationLevel;
    }

    @Override
    public Duration getMaintenanceInterval() {
        return maintenanceInterval;
    }

    @Override
    public Duration getQueueCleanupInterval() {
        return queueCleanupInterval;
    }

    @Override
    public int getMaintenanceBatchSize() {
        return maintenanceBatchSize;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    /**
     * Derives the Vert.x reactive client connect options for a dedicated connection.
     *
     * @return new connect options reflecting these settings
     */
    public PgConnectOptions toConnectOptions() {
        PgConnectOptions connectOptions = new PgConnectOptions()
            .setHost(host)
            .setPort(port)
            .setDatabase(database)
            .setUser(username);

        if (password != null) {
            connectOptions.setPassword(password);
        }

        if (sslEnabled) {
            connectOptions.setSslMode(SslMode.REQUIRE);
        } else {
            connectOptions.setSslMode(SslMode.DISABLE);
        }

        if (applicationName != null && !applicationName.isBlank()) {
            connectOptions.addProperty("application_name", applicationName);
        }
        return connectOptions;
    }

    @Override
    public String toString() {
        return "PostgresHostSettings{" +
            "host='" + host + '\'' +
            ", port=" + port +
            ", database='" + database + '\'' +
            ", username='" + username + '\'' +
            ", schema='" + schema + '\'' +
            ", sslEnabled=" + sslEnabled +
            ", isolationLevel=" + isolationLevel +
            ", maintenanceInterval=" + maintenanceInterval +
            ", queueCleanupInterval=" + queueCleanupInterval +
            ", maintenanceBatchSize=" + maintenanceBatchSize +
            ", retryAttempts=" + retryAttempts +
            '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for PostgresHostSettings.
     */
    public static class Builder {
        private String host = "localhost";
        private int port = 5432;
        private String database;
        private String username;
        private String password;
        private String schema = PgTransportDefaults.DEFAULT_SCHEMA;
        private boolean sslEnabled = false;
        private String applicationName = "pgtransport";
        private IsolationLevel isolationLevel = PgTransportDefaults.DEFAULT_ISOLATION_LEVEL;
        private Duration maintenanceInterval = PgTransportDefaults.DEFAULT_MAINTENANCE_INTERVAL;
        private Duration queueCleanupInterval = PgTransportDefaults.DEFAULT_QUEUE_CLEANUP_INTERVAL;
        private int maintenanceBatchSize = PgTransportDefaults.DEFAULT_MAINTENANCE_BATCH_SIZE;
        private int retryAttempts = PgTransportDefaults.DEFAULT_RETRY_ATTEMPTS;

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
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

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder sslEnabled(boolean sslEnabled) {
            this.sslEnabled = sslEnabled;
            return this;
        }

        public Builder applicationName(String applicationName) {
            this.applicationName = applicationName;
            return this;
        }

        public Builder isolationLevel(IsolationLevel isolationLevel) {
            this.isolationLevel = isolationLevel;
            return this;
        }

        public Builder maintenanceInterval(Duration maintenanceInterval) {
            this.maintenanceInterval = maintenanceInterval;
            return this;
        }

        public Builder queueCleanupInterval(Duration queueCleanupInterval) {
            this.queueCleanupInterval = queueCleanupInterval;
            return this;
        }

        public Builder maintenanceBatchSize(int maintenanceBatchSize) {
            this.maintenanceBatchSize = maintenanceBatchSize;
            return this;
        }

        public Builder retryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
            return this;
        }

        public PostgresHostSettings build() {
            return new PostgresHostSettings(this);
        }
    }
}
