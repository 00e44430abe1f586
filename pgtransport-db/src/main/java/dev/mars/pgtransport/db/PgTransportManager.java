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
package dev.mars.pgtransport.db;

import dev.mars.pgtransport.api.ConnectionContext;
import dev.mars.pgtransport.db.config.PgTransportConfiguration;
import dev.mars.pgtransport.db.config.PostgresHostConfiguration;
import dev.mars.pgtransport.db.metrics.TransportMetrics;
import dev.mars.pgtransport.db.supervisor.DefaultTransportSupervisor;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.RejectedExecutionException;

/**
 * Owns the lifecycle of one PostgreSQL transport host: Vert.x, metrics, the agent
 * supervisor and the connection context.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class PgTransportManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PgTransportManager.class);

    private final PgTransportConfiguration configuration;
    private final PostgresHostConfiguration hostConfiguration;
    private final MeterRegistry meterRegistry;
    private final Vertx vertx;
    private final boolean vertxOwnedByManager;
    private final TransportMetrics metrics;
    private final DefaultTransportSupervisor supervisor = new DefaultTransportSupervisor();

    private volatile PostgresConnectionContext connectionContext;

    public PgTransportManager() {
        this(new PgTransportConfiguration());
    }

    public PgTransportManager(PgTransportConfiguration configuration) {
        this(configuration, null, null);
    }

    /**
     * @param configuration the host configuration
     * @param meterRegistry registry for transport metrics, may be {@code null}
     * @param vertx         an externally owned Vert.x instance, or {@code null} to create one
     */
    public PgTransportManager(PgTransportConfiguration configuration, MeterRegistry meterRegistry, Vertx vertx) {
        PgTransportDriverSetup.initialize();
        this.configuration = configuration;
        this.hostConfiguration = configuration.getHostConfiguration();
        this.meterRegistry = meterRegistry;

        logger.info("Initializing pgtransport manager with profile: {}", configuration.getProfile());

        if (vertx != null) {
            this.vertx = vertx;
            this.vertxOwnedByManager = false;
            logger.info("Using provided Vert.x instance (external ownership)");
        } else {
            this.vertx = Vertx.vertx();
            this.vertxOwnedByManager = true;
            logger.info("Created new Vert.x instance (manager ownership)");
        }

        this.metrics = new TransportMetrics(configuration.getInstanceId());
        if (meterRegistry != null && configuration.isMetricsEnabled()) {
            metrics.bindTo(meterRegistry);
        }
    }

    /**
     * Creates the connection context, which starts the notification and maintenance agents.
     */
    public synchronized void start() {
        if (connectionContext != null) {
            logger.debug("pgtransport manager already started");
            return;
        }
        connectionContext = new PostgresConnectionContext(vertx, hostConfiguration, supervisor, metrics, null, null);
        logger.info("pgtransport manager started for host {}", hostConfiguration.getHostAddress());
    }

    public boolean isStarted() {
        return connectionContext != null;
    }

    /**
     * Stops the agents and waits for them to finish their final work.
     */
    public Future<Void> stopReactive() {
        logger.info("Stopping pgtransport manager...");
        return supervisor.stop()
            .onComplete(ar -> {
                PostgresConnectionContext context = connectionContext;
                if (context != null) {
                    context.close();
                }
            })
            .onSuccess(v -> logger.info("pgtransport manager stopped successfully"))
            .onFailure(err -> logger.error("Error stopping pgtransport manager", err));
    }

    public Future<Void> closeReactive() {
        return stopReactive()
            .recover(e -> {
                logger.warn("stopReactive failed during close, continuing cleanup: {}", e.getMessage());
                return Future.succeededFuture();
            })
            .compose(v -> {
                if (!vertxOwnedByManager) {
                    logger.info("Skipping Vert.x close (external ownership)");
                    return Future.succeededFuture();
                }
                logger.info("Closing Vert.x instance (manager-owned)");
                return vertx.close()
                    .recover(e -> {
                        if (e instanceof RejectedExecutionException || e.getCause() instanceof RejectedExecutionException) {
                            logger.debug("Vert.x event executor terminated during close; treating as closed.");
                        } else {
                            logger.warn("Error closing Vert.x instance", e);
                        }
                        return Future.succeededFuture();
                    });
            });
    }

    @Override
    public void close() {
        // Fire-and-forget; callers needing completion use closeReactive()
        logger.info("Initiating async close from AutoCloseable.close()");
        closeReactive();
    }

    public ConnectionContext getConnectionContext() {
        PostgresConnectionContext context = connectionContext;
        if (context == null) {
            throw new IllegalStateException("pgtransport manager has not been started");
        }
        return context;
    }

    public PgTransportConfiguration getConfiguration() { return configuration; }
    public PostgresHostConfiguration getHostConfiguration() { return hostConfiguration; }
    public MeterRegistry getMeterRegistry() { return meterRegistry; }
    public TransportMetrics getMetrics() { return metrics; }
    public DefaultTransportSupervisor getSupervisor() { return supervisor; }
    public Vertx getVertx() { return vertx; }
}
