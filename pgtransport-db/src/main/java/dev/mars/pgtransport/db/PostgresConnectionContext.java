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
import dev.mars.pgtransport.api.QueryCallback;
import dev.mars.pgtransport.api.agent.TransportSupervisor;
import dev.mars.pgtransport.api.agent.WakeSignal;
import dev.mars.pgtransport.api.connection.IsolationLevel;
import dev.mars.pgtransport.api.connection.TransportConnection;
import dev.mars.pgtransport.api.connection.TransportConnectionFactory;
import dev.mars.pgtransport.api.error.ConfigurationException;
import dev.mars.pgtransport.api.error.EndpointException;
import dev.mars.pgtransport.api.host.HostConfiguration;
import dev.mars.pgtransport.api.host.HostSettings;
import dev.mars.pgtransport.api.retry.RetryPolicy;
import dev.mars.pgtransport.db.config.PostgresHostSettings;
import dev.mars.pgtransport.db.connection.PgTransportConnectionFactory;
import dev.mars.pgtransport.db.maintenance.MaintenanceAgent;
import dev.mars.pgtransport.db.maintenance.MaintenanceSchedule;
import dev.mars.pgtransport.db.metrics.TransportMetrics;
import dev.mars.pgtransport.db.notification.NotificationAgent;
import dev.mars.pgtransport.db.retry.ImmediateRetryPolicy;
import dev.mars.pgtransport.db.util.Waits;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Connection context of a PostgreSQL transport host.
 *
 * <p>Creating the context registers its {@link NotificationAgent} and {@link MaintenanceAgent}
 * with the supervisor, which starts them with the host's stop signal. The context itself holds
 * no connection: {@link #query(QueryCallback, Future)} opens a private connection per call and
 * the notification agent owns the subscription connection.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class PostgresConnectionContext implements ConnectionContext {

    private static final Logger logger = LoggerFactory.getLogger(PostgresConnectionContext.class);

    private final Vertx vertx;
    private final URI hostAddress;
    private final PostgresHostSettings settings;
    private final RetryPolicy retryPolicy;
    private final TransportConnectionFactory connectionFactory;
    private final WakeSignal stopping = new WakeSignal();
    private final NotificationAgent notificationAgent;
    private final MaintenanceAgent maintenanceAgent;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public PostgresConnectionContext(Vertx vertx, HostConfiguration hostConfiguration, TransportSupervisor supervisor) {
        this(vertx, hostConfiguration, supervisor, TransportMetrics.noop(), null, null);
    }

    /**
     * @param vertx              the Vert.x instance running the agents
     * @param hostConfiguration  the host; its settings must be {@link PostgresHostSettings}
     * @param supervisor         starts the agents and owns their stop signal
     * @param metrics            agent metrics, may be {@code null}
     * @param connectionFactory  derives the connection factory from the settings, or {@code null} for
     *                           dedicated Vert.x PG connections
     * @param retryPolicy        retry policy, or {@code null} to retry PostgreSQL transient errors
     *                           up to the configured attempts
     * @throws ConfigurationException if the settings are not PostgreSQL settings
     */
    public PostgresConnectionContext(Vertx vertx, HostConfiguration hostConfiguration, TransportSupervisor supervisor,
                                     TransportMetrics metrics,
                                     Function<PostgresHostSettings, TransportConnectionFactory> connectionFactory,
                                     RetryPolicy retryPolicy) {
        HostSettings hostSettings = Objects.requireNonNull(hostConfiguration, "hostConfiguration cannot be null").getSettings();
        if (!(hostSettings instanceof PostgresHostSettings)) {
            throw new ConfigurationException("The host settings were not of the expected type");
        }
        this.vertx = Objects.requireNonNull(vertx, "vertx cannot be null");
        Objects.requireNonNull(supervisor, "supervisor cannot be null");
        this.hostAddress = hostConfiguration.getHostAddress();
        this.settings = (PostgresHostSettings) hostSettings;
        this.retryPolicy = retryPolicy != null
            ? retryPolicy
            : ImmediateRetryPolicy.forPostgres(settings.getRetryAttempts());
        this.connectionFactory = connectionFactory != null
            ? connectionFactory.apply(settings)
            : new PgTransportConnectionFactory(vertx, settings.toConnectOptions());

        supervisor.stopping().onComplete(ar -> stopping.fire());

        this.notificationAgent = new NotificationAgent(vertx, this.connectionFactory, this.retryPolicy, metrics);
        this.maintenanceAgent = new MaintenanceAgent(vertx, this, this.retryPolicy,
            new MaintenanceSchedule(settings.getMaintenanceInterval(), settings.getQueueCleanupInterval()),
            settings.getMaintenanceBatchSize(), metrics);

        supervisor.addConsumeAgent(notificationAgent);
        supervisor.addConsumeAgent(maintenanceAgent);
        logger.info("Connection context created for host {} (schema {}, isolation {})",
            hostAddress, settings.getSchema(), settings.getIsolationLevel());
    }

    @Override
    public URI getHostAddress() {
        return hostAddress;
    }

    @Override
    public String getSchema() {
        return settings.getSchema();
    }

    @Override
    public IsolationLevel getIsolationLevel() {
        return settings.getIsolationLevel();
    }

    public PostgresHostSettings getSettings() {
        return settings;
    }

    public NotificationAgent getNotificationAgent() {
        return notificationAgent;
    }

    public MaintenanceAgent getMaintenanceAgent() {
        return maintenanceAgent;
    }

    @Override
    public Future<TransportConnection> createConnection(Future<?> cancellation) {
        if (cancellation != null && cancellation.isComplete()) {
            return Future.failedFuture(new CancellationException("Connection request cancelled"));
        }
        Future<TransportConnection> connecting;
        try {
            connecting = connectionFactory.connect();
        } catch (RuntimeException e) {
            connecting = Future.failedFuture(e);
        }
        return connecting.recover(err -> Future.failedFuture(
            new EndpointException(hostAddress, "Failed to open connection", err)));
    }

    @Override
    public <T> Future<T> query(QueryCallback<T> callback, Future<?> cancellation) {
        Objects.requireNonNull(callback, "callback cannot be null");
        return createConnection(cancellation).compose(connection ->
            retryPolicy.retry(() -> runInTransaction(connection, callback), cancellation)
                .transform(ar -> connection.close().transform(closeResult -> ar.succeeded()
                    ? Future.succeededFuture(ar.result())
                    : Future.<T>failedFuture(ar.cause()))));
    }

    private <T> Future<T> runInTransaction(TransportConnection connection, QueryCallback<T> callback) {
        return connection.beginTransaction(settings.getIsolationLevel()).compose(transaction -> {
            Future<T> work;
            try {
                work = callback.execute(connection, transaction);
            } catch (RuntimeException e) {
                work = Future.failedFuture(e);
            }
            return work
                .compose(result -> transaction.commit().map(v -> result))
                .recover(err -> transaction.rollback().transform(rollback -> {
                    if (rollback.failed()) {
                        logger.debug("Rollback failed: {}", rollback.cause().getMessage());
                    }
                    return Future.<T>failedFuture(err);
                }));
        });
    }

    @Override
    public Future<Void> delayUntilMessageReady(long queueId, Duration timeout, Future<?> cancellation) {
        WakeSignal signal = notificationAgent.getSignalForQueue(queueId);
        return Waits.any(vertx, timeout, cancellation, signal, stopping)
            .onSuccess(v -> {
                if (signal.isFired()) {
                    notificationAgent.rotateSignal(queueId, signal);
                }
            });
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            logger.info("Disconnected host {}", hostAddress);
        }
    }
}
