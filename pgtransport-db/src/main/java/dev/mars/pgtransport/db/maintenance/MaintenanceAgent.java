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
package dev.mars.pgtransport.db.maintenance;

import dev.mars.pgtransport.api.ConnectionContext;
import dev.mars.pgtransport.api.agent.TransportAgent;
import dev.mars.pgtransport.api.agent.WakeSignal;
import dev.mars.pgtransport.api.retry.RetryPolicy;
import dev.mars.pgtransport.db.PgTransportDefaults;
import dev.mars.pgtransport.db.metrics.TransportMetrics;
import dev.mars.pgtransport.db.sql.SqlStatements;
import dev.mars.pgtransport.db.util.Waits;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically aggregates queue metrics and purges stale topology.
 *
 * <p>Every cycle waits a jittered maintenance interval, then processes up to the configured
 * batch of metric rows and, when the jittered cleanup interval has elapsed since the last
 * purge, purges topology. On stop it makes one last metrics call, plus a purge if none ever
 * ran, bounded by {@link PgTransportDefaults#MAINTENANCE_FLUSH_TIMEOUT}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class MaintenanceAgent implements TransportAgent {

    private static final Logger logger = LoggerFactory.getLogger(MaintenanceAgent.class);

    private final Vertx vertx;
    private final ConnectionContext connectionContext;
    private final RetryPolicy retryPolicy;
    private final MaintenanceSchedule schedule;
    private final TransportMetrics metrics;
    private final int batchSize;
    private final Duration flushTimeout;
    private final String processMetricsSql;
    private final String purgeTopologySql;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final WakeSignal stop = new WakeSignal();
    private final Promise<Void> readyPromise = Promise.promise();
    private final Promise<Void> completedPromise = Promise.promise();

    private Future<Void> stopSignal;
    private Context context;

    public MaintenanceAgent(Vertx vertx, ConnectionContext connectionContext, RetryPolicy retryPolicy,
                            MaintenanceSchedule schedule, int batchSize, TransportMetrics metrics) {
        this(vertx, connectionContext, retryPolicy, schedule, batchSize, metrics,
            PgTransportDefaults.MAINTENANCE_FLUSH_TIMEOUT);
    }

    public MaintenanceAgent(Vertx vertx, ConnectionContext connectionContext, RetryPolicy retryPolicy,
                            MaintenanceSchedule schedule, int batchSize, TransportMetrics metrics,
                            Duration flushTimeout) {
        this.vertx = Objects.requireNonNull(vertx, "vertx cannot be null");
        this.connectionContext = Objects.requireNonNull(connectionContext, "connectionContext cannot be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy cannot be null");
        this.schedule = Objects.requireNonNull(schedule, "schedule cannot be null");
        this.metrics = metrics != null ? metrics : TransportMetrics.noop();
        this.batchSize = batchSize;
        this.flushTimeout = Objects.requireNonNull(flushTimeout, "flushTimeout cannot be null");
        this.processMetricsSql = SqlStatements.processMetrics(connectionContext.getSchema());
        this.purgeTopologySql = SqlStatements.purgeTopology(connectionContext.getSchema());
    }

    @Override
    public String name() {
        return "maintenance-agent";
    }

    @Override
    public Future<Void> start(Future<Void> stopSignal) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Maintenance agent already started");
        }
        this.stopSignal = Objects.requireNonNull(stopSignal, "stopSignal cannot be null");
        this.context = vertx.getOrCreateContext();
        stopSignal.onComplete(ar -> stop.fire());
        context.runOnContext(v -> {
            readyPromise.tryComplete();
            scheduleNext();
        });
        return completedPromise.future();
    }

    @Override
    public Future<Void> ready() {
        return readyPromise.future();
    }

    @Override
    public Future<Void> completed() {
        return completedPromise.future();
    }

    public MaintenanceSchedule getSchedule() {
        return schedule;
    }

    private void scheduleNext() {
        if (stop.isFired()) {
            flushOnStop();
            return;
        }
        Duration interval = schedule.nextMaintenanceInterval();
        logger.debug("Next maintenance in {} ms", interval.toMillis());
        Waits.delay(vertx, interval, stop)
            .onComplete(ar -> context.runOnContext(v -> {
                if (ar.succeeded() && ar.result() && !stop.isFired()) {
                    runCycle();
                } else {
                    flushOnStop();
                }
            }));
    }

    private void runCycle() {
        retryPolicy.retry(() -> performMaintenance(stopSignal), stopSignal)
            .onComplete(ar -> {
                if (ar.failed()) {
                    if (ar.cause() instanceof CancellationException) {
                        logger.debug("Maintenance cancelled: {}", ar.cause().getMessage());
                    } else {
                        logger.warn("PostgreSQL maintenance faulted: {}", ar.cause().getMessage());
                        metrics.recordAgentFault(name());
                    }
                }
                context.runOnContext(v -> scheduleNext());
            });
    }

    private Future<Void> performMaintenance(Future<?> cancellation) {
        return processMetrics(cancellation).compose(processed -> {
            if (!schedule.isPurgeDue()) {
                return Future.succeededFuture();
            }
            return purgeTopology(cancellation).onSuccess(purged -> {
                schedule.recordPurge();
                logger.debug("Next topology purge due after {}", schedule.getCleanupInterval());
            }).mapEmpty();
        });
    }

    private Future<Long> processMetrics(Future<?> cancellation) {
        return connectionContext.<Long>query(
                (connection, transaction) -> connection.executeScalar(processMetricsSql, Tuple.of(batchSize)),
                cancellation)
            .onSuccess(rows -> {
                metrics.recordMaintenanceRun();
                logger.debug("Processed metrics: {}", rows);
            });
    }

    private Future<Long> purgeTopology(Future<?> cancellation) {
        return connectionContext.<Long>query(
                (connection, transaction) -> connection.executeScalar(purgeTopologySql, Tuple.tuple()),
                cancellation)
            .onSuccess(purged -> {
                metrics.recordMaintenancePurge();
                logger.debug("Purged topology: {}", purged);
            });
    }

    private void flushOnStop() {
        if (completedPromise.future().isComplete()) {
            return;
        }
        Promise<Void> deadline = Promise.promise();
        long timerId = vertx.setTimer(Math.max(1, flushTimeout.toMillis()), id -> {
            if (deadline.tryComplete()) {
                logger.warn("Final maintenance did not finish within {} ms", flushTimeout.toMillis());
            }
        });

        processMetrics(deadline.future())
            .transform(ar -> {
                if (ar.failed()) {
                    logger.debug("Final metrics processing failed: {}", ar.cause().getMessage());
                }
                if (schedule.hasPurged()) {
                    return Future.<Void>succeededFuture();
                }
                return purgeTopology(deadline.future())
                    .onSuccess(purged -> schedule.recordPurge())
                    .<Void>mapEmpty()
                    .recover(err -> {
                        logger.debug("Final topology purge failed: {}", err.getMessage());
                        return Future.succeededFuture();
                    });
            })
            .onComplete(ar -> deadline.tryComplete());

        deadline.future().onComplete(ar -> {
            vertx.cancelTimer(timerId);
            logger.info("Maintenance agent stopped");
            completedPromise.tryComplete();
        });
    }
}
