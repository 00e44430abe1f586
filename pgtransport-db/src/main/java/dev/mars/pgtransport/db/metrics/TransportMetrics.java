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
package dev.mars.pgtransport.db.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics of the notification and maintenance agents of one transport host.
 *
 * <p>Recording methods are no-ops until {@link #bindTo(MeterRegistry)} has been called,
 * so agents can record unconditionally.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class TransportMetrics implements MeterBinder {
    private static final Logger logger = LoggerFactory.getLogger(TransportMetrics.class);

    private final String instanceId;
    private volatile MeterRegistry registry;

    private Counter notificationsReceived;
    private Counter wakeupsDelivered;
    private Counter listenReconnects;
    private Counter maintenanceRuns;
    private Counter maintenancePurges;
    private Counter agentFaults;

    private final AtomicLong subscribedQueues = new AtomicLong(0);

    public TransportMetrics(String instanceId) {
        this.instanceId = instanceId;
    }

    /**
     * Metrics instance that is never bound; every recording call is ignored.
     */
    public static TransportMetrics noop() {
        return new TransportMetrics("noop");
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        notificationsReceived = Counter.builder("pgtransport.notifications.received")
            .description("Total number of notifications received on the subscription connection")
            .tag("instance", instanceId)
            .register(registry);

        wakeupsDelivered = Counter.builder("pgtransport.wakeups.delivered")
            .description("Total number of notifications that woke a waiting queue")
            .tag("instance", instanceId)
            .register(registry);

        listenReconnects = Counter.builder("pgtransport.listen.reconnects")
            .description("Total number of subscription connection reconnects")
            .tag("instance", instanceId)
            .register(registry);

        maintenanceRuns = Counter.builder("pgtransport.maintenance.runs")
            .description("Total number of completed metrics processing runs")
            .tag("instance", instanceId)
            .register(registry);

        maintenancePurges = Counter.builder("pgtransport.maintenance.purges")
            .description("Total number of completed topology purges")
            .tag("instance", instanceId)
            .register(registry);

        agentFaults = Counter.builder("pgtransport.agent.faults")
            .description("Total number of faults caught by agent loops")
            .tag("instance", instanceId)
            .register(registry);

        Gauge.builder("pgtransport.subscriptions.active", subscribedQueues::get)
            .description("Number of queues subscribed on the current subscription connection")
            .tag("instance", instanceId)
            .register(registry);

        this.registry = registry;
        logger.debug("Transport metrics bound for instance {}", instanceId);
    }

    public void recordNotificationReceived() {
        if (registry != null) {
            notificationsReceived.increment();
        }
    }

    public void recordWakeupDelivered() {
        if (registry != null) {
            wakeupsDelivered.increment();
        }
    }

    public void recordListenReconnect() {
        if (registry != null) {
            listenReconnects.increment();
        }
    }

    public void recordMaintenanceRun() {
        if (registry != null) {
            maintenanceRuns.increment();
        }
    }

    public void recordMaintenancePurge() {
        if (registry != null) {
            maintenancePurges.increment();
        }
    }

    public void recordAgentFault(String agent) {
        if (registry != null) {
            agentFaults.increment();
        }
        logger.trace("Fault recorded for agent {}", agent);
    }

    public void setSubscribedQueues(int count) {
        subscribedQueues.set(count);
    }

    public String getInstanceId() {
        return instanceId;
    }
}
