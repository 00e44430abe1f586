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

import dev.mars.pgtransport.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class TransportMetricsTest {

    @Test
    void unboundMetricsAreNoOps() {
        TransportMetrics metrics = TransportMetrics.noop();

        assertDoesNotThrow(() -> {
            metrics.recordNotificationReceived();
            metrics.recordWakeupDelivered();
            metrics.recordListenReconnect();
            metrics.recordMaintenanceRun();
            metrics.recordMaintenancePurge();
            metrics.recordAgentFault("agent");
            metrics.setSubscribedQueues(3);
        });
    }

    @Test
    void boundMetricsAreRecordedWithInstanceTag() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        TransportMetrics metrics = new TransportMetrics("node-1");
        metrics.bindTo(registry);

        metrics.recordNotificationReceived();
        metrics.recordNotificationReceived();
        metrics.recordWakeupDelivered();
        metrics.recordMaintenancePurge();
        metrics.setSubscribedQueues(5);

        assertEquals(2.0, registry.get("pgtransport.notifications.received").tag("instance", "node-1").counter().count());
        assertEquals(1.0, registry.get("pgtransport.wakeups.delivered").counter().count());
        assertEquals(0.0, registry.get("pgtransport.listen.reconnects").counter().count());
        assertEquals(1.0, registry.get("pgtransport.maintenance.purges").counter().count());
        assertEquals(0.0, registry.get("pgtransport.maintenance.runs").counter().count());
        assertEquals(0.0, registry.get("pgtransport.agent.faults").counter().count());
        assertEquals(5.0, registry.get("pgtransport.subscriptions.active").gauge().value());
    }
}
