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

import dev.mars.pgtransport.db.config.PgTransportConfiguration;
import dev.mars.pgtransport.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.Properties;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Lifecycle tests for {@link PgTransportManager} against an unreachable host.
 */
@Tag(TestCategories.CORE)
@ExtendWith(VertxExtension.class)
class PgTransportManagerTest {

    private static PgTransportConfiguration unreachableHost() {
        Properties overrides = new Properties();
        overrides.setProperty(PgTransportConfiguration.HOST, "127.0.0.1");
        overrides.setProperty(PgTransportConfiguration.PORT, "1");
        overrides.setProperty(PgTransportConfiguration.INSTANCE_ID, "manager-test");
        return new PgTransportConfiguration("default", overrides);
    }

    @Test
    void contextIsUnavailableBeforeStart(Vertx vertx) {
        PgTransportManager manager = new PgTransportManager(unreachableHost(), null, vertx);

        assertFalse(manager.isStarted());
        assertThrows(IllegalStateException.class, manager::getConnectionContext);
        assertTrue(PgTransportDriverSetup.isInitialized());
    }

    @Test
    void startRegistersAgentsAndStopCompletesWhileDatabaseIsDown(Vertx vertx) {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        PgTransportManager manager = new PgTransportManager(unreachableHost(), registry, vertx);

        manager.start();
        manager.start();

        assertTrue(manager.isStarted());
        assertEquals(2, manager.getSupervisor().getAgents().size());
        assertEquals("transport", manager.getConnectionContext().getSchema());
        assertNotNull(registry.find("pgtransport.notifications.received").tag("instance", "manager-test").counter());

        Future<Void> closed = manager.closeReactive();

        await().atMost(30, TimeUnit.SECONDS).until(closed::isComplete);
        assertTrue(closed.succeeded());
        assertTrue(manager.getSupervisor().stopping().isComplete());
    }
}
