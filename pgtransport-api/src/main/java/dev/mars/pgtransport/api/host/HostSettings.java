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
package dev.mars.pgtransport.api.host;

import dev.mars.pgtransport.api.connection.IsolationLevel;

import java.time.Duration;

/**
 * Provider-neutral settings of a transport host.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public interface HostSettings {

    String getHost();

    int getPort();

    String getDatabase();

    String getSchema();

    IsolationLevel getIsolationLevel();

    /**
     * Base interval between maintenance cycles, before jitter.
     */
    Duration getMaintenanceInterval();

    /**
     * Base interval between stale topology purges, before jitter.
     */
    Duration getQueueCleanupInterval();

    /**
     * Maximum number of metric rows processed by one maintenance cycle.
     */
    int getMaintenanceBatchSize();
}
