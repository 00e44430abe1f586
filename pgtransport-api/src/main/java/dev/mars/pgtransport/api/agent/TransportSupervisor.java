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
package dev.mars.pgtransport.api.agent;

import io.vertx.core.Future;

/**
 * Owns the stop signal shared by the agents of one transport host.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public interface TransportSupervisor {

    /**
     * @return the shared stop signal, completed once {@link #stop()} is called
     */
    Future<Void> stopping();

    /**
     * Registers and starts a consume-side agent.
     *
     * @throws IllegalStateException if the supervisor is already stopping
     */
    void addConsumeAgent(TransportAgent agent);

    /**
     * Signals every agent to stop.
     *
     * @return a future completed when every registered agent has completed
     */
    Future<Void> stop();
}
