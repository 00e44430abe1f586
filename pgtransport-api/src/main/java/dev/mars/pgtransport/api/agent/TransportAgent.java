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
 * A long-running background activity owned by a transport host.
 *
 * <p>An agent is started once with the host's stop signal and runs until that signal
 * completes. {@link #ready()} completes when the agent has started its work and
 * {@link #completed()} when it has fully stopped.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public interface TransportAgent {

    String name();

    /**
     * Starts the agent.
     *
     * @param stopSignal completes when the agent must stop
     * @return the running handle, the same future as {@link #completed()}
     * @throws IllegalStateException if the agent was already started
     */
    Future<Void> start(Future<Void> stopSignal);

    Future<Void> ready();

    Future<Void> completed();
}
