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
package dev.mars.pgtransport.db.supervisor;

import dev.mars.pgtransport.api.agent.TransportAgent;
import dev.mars.pgtransport.api.agent.TransportSupervisor;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Supervisor that starts registered agents with one shared stop signal.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class DefaultTransportSupervisor implements TransportSupervisor {

    private static final Logger logger = LoggerFactory.getLogger(DefaultTransportSupervisor.class);

    private final Promise<Void> stopping = Promise.promise();
    private final List<TransportAgent> agents = new CopyOnWriteArrayList<>();

    @Override
    public Future<Void> stopping() {
        return stopping.future();
    }

    @Override
    public synchronized void addConsumeAgent(TransportAgent agent) {
        if (stopping.future().isComplete()) {
            throw new IllegalStateException("Supervisor is stopping, cannot add agent " + agent.name());
        }
        agents.add(agent);
        agent.start(stopping.future());
        logger.debug("Started agent {}", agent.name());
    }

    @Override
    public Future<Void> stop() {
        List<Future<Void>> completions;
        synchronized (this) {
            if (stopping.tryComplete()) {
                logger.info("Stopping {} transport agent(s)", agents.size());
            }
            completions = new ArrayList<>();
            for (TransportAgent agent : agents) {
                completions.add(agent.completed());
            }
        }
        return Future.join(completions)
            .<Void>mapEmpty()
            .onComplete(ar -> logger.debug("All transport agents completed"));
    }

    public List<TransportAgent> getAgents() {
        return List.copyOf(agents);
    }
}
