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
import dev.mars.pgtransport.test.categories.TestCategories;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class DefaultTransportSupervisorTest {

    private final DefaultTransportSupervisor supervisor = new DefaultTransportSupervisor();

    @Test
    void agentsStartWithSharedStopSignal() {
        RecordingAgent first = new RecordingAgent("first");
        RecordingAgent second = new RecordingAgent("second");

        supervisor.addConsumeAgent(first);
        supervisor.addConsumeAgent(second);

        assertSame(supervisor.stopping(), first.stopSignal);
        assertSame(supervisor.stopping(), second.stopSignal);
        assertFalse(supervisor.stopping().isComplete());
    }

    @Test
    void stopCompletesWhenEveryAgentHasCompleted() {
        RecordingAgent fast = new RecordingAgent("fast");
        RecordingAgent slow = new RecordingAgent("slow");
        supervisor.addConsumeAgent(fast);
        supervisor.addConsumeAgent(slow);

        Future<Void> stopped = supervisor.stop();

        assertTrue(supervisor.stopping().isComplete());
        assertTrue(fast.completed().succeeded());
        assertFalse(stopped.isComplete());

        slow.finish();

        assertTrue(stopped.succeeded());
    }

    @Test
    void cannotAddAgentWhileStopping() {
        supervisor.stop();

        assertThrows(IllegalStateException.class, () -> supervisor.addConsumeAgent(new RecordingAgent("late")));
    }

    @Test
    void stopWithoutAgentsCompletesImmediately() {
        assertTrue(supervisor.stop().succeeded());
    }

    private static final class RecordingAgent implements TransportAgent {
        private final String name;
        private final Promise<Void> completed = Promise.promise();
        private Future<Void> stopSignal;

        private RecordingAgent(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Future<Void> start(Future<Void> stopSignal) {
            this.stopSignal = stopSignal;
            if (!"slow".equals(name)) {
                stopSignal.onComplete(ar -> completed.tryComplete());
            }
            return completed.future();
        }

        void finish() {
            completed.tryComplete();
        }

        @Override
        public Future<Void> ready() {
            return Future.succeededFuture();
        }

        @Override
        public Future<Void> completed() {
            return completed.future();
        }
    }
}
