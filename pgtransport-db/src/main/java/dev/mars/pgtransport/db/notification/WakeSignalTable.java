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
package dev.mars.pgtransport.db.notification;

import dev.mars.pgtransport.api.agent.WakeSignal;

import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-queue wake signals. Holds at most one live signal per queue identifier.
 *
 * <p>Entries are replaced with a fresh signal after they fire and are never removed.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class WakeSignalTable {

    private final ConcurrentMap<Long, WakeSignal> signals = new ConcurrentHashMap<>();

    /**
     * Returns the queue's unfired signal, creating it when the queue is new.
     *
     * @param queueId  the queue identifier
     * @param onInsert run once, after the entry was created by this call
     * @return an unfired signal at the time of the call
     */
    public WakeSignal getOrCreate(long queueId, Runnable onInsert) {
        AtomicBoolean inserted = new AtomicBoolean(false);
        WakeSignal signal = signals.computeIfAbsent(queueId, id -> {
            inserted.set(true);
            return new WakeSignal();
        });
        if (inserted.get() && onInsert != null) {
            onInsert.run();
        }
        while (signal.isFired()) {
            signal = rotate(queueId, signal);
        }
        return signal;
    }

    /**
     * Replaces {@code expected} with a fresh signal if it is still the queue's current one.
     * Never creates an entry; queues become known only through {@link #getOrCreate}.
     *
     * @return the fresh signal, the current one when another caller rotated first, or
     *         {@code null} when the queue is unknown
     */
    public WakeSignal rotate(long queueId, WakeSignal expected) {
        WakeSignal fresh = new WakeSignal();
        if (signals.replace(queueId, expected, fresh)) {
            return fresh;
        }
        return signals.get(queueId);
    }

    /**
     * @return the current signal of the queue, or {@code null} when the queue is unknown
     */
    public WakeSignal find(long queueId) {
        return signals.get(queueId);
    }

    /**
     * @return a sorted snapshot of the known queue identifiers
     */
    public Set<Long> queueIds() {
        return new TreeSet<>(signals.keySet());
    }

    public int size() {
        return signals.size();
    }
}
