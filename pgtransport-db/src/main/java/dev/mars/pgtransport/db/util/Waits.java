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
package dev.mars.pgtransport.db.util;

import dev.mars.pgtransport.api.agent.WakeSignal;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.WeakHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Combined waits over signals, an optional timeout and an optional caller cancellation.
 *
 * <p>Every listener and timer registered for a wait is released as soon as the wait
 * completes, so long-lived signals do not accumulate listeners from finished waits.
 * A cancellation future is observed through a {@link WakeSignal} mirror created on first
 * use, so repeated waits on the same future add a single handler to it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public final class Waits {

    // Keys are held weakly; the mirror signal does not reference its future.
    private static final Map<Future<?>, WakeSignal> CANCELLATION_SIGNALS =
        Collections.synchronizedMap(new WeakHashMap<>());

    private Waits() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Waits for whichever comes first: one of the signals fires, the timeout elapses or the
     * cancellation future completes.
     *
     * <p>The returned future always succeeds. Callers inspect the signals afterwards to
     * find out why the wait ended.</p>
     *
     * @param vertx        used for the timeout timer
     * @param timeout      the longest time to wait, or {@code null} for no timeout
     * @param cancellation completes when the caller stops waiting, or {@code null}
     * @param signals      the signals to wait on
     * @return a future completed when the wait ends
     */
    public static Future<Void> any(Vertx vertx, Duration timeout, Future<?> cancellation, WakeSignal... signals) {
        Promise<Void> promise = Promise.promise();
        if (cancellation != null && cancellation.isComplete()) {
            promise.complete();
            return promise.future();
        }

        List<WakeSignal.Registration> registrations = new CopyOnWriteArrayList<>();
        AtomicLong timerId = new AtomicLong(-1);

        promise.future().onComplete(ar -> {
            registrations.forEach(WakeSignal.Registration::cancel);
            long id = timerId.get();
            if (id >= 0) {
                vertx.cancelTimer(id);
            }
        });

        if (cancellation != null) {
            registrations.add(cancellationSignal(cancellation).onFire(promise::tryComplete));
        }
        for (WakeSignal signal : signals) {
            if (signal != null) {
                registrations.add(signal.onFire(promise::tryComplete));
            }
        }
        if (promise.future().isComplete()) {
            registrations.forEach(WakeSignal.Registration::cancel);
        }
        if (timeout != null && !promise.future().isComplete()) {
            long delayMs = Math.max(1, timeout.toMillis());
            timerId.set(vertx.setTimer(delayMs, id -> promise.tryComplete()));
            if (promise.future().isComplete()) {
                vertx.cancelTimer(timerId.get());
            }
        }
        return promise.future();
    }

    /**
     * Waits for the given duration unless one of the interrupting signals fires first.
     *
     * @return a future completed with {@code true} if the full duration elapsed
     */
    public static Future<Boolean> delay(Vertx vertx, Duration duration, WakeSignal... interrupts) {
        return any(vertx, duration, null, interrupts).map(v -> {
            for (WakeSignal interrupt : interrupts) {
                if (interrupt != null && interrupt.isFired()) {
                    return false;
                }
            }
            return true;
        });
    }

    /**
     * Returns the signal mirroring {@code cancellation}, registering a handler on the future
     * only the first time the future is seen.
     */
    static WakeSignal cancellationSignal(Future<?> cancellation) {
        return CANCELLATION_SIGNALS.computeIfAbsent(cancellation, future -> {
            WakeSignal signal = new WakeSignal();
            future.onComplete(ar -> signal.fire());
            return signal;
        });
    }
}
