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
import io.vertx.core.Promise;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A one-shot signal that can be observed and explicitly fired.
 *
 * <p>Once fired a signal stays fired; callers that need to wait again obtain a fresh
 * instance. Listeners registered with {@link #onFire(Runnable)} run exactly once, on the
 * firing thread, unless their registration is cancelled first.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public final class WakeSignal {

    private final AtomicBoolean fired = new AtomicBoolean(false);
    private final Set<Runnable> listeners = ConcurrentHashMap.newKeySet();

    /**
     * Fires the signal.
     *
     * @return true if this call fired it, false if it had already fired
     */
    public boolean fire() {
        if (!fired.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable listener : listeners) {
            if (listeners.remove(listener)) {
                listener.run();
            }
        }
        return true;
    }

    public boolean isFired() {
        return fired.get();
    }

    /**
     * Registers a listener run when the signal fires, immediately if it already has.
     *
     * @param listener the listener
     * @return a registration that removes the listener when cancelled
     */
    public Registration onFire(Runnable listener) {
        Runnable wrapper = listener::run;
        listeners.add(wrapper);
        if (fired.get() && listeners.remove(wrapper)) {
            wrapper.run();
        }
        return () -> listeners.remove(wrapper);
    }

    /**
     * @return a future completed when the signal fires
     */
    public Future<Void> future() {
        Promise<Void> promise = Promise.promise();
        onFire(promise::tryComplete);
        return promise.future();
    }

    @Override
    public String toString() {
        return "WakeSignal{fired=" + isFired() + "}";
    }

    /**
     * Handle of a listener added with {@link #onFire(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration {

        /**
         * Removes the listener. Has no effect once the listener has run.
         */
        void cancel();
    }
}
