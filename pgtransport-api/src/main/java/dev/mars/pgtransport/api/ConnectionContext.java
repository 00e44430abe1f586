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
package dev.mars.pgtransport.api;

import dev.mars.pgtransport.api.connection.IsolationLevel;
import dev.mars.pgtransport.api.connection.TransportConnection;
import io.vertx.core.Future;

import java.net.URI;
import java.time.Duration;

/**
 * Connection context of a transport host.
 *
 * <p>Opens connections, runs transactional work with transient-failure retry and lets
 * consumers wait for new work on a queue without polling.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public interface ConnectionContext extends AutoCloseable {

    URI getHostAddress();

    String getSchema();

    IsolationLevel getIsolationLevel();

    /**
     * Opens a new physical connection. Failures are not retried.
     *
     * @param cancellation completes when the caller gives up; may be {@code null}
     */
    Future<TransportConnection> createConnection(Future<?> cancellation);

    /**
     * Runs {@code callback} in a transaction on a freshly opened connection.
     *
     * <p>Transient failures of the begin / work / commit sequence are retried on the same
     * connection. Failing to open the connection is not retried.</p>
     *
     * @param callback     the transactional work
     * @param cancellation completes when no further attempt should start; may be {@code null}
     * @return the callback's result once committed
     */
    <T> Future<T> query(QueryCallback<T> callback, Future<?> cancellation);

    default <T> Future<T> query(QueryCallback<T> callback) {
        return query(callback, null);
    }

    /**
     * Waits until the queue may have new work, the timeout elapses or the caller cancels.
     *
     * <p>The returned future always succeeds. A wake is advisory: callers re-check the
     * queue after it completes, whatever the reason.</p>
     *
     * @param queueId      the queue identifier
     * @param timeout      the longest time to wait
     * @param cancellation completes when the caller stops waiting; may be {@code null}
     */
    Future<Void> delayUntilMessageReady(long queueId, Duration timeout, Future<?> cancellation);

    default Future<Void> delayUntilMessageReady(long queueId, Duration timeout) {
        return delayUntilMessageReady(queueId, timeout, null);
    }

    /**
     * Releases the context. Agents are stopped through the supervisor, not here.
     */
    @Override
    void close();
}
