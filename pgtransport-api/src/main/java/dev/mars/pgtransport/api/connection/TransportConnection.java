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
package dev.mars.pgtransport.api.connection;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.sqlclient.Tuple;

/**
 * A single open database connection as seen by the transport core.
 *
 * <p>Implementations adapt a concrete driver. Inbound notifications are pushed to the one
 * handler registered through {@link #notificationHandler(Handler)}; the transport core never
 * depends on a driver's own event model.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public interface TransportConnection {

    /**
     * Begins a transaction at the given isolation level.
     *
     * @param isolationLevel the isolation level for the new transaction
     * @return a future completed with the open transaction
     */
    Future<TransportTransaction> beginTransaction(IsolationLevel isolationLevel);

    /**
     * Executes a parameterised statement and returns the first column of the first row.
     *
     * @param sql    the statement, using {@code $n} placeholders
     * @param params the bound parameters
     * @return the scalar value, or {@code null} when the statement produced no row or a null value
     */
    Future<Long> executeScalar(String sql, Tuple params);

    /**
     * Executes a parameterised statement.
     *
     * @return the number of rows affected
     */
    Future<Integer> execute(String sql, Tuple params);

    /**
     * Subscribes this connection to a notification channel.
     */
    Future<Void> listen(String channel);

    TransportConnection notificationHandler(Handler<TransportNotification> handler);

    /**
     * Registers a handler invoked once when the connection is closed, by either side.
     */
    TransportConnection closeHandler(Handler<Void> handler);

    TransportConnection exceptionHandler(Handler<Throwable> handler);

    Future<Void> close();
}
