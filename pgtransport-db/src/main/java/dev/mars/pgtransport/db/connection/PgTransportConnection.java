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
package dev.mars.pgtransport.db.connection;

import dev.mars.pgtransport.api.connection.IsolationLevel;
import dev.mars.pgtransport.api.connection.TransportConnection;
import dev.mars.pgtransport.api.connection.TransportNotification;
import dev.mars.pgtransport.api.connection.TransportTransaction;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.pgclient.PgConnection;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.Transaction;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * {@link TransportConnection} over a dedicated, non-pooled Vert.x {@link PgConnection}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class PgTransportConnection implements TransportConnection {

    private static final Logger logger = LoggerFactory.getLogger(PgTransportConnection.class);

    private final PgConnection connection;

    public PgTransportConnection(PgConnection connection) {
        this.connection = Objects.requireNonNull(connection, "connection cannot be null");
    }

    /**
     * Begins a transaction and sets its isolation level as the first statement.
     * The transaction is rolled back if the isolation level cannot be applied.
     */
    @Override
    public Future<TransportTransaction> beginTransaction(IsolationLevel isolationLevel) {
        return connection.begin()
            .compose(tx -> connection.query("SET TRANSACTION ISOLATION LEVEL " + isolationLevel.toSql())
                .execute()
                .<TransportTransaction>map(rs -> new PgTransportTransaction(tx))
                .recover(err -> tx.rollback()
                    .transform(ar -> Future.<TransportTransaction>failedFuture(err))));
    }

    @Override
    public Future<Long> executeScalar(String sql, Tuple params) {
        return connection.preparedQuery(sql)
            .execute(params)
            .map(PgTransportConnection::firstLong);
    }

    @Override
    public Future<Integer> execute(String sql, Tuple params) {
        return connection.preparedQuery(sql)
            .execute(params)
            .map(RowSet::rowCount);
    }

    @Override
    public Future<Void> listen(String channel) {
        return connection.query("LISTEN \"" + channel + "\"")
            .execute()
            .mapEmpty();
    }

    @Override
    public TransportConnection notificationHandler(Handler<TransportNotification> handler) {
        connection.notificationHandler(notification -> handler.handle(new TransportNotification(
            notification.getChannel(), notification.getPayload(), notification.getProcessId())));
        return this;
    }

    @Override
    public TransportConnection closeHandler(Handler<Void> handler) {
        connection.closeHandler(handler);
        return this;
    }

    @Override
    public TransportConnection exceptionHandler(Handler<Throwable> handler) {
        connection.exceptionHandler(handler);
        return this;
    }

    @Override
    public Future<Void> close() {
        return connection.close()
            .onFailure(err -> logger.debug("Error closing connection: {}", err.getMessage()));
    }

    private static Long firstLong(RowSet<Row> rows) {
        if (rows.size() == 0) {
            return null;
        }
        Object value = rows.iterator().next().getValue(0);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return null;
    }

    private static final class PgTransportTransaction implements TransportTransaction {

        private final Transaction transaction;

        private PgTransportTransaction(Transaction transaction) {
            this.transaction = transaction;
        }

        @Override
        public Future<Void> commit() {
            return transaction.commit();
        }

        @Override
        public Future<Void> rollback() {
            return transaction.rollback();
        }
    }
}
