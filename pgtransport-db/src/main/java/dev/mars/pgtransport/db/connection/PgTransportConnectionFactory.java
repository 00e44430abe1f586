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

import dev.mars.pgtransport.api.connection.TransportConnection;
import dev.mars.pgtransport.api.connection.TransportConnectionFactory;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.PgConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Opens dedicated, non-pooled PostgreSQL connections. Subscription connections must not
 * come from a pool because {@code LISTEN} state belongs to the session.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class PgTransportConnectionFactory implements TransportConnectionFactory {

    private static final Logger logger = LoggerFactory.getLogger(PgTransportConnectionFactory.class);

    private final Vertx vertx;
    private final PgConnectOptions connectOptions;

    public PgTransportConnectionFactory(Vertx vertx, PgConnectOptions connectOptions) {
        this.vertx = Objects.requireNonNull(vertx, "vertx cannot be null");
        this.connectOptions = Objects.requireNonNull(connectOptions, "connectOptions cannot be null");
    }

    @Override
    public Future<TransportConnection> connect() {
        logger.debug("Opening connection to {}:{}/{}",
            connectOptions.getHost(), connectOptions.getPort(), connectOptions.getDatabase());
        return PgConnection.connect(vertx, connectOptions)
            .<TransportConnection>map(PgTransportConnection::new);
    }
}
