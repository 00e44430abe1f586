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

import dev.mars.pgtransport.api.agent.TransportAgent;
import dev.mars.pgtransport.api.agent.WakeSignal;
import dev.mars.pgtransport.api.connection.TransportConnection;
import dev.mars.pgtransport.api.connection.TransportConnectionFactory;
import dev.mars.pgtransport.api.connection.TransportNotification;
import dev.mars.pgtransport.api.retry.RetryPolicy;
import dev.mars.pgtransport.db.PgTransportDefaults;
import dev.mars.pgtransport.db.metrics.TransportMetrics;
import dev.mars.pgtransport.db.util.Waits;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Multiplexes per-queue wake signals onto one subscription connection.
 *
 * <p>Consumers obtain a signal per queue with {@link #getSignalForQueue(long)}. The agent keeps
 * a dedicated connection on which every known queue's channel is {@code LISTEN}ed, and fires a
 * queue's signal when a notification arrives on its channel. A queue seen for the first time
 * interrupts the agent's idle wait so that it is subscribed without reconnecting.</p>
 *
 * <p>When the connection is lost the agent closes it, forgets its subscriptions and reconnects
 * after a backoff that starts at one second and doubles up to thirty seconds. Only the stop
 * signal ends the loop.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class NotificationAgent implements TransportAgent {

    private static final Logger logger = LoggerFactory.getLogger(NotificationAgent.class);

    public enum State {
        IDLE,
        CONNECTING,
        SUBSCRIBED,
        WAITING,
        FAULTED,
        STOPPED
    }

    private final Vertx vertx;
    private final TransportConnectionFactory connectionFactory;
    private final RetryPolicy retryPolicy;
    private final TransportMetrics metrics;
    private final long initialBackoffMs;
    private final long maxBackoffMs;

    private final WakeSignalTable signals = new WakeSignalTable();
    private final AtomicReference<WakeSignal> restartSignal = new AtomicReference<>(new WakeSignal());
    private final Set<Long> subscribed = ConcurrentHashMap.newKeySet();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final WakeSignal stop = new WakeSignal();
    private final Promise<Void> readyPromise = Promise.promise();
    private final Promise<Void> completedPromise = Promise.promise();

    private volatile State state = State.IDLE;
    private volatile Session session;
    private volatile long backoffMs;
    private Future<Void> stopSignal;
    private Context context;

    public NotificationAgent(Vertx vertx, TransportConnectionFactory connectionFactory,
                             RetryPolicy retryPolicy, TransportMetrics metrics) {
        this(vertx, connectionFactory, retryPolicy, metrics,
            Duration.ofMillis(PgTransportDefaults.LISTEN_RECONNECT_INITIAL_BACKOFF_MS),
            Duration.ofMillis(PgTransportDefaults.LISTEN_RECONNECT_MAX_BACKOFF_MS));
    }

    public NotificationAgent(Vertx vertx, TransportConnectionFactory connectionFactory,
                             RetryPolicy retryPolicy, TransportMetrics metrics,
                             Duration initialBackoff, Duration maxBackoff) {
        this.vertx = Objects.requireNonNull(vertx, "vertx cannot be null");
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory cannot be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy cannot be null");
        this.metrics = metrics != null ? metrics : TransportMetrics.noop();
        this.initialBackoffMs = Math.max(1, initialBackoff.toMillis());
        this.maxBackoffMs = Math.max(initialBackoffMs, maxBackoff.toMillis());
        this.backoffMs = initialBackoffMs;
    }

    @Override
    public String name() {
        return "notification-agent";
    }

    @Override
    public Future<Void> start(Future<Void> stopSignal) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Notification agent already started");
        }
        this.stopSignal = Objects.requireNonNull(stopSignal, "stopSignal cannot be null");
        this.context = vertx.getOrCreateContext();
        stopSignal.onComplete(ar -> stop.fire());
        context.runOnContext(v -> connect());
        return completedPromise.future();
    }

    @Override
    public Future<Void> ready() {
        return readyPromise.future();
    }

    @Override
    public Future<Void> completed() {
        return completedPromise.future();
    }

    /**
     * Returns the queue's current unfired wake signal, creating it and scheduling the queue's
     * subscription if the queue is new.
     */
    public WakeSignal getSignalForQueue(long queueId) {
        return signals.getOrCreate(queueId, this::requestRestart);
    }

    /**
     * Replaces the queue's signal with a fresh one if {@code expected} is still current.
     *
     * @return the fresh signal, or the current one when another caller rotated first
     */
    public WakeSignal rotateSignal(long queueId, WakeSignal expected) {
        WakeSignal rotated = signals.rotate(queueId, expected);
        return rotated != null ? rotated : getSignalForQueue(queueId);
    }

    public WakeSignal rotateSignal(long queueId) {
        WakeSignal current = signals.find(queueId);
        return current == null ? getSignalForQueue(queueId) : rotateSignal(queueId, current);
    }

    public State getState() {
        return state;
    }

    public boolean isStarted() {
        return started.get();
    }

    /**
     * @return true while a subscription connection is established
     */
    public boolean isConnected() {
        return session != null;
    }

    /**
     * @return a sorted snapshot of the queues subscribed on the current connection
     */
    public Set<Long> subscribedQueueIds() {
        return new TreeSet<>(subscribed);
    }

    /**
     * @return a sorted snapshot of every queue with a wake signal
     */
    public Set<Long> knownQueueIds() {
        return signals.queueIds();
    }

    private void requestRestart() {
        logger.debug("New queue registered, interrupting subscription wait");
        restartSignal.get().fire();
    }

    /**
     * Installs a fresh restart signal if the current one has fired. Requests made before this
     * call are covered by the subscription pass that follows it.
     */
    private void resetRestartSignal() {
        WakeSignal current = restartSignal.get();
        if (current.isFired()) {
            restartSignal.compareAndSet(current, new WakeSignal());
        }
    }

    private void connect() {
        if (stop.isFired()) {
            shutdown(null);
            return;
        }
        state = State.CONNECTING;
        retryPolicy.retry(this::openSession, stopSignal)
            .onComplete(ar -> context.runOnContext(v -> {
                if (ar.failed()) {
                    onFault(null, ar.cause());
                    return;
                }
                Session opened = ar.result();
                if (stop.isFired()) {
                    shutdown(opened);
                    return;
                }
                session = opened;
                backoffMs = initialBackoffMs;
                state = State.SUBSCRIBED;
                logger.info("Subscription connection established, listening on {} queue(s)", subscribed.size());
                readyPromise.tryComplete();
                waitForWork(opened);
            }));
    }

    private Future<Session> openSession() {
        subscribed.clear();
        metrics.setSubscribedQueues(0);
        return connectionFactory.connect().compose(connection -> {
            Session opened = new Session(connection);
            connection.notificationHandler(this::onNotification);
            connection.closeHandler(v -> {
                if (!stop.isFired()) {
                    logger.warn("Subscription connection closed unexpectedly");
                }
                opened.lost.fire();
            });
            connection.exceptionHandler(err -> {
                if (stop.isFired()) {
                    logger.debug("Subscription connection error during shutdown: {}", err.getMessage());
                } else {
                    logger.warn("Subscription connection error: {}", err.getMessage());
                }
                opened.lost.fire();
            });
            resetRestartSignal();
            return subscribeMissing(connection)
                .map(opened)
                .recover(err -> connection.close()
                    .transform(ar -> Future.<Session>failedFuture(err)));
        });
    }

    private Future<Void> subscribeMissing(TransportConnection connection) {
        Future<Void> chain = Future.succeededFuture();
        for (Long queueId : signals.queueIds()) {
            if (subscribed.contains(queueId)) {
                continue;
            }
            String channel = NotificationChannels.channelFor(queueId);
            chain = chain.compose(v -> connection.listen(channel)
                .onSuccess(ok -> {
                    subscribed.add(queueId);
                    metrics.setSubscribedQueues(subscribed.size());
                    logger.debug("Listening on channel {}", channel);
                }));
        }
        return chain;
    }

    private void waitForWork(Session current) {
        state = State.WAITING;
        Waits.any(vertx, null, null, restartSignal.get(), current.lost, stop)
            .onComplete(ar -> context.runOnContext(v -> afterWait(current)));
    }

    private void afterWait(Session current) {
        if (stop.isFired()) {
            shutdown(current);
        } else if (current.lost.isFired()) {
            onFault(current, new IllegalStateException("Subscription connection lost"));
        } else {
            resetRestartSignal();
            subscribeMissing(current.connection)
                .onComplete(ar -> context.runOnContext(v -> {
                    if (ar.succeeded()) {
                        state = State.SUBSCRIBED;
                        waitForWork(current);
                    } else {
                        onFault(current, ar.cause());
                    }
                }));
        }
    }

    private void onFault(Session current, Throwable error) {
        if (stop.isFired()) {
            shutdown(current);
            return;
        }
        if (error instanceof CancellationException) {
            logger.debug("Subscription cancelled: {}", error.getMessage());
        } else {
            logger.warn("Subscription connection faulted: {}", error.getMessage());
            metrics.recordAgentFault(name());
        }
        state = State.FAULTED;
        session = null;
        subscribed.clear();
        metrics.setSubscribedQueues(0);
        if (current != null) {
            current.connection.close();
        }

        long delay = backoffMs;
        backoffMs = Math.min(backoffMs * 2, maxBackoffMs);
        logger.info("Reconnecting subscription connection in {} ms", delay);
        metrics.recordListenReconnect();
        Waits.delay(vertx, Duration.ofMillis(delay), stop)
            .onComplete(ar -> context.runOnContext(v -> connect()));
    }

    private void shutdown(Session current) {
        if (state == State.STOPPED) {
            return;
        }
        state = State.STOPPED;
        session = null;
        subscribed.clear();
        metrics.setSubscribedQueues(0);
        Future<Void> closed = current != null ? current.connection.close() : Future.succeededFuture();
        closed.onComplete(ar -> {
            logger.info("Notification agent stopped");
            readyPromise.tryComplete();
            completedPromise.tryComplete();
        });
    }

    private void onNotification(TransportNotification notification) {
        metrics.recordNotificationReceived();
        OptionalLong queueId = NotificationChannels.parseQueueId(notification.channel());
        if (queueId.isEmpty()) {
            logger.debug("Ignoring notification on unrecognised channel {}", notification.channel());
            return;
        }
        WakeSignal signal = signals.find(queueId.getAsLong());
        if (signal != null && signal.fire()) {
            metrics.recordWakeupDelivered();
            logger.trace("Woke queue {}", queueId.getAsLong());
        }
    }

    private static final class Session {
        private final TransportConnection connection;
        private final WakeSignal lost = new WakeSignal();

        private Session(TransportConnection connection) {
            this.connection = connection;
        }
    }
}
