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
package dev.mars.pgtransport.db.retry;

import dev.mars.pgtransport.api.retry.RetryPolicy;
import dev.mars.pgtransport.db.PgTransportDefaults;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Retry policy that re-attempts immediately, without backoff, while failures match a predicate.
 *
 * <p>The last failure is propagated unchanged once attempts are exhausted or a failure does
 * not match. A completed cancellation future stops further attempts with a
 * {@link CancellationException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class ImmediateRetryPolicy implements RetryPolicy {

    private static final Logger logger = LoggerFactory.getLogger(ImmediateRetryPolicy.class);

    private final int maxAttempts;
    private final Predicate<Throwable> retryable;

    /**
     * @param maxAttempts total attempts, the first one included
     * @param retryable   decides whether a failure is worth another attempt
     */
    public ImmediateRetryPolicy(int maxAttempts, Predicate<Throwable> retryable) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.retryable = Objects.requireNonNull(retryable, "retryable cannot be null");
    }

    /**
     * Policy retrying PostgreSQL transient errors as classified by {@link PgTransientErrors}.
     */
    public static ImmediateRetryPolicy forPostgres(int maxAttempts) {
        return new ImmediateRetryPolicy(maxAttempts, PgTransientErrors::isTransient);
    }

    public static ImmediateRetryPolicy forPostgres() {
        return forPostgres(PgTransportDefaults.DEFAULT_RETRY_ATTEMPTS);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    @Override
    public <T> Future<T> retry(Supplier<Future<T>> operation, Future<?> cancellation) {
        Promise<T> promise = Promise.promise();
        executeAttempt(operation, cancellation, 1, promise);
        return promise.future();
    }

    private <T> void executeAttempt(Supplier<Future<T>> operation, Future<?> cancellation,
                                    int attempt, Promise<T> promise) {
        if (cancellation != null && cancellation.isComplete()) {
            promise.fail(new CancellationException("Operation cancelled before attempt " + attempt));
            return;
        }
        Future<T> future;
        try {
            future = operation.get();
        } catch (Throwable e) {
            onFailure(operation, cancellation, attempt, promise, e);
            return;
        }
        future.onComplete(ar -> {
            if (ar.succeeded()) {
                promise.complete(ar.result());
            } else {
                onFailure(operation, cancellation, attempt, promise, ar.cause());
            }
        });
    }

    private <T> void onFailure(Supplier<Future<T>> operation, Future<?> cancellation,
                               int attempt, Promise<T> promise, Throwable error) {
        if (attempt < maxAttempts && retryable.test(error)) {
            logger.debug("Transient failure on attempt {}/{}, retrying: {}", attempt, maxAttempts, error.getMessage());
            executeAttempt(operation, cancellation, attempt + 1, promise);
        } else {
            if (attempt > 1) {
                logger.debug("Giving up after {} attempt(s): {}", attempt, error.getMessage());
            }
            promise.fail(error);
        }
    }
}
