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

import dev.mars.pgtransport.test.categories.TestCategories;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.pgclient.PgException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ImmediateRetryPolicy}.
 */
@Tag(TestCategories.CORE)
class ImmediateRetryPolicyTest {

    private final ImmediateRetryPolicy policy = ImmediateRetryPolicy.forPostgres(10);

    @Test
    void transientFailuresAreRetriedUntilAttemptsRunOut() {
        PgException deadlock = PgTransientErrorsTest.pgError("40P01");
        AtomicInteger attempts = new AtomicInteger();

        Future<String> result = policy.retry(() -> {
            attempts.incrementAndGet();
            return Future.failedFuture(deadlock);
        });

        assertTrue(result.failed());
        assertSame(deadlock, result.cause());
        assertEquals(10, attempts.get());
    }

    @Test
    void permanentFailureIsNotRetried() {
        PgException uniqueViolation = PgTransientErrorsTest.pgError("23505");
        AtomicInteger attempts = new AtomicInteger();

        Future<String> result = policy.retry(() -> {
            attempts.incrementAndGet();
            return Future.failedFuture(uniqueViolation);
        });

        assertSame(uniqueViolation, result.cause());
        assertEquals(1, attempts.get());
    }

    @Test
    void succeedsAfterTransientFailures() {
        AtomicInteger attempts = new AtomicInteger();

        Future<String> result = policy.retry(() -> attempts.incrementAndGet() < 3
            ? Future.failedFuture(PgTransientErrorsTest.pgError("40001"))
            : Future.succeededFuture("done"));

        assertEquals("done", result.result());
        assertEquals(3, attempts.get());
    }

    @Test
    void synchronousThrowIsTreatedAsFailure() {
        AtomicInteger attempts = new AtomicInteger();

        Future<String> result = policy.retry(() -> {
            if (attempts.incrementAndGet() == 1) {
                throw PgTransientErrorsTest.pgError("40001");
            }
            return Future.succeededFuture("recovered");
        });

        assertEquals("recovered", result.result());
        assertEquals(2, attempts.get());
    }

    @Test
    void completedCancellationStopsFurtherAttempts() {
        Promise<Void> cancellation = Promise.promise();
        AtomicInteger attempts = new AtomicInteger();

        Future<String> result = policy.retry(() -> {
            attempts.incrementAndGet();
            cancellation.tryComplete();
            return Future.failedFuture(PgTransientErrorsTest.pgError("40001"));
        }, cancellation.future());

        assertInstanceOf(CancellationException.class, result.cause());
        assertEquals(1, attempts.get());
    }

    @Test
    void customPredicateDecidesRetries() {
        ImmediateRetryPolicy everything = new ImmediateRetryPolicy(4, error -> true);
        AtomicInteger attempts = new AtomicInteger();

        Future<Void> result = everything.retry(() -> {
            attempts.incrementAndGet();
            return Future.failedFuture(new IllegalStateException("always"));
        });

        assertTrue(result.failed());
        assertEquals(4, attempts.get());
    }

    @Test
    void rejectsInvalidAttempts() {
        assertThrows(IllegalArgumentException.class, () -> new ImmediateRetryPolicy(0, error -> true));
    }
}
