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
import dev.mars.pgtransport.test.categories.TestCategories;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@Tag(TestCategories.CORE)
@ExtendWith(VertxExtension.class)
class WaitsTest {

    @Test
    void timeoutEndsWait(Vertx vertx, VertxTestContext testContext) {
        WakeSignal signal = new WakeSignal();

        Waits.delay(vertx, Duration.ofMillis(50), signal)
            .onComplete(testContext.succeeding(elapsed -> testContext.verify(() -> {
                assertTrue(elapsed);
                assertFalse(signal.isFired());
                testContext.completeNow();
            })));
    }

    @Test
    void signalInterruptsDelay(Vertx vertx) {
        WakeSignal signal = new WakeSignal();
        Future<Boolean> delay = Waits.delay(vertx, Duration.ofSeconds(30), signal);

        signal.fire();

        await().atMost(1, TimeUnit.SECONDS).until(delay::isComplete);
        assertFalse(delay.result());
    }

    @Test
    void alreadyFiredSignalCompletesImmediately(Vertx vertx) {
        WakeSignal fired = new WakeSignal();
        fired.fire();

        assertTrue(Waits.any(vertx, Duration.ofSeconds(30), null, fired).isComplete());
    }

    @Test
    void cancellationEndsWait(Vertx vertx) {
        Promise<Void> cancellation = Promise.promise();
        Future<Void> wait = Waits.any(vertx, null, cancellation.future(), new WakeSignal());

        cancellation.complete();

        assertTrue(wait.succeeded());
    }

    @Test
    void repeatedWaitsOnOneCancellationAddOneHandler(Vertx vertx) {
        Future<Void> cancellation = spy(Promise.<Void>promise().future());

        for (int i = 0; i < 200; i++) {
            Future<Void> wait = Waits.any(vertx, Duration.ofMillis(1), cancellation, new WakeSignal());
            await().atMost(1, TimeUnit.SECONDS).until(wait::isComplete);
        }

        verify(cancellation, times(1)).onComplete(org.mockito.ArgumentMatchers.<io.vertx.core.Handler<io.vertx.core.AsyncResult<Void>>>any());
        assertFalse(Waits.cancellationSignal(cancellation).isFired());
    }

    @Test
    void cancellationSignalIsSharedAndFiresOnCompletion() {
        Promise<Void> cancellation = Promise.promise();
        WakeSignal mirror = Waits.cancellationSignal(cancellation.future());

        assertSame(mirror, Waits.cancellationSignal(cancellation.future()));
        cancellation.complete();

        assertTrue(mirror.isFired());
    }

    @Test
    void completedCancellationEndsWaitWithoutTimer(Vertx vertx) {
        Future<Void> wait = Waits.any(vertx, Duration.ofSeconds(30), Future.succeededFuture(), new WakeSignal());

        assertTrue(wait.succeeded());
    }
}
