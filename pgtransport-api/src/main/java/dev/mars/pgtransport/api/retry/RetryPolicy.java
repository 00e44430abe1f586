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
package dev.mars.pgtransport.api.retry;

import io.vertx.core.Future;

import java.util.function.Supplier;

/**
 * Retries an asynchronous operation when it fails with an error the policy considers transient.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public interface RetryPolicy {

    /**
     * Runs the operation, retrying transient failures.
     *
     * @param operation    supplies a new attempt each time it is called
     * @param cancellation completes when no further attempt should start; may be {@code null}
     * @return the first successful result, or the failure that ended the attempts
     */
    <T> Future<T> retry(Supplier<Future<T>> operation, Future<?> cancellation);

    default <T> Future<T> retry(Supplier<Future<T>> operation) {
        return retry(operation, null);
    }
}
