/*
 * Copyright 2024 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.foldstream.retry;

import org.foldstream.retry.internal.RetryImpl;

import java.time.Duration;
import java.util.function.BiConsumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;
import static org.foldstream.retry.internal.RetryExecution.executeWithRetry;

/**
 * Retry strategy to use if an action throws an exception. A {@code RetryStrategy} is immutable, every configuration method
 * returns a new instance:
 * <pre>
 * RetryStrategy retryStrategy = RetryStrategy.fixed(200).maxAttempts(5).retryIf(StreamUnavailableException.class::isInstance);
 * retryStrategy.execute(() -> something());
 * </pre>
 */
public interface RetryStrategy {

    /**
     * @return A strategy that retries every {@link RuntimeException}, without backoff, an infinite number of times
     */
    static Retry retry() {
        return new RetryImpl();
    }

    /**
     * @return A strategy that never retries
     */
    static DontRetry none() {
        return DontRetry.INSTANCE;
    }

    static Retry fixed(Duration duration) {
        return retry().backoff(Backoff.fixed(duration));
    }

    static Retry fixed(long millis) {
        return retry().backoff(Backoff.fixed(millis));
    }

    static Retry exponentialBackoff(Duration initial, Duration max, double multiplier) {
        return retry().backoff(Backoff.exponential(initial, max, multiplier));
    }

    /**
     * Execute the supplier with the configured retry settings. The exception of the last attempt is rethrown when the
     * strategy is exhausted or the exception isn't retryable.
     */
    default <T> T execute(Supplier<T> supplier) {
        requireNonNull(supplier, Supplier.class.getSimpleName() + " cannot be null");
        return executeWithRetry(supplier, this);
    }

    default void execute(Runnable runnable) {
        requireNonNull(runnable, Runnable.class.getSimpleName() + " cannot be null");
        executeWithRetry(() -> {
            runnable.run();
            return null;
        }, this);
    }

    final class DontRetry implements RetryStrategy {
        private static final DontRetry INSTANCE = new DontRetry();

        private DontRetry() {
        }

        @Override
        public String toString() {
            return DontRetry.class.getSimpleName();
        }
    }

    interface Retry extends RetryStrategy {

        Retry backoff(Backoff backoff);

        /**
         * Retry an infinite number of times (this is default)
         */
        Retry infiniteAttempts();

        /**
         * @param maxAttempts The max number of times the action is invoked, the first invocation included
         */
        Retry maxAttempts(int maxAttempts);

        /**
         * Only retry if the predicate is {@code true} for the thrown exception. Replaces any previous retry predicate.
         */
        Retry retryIf(Predicate<Throwable> retryPredicate);

        /**
         * Invoked for every exception that will be retried, before waiting for the backoff
         */
        Retry onRetryableError(BiConsumer<RetryInfo, Throwable> retryableErrorListener);
    }
}
