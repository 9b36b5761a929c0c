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

package org.foldstream.retry.internal;

import org.foldstream.retry.Backoff;
import org.foldstream.retry.RetryInfo;
import org.foldstream.retry.RetryStrategy;
import org.jspecify.annotations.NullMarked;

import java.util.StringJoiner;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;

/**
 * A retry strategy that does retry. By default there's no backoff, an infinite number of attempts, every exception is
 * retried and nothing is notified.
 */
@NullMarked
public final class RetryImpl implements RetryStrategy.Retry {
    private static final BiConsumer<RetryInfo, Throwable> NOOP_RETRYABLE_ERROR_LISTENER = (__, ___) -> {
    };

    final Backoff backoff;
    final int maxAttempts;
    final Predicate<Throwable> retryPredicate;
    final BiConsumer<RetryInfo, Throwable> retryableErrorListener;

    private RetryImpl(Backoff backoff, int maxAttempts, Predicate<Throwable> retryPredicate, BiConsumer<RetryInfo, Throwable> retryableErrorListener) {
        requireNonNull(backoff, Backoff.class.getSimpleName() + " cannot be null");
        requireNonNull(retryPredicate, "Retry predicate cannot be null");
        requireNonNull(retryableErrorListener, "Retryable error listener cannot be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be greater than zero");
        }
        this.backoff = backoff;
        this.maxAttempts = maxAttempts;
        this.retryPredicate = retryPredicate;
        this.retryableErrorListener = retryableErrorListener;
    }

    public RetryImpl() {
        this(Backoff.none(), Integer.MAX_VALUE, __ -> true, NOOP_RETRYABLE_ERROR_LISTENER);
    }

    @Override
    public Retry backoff(Backoff backoff) {
        return new RetryImpl(backoff, maxAttempts, retryPredicate, retryableErrorListener);
    }

    @Override
    public Retry infiniteAttempts() {
        return new RetryImpl(backoff, Integer.MAX_VALUE, retryPredicate, retryableErrorListener);
    }

    @Override
    public Retry maxAttempts(int maxAttempts) {
        return new RetryImpl(backoff, maxAttempts, retryPredicate, retryableErrorListener);
    }

    @Override
    public Retry retryIf(Predicate<Throwable> retryPredicate) {
        return new RetryImpl(backoff, maxAttempts, retryPredicate, retryableErrorListener);
    }

    @Override
    public Retry onRetryableError(BiConsumer<RetryInfo, Throwable> retryableErrorListener) {
        return new RetryImpl(backoff, maxAttempts, retryPredicate, retryableErrorListener);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", RetryImpl.class.getSimpleName() + "[", "]")
                .add("backoff=" + backoff)
                .add("maxAttempts=" + (maxAttempts == Integer.MAX_VALUE ? "infinite" : String.valueOf(maxAttempts)))
                .toString();
    }
}
