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

import org.foldstream.retry.RetryInfo;
import org.foldstream.retry.RetryStrategy;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Internal class for executing functions with retry capability. Never use this class directly from your own code!
 */
public class RetryExecution {

    private RetryExecution() {
    }

    public static <T> T executeWithRetry(Supplier<T> supplier, RetryStrategy retryStrategy) {
        if (retryStrategy instanceof RetryStrategy.DontRetry) {
            return supplier.get();
        }
        RetryImpl retry = (RetryImpl) retryStrategy;
        for (int attempt = 1; ; attempt++) {
            try {
                return supplier.get();
            } catch (RuntimeException e) {
                if (attempt >= retry.maxAttempts || !retry.retryPredicate.test(e)) {
                    throw e;
                }
                Duration backoff = retry.backoff.delayAfter(attempt);
                retry.retryableErrorListener.accept(new RetryInfo(attempt, retry.maxAttempts, backoff), e);
                sleep(backoff, e);
            }
        }
    }

    private static void sleep(Duration backoff, RuntimeException cause) {
        if (backoff.isZero()) {
            return;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cause.addSuppressed(e);
            throw cause;
        }
    }
}
