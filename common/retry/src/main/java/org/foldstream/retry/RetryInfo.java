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

import java.time.Duration;

/**
 * Information about a failed attempt that is about to be retried
 *
 * @param attemptNumber The attempt that failed, starting with 1
 * @param maxAttempts   The max number of attempts, or {@link Integer#MAX_VALUE} if infinite
 * @param backoff       The time waited before the next attempt
 */
public record RetryInfo(int attemptNumber, int maxAttempts, Duration backoff) {

    public boolean isInfiniteRetriesLeft() {
        return maxAttempts == Integer.MAX_VALUE;
    }
}
