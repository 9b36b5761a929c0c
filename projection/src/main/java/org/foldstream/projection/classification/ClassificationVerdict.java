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

package org.foldstream.projection.classification;

import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;

import static java.util.Objects.requireNonNull;

/**
 * The classification of one instance.
 *
 * @param result       The result
 * @param asOfSequence The sequence number of the last envelope the result reflects, {@code 0} if the stream doesn't exist.
 *                     Append with this as expected sequence number to act on the verdict only if nothing has changed since.
 * @param asOfDate     The "as of" bound the classification was made with, or {@code null}
 */
public record ClassificationVerdict(ClassificationResult result, long asOfSequence, @Nullable OffsetDateTime asOfDate) {

    public ClassificationVerdict {
        requireNonNull(result, ClassificationResult.class.getSimpleName() + " cannot be null");
        if (asOfSequence < 0) {
            throw new IllegalArgumentException("As of sequence cannot be negative");
        }
    }

    public static ClassificationVerdict unknown(@Nullable OffsetDateTime asOfDate) {
        return new ClassificationVerdict(ClassificationResult.UNKNOWN, 0, asOfDate);
    }

    public boolean isIncluded() {
        return result == ClassificationResult.INCLUDE;
    }
}
