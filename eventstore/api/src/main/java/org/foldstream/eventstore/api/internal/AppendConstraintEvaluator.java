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

package org.foldstream.eventstore.api.internal;

import org.foldstream.eventstore.api.*;
import org.foldstream.eventstore.api.AppendConstraint.ExpectedSequenceNumber;
import org.foldstream.eventstore.api.AppendConstraint.MustBeNew;

import java.util.Objects;

/**
 * Evaluates an {@link AppendConstraint} against the current tail of an event stream and throws the matching {@link EventStreamWriteException}
 * if it's not fulfilled. Event store implementations call this while holding the lock (or inside the atomic operation) that serializes appends to the stream.
 */
public class AppendConstraintEvaluator {

    public static void requireFulfilled(EventStreamIdentity identity, AppendConstraint constraint, long currentSequenceNumber) {
        Objects.requireNonNull(constraint, AppendConstraint.class.getSimpleName() + " cannot be null");
        if (constraint.isFulfilledBy(currentSequenceNumber)) {
            return;
        }

        if (constraint instanceof MustBeNew) {
            throw new StreamAlreadyExistsException(identity, currentSequenceNumber);
        } else if (constraint instanceof ExpectedSequenceNumber expectedSequenceNumber) {
            throw new ConcurrencyConflictException(identity, currentSequenceNumber, expectedSequenceNumber);
        } else {
            throw new IllegalStateException("Internal error: " + constraint + " was not fulfilled by sequence number " + currentSequenceNumber);
        }
    }
}
