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

package org.foldstream.eventstore.api;

/**
 * A constraint that may be applied when appending an event to an event stream. If the constraint is not fulfilled at the instant
 * of the append, the event is not written.
 */
public sealed interface AppendConstraint {

    /**
     * No check is made, the event is appended to the tail of the stream (creating the stream if needed).
     *
     * @return An {@link AppendConstraint} with the behavior specified above.
     */
    static AppendConstraint none() {
        return None.INSTANCE;
    }

    /**
     * The append only succeeds if the stream doesn't contain any events yet.
     *
     * @return An {@link AppendConstraint} with the behavior specified above.
     * @see StreamAlreadyExistsException
     */
    static AppendConstraint mustBeNew() {
        return MustBeNew.INSTANCE;
    }

    /**
     * The append only succeeds if the sequence number of the last event in the stream is equal to {@code sequenceNumber}.
     * An expected sequence number of {@code 0} means that the stream is expected to be empty.
     *
     * @return An {@link AppendConstraint} with the behavior specified above.
     * @see ConcurrencyConflictException
     */
    static AppendConstraint expectedSequenceNumber(long sequenceNumber) {
        return new ExpectedSequenceNumber(sequenceNumber);
    }

    /**
     * @param currentSequenceNumber The sequence number of the last event in the stream, {@code 0} if the stream is empty.
     * @return {@code true} if an event may be appended to a stream whose tail is at {@code currentSequenceNumber}.
     */
    boolean isFulfilledBy(long currentSequenceNumber);

    final class None implements AppendConstraint {
        private static final None INSTANCE = new None();

        private None() {
        }

        @Override
        public boolean isFulfilledBy(long currentSequenceNumber) {
            return true;
        }

        @Override
        public String toString() {
            return "none";
        }
    }

    final class MustBeNew implements AppendConstraint {
        private static final MustBeNew INSTANCE = new MustBeNew();

        private MustBeNew() {
        }

        @Override
        public boolean isFulfilledBy(long currentSequenceNumber) {
            return currentSequenceNumber == 0;
        }

        @Override
        public String toString() {
            return "must be new";
        }
    }

    record ExpectedSequenceNumber(long sequenceNumber) implements AppendConstraint {

        public ExpectedSequenceNumber {
            if (sequenceNumber < 0) {
                throw new IllegalArgumentException("Expected sequence number cannot be negative");
            }
        }

        @Override
        public boolean isFulfilledBy(long currentSequenceNumber) {
            return currentSequenceNumber == sequenceNumber;
        }

        @Override
        public String toString() {
            return "expected sequence number " + sequenceNumber;
        }
    }
}
