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
 * The tail of the event stream didn't match the expected sequence number when the event was about to be appended.
 * This is an optimistic locking failure: someone else appended to the stream since it was read. Re-read the stream (or re-run the projection)
 * and retry with the new sequence number, or give up.
 */
public class ConcurrencyConflictException extends EventStreamWriteException {
    public final long expectedSequenceNumber;

    public ConcurrencyConflictException(EventStreamIdentity identity, long currentSequenceNumber, AppendConstraint.ExpectedSequenceNumber appendConstraint) {
        super(identity, currentSequenceNumber, appendConstraint,
                String.format("Concurrency conflict on event stream %s. Expected sequence number %d but was %d.", identity, appendConstraint.sequenceNumber(), currentSequenceNumber));
        this.expectedSequenceNumber = appendConstraint.sequenceNumber();
    }
}
