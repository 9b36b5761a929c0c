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
 * Event stores that can append events to an event stream. Appends to the same stream are serialized by the store, never by the caller.
 */
public interface AppendToEventStream {

    /**
     * Append an event to the tail of an event stream without any constraint.
     *
     * @see #append(EventStreamIdentity, EventRecord, AppendConstraint)
     */
    default AppendResult append(EventStreamIdentity identity, EventRecord event) {
        return append(identity, event, AppendConstraint.none());
    }

    /**
     * Conditionally append an event to the tail of an event stream. The append either fully commits or fully fails.
     *
     * @param identity   The identity of the stream
     * @param event      The event to append
     * @param constraint The constraint that must be fulfilled, at the instant of the append, for the event to be written
     * @return An {@link AppendResult} holding the sequence number assigned to the event
     * @throws StreamAlreadyExistsException When {@link AppendConstraint#mustBeNew()} is used and the stream already has events
     * @throws ConcurrencyConflictException When {@link AppendConstraint#expectedSequenceNumber(long)} doesn't match the tail of the stream
     * @throws StreamUnavailableException   When the backing store failed
     */
    AppendResult append(EventStreamIdentity identity, EventRecord event, AppendConstraint constraint);
}
