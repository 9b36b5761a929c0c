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

import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A read view of an event stream: the envelopes in ascending sequence number order.
 */
@SuppressWarnings("NullableProblems")
public interface EventStream extends Iterable<EventEnvelope> {

    /**
     * @return The identity of the event stream
     */
    EventStreamIdentity identity();

    /**
     * The sequence number of the last envelope in the stream. It is equal to {@code 0} if event stream is empty.
     *
     * @return The current sequence number of the event stream
     * @see #isEmpty()
     */
    long currentSequenceNumber();

    /**
     * @return The envelopes as a {@link Stream}, ordered by sequence number.
     */
    Stream<EventEnvelope> envelopes();

    @Override
    default Iterator<EventEnvelope> iterator() {
        return envelopes().iterator();
    }

    /**
     * @return {@code true} if event stream is empty, {@code false} otherwise.
     */
    default boolean isEmpty() {
        return currentSequenceNumber() == 0;
    }

    /**
     * @return The envelopes in this stream as a list
     */
    default List<EventEnvelope> envelopeList() {
        return envelopes().collect(Collectors.toList());
    }
}
