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

import org.foldstream.eventstore.api.EventEnvelope;
import org.foldstream.eventstore.api.EventStream;
import org.foldstream.eventstore.api.EventStreamIdentity;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * An {@link EventStream} backed by a list of envelopes that has already been read from the backing store.
 */
public class EventStreamImpl implements EventStream {
    private final EventStreamIdentity identity;
    private final long currentSequenceNumber;
    private final List<EventEnvelope> envelopes;

    public EventStreamImpl(EventStreamIdentity identity, List<EventEnvelope> envelopes) {
        this.identity = identity;
        this.envelopes = Collections.unmodifiableList(envelopes);
        this.currentSequenceNumber = envelopes.isEmpty() ? 0 : envelopes.get(envelopes.size() - 1).sequenceNumber();
    }

    public static EventStream empty(EventStreamIdentity identity) {
        return new EventStreamImpl(identity, Collections.emptyList());
    }

    @Override
    public EventStreamIdentity identity() {
        return identity;
    }

    @Override
    public long currentSequenceNumber() {
        return currentSequenceNumber;
    }

    @Override
    public Stream<EventEnvelope> envelopes() {
        return envelopes.stream();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventStreamImpl)) return false;
        EventStreamImpl that = (EventStreamImpl) o;
        return currentSequenceNumber == that.currentSequenceNumber &&
                Objects.equals(identity, that.identity) &&
                Objects.equals(envelopes, that.envelopes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, currentSequenceNumber, envelopes);
    }

    @Override
    public String toString() {
        return "EventStreamImpl{" +
                "identity=" + identity +
                ", currentSequenceNumber=" + currentSequenceNumber +
                ", envelopes=" + envelopes +
                '}';
    }
}
