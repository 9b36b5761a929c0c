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

import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * A handle to the event stream of one entity instance. This is what a host layer hands to business operations
 * once it has resolved the domain, entity type and instance key of a request.
 */
public class EntityEventStream {
    private final EventStreamStore store;
    private final EventStreamIdentity identity;

    public EntityEventStream(EventStreamStore store, EventStreamIdentity identity) {
        requireNonNull(store, EventStreamStore.class.getSimpleName() + " cannot be null");
        requireNonNull(identity, EventStreamIdentity.class.getSimpleName() + " cannot be null");
        this.store = store;
        this.identity = identity;
    }

    public static EntityEventStream of(EventStreamStore store, String domainName, String entityTypeName, String instanceKey) {
        return new EntityEventStream(store, EventStreamIdentity.of(domainName, entityTypeName, instanceKey));
    }

    public EventStreamIdentity identity() {
        return identity;
    }

    public boolean exists() {
        return store.exists(identity);
    }

    public EventStream read() {
        return store.read(identity);
    }

    public long append(EventRecord event) {
        return store.append(identity, event).getSequenceNumber();
    }

    public long append(EventRecord event, AppendConstraint constraint) {
        return store.append(identity, event, constraint).getSequenceNumber();
    }

    /**
     * Append only if the tail of the stream is still at {@code expectedSequenceNumber}.
     */
    public long append(EventRecord event, long expectedSequenceNumber) {
        return append(event, AppendConstraint.expectedSequenceNumber(expectedSequenceNumber));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntityEventStream)) return false;
        EntityEventStream that = (EntityEventStream) o;
        return Objects.equals(store, that.store) && Objects.equals(identity, that.identity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(store, identity);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", EntityEventStream.class.getSimpleName() + "[", "]")
                .add("identity=" + identity)
                .toString();
    }
}
