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

package org.foldstream.projection;

import org.foldstream.eventstore.api.EventEnvelope;
import org.foldstream.eventstore.api.EventStream;
import org.foldstream.eventstore.api.EventStreamIdentity;
import org.foldstream.eventstore.api.EventStreamStore;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.OffsetDateTime;
import java.util.Iterator;

import static java.util.Objects.requireNonNull;

/**
 * Replays event streams through projections.
 * <p>
 * Envelopes are folded in ascending sequence number order. When an "as of" date is given, envelopes whose effective date
 * (or logged timestamp, if they have no effective date) is after it are left out, regardless of where they are in the stream.
 * So a backdated correction appended later is included while an event dated in the future is not.
 * </p>
 */
public class ProjectionEngine {
    private static final Logger log = LoggerFactory.getLogger(ProjectionEngine.class);

    private final EventStreamStore eventStore;
    private final ProjectionRegistry registry;

    public ProjectionEngine(EventStreamStore eventStore, ProjectionRegistry registry) {
        requireNonNull(eventStore, EventStreamStore.class.getSimpleName() + " cannot be null");
        requireNonNull(registry, ProjectionRegistry.class.getSimpleName() + " cannot be null");
        this.eventStore = eventStore;
        this.registry = registry;
    }

    /**
     * Fold the whole event stream through the projection registered as {@code projectionType}.
     *
     * @see #process(EventStreamIdentity, String, OffsetDateTime)
     */
    public <S> @Nullable ProjectionSnapshot<S> process(EventStreamIdentity identity, String projectionType) {
        return process(identity, projectionType, null);
    }

    /**
     * @param identity       The event stream to fold
     * @param projectionType The name the projection is registered with
     * @param asOfDate       Only include envelopes effective at or before this date, or {@code null} to include all envelopes
     * @return The snapshot, or {@code null} if the event stream doesn't exist
     * @throws ProjectionProcessorNotConfiguredException If no projection is registered as {@code projectionType}
     */
    public <S> @Nullable ProjectionSnapshot<S> process(EventStreamIdentity identity, String projectionType, @Nullable OffsetDateTime asOfDate) {
        ProjectionDefinition<S> projection = registry.projection(projectionType);
        return process(identity, projection, asOfDate);
    }

    /**
     * Fold the event stream through a projection definition that need not be registered
     *
     * @return The snapshot, or {@code null} if the event stream doesn't exist
     */
    public <S> @Nullable ProjectionSnapshot<S> process(EventStreamIdentity identity, ProjectionDefinition<S> projection, @Nullable OffsetDateTime asOfDate) {
        requireNonNull(identity, EventStreamIdentity.class.getSimpleName() + " cannot be null");
        requireNonNull(projection, ProjectionDefinition.class.getSimpleName() + " cannot be null");

        EventStream eventStream = eventStore.read(identity);
        if (eventStream.isEmpty()) {
            log.debug("Event stream {} doesn't exist, no {} projection", identity, projection.name());
            return null;
        }

        S state = projection.initialState();
        long currentSequenceNumber = 0;
        Iterator<EventEnvelope> envelopes = eventStream.iterator();
        while (envelopes.hasNext()) {
            EventEnvelope envelope = envelopes.next();
            if (asOfDate != null && envelope.effectiveOrLoggedDate().isAfter(asOfDate)) {
                continue;
            }
            state = projection.evolve(state, envelope);
            currentSequenceNumber = envelope.sequenceNumber();
        }

        log.debug("Processed projection {} of event stream {} up to sequence number {} (as of {})", projection.name(), identity, currentSequenceNumber, asOfDate);
        return new ProjectionSnapshot<>(projection.name(), state, currentSequenceNumber, asOfDate);
    }

    /**
     * @return {@code true} if the event stream has at least one envelope
     */
    public boolean exists(EventStreamIdentity identity) {
        return eventStore.exists(identity);
    }

    /**
     * @return A handle for the projection of one event stream
     */
    public <S> Projection<S> projection(EventStreamIdentity identity, String projectionType) {
        return new Projection<>(this, identity, projectionType);
    }
}
