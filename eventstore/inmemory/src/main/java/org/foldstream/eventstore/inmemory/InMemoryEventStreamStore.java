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

package org.foldstream.eventstore.inmemory;

import io.cloudevents.CloudEvent;
import org.foldstream.cloudevents.FoldstreamExtensionGetter;
import org.foldstream.eventstore.api.*;
import org.foldstream.eventstore.api.internal.AppendConstraintEvaluator;
import org.foldstream.eventstore.api.internal.CloudEventEnvelopeMapper;
import org.foldstream.eventstore.api.internal.EventStreamImpl;
import org.foldstream.eventstore.api.internal.NotificationSupport;
import org.foldstream.eventstore.api.notification.NotificationDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.*;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * This is an {@link EventStreamStore} that stores events in-memory. This is mainly useful for testing
 * and/or demo purposes. Appends to the same event stream are atomic, the append constraint is evaluated
 * against the tail of the stream inside the same {@code compute} call that adds the event.
 */
public class InMemoryEventStreamStore implements EventStreamStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStreamStore.class);

    // We cannot use ConcurrentMap since it doesn't maintain insertion order
    private final Map<EventStreamIdentity, List<CloudEvent>> state = Collections.synchronizedMap(new LinkedHashMap<>());

    private final NotificationDispatcher notificationDispatcher;
    private final Clock clock;
    private final CloudEventEnvelopeMapper envelopeMapper = new CloudEventEnvelopeMapper();

    /**
     * Create an instance of {@link InMemoryEventStreamStore} that doesn't send any notifications
     */
    public InMemoryEventStreamStore() {
        this(NotificationDispatcher.none());
    }

    /**
     * Create an instance of {@link InMemoryEventStreamStore} that invokes the <code>notificationDispatcher</code>
     * (synchronously!) after an event has been appended.
     *
     * @param notificationDispatcher The dispatcher to notify after each successful append
     */
    public InMemoryEventStreamStore(NotificationDispatcher notificationDispatcher) {
        this(notificationDispatcher, Clock.systemUTC());
    }

    /**
     * @param notificationDispatcher The dispatcher to notify after each successful append
     * @param clock                  The clock that defines the logged timestamp of appended events
     */
    public InMemoryEventStreamStore(NotificationDispatcher notificationDispatcher, Clock clock) {
        requireNonNull(notificationDispatcher, NotificationDispatcher.class.getSimpleName() + " cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.notificationDispatcher = notificationDispatcher;
        this.clock = clock;
    }

    @Override
    public EventStream read(EventStreamIdentity identity) {
        requireNonNull(identity, EventStreamIdentity.class.getSimpleName() + " cannot be null");
        List<CloudEvent> events = state.get(identity);
        if (events == null) {
            return EventStreamImpl.empty(identity);
        }
        return new EventStreamImpl(identity, events.stream().map(envelopeMapper::toEnvelope).collect(Collectors.toList()));
    }

    @Override
    public AppendResult append(EventStreamIdentity identity, EventRecord event, AppendConstraint appendConstraint) {
        requireNonNull(identity, EventStreamIdentity.class.getSimpleName() + " cannot be null");
        requireNonNull(event, EventRecord.class.getSimpleName() + " cannot be null");
        requireNonNull(appendConstraint, AppendConstraint.class.getSimpleName() + " cannot be null");

        final AtomicReference<AppendResult> appendResult = new AtomicReference<>();
        state.compute(identity, (__, currentEvents) -> {
            long currentSequenceNumber = calculateSequenceNumber(currentEvents);
            AppendConstraintEvaluator.requireFulfilled(identity, appendConstraint, currentSequenceNumber);

            long sequenceNumber = currentSequenceNumber + 1;
            CloudEvent cloudEvent = envelopeMapper.toCloudEvent(identity, event, sequenceNumber, OffsetDateTime.now(clock));
            List<CloudEvent> eventList = currentEvents == null ? new ArrayList<>() : new ArrayList<>(currentEvents);
            eventList.add(cloudEvent);
            appendResult.set(new AppendResult(identity, sequenceNumber, currentEvents == null));
            return eventList;
        });

        AppendResult result = appendResult.get();
        log.debug("Appended event {} to event stream {} with sequence number {}", event.eventType(), identity, result.getSequenceNumber());
        NotificationSupport.notifyAppended(notificationDispatcher, result, event.eventType());
        return result;
    }

    @Override
    public boolean exists(EventStreamIdentity identity) {
        requireNonNull(identity, EventStreamIdentity.class.getSimpleName() + " cannot be null");
        return state.containsKey(identity);
    }

    @Override
    public Stream<String> instanceKeys(String domainName, String entityTypeName) {
        requireNonNull(domainName, "Domain name cannot be null");
        requireNonNull(entityTypeName, "Entity type name cannot be null");
        final List<String> instanceKeys;
        synchronized (state) {
            instanceKeys = state.keySet().stream()
                    .filter(identity -> identity.isInstanceOf(domainName, entityTypeName))
                    .map(EventStreamIdentity::instanceKey)
                    .collect(Collectors.toList());
        }
        return instanceKeys.stream();
    }

    private static long calculateSequenceNumber(List<CloudEvent> events) {
        if (events == null || events.isEmpty()) {
            return 0;
        }
        return FoldstreamExtensionGetter.getSequenceNumber(events.get(events.size() - 1));
    }
}
