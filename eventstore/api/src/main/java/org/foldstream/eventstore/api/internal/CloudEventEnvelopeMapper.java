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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cloudevents.CloudEvent;
import io.cloudevents.CloudEventData;
import io.cloudevents.core.builder.CloudEventBuilder;
import org.foldstream.cloudevents.FoldstreamCloudEventExtension;
import org.foldstream.cloudevents.FoldstreamExtensionGetter;
import org.foldstream.eventstore.api.EventEnvelope;
import org.foldstream.eventstore.api.EventRecord;
import org.foldstream.eventstore.api.EventStreamIdentity;
import org.foldstream.time.internal.RFC3339;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.time.OffsetDateTime;
import java.util.UUID;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Converts between the {@link EventEnvelope}s handed to callers and the {@link CloudEvent}s that event stores persist.
 * The payload is stored as JSON data, the stream identity and envelope metadata as {@link FoldstreamCloudEventExtension} attributes.
 */
public class CloudEventEnvelopeMapper {
    static final String CONTENT_TYPE = "application/json";

    private final ObjectMapper objectMapper;

    /**
     * Create a mapper that reads decimal numbers in payloads as {@link java.math.BigDecimal} so that amounts keep their exact value.
     */
    public CloudEventEnvelopeMapper() {
        this(new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS));
    }

    public CloudEventEnvelopeMapper(ObjectMapper objectMapper) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        this.objectMapper = objectMapper;
    }

    public CloudEvent toCloudEvent(EventStreamIdentity identity, EventRecord event, long sequenceNumber, OffsetDateTime loggedTimestamp) {
        requireNonNull(identity, EventStreamIdentity.class.getSimpleName() + " cannot be null");
        requireNonNull(event, EventRecord.class.getSimpleName() + " cannot be null");
        requireNonNull(loggedTimestamp, "Logged timestamp cannot be null");

        final byte[] data;
        try {
            data = objectMapper.writeValueAsBytes(event.payload());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Couldn't serialize payload of event " + event.eventType() + " to JSON", e);
        }

        String effectiveDate = event.effectiveDate() == null ? null : RFC3339.format(event.effectiveDate());
        return CloudEventBuilder.v1()
                .withId(UUID.randomUUID().toString())
                .withSource(sourceOf(identity))
                .withType(event.eventType())
                .withTime(loggedTimestamp)
                .withSubject(identity.instanceKey())
                .withDataContentType(CONTENT_TYPE)
                .withData(data)
                .withExtension(new FoldstreamCloudEventExtension(identity.domainName(), identity.entityTypeName(), identity.instanceKey(),
                        sequenceNumber, effectiveDate, event.commentary(), event.source()))
                .build();
    }

    @SuppressWarnings("ConstantConditions")
    public EventEnvelope toEnvelope(CloudEvent cloudEvent) {
        requireNonNull(cloudEvent, CloudEvent.class.getSimpleName() + " cannot be null");
        CloudEventData data = requireNonNull(cloudEvent.getData(), "Cloud event data cannot be null");
        final JsonNode payload;
        try {
            payload = objectMapper.readTree(data.toBytes());
        } catch (IOException e) {
            throw new UncheckedIOException("Couldn't read payload of cloud event " + cloudEvent.getId(), e);
        }

        String effectiveDate = FoldstreamExtensionGetter.getEffectiveDate(cloudEvent);
        return new EventEnvelope(
                FoldstreamExtensionGetter.getSequenceNumber(cloudEvent),
                cloudEvent.getType(),
                payload,
                cloudEvent.getTime(),
                effectiveDate == null ? null : RFC3339.parse(effectiveDate),
                FoldstreamExtensionGetter.getCommentary(cloudEvent),
                FoldstreamExtensionGetter.getOrigin(cloudEvent));
    }

    /**
     * @return The identity of the event stream the {@code cloudEvent} belongs to
     */
    public static EventStreamIdentity identityOf(CloudEvent cloudEvent) {
        return EventStreamIdentity.of(FoldstreamExtensionGetter.getDomainName(cloudEvent), FoldstreamExtensionGetter.getEntityType(cloudEvent), FoldstreamExtensionGetter.getInstanceKey(cloudEvent));
    }

    static URI sourceOf(EventStreamIdentity identity) {
        return URI.create("urn:foldstream:" + URLEncoder.encode(identity.domainName(), UTF_8));
    }
}
