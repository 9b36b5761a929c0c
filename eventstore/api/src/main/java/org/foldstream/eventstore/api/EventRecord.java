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

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * An event that is about to be appended to an event stream. The event store turns it into an {@link EventEnvelope}
 * by assigning a sequence number and a logged timestamp.
 */
public final class EventRecord {
    private final String eventType;
    private final JsonNode payload;
    private final @Nullable OffsetDateTime effectiveDate;
    private final @Nullable String commentary;
    private final @Nullable String source;

    private EventRecord(String eventType, JsonNode payload, @Nullable OffsetDateTime effectiveDate, @Nullable String commentary, @Nullable String source) {
        requireNonNull(eventType, "Event type cannot be null");
        requireNonNull(payload, "Payload cannot be null");
        if (eventType.isBlank()) {
            throw new IllegalArgumentException("Event type cannot be blank");
        }
        this.eventType = eventType;
        this.payload = payload.deepCopy();
        this.effectiveDate = effectiveDate;
        this.commentary = commentary;
        this.source = source;
    }

    /**
     * @param eventType The discriminator of the event, for example {@code MoneyDeposited}
     * @param payload   The event specific data
     */
    public static EventRecord of(String eventType, JsonNode payload) {
        return new EventRecord(eventType, payload, null, null, null);
    }

    /**
     * @param effectiveDate The date at which the event takes business effect, if it's different from the time it's logged.
     */
    public EventRecord withEffectiveDate(@Nullable OffsetDateTime effectiveDate) {
        return new EventRecord(eventType, payload, effectiveDate, commentary, source);
    }

    public EventRecord withCommentary(@Nullable String commentary) {
        return new EventRecord(eventType, payload, effectiveDate, commentary, source);
    }

    public EventRecord withSource(@Nullable String source) {
        return new EventRecord(eventType, payload, effectiveDate, commentary, source);
    }

    public String eventType() {
        return eventType;
    }

    public JsonNode payload() {
        return payload.deepCopy();
    }

    public @Nullable OffsetDateTime effectiveDate() {
        return effectiveDate;
    }

    public @Nullable String commentary() {
        return commentary;
    }

    public @Nullable String source() {
        return source;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventRecord)) return false;
        EventRecord that = (EventRecord) o;
        return Objects.equals(eventType, that.eventType) && Objects.equals(payload, that.payload) && Objects.equals(effectiveDate, that.effectiveDate)
                && Objects.equals(commentary, that.commentary) && Objects.equals(source, that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventType, payload, effectiveDate, commentary, source);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", EventRecord.class.getSimpleName() + "[", "]")
                .add("eventType='" + eventType + "'")
                .add("payload=" + payload)
                .add("effectiveDate=" + effectiveDate)
                .add("commentary='" + commentary + "'")
                .add("source='" + source + "'")
                .toString();
    }
}
