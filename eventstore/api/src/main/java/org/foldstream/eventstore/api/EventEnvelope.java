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
 * One immutable, recorded event in an event stream. The {@link #sequenceNumber()} is the sole authority for ordering within the stream
 * and for optimistic concurrency.
 */
public final class EventEnvelope {
    private final long sequenceNumber;
    private final String eventType;
    private final JsonNode payload;
    private final OffsetDateTime loggedTimestamp;
    private final @Nullable OffsetDateTime effectiveDate;
    private final @Nullable String commentary;
    private final @Nullable String source;

    public EventEnvelope(long sequenceNumber, String eventType, JsonNode payload, OffsetDateTime loggedTimestamp,
                         @Nullable OffsetDateTime effectiveDate, @Nullable String commentary, @Nullable String source) {
        if (sequenceNumber < 1) {
            throw new IllegalArgumentException("Sequence number cannot be less than 1");
        }
        requireNonNull(eventType, "Event type cannot be null");
        requireNonNull(payload, "Payload cannot be null");
        requireNonNull(loggedTimestamp, "Logged timestamp cannot be null");
        this.sequenceNumber = sequenceNumber;
        this.eventType = eventType;
        this.payload = payload.deepCopy();
        this.loggedTimestamp = loggedTimestamp;
        this.effectiveDate = effectiveDate;
        this.commentary = commentary;
        this.source = source;
    }

    public long sequenceNumber() {
        return sequenceNumber;
    }

    public String eventType() {
        return eventType;
    }

    /**
     * @return A copy of the payload, changing it doesn't change the envelope.
     */
    public JsonNode payload() {
        return payload.deepCopy();
    }

    public OffsetDateTime loggedTimestamp() {
        return loggedTimestamp;
    }

    public @Nullable OffsetDateTime effectiveDate() {
        return effectiveDate;
    }

    /**
     * @return The date used to decide whether the envelope falls inside an "as of" bound: the effective date if there is one, otherwise the logged timestamp.
     */
    public OffsetDateTime effectiveOrLoggedDate() {
        return effectiveDate == null ? loggedTimestamp : effectiveDate;
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
        if (!(o instanceof EventEnvelope)) return false;
        EventEnvelope that = (EventEnvelope) o;
        return sequenceNumber == that.sequenceNumber && Objects.equals(eventType, that.eventType) && Objects.equals(payload, that.payload)
                && Objects.equals(loggedTimestamp, that.loggedTimestamp) && Objects.equals(effectiveDate, that.effectiveDate)
                && Objects.equals(commentary, that.commentary) && Objects.equals(source, that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequenceNumber, eventType, payload, loggedTimestamp, effectiveDate, commentary, source);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", EventEnvelope.class.getSimpleName() + "[", "]")
                .add("sequenceNumber=" + sequenceNumber)
                .add("eventType='" + eventType + "'")
                .add("payload=" + payload)
                .add("loggedTimestamp=" + loggedTimestamp)
                .add("effectiveDate=" + effectiveDate)
                .add("commentary='" + commentary + "'")
                .add("source='" + source + "'")
                .toString();
    }
}
