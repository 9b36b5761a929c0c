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

package org.foldstream.example.domain.bankaccount.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.foldstream.eventstore.api.EventEnvelope;
import org.foldstream.eventstore.api.EventRecord;
import org.foldstream.example.domain.bankaccount.model.events.AccountEvent;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Converts between {@link AccountEvent}s and the JSON payloads stored in the event stream of an account
 */
public class AccountEventSerialization {

    private final ObjectMapper objectMapper;

    public AccountEventSerialization() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS));
    }

    public AccountEventSerialization(ObjectMapper objectMapper) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        this.objectMapper = objectMapper;
    }

    public EventRecord serialize(AccountEvent event) {
        requireNonNull(event, AccountEvent.class.getSimpleName() + " cannot be null");
        return EventRecord.of(event.eventType(), objectMapper.valueToTree(event));
    }

    public <T extends AccountEvent> T deserialize(EventEnvelope envelope, Class<T> eventType) {
        if (!Objects.equals(envelope.eventType(), eventType.getSimpleName())) {
            throw new IllegalArgumentException("Envelope " + envelope.sequenceNumber() + " contains " + envelope.eventType() + " and not " + eventType.getSimpleName());
        }
        try {
            return objectMapper.treeToValue(envelope.payload(), eventType);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Couldn't deserialize " + envelope.eventType() + " with sequence number " + envelope.sequenceNumber(), e);
        }
    }
}
