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

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.foldstream.eventstore.api.EventEnvelope;
import org.foldstream.eventstore.api.EventStreamStore;
import org.foldstream.eventstore.api.notification.NotificationDispatcher;
import org.foldstream.testsupport.EventStreamStoreContract;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;

import static java.time.ZoneOffset.UTC;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayNameGeneration(ReplaceUnderscores.class)
class InMemoryEventStreamStoreTest extends EventStreamStoreContract {

    @Override
    protected EventStreamStore newEventStore(NotificationDispatcher notificationDispatcher) {
        return new InMemoryEventStreamStore(notificationDispatcher);
    }

    @Test
    void logged_timestamp_is_taken_from_the_clock() {
        // Given
        Instant now = Instant.parse("2024-03-01T10:15:30Z");
        InMemoryEventStreamStore eventStore = new InMemoryEventStreamStore(NotificationDispatcher.none(), Clock.fixed(now, UTC));

        // When
        eventStore.append(ACCOUNT, event("Opened", 0));

        // Then
        EventEnvelope envelope = eventStore.read(ACCOUNT).envelopeList().get(0);
        assertThat(envelope.loggedTimestamp()).isEqualTo(OffsetDateTime.of(2024, 3, 1, 10, 15, 30, 0, UTC));
        assertThat(envelope.effectiveOrLoggedDate()).isEqualTo(envelope.loggedTimestamp());
    }

    @Test
    void changing_a_read_payload_does_not_change_the_stored_event() {
        // Given
        InMemoryEventStreamStore eventStore = new InMemoryEventStreamStore();
        eventStore.append(ACCOUNT, event("MoneyDeposited", 100));

        // When
        ObjectNode payload = (ObjectNode) eventStore.read(ACCOUNT).envelopeList().get(0).payload();
        payload.put("amount", 1_000_000);

        // Then
        assertThat(eventStore.read(ACCOUNT).envelopeList().get(0).payload().get("amount").asInt()).isEqualTo(100);
    }

    @Test
    void a_stream_read_before_an_append_is_not_affected_by_the_append() {
        // Given
        InMemoryEventStreamStore eventStore = new InMemoryEventStreamStore();
        eventStore.append(ACCOUNT, event("Opened", 0));
        var eventStream = eventStore.read(ACCOUNT);

        // When
        eventStore.append(ACCOUNT, event("MoneyDeposited", 100));

        // Then
        assertThat(eventStream.currentSequenceNumber()).isEqualTo(1L);
        assertThat(eventStream.envelopeList()).hasSize(1);
    }
}
