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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cloudevents.CloudEvent;
import org.assertj.core.api.SoftAssertions;
import org.assertj.core.api.junit.jupiter.SoftAssertionsExtension;
import org.foldstream.cloudevents.FoldstreamCloudEventExtension;
import org.foldstream.eventstore.api.EventEnvelope;
import org.foldstream.eventstore.api.EventRecord;
import org.foldstream.eventstore.api.EventStreamIdentity;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.net.URI;
import java.time.OffsetDateTime;

import static java.time.ZoneOffset.UTC;
import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(SoftAssertionsExtension.class)
@DisplayNameGeneration(ReplaceUnderscores.class)
class CloudEventEnvelopeMapperTest {

    private static final EventStreamIdentity ACCOUNT = EventStreamIdentity.of("Retail Bank", "Account", "A-1");
    private final CloudEventEnvelopeMapper mapper = new CloudEventEnvelopeMapper();

    @Test
    void stores_stream_identity_and_metadata_as_cloud_event_attributes(SoftAssertions softly) {
        // Given
        OffsetDateTime logged = OffsetDateTime.of(2024, 3, 2, 10, 15, 0, 0, UTC);
        EventRecord event = EventRecord.of("MoneyDeposited", amount(100))
                .withEffectiveDate(OffsetDateTime.of(2024, 3, 1, 0, 0, 0, 0, UTC))
                .withCommentary("Opening deposit")
                .withSource("Branch");

        // When
        CloudEvent cloudEvent = mapper.toCloudEvent(ACCOUNT, event, 2, logged);

        // Then
        softly.assertThat(cloudEvent.getType()).isEqualTo("MoneyDeposited");
        softly.assertThat(cloudEvent.getTime()).isEqualTo(logged);
        softly.assertThat(cloudEvent.getSubject()).isEqualTo("A-1");
        softly.assertThat(cloudEvent.getSource()).isEqualTo(URI.create("urn:foldstream:Retail+Bank"));
        softly.assertThat(cloudEvent.getDataContentType()).isEqualTo("application/json");
        softly.assertThat(cloudEvent.getExtension(FoldstreamCloudEventExtension.SEQUENCE_NUMBER)).isEqualTo(2L);
        softly.assertThat(cloudEvent.getExtension(FoldstreamCloudEventExtension.EFFECTIVE_DATE)).isEqualTo("2024-03-01T00:00:00Z");
        softly.assertThat(cloudEvent.getExtension(FoldstreamCloudEventExtension.ORIGIN)).isEqualTo("Branch");
        softly.assertThat(CloudEventEnvelopeMapper.identityOf(cloudEvent)).isEqualTo(ACCOUNT);
    }

    @Test
    void converts_cloud_event_back_to_an_envelope(SoftAssertions softly) {
        // Given
        OffsetDateTime logged = OffsetDateTime.of(2024, 3, 2, 10, 15, 0, 0, UTC);
        EventRecord event = EventRecord.of("MoneyDeposited", amount(100))
                .withEffectiveDate(OffsetDateTime.of(2024, 3, 1, 0, 0, 0, 0, UTC))
                .withCommentary("Opening deposit");
        CloudEvent cloudEvent = mapper.toCloudEvent(ACCOUNT, event, 1, logged);

        // When
        EventEnvelope envelope = mapper.toEnvelope(cloudEvent);

        // Then
        softly.assertThat(envelope.sequenceNumber()).isEqualTo(1L);
        softly.assertThat(envelope.eventType()).isEqualTo("MoneyDeposited");
        softly.assertThat(envelope.payload()).isEqualTo(amount(100));
        softly.assertThat(envelope.loggedTimestamp()).isEqualTo(logged);
        softly.assertThat(envelope.effectiveDate()).isEqualTo(OffsetDateTime.of(2024, 3, 1, 0, 0, 0, 0, UTC));
        softly.assertThat(envelope.commentary()).isEqualTo("Opening deposit");
        softly.assertThat(envelope.source()).isNull();
    }

    @Test
    void envelope_without_effective_date_uses_logged_timestamp_as_effective_or_logged_date() {
        // Given
        OffsetDateTime logged = OffsetDateTime.of(2024, 3, 2, 10, 15, 0, 0, UTC);
        CloudEvent cloudEvent = mapper.toCloudEvent(ACCOUNT, EventRecord.of("Opened", JsonNodeFactory.instance.objectNode()), 1, logged);

        // When
        EventEnvelope envelope = mapper.toEnvelope(cloudEvent);

        // Then
        assertThat(envelope.effectiveOrLoggedDate()).isEqualTo(logged);
    }

    @Test
    void changing_the_payload_returned_by_an_envelope_does_not_change_the_envelope() {
        // Given
        EventEnvelope envelope = new EventEnvelope(1, "MoneyDeposited", amount(100), OffsetDateTime.now(UTC), null, null, null);

        // When
        ((ObjectNode) envelope.payload()).put("amount", 1_000_000);

        // Then
        assertThat(envelope.payload()).isEqualTo(amount(100));
    }

    private static ObjectNode amount(int amount) {
        return JsonNodeFactory.instance.objectNode().put("amount", amount);
    }
}
