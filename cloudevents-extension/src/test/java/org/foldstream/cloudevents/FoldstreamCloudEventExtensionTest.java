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

package org.foldstream.cloudevents;


import io.cloudevents.CloudEvent;
import io.cloudevents.core.v1.CloudEventBuilder;
import org.assertj.core.api.SoftAssertions;
import org.assertj.core.api.junit.jupiter.SoftAssertionsExtension;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.net.URI;
import java.time.ZonedDateTime;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@ExtendWith(SoftAssertionsExtension.class)
@DisplayNameGeneration(ReplaceUnderscores.class)
class FoldstreamCloudEventExtensionTest {

    @Test
    void optional_keys_are_left_out_when_they_have_no_value() {
        // When
        FoldstreamCloudEventExtension extension = FoldstreamCloudEventExtension.foldstream("Bank", "Account", "A-1", 1);

        // Then
        assertThat(extension.getKeys()).containsExactly("domainname", "entitytype", "instancekey", "sequencenumber");
    }

    @Test
    void sequence_number_cannot_be_less_than_one() {
        // When
        Throwable throwable = catchThrowable(() -> FoldstreamCloudEventExtension.foldstream("Bank", "Account", "A-1", 0));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("Sequence number cannot be less than 1");
    }

    @Nested
    class Getter {

        @Test
        void reads_back_all_extension_values(SoftAssertions softly) {
            // Given
            CloudEvent cloudEvent = cloudEventBuilder()
                    .withExtension(new FoldstreamCloudEventExtension("Bank", "Account", "A-1", 7, "2024-03-01T00:00:00Z", "backdated", "ATM"))
                    .build();

            // Then
            softly.assertThat(FoldstreamExtensionGetter.getDomainName(cloudEvent)).isEqualTo("Bank");
            softly.assertThat(FoldstreamExtensionGetter.getEntityType(cloudEvent)).isEqualTo("Account");
            softly.assertThat(FoldstreamExtensionGetter.getInstanceKey(cloudEvent)).isEqualTo("A-1");
            softly.assertThat(FoldstreamExtensionGetter.getSequenceNumber(cloudEvent)).isEqualTo(7L);
            softly.assertThat(FoldstreamExtensionGetter.getEffectiveDate(cloudEvent)).isEqualTo("2024-03-01T00:00:00Z");
            softly.assertThat(FoldstreamExtensionGetter.getCommentary(cloudEvent)).isEqualTo("backdated");
            softly.assertThat(FoldstreamExtensionGetter.getOrigin(cloudEvent)).isEqualTo("ATM");
        }

        @Test
        void accepts_sequence_number_stored_as_integer() {
            // Given
            CloudEvent cloudEvent = cloudEventBuilder().withExtension(FoldstreamCloudEventExtension.SEQUENCE_NUMBER, 3).build();

            // Then
            assertThat(FoldstreamExtensionGetter.getSequenceNumber(cloudEvent)).isEqualTo(3L);
        }

        @Test
        void throws_when_sequence_number_is_missing() {
            // Given
            CloudEvent cloudEvent = cloudEventBuilder().build();

            // When
            Throwable throwable = catchThrowable(() -> FoldstreamExtensionGetter.getSequenceNumber(cloudEvent));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("CloudEvent does not contain the sequencenumber key");
        }

        @Test
        void optional_values_are_null_when_missing() {
            // Given
            CloudEvent cloudEvent = cloudEventBuilder().withExtension(FoldstreamCloudEventExtension.foldstream("Bank", "Account", "A-1", 1)).build();

            // Then
            assertThat(FoldstreamExtensionGetter.getEffectiveDate(cloudEvent)).isNull();
        }
    }

    private static CloudEventBuilder cloudEventBuilder() {
        return new CloudEventBuilder()
                .withId("id")
                .withTime(ZonedDateTime.now().toOffsetDateTime())
                .withSource(URI.create("urn:test"))
                .withType("MoneyDeposited")
                .withData("text/plain", "hello".getBytes(UTF_8));
    }
}
