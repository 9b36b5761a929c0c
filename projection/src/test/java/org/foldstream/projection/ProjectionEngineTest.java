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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.foldstream.eventstore.api.EventRecord;
import org.foldstream.eventstore.api.EventStream;
import org.foldstream.eventstore.api.EventStreamIdentity;
import org.foldstream.eventstore.api.StreamUnavailableException;
import org.foldstream.eventstore.api.notification.NotificationDispatcher;
import org.foldstream.eventstore.inmemory.InMemoryEventStreamStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;

import static java.time.ZoneOffset.UTC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayNameGeneration(ReplaceUnderscores.class)
class ProjectionEngineTest {
    private static final EventStreamIdentity ACCOUNT = EventStreamIdentity.of("Bank", "Account", "A-1");
    private static final OffsetDateTime JAN_10 = OffsetDateTime.of(2024, 1, 10, 0, 0, 0, 0, UTC);
    private static final OffsetDateTime JAN_20 = OffsetDateTime.of(2024, 1, 20, 0, 0, 0, 0, UTC);
    private static final OffsetDateTime JAN_30 = OffsetDateTime.of(2024, 1, 30, 0, 0, 0, 0, UTC);

    private static final ProjectionDefinition<Integer> TOTAL_DEPOSITED = ProjectionDefinition.builder("TotalDeposited", 0)
            .on("MoneyDeposited", (total, envelope) -> total + envelope.payload().get("amount").asInt())
            .build();

    private InMemoryEventStreamStore eventStore;
    private ProjectionEngine projectionEngine;

    @BeforeEach
    void create_projection_engine() {
        // Events are logged on February 1st unless they have an effective date
        eventStore = new InMemoryEventStreamStore(NotificationDispatcher.none(), Clock.fixed(Instant.parse("2024-02-01T12:00:00Z"), UTC));
        projectionEngine = new ProjectionEngine(eventStore, new ProjectionRegistry().register(TOTAL_DEPOSITED));
    }

    @Test
    void folds_all_envelopes_of_the_event_stream() {
        // Given
        eventStore.append(ACCOUNT, event("Opened", 0));
        eventStore.append(ACCOUNT, event("MoneyDeposited", 100));
        eventStore.append(ACCOUNT, event("MoneyDeposited", 50));

        // When
        ProjectionSnapshot<Integer> snapshot = projectionEngine.process(ACCOUNT, "TotalDeposited");

        // Then
        assertThat(snapshot).isEqualTo(new ProjectionSnapshot<>("TotalDeposited", 150, 3, null));
    }

    @Test
    void returns_null_when_the_event_stream_does_not_exist() {
        // When
        ProjectionSnapshot<Integer> snapshot = projectionEngine.process(ACCOUNT, "TotalDeposited");

        // Then
        assertThat(snapshot).isNull();
    }

    @Test
    void processing_the_same_stream_twice_yields_equal_snapshots() {
        // Given
        eventStore.append(ACCOUNT, event("MoneyDeposited", 100));
        eventStore.append(ACCOUNT, event("MoneyDeposited", 25));

        // When
        ProjectionSnapshot<Integer> first = projectionEngine.process(ACCOUNT, "TotalDeposited");
        ProjectionSnapshot<Integer> second = projectionEngine.process(ACCOUNT, "TotalDeposited");

        // Then
        assertThat(first).isEqualTo(second);
    }

    @Test
    void an_event_type_unknown_to_the_projection_only_advances_the_sequence_number() {
        // Given
        eventStore.append(ACCOUNT, event("MoneyDeposited", 100));
        ProjectionSnapshot<Integer> before = projectionEngine.process(ACCOUNT, "TotalDeposited");

        // When
        eventStore.append(ACCOUNT, event("SomethingIntroducedLater", 1_000));
        ProjectionSnapshot<Integer> after = projectionEngine.process(ACCOUNT, "TotalDeposited");

        // Then
        assertThat(after.state()).isEqualTo(before.state());
        assertThat(after.currentSequenceNumber()).isEqualTo(2L);
    }

    @Test
    void throws_projection_processor_not_configured_when_the_projection_type_is_not_registered() {
        // Given
        eventStore.append(ACCOUNT, event("MoneyDeposited", 100));

        // When
        Throwable throwable = catchThrowable(() -> projectionEngine.process(ACCOUNT, "Balance"));

        // Then
        assertThat(throwable).isExactlyInstanceOf(ProjectionProcessorNotConfiguredException.class).hasMessage("No projection named Balance has been registered");
        assertThat(((ProjectionProcessorNotConfiguredException) throwable).projectionType).isEqualTo("Balance");
    }

    @Test
    void read_failures_of_the_event_store_are_propagated() {
        // Given
        StreamUnavailableException failure = new StreamUnavailableException(ACCOUNT, "expected", new IOException("disk on fire"));
        ProjectionEngine engine = new ProjectionEngine(new InMemoryEventStreamStore() {
            @Override
            public EventStream read(EventStreamIdentity identity) {
                throw failure;
            }
        }, new ProjectionRegistry().register(TOTAL_DEPOSITED));

        // When
        Throwable throwable = catchThrowable(() -> engine.process(ACCOUNT, "TotalDeposited"));

        // Then
        assertThat(throwable).isSameAs(failure);
    }

    @Nested
    class AsOf {

        @Test
        void envelopes_effective_after_the_as_of_date_are_excluded_regardless_of_append_order() {
            // Given
            eventStore.append(ACCOUNT, event("MoneyDeposited", 300).withEffectiveDate(JAN_30));
            eventStore.append(ACCOUNT, event("MoneyDeposited", 100).withEffectiveDate(JAN_10));
            eventStore.append(ACCOUNT, event("MoneyDeposited", 200).withEffectiveDate(JAN_20));

            // When
            ProjectionSnapshot<Integer> snapshot = projectionEngine.process(ACCOUNT, "TotalDeposited", JAN_20);

            // Then
            assertThat(snapshot.state()).isEqualTo(300);
            assertThat(snapshot.currentSequenceNumber()).isEqualTo(3L);
            assertThat(snapshot.asOfDate()).isEqualTo(JAN_20);
        }

        @Test
        void a_backdated_correction_appended_later_is_included() {
            // Given
            eventStore.append(ACCOUNT, event("MoneyDeposited", 100).withEffectiveDate(JAN_10));
            eventStore.append(ACCOUNT, event("MoneyDeposited", 300).withEffectiveDate(JAN_30));
            eventStore.append(ACCOUNT, event("MoneyDeposited", -50).withEffectiveDate(JAN_10).withCommentary("Correction"));

            // When
            ProjectionSnapshot<Integer> snapshot = projectionEngine.process(ACCOUNT, "TotalDeposited", JAN_20);

            // Then
            assertThat(snapshot.state()).isEqualTo(50);
            assertThat(snapshot.currentSequenceNumber()).isEqualTo(3L);
        }

        @Test
        void the_logged_timestamp_is_used_for_envelopes_without_effective_date() {
            // Given
            eventStore.append(ACCOUNT, event("MoneyDeposited", 100).withEffectiveDate(JAN_10));
            eventStore.append(ACCOUNT, event("MoneyDeposited", 500));

            // When
            ProjectionSnapshot<Integer> beforeLogged = projectionEngine.process(ACCOUNT, "TotalDeposited", JAN_30);
            ProjectionSnapshot<Integer> afterLogged = projectionEngine.process(ACCOUNT, "TotalDeposited", OffsetDateTime.of(2024, 2, 2, 0, 0, 0, 0, UTC));

            // Then
            assertThat(beforeLogged.state()).isEqualTo(100);
            assertThat(beforeLogged.currentSequenceNumber()).isEqualTo(1L);
            assertThat(afterLogged.state()).isEqualTo(600);
        }

        @Test
        void an_envelope_effective_exactly_at_the_as_of_date_is_included() {
            // Given
            eventStore.append(ACCOUNT, event("MoneyDeposited", 100).withEffectiveDate(JAN_20));

            // When
            ProjectionSnapshot<Integer> snapshot = projectionEngine.process(ACCOUNT, "TotalDeposited", JAN_20);

            // Then
            assertThat(snapshot.state()).isEqualTo(100);
        }

        @Test
        void the_initial_state_at_sequence_zero_is_returned_when_no_envelope_is_inside_the_bound() {
            // Given
            eventStore.append(ACCOUNT, event("MoneyDeposited", 100).withEffectiveDate(JAN_30));

            // When
            ProjectionSnapshot<Integer> snapshot = projectionEngine.process(ACCOUNT, "TotalDeposited", JAN_10);

            // Then
            assertThat(snapshot).isEqualTo(new ProjectionSnapshot<>("TotalDeposited", 0, 0, JAN_10));
        }
    }

    @Nested
    class ProjectionHandle {

        @Test
        void processes_the_projection_of_its_event_stream() {
            // Given
            eventStore.append(ACCOUNT, event("MoneyDeposited", 100).withEffectiveDate(JAN_10));
            eventStore.append(ACCOUNT, event("MoneyDeposited", 200).withEffectiveDate(JAN_30));
            Projection<Integer> projection = projectionEngine.projection(ACCOUNT, "TotalDeposited");

            // When
            ProjectionSnapshot<Integer> current = projection.process();
            ProjectionSnapshot<Integer> asOfJan20 = projection.process(JAN_20);

            // Then
            assertThat(projection.exists()).isTrue();
            assertThat(current.state()).isEqualTo(300);
            assertThat(asOfJan20.state()).isEqualTo(100);
        }

        @Test
        void does_not_exist_when_the_event_stream_does_not_exist() {
            // When
            Projection<Integer> projection = projectionEngine.projection(ACCOUNT, "TotalDeposited");

            // Then
            assertThat(projection.exists()).isFalse();
            assertThat(projection.process()).isNull();
        }
    }

    private static EventRecord event(String eventType, int amount) {
        return EventRecord.of(eventType, JsonNodeFactory.instance.objectNode().put("amount", amount));
    }
}
