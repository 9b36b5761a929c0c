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

package org.foldstream.projection.classification;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.foldstream.eventstore.api.EventRecord;
import org.foldstream.eventstore.api.EventStreamIdentity;
import org.foldstream.eventstore.inmemory.InMemoryEventStreamStore;
import org.foldstream.projection.ProjectionEngine;
import org.foldstream.projection.ProjectionProcessorNotConfiguredException;
import org.foldstream.projection.ProjectionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.time.ZoneOffset.UTC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.foldstream.projection.classification.ClassificationResult.*;

@DisplayNameGeneration(ReplaceUnderscores.class)
class ClassificationEngineTest {
    private static final OffsetDateTime JAN_10 = OffsetDateTime.of(2024, 1, 10, 0, 0, 0, 0, UTC);
    private static final OffsetDateTime JAN_20 = OffsetDateTime.of(2024, 1, 20, 0, 0, 0, 0, UTC);

    private static final ClassificationDefinition OPEN = ClassificationDefinition.builder("Open")
            .on("Opened", INCLUDE)
            .on("Closed", EXCLUDE)
            .build();

    // Include if a "Visited" event is effective on the day the classification is evaluated for
    private static final ClassificationDefinition VISITED_TODAY = ClassificationDefinition.builder("VisitedToday")
            .on("Visited", (current, envelope, evaluationDate) ->
                    envelope.effectiveOrLoggedDate().toLocalDate().equals(evaluationDate.toLocalDate()) ? INCLUDE : EXCLUDE)
            .build();

    private InMemoryEventStreamStore eventStore;
    private ClassificationEngine classificationEngine;

    @BeforeEach
    void create_classification_engine() {
        eventStore = new InMemoryEventStreamStore();
        ProjectionRegistry registry = new ProjectionRegistry().register(OPEN).register(VISITED_TODAY);
        classificationEngine = new ClassificationEngine(new ProjectionEngine(eventStore, registry), registry, eventStore,
                Clock.fixed(Instant.parse("2024-01-20T15:00:00Z"), UTC));
    }

    @Nested
    class Classify {

        @Test
        void returns_the_result_of_the_last_handled_envelope_and_the_sequence_number_of_the_last_envelope() {
            // Given
            EventStreamIdentity account = account("A-1");
            eventStore.append(account, event("Opened"));
            eventStore.append(account, event("MoneyDeposited"));

            // When
            ClassificationVerdict verdict = classificationEngine.classify(account, "Open");

            // Then
            assertThat(verdict).isEqualTo(new ClassificationVerdict(INCLUDE, 2, null));
        }

        @Test
        void is_unknown_at_sequence_zero_when_the_event_stream_does_not_exist() {
            // When
            ClassificationVerdict verdict = classificationEngine.classify(account("A-1"), "Open", JAN_10);

            // Then
            assertThat(verdict).isEqualTo(new ClassificationVerdict(UNKNOWN, 0, JAN_10));
        }

        @Test
        void is_unknown_when_no_envelope_is_handled_by_the_classification() {
            // Given
            EventStreamIdentity account = account("A-1");
            eventStore.append(account, event("MoneyDeposited"));

            // When
            ClassificationVerdict verdict = classificationEngine.classify(account, "Open");

            // Then
            assertThat(verdict.result()).isEqualTo(UNKNOWN);
            assertThat(verdict.asOfSequence()).isEqualTo(1L);
        }

        @Test
        void honours_the_as_of_date() {
            // Given
            EventStreamIdentity account = account("A-1");
            eventStore.append(account, event("Opened").withEffectiveDate(JAN_10));
            eventStore.append(account, event("Closed").withEffectiveDate(JAN_20));

            // When
            ClassificationVerdict asOfJan10 = classificationEngine.classify(account, "Open", JAN_10);
            ClassificationVerdict current = classificationEngine.classify(account, "Open");

            // Then
            assertThat(asOfJan10).isEqualTo(new ClassificationVerdict(INCLUDE, 1, JAN_10));
            assertThat(current).isEqualTo(new ClassificationVerdict(EXCLUDE, 2, null));
        }

        @Test
        void steps_are_evaluated_for_the_as_of_date_or_the_current_time_of_the_clock() {
            // Given
            EventStreamIdentity account = account("A-1");
            eventStore.append(account, event("Visited").withEffectiveDate(JAN_20));

            // When
            ClassificationVerdict today = classificationEngine.classify(account, "VisitedToday");
            ClassificationVerdict nextDay = classificationEngine.classify(account, "VisitedToday", JAN_20.plusDays(1));

            // Then
            assertThat(today.result()).isEqualTo(INCLUDE);
            assertThat(nextDay.result()).isEqualTo(EXCLUDE);
        }

        @Test
        void throws_projection_processor_not_configured_for_an_unregistered_classification() {
            // When
            Throwable throwable = catchThrowable(() -> classificationEngine.classify(account("A-1"), "Dormant"));

            // Then
            assertThat(throwable).isExactlyInstanceOf(ProjectionProcessorNotConfiguredException.class);
        }

        @Test
        void classification_handle_classifies_its_event_stream() {
            // Given
            EventStreamIdentity account = account("A-1");
            eventStore.append(account, event("Opened").withEffectiveDate(JAN_10));
            eventStore.append(account, event("Closed").withEffectiveDate(JAN_20));
            Classification classification = classificationEngine.classification(account, "Open");

            // When
            ClassificationVerdict current = classification.classify();
            ClassificationVerdict asOfJan10 = classification.classify(JAN_10);

            // Then
            assertThat(classification.exists()).isTrue();
            assertThat(current.result()).isEqualTo(EXCLUDE);
            assertThat(asOfJan10.isIncluded()).isTrue();
        }
    }

    @Nested
    class GetAllInstanceKeys {

        @Test
        void returns_only_instances_classified_as_include() {
            // Given
            eventStore.append(account("A-1"), event("Opened"));
            eventStore.append(account("A-2"), event("Opened"));
            eventStore.append(account("A-2"), event("Closed"));
            eventStore.append(account("A-3"), event("MoneyDeposited"));
            eventStore.append(account("A-4"), event("Opened"));
            eventStore.append(EventStreamIdentity.of("Bank", "Loan", "L-1"), event("Opened"));

            // When
            List<String> instanceKeys = classificationEngine.getAllInstanceKeys("Bank", "Account", "Open").collect(Collectors.toList());

            // Then
            assertThat(instanceKeys).containsExactlyInAnyOrder("A-1", "A-4");
        }

        @Test
        void empty_classification_type_returns_every_existing_instance() {
            // Given
            eventStore.append(account("A-1"), event("Opened"));
            eventStore.append(account("A-2"), event("Closed"));

            // When
            List<String> instanceKeys = classificationEngine.getAllInstanceKeys("Bank", "Account", "").collect(Collectors.toList());

            // Then
            assertThat(instanceKeys).containsExactlyInAnyOrder("A-1", "A-2");
        }

        @Test
        void honours_the_as_of_date() {
            // Given
            eventStore.append(account("A-1"), event("Opened").withEffectiveDate(JAN_10));
            eventStore.append(account("A-1"), event("Closed").withEffectiveDate(JAN_20));
            eventStore.append(account("A-2"), event("Opened").withEffectiveDate(JAN_20));

            // When
            List<String> instanceKeys = classificationEngine.getAllInstanceKeys("Bank", "Account", "Open", JAN_10).collect(Collectors.toList());

            // Then
            assertThat(instanceKeys).containsExactly("A-1");
        }

        @Test
        void instances_are_classified_lazily_as_the_stream_is_consumed() {
            // Given
            AtomicInteger classified = new AtomicInteger();
            ProjectionRegistry registry = new ProjectionRegistry().register(ClassificationDefinition.builder("Counted")
                    .on("Opened", (current, envelope, evaluationDate) -> {
                        classified.incrementAndGet();
                        return INCLUDE;
                    })
                    .build());
            ClassificationEngine engine = new ClassificationEngine(new ProjectionEngine(eventStore, registry), registry, eventStore);
            eventStore.append(account("A-1"), event("Opened"));
            eventStore.append(account("A-2"), event("Opened"));

            // When
            Stream<String> instanceKeys = engine.getAllInstanceKeys("Bank", "Account", "Counted");

            // Then
            assertThat(classified).hasValue(0);
            assertThat(instanceKeys.findFirst()).isPresent();
            assertThat(classified).hasValue(1);
        }

        @Test
        void throws_projection_processor_not_configured_before_the_stream_is_consumed() {
            // When
            Throwable throwable = catchThrowable(() -> classificationEngine.getAllInstanceKeys("Bank", "Account", "Dormant"));

            // Then
            assertThat(throwable).isExactlyInstanceOf(ProjectionProcessorNotConfiguredException.class);
        }
    }

    private static EventStreamIdentity account(String accountNumber) {
        return EventStreamIdentity.of("Bank", "Account", accountNumber);
    }

    private static EventRecord event(String eventType) {
        return EventRecord.of(eventType, JsonNodeFactory.instance.objectNode());
    }
}
