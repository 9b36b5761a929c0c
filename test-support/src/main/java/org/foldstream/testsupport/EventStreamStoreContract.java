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

package org.foldstream.testsupport;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.foldstream.eventstore.api.*;
import org.foldstream.eventstore.api.notification.NotificationDispatcher;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static java.time.ZoneOffset.UTC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

/**
 * The behavior every {@link EventStreamStore} must have. Extend it from the test of an event store implementation.
 */
@DisplayNameGeneration(ReplaceUnderscores.class)
public abstract class EventStreamStoreContract {

    protected static final EventStreamIdentity ACCOUNT = EventStreamIdentity.of("Bank", "Account", "A-1");

    /**
     * @return A new, empty event store that reports to the given {@code notificationDispatcher}
     */
    protected abstract EventStreamStore newEventStore(NotificationDispatcher notificationDispatcher);

    protected EventStreamStore newEventStore() {
        return newEventStore(NotificationDispatcher.none());
    }

    protected static EventRecord event(String eventType, int amount) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("amount", amount);
        return EventRecord.of(eventType, payload);
    }

    @Test
    void read_and_append() {
        // Given
        EventStreamStore eventStore = newEventStore();
        OffsetDateTime effectiveDate = OffsetDateTime.of(2024, 1, 31, 0, 0, 0, 0, UTC);

        // When
        eventStore.append(ACCOUNT, event("Opened", 0));
        eventStore.append(ACCOUNT, event("MoneyDeposited", 100).withEffectiveDate(effectiveDate).withCommentary("Salary").withSource("Payroll"));

        // Then
        EventStream eventStream = eventStore.read(ACCOUNT);
        assertThat(eventStream.currentSequenceNumber()).isEqualTo(2L);
        List<EventEnvelope> envelopes = eventStream.envelopeList();
        assertThat(envelopes).extracting(EventEnvelope::eventType).containsExactly("Opened", "MoneyDeposited");
        assertThat(envelopes.get(1).payload().get("amount").asInt()).isEqualTo(100);
        assertThat(envelopes.get(1).effectiveDate()).isEqualTo(effectiveDate);
        assertThat(envelopes.get(1).commentary()).isEqualTo("Salary");
        assertThat(envelopes.get(1).source()).isEqualTo("Payroll");
        assertThat(envelopes.get(1).loggedTimestamp()).isNotNull();
    }

    @Test
    void reading_a_stream_that_does_not_exist_returns_an_empty_stream() {
        // When
        EventStream eventStream = newEventStore().read(ACCOUNT);

        // Then
        assertThat(eventStream.isEmpty()).isTrue();
        assertThat(eventStream.identity()).isEqualTo(ACCOUNT);
        assertThat(eventStream.envelopeList()).isEmpty();
    }

    @Test
    void streams_with_different_identities_are_independent() {
        // Given
        EventStreamStore eventStore = newEventStore();
        EventStreamIdentity otherAccount = EventStreamIdentity.of("Bank", "Account", "A-2");

        // When
        eventStore.append(ACCOUNT, event("Opened", 0));
        long otherSequenceNumber = eventStore.append(otherAccount, event("Opened", 0)).getSequenceNumber();

        // Then
        assertThat(otherSequenceNumber).isEqualTo(1L);
        assertThat(eventStore.read(ACCOUNT).currentSequenceNumber()).isEqualTo(1L);
    }

    @Nested
    class Exists {

        @Test
        void returns_false_when_nothing_has_been_appended() {
            assertThat(newEventStore().exists(ACCOUNT)).isFalse();
        }

        @Test
        void returns_true_after_the_first_append() {
            // Given
            EventStreamStore eventStore = newEventStore();

            // When
            eventStore.append(ACCOUNT, event("Opened", 0));

            // Then
            assertThat(eventStore.exists(ACCOUNT)).isTrue();
        }
    }

    @Nested
    class SequenceNumbers {

        @Test
        void sequence_numbers_start_at_one_and_are_contiguous() {
            // Given
            EventStreamStore eventStore = newEventStore();

            // When
            List<Long> sequenceNumbers = IntStream.rangeClosed(1, 5)
                    .mapToObj(i -> eventStore.append(ACCOUNT, event("MoneyDeposited", i)).getSequenceNumber())
                    .collect(Collectors.toList());

            // Then
            assertThat(sequenceNumbers).containsExactly(1L, 2L, 3L, 4L, 5L);
            assertThat(eventStore.read(ACCOUNT).envelopes().map(EventEnvelope::sequenceNumber)).containsExactly(1L, 2L, 3L, 4L, 5L);
        }

        @Test
        void only_the_first_append_reports_that_the_stream_was_created() {
            // Given
            EventStreamStore eventStore = newEventStore();

            // When
            AppendResult first = eventStore.append(ACCOUNT, event("Opened", 0));
            AppendResult second = eventStore.append(ACCOUNT, event("MoneyDeposited", 10));

            // Then
            assertThat(first.isStreamCreated()).isTrue();
            assertThat(second.isStreamCreated()).isFalse();
        }

        @Test
        void concurrent_unconstrained_appends_produce_contiguous_sequence_numbers() throws Exception {
            // Given
            EventStreamStore eventStore = newEventStore();
            int numberOfAppends = 50;

            // When
            List<Long> sequenceNumbers = Concurrently.run(numberOfAppends, i -> eventStore.append(ACCOUNT, event("MoneyDeposited", i)).getSequenceNumber());

            // Then
            assertThat(sequenceNumbers).containsExactlyInAnyOrderElementsOf(LongStreams.closedRange(1, numberOfAppends));
            assertThat(eventStore.read(ACCOUNT).envelopes().map(EventEnvelope::sequenceNumber)).containsExactlyElementsOf(LongStreams.closedRange(1, numberOfAppends));
        }
    }

    @Nested
    class MustBeNew {

        @Test
        void succeeds_when_the_stream_does_not_exist() {
            // When
            AppendResult result = newEventStore().append(ACCOUNT, event("Opened", 0), AppendConstraint.mustBeNew());

            // Then
            assertThat(result.getSequenceNumber()).isEqualTo(1L);
        }

        @Test
        void throws_stream_already_exists_when_the_stream_exists() {
            // Given
            EventStreamStore eventStore = newEventStore();
            eventStore.append(ACCOUNT, event("Opened", 0), AppendConstraint.mustBeNew());

            // When
            Throwable throwable = catchThrowable(() -> eventStore.append(ACCOUNT, event("Opened", 0), AppendConstraint.mustBeNew()));

            // Then
            assertThat(throwable).isExactlyInstanceOf(StreamAlreadyExistsException.class)
                    .hasMessage("Event stream Bank/Account/A-1 already exists (current sequence number is 1).");
            assertThat(eventStore.read(ACCOUNT).currentSequenceNumber()).isEqualTo(1L);
        }

        @Test
        void succeeds_exactly_once_when_appended_concurrently() throws Exception {
            // Given
            EventStreamStore eventStore = newEventStore();

            // When
            List<Object> outcomes = Concurrently.attempt(10, i -> eventStore.append(ACCOUNT, event("Opened", i), AppendConstraint.mustBeNew()));

            // Then
            assertThat(outcomes).filteredOn(AppendResult.class::isInstance).hasSize(1);
            assertThat(outcomes).filteredOn(StreamAlreadyExistsException.class::isInstance).hasSize(9);
            assertThat(eventStore.read(ACCOUNT).currentSequenceNumber()).isEqualTo(1L);
        }
    }

    @Nested
    class ExpectedSequenceNumber {

        @Test
        void appends_when_the_tail_matches() {
            // Given
            EventStreamStore eventStore = newEventStore();
            eventStore.append(ACCOUNT, event("Opened", 0));
            eventStore.append(ACCOUNT, event("MoneyDeposited", 100));

            // When
            AppendResult result = eventStore.append(ACCOUNT, event("MoneyWithdrawn", 50), AppendConstraint.expectedSequenceNumber(2));

            // Then
            assertThat(result.getSequenceNumber()).isEqualTo(3L);
        }

        @Test
        void expected_sequence_number_zero_appends_to_a_stream_that_does_not_exist() {
            // When
            AppendResult result = newEventStore().append(ACCOUNT, event("Opened", 0), AppendConstraint.expectedSequenceNumber(0));

            // Then
            assertThat(result.getSequenceNumber()).isEqualTo(1L);
        }

        @Test
        void throws_concurrency_conflict_when_the_tail_does_not_match() {
            // Given
            EventStreamStore eventStore = newEventStore();
            eventStore.append(ACCOUNT, event("Opened", 0));
            eventStore.append(ACCOUNT, event("MoneyDeposited", 100));
            eventStore.append(ACCOUNT, event("MoneyDeposited", 100));

            // When
            Throwable throwable = catchThrowable(() -> eventStore.append(ACCOUNT, event("MoneyWithdrawn", 50), AppendConstraint.expectedSequenceNumber(2)));

            // Then
            assertThat(throwable).isExactlyInstanceOf(ConcurrencyConflictException.class)
                    .hasMessage("Concurrency conflict on event stream Bank/Account/A-1. Expected sequence number 2 but was 3.");
            ConcurrencyConflictException conflict = (ConcurrencyConflictException) throwable;
            assertThat(conflict.currentSequenceNumber).isEqualTo(3L);
            assertThat(conflict.expectedSequenceNumber).isEqualTo(2L);
            assertThat(eventStore.read(ACCOUNT).currentSequenceNumber()).isEqualTo(3L);
        }

        @Test
        void exactly_one_of_two_concurrent_appends_expecting_the_same_tail_succeeds() throws Exception {
            // Given
            EventStreamStore eventStore = newEventStore();
            eventStore.append(ACCOUNT, event("Opened", 0));
            eventStore.append(ACCOUNT, event("MoneyDeposited", 100));

            // When
            List<Object> outcomes = Concurrently.attempt(2, i -> eventStore.append(ACCOUNT, event("MoneyWithdrawn", i), AppendConstraint.expectedSequenceNumber(2)));

            // Then
            assertThat(outcomes).filteredOn(AppendResult.class::isInstance).hasSize(1);
            assertThat(outcomes).filteredOn(ConcurrencyConflictException.class::isInstance).hasSize(1);
            assertThat(eventStore.read(ACCOUNT).currentSequenceNumber()).isEqualTo(3L);
        }
    }

    @Nested
    class Notifications {

        @Test
        void dispatcher_is_notified_of_stream_creation_and_every_append() {
            // Given
            RecordingNotificationDispatcher dispatcher = new RecordingNotificationDispatcher();
            EventStreamStore eventStore = newEventStore(dispatcher);

            // When
            eventStore.append(ACCOUNT, event("Opened", 0));
            eventStore.append(ACCOUNT, event("MoneyDeposited", 100));

            // Then
            assertThat(dispatcher.notifications()).containsExactly(
                    "created Bank/Account/A-1",
                    "appended Bank/Account/A-1 Opened 1",
                    "appended Bank/Account/A-1 MoneyDeposited 2");
        }

        @Test
        void dispatcher_is_not_notified_when_the_append_is_rejected() {
            // Given
            RecordingNotificationDispatcher dispatcher = new RecordingNotificationDispatcher();
            EventStreamStore eventStore = newEventStore(dispatcher);
            eventStore.append(ACCOUNT, event("Opened", 0));

            // When
            catchThrowable(() -> eventStore.append(ACCOUNT, event("Opened", 0), AppendConstraint.mustBeNew()));

            // Then
            assertThat(dispatcher.notifications()).hasSize(2);
        }

        @Test
        void failing_dispatcher_does_not_fail_the_append() {
            // Given
            EventStreamStore eventStore = newEventStore(new NotificationDispatcher() {
                @Override
                public void notifyStreamCreated(EventStreamIdentity identity) {
                    throw new IllegalStateException("expected");
                }

                @Override
                public void notifyEventAppended(EventStreamIdentity identity, String eventType, long sequenceNumber) {
                    throw new IllegalStateException("expected");
                }
            });

            // When
            AppendResult result = eventStore.append(ACCOUNT, event("Opened", 0));

            // Then
            assertThat(result.getSequenceNumber()).isEqualTo(1L);
            assertThat(eventStore.exists(ACCOUNT)).isTrue();
        }
    }

    @Nested
    class InstanceKeys {

        @Test
        void returns_the_instance_keys_of_existing_streams_of_the_entity_type() {
            // Given
            EventStreamStore eventStore = newEventStore();
            eventStore.append(EventStreamIdentity.of("Bank", "Account", "A-1"), event("Opened", 0));
            eventStore.append(EventStreamIdentity.of("Bank", "Account", "A-2"), event("Opened", 0));
            eventStore.append(EventStreamIdentity.of("Bank", "Loan", "L-1"), event("Opened", 0));
            eventStore.append(EventStreamIdentity.of("Insurance", "Account", "I-1"), event("Opened", 0));

            // When
            List<String> instanceKeys = eventStore.instanceKeys("Bank", "Account").collect(Collectors.toList());

            // Then
            assertThat(instanceKeys).containsExactlyInAnyOrder("A-1", "A-2");
        }

        @Test
        void returns_nothing_when_there_are_no_streams_of_the_entity_type() {
            assertThat(newEventStore().instanceKeys("Bank", "Account")).isEmpty();
        }
    }

    @Test
    void append_rejects_null_event() {
        // When
        Throwable throwable = catchThrowable(() -> newEventStore().append(ACCOUNT, null, AppendConstraint.none()));

        // Then
        assertThat(throwable).isInstanceOf(NullPointerException.class);
    }
}
