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

package org.foldstream.example.domain.bankaccount.application;

import org.foldstream.command.CommandIdentity;
import org.foldstream.command.CommandStepRecord;
import org.foldstream.command.EventSourcedCommandStepTracker;
import org.foldstream.command.StepStatus;
import org.foldstream.eventstore.api.AppendConstraint;
import org.foldstream.eventstore.api.AppendResult;
import org.foldstream.eventstore.api.EventEnvelope;
import org.foldstream.eventstore.api.EventRecord;
import org.foldstream.eventstore.api.EventStreamIdentity;
import org.foldstream.eventstore.api.EventStreamStore;
import org.foldstream.eventstore.api.StreamUnavailableException;
import org.foldstream.eventstore.api.notification.NotificationDispatcher;
import org.foldstream.eventstore.inmemory.InMemoryEventStreamStore;
import org.foldstream.example.domain.bankaccount.AccountProjections;
import org.foldstream.example.domain.bankaccount.infrastructure.AccountEventSerialization;
import org.foldstream.example.domain.bankaccount.model.projections.Balance;
import org.foldstream.example.domain.bankaccount.model.projections.InterestDue;
import org.foldstream.example.domain.bankaccount.model.projections.OverdraftLimit;
import org.foldstream.projection.ProjectionEngine;
import org.foldstream.projection.ProjectionRegistry;
import org.foldstream.retry.RetryStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static java.time.ZoneOffset.UTC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.foldstream.example.domain.bankaccount.AccountProjections.DOMAIN;
import static org.foldstream.example.domain.bankaccount.AccountProjections.account;
import static org.foldstream.example.domain.bankaccount.application.InterestOrchestration.PAY_INTEREST_COMMAND;

@DisplayNameGeneration(ReplaceUnderscores.class)
class InterestOrchestrationTest {
    private static final Clock YESTERDAY = Clock.fixed(Instant.parse("2024-02-29T09:00:00Z"), UTC);
    private static final Clock TODAY = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), UTC);

    private final AccountEventSerialization serialization = new AccountEventSerialization();
    private final AtomicInteger unavailableInterestPaymentsToA1 = new AtomicInteger();
    private ProjectionRegistry registry;
    private EventStreamStore accountStore;
    private ProjectionEngine projectionEngine;
    private EventSourcedCommandStepTracker tracker;
    private ExecutorService executor;
    private InterestOrchestration interestOrchestration;

    @BeforeEach
    void open_accounts_yesterday() {
        registry = AccountProjections.registerAll(new ProjectionRegistry(), serialization);
        accountStore = new InMemoryEventStreamStore(NotificationDispatcher.none(), YESTERDAY) {
            @Override
            public AppendResult append(EventStreamIdentity identity, EventRecord event, AppendConstraint appendConstraint) {
                if (identity.equals(account("A-1")) && event.eventType().equals("InterestPaid") && unavailableInterestPaymentsToA1.getAndDecrement() > 0) {
                    throw new StreamUnavailableException(identity, "Event stream " + identity + " is unavailable", new IOException("Device busy"));
                }
                return super.append(identity, event, appendConstraint);
            }
        };
        projectionEngine = new ProjectionEngine(accountStore, registry);
        tracker = new EventSourcedCommandStepTracker(new InMemoryEventStreamStore());
        executor = Executors.newFixedThreadPool(4);
        interestOrchestration = new InterestOrchestration(accountStore, registry, serialization, tracker, executor, TODAY);

        BankAccountService bankAccountService = new BankAccountService(accountStore, projectionEngine, serialization, YESTERDAY);
        // In credit
        bankAccountService.openAccount("A-1", new BigDecimal("1000"), null, null);
        // Overdrawn with room left in the overdraft
        bankAccountService.openAccount("A-2", null, null, null);
        bankAccountService.setOverdraftLimit("A-2", new BigDecimal("200"), null);
        bankAccountService.withdraw("A-2", new BigDecimal("100"), null);
        // Overdrawn up to the limit
        bankAccountService.openAccount("A-3", null, null, null);
        bankAccountService.setOverdraftLimit("A-3", new BigDecimal("100"), null);
        bankAccountService.withdraw("A-3", new BigDecimal("100"), null);
    }

    @AfterEach
    void shutdown_executor() {
        executor.shutdownNow();
    }

    @Nested
    class AccrueInterest {

        @Test
        void accrues_credit_and_debit_interest_effective_from_the_start_of_today() {
            // When
            InterestRunReport report = interestOrchestration.accrueInterestForAllAccounts();

            // Then
            assertThat(report.allSucceeded()).isTrue();
            assertThat(report.succeededAccounts()).containsExactlyInAnyOrder("A-1", "A-2", "A-3");
            assertThat(interestDue("A-1")).isEqualByComparingTo("0.5");
            assertThat(interestDue("A-2")).isEqualByComparingTo("-0.1");
            assertThat(interestDue("A-3")).isEqualByComparingTo("-0.1");
            EventEnvelope accrual = lastEnvelope("A-1");
            assertThat(accrual.eventType()).isEqualTo("InterestAccrued");
            assertThat(accrual.effectiveDate()).isEqualTo(OffsetDateTime.of(2024, 3, 1, 0, 0, 0, 0, UTC));
            assertThat(accrual.commentary()).isEqualTo("Daily scheduled interest accrual");
        }

        @Test
        void accrues_interest_only_once_per_day() {
            // Given
            interestOrchestration.accrueInterestForAllAccounts();
            long tail = accountStore.read(account("A-1")).currentSequenceNumber();

            // When
            InterestRunReport report = interestOrchestration.accrueInterestForAllAccounts();

            // Then
            assertThat(report.allSucceeded()).isTrue();
            assertThat(accountStore.read(account("A-1")).currentSequenceNumber()).isEqualTo(tail);
            assertThat(interestDue("A-1")).isEqualByComparingTo("0.5");
        }
    }

    @Nested
    class ApplyInterest {

        @BeforeEach
        void accrue_interest() {
            interestOrchestration.accrueInterestForAllAccounts();
        }

        @Test
        void pays_interest_rounded_to_two_decimals_and_extends_overdraft_where_needed() {
            // When
            InterestRunReport report = interestOrchestration.applyInterestForAllAccounts("2024-03");

            // Then
            assertThat(report.allSucceeded()).isTrue();
            assertThat(balance("A-1")).isEqualByComparingTo("1000.50");
            assertThat(balance("A-2")).isEqualByComparingTo("-100.10");
            assertThat(balance("A-3")).isEqualByComparingTo("-100.10");
            assertThat(interestDue("A-1")).isEqualByComparingTo("0");
            assertThat(overdraftLimit("A-2").currentOverdraftLimit()).isEqualByComparingTo("200");
            assertThat(overdraftLimit("A-3").currentOverdraftLimit()).isEqualByComparingTo("110.1");
            assertThat(overdraftLimit("A-3").unauthorised()).isTrue();
            assertThat(tracker.steps(payInterestCommand("2024-03")))
                    .extracting(CommandStepRecord::stepName, CommandStepRecord::status)
                    .containsExactlyInAnyOrder(
                            tuple("Extend overdraft for interest A-1", StepStatus.COMPLETED),
                            tuple("Extend overdraft for interest A-2", StepStatus.COMPLETED),
                            tuple("Extend overdraft for interest A-3", StepStatus.COMPLETED),
                            tuple("Pay interest A-1", StepStatus.COMPLETED),
                            tuple("Pay interest A-2", StepStatus.COMPLETED),
                            tuple("Pay interest A-3", StepStatus.COMPLETED));
        }

        @Test
        void running_the_same_command_again_does_not_pay_interest_twice() {
            // Given
            interestOrchestration.applyInterestForAllAccounts("2024-03");
            long tail = accountStore.read(account("A-1")).currentSequenceNumber();

            // When
            InterestRunReport report = interestOrchestration.applyInterestForAllAccounts("2024-03");

            // Then
            assertThat(report.allSucceeded()).isTrue();
            assertThat(accountStore.read(account("A-1")).currentSequenceNumber()).isEqualTo(tail);
            assertThat(balance("A-1")).isEqualByComparingTo("1000.50");
        }

        @Test
        void accounts_whose_overdraft_step_failed_are_not_paid() {
            // Given
            CommandIdentity command = payInterestCommand("2024-03");
            tracker.initiateStep(command, "Extend overdraft for interest A-3", account("A-3"));
            tracker.stepFailed(command, "Extend overdraft for interest A-3", "Manual intervention");

            // When
            InterestRunReport report = interestOrchestration.applyInterestForAllAccounts("2024-03");

            // Then
            assertThat(report.failedAccounts()).containsExactly("A-3");
            assertThat(report.succeededAccounts()).containsExactlyInAnyOrder("A-1", "A-2");
            assertThat(balance("A-3")).isEqualByComparingTo("-100");
            assertThat(tracker.findStep(command, "Pay interest A-3")).isEmpty();
        }

        @Test
        void step_left_pending_by_an_earlier_run_is_not_run_again() {
            // Given
            CommandIdentity command = payInterestCommand("2024-03");
            tracker.initiateStep(command, "Pay interest A-1", account("A-1"));

            // When
            InterestRunReport report = interestOrchestration.applyInterestForAllAccounts("2024-03");

            // Then
            assertThat(report.failedAccounts()).containsExactly("A-1");
            assertThat(balance("A-1")).isEqualByComparingTo("1000");
            assertThat(tracker.findStep(command, "Pay interest A-1")).get().extracting(CommandStepRecord::status).isEqualTo(StepStatus.INITIATED);
        }

        @Test
        void step_is_retried_when_the_account_stream_is_briefly_unavailable() {
            // Given
            unavailableInterestPaymentsToA1.set(1);

            // When
            InterestRunReport report = interestOrchestration.applyInterestForAllAccounts("2024-03");

            // Then
            assertThat(report.allSucceeded()).isTrue();
            assertThat(balance("A-1")).isEqualByComparingTo("1000.50");
            assertThat(tracker.findStep(payInterestCommand("2024-03"), "Pay interest A-1")).get()
                    .extracting(CommandStepRecord::status, CommandStepRecord::resultText)
                    .containsExactly(StepStatus.COMPLETED, "Interest paid: 0.50");
        }

        @Test
        void step_is_recorded_as_failed_when_the_account_stream_stays_unavailable() {
            // Given
            unavailableInterestPaymentsToA1.set(Integer.MAX_VALUE);
            InterestOrchestration orchestration = new InterestOrchestration(accountStore, registry, serialization, tracker, executor, TODAY,
                    RetryStrategy.fixed(1).maxAttempts(3).retryIf(StreamUnavailableException.class::isInstance));

            // When
            InterestRunReport report = orchestration.applyInterestForAllAccounts("2024-03");

            // Then
            assertThat(report.failedAccounts()).containsExactly("A-1");
            assertThat(report.succeededAccounts()).containsExactlyInAnyOrder("A-2", "A-3");
            assertThat(balance("A-1")).isEqualByComparingTo("1000");
            CommandStepRecord step = tracker.findStep(payInterestCommand("2024-03"), "Pay interest A-1").orElseThrow();
            assertThat(step.status()).isEqualTo(StepStatus.FAILED);
            assertThat(step.resultText()).isEqualTo("Event stream " + account("A-1") + " is unavailable");
        }

        @Test
        void failed_step_is_reported_again_instead_of_being_left_pending_when_the_command_is_rerun() {
            // Given
            unavailableInterestPaymentsToA1.set(Integer.MAX_VALUE);
            InterestOrchestration orchestration = new InterestOrchestration(accountStore, registry, serialization, tracker, executor, TODAY,
                    RetryStrategy.fixed(1).maxAttempts(2).retryIf(StreamUnavailableException.class::isInstance));
            orchestration.applyInterestForAllAccounts("2024-03");
            unavailableInterestPaymentsToA1.set(0);

            // When
            InterestRunReport report = orchestration.applyInterestForAllAccounts("2024-03");

            // Then
            assertThat(report.failedAccounts()).containsExactly("A-1");
            assertThat(balance("A-1")).isEqualByComparingTo("1000");
            assertThat(tracker.steps(payInterestCommand("2024-03")))
                    .extracting(CommandStepRecord::status)
                    .doesNotContain(StepStatus.INITIATED);
        }
    }

    private CommandIdentity payInterestCommand(String commandInstanceId) {
        return new CommandIdentity(DOMAIN, PAY_INTEREST_COMMAND, commandInstanceId);
    }

    private BigDecimal interestDue(String accountNumber) {
        return projectionEngine.<InterestDue>process(account(accountNumber), InterestDue.NAME).state().due();
    }

    private BigDecimal balance(String accountNumber) {
        return projectionEngine.<Balance>process(account(accountNumber), Balance.NAME).state().currentBalance();
    }

    private OverdraftLimit overdraftLimit(String accountNumber) {
        return projectionEngine.<OverdraftLimit>process(account(accountNumber), OverdraftLimit.NAME).state();
    }

    private EventEnvelope lastEnvelope(String accountNumber) {
        var envelopes = accountStore.read(account(accountNumber)).envelopeList();
        return envelopes.get(envelopes.size() - 1);
    }
}
