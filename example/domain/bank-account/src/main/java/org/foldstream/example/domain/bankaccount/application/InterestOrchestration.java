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

import org.foldstream.command.Command;
import org.foldstream.command.CommandIdentity;
import org.foldstream.command.CommandStepException;
import org.foldstream.command.CommandStepRecord;
import org.foldstream.command.CommandStepTracker;
import org.foldstream.command.StepStatus;
import org.foldstream.eventstore.api.AppendConstraint;
import org.foldstream.eventstore.api.ConcurrencyConflictException;
import org.foldstream.eventstore.api.EventRecord;
import org.foldstream.eventstore.api.EventStreamIdentity;
import org.foldstream.eventstore.api.EventStreamStore;
import org.foldstream.eventstore.api.EventStreamWriteException;
import org.foldstream.eventstore.api.StreamUnavailableException;
import org.foldstream.example.domain.bankaccount.infrastructure.AccountEventSerialization;
import org.foldstream.example.domain.bankaccount.model.classifications.InterestAccruedToday;
import org.foldstream.example.domain.bankaccount.model.events.InterestAccrued;
import org.foldstream.example.domain.bankaccount.model.events.InterestPaid;
import org.foldstream.example.domain.bankaccount.model.events.OverdraftLimitSet;
import org.foldstream.example.domain.bankaccount.model.projections.Balance;
import org.foldstream.example.domain.bankaccount.model.projections.InterestDue;
import org.foldstream.example.domain.bankaccount.model.projections.OverdraftLimit;
import org.foldstream.projection.ProjectionEngine;
import org.foldstream.projection.ProjectionRegistry;
import org.foldstream.projection.ProjectionSnapshot;
import org.foldstream.projection.classification.ClassificationEngine;
import org.foldstream.projection.classification.ClassificationVerdict;
import org.foldstream.retry.RetryStrategy;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;
import static org.foldstream.example.domain.bankaccount.AccountProjections.DOMAIN;
import static org.foldstream.example.domain.bankaccount.AccountProjections.ENTITY_TYPE;
import static org.foldstream.example.domain.bankaccount.AccountProjections.account;

/**
 * Runs the interest operations over every account in parallel. Interest is accrued daily and paid on request.
 * Paying interest is a two step command: first every account that can't afford negative interest gets its overdraft
 * extended, then interest is paid into the accounts where the first step succeeded. Both steps are recorded with the
 * {@link CommandStepTracker} so that running the same command again doesn't pay interest twice. A step re-reads the
 * projections it acts on, so it's retried when the account stream is unavailable or changed in between. A step that still
 * fails is recorded as failed.
 */
@NullMarked
public class InterestOrchestration {
    private static final Logger log = LoggerFactory.getLogger(InterestOrchestration.class);

    public static final BigDecimal CREDIT_INTEREST_RATE = new BigDecimal("0.0005");
    public static final BigDecimal DEBIT_INTEREST_RATE = new BigDecimal("0.001");
    public static final String PAY_INTEREST_COMMAND = "Pay Interest";
    public static final String EXTEND_OVERDRAFT_STEP = "Extend overdraft for interest";
    public static final String PAY_INTEREST_STEP = "Pay interest";

    private static final BigDecimal OVERDRAFT_EXTENSION_STEP = BigDecimal.TEN;
    private static final String ALL_ACCOUNTS = "";
    private static final RetryStrategy.Retry DEFAULT_STEP_RETRY_STRATEGY = RetryStrategy.exponentialBackoff(Duration.ofMillis(50), Duration.ofSeconds(1), 2.0)
            .maxAttempts(5)
            .retryIf(e -> e instanceof StreamUnavailableException || e instanceof ConcurrencyConflictException);

    private final EventStreamStore accountStore;
    private final ProjectionEngine projectionEngine;
    private final ClassificationEngine classificationEngine;
    private final AccountEventSerialization serialization;
    private final CommandStepTracker tracker;
    private final ExecutorService executor;
    private final Clock clock;
    private final RetryStrategy.Retry stepRetryStrategy;

    public InterestOrchestration(EventStreamStore accountStore, ProjectionRegistry registry, AccountEventSerialization serialization,
                                 CommandStepTracker tracker, ExecutorService executor, Clock clock) {
        this(accountStore, registry, serialization, tracker, executor, clock, DEFAULT_STEP_RETRY_STRATEGY);
    }

    /**
     * @param stepRetryStrategy How a step of the pay interest command is retried before it's recorded as failed
     */
    public InterestOrchestration(EventStreamStore accountStore, ProjectionRegistry registry, AccountEventSerialization serialization,
                                 CommandStepTracker tracker, ExecutorService executor, Clock clock, RetryStrategy.Retry stepRetryStrategy) {
        requireNonNull(accountStore, EventStreamStore.class.getSimpleName() + " cannot be null");
        requireNonNull(registry, ProjectionRegistry.class.getSimpleName() + " cannot be null");
        requireNonNull(serialization, AccountEventSerialization.class.getSimpleName() + " cannot be null");
        requireNonNull(tracker, CommandStepTracker.class.getSimpleName() + " cannot be null");
        requireNonNull(executor, ExecutorService.class.getSimpleName() + " cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        requireNonNull(stepRetryStrategy, RetryStrategy.class.getSimpleName() + " cannot be null");
        this.accountStore = accountStore;
        this.projectionEngine = new ProjectionEngine(accountStore, registry);
        this.classificationEngine = new ClassificationEngine(projectionEngine, registry, accountStore, clock);
        this.serialization = serialization;
        this.tracker = tracker;
        this.executor = executor;
        this.clock = clock;
        this.stepRetryStrategy = stepRetryStrategy;
    }

    /**
     * Accrue one day of interest, based on the balance at the start of today, for every account that hasn't had
     * interest accrued today.
     */
    public InterestRunReport accrueInterestForAllAccounts() {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        List<String> accounts = allAccounts();
        List<String> failed = forEachAccount(accounts, "accruing interest", accountNumber -> accrueInterest(accountNumber, today));
        return report(accounts, failed);
    }

    /**
     * Pay the interest due on every account
     *
     * @param commandInstanceId Identifies this run. Running again with the same id skips the steps that have already completed.
     */
    public InterestRunReport applyInterestForAllAccounts(String commandInstanceId) {
        Command command = tracker.command(new CommandIdentity(DOMAIN, PAY_INTEREST_COMMAND, commandInstanceId));
        List<String> accounts = allAccounts();

        List<String> overdraftFailures = forEachAccount(accounts, "extending overdraft for interest",
                accountNumber -> runStep(command, stepName(EXTEND_OVERDRAFT_STEP, accountNumber), accountNumber, () -> extendOverdraftForInterest(accountNumber)));
        List<String> readyToPay = accounts.stream().filter(accountNumber -> !overdraftFailures.contains(accountNumber)).collect(Collectors.toList());
        List<String> paymentFailures = forEachAccount(readyToPay, "paying interest",
                accountNumber -> runStep(command, stepName(PAY_INTEREST_STEP, accountNumber), accountNumber, () -> payInterest(accountNumber)));

        List<String> failed = new ArrayList<>(overdraftFailures);
        failed.addAll(paymentFailures);
        return report(accounts, failed);
    }

    boolean accrueInterest(String accountNumber, LocalDate today) {
        EventStreamIdentity account = account(accountNumber);
        ClassificationVerdict verdict = classificationEngine.classify(account, InterestAccruedToday.NAME);
        if (verdict.isIncluded()) {
            log.debug("Interest has already been accrued today for account {}", accountNumber);
            return true;
        }

        OffsetDateTime startOfDay = today.atStartOfDay().atOffset(ZoneOffset.UTC);
        ProjectionSnapshot<Balance> balance = projectionEngine.process(account, Balance.NAME, startOfDay);
        if (balance == null) {
            log.warn("No balance available for account {}", accountNumber);
            return false;
        }

        BigDecimal currentBalance = balance.state().currentBalance();
        BigDecimal rate = currentBalance.signum() >= 0 ? CREDIT_INTEREST_RATE : DEBIT_INTEREST_RATE;
        InterestAccrued accrued = new InterestAccrued(currentBalance.multiply(rate), rate);
        EventRecord record = serialization.serialize(accrued)
                .withEffectiveDate(startOfDay)
                .withCommentary("Daily scheduled interest accrual");
        try {
            accountStore.append(account, record, AppendConstraint.expectedSequenceNumber(verdict.asOfSequence()));
        } catch (EventStreamWriteException e) {
            log.warn("Couldn't accrue interest for account {}: {}", accountNumber, e.getMessage());
            return false;
        }
        log.debug("Accrued interest of {} for account {}", accrued.amountAccrued().toPlainString(), accountNumber);
        return true;
    }

    String extendOverdraftForInterest(String accountNumber) {
        EventStreamIdentity account = account(accountNumber);
        ProjectionSnapshot<InterestDue> interestDue = requireProjection(accountNumber, projectionEngine.process(account, InterestDue.NAME));
        BigDecimal due = interestDue.state().due();
        if (due.signum() >= 0) {
            return "No overdraft extension needed";
        }

        ProjectionSnapshot<Balance> balance = requireProjection(accountNumber, projectionEngine.process(account, Balance.NAME));
        ProjectionSnapshot<OverdraftLimit> overdraft = requireProjection(accountNumber, projectionEngine.process(account, OverdraftLimit.NAME));
        requireInSync(accountNumber, InterestDue.NAME, interestDue, Balance.NAME, balance);
        requireInSync(accountNumber, Balance.NAME, balance, OverdraftLimit.NAME, overdraft);

        BigDecimal overdraftLimit = overdraft.state().currentOverdraftLimit();
        if (balance.state().currentBalance().add(overdraftLimit).add(due).signum() >= 0) {
            return "No overdraft extension needed";
        }

        BigDecimal extension = OVERDRAFT_EXTENSION_STEP.add(due.remainder(OVERDRAFT_EXTENSION_STEP).abs());
        BigDecimal newLimit = overdraftLimit.add(extension);
        EventRecord record = serialization.serialize(new OverdraftLimitSet(newLimit, true))
                .withCommentary("Overdraft extended to pay interest of " + due.toPlainString());
        accountStore.append(account, record, AppendConstraint.expectedSequenceNumber(balance.currentSequenceNumber()));
        log.info("Extended overdraft of account {} to {}", accountNumber, newLimit.toPlainString());
        return "Overdraft extended to " + newLimit.toPlainString();
    }

    String payInterest(String accountNumber) {
        EventStreamIdentity account = account(accountNumber);
        ProjectionSnapshot<InterestDue> interestDue = requireProjection(accountNumber, projectionEngine.process(account, InterestDue.NAME));
        BigDecimal amount = interestDue.state().due().setScale(2, RoundingMode.HALF_UP);
        if (amount.signum() == 0) {
            return "No interest due";
        }
        EventRecord record = serialization.serialize(new InterestPaid(amount))
                .withCommentary("Interest due as at sequence number " + interestDue.currentSequenceNumber());
        accountStore.append(account, record, AppendConstraint.expectedSequenceNumber(interestDue.currentSequenceNumber()));
        log.info("Paid interest of {} to account {}", amount.toPlainString(), accountNumber);
        return "Interest paid: " + amount.toPlainString();
    }

    private boolean runStep(Command command, String stepName, String accountNumber, Supplier<String> step) {
        Optional<CommandStepRecord> existing = command.findStep(stepName);
        if (existing.isPresent()) {
            StepStatus status = existing.get().status();
            log.info("Step {} of command {} has already run (status is {})", stepName, command.identity(), status);
            return status == StepStatus.COMPLETED;
        }

        try {
            command.initiateStep(stepName, account(accountNumber));
        } catch (CommandStepException e) {
            log.warn(e.getMessage());
            return false;
        }

        RetryStrategy retryStrategy = stepRetryStrategy.onRetryableError((info, e) ->
                log.warn("Step {} of command {} failed (attempt {} of {}), retrying in {} ms: {}", stepName, command.identity(), info.attemptNumber(), info.maxAttempts(), info.backoff().toMillis(), e.getMessage()));
        String result;
        try {
            result = retryStrategy.execute(step);
        } catch (AccountException | EventStreamWriteException | StreamUnavailableException e) {
            log.warn("Step {} of command {} failed: {}", stepName, command.identity(), e.getMessage());
            command.stepFailed(stepName, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Step {} of command {} failed unexpectedly", stepName, command.identity(), e);
            command.stepFailed(stepName, e.toString());
            return false;
        }
        command.stepCompleted(stepName, result);
        return true;
    }

    private List<String> forEachAccount(List<String> accounts, String description, Predicate<String> action) {
        Map<String, Future<Boolean>> futures = new LinkedHashMap<>();
        for (String accountNumber : accounts) {
            futures.put(accountNumber, executor.submit(() -> action.test(accountNumber)));
        }

        List<String> failed = new ArrayList<>();
        for (Map.Entry<String, Future<Boolean>> entry : futures.entrySet()) {
            try {
                if (!entry.getValue().get()) {
                    failed.add(entry.getKey());
                }
            } catch (ExecutionException e) {
                log.error("Error while {} for account {}", description, entry.getKey(), e.getCause());
                failed.add(entry.getKey());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.values().forEach(future -> future.cancel(true));
                throw new IllegalStateException("Interrupted while " + description, e);
            }
        }
        if (!failed.isEmpty()) {
            log.warn("Failed {} for accounts {}", description, failed);
        }
        return failed;
    }

    private List<String> allAccounts() {
        return classificationEngine.getAllInstanceKeys(DOMAIN, ENTITY_TYPE, ALL_ACCOUNTS).collect(Collectors.toList());
    }

    private static InterestRunReport report(List<String> accounts, List<String> failed) {
        List<String> succeeded = accounts.stream().filter(accountNumber -> !failed.contains(accountNumber)).collect(Collectors.toList());
        return new InterestRunReport(succeeded, failed);
    }

    private static String stepName(String step, String accountNumber) {
        return step + " " + accountNumber;
    }

    private static <S> ProjectionSnapshot<S> requireProjection(String accountNumber, @Nullable ProjectionSnapshot<S> snapshot) {
        if (snapshot == null) {
            throw new AccountNotFoundException(accountNumber);
        }
        return snapshot;
    }

    private static void requireInSync(String accountNumber, String firstType, ProjectionSnapshot<?> first, String secondType, ProjectionSnapshot<?> second) {
        if (first.currentSequenceNumber() != second.currentSequenceNumber()) {
            throw new ProjectionsOutOfSyncException(accountNumber, firstType, first.currentSequenceNumber(), secondType, second.currentSequenceNumber());
        }
    }
}
