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

import org.foldstream.eventstore.api.AppendConstraint;
import org.foldstream.eventstore.api.AppendResult;
import org.foldstream.eventstore.api.EventRecord;
import org.foldstream.eventstore.api.EventStreamIdentity;
import org.foldstream.eventstore.api.EventStreamStore;
import org.foldstream.eventstore.api.StreamAlreadyExistsException;
import org.foldstream.example.domain.bankaccount.infrastructure.AccountEventSerialization;
import org.foldstream.example.domain.bankaccount.model.events.AccountEvent;
import org.foldstream.example.domain.bankaccount.model.events.BeneficiarySet;
import org.foldstream.example.domain.bankaccount.model.events.MoneyDeposited;
import org.foldstream.example.domain.bankaccount.model.events.MoneyWithdrawn;
import org.foldstream.example.domain.bankaccount.model.events.Opened;
import org.foldstream.example.domain.bankaccount.model.events.OverdraftLimitSet;
import org.foldstream.example.domain.bankaccount.model.projections.Balance;
import org.foldstream.example.domain.bankaccount.model.projections.OverdraftLimit;
import org.foldstream.projection.ProjectionEngine;
import org.foldstream.projection.ProjectionSnapshot;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;

import static java.util.Objects.requireNonNull;
import static org.foldstream.example.domain.bankaccount.AccountProjections.account;

/**
 * Application service for bank accounts. Every operation validates against projections and appends an event to the
 * event stream of the account. Operations that depend on the balance append with an expected sequence number so that
 * a concurrent change to the account makes them fail with a {@link org.foldstream.eventstore.api.ConcurrencyConflictException}.
 */
@NullMarked
public class BankAccountService {
    private static final Logger log = LoggerFactory.getLogger(BankAccountService.class);

    private final EventStreamStore eventStore;
    private final ProjectionEngine projectionEngine;
    private final AccountEventSerialization serialization;
    private final Clock clock;

    public BankAccountService(EventStreamStore eventStore, ProjectionEngine projectionEngine, AccountEventSerialization serialization, Clock clock) {
        requireNonNull(eventStore, EventStreamStore.class.getSimpleName() + " cannot be null");
        requireNonNull(projectionEngine, ProjectionEngine.class.getSimpleName() + " cannot be null");
        requireNonNull(serialization, AccountEventSerialization.class.getSimpleName() + " cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.eventStore = eventStore;
        this.projectionEngine = projectionEngine;
        this.serialization = serialization;
        this.clock = clock;
    }

    /**
     * Open a new account, optionally with an opening deposit and a beneficiary
     *
     * @return The sequence number of the last event written
     * @throws AccountAlreadyExistsException If the account has already been opened
     */
    public long openAccount(String accountNumber, @Nullable BigDecimal openingDeposit, @Nullable String beneficiaryName, @Nullable String commentary) {
        EventStreamIdentity account = account(accountNumber);
        long sequenceNumber;
        try {
            sequenceNumber = append(account, new Opened(OffsetDateTime.now(clock)), commentary, AppendConstraint.mustBeNew());
        } catch (StreamAlreadyExistsException e) {
            throw new AccountAlreadyExistsException(accountNumber, e);
        }
        log.info("Opened account {}", accountNumber);

        if (openingDeposit != null && openingDeposit.signum() > 0) {
            sequenceNumber = append(account, new MoneyDeposited(openingDeposit), "Opening deposit", AppendConstraint.expectedSequenceNumber(sequenceNumber));
        }
        if (beneficiaryName != null && !beneficiaryName.isBlank()) {
            sequenceNumber = append(account, new BeneficiarySet(beneficiaryName), commentary, AppendConstraint.expectedSequenceNumber(sequenceNumber));
        }
        return sequenceNumber;
    }

    /**
     * @return The sequence number of the deposit
     */
    public long deposit(String accountNumber, BigDecimal amount, @Nullable String commentary) {
        requirePositive(amount);
        EventStreamIdentity account = requireExistingAccount(accountNumber);
        return append(account, new MoneyDeposited(amount), commentary, AppendConstraint.none());
    }

    /**
     * Withdraw money if the balance together with the overdraft limit covers the amount
     *
     * @return The sequence number of the withdrawal
     * @throws InsufficientFundsException    If the amount isn't covered
     * @throws ProjectionsOutOfSyncException If the balance and overdraft limit were computed at different stream positions
     * @throws BalanceUnavailableException   If no balance could be computed for the account
     */
    public long withdraw(String accountNumber, BigDecimal amount, @Nullable String commentary) {
        requirePositive(amount);
        EventStreamIdentity account = requireExistingAccount(accountNumber);
        ProjectionSnapshot<Balance> balance = balance(accountNumber, account);
        ProjectionSnapshot<OverdraftLimit> overdraft = projectionEngine.process(account, OverdraftLimit.NAME);
        if (overdraft == null) {
            throw new BalanceUnavailableException(accountNumber);
        }
        if (balance.currentSequenceNumber() != overdraft.currentSequenceNumber()) {
            throw new ProjectionsOutOfSyncException(accountNumber, Balance.NAME, balance.currentSequenceNumber(), OverdraftLimit.NAME, overdraft.currentSequenceNumber());
        }

        BigDecimal currentBalance = balance.state().currentBalance();
        BigDecimal overdraftLimit = overdraft.state().currentOverdraftLimit();
        if (currentBalance.add(overdraftLimit).compareTo(amount) < 0) {
            throw new InsufficientFundsException(accountNumber, amount, currentBalance, overdraftLimit);
        }
        return append(account, new MoneyWithdrawn(amount), commentary, AppendConstraint.expectedSequenceNumber(balance.currentSequenceNumber()));
    }

    /**
     * @return The sequence number of the change
     */
    public long setBeneficiary(String accountNumber, String beneficiaryName, @Nullable String commentary) {
        requireNonNull(beneficiaryName, "Beneficiary name cannot be null");
        if (beneficiaryName.isBlank()) {
            throw new IllegalArgumentException("Beneficiary name cannot be blank");
        }
        EventStreamIdentity account = requireExistingAccount(accountNumber);
        return append(account, new BeneficiarySet(beneficiaryName), commentary, AppendConstraint.none());
    }

    /**
     * Set a new overdraft limit. The limit must cover the amount the account is currently overdrawn by.
     *
     * @return The sequence number of the change
     * @throws OverdraftLimitTooLowException If the account is overdrawn by more than the new limit
     * @throws BalanceUnavailableException   If no balance could be computed for the account
     */
    public long setOverdraftLimit(String accountNumber, BigDecimal overdraftLimit, @Nullable String commentary) {
        requireNonNull(overdraftLimit, "Overdraft limit cannot be null");
        if (overdraftLimit.signum() < 0) {
            throw new IllegalArgumentException("Overdraft limit cannot be negative");
        }
        EventStreamIdentity account = requireExistingAccount(accountNumber);
        ProjectionSnapshot<Balance> balance = balance(accountNumber, account);
        BigDecimal currentBalance = balance.state().currentBalance();
        if (currentBalance.compareTo(overdraftLimit.negate()) < 0) {
            throw new OverdraftLimitTooLowException(accountNumber, overdraftLimit, currentBalance);
        }
        return append(account, new OverdraftLimitSet(overdraftLimit, false), commentary, AppendConstraint.expectedSequenceNumber(balance.currentSequenceNumber()));
    }

    public ProjectionSnapshot<Balance> getBalance(String accountNumber) {
        return getBalance(accountNumber, null);
    }

    /**
     * @param asOfDate Only take events effective on or before this date into account, or {@code null} for the current balance
     * @throws AccountNotFoundException If the account doesn't exist
     */
    public ProjectionSnapshot<Balance> getBalance(String accountNumber, @Nullable OffsetDateTime asOfDate) {
        EventStreamIdentity account = account(accountNumber);
        ProjectionSnapshot<Balance> balance = projectionEngine.process(account, Balance.NAME, asOfDate);
        if (balance == null) {
            throw new AccountNotFoundException(accountNumber);
        }
        return balance;
    }

    private ProjectionSnapshot<Balance> balance(String accountNumber, EventStreamIdentity account) {
        ProjectionSnapshot<Balance> balance = projectionEngine.process(account, Balance.NAME);
        if (balance == null) {
            throw new BalanceUnavailableException(accountNumber);
        }
        return balance;
    }

    private EventStreamIdentity requireExistingAccount(String accountNumber) {
        EventStreamIdentity account = account(accountNumber);
        if (!eventStore.exists(account)) {
            throw new AccountNotFoundException(accountNumber);
        }
        return account;
    }

    private long append(EventStreamIdentity account, AccountEvent event, @Nullable String commentary, AppendConstraint constraint) {
        EventRecord record = serialization.serialize(event).withCommentary(commentary);
        AppendResult result = eventStore.append(account, record, constraint);
        log.debug("Appended {} to account {} at sequence number {}", event.eventType(), account.instanceKey(), result.getSequenceNumber());
        return result.getSequenceNumber();
    }

    private static void requirePositive(BigDecimal amount) {
        requireNonNull(amount, "Amount cannot be null");
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be greater than zero");
        }
    }
}
