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

package org.foldstream.example.domain.bankaccount.model.projections;

import org.foldstream.example.domain.bankaccount.infrastructure.AccountEventSerialization;
import org.foldstream.example.domain.bankaccount.model.events.InterestPaid;
import org.foldstream.example.domain.bankaccount.model.events.MoneyDeposited;
import org.foldstream.example.domain.bankaccount.model.events.MoneyWithdrawn;
import org.foldstream.projection.ProjectionDefinition;

import java.math.BigDecimal;

/**
 * The running balance of an account: deposits and paid interest minus withdrawals
 */
public record Balance(BigDecimal currentBalance) {
    public static final String NAME = "Balance";

    public static ProjectionDefinition<Balance> definition(AccountEventSerialization serialization) {
        return ProjectionDefinition.builder(NAME, new Balance(BigDecimal.ZERO))
                .on("MoneyDeposited", (balance, envelope) -> balance.plus(serialization.deserialize(envelope, MoneyDeposited.class).amountDeposited()))
                .on("MoneyWithdrawn", (balance, envelope) -> balance.plus(serialization.deserialize(envelope, MoneyWithdrawn.class).amountWithdrawn().negate()))
                .on("InterestPaid", (balance, envelope) -> balance.plus(serialization.deserialize(envelope, InterestPaid.class).amountPaid()))
                .build();
    }

    public Balance plus(BigDecimal amount) {
        return new Balance(currentBalance.add(amount));
    }
}
