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
import org.foldstream.example.domain.bankaccount.model.events.InterestAccrued;
import org.foldstream.example.domain.bankaccount.model.events.InterestPaid;
import org.foldstream.projection.ProjectionDefinition;

import java.math.BigDecimal;

/**
 * Interest accrued on an account that hasn't been paid yet. A negative amount is owed by the account holder.
 */
public record InterestDue(BigDecimal totalAccrued, BigDecimal totalPaid) {
    public static final String NAME = "InterestDue";

    public static ProjectionDefinition<InterestDue> definition(AccountEventSerialization serialization) {
        return ProjectionDefinition.builder(NAME, new InterestDue(BigDecimal.ZERO, BigDecimal.ZERO))
                .on("InterestAccrued", (due, envelope) -> new InterestDue(due.totalAccrued.add(serialization.deserialize(envelope, InterestAccrued.class).amountAccrued()), due.totalPaid))
                .on("InterestPaid", (due, envelope) -> new InterestDue(due.totalAccrued, due.totalPaid.add(serialization.deserialize(envelope, InterestPaid.class).amountPaid())))
                .build();
    }

    public BigDecimal due() {
        return totalAccrued.subtract(totalPaid);
    }
}
