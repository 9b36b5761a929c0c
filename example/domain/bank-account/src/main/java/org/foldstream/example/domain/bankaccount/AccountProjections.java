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

package org.foldstream.example.domain.bankaccount;

import org.foldstream.eventstore.api.EventStreamIdentity;
import org.foldstream.example.domain.bankaccount.infrastructure.AccountEventSerialization;
import org.foldstream.example.domain.bankaccount.model.classifications.InterestAccruedToday;
import org.foldstream.example.domain.bankaccount.model.projections.Balance;
import org.foldstream.example.domain.bankaccount.model.projections.InterestDue;
import org.foldstream.example.domain.bankaccount.model.projections.OverdraftLimit;
import org.foldstream.projection.ProjectionRegistry;

public class AccountProjections {
    public static final String DOMAIN = "Bank";
    public static final String ENTITY_TYPE = "Account";

    private AccountProjections() {
    }

    public static EventStreamIdentity account(String accountNumber) {
        return EventStreamIdentity.of(DOMAIN, ENTITY_TYPE, accountNumber);
    }

    /**
     * Registers every projection and classification of the bank account domain
     */
    public static ProjectionRegistry registerAll(ProjectionRegistry registry, AccountEventSerialization serialization) {
        return registry.register(Balance.definition(serialization))
                .register(OverdraftLimit.definition(serialization))
                .register(InterestDue.definition(serialization))
                .register(InterestAccruedToday.definition());
    }
}
