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
import org.foldstream.example.domain.bankaccount.model.events.OverdraftLimitSet;
import org.foldstream.projection.ProjectionDefinition;

import java.math.BigDecimal;

/**
 * The overdraft limit currently in effect. An account without any {@code OverdraftLimitSet} event has no overdraft.
 */
public record OverdraftLimit(BigDecimal currentOverdraftLimit, boolean unauthorised) {
    public static final String NAME = "OverdraftLimit";

    public static ProjectionDefinition<OverdraftLimit> definition(AccountEventSerialization serialization) {
        return ProjectionDefinition.builder(NAME, new OverdraftLimit(BigDecimal.ZERO, false))
                .on("OverdraftLimitSet", (limit, envelope) -> {
                    OverdraftLimitSet event = serialization.deserialize(envelope, OverdraftLimitSet.class);
                    return new OverdraftLimit(event.overdraftLimit(), event.unauthorised());
                })
                .build();
    }
}
