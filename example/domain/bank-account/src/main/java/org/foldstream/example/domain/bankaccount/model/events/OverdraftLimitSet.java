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

package org.foldstream.example.domain.bankaccount.model.events;

import java.math.BigDecimal;

/**
 * @param overdraftLimit The new overdraft limit
 * @param unauthorised   {@code true} if the bank extended the limit by itself, for example to be able to charge interest
 */
public record OverdraftLimitSet(BigDecimal overdraftLimit, boolean unauthorised) implements AccountEvent {
}
