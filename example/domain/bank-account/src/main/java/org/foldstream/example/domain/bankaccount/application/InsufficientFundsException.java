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

import java.math.BigDecimal;

public class InsufficientFundsException extends AccountException {
    public final BigDecimal requestedAmount;
    public final BigDecimal currentBalance;
    public final BigDecimal overdraftLimit;

    public InsufficientFundsException(String accountNumber, BigDecimal requestedAmount, BigDecimal currentBalance, BigDecimal overdraftLimit) {
        super(accountNumber, String.format("Account %s has insufficient funds to withdraw %s (balance is %s and overdraft limit is %s)",
                accountNumber, requestedAmount.toPlainString(), currentBalance.toPlainString(), overdraftLimit.toPlainString()));
        this.requestedAmount = requestedAmount;
        this.currentBalance = currentBalance;
        this.overdraftLimit = overdraftLimit;
    }
}
