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

/**
 * Thrown when an overdraft limit would be set below what the account is already overdrawn by
 */
public class OverdraftLimitTooLowException extends AccountException {
    public final BigDecimal requestedLimit;
    public final BigDecimal currentBalance;

    public OverdraftLimitTooLowException(String accountNumber, BigDecimal requestedLimit, BigDecimal currentBalance) {
        super(accountNumber, String.format("Account %s has a balance of %s which exceeds the requested overdraft limit of %s",
                accountNumber, currentBalance.toPlainString(), requestedLimit.toPlainString()));
        this.requestedLimit = requestedLimit;
        this.currentBalance = currentBalance;
    }
}
