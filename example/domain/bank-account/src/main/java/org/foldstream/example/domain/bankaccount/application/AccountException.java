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

/**
 * Base class for business rule violations of an account operation
 */
public abstract class AccountException extends RuntimeException {
    public final String accountNumber;

    protected AccountException(String accountNumber, String message) {
        this(accountNumber, message, null);
    }

    protected AccountException(String accountNumber, String message, Throwable cause) {
        super(message, cause);
        this.accountNumber = accountNumber;
    }
}
