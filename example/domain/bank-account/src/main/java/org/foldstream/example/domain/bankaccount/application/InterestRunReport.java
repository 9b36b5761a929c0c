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

import java.util.List;

/**
 * The outcome of running an interest operation over all accounts
 *
 * @param succeededAccounts Accounts that were processed, including those where nothing needed to be done
 * @param failedAccounts    Accounts that couldn't be processed
 */
public record InterestRunReport(List<String> succeededAccounts, List<String> failedAccounts) {

    public InterestRunReport {
        succeededAccounts = List.copyOf(succeededAccounts);
        failedAccounts = List.copyOf(failedAccounts);
    }

    public boolean allSucceeded() {
        return failedAccounts.isEmpty();
    }
}
