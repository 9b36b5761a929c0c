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
 * Thrown when two projections of the same account were computed at different positions of its event stream
 */
public class ProjectionsOutOfSyncException extends AccountException {
    public final String firstProjectionType;
    public final long firstSequenceNumber;
    public final String secondProjectionType;
    public final long secondSequenceNumber;

    public ProjectionsOutOfSyncException(String accountNumber, String firstProjectionType, long firstSequenceNumber, String secondProjectionType, long secondSequenceNumber) {
        super(accountNumber, String.format("Projections of account %s are out of sync: %s is at sequence number %d but %s is at sequence number %d",
                accountNumber, firstProjectionType, firstSequenceNumber, secondProjectionType, secondSequenceNumber));
        this.firstProjectionType = firstProjectionType;
        this.firstSequenceNumber = firstSequenceNumber;
        this.secondProjectionType = secondProjectionType;
        this.secondSequenceNumber = secondSequenceNumber;
    }
}
