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

package org.foldstream.eventstore.api;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * The {@link AppendConstraint} was not fulfilled so the event has not been written to the event stream.
 */
public abstract class EventStreamWriteException extends RuntimeException {
    public final EventStreamIdentity identity;
    public final long currentSequenceNumber;
    public final AppendConstraint appendConstraint;

    protected EventStreamWriteException(EventStreamIdentity identity, long currentSequenceNumber, AppendConstraint appendConstraint, String message) {
        super(message);
        this.identity = identity;
        this.currentSequenceNumber = currentSequenceNumber;
        this.appendConstraint = appendConstraint;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EventStreamWriteException that = (EventStreamWriteException) o;
        return currentSequenceNumber == that.currentSequenceNumber && Objects.equals(identity, that.identity)
                && Objects.equals(appendConstraint, that.appendConstraint) && Objects.equals(getMessage(), that.getMessage());
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, currentSequenceNumber, appendConstraint);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", getClass().getSimpleName() + "[", "]")
                .add("identity=" + identity)
                .add("currentSequenceNumber=" + currentSequenceNumber)
                .add("appendConstraint=" + appendConstraint)
                .add("message=" + getMessage())
                .toString();
    }
}
