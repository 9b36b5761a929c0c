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

package org.foldstream.projection;

import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * The result of folding an event stream, or the prefix of it that falls inside an "as of" bound, through a projection.
 * A snapshot holds no reference back to the event store.
 *
 * @param <S> The type of the projection state
 */
public final class ProjectionSnapshot<S> {
    private final String projectionType;
    private final S state;
    private final long currentSequenceNumber;
    private final @Nullable OffsetDateTime asOfDate;

    public ProjectionSnapshot(String projectionType, S state, long currentSequenceNumber, @Nullable OffsetDateTime asOfDate) {
        requireNonNull(projectionType, "Projection type cannot be null");
        requireNonNull(state, "State cannot be null");
        if (currentSequenceNumber < 0) {
            throw new IllegalArgumentException("Current sequence number cannot be negative");
        }
        this.projectionType = projectionType;
        this.state = state;
        this.currentSequenceNumber = currentSequenceNumber;
        this.asOfDate = asOfDate;
    }

    public String projectionType() {
        return projectionType;
    }

    public S state() {
        return state;
    }

    /**
     * @return The sequence number of the last envelope that was inside the "as of" bound, {@code 0} if there was none.
     */
    public long currentSequenceNumber() {
        return currentSequenceNumber;
    }

    /**
     * @return The "as of" bound the snapshot was taken with, or {@code null} if the whole stream was folded
     */
    public @Nullable OffsetDateTime asOfDate() {
        return asOfDate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectionSnapshot)) return false;
        ProjectionSnapshot<?> that = (ProjectionSnapshot<?>) o;
        return currentSequenceNumber == that.currentSequenceNumber && Objects.equals(projectionType, that.projectionType)
                && Objects.equals(state, that.state) && Objects.equals(asOfDate, that.asOfDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectionType, state, currentSequenceNumber, asOfDate);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ProjectionSnapshot.class.getSimpleName() + "[", "]")
                .add("projectionType='" + projectionType + "'")
                .add("state=" + state)
                .add("currentSequenceNumber=" + currentSequenceNumber)
                .add("asOfDate=" + asOfDate)
                .toString();
    }
}
