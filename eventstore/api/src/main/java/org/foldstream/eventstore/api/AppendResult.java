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
 * The result of a successful append to an event stream.
 */
public class AppendResult {

    private final EventStreamIdentity identity;
    private final long sequenceNumber;
    private final boolean streamCreated;

    public AppendResult(EventStreamIdentity identity, long sequenceNumber, boolean streamCreated) {
        this.identity = identity;
        this.sequenceNumber = sequenceNumber;
        this.streamCreated = streamCreated;
    }

    public EventStreamIdentity getIdentity() {
        return identity;
    }

    /**
     * @return The sequence number assigned to the appended event
     */
    public long getSequenceNumber() {
        return sequenceNumber;
    }

    /**
     * @return {@code true} if the append created the event stream, i.e. the event is the first one in the stream.
     */
    public boolean isStreamCreated() {
        return streamCreated;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AppendResult)) return false;
        AppendResult that = (AppendResult) o;
        return sequenceNumber == that.sequenceNumber && streamCreated == that.streamCreated && Objects.equals(identity, that.identity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, sequenceNumber, streamCreated);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", AppendResult.class.getSimpleName() + "[", "]")
                .add("identity=" + identity)
                .add("sequenceNumber=" + sequenceNumber)
                .add("streamCreated=" + streamCreated)
                .toString();
    }
}
