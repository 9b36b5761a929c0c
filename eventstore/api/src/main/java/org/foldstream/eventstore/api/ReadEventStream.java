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

public interface ReadEventStream {

    /**
     * Read all envelopes from a particular event stream. Reading never observes a partially written envelope.
     *
     * @param identity The identity of the stream to read.
     * @return An {@link EventStream} containing the envelopes of the stream. Will return an {@link EventStream} with sequence number {@code 0} if event stream doesn't exist.
     * @throws StreamUnavailableException If the backing store couldn't be reached
     */
    EventStream read(EventStreamIdentity identity);
}
