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

public interface EventStreamExists {
    /**
     * Check whether or not an event stream exists, i.e. whether at least one event has been appended to it.
     *
     * @param identity The identity of the stream to check
     * @return {@code true} if the stream exists, {@code false} otherwise.
     * @throws StreamUnavailableException If the backing store couldn't be reached
     */
    boolean exists(EventStreamIdentity identity);
}
