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

import java.util.stream.Stream;

/**
 * Event stores that can enumerate the entity instances that have an event stream.
 */
public interface EventStreamInstances {

    /**
     * @return A lazy stream of the instance keys of all existing event streams of the given domain and entity type.
     * Streams created after the enumeration started may or may not be included.
     * @throws StreamUnavailableException If the backing store couldn't be reached
     */
    Stream<String> instanceKeys(String domainName, String entityTypeName);
}
