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

import org.jspecify.annotations.Nullable;

/**
 * The backing store of the event streams couldn't be reached or failed to read or write (I/O error, throttling etc).
 * This is a transient failure and the caller may retry.
 */
public class StreamUnavailableException extends RuntimeException {
    public final @Nullable EventStreamIdentity identity;

    public StreamUnavailableException(@Nullable EventStreamIdentity identity, String message, Throwable cause) {
        super(message, cause);
        this.identity = identity;
    }
}
