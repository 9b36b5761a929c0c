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

package org.foldstream.command;

import org.foldstream.eventstore.api.EventStreamIdentity;

import java.util.Objects;

/**
 * Identifies one execution of a multi-step business command.
 *
 * @param domainName        The domain the command belongs to, for example {@code Bank}
 * @param commandName       The name of the command, for example {@code ApplyAccruedInterest}
 * @param commandInstanceId The id of this execution of the command
 */
public record CommandIdentity(String domainName, String commandName, String commandInstanceId) {

    public CommandIdentity {
        requireNotBlank(domainName, "Domain name");
        requireNotBlank(commandName, "Command name");
        requireNotBlank(commandInstanceId, "Command instance id");
    }

    public static CommandIdentity of(String domainName, String commandName, String commandInstanceId) {
        return new CommandIdentity(domainName, commandName, commandInstanceId);
    }

    /**
     * @return The identity of the event stream that records the steps of this command
     */
    public EventStreamIdentity toEventStreamIdentity() {
        return EventStreamIdentity.of(domainName, commandName, commandInstanceId);
    }

    @Override
    public String toString() {
        return domainName + "/" + commandName + "/" + commandInstanceId;
    }

    private static void requireNotBlank(String value, String name) {
        Objects.requireNonNull(value, name + " cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be blank");
        }
    }
}
