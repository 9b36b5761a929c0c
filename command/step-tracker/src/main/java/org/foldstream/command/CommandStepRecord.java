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
import org.jspecify.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * The recorded state of one step of a command.
 *
 * @param command    The command the step belongs to
 * @param stepName   The name of the step, unique within the command instance
 * @param status     The current status
 * @param target     The event stream of the entity the step acts on
 * @param resultText A description of the outcome, {@code null} until the step has completed or failed
 */
public record CommandStepRecord(CommandIdentity command, String stepName, StepStatus status, EventStreamIdentity target, @Nullable String resultText) {

    public CommandStepRecord {
        requireNonNull(command, CommandIdentity.class.getSimpleName() + " cannot be null");
        requireNonNull(stepName, "Step name cannot be null");
        requireNonNull(status, StepStatus.class.getSimpleName() + " cannot be null");
        requireNonNull(target, "Target cannot be null");
    }

    public String targetDomain() {
        return target.domainName();
    }

    public String targetEntityType() {
        return target.entityTypeName();
    }

    public String targetInstanceKey() {
        return target.instanceKey();
    }
}
