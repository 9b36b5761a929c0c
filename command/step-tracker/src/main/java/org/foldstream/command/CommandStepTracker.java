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

import java.util.List;
import java.util.Optional;

/**
 * Records the steps of multi-step business commands. Each step of a command instance moves from
 * {@link StepStatus#INITIATED} to either {@link StepStatus#COMPLETED} or {@link StepStatus#FAILED}, once.
 * The tracker only records facts and enforces the transitions, retrying is up to the orchestrator.
 */
public interface CommandStepTracker {

    /**
     * Record that a step has started
     *
     * @param command  The command instance
     * @param stepName The name of the step
     * @param target   The event stream of the entity the step will act on
     * @return The recorded step
     * @throws StepAlreadyInitiatedException If the step has already been initiated
     */
    CommandStepRecord initiateStep(CommandIdentity command, String stepName, EventStreamIdentity target);

    /**
     * Record that an initiated step has completed
     *
     * @throws StepNotInitiatedException If the step isn't initiated, or has already completed or failed
     */
    CommandStepRecord stepCompleted(CommandIdentity command, String stepName, @Nullable String resultText);

    /**
     * Record that an initiated step has failed
     *
     * @throws StepNotInitiatedException If the step isn't initiated, or has already completed or failed
     */
    CommandStepRecord stepFailed(CommandIdentity command, String stepName, @Nullable String resultText);

    Optional<CommandStepRecord> findStep(CommandIdentity command, String stepName);

    /**
     * @return All steps of the command in the order they were initiated
     */
    List<CommandStepRecord> steps(CommandIdentity command);

    /**
     * @return A handle for one command instance
     */
    default Command command(CommandIdentity command) {
        return new Command(this, command);
    }
}
