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

import static java.util.Objects.requireNonNull;

/**
 * A handle to one command instance
 */
public class Command {
    private final CommandStepTracker tracker;
    private final CommandIdentity identity;

    public Command(CommandStepTracker tracker, CommandIdentity identity) {
        requireNonNull(tracker, CommandStepTracker.class.getSimpleName() + " cannot be null");
        requireNonNull(identity, CommandIdentity.class.getSimpleName() + " cannot be null");
        this.tracker = tracker;
        this.identity = identity;
    }

    public CommandIdentity identity() {
        return identity;
    }

    public CommandStepRecord initiateStep(String stepName, EventStreamIdentity target) {
        return tracker.initiateStep(identity, stepName, target);
    }

    public CommandStepRecord stepCompleted(String stepName, @Nullable String resultText) {
        return tracker.stepCompleted(identity, stepName, resultText);
    }

    public CommandStepRecord stepFailed(String stepName, @Nullable String resultText) {
        return tracker.stepFailed(identity, stepName, resultText);
    }

    public Optional<CommandStepRecord> findStep(String stepName) {
        return tracker.findStep(identity, stepName);
    }

    public List<CommandStepRecord> steps() {
        return tracker.steps(identity);
    }

    @Override
    public String toString() {
        return "Command{" + "identity=" + identity + '}';
    }
}
