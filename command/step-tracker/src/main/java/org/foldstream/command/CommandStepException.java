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

import org.jspecify.annotations.Nullable;

/**
 * A step of a command was asked to make a transition that its current status doesn't allow. Nothing has been recorded.
 */
public abstract class CommandStepException extends RuntimeException {
    public final CommandIdentity command;
    public final String stepName;
    public final @Nullable StepStatus currentStatus;

    protected CommandStepException(CommandIdentity command, String stepName, @Nullable StepStatus currentStatus, String message) {
        super(message);
        this.command = command;
        this.stepName = stepName;
        this.currentStatus = currentStatus;
    }
}
