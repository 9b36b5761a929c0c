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
 * Thrown when a step is completed or failed without being in the {@link StepStatus#INITIATED} status, either because it was
 * never initiated or because it has already completed or failed.
 */
public class StepNotInitiatedException extends CommandStepException {

    public StepNotInitiatedException(CommandIdentity command, String stepName, @Nullable StepStatus currentStatus) {
        super(command, stepName, currentStatus, currentStatus == null ?
                String.format("Step %s of command %s has not been initiated.", stepName, command) :
                String.format("Step %s of command %s is not initiated (status is %s).", stepName, command, currentStatus));
    }
}
