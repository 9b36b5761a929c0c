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

/**
 * Thrown when a step that has already been initiated (and maybe completed or failed) is initiated again.
 * This is what stops a retried orchestration from executing a step twice.
 */
public class StepAlreadyInitiatedException extends CommandStepException {

    public StepAlreadyInitiatedException(CommandIdentity command, String stepName, StepStatus currentStatus) {
        super(command, stepName, currentStatus, String.format("Step %s of command %s has already been initiated (status is %s).", stepName, command, currentStatus));
    }
}
