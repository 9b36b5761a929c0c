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

package org.foldstream.projection;

/**
 * Thrown when a projection or classification is requested by a name that hasn't been registered in the {@link ProjectionRegistry}.
 * This is a configuration error and retrying won't help.
 */
public class ProjectionProcessorNotConfiguredException extends RuntimeException {
    public final String projectionType;

    public ProjectionProcessorNotConfiguredException(String projectionType, String message) {
        super(message);
        this.projectionType = projectionType;
    }
}
