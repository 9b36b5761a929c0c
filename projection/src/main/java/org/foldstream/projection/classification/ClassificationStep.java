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

package org.foldstream.projection.classification;

import org.foldstream.eventstore.api.EventEnvelope;

import java.time.OffsetDateTime;

/**
 * Evaluates one envelope and returns the new classification result.
 */
@FunctionalInterface
public interface ClassificationStep {

    /**
     * @param current        The result before the envelope is applied
     * @param envelope       The envelope
     * @param evaluationDate The date the classification is evaluated for: the "as of" bound if one was requested, otherwise the current time.
     * @return The result after the envelope has been applied
     */
    ClassificationResult evaluate(ClassificationResult current, EventEnvelope envelope, OffsetDateTime evaluationDate);
}
