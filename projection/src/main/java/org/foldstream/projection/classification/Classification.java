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

import org.foldstream.eventstore.api.EventStreamIdentity;
import org.foldstream.projection.ProjectionEngine;
import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * A handle to one classification type of one event stream
 */
public class Classification {
    private final ClassificationEngine classificationEngine;
    private final ProjectionEngine projectionEngine;
    private final EventStreamIdentity identity;
    private final String classificationType;

    Classification(ClassificationEngine classificationEngine, ProjectionEngine projectionEngine, EventStreamIdentity identity, String classificationType) {
        requireNonNull(identity, EventStreamIdentity.class.getSimpleName() + " cannot be null");
        requireNonNull(classificationType, "Classification type cannot be null");
        this.classificationEngine = classificationEngine;
        this.projectionEngine = projectionEngine;
        this.identity = identity;
        this.classificationType = classificationType;
    }

    public EventStreamIdentity identity() {
        return identity;
    }

    public boolean exists() {
        return projectionEngine.exists(identity);
    }

    public ClassificationVerdict classify() {
        return classificationEngine.classify(identity, classificationType);
    }

    public ClassificationVerdict classify(@Nullable OffsetDateTime asOfDate) {
        return classificationEngine.classify(identity, classificationType, asOfDate);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", Classification.class.getSimpleName() + "[", "]")
                .add("identity=" + identity)
                .add("classificationType='" + classificationType + "'")
                .toString();
    }
}
