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

import org.foldstream.projection.ProjectionDefinition;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * A projection whose state is a {@link ClassificationResult}. The initial result is {@link ClassificationResult#UNKNOWN}.
 */
public final class ClassificationDefinition {
    private final String name;
    private final Map<String, ClassificationStep> steps;

    private ClassificationDefinition(String name, Map<String, ClassificationStep> steps) {
        this.name = name;
        this.steps = steps;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    /**
     * @return The projection that evaluates this classification for the given {@code evaluationDate}
     */
    public ProjectionDefinition<ClassificationResult> toProjection(OffsetDateTime evaluationDate) {
        requireNonNull(evaluationDate, "Evaluation date cannot be null");
        ProjectionDefinition.Builder<ClassificationResult> builder = ProjectionDefinition.builder(name, ClassificationResult.UNKNOWN);
        steps.forEach((eventType, step) -> builder.on(eventType, (current, envelope) -> step.evaluate(current, envelope, evaluationDate)));
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClassificationDefinition)) return false;
        ClassificationDefinition that = (ClassificationDefinition) o;
        return Objects.equals(name, that.name) && Objects.equals(steps, that.steps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, steps);
    }

    @Override
    public String toString() {
        return "ClassificationDefinition{" +
                "name='" + name + '\'' +
                ", handledEventTypes=" + steps.keySet() +
                '}';
    }

    public static final class Builder {
        private final String name;
        private final Map<String, ClassificationStep> steps = new LinkedHashMap<>();

        private Builder(String name) {
            requireNonNull(name, "Classification name cannot be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Classification name cannot be blank");
            }
            this.name = name;
        }

        /**
         * Use {@code result} whenever an envelope of {@code eventType} is encountered
         */
        public Builder on(String eventType, ClassificationResult result) {
            requireNonNull(result, ClassificationResult.class.getSimpleName() + " cannot be null");
            return on(eventType, (current, envelope, evaluationDate) -> result);
        }

        public Builder on(String eventType, ClassificationStep step) {
            requireNonNull(eventType, "Event type cannot be null");
            requireNonNull(step, ClassificationStep.class.getSimpleName() + " cannot be null");
            if (steps.putIfAbsent(eventType, step) != null) {
                throw new IllegalArgumentException("Classification " + name + " already has a step for event type " + eventType);
            }
            return this;
        }

        public ClassificationDefinition build() {
            return new ClassificationDefinition(name, new LinkedHashMap<>(steps));
        }
    }
}
