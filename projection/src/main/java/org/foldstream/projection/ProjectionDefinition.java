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

import org.foldstream.eventstore.api.EventEnvelope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Defines a projection type: its name, its initial state and the fold step of each event type it cares about.
 * Envelopes of any other event type are skipped, so new event types never break existing projections.
 * <p>
 * Example:
 * <pre>
 * ProjectionDefinition&lt;Integer&gt; deposits = ProjectionDefinition.builder("TotalDeposited", 0)
 *         .on("MoneyDeposited", (total, envelope) -&gt; total + envelope.payload().get("amount").asInt())
 *         .build();
 * </pre>
 *
 * @param <S> The type of the projection state. Use immutable types, the same state instance may be shared by several snapshots.
 */
public final class ProjectionDefinition<S> {
    private final String name;
    private final S initialState;
    private final Map<String, FoldStep<S>> foldSteps;

    private ProjectionDefinition(String name, S initialState, Map<String, FoldStep<S>> foldSteps) {
        this.name = name;
        this.initialState = initialState;
        this.foldSteps = Collections.unmodifiableMap(new LinkedHashMap<>(foldSteps));
    }

    /**
     * @param name         The projection type name that the projection is registered and requested by
     * @param initialState The state before the first envelope has been applied
     */
    public static <S> Builder<S> builder(String name, S initialState) {
        return new Builder<>(name, initialState);
    }

    public String name() {
        return name;
    }

    public S initialState() {
        return initialState;
    }

    /**
     * @return The event types that this projection has a fold step for
     */
    public Set<String> handledEventTypes() {
        return foldSteps.keySet();
    }

    public boolean handles(String eventType) {
        return foldSteps.containsKey(eventType);
    }

    /**
     * Evolve state by applying the envelope. Returns {@code state} unchanged if the projection doesn't handle the event type of the envelope.
     */
    public S evolve(S state, EventEnvelope envelope) {
        FoldStep<S> foldStep = foldSteps.get(envelope.eventType());
        if (foldStep == null) {
            return state;
        }
        return requireNonNull(foldStep.apply(state, envelope), "Fold step for " + envelope.eventType() + " in projection " + name + " returned null");
    }

    /**
     * Evolve the initial state from envelopes
     */
    public S evolve(Stream<EventEnvelope> envelopes) {
        return envelopes.sequential().reduce(initialState, this::evolve, (left, right) -> right);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectionDefinition)) return false;
        ProjectionDefinition<?> that = (ProjectionDefinition<?>) o;
        return Objects.equals(name, that.name) && Objects.equals(initialState, that.initialState) && Objects.equals(foldSteps, that.foldSteps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, initialState, foldSteps);
    }

    @Override
    public String toString() {
        return "ProjectionDefinition{" +
                "name='" + name + '\'' +
                ", handledEventTypes=" + foldSteps.keySet() +
                '}';
    }

    public static final class Builder<S> {
        private final String name;
        private final S initialState;
        private final Map<String, FoldStep<S>> foldSteps = new LinkedHashMap<>();

        private Builder(String name, S initialState) {
            requireNonNull(name, "Projection name cannot be null");
            requireNonNull(initialState, "Initial state cannot be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Projection name cannot be blank");
            }
            this.name = name;
            this.initialState = initialState;
        }

        /**
         * @param eventType The event type that the fold step applies to
         * @param foldStep  The fold step
         * @return The builder instance
         */
        public Builder<S> on(String eventType, FoldStep<S> foldStep) {
            requireNonNull(eventType, "Event type cannot be null");
            requireNonNull(foldStep, FoldStep.class.getSimpleName() + " cannot be null");
            if (foldSteps.putIfAbsent(eventType, foldStep) != null) {
                throw new IllegalArgumentException("Projection " + name + " already has a fold step for event type " + eventType);
            }
            return this;
        }

        public ProjectionDefinition<S> build() {
            return new ProjectionDefinition<>(name, initialState, foldSteps);
        }
    }
}
