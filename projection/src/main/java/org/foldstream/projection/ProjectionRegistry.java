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

import org.foldstream.projection.classification.ClassificationDefinition;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * Maps projection and classification type names to their definitions. Populate it at startup, before any projection is requested.
 * Projections and classifications share the same namespace.
 */
public class ProjectionRegistry {
    private final Map<String, ProjectionDefinition<?>> projections = new ConcurrentHashMap<>();
    private final Map<String, ClassificationDefinition> classifications = new ConcurrentHashMap<>();

    public ProjectionRegistry register(ProjectionDefinition<?> projection) {
        requireNonNull(projection, ProjectionDefinition.class.getSimpleName() + " cannot be null");
        synchronized (this) {
            requireUnregistered(projection.name());
            projections.put(projection.name(), projection);
        }
        return this;
    }

    public ProjectionRegistry register(ClassificationDefinition classification) {
        requireNonNull(classification, ClassificationDefinition.class.getSimpleName() + " cannot be null");
        synchronized (this) {
            requireUnregistered(classification.name());
            classifications.put(classification.name(), classification);
        }
        return this;
    }

    /**
     * @param name The projection type name
     * @param <S>  The state type of the projection, it's up to the caller to request the type the projection was registered with.
     * @return The projection definition
     * @throws ProjectionProcessorNotConfiguredException If no projection is registered with the given name
     */
    @SuppressWarnings("unchecked")
    public <S> ProjectionDefinition<S> projection(String name) {
        requireNonNull(name, "Projection type cannot be null");
        ProjectionDefinition<?> projection = projections.get(name);
        if (projection == null) {
            throw new ProjectionProcessorNotConfiguredException(name, "No projection named " + name + " has been registered");
        }
        return (ProjectionDefinition<S>) projection;
    }

    /**
     * @throws ProjectionProcessorNotConfiguredException If no classification is registered with the given name
     */
    public ClassificationDefinition classification(String name) {
        requireNonNull(name, "Classification type cannot be null");
        ClassificationDefinition classification = classifications.get(name);
        if (classification == null) {
            throw new ProjectionProcessorNotConfiguredException(name, "No classification named " + name + " has been registered");
        }
        return classification;
    }

    public boolean isRegistered(String name) {
        return projections.containsKey(name) || classifications.containsKey(name);
    }

    private void requireUnregistered(String name) {
        if (isRegistered(name)) {
            throw new IllegalStateException("A projection or classification named " + name + " is already registered");
        }
    }
}
