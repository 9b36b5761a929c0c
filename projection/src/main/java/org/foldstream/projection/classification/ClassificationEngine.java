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
import org.foldstream.eventstore.api.EventStreamInstances;
import org.foldstream.projection.ProjectionEngine;
import org.foldstream.projection.ProjectionProcessorNotConfiguredException;
import org.foldstream.projection.ProjectionRegistry;
import org.foldstream.projection.ProjectionSnapshot;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Classifies event streams as {@link ClassificationResult#INCLUDE included}, {@link ClassificationResult#EXCLUDE excluded} or
 * {@link ClassificationResult#UNKNOWN unknown} using the classifications in a {@link ProjectionRegistry}. The fold and "as of" rules
 * are those of the {@link ProjectionEngine}.
 */
public class ClassificationEngine {
    private final ProjectionEngine projectionEngine;
    private final ProjectionRegistry registry;
    private final EventStreamInstances instances;
    private final Clock clock;

    public ClassificationEngine(ProjectionEngine projectionEngine, ProjectionRegistry registry, EventStreamInstances instances) {
        this(projectionEngine, registry, instances, Clock.systemUTC());
    }

    /**
     * @param clock Defines the evaluation date of classifications that are made without an "as of" date
     */
    public ClassificationEngine(ProjectionEngine projectionEngine, ProjectionRegistry registry, EventStreamInstances instances, Clock clock) {
        requireNonNull(projectionEngine, ProjectionEngine.class.getSimpleName() + " cannot be null");
        requireNonNull(registry, ProjectionRegistry.class.getSimpleName() + " cannot be null");
        requireNonNull(instances, EventStreamInstances.class.getSimpleName() + " cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.projectionEngine = projectionEngine;
        this.registry = registry;
        this.instances = instances;
        this.clock = clock;
    }

    public ClassificationVerdict classify(EventStreamIdentity identity, String classificationType) {
        return classify(identity, classificationType, null);
    }

    /**
     * @param identity           The event stream to classify
     * @param classificationType The name the classification is registered with
     * @param asOfDate           Only consider envelopes effective at or before this date, or {@code null} to consider all envelopes
     * @return The verdict, {@link ClassificationResult#UNKNOWN} at sequence {@code 0} if the event stream doesn't exist
     * @throws ProjectionProcessorNotConfiguredException If no classification is registered as {@code classificationType}
     */
    public ClassificationVerdict classify(EventStreamIdentity identity, String classificationType, @Nullable OffsetDateTime asOfDate) {
        ClassificationDefinition classification = registry.classification(classificationType);
        OffsetDateTime evaluationDate = asOfDate == null ? OffsetDateTime.now(clock) : asOfDate;
        ProjectionSnapshot<ClassificationResult> snapshot = projectionEngine.process(identity, classification.toProjection(evaluationDate), asOfDate);
        if (snapshot == null) {
            return ClassificationVerdict.unknown(asOfDate);
        }
        return new ClassificationVerdict(snapshot.state(), snapshot.currentSequenceNumber(), asOfDate);
    }

    /**
     * @see #getAllInstanceKeys(String, String, String, OffsetDateTime)
     */
    public Stream<String> getAllInstanceKeys(String domainName, String entityTypeName, String classificationType) {
        return getAllInstanceKeys(domainName, entityTypeName, classificationType, null);
    }

    /**
     * Find the instance keys of all event streams of an entity type that are classified as {@link ClassificationResult#INCLUDE}.
     * Each instance is classified as the returned stream is consumed, so consume it once. An empty {@code classificationType}
     * returns the instance keys of every existing event stream of the entity type.
     *
     * @throws ProjectionProcessorNotConfiguredException If no classification is registered as {@code classificationType}
     */
    public Stream<String> getAllInstanceKeys(String domainName, String entityTypeName, String classificationType, @Nullable OffsetDateTime asOfDate) {
        requireNonNull(classificationType, "Classification type cannot be null");
        Stream<String> instanceKeys = instances.instanceKeys(domainName, entityTypeName);
        if (classificationType.isEmpty()) {
            return instanceKeys;
        }
        // Fail before the stream is consumed
        registry.classification(classificationType);
        return instanceKeys.filter(instanceKey -> classify(EventStreamIdentity.of(domainName, entityTypeName, instanceKey), classificationType, asOfDate).isIncluded());
    }

    public Classification classification(EventStreamIdentity identity, String classificationType) {
        return new Classification(this, projectionEngine, identity, classificationType);
    }
}
