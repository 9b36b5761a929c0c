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

import org.foldstream.eventstore.api.EventStreamIdentity;
import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * A handle to one projection type of one event stream. It's created per request and holds no state of its own.
 *
 * @param <S> The type of the projection state
 */
public class Projection<S> {
    private final ProjectionEngine engine;
    private final EventStreamIdentity identity;
    private final String projectionType;

    public Projection(ProjectionEngine engine, EventStreamIdentity identity, String projectionType) {
        requireNonNull(engine, ProjectionEngine.class.getSimpleName() + " cannot be null");
        requireNonNull(identity, EventStreamIdentity.class.getSimpleName() + " cannot be null");
        requireNonNull(projectionType, "Projection type cannot be null");
        this.engine = engine;
        this.identity = identity;
        this.projectionType = projectionType;
    }

    public EventStreamIdentity identity() {
        return identity;
    }

    public String projectionType() {
        return projectionType;
    }

    public boolean exists() {
        return engine.exists(identity);
    }

    public @Nullable ProjectionSnapshot<S> process() {
        return engine.process(identity, projectionType);
    }

    public @Nullable ProjectionSnapshot<S> process(@Nullable OffsetDateTime asOfDate) {
        return engine.process(identity, projectionType, asOfDate);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", Projection.class.getSimpleName() + "[", "]")
                .add("identity=" + identity)
                .add("projectionType='" + projectionType + "'")
                .toString();
    }
}
