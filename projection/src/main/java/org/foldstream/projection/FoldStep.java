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

/**
 * Evolves the state of a projection by applying one envelope. A fold step must be a pure function: it must not
 * mutate {@code state}, it must return the same result for the same input and it must not have side effects.
 *
 * @param <S> The type of the projection state
 */
@FunctionalInterface
public interface FoldStep<S> {

    S apply(S state, EventEnvelope envelope);
}
