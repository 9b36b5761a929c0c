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

package org.foldstream.eventstore.api;

import java.util.Objects;

/**
 * The compound key that addresses exactly one event stream, i.e. one append-only log of events for one entity instance.
 *
 * @param domainName     The domain the entity belongs to, for example {@code Bank}
 * @param entityTypeName The type of the entity, for example {@code Account}
 * @param instanceKey    The key that uniquely identifies the entity instance within its type, for example an account number
 */
public record EventStreamIdentity(String domainName, String entityTypeName, String instanceKey) {

    public EventStreamIdentity {
        requireNotBlank(domainName, "Domain name");
        requireNotBlank(entityTypeName, "Entity type name");
        requireNotBlank(instanceKey, "Instance key");
    }

    public static EventStreamIdentity of(String domainName, String entityTypeName, String instanceKey) {
        return new EventStreamIdentity(domainName, entityTypeName, instanceKey);
    }

    /**
     * @return {@code true} if this identity addresses an instance of the given domain and entity type
     */
    public boolean isInstanceOf(String domainName, String entityTypeName) {
        return this.domainName.equals(domainName) && this.entityTypeName.equals(entityTypeName);
    }

    @Override
    public String toString() {
        return domainName + "/" + entityTypeName + "/" + instanceKey;
    }

    private static void requireNotBlank(String value, String name) {
        Objects.requireNonNull(value, name + " cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be blank");
        }
    }
}
