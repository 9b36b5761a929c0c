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

package org.foldstream.cloudevents;

import io.cloudevents.CloudEvent;
import io.cloudevents.CloudEventExtension;
import io.cloudevents.CloudEventExtensions;

import java.util.*;

/**
 * A {@link CloudEvent} {@link CloudEventExtension} that adds the extensions Foldstream requires to place an event in an event stream.
 * These are:<br><br>
 *
 * <table>
 *     <tr><th>Key</th><th>Description</th></tr>
 *     <tr><td>{@value #DOMAIN_NAME}</td><td>The domain the event stream belongs to</td></tr>
 *     <tr><td>{@value #ENTITY_TYPE}</td><td>The type of entity the event stream belongs to</td></tr>
 *     <tr><td>{@value #INSTANCE_KEY}</td><td>The key of the entity instance the event stream belongs to</td></tr>
 *     <tr><td>{@value #SEQUENCE_NUMBER}</td><td>The position (starting at 1) of the event in the event stream</td></tr>
 *     <tr><td>{@value #EFFECTIVE_DATE}</td><td>Optional RFC 3339 date at which the event takes business effect</td></tr>
 *     <tr><td>{@value #COMMENTARY}</td><td>Optional free text commentary</td></tr>
 *     <tr><td>{@value #ORIGIN}</td><td>Optional free text describing where the event came from</td></tr>
 * </table>
 * <p>
 * Optional keys are only reported by {@link #getKeys()} when they have a value.
 */
public class FoldstreamCloudEventExtension implements CloudEventExtension {
    public static final String DOMAIN_NAME = "domainname";
    public static final String ENTITY_TYPE = "entitytype";
    public static final String INSTANCE_KEY = "instancekey";
    public static final String SEQUENCE_NUMBER = "sequencenumber";
    public static final String EFFECTIVE_DATE = "effectivedate";
    public static final String COMMENTARY = "commentary";
    public static final String ORIGIN = "origin";

    static final Set<String> KEYS = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(DOMAIN_NAME, ENTITY_TYPE, INSTANCE_KEY, SEQUENCE_NUMBER, EFFECTIVE_DATE, COMMENTARY, ORIGIN)));

    private String domainName;
    private String entityType;
    private String instanceKey;
    private long sequenceNumber;
    private String effectiveDate;
    private String commentary;
    private String origin;

    public FoldstreamCloudEventExtension(String domainName, String entityType, String instanceKey, long sequenceNumber, String effectiveDate, String commentary, String origin) {
        Objects.requireNonNull(domainName, "Domain name cannot be null");
        Objects.requireNonNull(entityType, "Entity type cannot be null");
        Objects.requireNonNull(instanceKey, "Instance key cannot be null");
        if (sequenceNumber < 1) {
            throw new IllegalArgumentException("Sequence number cannot be less than 1");
        }
        this.domainName = domainName;
        this.entityType = entityType;
        this.instanceKey = instanceKey;
        this.sequenceNumber = sequenceNumber;
        this.effectiveDate = effectiveDate;
        this.commentary = commentary;
        this.origin = origin;
    }

    public static FoldstreamCloudEventExtension foldstream(String domainName, String entityType, String instanceKey, long sequenceNumber) {
        return new FoldstreamCloudEventExtension(domainName, entityType, instanceKey, sequenceNumber, null, null, null);
    }

    @Override
    public void readFrom(CloudEventExtensions extensions) {
        Object domainName = extensions.getExtension(DOMAIN_NAME);
        if (domainName != null) {
            this.domainName = domainName.toString();
        }

        Object entityType = extensions.getExtension(ENTITY_TYPE);
        if (entityType != null) {
            this.entityType = entityType.toString();
        }

        Object instanceKey = extensions.getExtension(INSTANCE_KEY);
        if (instanceKey != null) {
            this.instanceKey = instanceKey.toString();
        }

        Object sequenceNumber = extensions.getExtension(SEQUENCE_NUMBER);
        if (sequenceNumber != null) {
            this.sequenceNumber = FoldstreamExtensionGetter.toLong(sequenceNumber);
        }

        Object effectiveDate = extensions.getExtension(EFFECTIVE_DATE);
        this.effectiveDate = effectiveDate == null ? null : effectiveDate.toString();

        Object commentary = extensions.getExtension(COMMENTARY);
        this.commentary = commentary == null ? null : commentary.toString();

        Object origin = extensions.getExtension(ORIGIN);
        this.origin = origin == null ? null : origin.toString();
    }

    @Override
    public Object getValue(String key) throws IllegalArgumentException {
        switch (key) {
            case DOMAIN_NAME:
                return domainName;
            case ENTITY_TYPE:
                return entityType;
            case INSTANCE_KEY:
                return instanceKey;
            case SEQUENCE_NUMBER:
                return sequenceNumber;
            case EFFECTIVE_DATE:
                return effectiveDate;
            case COMMENTARY:
                return commentary;
            case ORIGIN:
                return origin;
            default:
                throw new IllegalArgumentException(this.getClass().getSimpleName() + " doesn't expect the attribute key \"" + key + "\"");
        }
    }

    @Override
    public Set<String> getKeys() {
        Set<String> keys = new LinkedHashSet<>(Arrays.asList(DOMAIN_NAME, ENTITY_TYPE, INSTANCE_KEY, SEQUENCE_NUMBER));
        if (effectiveDate != null) {
            keys.add(EFFECTIVE_DATE);
        }
        if (commentary != null) {
            keys.add(COMMENTARY);
        }
        if (origin != null) {
            keys.add(ORIGIN);
        }
        return Collections.unmodifiableSet(keys);
    }
}
