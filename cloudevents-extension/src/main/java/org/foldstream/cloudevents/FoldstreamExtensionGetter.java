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

import static org.foldstream.cloudevents.FoldstreamCloudEventExtension.*;

/**
 * Utility class that helps get Foldstream extension values, and converts them to the correct type, from a {@link CloudEvent}.
 */
public class FoldstreamExtensionGetter {

    /**
     * Get the sequence number from a {@link CloudEvent} that has {@link FoldstreamCloudEventExtension} applied.
     * JSON event formats may hand back the number as an {@code Integer} or a {@code String}, both are accepted.
     *
     * @param cloudEvent The cloud event
     * @return the sequence number
     */
    public static long getSequenceNumber(CloudEvent cloudEvent) {
        return toLong(getRequired(cloudEvent, SEQUENCE_NUMBER));
    }

    public static String getDomainName(CloudEvent cloudEvent) {
        return getRequired(cloudEvent, DOMAIN_NAME).toString();
    }

    public static String getEntityType(CloudEvent cloudEvent) {
        return getRequired(cloudEvent, ENTITY_TYPE).toString();
    }

    public static String getInstanceKey(CloudEvent cloudEvent) {
        return getRequired(cloudEvent, INSTANCE_KEY).toString();
    }

    /**
     * @return The RFC 3339 effective date, or {@code null} if the event doesn't have one.
     */
    public static String getEffectiveDate(CloudEvent cloudEvent) {
        return getOptional(cloudEvent, EFFECTIVE_DATE);
    }

    public static String getCommentary(CloudEvent cloudEvent) {
        return getOptional(cloudEvent, COMMENTARY);
    }

    public static String getOrigin(CloudEvent cloudEvent) {
        return getOptional(cloudEvent, ORIGIN);
    }

    static long toLong(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        } else if (value instanceof String) {
            try {
                return Long.parseLong((String) value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(SEQUENCE_NUMBER + " value \"" + value + "\" is not a number", e);
            }
        }
        throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain a " + SEQUENCE_NUMBER + " value that is an instance of " + long.class.getSimpleName());
    }

    private static Object getRequired(CloudEvent cloudEvent, String key) {
        if (!cloudEvent.getExtensionNames().contains(key)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain the " + key + " key");
        }
        return cloudEvent.getExtension(key);
    }

    private static String getOptional(CloudEvent cloudEvent, String key) {
        Object value = cloudEvent.getExtension(key);
        return value == null ? null : value.toString();
    }
}
