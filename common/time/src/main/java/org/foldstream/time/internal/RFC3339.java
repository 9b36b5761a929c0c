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

package org.foldstream.time.internal;

import java.time.DateTimeException;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.Objects;

import static java.time.format.DateTimeFormatter.ISO_LOCAL_DATE_TIME;

/**
 * Utilities for RFC3339 date/time conversions.
 */
public class RFC3339 {

    public static final DateTimeFormatter RFC_3339_DATE_TIME_FORMATTER = new DateTimeFormatterBuilder()
            .append(ISO_LOCAL_DATE_TIME)
            .optionalStart()
            .appendOffset("+HH:MM", "Z")
            .optionalEnd()
            .toFormatter();

    public static String format(OffsetDateTime dateTime) {
        Objects.requireNonNull(dateTime, OffsetDateTime.class.getSimpleName() + " cannot be null");
        return RFC_3339_DATE_TIME_FORMATTER.format(dateTime);
    }

    /**
     * @param dateTimeString An RFC 3339 date-time that includes an offset
     * @return The parsed {@link OffsetDateTime}
     * @throws IllegalArgumentException If {@code dateTimeString} is not an RFC 3339 date-time with offset
     */
    public static OffsetDateTime parse(String dateTimeString) {
        Objects.requireNonNull(dateTimeString, "Date time string cannot be null");
        try {
            return OffsetDateTime.from(RFC_3339_DATE_TIME_FORMATTER.parse(dateTimeString));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("\"" + dateTimeString + "\" is not a valid RFC 3339 date-time", e);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("\"" + dateTimeString + "\" doesn't contain an offset", e);
        }
    }
}
