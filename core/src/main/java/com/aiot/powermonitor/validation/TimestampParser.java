/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.aiot.powermonitor.validation;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Parses ISO-8601 timestamps into instants. Timestamps carrying an offset or a
 * zone are converted exactly; local date-times and bare dates are read in the
 * default zone, which is UTC unless configured otherwise. A single space
 * between the date and the time is accepted in place of the {@code T}.
 */
public class TimestampParser {

    private final ZoneId defaultZone;

    public TimestampParser() {
        this(ZoneOffset.UTC);
    }

    public TimestampParser(ZoneId defaultZone) {
        this.defaultZone = defaultZone;
    }

    /**
     * @param text an ISO-8601 timestamp
     * @return the instant it denotes
     * @throws DateTimeParseException if the text is not a supported ISO-8601 form
     */
    public Instant parse(String text) {
        String normalized = text.trim();
        if (normalized.length() > 10 && normalized.charAt(10) == ' ') {
            normalized = normalized.substring(0, 10) + 'T' + normalized.substring(11);
        }
        if (normalized.length() == 10) {
            return LocalDate.parse(normalized, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(defaultZone).toInstant();
        }
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(normalized, ZonedDateTime::from,
                LocalDateTime::from);
        if (parsed instanceof ZonedDateTime) {
            return ((ZonedDateTime) parsed).toInstant();
        }
        return ((LocalDateTime) parsed).atZone(defaultZone).toInstant();
    }

    public ZoneId getDefaultZone() {
        return defaultZone;
    }
}
