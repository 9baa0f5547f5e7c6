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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

public class TimestampParserTest {

    private final TimestampParser parser = new TimestampParser();

    @ParameterizedTest
    @CsvSource({ "2025-10-16T08:30:00Z, 2025-10-16T08:30:00Z", "2025-10-16T10:30:00+02:00, 2025-10-16T08:30:00Z",
            "2025-10-16T08:30:00, 2025-10-16T08:30:00Z", "2025-10-16 08:30:00, 2025-10-16T08:30:00Z",
            "2025-10-16T08:30, 2025-10-16T08:30:00Z", "2025-10-16T08:30:00.250Z, 2025-10-16T08:30:00.250Z",
            "2025-10-16, 2025-10-16T00:00:00Z" })
    public void testParse(String text, String expected) {
        assertEquals(Instant.parse(expected), parser.parse(text));
    }

    @Test
    public void testZoneRegionId() {
        assertEquals(Instant.parse("2025-10-16T06:00:00Z"), parser.parse("2025-10-16T08:00:00+02:00[Europe/Paris]"));
    }

    @Test
    public void testDefaultZone() {
        TimestampParser tokyo = new TimestampParser(ZoneId.of("Asia/Tokyo"));
        assertEquals(Instant.parse("2025-10-15T23:30:00Z"), tokyo.parse("2025-10-16T08:30:00"));
        // an explicit offset wins over the default zone
        assertEquals(Instant.parse("2025-10-16T08:30:00Z"), tokyo.parse("2025-10-16T08:30:00Z"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "yesterday", "16/10/2025 08:30", "2025-13-01T00:00:00", "2025-10-16T25:00:00",
            "1697443800" })
    public void testInvalid(String text) {
        assertThrows(DateTimeParseException.class, () -> parser.parse(text));
    }
}
