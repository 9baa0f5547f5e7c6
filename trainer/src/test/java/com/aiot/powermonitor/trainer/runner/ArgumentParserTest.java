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

package com.aiot.powermonitor.trainer.runner;

import static com.aiot.powermonitor.CommonUtils.checkArgument;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ArgumentParserTest {

    private static class TestParser extends ArgumentParser {
        private final IntegerArgument count;
        private final StringArgument name;

        TestParser() {
            super("test-command", "test-description");
            count = new IntegerArgument("-n", "--count", "How many.", 3,
                    n -> checkArgument(n > 0, "count should be greater than 0"));
            addArgument(count);
            name = new StringArgument(null, "--name", "A name.", "default");
            addArgument(name);
        }
    }

    private TestParser parser;

    @BeforeEach
    public void setUp() {
        parser = new TestParser();
    }

    @Test
    public void testNew() {
        assertEquals(42L, parser.getRandomSeed());
        assertEquals(3, parser.count.getValue());
        assertEquals("default", parser.name.getValue());
        assertFalse(parser.isHelpRequested());
        assertEquals("test-command", parser.getCommand());
    }

    @Test
    public void testParse() {
        parser.parse("--count", "7", "--name", "meter", "--random-seed", "123456789012");

        assertEquals(7, parser.count.getValue());
        assertEquals("meter", parser.name.getValue());
        assertEquals(123456789012L, parser.getRandomSeed());
    }

    @Test
    public void testParseShortFlags() {
        parser.parse("-n", "9");
        assertEquals(9, parser.count.getValue());
    }

    @Test
    public void testHelp() {
        parser.parse("-n", "9", "--help", "--unknown");
        assertTrue(parser.isHelpRequested());
    }

    @Test
    public void testInvalidArguments() {
        IllegalArgumentException unknown = assertThrows(IllegalArgumentException.class,
                () -> parser.parse("--unknown", "1"));
        assertThat(unknown.getMessage(), containsString("Unknown argument"));

        IllegalArgumentException missing = assertThrows(IllegalArgumentException.class,
                () -> parser.parse("--count"));
        assertThat(missing.getMessage(), containsString("Missing value"));

        IllegalArgumentException invalid = assertThrows(IllegalArgumentException.class,
                () -> parser.parse("--count", "many"));
        assertThat(invalid.getMessage(), containsString("Invalid value for --count"));

        assertThrows(IllegalArgumentException.class, () -> parser.parse("--count", "0"));
        assertEquals(3, parser.count.getValue());
    }

    @Test
    public void testDuplicateFlag() {
        assertThrows(IllegalArgumentException.class,
                () -> parser.addArgument(new ArgumentParser.StringArgument("-n", "--other", "Clash.", "")));
        assertThrows(IllegalArgumentException.class,
                () -> parser.addArgument(new ArgumentParser.StringArgument(null, "--name", "Clash.", "")));
    }

    @Test
    public void testPrintUsage() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        parser.printUsage(new PrintStream(bytes, true, StandardCharsets.UTF_8));
        String usage = bytes.toString(StandardCharsets.UTF_8);

        assertThat(usage, containsString("test-command [options]"));
        assertThat(usage, containsString("test-description"));
        assertThat(usage, containsString("-n, --count: How many. (default: 3)"));
        assertThat(usage, containsString("--random-seed"));
    }
}
