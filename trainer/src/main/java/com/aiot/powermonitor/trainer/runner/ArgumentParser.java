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
import static com.aiot.powermonitor.CommonUtils.checkNotNull;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Command-line flags for one trainer command. Every command accepts
 * {@code --random-seed}; commands register their own flags in a subclass.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "powermonitor-trainer-1.0.0.jar";

    private final String command;
    private final String commandDescription;
    private final Map<String, Argument<?>> byFlag = new HashMap<>();
    private final List<Argument<?>> registered = new ArrayList<>();
    private final LongArgument randomSeed;
    private boolean helpRequested;

    /**
     * @param command            name of the command, shown in the usage line
     * @param commandDescription one paragraph shown under the usage line
     */
    public ArgumentParser(String command, String commandDescription) {
        this.command = command;
        this.commandDescription = commandDescription;
        randomSeed = new LongArgument(null, "--random-seed", "Seed for every random choice the command makes.", 42L);
        addArgument(randomSeed);
    }

    protected void addArgument(Argument<?> argument) {
        checkNotNull(argument, "argument must not be null");
        for (String flag : argument.flags()) {
            checkArgument(!byFlag.containsKey(flag), "flag " + flag + " is already registered");
        }
        argument.flags().forEach(flag -> byFlag.put(flag, argument));
        registered.add(argument);
    }

    /**
     * Reads flag/value pairs. Stops at the first {@code -h} or {@code --help}.
     *
     * @param arguments the raw command line after the command name
     * @throws IllegalArgumentException if a flag is unknown, lacks a value or the
     *                                  value is rejected
     */
    public void parse(String... arguments) {
        for (int i = 0; i < arguments.length; i += 2) {
            String flag = arguments[i];
            if ("-h".equals(flag) || "--help".equals(flag)) {
                helpRequested = true;
                return;
            }
            Argument<?> argument = byFlag.get(flag);
            checkArgument(argument != null, "Unknown argument: " + flag);
            checkArgument(i + 1 < arguments.length, "Missing value for " + flag);

            String text = arguments[i + 1];
            try {
                argument.set(text);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(String.format("Invalid value for %s: %s", flag, text), e);
            }
        }
    }

    public void printUsage(PrintStream out) {
        out.printf("Usage: java -jar %s %s [options]%n%n", ARCHIVE_NAME, command);
        out.println(commandDescription);
        out.println();
        out.println("Options:");
        registered.forEach(argument -> out.println("  " + argument.describe()));
        out.println("  -h, --help: Print this help message and exit.");
    }

    public String getCommand() {
        return command;
    }

    public boolean isHelpRequested() {
        return helpRequested;
    }

    public long getRandomSeed() {
        return randomSeed.getValue();
    }

    /**
     * A flag with an optional one-letter alias, a default and a converter from
     * the command-line text. The validator runs on every value the user supplies.
     */
    public static class Argument<T> {

        private final String shortFlag;
        private final String longFlag;
        private final String description;
        private final T defaultValue;
        private final Function<String, T> converter;
        private final Consumer<T> validator;
        private T value;

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> converter, Consumer<T> validator) {
            this.shortFlag = shortFlag;
            this.longFlag = checkNotNull(longFlag, "longFlag must not be null");
            this.description = description;
            this.defaultValue = defaultValue;
            this.converter = checkNotNull(converter, "converter must not be null");
            this.validator = validator == null ? v -> {
            } : validator;
            this.value = defaultValue;
        }

        public String getShortFlag() {
            return shortFlag;
        }

        public String getLongFlag() {
            return longFlag;
        }

        public T getValue() {
            return value;
        }

        List<String> flags() {
            return shortFlag == null ? List.of(longFlag) : List.of(shortFlag, longFlag);
        }

        void set(String text) {
            T converted = converter.apply(text);
            validator.accept(converted);
            value = converted;
        }

        String describe() {
            String names = shortFlag == null ? longFlag : shortFlag + ", " + longFlag;
            return String.format("%s: %s (default: %s)", names, description, defaultValue);
        }
    }

    public static class StringArgument extends Argument<String> {

        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue,
                Consumer<String> validator) {
            super(shortFlag, longFlag, description, defaultValue, Function.identity(), validator);
        }

        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue) {
            this(shortFlag, longFlag, description, defaultValue, null);
        }
    }

    public static class IntegerArgument extends Argument<Integer> {

        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue,
                Consumer<Integer> validator) {
            super(shortFlag, longFlag, description, defaultValue, text -> Integer.valueOf(text.trim()), validator);
        }

        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue) {
            this(shortFlag, longFlag, description, defaultValue, null);
        }
    }

    public static class LongArgument extends Argument<Long> {

        public LongArgument(String shortFlag, String longFlag, String description, long defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, text -> Long.valueOf(text.trim()), null);
        }
    }
}
