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

package com.aiot.powermonitor.trainer.io;

import static com.aiot.powermonitor.CommonUtils.checkArgument;
import static com.aiot.powermonitor.CommonUtils.checkNotNull;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import com.aiot.powermonitor.inputtypes.FeatureMatrix;
import com.aiot.powermonitor.testutils.SimulatedPowerData;

/**
 * Reads and writes power data as CSV with a header row:
 *
 * <pre>
 * timestamp,power_kW,is_anomaly
 * 2025-10-16 00:00:00,0.2374,0
 * </pre>
 *
 * Only {@code power_kW} is required when reading. The columns may appear in
 * any order and blank lines are ignored.
 */
public class PowerDataCsv {

    public static final String TIMESTAMP_COLUMN = "timestamp";
    public static final String POWER_COLUMN = FeatureMatrix.POWER_COLUMN;
    public static final String ANOMALY_COLUMN = "is_anomaly";

    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final String delimiter;

    public PowerDataCsv() {
        this(",");
    }

    public PowerDataCsv(String delimiter) {
        checkNotNull(delimiter, "delimiter must not be null");
        checkArgument(!delimiter.isEmpty(), "delimiter must not be empty");
        this.delimiter = delimiter;
    }

    public void write(SimulatedPowerData data, Writer writer) throws IOException {
        checkNotNull(data, "data must not be null");
        writer.write(String.join(delimiter, TIMESTAMP_COLUMN, POWER_COLUMN, ANOMALY_COLUMN));
        writer.write('\n');
        double[] power = data.getPower();
        boolean[] anomaly = data.getAnomaly();
        for (int i = 0; i < data.size(); i++) {
            writer.write(String.join(delimiter, TIMESTAMP_FORMAT.format(data.getTimestamps().get(i)),
                    Double.toString(power[i]), anomaly[i] ? "1" : "0"));
            writer.write('\n');
        }
        writer.flush();
    }

    public void write(SimulatedPowerData data, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(data, writer);
        }
    }

    /**
     * @throws IOException              if the input cannot be read
     * @throws IllegalArgumentException if the input is not valid power data
     */
    public PowerDataset read(Reader reader) throws IOException {
        BufferedReader lines = reader instanceof BufferedReader ? (BufferedReader) reader
                : new BufferedReader(reader);

        String header = lines.readLine();
        checkArgument(header != null, "the input is empty");
        List<String> columns = Arrays.asList(split(header.trim()));
        int timestampIndex = columns.indexOf(TIMESTAMP_COLUMN);
        int powerIndex = columns.indexOf(POWER_COLUMN);
        int anomalyIndex = columns.indexOf(ANOMALY_COLUMN);
        checkArgument(powerIndex >= 0, "the header has no " + POWER_COLUMN + " column");

        List<String> timestamps = new ArrayList<>();
        List<Double> power = new ArrayList<>();
        List<Boolean> anomaly = new ArrayList<>();

        int lineNumber = 1;
        String line;
        while ((line = lines.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            String[] fields = split(line.trim());
            checkArgument(fields.length == columns.size(), String.format("line %d has %d fields, expected %d",
                    lineNumber, fields.length, columns.size()));

            timestamps.add(timestampIndex >= 0 ? fields[timestampIndex].trim() : Integer.toString(power.size()));
            power.add(parsePower(fields[powerIndex].trim(), lineNumber));
            if (anomalyIndex >= 0) {
                anomaly.add(parseFlag(fields[anomalyIndex].trim(), lineNumber));
            }
        }
        checkArgument(!power.isEmpty(), "the input has no data rows");

        double[] powerArray = new double[power.size()];
        for (int i = 0; i < powerArray.length; i++) {
            powerArray[i] = power.get(i);
        }
        boolean[] anomalyArray = null;
        if (anomalyIndex >= 0) {
            anomalyArray = new boolean[anomaly.size()];
            for (int i = 0; i < anomalyArray.length; i++) {
                anomalyArray[i] = anomaly.get(i);
            }
        }
        return new PowerDataset(timestamps, powerArray, anomalyArray);
    }

    public PowerDataset read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public String getDelimiter() {
        return delimiter;
    }

    private String[] split(String line) {
        return line.split(Pattern.quote(delimiter), -1);
    }

    private static double parsePower(String text, int lineNumber) {
        double value;
        try {
            value = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format("line %d: '%s' is not a valid %s value", lineNumber, text, POWER_COLUMN), e);
        }
        checkArgument(Double.isFinite(value) && value >= 0,
                String.format("line %d: %s must be a finite number >= 0", lineNumber, POWER_COLUMN));
        return value;
    }

    private static boolean parseFlag(String text, int lineNumber) {
        switch (text.toLowerCase(Locale.ROOT)) {
        case "1":
        case "true":
            return true;
        case "0":
        case "false":
            return false;
        default:
            throw new IllegalArgumentException(
                    String.format("line %d: '%s' is not a valid %s value", lineNumber, text, ANOMALY_COLUMN));
        }
    }
}
