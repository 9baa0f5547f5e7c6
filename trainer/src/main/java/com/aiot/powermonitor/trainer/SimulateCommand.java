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

package com.aiot.powermonitor.trainer;

import static com.aiot.powermonitor.CommonUtils.checkArgument;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aiot.powermonitor.testutils.PowerConsumptionSimulator;
import com.aiot.powermonitor.testutils.SimulatedPowerData;
import com.aiot.powermonitor.trainer.io.PowerDataCsv;
import com.aiot.powermonitor.trainer.runner.ArgumentParser;

/**
 * Writes a simulated household power series with injected anomalies to a CSV
 * file that {@link TrainCommand} can read.
 */
public class SimulateCommand implements Command<SimulateCommand.Arguments> {

    private static final Logger log = LoggerFactory.getLogger(SimulateCommand.class);

    public static final String DEFAULT_OUTPUT = "simulated_power_data.csv";

    @Override
    public String command() {
        return "simulate";
    }

    @Override
    public String description() {
        return "generate simulated power consumption data with labelled anomalies";
    }

    @Override
    public Arguments newArgumentParser() {
        return new Arguments(command(), description());
    }

    @Override
    public void run(Arguments arguments, PrintStream out) throws Exception {
        PowerConsumptionSimulator simulator = new PowerConsumptionSimulator(PowerConsumptionSimulator.DEFAULT_START,
                arguments.getDays(), arguments.getIntervalMinutes(), arguments.getAnomalies(),
                PowerConsumptionSimulator.DEFAULT_NOISE_SIGMA, PowerConsumptionSimulator.DEFAULT_ANOMALY_MIN,
                PowerConsumptionSimulator.DEFAULT_ANOMALY_MAX);
        SimulatedPowerData data = simulator.generate(arguments.getRandomSeed());

        Path output = arguments.getOutput();
        new PowerDataCsv(arguments.getDelimiter()).write(data, output);
        log.info("Wrote {} simulated readings to {}", data.size(), output);

        out.printf("File: %s%n", output);
        out.printf("Total records: %d%n", data.size());
        out.printf("Anomalies: %d%n", data.countAnomalies());
    }

    public static class Arguments extends ArgumentParser {

        private final StringArgument output;
        private final IntegerArgument days;
        private final IntegerArgument intervalMinutes;
        private final IntegerArgument anomalies;
        private final StringArgument delimiter;

        public Arguments(String command, String description) {
            super(command, description);

            output = new StringArgument("-o", "--output", "CSV file to write.", DEFAULT_OUTPUT);

            addArgument(output);

            days = new IntegerArgument(null, "--days", "Number of days to simulate.",
                    PowerConsumptionSimulator.DEFAULT_DAYS, n -> checkArgument(n > 0, "days should be greater than 0"));

            addArgument(days);

            intervalMinutes = new IntegerArgument(null, "--interval-minutes", "Minutes between readings.",
                    PowerConsumptionSimulator.DEFAULT_INTERVAL_MINUTES,
                    n -> checkArgument(n > 0 && 60 % n == 0, "interval should divide an hour"));

            addArgument(intervalMinutes);

            anomalies = new IntegerArgument("-a", "--anomalies", "Number of anomalies to inject.",
                    PowerConsumptionSimulator.DEFAULT_ANOMALY_COUNT,
                    n -> checkArgument(n >= 0, "anomalies should not be negative"));

            addArgument(anomalies);

            delimiter = new StringArgument("-d", "--delimiter", "The character or string used as a field delimiter.",
                    ",", s -> checkArgument(!s.isEmpty(), "delimiter should not be empty"));

            addArgument(delimiter);
        }

        public Path getOutput() {
            return Paths.get(output.getValue());
        }

        public int getDays() {
            return days.getValue();
        }

        public int getIntervalMinutes() {
            return intervalMinutes.getValue();
        }

        public int getAnomalies() {
            return anomalies.getValue();
        }

        public String getDelimiter() {
            return delimiter.getValue();
        }
    }
}
