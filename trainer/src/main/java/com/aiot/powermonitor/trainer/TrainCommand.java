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
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aiot.powermonitor.IsolationForest;
import com.aiot.powermonitor.returntypes.PointLabel;
import com.aiot.powermonitor.serialize.IsolationForestSerDe;
import com.aiot.powermonitor.trainer.io.PowerDataCsv;
import com.aiot.powermonitor.trainer.io.PowerDataset;
import com.aiot.powermonitor.trainer.runner.ArgumentParser;

/**
 * Trains an isolation forest on the {@code power_kW} column of a CSV file and
 * writes the JSON artifact the server loads. If the file carries
 * {@code is_anomaly} labels, the labels the forest assigns to its own training
 * data are compared with them.
 */
public class TrainCommand implements Command<TrainCommand.Arguments> {

    private static final Logger log = LoggerFactory.getLogger(TrainCommand.class);

    public static final String DEFAULT_INPUT = SimulateCommand.DEFAULT_OUTPUT;
    public static final String DEFAULT_OUTPUT = "anomaly_detector.json";
    public static final double DEFAULT_CONTAMINATION = 0.05;

    // rows of a list to print in full
    private static final int MAX_LISTED = 10;

    @Override
    public String command() {
        return "train";
    }

    @Override
    public String description() {
        return "train the isolation forest artifact from power data";
    }

    @Override
    public Arguments newArgumentParser() {
        return new Arguments(command(), description());
    }

    @Override
    public void run(Arguments arguments, PrintStream out) throws Exception {
        Path input = arguments.getInput();
        if (!Files.exists(input)) {
            throw new NoSuchFileException(input.toString(), null,
                    "input file not found; run the simulate command first");
        }

        out.printf("1. Reading %s%n", input);
        PowerDataset dataset = new PowerDataCsv(arguments.getDelimiter()).read(input);
        double[][] rows = dataset.toRows();

        out.printf("2. Training isolation forest on %d readings%n", dataset.size());
        IsolationForest.Builder<?> builder = IsolationForest.builder().numberOfTrees(arguments.getNumberOfTrees())
                .sampleSize(arguments.getSampleSize()).randomSeed(arguments.getRandomSeed());
        Optional<Double> contamination = arguments.getContamination();
        if (contamination.isPresent()) {
            builder.contamination(contamination.get());
        } else {
            builder.automaticContamination();
        }
        IsolationForest forest = builder.fit(rows);
        log.info("Trained {} trees on samples of {} readings, offset {}", forest.getNumberOfTrees(),
                forest.getSampleSize(), forest.getOffset());

        PointLabel[] labels = forest.predict(rows);
        Optional<boolean[]> truth = dataset.getAnomaly();
        if (truth.isPresent()) {
            out.println("3. Evaluating against is_anomaly");
            report(ModelEvaluation.evaluate(truth.get(), labels), dataset, out);
        } else {
            int flagged = 0;
            for (PointLabel label : labels) {
                if (label == PointLabel.ANOMALOUS) {
                    flagged++;
                }
            }
            out.printf("3. No is_anomaly column; the model flags %d of %d readings%n", flagged, dataset.size());
        }

        Path output = arguments.getOutput();
        new IsolationForestSerDe().write(forest, output);
        forest.close();
        log.info("Wrote model artifact to {}", output);
        out.printf("4. Saved model to %s%n", output);
    }

    private void report(ModelEvaluation evaluation, PowerDataset dataset, PrintStream out) {
        out.printf("   Labelled anomalies: %d%n", evaluation.getTotalAnomalies());
        out.printf("   Flagged by the model: %d%n", evaluation.getTotalFlagged());
        out.printf("   True positives: %d / %d%n", evaluation.getTruePositives(), evaluation.getTotalAnomalies());
        if (!evaluation.getMissed().isEmpty()) {
            out.printf("   Missed anomalies (%d):%n", evaluation.getMissed().size());
            list(evaluation.getMissed(), dataset, out);
        }
        if (!evaluation.getFalseAlarms().isEmpty()) {
            out.printf("   False alarms (%d):%n", evaluation.getFalseAlarms().size());
            list(evaluation.getFalseAlarms(), dataset, out);
        }
    }

    private void list(List<Integer> indexes, PowerDataset dataset, PrintStream out) {
        for (int index : indexes.subList(0, Math.min(indexes.size(), MAX_LISTED))) {
            out.printf("     %s  %.4f kW%n", dataset.getTimestamps().get(index), dataset.getPower(index));
        }
        if (indexes.size() > MAX_LISTED) {
            out.printf("     ... and %d more%n", indexes.size() - MAX_LISTED);
        }
    }

    public static class Arguments extends ArgumentParser {

        private final StringArgument input;
        private final StringArgument output;
        private final IntegerArgument numberOfTrees;
        private final IntegerArgument sampleSize;
        private final StringArgument contamination;
        private final StringArgument delimiter;

        public Arguments(String command, String description) {
            super(command, description);

            input = new StringArgument("-i", "--input", "CSV file with a power_kW column.", DEFAULT_INPUT);

            addArgument(input);

            output = new StringArgument("-o", "--output", "Model artifact to write.", DEFAULT_OUTPUT);

            addArgument(output);

            numberOfTrees = new IntegerArgument("-n", "--number-of-trees", "Number of trees to use in the forest.",
                    IsolationForest.DEFAULT_NUMBER_OF_TREES,
                    n -> checkArgument(n > 0, "number of trees should be greater than 0"));

            addArgument(numberOfTrees);

            sampleSize = new IntegerArgument("-s", "--sample-size",
                    "Number of readings each tree is grown on, capped by the data size.",
                    IsolationForest.DEFAULT_MAX_SAMPLE_SIZE,
                    n -> checkArgument(n > 1, "sample size should be greater than 1"));

            addArgument(sampleSize);

            contamination = new StringArgument("-c", "--contamination",
                    "Expected fraction of anomalies in (0, 0.5], or 'auto'.", Double.toString(DEFAULT_CONTAMINATION),
                    TrainCommand::checkContamination);

            addArgument(contamination);

            delimiter = new StringArgument("-d", "--delimiter", "The character or string used as a field delimiter.",
                    ",", s -> checkArgument(!s.isEmpty(), "delimiter should not be empty"));

            addArgument(delimiter);
        }

        public Path getInput() {
            return Paths.get(input.getValue());
        }

        public Path getOutput() {
            return Paths.get(output.getValue());
        }

        public int getNumberOfTrees() {
            return numberOfTrees.getValue();
        }

        public int getSampleSize() {
            return sampleSize.getValue();
        }

        /**
         * @return the contamination, or empty for the automatic offset
         */
        public Optional<Double> getContamination() {
            String value = contamination.getValue();
            return "auto".equalsIgnoreCase(value) ? Optional.empty() : Optional.of(Double.parseDouble(value));
        }

        public String getDelimiter() {
            return delimiter.getValue();
        }
    }

    private static void checkContamination(String value) {
        if ("auto".equalsIgnoreCase(value)) {
            return;
        }
        double contamination = Double.parseDouble(value);
        checkArgument(contamination > 0 && contamination <= IsolationForest.MAX_CONTAMINATION,
                "contamination should be in (0, 0.5] or 'auto'");
    }
}
