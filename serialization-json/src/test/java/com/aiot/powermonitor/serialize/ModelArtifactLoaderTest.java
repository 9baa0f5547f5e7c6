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

package com.aiot.powermonitor.serialize;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.aiot.powermonitor.IsolationForest;
import com.aiot.powermonitor.anomalydetection.ModelHandle;
import com.aiot.powermonitor.exception.ErrorCategory;
import com.aiot.powermonitor.exception.StartupException;
import com.aiot.powermonitor.exception.StartupException.Fault;
import com.aiot.powermonitor.inputtypes.FeatureMatrix;

public class ModelArtifactLoaderTest {

    @TempDir
    Path directory;

    private ModelArtifactLoader loader;
    private IsolationForest forest;

    @BeforeEach
    public void setUp() {
        loader = new ModelArtifactLoader();
        double[][] data = new double[50][];
        for (int i = 0; i < data.length; i++) {
            data[i] = new double[] { 0.5 + 0.01 * i };
        }
        forest = IsolationForest.builder().numberOfTrees(10).randomSeed(42).fit(data);
    }

    @Test
    public void testLoad() throws IOException {
        Path path = directory.resolve("anomaly_detector.json");
        loader.getSerDe().write(forest, path);

        try (ModelHandle handle = loader.load(path)) {
            assertEquals(1, handle.getDimensions());
            assertEquals(path.toString(), handle.getSource());
            assertFalse(handle.isSerialized());

            FeatureMatrix matrix = new FeatureMatrix(Collections.singletonList(FeatureMatrix.POWER_COLUMN),
                    new double[][] { { 0.7 }, { 9.0 } });
            assertArrayEquals(forest.score(matrix).toArray(), handle.score(matrix).toArray());
        }
    }

    @Test
    public void testMissingFile() {
        StartupException exception = assertThrows(StartupException.class,
                () -> loader.load(directory.resolve("missing.json")));
        assertEquals(Fault.FILE_SYSTEM, exception.getFault());
        assertEquals(ErrorCategory.STARTUP_FAILURE, exception.getCategory());
        assertThat(exception.getMessage(), containsString("does not exist"));
    }

    @Test
    public void testDirectory() {
        StartupException exception = assertThrows(StartupException.class, () -> loader.load(directory));
        assertEquals(Fault.FILE_SYSTEM, exception.getFault());
    }

    @Test
    public void testMalformedJson() throws IOException {
        Path path = directory.resolve("broken.json");
        Files.write(path, "{\"version\": \"1.0\", \"treeStates\": [".getBytes(StandardCharsets.UTF_8));

        StartupException exception = assertThrows(StartupException.class, () -> loader.load(path));
        assertEquals(Fault.MODEL, exception.getFault());
        assertThat(exception.getMessage(), containsString("not valid JSON"));
    }

    @Test
    public void testInvalidModel() throws IOException {
        Path path = directory.resolve("empty-forest.json");
        Files.write(path, "{\"version\": \"1.0\", \"dimensions\": 1, \"numberOfTrees\": 0, \"treeStates\": []}"
                .getBytes(StandardCharsets.UTF_8));

        StartupException exception = assertThrows(StartupException.class, () -> loader.load(path));
        assertEquals(Fault.MODEL, exception.getFault());
        assertThat(exception.getMessage(), containsString("not a valid model"));
    }

    @Test
    public void testUnsupportedVersion() throws IOException {
        Path path = directory.resolve("future.json");
        String json = loader.getSerDe().toJson(forest).replace("\"version\":\"1.0\"", "\"version\":\"2.0\"");
        Files.write(path, json.getBytes(StandardCharsets.UTF_8));

        StartupException exception = assertThrows(StartupException.class, () -> loader.load(path));
        assertEquals(Fault.MODEL, exception.getFault());
        assertThat(exception.getMessage(), containsString("version"));
    }
}
