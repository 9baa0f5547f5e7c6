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

package com.aiot.powermonitor.inputtypes;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

public class FeatureMatrixTest {

    @Test
    public void testOfPower() {
        TimeSeries series = new TimeSeries(Arrays.asList(new DataPoint(Instant.EPOCH, 0.4),
                new DataPoint(Instant.EPOCH.plusSeconds(600), 1.2)));

        FeatureMatrix matrix = FeatureMatrix.ofPower(series);

        assertEquals(2, matrix.getNumberOfRows());
        assertEquals(1, matrix.getNumberOfColumns());
        assertEquals(Collections.singletonList("power_kW"), matrix.getColumnNames());
        assertArrayEquals(new double[] { 1.2 }, matrix.getRow(1));
    }

    @Test
    public void testRowsAreCopied() {
        double[][] rows = { { 1.0 }, { 2.0 } };
        FeatureMatrix matrix = new FeatureMatrix(List.of("power_kW"), rows);
        rows[0][0] = 5.0;
        matrix.toArray()[1][0] = 5.0;
        matrix.getRow(1)[0] = 5.0;
        assertEquals(1.0, matrix.get(0, 0));
        assertEquals(2.0, matrix.get(1, 0));
    }

    @Test
    public void testInvalid() {
        assertThrows(IllegalArgumentException.class,
                () -> new FeatureMatrix(List.of("power_kW"), new double[][] { { 1.0, 2.0 } }));
        assertThrows(IllegalArgumentException.class,
                () -> new FeatureMatrix(Collections.emptyList(), new double[0][]));
        assertThrows(IllegalArgumentException.class, () -> new TimeSeries(Collections.emptyList()));
        assertThrows(IllegalArgumentException.class, () -> new DataPoint(Instant.EPOCH, -1.0));
    }
}
