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

package com.aiot.powermonitor.returntypes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class ScoreVectorTest {

    @Test
    public void testMean() {
        ScoreVector vector = new ScoreVector(new double[] { 0.1, 0.2, 0.6 });
        assertEquals(3, vector.size());
        assertEquals((0.1 + 0.2 + 0.6) / 3, vector.mean());
        assertThrows(IllegalStateException.class, () -> new ScoreVector(new double[0]).mean());
    }

    @Test
    public void testCopiesInput() {
        double[] values = { 0.1, 0.2 };
        ScoreVector vector = new ScoreVector(values);
        values[0] = 9.0;
        assertEquals(0.1, vector.get(0));
        vector.toArray()[1] = 9.0;
        assertEquals(0.2, vector.get(1));
    }

    @Test
    public void testIsFinite() {
        assertTrue(new ScoreVector(new double[] { -0.3, 0.0 }).isFinite());
        assertFalse(new ScoreVector(new double[] { 0.1, Double.NaN }).isFinite());
        assertFalse(new ScoreVector(new double[] { Double.NEGATIVE_INFINITY }).isFinite());
    }

    @Test
    public void testLabels() {
        LabelVector labels = new LabelVector(
                new PointLabel[] { PointLabel.NORMAL, PointLabel.ANOMALOUS, PointLabel.ANOMALOUS });
        assertTrue(labels.containsAnomaly());
        assertEquals(2, labels.countAnomalies());
        assertFalse(new LabelVector(new PointLabel[] { PointLabel.NORMAL }).containsAnomaly());
        assertThrows(NullPointerException.class, () -> new LabelVector(new PointLabel[] { null }));
    }

    @Test
    public void testLabelCodes() {
        assertEquals(1, PointLabel.NORMAL.getCode());
        assertEquals(-1, PointLabel.ANOMALOUS.getCode());
        assertEquals(PointLabel.ANOMALOUS, PointLabel.fromCode(-1));
        assertThrows(IllegalArgumentException.class, () -> PointLabel.fromCode(0));
    }
}
