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

package com.aiot.powermonitor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.aiot.powermonitor.anomalydetection.AnomalyModel;
import com.aiot.powermonitor.inputtypes.FeatureMatrix;
import com.aiot.powermonitor.inputtypes.RawPoint;
import com.aiot.powermonitor.returntypes.LabelVector;
import com.aiot.powermonitor.returntypes.PointLabel;
import com.aiot.powermonitor.returntypes.ScoreVector;

public class TestUtils {
    public static final double EPSILON = 1e-6;

    public static final Instant START = Instant.parse("2025-10-16T00:00:00Z");

    /**
     * Readings ten minutes apart, starting at {@link #START}.
     */
    public static List<RawPoint> readings(double... power) {
        List<RawPoint> points = new ArrayList<>(power.length);
        for (int i = 0; i < power.length; i++) {
            points.add(new RawPoint(START.plusSeconds(600L * i).toString(), power[i]));
        }
        return points;
    }

    /**
     * A model that returns fixed scores and labels for inputs of matching size.
     */
    public static class FixedModel implements AnomalyModel {
        private final double[] scores;
        private final PointLabel[] labels;
        private final boolean reentrant;
        public int calls;
        public boolean closed;

        public FixedModel(double[] scores, PointLabel[] labels) {
            this(scores, labels, true);
        }

        public FixedModel(double[] scores, PointLabel[] labels, boolean reentrant) {
            this.scores = scores;
            this.labels = labels;
            this.reentrant = reentrant;
        }

        @Override
        public ScoreVector score(FeatureMatrix features) {
            calls++;
            return new ScoreVector(scores);
        }

        @Override
        public LabelVector label(FeatureMatrix features) {
            calls++;
            return new LabelVector(labels);
        }

        @Override
        public int getDimensions() {
            return 1;
        }

        @Override
        public boolean isReentrant() {
            return reentrant;
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
