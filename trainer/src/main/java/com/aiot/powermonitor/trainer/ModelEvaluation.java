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
import static com.aiot.powermonitor.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

import com.aiot.powermonitor.returntypes.PointLabel;

/**
 * Compares the labels a trained model assigns to its own training data with
 * the ground truth of the simulator.
 */
@Getter
public class ModelEvaluation {

    private final int totalAnomalies;

    private final int totalFlagged;

    private final int truePositives;

    /**
     * indexes of anomalies the model labelled normal
     */
    private final List<Integer> missed;

    /**
     * indexes of normal readings the model labelled anomalous
     */
    private final List<Integer> falseAlarms;

    private ModelEvaluation(int totalAnomalies, int totalFlagged, int truePositives, List<Integer> missed,
            List<Integer> falseAlarms) {
        this.totalAnomalies = totalAnomalies;
        this.totalFlagged = totalFlagged;
        this.truePositives = truePositives;
        this.missed = Collections.unmodifiableList(missed);
        this.falseAlarms = Collections.unmodifiableList(falseAlarms);
    }

    public static ModelEvaluation evaluate(boolean[] truth, PointLabel[] predicted) {
        checkNotNull(truth, "truth must not be null");
        checkNotNull(predicted, "predicted must not be null");
        checkArgument(truth.length == predicted.length, "truth and predicted must have the same length");

        int totalAnomalies = 0;
        int totalFlagged = 0;
        int truePositives = 0;
        List<Integer> missed = new ArrayList<>();
        List<Integer> falseAlarms = new ArrayList<>();
        for (int i = 0; i < truth.length; i++) {
            boolean flagged = predicted[i] == PointLabel.ANOMALOUS;
            if (truth[i]) {
                totalAnomalies++;
            }
            if (flagged) {
                totalFlagged++;
            }
            if (truth[i] && flagged) {
                truePositives++;
            } else if (truth[i]) {
                missed.add(i);
            } else if (flagged) {
                falseAlarms.add(i);
            }
        }
        return new ModelEvaluation(totalAnomalies, totalFlagged, truePositives, missed, falseAlarms);
    }

    /**
     * @return the fraction of true anomalies the model found, 1 if there were
     *         none
     */
    public double getRecall() {
        return totalAnomalies == 0 ? 1.0 : (double) truePositives / totalAnomalies;
    }
}
