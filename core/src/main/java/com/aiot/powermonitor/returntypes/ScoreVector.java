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

import static com.aiot.powermonitor.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * One anomaly score per row of a feature matrix, in row order. Lower scores
 * are more anomalous.
 */
public class ScoreVector {

    private final double[] scores;

    public ScoreVector(double[] scores) {
        checkNotNull(scores, "scores must not be null");
        this.scores = Arrays.copyOf(scores, scores.length);
    }

    public int size() {
        return scores.length;
    }

    public double get(int index) {
        return scores[index];
    }

    public double[] toArray() {
        return Arrays.copyOf(scores, scores.length);
    }

    /**
     * @return true if no score is NaN or infinite
     */
    public boolean isFinite() {
        for (double score : scores) {
            if (!Double.isFinite(score)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Arithmetic mean of the scores. Summation is left to right, so the same
     * vector always produces the same bits.
     *
     * @return the mean score
     */
    public double mean() {
        if (scores.length == 0) {
            throw new IllegalStateException("mean of an empty score vector");
        }
        double sum = 0;
        for (double score : scores) {
            sum += score;
        }
        return sum / scores.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScoreVector)) {
            return false;
        }
        return Arrays.equals(scores, ((ScoreVector) o).scores);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(scores);
    }

    @Override
    public String toString() {
        return "ScoreVector" + Arrays.toString(scores);
    }
}
