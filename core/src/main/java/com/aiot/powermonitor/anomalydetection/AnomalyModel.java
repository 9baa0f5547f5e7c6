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

package com.aiot.powermonitor.anomalydetection;

import com.aiot.powermonitor.inputtypes.FeatureMatrix;
import com.aiot.powermonitor.returntypes.LabelVector;
import com.aiot.powermonitor.returntypes.ScoreVector;

/**
 * The capability the scoring pipeline needs from a trained model: a continuous
 * score and a hard label for every row of a feature matrix. Implementations
 * must be deterministic for a fixed trained state, and must return vectors of
 * the same length and order as the matrix rows.
 */
public interface AnomalyModel extends AutoCloseable {

    /**
     * Scores every row. Lower scores are more anomalous, and scores of different
     * calls are on the same scale regardless of the number of rows.
     *
     * @param features rows to score
     * @return one score per row
     */
    ScoreVector score(FeatureMatrix features);

    /**
     * Labels every row with the model's own decision threshold.
     *
     * @param features rows to label
     * @return one label per row
     */
    LabelVector label(FeatureMatrix features);

    /**
     * @return the number of features each row must have
     */
    int getDimensions();

    /**
     * @return true if {@link #score} and {@link #label} may be invoked
     *         concurrently from several threads
     */
    default boolean isReentrant() {
        return true;
    }

    /**
     * Releases resources held by the model. The default does nothing.
     */
    @Override
    default void close() {
    }
}
