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

package com.aiot.powermonitor.verdict;

import static com.aiot.powermonitor.CommonUtils.checkArgument;
import static com.aiot.powermonitor.CommonUtils.checkNotNull;

import com.aiot.powermonitor.config.VerdictConfig;
import com.aiot.powermonitor.returntypes.LabelVector;
import com.aiot.powermonitor.returntypes.ScoreVector;
import com.aiot.powermonitor.returntypes.Verdict;
import com.aiot.powermonitor.returntypes.VerdictStatus;

/**
 * Fuses per-row scores and labels into a single verdict for the session.
 *
 * Two signals are computed. The hard flag is raised when the model labels at
 * least one row as anomalous, which catches an isolated spike. The soft flag is
 * raised when the mean score is below the configured threshold, which catches
 * sustained drift where no single row crosses the model's own boundary. The
 * configured {@link com.aiot.powermonitor.config.FusionRule} combines them; the
 * default warns when either fires.
 */
public class VerdictEngine {

    private final VerdictConfig config;

    public VerdictEngine() {
        this(VerdictConfig.defaults());
    }

    public VerdictEngine(VerdictConfig config) {
        this.config = checkNotNull(config, "config must not be null");
    }

    /**
     * @param scores one score per row
     * @param labels one label per row, aligned with {@code scores}
     * @return the session verdict; its average score is the mean of
     *         {@code scores}
     * @throws IllegalArgumentException if the vectors are empty or of different
     *                                  lengths
     */
    public Verdict decide(ScoreVector scores, LabelVector labels) {
        checkNotNull(scores, "scores must not be null");
        checkNotNull(labels, "labels must not be null");
        checkArgument(scores.size() > 0, "at least one score is required");
        checkArgument(scores.size() == labels.size(),
                String.format("%d scores but %d labels", scores.size(), labels.size()));

        double average = scores.mean();
        boolean hardFlag = labels.containsAnomaly();
        boolean softFlag = average < config.getAnomalyScoreThreshold();

        VerdictStatus status = config.getFusionRule().isWarning(hardFlag, softFlag) ? VerdictStatus.WARNING
                : VerdictStatus.NORMAL;
        return new Verdict(status, average, status.getMessage());
    }

    public VerdictConfig getConfig() {
        return config;
    }
}
