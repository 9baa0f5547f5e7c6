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

package com.aiot.powermonitor.config;

import static com.aiot.powermonitor.CommonUtils.checkArgument;
import static com.aiot.powermonitor.CommonUtils.checkNotNull;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Decision policy of the verdict engine.
 */
@Getter
@ToString
@EqualsAndHashCode
public class VerdictConfig {

    /**
     * A session whose mean score falls below this value is flagged.
     */
    public static final double DEFAULT_ANOMALY_SCORE_THRESHOLD = 0.05;

    public static final FusionRule DEFAULT_FUSION_RULE = FusionRule.ANY;

    private final double anomalyScoreThreshold;

    private final FusionRule fusionRule;

    protected VerdictConfig(Builder builder) {
        checkArgument(Double.isFinite(builder.anomalyScoreThreshold), "anomalyScoreThreshold must be finite");
        this.anomalyScoreThreshold = builder.anomalyScoreThreshold;
        this.fusionRule = checkNotNull(builder.fusionRule, "fusionRule must not be null");
    }

    public static VerdictConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private double anomalyScoreThreshold = DEFAULT_ANOMALY_SCORE_THRESHOLD;
        private FusionRule fusionRule = DEFAULT_FUSION_RULE;

        public Builder anomalyScoreThreshold(double anomalyScoreThreshold) {
            this.anomalyScoreThreshold = anomalyScoreThreshold;
            return this;
        }

        public Builder fusionRule(FusionRule fusionRule) {
            this.fusionRule = fusionRule;
            return this;
        }

        public VerdictConfig build() {
            return new VerdictConfig(this);
        }
    }
}
