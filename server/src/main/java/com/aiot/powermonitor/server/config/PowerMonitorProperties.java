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

package com.aiot.powermonitor.server.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.aiot.powermonitor.config.FusionRule;
import com.aiot.powermonitor.config.VerdictConfig;

import lombok.Data;

/**
 * Settings bound from the {@code powermonitor} prefix.
 */
@Data
@ConfigurationProperties(prefix = "powermonitor")
public class PowerMonitorProperties {

    private Scoring scoring = new Scoring();

    private Model model = new Model();

    private Cors cors = new Cors();

    @Data
    public static class Scoring {

        /**
         * Sessions whose mean score falls below this value are flagged.
         */
        private double anomalyScoreThreshold = VerdictConfig.DEFAULT_ANOMALY_SCORE_THRESHOLD;

        private FusionRule fusionRule = VerdictConfig.DEFAULT_FUSION_RULE;

        public VerdictConfig toVerdictConfig() {
            return VerdictConfig.builder().anomalyScoreThreshold(anomalyScoreThreshold).fusionRule(fusionRule)
                    .build();
        }
    }

    @Data
    public static class Model {

        /**
         * Location of the JSON artifact written by the trainer.
         */
        private String path = "anomaly_detector.json";
    }

    @Data
    public static class Cors {

        private List<String> allowedOrigins = new ArrayList<>(
                List.of("http://localhost:5173", "http://127.0.0.1:5173", "http://localhost:8000"));

        private List<String> allowedMethods = new ArrayList<>(List.of("POST", "OPTIONS"));
    }
}
