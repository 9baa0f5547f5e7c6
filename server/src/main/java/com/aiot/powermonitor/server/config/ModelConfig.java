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

import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.aiot.powermonitor.ScoringService;
import com.aiot.powermonitor.anomalydetection.ModelHandle;
import com.aiot.powermonitor.config.VerdictConfig;
import com.aiot.powermonitor.serialize.ModelArtifactLoader;
import com.aiot.powermonitor.verdict.VerdictEngine;

/**
 * Wires the scoring pipeline. The model artifact is loaded exactly once; a
 * failed load aborts context startup with the loader's {@code StartupException}.
 */
@Configuration
@EnableConfigurationProperties(PowerMonitorProperties.class)
public class ModelConfig {

    private static final Logger log = LoggerFactory.getLogger(ModelConfig.class);

    @Bean
    public ModelArtifactLoader modelArtifactLoader() {
        return new ModelArtifactLoader();
    }

    @Bean(destroyMethod = "close")
    public ModelHandle modelHandle(ModelArtifactLoader loader, PowerMonitorProperties properties) {
        Path path = Paths.get(properties.getModel().getPath());
        return loader.load(path);
    }

    @Bean
    public VerdictEngine verdictEngine(PowerMonitorProperties properties) {
        VerdictConfig config = properties.getScoring().toVerdictConfig();
        log.info("Verdict fusion rule {} with anomaly score threshold {}", config.getFusionRule(),
                config.getAnomalyScoreThreshold());
        return new VerdictEngine(config);
    }

    @Bean
    public ScoringService scoringService(ModelHandle modelHandle, VerdictEngine verdictEngine) {
        return new ScoringService(modelHandle, verdictEngine);
    }
}
