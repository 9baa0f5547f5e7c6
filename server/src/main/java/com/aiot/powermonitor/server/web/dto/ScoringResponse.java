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

package com.aiot.powermonitor.server.web.dto;

import com.aiot.powermonitor.returntypes.Verdict;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScoringResponse {

    @JsonProperty("status")
    private String status;

    @JsonProperty("average_anomaly_score")
    private double averageAnomalyScore;

    @JsonProperty("message")
    private String message;

    public static ScoringResponse of(Verdict verdict) {
        return new ScoringResponse(verdict.getStatus().getLabel(), verdict.getAverageScore(), verdict.getMessage());
    }
}
