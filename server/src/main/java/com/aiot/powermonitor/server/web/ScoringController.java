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

package com.aiot.powermonitor.server.web;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import com.aiot.powermonitor.ScoringService;
import com.aiot.powermonitor.inputtypes.RawPoint;
import com.aiot.powermonitor.returntypes.Verdict;
import com.aiot.powermonitor.server.web.dto.PowerReading;
import com.aiot.powermonitor.server.web.dto.ScoringRequest;
import com.aiot.powermonitor.server.web.dto.ScoringResponse;

/**
 * Scores one session of power readings per request.
 */
@RestController
public class ScoringController {

    private static final Logger log = LoggerFactory.getLogger(ScoringController.class);

    private final ScoringService scoringService;

    public ScoringController(ScoringService scoringService) {
        this.scoringService = scoringService;
    }

    @PostMapping(path = "/predict_anomaly", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ScoringResponse predictAnomaly(@RequestBody ScoringRequest request) {
        List<RawPoint> points = toRawPoints(request.getTimeSeries());
        log.debug("Scoring request with {} readings", points.size());
        Verdict verdict = scoringService.score(points);
        return ScoringResponse.of(verdict);
    }

    // a null element is kept so the validator can report its index
    private static List<RawPoint> toRawPoints(List<PowerReading> readings) {
        if (readings == null) {
            return Collections.emptyList();
        }
        return readings.stream().map(r -> r == null ? null : r.toRawPoint()).collect(Collectors.toList());
    }
}
