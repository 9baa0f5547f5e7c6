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

import com.aiot.powermonitor.inputtypes.RawPoint;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One reading as sent by the client. Fields stay loosely typed here; the
 * validator decides what is acceptable.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PowerReading {

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("power_kW")
    private Double power;

    public RawPoint toRawPoint() {
        return new RawPoint(timestamp, power);
    }
}
