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

package com.aiot.powermonitor.inputtypes;

import static com.aiot.powermonitor.CommonUtils.checkArgument;
import static com.aiot.powermonitor.CommonUtils.checkNotNull;

import java.time.Instant;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * a validated power reading
 */
@Getter
@ToString
@EqualsAndHashCode
public class DataPoint {

    // time of the reading
    private final Instant timestamp;

    // consumption in kW, never negative
    private final double power;

    public DataPoint(Instant timestamp, double power) {
        checkNotNull(timestamp, "timestamp must not be null");
        checkArgument(Double.isFinite(power), "power must be a finite number");
        checkArgument(power >= 0, "power must be non-negative");
        this.timestamp = timestamp;
        this.power = power;
    }
}
