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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A reading as supplied by a caller, before validation. Either field may be
 * missing; the timestamp is kept in its textual form until it is parsed by the
 * validator.
 */
@Getter
@ToString
@EqualsAndHashCode
public class RawPoint {

    private final String timestamp;

    private final Double power;

    public RawPoint(String timestamp, Double power) {
        this.timestamp = timestamp;
        this.power = power;
    }
}
