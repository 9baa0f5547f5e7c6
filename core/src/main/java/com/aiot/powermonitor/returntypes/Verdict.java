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

package com.aiot.powermonitor.returntypes;

import static com.aiot.powermonitor.CommonUtils.checkNotNull;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The result of scoring one series: the status, the mean anomaly score of its
 * rows and the message associated with the status.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Verdict {

    private final VerdictStatus status;

    private final double averageScore;

    private final String message;

    public Verdict(VerdictStatus status, double averageScore, String message) {
        this.status = checkNotNull(status, "status must not be null");
        this.averageScore = averageScore;
        this.message = checkNotNull(message, "message must not be null");
    }

    public boolean isWarning() {
        return status == VerdictStatus.WARNING;
    }
}
