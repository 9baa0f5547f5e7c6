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

/**
 * Session level classification of a power consumption series.
 */
public enum VerdictStatus {

    NORMAL("Normal", "Power consumption pattern is stable. No anomaly detected."),
    WARNING("Warning",
            "Abnormal power consumption pattern detected. Immediate inspection of the related equipment is recommended.");

    private final String label;
    private final String message;

    VerdictStatus(String label, String message) {
        this.label = label;
        this.message = message;
    }

    /**
     * @return the name callers see, "Normal" or "Warning"
     */
    public String getLabel() {
        return label;
    }

    /**
     * @return the fixed human readable message for this status
     */
    public String getMessage() {
        return message;
    }
}
