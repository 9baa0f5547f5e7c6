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
 * The hard, per-row decision of an anomaly model. The codes follow the
 * convention of the training tools: 1 for an inlier and -1 for an outlier.
 */
public enum PointLabel {

    NORMAL(1), ANOMALOUS(-1);

    private final int code;

    PointLabel(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static PointLabel fromCode(int code) {
        for (PointLabel label : values()) {
            if (label.code == code) {
                return label;
            }
        }
        throw new IllegalArgumentException("unknown label code " + code);
    }
}
