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

import java.util.Arrays;

/**
 * One {@link PointLabel} per row of a feature matrix, in row order.
 */
public class LabelVector {

    private final PointLabel[] labels;

    public LabelVector(PointLabel[] labels) {
        checkNotNull(labels, "labels must not be null");
        for (PointLabel label : labels) {
            checkNotNull(label, "labels must not contain null");
        }
        this.labels = Arrays.copyOf(labels, labels.length);
    }

    public int size() {
        return labels.length;
    }

    public PointLabel get(int index) {
        return labels[index];
    }

    public boolean containsAnomaly() {
        for (PointLabel label : labels) {
            if (label == PointLabel.ANOMALOUS) {
                return true;
            }
        }
        return false;
    }

    public int countAnomalies() {
        int count = 0;
        for (PointLabel label : labels) {
            if (label == PointLabel.ANOMALOUS) {
                count++;
            }
        }
        return count;
    }

    public PointLabel[] toArray() {
        return Arrays.copyOf(labels, labels.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LabelVector)) {
            return false;
        }
        return Arrays.equals(labels, ((LabelVector) o).labels);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(labels);
    }

    @Override
    public String toString() {
        return "LabelVector" + Arrays.toString(labels);
    }
}
