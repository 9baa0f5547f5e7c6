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

package com.aiot.powermonitor.trainer.io;

import static com.aiot.powermonitor.CommonUtils.checkArgument;
import static com.aiot.powermonitor.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Power readings read from a CSV file, with the ground truth labels if the
 * file has an {@code is_anomaly} column.
 */
public class PowerDataset {

    private final List<String> timestamps;
    private final double[] power;
    private final boolean[] anomaly;

    public PowerDataset(List<String> timestamps, double[] power, boolean[] anomaly) {
        checkNotNull(timestamps, "timestamps must not be null");
        checkNotNull(power, "power must not be null");
        checkArgument(timestamps.size() == power.length, "timestamps and power must have the same length");
        checkArgument(anomaly == null || anomaly.length == power.length,
                "anomaly flags and power must have the same length");
        this.timestamps = Collections.unmodifiableList(new ArrayList<>(timestamps));
        this.power = Arrays.copyOf(power, power.length);
        this.anomaly = anomaly == null ? null : Arrays.copyOf(anomaly, anomaly.length);
    }

    public int size() {
        return power.length;
    }

    public List<String> getTimestamps() {
        return timestamps;
    }

    public double getPower(int index) {
        return power[index];
    }

    public Optional<boolean[]> getAnomaly() {
        return anomaly == null ? Optional.empty() : Optional.of(Arrays.copyOf(anomaly, anomaly.length));
    }

    /**
     * @return the power values as single column training rows
     */
    public double[][] toRows() {
        double[][] rows = new double[power.length][];
        for (int i = 0; i < power.length; i++) {
            rows[i] = new double[] { power[i] };
        }
        return rows;
    }
}
