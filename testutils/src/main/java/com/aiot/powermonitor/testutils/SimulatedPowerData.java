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

package com.aiot.powermonitor.testutils;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

/**
 * A simulated power series together with the ground truth of which readings
 * were injected as anomalies.
 */
public class SimulatedPowerData {

    private final List<LocalDateTime> timestamps;
    private final double[] power;
    private final boolean[] anomaly;

    public SimulatedPowerData(List<LocalDateTime> timestamps, double[] power, boolean[] anomaly) {
        if (timestamps.size() != power.length || power.length != anomaly.length) {
            throw new IllegalArgumentException("timestamps, power and anomaly flags must have the same length");
        }
        this.timestamps = List.copyOf(timestamps);
        this.power = Arrays.copyOf(power, power.length);
        this.anomaly = Arrays.copyOf(anomaly, anomaly.length);
    }

    public int size() {
        return power.length;
    }

    public List<LocalDateTime> getTimestamps() {
        return timestamps;
    }

    public double[] getPower() {
        return Arrays.copyOf(power, power.length);
    }

    public boolean[] getAnomaly() {
        return Arrays.copyOf(anomaly, anomaly.length);
    }

    public int countAnomalies() {
        int count = 0;
        for (boolean flag : anomaly) {
            if (flag) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return the power values as single column rows
     */
    public double[][] toRows() {
        double[][] rows = new double[power.length][];
        for (int i = 0; i < power.length; i++) {
            rows[i] = new double[] { power[i] };
        }
        return rows;
    }
}
