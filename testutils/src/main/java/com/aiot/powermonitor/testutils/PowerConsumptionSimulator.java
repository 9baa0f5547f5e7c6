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
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Generates the power draw of a household device at a fixed sampling interval.
 * The base load follows the time of day:
 *
 * <pre>
 *  00:00 - 06:00  0.2 kW  (night)
 *  06:00 - 09:00  0.8 kW  (morning)
 *  09:00 - 17:00  0.6 kW  (daytime)
 *  17:00 - 22:00  1.5 kW  (evening peak)
 *  22:00 - 24:00  0.4 kW  (late evening)
 * </pre>
 *
 * Gaussian noise is added to every reading and the result is clamped at zero.
 * A number of readings, never the first or the last, are then replaced by
 * values drawn uniformly from the anomaly range to simulate a faulty or
 * runaway appliance.
 */
public class PowerConsumptionSimulator {

    public static final LocalDateTime DEFAULT_START = LocalDateTime.of(2025, 10, 16, 0, 0, 0);
    public static final int DEFAULT_DAYS = 2;
    public static final int DEFAULT_INTERVAL_MINUTES = 10;
    public static final int DEFAULT_ANOMALY_COUNT = 8;
    public static final double DEFAULT_NOISE_SIGMA = 0.1;
    public static final double DEFAULT_ANOMALY_MIN = 3.0;
    public static final double DEFAULT_ANOMALY_MAX = 6.0;

    private static final int[] PERIOD_END_HOURS = { 6, 9, 17, 22, 24 };
    private static final double[] PERIOD_BASE_POWER = { 0.2, 0.8, 0.6, 1.5, 0.4 };

    private final LocalDateTime start;
    private final int days;
    private final int intervalMinutes;
    private final int anomalyCount;
    private final double noiseSigma;
    private final double anomalyMin;
    private final double anomalyMax;

    public PowerConsumptionSimulator() {
        this(DEFAULT_START, DEFAULT_DAYS, DEFAULT_INTERVAL_MINUTES, DEFAULT_ANOMALY_COUNT, DEFAULT_NOISE_SIGMA,
                DEFAULT_ANOMALY_MIN, DEFAULT_ANOMALY_MAX);
    }

    public PowerConsumptionSimulator(LocalDateTime start, int days, int intervalMinutes, int anomalyCount,
            double noiseSigma, double anomalyMin, double anomalyMax) {
        if (days <= 0 || intervalMinutes <= 0 || 60 % intervalMinutes != 0) {
            throw new IllegalArgumentException("days must be positive and the interval must divide an hour");
        }
        int size = days * 24 * (60 / intervalMinutes);
        if (anomalyCount < 0 || anomalyCount > size - 2) {
            throw new IllegalArgumentException("anomalyCount must be between 0 and " + (size - 2));
        }
        if (anomalyMin > anomalyMax || noiseSigma < 0) {
            throw new IllegalArgumentException("invalid noise or anomaly range");
        }
        this.start = start;
        this.days = days;
        this.intervalMinutes = intervalMinutes;
        this.anomalyCount = anomalyCount;
        this.noiseSigma = noiseSigma;
        this.anomalyMin = anomalyMin;
        this.anomalyMax = anomalyMax;
    }

    public int getSize() {
        return days * 24 * (60 / intervalMinutes);
    }

    public static double basePower(int hour) {
        for (int i = 0; i < PERIOD_END_HOURS.length; i++) {
            if (hour < PERIOD_END_HOURS[i]) {
                return PERIOD_BASE_POWER[i];
            }
        }
        throw new IllegalArgumentException("hour out of range: " + hour);
    }

    public SimulatedPowerData generate(long seed) {
        Random rng = new Random(seed);
        NormalDistribution noise = new NormalDistribution(new Random(rng.nextLong()));
        int size = getSize();

        List<LocalDateTime> timestamps = new ArrayList<>(size);
        double[] power = new double[size];
        boolean[] anomaly = new boolean[size];

        for (int i = 0; i < size; i++) {
            LocalDateTime timestamp = start.plusMinutes((long) i * intervalMinutes);
            timestamps.add(timestamp);
            power[i] = Math.max(0.0, noise.nextDouble(basePower(timestamp.getHour()), noiseSigma));
        }

        // distinct interior positions
        int[] candidates = new int[size - 2];
        for (int i = 0; i < candidates.length; i++) {
            candidates[i] = i + 1;
        }
        for (int i = 0; i < anomalyCount; i++) {
            int j = i + rng.nextInt(candidates.length - i);
            int tmp = candidates[i];
            candidates[i] = candidates[j];
            candidates[j] = tmp;

            int index = candidates[i];
            power[index] = anomalyMin + rng.nextDouble() * (anomalyMax - anomalyMin);
            anomaly[index] = true;
        }

        return new SimulatedPowerData(timestamps, power, anomaly);
    }
}
