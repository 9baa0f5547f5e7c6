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

import java.util.Random;

/**
 * Normal variates from a seeded {@link Random}, generated in pairs with the
 * Box-Muller transform.
 */
public class NormalDistribution {
    private final Random rng;
    private final double[] buffer;
    private int index;

    public NormalDistribution(Random rng) {
        this.rng = rng;
        buffer = new double[2];
        index = 0;
    }

    public double nextDouble() {
        if (index == 0) {
            // apply the Box-Muller transform to produce Normal variates
            double u = 1.0 - rng.nextDouble();
            double v = rng.nextDouble();
            double r = Math.sqrt(-2 * Math.log(u));
            buffer[0] = r * Math.cos(2 * Math.PI * v);
            buffer[1] = r * Math.sin(2 * Math.PI * v);
        }

        double result = buffer[index];
        index = (index + 1) % 2;

        return result;
    }

    public double nextDouble(double mu, double sigma) {
        return mu + sigma * nextDouble();
    }
}
