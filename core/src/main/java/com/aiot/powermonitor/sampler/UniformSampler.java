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

package com.aiot.powermonitor.sampler;

import static com.aiot.powermonitor.CommonUtils.checkArgument;
import static com.aiot.powermonitor.CommonUtils.checkNotNull;

import java.util.Random;

/**
 * Draws a uniform random subsample of row indexes without replacement. Each
 * tree of a forest is grown on its own subsample.
 */
public class UniformSampler {

    private final Random rng;

    public UniformSampler(Random rng) {
        this.rng = checkNotNull(rng, "rng must not be null");
    }

    public UniformSampler(long seed) {
        this(new Random(seed));
    }

    /**
     * Partial Fisher-Yates shuffle of {@code 0 .. populationSize - 1}.
     *
     * @param populationSize number of rows to draw from
     * @param sampleSize     number of distinct rows to draw
     * @return {@code sampleSize} distinct indexes in draw order
     */
    public int[] sample(int populationSize, int sampleSize) {
        checkArgument(populationSize > 0, "populationSize must be greater than 0");
        checkArgument(sampleSize > 0 && sampleSize <= populationSize,
                "sampleSize must be between 1 and populationSize");
        int[] population = new int[populationSize];
        for (int i = 0; i < populationSize; i++) {
            population[i] = i;
        }
        for (int i = 0; i < sampleSize; i++) {
            int j = i + rng.nextInt(populationSize - i);
            int tmp = population[i];
            population[i] = population[j];
            population[j] = tmp;
        }
        int[] sample = new int[sampleSize];
        System.arraycopy(population, 0, sample, 0, sampleSize);
        return sample;
    }
}
