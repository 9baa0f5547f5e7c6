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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

public class UniformSamplerTest {

    @Test
    public void testSampleIsDistinctAndInRange() {
        UniformSampler sampler = new UniformSampler(42L);
        int[] sample = sampler.sample(288, 256);

        assertEquals(256, sample.length);
        Set<Integer> seen = new HashSet<>();
        for (int index : sample) {
            assertTrue(index >= 0 && index < 288);
            assertTrue(seen.add(index));
        }
    }

    @Test
    public void testFullSampleIsPermutation() {
        int[] sample = new UniformSampler(7L).sample(10, 10);
        int[] sorted = sample.clone();
        Arrays.sort(sorted);
        assertArrayEquals(new int[] { 0, 1, 2, 3, 4, 5, 6, 7, 8, 9 }, sorted);
    }

    @Test
    public void testSeedDeterminesSample() {
        assertArrayEquals(new UniformSampler(123L).sample(100, 20), new UniformSampler(123L).sample(100, 20));
    }

    @Test
    public void testInvalidArguments() {
        UniformSampler sampler = new UniformSampler(0L);
        assertThrows(IllegalArgumentException.class, () -> sampler.sample(0, 0));
        assertThrows(IllegalArgumentException.class, () -> sampler.sample(5, 6));
        assertThrows(IllegalArgumentException.class, () -> sampler.sample(5, 0));
        assertThrows(NullPointerException.class, () -> new UniformSampler(null));
    }
}
