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

package com.aiot.powermonitor;

import java.util.Arrays;
import java.util.Objects;

/** A collection of common utility functions. */
public class CommonUtils {

    /**
     * The Euler-Mascheroni constant, used to approximate harmonic numbers.
     */
    public static final double EULER_GAMMA = 0.5772156649;

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * Approximates the harmonic number H(i) = 1 + 1/2 + ... + 1/i.
     *
     * @param i a positive number
     * @return ln(i) + gamma
     */
    public static double harmonicNumber(double i) {
        return Math.log(i) + EULER_GAMMA;
    }

    /**
     * The average path length of an unsuccessful search in a binary search tree
     * built over {@code mass} points. This is the normalizer of isolation depths: a
     * leaf that still holds {@code mass} points is credited with this much extra
     * depth, and the score of a forest grown on samples of size {@code n} is scaled
     * by {@code averagePathLength(n)}.
     *
     * @param mass the number of points
     * @return 0 for mass at most 1, 1 for mass 2, and 2H(mass - 1) - 2(mass - 1) /
     *         mass otherwise
     */
    public static double averagePathLength(int mass) {
        if (mass <= 1) {
            return 0.0;
        }
        if (mass == 2) {
            return 1.0;
        }
        return 2.0 * harmonicNumber(mass - 1.0) - 2.0 * (mass - 1.0) / mass;
    }

    /**
     * The isolation depth beyond which trees stop splitting, for trees grown on
     * samples of the given size.
     *
     * @param sampleSize number of points each tree is grown on
     * @return ceil(log2(max(sampleSize, 2)))
     */
    public static int maxDepth(int sampleSize) {
        int n = Math.max(sampleSize, 2);
        // ceil(log2(n)) without floating point rounding
        return 32 - Integer.numberOfLeadingZeros(n - 1);
    }

    /**
     * The q-th percentile of the values, with linear interpolation between the two
     * closest ranks. The input is not modified.
     *
     * @param values     a non-empty array
     * @param percentile a value in [0, 100]
     * @return the interpolated percentile
     */
    public static double percentile(double[] values, double percentile) {
        checkNotNull(values, "values must not be null");
        checkArgument(values.length > 0, "values must not be empty");
        checkArgument(percentile >= 0 && percentile <= 100, "percentile must be between 0 and 100");
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }
}
