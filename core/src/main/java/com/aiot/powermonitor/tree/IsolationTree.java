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

package com.aiot.powermonitor.tree;

import static com.aiot.powermonitor.CommonUtils.averagePathLength;
import static com.aiot.powermonitor.CommonUtils.checkArgument;
import static com.aiot.powermonitor.CommonUtils.checkNotNull;

import java.util.Random;

import com.aiot.powermonitor.store.NodeStore;

/**
 * A randomized partitioning tree. Each interior node splits its points on one
 * dimension at a value drawn uniformly between the smallest and the largest
 * value of that dimension among its points; points at or below the cut go
 * left. Points that are easy to separate from the rest end up in shallow
 * leaves, which is what makes the depth of a point an anomaly measure.
 *
 * A tree is immutable once grown and may be traversed concurrently.
 */
public class IsolationTree {

    private final NodeStore nodeStore;
    private final int dimensions;

    /**
     * @param nodeStore  the nodes of the tree, root at index 0
     * @param dimensions the number of dimensions of the points the tree splits
     * @throws IllegalArgumentException if a cut refers to a dimension the points
     *                                  do not have
     */
    public IsolationTree(NodeStore nodeStore, int dimensions) {
        checkNotNull(nodeStore, "nodeStore must not be null");
        checkArgument(dimensions > 0, "dimensions must be greater than 0");
        checkArgument(nodeStore.size() > 0, "a tree needs at least one node");
        for (int i = 0; i < nodeStore.size(); i++) {
            if (!nodeStore.isLeaf(i)) {
                checkArgument(nodeStore.getCutDimension(i) < dimensions,
                        String.format("node %d cuts dimension %d of a %d dimensional space", i,
                                nodeStore.getCutDimension(i), dimensions));
            }
        }
        this.nodeStore = nodeStore;
        this.dimensions = dimensions;
    }

    /**
     * Grows a tree on the given rows of {@code data}.
     *
     * @param data     training points, all of the same dimension
     * @param sample   indexes of the rows this tree is grown on
     * @param maxDepth depth at which nodes stop splitting
     * @param rng      source of the random cuts
     * @return the grown tree
     */
    public static IsolationTree grow(double[][] data, int[] sample, int maxDepth, Random rng) {
        checkNotNull(data, "data must not be null");
        checkNotNull(sample, "sample must not be null");
        checkNotNull(rng, "rng must not be null");
        checkArgument(sample.length > 0, "sample must not be empty");
        checkArgument(maxDepth >= 0, "maxDepth must be non-negative");
        int dimensions = data[sample[0]].length;
        NodeStore store = new NodeStore(2 * sample.length - 1);
        new Grower(data, sample.clone(), maxDepth, rng, store, dimensions).grow(0, sample.length, 0);
        return new IsolationTree(store, dimensions);
    }

    /**
     * The isolation depth of a point: the number of edges from the root to the
     * leaf the point falls into, plus the average path length of the training
     * points that share that leaf.
     *
     * @param point a point with {@link #getDimensions()} values
     * @return the adjusted depth of the point
     */
    public double pathLength(double[] point) {
        checkArgument(point.length == dimensions,
                String.format("point has %d dimensions, expected %d", point.length, dimensions));
        int node = 0;
        int depth = 0;
        while (!nodeStore.isLeaf(node)) {
            if (point[nodeStore.getCutDimension(node)] <= nodeStore.getCutValue(node)) {
                node = nodeStore.getLeftIndex(node);
            } else {
                node = nodeStore.getRightIndex(node);
            }
            depth++;
        }
        return depth + averagePathLength(nodeStore.getMass(node));
    }

    public int getDimensions() {
        return dimensions;
    }

    /**
     * @return the number of training points the tree was grown on
     */
    public int getMass() {
        return nodeStore.getMass(0);
    }

    public int getNumberOfNodes() {
        return nodeStore.size();
    }

    public NodeStore getNodeStore() {
        return nodeStore;
    }

    /**
     * Recursive partitioning of an index array, in the manner of quicksort.
     */
    private static class Grower {

        private final double[][] data;
        private final int[] indexes;
        private final int maxDepth;
        private final Random rng;
        private final NodeStore store;
        private final int dimensions;

        Grower(double[][] data, int[] indexes, int maxDepth, Random rng, NodeStore store, int dimensions) {
            this.data = data;
            this.indexes = indexes;
            this.maxDepth = maxDepth;
            this.rng = rng;
            this.store = store;
            this.dimensions = dimensions;
        }

        /**
         * grows the subtree over indexes[from, to) and returns its node index
         */
        int grow(int from, int to, int depth) {
            int mass = to - from;
            if (depth >= maxDepth || mass <= 1) {
                return store.addLeaf(mass);
            }

            double[] min = new double[dimensions];
            double[] max = new double[dimensions];
            int splittable = bounds(from, to, min, max);
            if (splittable == 0) {
                // all points are identical
                return store.addLeaf(mass);
            }

            int dimension = pickDimension(min, max, rng.nextInt(splittable));
            double cut = min[dimension] + rng.nextDouble() * (max[dimension] - min[dimension]);
            if (cut >= max[dimension]) {
                cut = min[dimension];
            }

            int split = partition(from, to, dimension, cut);
            int node = store.addNode(dimension, cut, mass);
            int left = grow(from, split, depth + 1);
            int right = grow(split, to, depth + 1);
            store.setChildren(node, left, right);
            return node;
        }

        private int bounds(int from, int to, double[] min, double[] max) {
            double[] first = data[indexes[from]];
            System.arraycopy(first, 0, min, 0, dimensions);
            System.arraycopy(first, 0, max, 0, dimensions);
            for (int i = from + 1; i < to; i++) {
                double[] point = data[indexes[i]];
                for (int d = 0; d < dimensions; d++) {
                    min[d] = Math.min(min[d], point[d]);
                    max[d] = Math.max(max[d], point[d]);
                }
            }
            int splittable = 0;
            for (int d = 0; d < dimensions; d++) {
                if (max[d] > min[d]) {
                    splittable++;
                }
            }
            return splittable;
        }

        // the k-th dimension (0 based) with a positive range
        private int pickDimension(double[] min, double[] max, int k) {
            int seen = 0;
            for (int d = 0; d < dimensions; d++) {
                if (max[d] > min[d]) {
                    if (seen == k) {
                        return d;
                    }
                    seen++;
                }
            }
            throw new IllegalStateException("no splittable dimension");
        }

        // moves points with value <= cut to the front, returns the first index of
        // the right side
        private int partition(int from, int to, int dimension, double cut) {
            int i = from;
            int j = to - 1;
            while (i <= j) {
                if (data[indexes[i]][dimension] <= cut) {
                    i++;
                } else {
                    int tmp = indexes[i];
                    indexes[i] = indexes[j];
                    indexes[j] = tmp;
                    j--;
                }
            }
            return i;
        }
    }
}
