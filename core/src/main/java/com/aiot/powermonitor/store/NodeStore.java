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

package com.aiot.powermonitor.store;

import static com.aiot.powermonitor.CommonUtils.checkArgument;
import static com.aiot.powermonitor.CommonUtils.checkNotNull;
import static com.aiot.powermonitor.CommonUtils.checkState;

import java.util.Arrays;

/**
 * A fixed-capacity buffer for the nodes of one isolation tree. A node is
 * defined by its children, its cut, and the number of training points that
 * reached it. The NodeStore class uses arrays to store these field values for
 * a collection of nodes, and an index in the store is used to look up the
 * field values for a particular node.
 *
 * If we think of an array of node objects as being row-oriented (where each row
 * is a node), then this class is analogous to a column-oriented database of
 * nodes.
 *
 * Nodes are added parent first, so the children of a node always have larger
 * indexes than the node itself and index 0 is the root. A leaf has both child
 * indexes set to {@link #NULL}; an interior node has both set.
 */
public class NodeStore {

    public static final int NULL = -1;

    private final int capacity;
    private int size;
    private final int[] leftIndex;
    private final int[] rightIndex;
    private final int[] cutDimension;
    private final double[] cutValue;
    private final int[] mass;

    /**
     * Create a new empty NodeStore with the given capacity.
     *
     * @param capacity The maximum number of nodes whose data can be stored.
     */
    public NodeStore(int capacity) {
        checkArgument(capacity > 0, "capacity must be greater than 0");
        this.capacity = capacity;
        this.size = 0;
        leftIndex = new int[capacity];
        rightIndex = new int[capacity];
        cutDimension = new int[capacity];
        cutValue = new double[capacity];
        mass = new int[capacity];
        Arrays.fill(leftIndex, NULL);
        Arrays.fill(rightIndex, NULL);
        Arrays.fill(cutDimension, NULL);
    }

    /**
     * Create a full NodeStore from previously saved arrays. The arrays are copied
     * and checked for structural consistency.
     *
     * @throws IllegalArgumentException if the arrays do not describe a tree rooted
     *                                  at index 0
     */
    public NodeStore(int[] leftIndex, int[] rightIndex, int[] cutDimension, double[] cutValue, int[] mass) {
        checkNotNull(leftIndex, "leftIndex must not be null");
        checkNotNull(rightIndex, "rightIndex must not be null");
        checkNotNull(cutDimension, "cutDimension must not be null");
        checkNotNull(cutValue, "cutValue must not be null");
        checkNotNull(mass, "mass must not be null");
        int length = leftIndex.length;
        checkArgument(length > 0, "a node store needs at least one node");
        checkArgument(rightIndex.length == length && cutDimension.length == length && cutValue.length == length
                && mass.length == length, "node arrays must have the same length");

        for (int i = 0; i < length; i++) {
            boolean leftLeaf = leftIndex[i] == NULL;
            boolean rightLeaf = rightIndex[i] == NULL;
            checkArgument(leftLeaf == rightLeaf, String.format("node %d has exactly one child", i));
            checkArgument(mass[i] >= 0, String.format("node %d has negative mass", i));
            if (!leftLeaf) {
                checkArgument(leftIndex[i] > i && leftIndex[i] < length,
                        String.format("node %d has an invalid left child %d", i, leftIndex[i]));
                checkArgument(rightIndex[i] > i && rightIndex[i] < length,
                        String.format("node %d has an invalid right child %d", i, rightIndex[i]));
                checkArgument(leftIndex[i] != rightIndex[i], String.format("node %d has identical children", i));
                checkArgument(cutDimension[i] >= 0, String.format("node %d has an invalid cut dimension", i));
                checkArgument(!Double.isNaN(cutValue[i]), String.format("node %d has an invalid cut value", i));
            }
        }

        this.capacity = length;
        this.size = length;
        this.leftIndex = Arrays.copyOf(leftIndex, length);
        this.rightIndex = Arrays.copyOf(rightIndex, length);
        this.cutDimension = Arrays.copyOf(cutDimension, length);
        this.cutValue = Arrays.copyOf(cutValue, length);
        this.mass = Arrays.copyOf(mass, length);
    }

    /**
     * Add an interior node. Its children are attached later with
     * {@link #setChildren}.
     *
     * @param cutDimension The dimension of the cut in this node.
     * @param cutValue     The value of the cut in this node.
     * @param mass         Number of training points that reached this node.
     * @return the index of the newly stored node.
     */
    public int addNode(int cutDimension, double cutValue, int mass) {
        int index = takeIndex();
        this.cutDimension[index] = cutDimension;
        this.cutValue[index] = cutValue;
        this.mass[index] = mass;
        return index;
    }

    /**
     * Add a leaf.
     *
     * @param mass Number of training points that reached this leaf.
     * @return the index of the newly stored leaf.
     */
    public int addLeaf(int mass) {
        int index = takeIndex();
        this.mass[index] = mass;
        return index;
    }

    public void setChildren(int index, int left, int right) {
        checkArgument(left > index && right > index, "children must be added after their parent");
        leftIndex[index] = left;
        rightIndex[index] = right;
    }

    private int takeIndex() {
        checkState(size < capacity, "node store is full");
        return size++;
    }

    public boolean isLeaf(int index) {
        return leftIndex[index] == NULL;
    }

    public int getLeftIndex(int index) {
        return leftIndex[index];
    }

    public int getRightIndex(int index) {
        return rightIndex[index];
    }

    public int getCutDimension(int index) {
        return cutDimension[index];
    }

    public double getCutValue(int index) {
        return cutValue[index];
    }

    public int getMass(int index) {
        return mass[index];
    }

    public int size() {
        return size;
    }

    public int getCapacity() {
        return capacity;
    }

    public int[] getLeftIndex() {
        return Arrays.copyOf(leftIndex, size);
    }

    public int[] getRightIndex() {
        return Arrays.copyOf(rightIndex, size);
    }

    public int[] getCutDimension() {
        return Arrays.copyOf(cutDimension, size);
    }

    public double[] getCutValue() {
        return Arrays.copyOf(cutValue, size);
    }

    public int[] getMass() {
        return Arrays.copyOf(mass, size);
    }
}
