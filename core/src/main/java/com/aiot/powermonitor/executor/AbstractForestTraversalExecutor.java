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

package com.aiot.powermonitor.executor;

import static com.aiot.powermonitor.CommonUtils.checkArgument;
import static com.aiot.powermonitor.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.aiot.powermonitor.tree.IsolationTree;

/**
 * Visits every tree of a forest for a batch of points. For each point the path
 * lengths are summed over the trees in forest order, so every implementation
 * produces bit-identical results for the same input.
 */
public abstract class AbstractForestTraversalExecutor implements AutoCloseable {

    protected final List<IsolationTree> trees;

    protected AbstractForestTraversalExecutor(List<IsolationTree> trees) {
        checkNotNull(trees, "trees must not be null");
        checkArgument(!trees.isEmpty(), "a forest needs at least one tree");
        this.trees = Collections.unmodifiableList(new ArrayList<>(trees));
    }

    /**
     * @param points points to traverse
     * @return for each point, its path length averaged over all trees
     */
    public abstract double[] averagePathLengths(double[][] points);

    protected double averagePathLength(double[] point) {
        double sum = 0;
        for (IsolationTree tree : trees) {
            sum += tree.pathLength(point);
        }
        return sum / trees.size();
    }

    public List<IsolationTree> getTrees() {
        return trees;
    }

    /**
     * Releases any threads held by the executor. The default does nothing.
     */
    @Override
    public void close() {
    }
}
