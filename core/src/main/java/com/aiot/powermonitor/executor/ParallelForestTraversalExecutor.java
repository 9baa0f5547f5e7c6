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

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;

import com.aiot.powermonitor.tree.IsolationTree;

/**
 * An implementation of forest traversal that uses a private thread pool to
 * score the points of a batch in parallel. Each point is still summed over the
 * trees in order, so results match {@link SequentialForestTraversalExecutor}
 * exactly.
 */
public class ParallelForestTraversalExecutor extends AbstractForestTraversalExecutor {

    private ForkJoinPool forkJoinPool;
    private final int threadPoolSize;

    public ParallelForestTraversalExecutor(List<IsolationTree> trees, int threadPoolSize) {
        super(trees);
        checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        this.threadPoolSize = threadPoolSize;
        forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    @Override
    public double[] averagePathLengths(double[][] points) {
        return submitAndJoin(
                () -> IntStream.range(0, points.length).parallel().mapToDouble(i -> averagePathLength(points[i]))
                        .toArray());
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    private synchronized ForkJoinPool pool() {
        if (forkJoinPool == null) {
            forkJoinPool = new ForkJoinPool(threadPoolSize);
        }
        return forkJoinPool;
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        return pool().submit(callable).join();
    }

    @Override
    public synchronized void close() {
        if (forkJoinPool != null) {
            forkJoinPool.shutdown();
            forkJoinPool = null;
        }
    }
}
