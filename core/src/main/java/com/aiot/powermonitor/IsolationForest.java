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

import static com.aiot.powermonitor.CommonUtils.averagePathLength;
import static com.aiot.powermonitor.CommonUtils.checkArgument;
import static com.aiot.powermonitor.CommonUtils.checkNotNull;
import static com.aiot.powermonitor.CommonUtils.maxDepth;
import static com.aiot.powermonitor.CommonUtils.percentile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import com.aiot.powermonitor.anomalydetection.AnomalyModel;
import com.aiot.powermonitor.executor.AbstractForestTraversalExecutor;
import com.aiot.powermonitor.executor.ParallelForestTraversalExecutor;
import com.aiot.powermonitor.executor.SequentialForestTraversalExecutor;
import com.aiot.powermonitor.inputtypes.FeatureMatrix;
import com.aiot.powermonitor.returntypes.LabelVector;
import com.aiot.powermonitor.returntypes.PointLabel;
import com.aiot.powermonitor.returntypes.ScoreVector;
import com.aiot.powermonitor.sampler.UniformSampler;
import com.aiot.powermonitor.tree.IsolationTree;

/**
 * An Isolation Forest is a collection of randomized partitioning trees, each
 * grown on a uniform subsample of a batch of training points. A point that is
 * isolated after few cuts on average is unusual with respect to the training
 * data.
 *
 * Three scores are exposed:
 * <ul>
 * <li>{@link #scoreSample} is {@code -2^(-E[h(x)] / c(sampleSize))}, where
 * {@code E[h(x)]} is the path length of {@code x} averaged over the trees and
 * {@code c} is {@link CommonUtils#averagePathLength}. It lies in [-1, 0] and is
 * close to -1 for clear outliers.</li>
 * <li>{@link #decisionFunction} is the sample score minus the offset learned at
 * training time. It is negative for points the forest considers outliers; this
 * is the score reported through {@link AnomalyModel#score}.</li>
 * <li>{@link AnomalyModel#label} is {@link PointLabel#ANOMALOUS} exactly when the
 * decision function is negative.</li>
 * </ul>
 *
 * The offset is -0.5 when the contamination is automatic, otherwise the
 * percentile of the training sample scores that corresponds to the expected
 * fraction of outliers. A trained forest never changes, and concurrent scoring
 * is safe.
 */
public class IsolationForest implements AnomalyModel {

    /**
     * Default number of trees to use in the forest.
     */
    public static final int DEFAULT_NUMBER_OF_TREES = 100;

    /**
     * Upper bound of the subsample size when none is configured. Smaller
     * training sets use all of their points.
     */
    public static final int DEFAULT_MAX_SAMPLE_SIZE = 256;

    /**
     * Offset used when the contamination is automatic.
     */
    public static final double DEFAULT_OFFSET = -0.5;

    /**
     * Largest supported contamination.
     */
    public static final double MAX_CONTAMINATION = 0.5;

    /**
     * Parallel execution is not enabled by default.
     */
    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    /**
     * The number of dimensions of the input data.
     */
    protected final int dimensions;
    /**
     * The number of points each tree was grown on.
     */
    protected final int sampleSize;
    /**
     * The number of trees in this forest.
     */
    protected final int numberOfTrees;
    /**
     * Expected fraction of outliers in the training data, or empty if the offset
     * is the automatic one.
     */
    protected final Optional<Double> contamination;
    /**
     * Subtracted from sample scores so that outliers score below zero.
     */
    protected final double offset;
    /**
     * Expected path length of a point in a tree grown on {@code sampleSize}
     * points.
     */
    protected final double normalizer;
    /**
     * Enable parallel execution.
     */
    protected final boolean parallelExecutionEnabled;
    /**
     * Number of threads to use in the thread pool if parallel execution is enabled.
     */
    protected final int threadPoolSize;

    protected final List<IsolationTree> trees;

    /**
     * An implementation of forest traversal algorithms.
     */
    protected final AbstractForestTraversalExecutor traversalExecutor;

    /**
     * Assembles a forest from trees that were already grown, for example when
     * restoring a saved model.
     *
     * The sample size of the forest is the number of points the trees were grown
     * on, which must be the same for every tree.
     *
     * @param builder settings of the forest
     * @param trees   the trees of the forest
     * @param offset  the offset learned when the trees were grown
     */
    public IsolationForest(Builder<?> builder, List<IsolationTree> trees, double offset) {
        checkNotNull(builder, "builder must not be null");
        checkNotNull(trees, "trees must not be null");
        checkArgument(builder.dimensions > 0, "dimensions must be greater than 0");
        checkArgument(!trees.isEmpty(), "a forest needs at least one tree");
        checkArgument(Double.isFinite(offset), "offset must be finite");
        checkNotNull(trees.get(0), "trees must not contain null");
        int treeMass = trees.get(0).getMass();
        checkArgument(treeMass > 1, "trees must be grown on at least two points");
        for (IsolationTree tree : trees) {
            checkNotNull(tree, "trees must not contain null");
            checkArgument(tree.getDimensions() == builder.dimensions, "trees must match the forest dimensions");
            checkArgument(tree.getMass() == treeMass, "all trees must be grown on the same number of points");
        }
        builder.contamination.ifPresent(IsolationForest::checkContamination);

        this.dimensions = builder.dimensions;
        this.sampleSize = treeMass;
        this.numberOfTrees = trees.size();
        this.contamination = builder.contamination;
        this.offset = offset;
        this.normalizer = averagePathLength(sampleSize);
        this.parallelExecutionEnabled = builder.parallelExecutionEnabled;
        this.threadPoolSize = builder.threadPoolSize.orElse(Runtime.getRuntime().availableProcessors() - 1);
        this.trees = Collections.unmodifiableList(new ArrayList<>(trees));

        if (parallelExecutionEnabled) {
            checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
            traversalExecutor = new ParallelForestTraversalExecutor(this.trees, threadPoolSize);
        } else {
            traversalExecutor = new SequentialForestTraversalExecutor(this.trees);
        }
    }

    private static void checkContamination(double contamination) {
        checkArgument(contamination > 0 && contamination <= MAX_CONTAMINATION,
                "contamination must be in (0, " + MAX_CONTAMINATION + "]");
    }

    /**
     * @return a new builder.
     */
    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * @param points points with {@link #getDimensions()} values each
     * @return the sample score of every point, in [-1, 0]; lower is more anomalous
     */
    public double[] scoreSamples(double[][] points) {
        checkNotNull(points, "points must not be null");
        for (double[] point : points) {
            checkNotNull(point, "points must not contain null");
            checkArgument(point.length == dimensions,
                    String.format("point has %d dimensions, expected %d", point.length, dimensions));
        }
        double[] lengths = traversalExecutor.averagePathLengths(points);
        double[] scores = new double[lengths.length];
        for (int i = 0; i < lengths.length; i++) {
            scores[i] = -Math.pow(2.0, -lengths[i] / normalizer);
        }
        return scores;
    }

    public double scoreSample(double[] point) {
        return scoreSamples(new double[][] { point })[0];
    }

    /**
     * @param points points with {@link #getDimensions()} values each
     * @return the sample score minus the offset; negative for outliers
     */
    public double[] decisionFunction(double[][] points) {
        double[] scores = scoreSamples(points);
        for (int i = 0; i < scores.length; i++) {
            scores[i] -= offset;
        }
        return scores;
    }

    public double decisionFunction(double[] point) {
        return decisionFunction(new double[][] { point })[0];
    }

    /**
     * @param points points with {@link #getDimensions()} values each
     * @return the label of every point
     */
    public PointLabel[] predict(double[][] points) {
        double[] decisions = decisionFunction(points);
        PointLabel[] labels = new PointLabel[decisions.length];
        for (int i = 0; i < decisions.length; i++) {
            labels[i] = decisions[i] < 0 ? PointLabel.ANOMALOUS : PointLabel.NORMAL;
        }
        return labels;
    }

    @Override
    public ScoreVector score(FeatureMatrix features) {
        checkNotNull(features, "features must not be null");
        return new ScoreVector(decisionFunction(features.toArray()));
    }

    @Override
    public LabelVector label(FeatureMatrix features) {
        checkNotNull(features, "features must not be null");
        return new LabelVector(predict(features.toArray()));
    }

    @Override
    public int getDimensions() {
        return dimensions;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public int getNumberOfTrees() {
        return numberOfTrees;
    }

    public Optional<Double> getContamination() {
        return contamination;
    }

    public double getOffset() {
        return offset;
    }

    public boolean isParallelExecutionEnabled() {
        return parallelExecutionEnabled;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public List<IsolationTree> getTrees() {
        return trees;
    }

    @Override
    public void close() {
        traversalExecutor.close();
    }

    public static class Builder<T extends Builder<T>> {

        // We use Optional types for optional primitive fields when it doesn't make
        // sense to use a constant default.

        private int dimensions;
        private int numberOfTrees = DEFAULT_NUMBER_OF_TREES;
        private Optional<Integer> sampleSize = Optional.empty();
        private Optional<Double> contamination = Optional.empty();
        private Optional<Long> randomSeed = Optional.empty();
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();

        public T dimensions(int dimensions) {
            this.dimensions = dimensions;
            return (T) this;
        }

        public T numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return (T) this;
        }

        public T sampleSize(int sampleSize) {
            this.sampleSize = Optional.of(sampleSize);
            return (T) this;
        }

        /**
         * @param contamination expected fraction of outliers, in (0, 0.5]
         */
        public T contamination(double contamination) {
            this.contamination = Optional.of(contamination);
            return (T) this;
        }

        /**
         * Use the fixed offset {@value IsolationForest#DEFAULT_OFFSET} instead of one
         * derived from a contamination. This is the default.
         */
        public T automaticContamination() {
            this.contamination = Optional.empty();
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        public Random getRandom() {
            // If a random seed was given, use it to create a new Random. Otherwise, call
            // the 0-argument constructor
            return randomSeed.map(Random::new).orElseGet(Random::new);
        }

        /**
         * Grows a forest on a batch of training points. If no dimension was set it is
         * taken from the data. A configured sample size larger than the data is
         * reduced to the number of points.
         *
         * @param data training points, at least two, all with the same number of
         *             finite values
         * @return the trained forest
         */
        public IsolationForest fit(double[][] data) {
            checkNotNull(data, "data must not be null");
            checkArgument(data.length > 1, "at least two training points are required");
            checkNotNull(data[0], "data must not contain null");
            if (dimensions == 0) {
                dimensions = data[0].length;
            }
            checkArgument(dimensions > 0, "dimensions must be greater than 0");
            for (int i = 0; i < data.length; i++) {
                checkNotNull(data[i], "data must not contain null");
                checkArgument(data[i].length == dimensions,
                        String.format("training point %d has %d dimensions, expected %d", i, data[i].length,
                                dimensions));
                for (double value : data[i]) {
                    checkArgument(Double.isFinite(value), String.format("training point %d is not finite", i));
                }
            }
            checkArgument(numberOfTrees > 0, "numberOfTrees must be greater than 0");
            sampleSize.ifPresent(size -> checkArgument(size > 1, "sampleSize must be greater than 1"));
            contamination.ifPresent(IsolationForest::checkContamination);

            int effectiveSampleSize = Math.min(sampleSize.orElse(DEFAULT_MAX_SAMPLE_SIZE), data.length);
            int maxDepth = maxDepth(effectiveSampleSize);
            Random rng = getRandom();
            UniformSampler sampler = new UniformSampler(rng.nextLong());

            List<IsolationTree> trees = new ArrayList<>(numberOfTrees);
            for (int i = 0; i < numberOfTrees; i++) {
                int[] sample = sampler.sample(data.length, effectiveSampleSize);
                trees.add(IsolationTree.grow(data, sample, maxDepth, new Random(rng.nextLong())));
            }

            if (contamination.isEmpty()) {
                return new IsolationForest(this, trees, DEFAULT_OFFSET);
            }

            // the offset depends on the trees, so score the training data with them
            // first
            try (IsolationForest unadjusted = new IsolationForest(this, trees, DEFAULT_OFFSET)) {
                double offset = percentile(unadjusted.scoreSamples(data), 100.0 * contamination.get());
                return new IsolationForest(this, trees, offset);
            }
        }
    }
}
