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

package com.aiot.powermonitor.state;

import static com.aiot.powermonitor.CommonUtils.checkArgument;
import static com.aiot.powermonitor.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;
import lombok.Setter;

import com.aiot.powermonitor.IsolationForest;
import com.aiot.powermonitor.inputtypes.FeatureMatrix;
import com.aiot.powermonitor.state.tree.IsolationTreeMapper;
import com.aiot.powermonitor.state.tree.IsolationTreeState;
import com.aiot.powermonitor.tree.IsolationTree;

/**
 * A utility class for creating a {@link IsolationForestState} instance from a
 * {@link IsolationForest} instance and vice versa.
 *
 * Restoring checks the state thoroughly, since it usually comes from a file:
 * an unsupported version, inconsistent counts, malformed tree arrays or cuts on
 * dimensions the forest does not have are all rejected with an
 * {@link IllegalArgumentException}.
 */
@Getter
@Setter
public class IsolationForestMapper implements IStateMapper<IsolationForest, IsolationForestState> {

    /**
     * Execution settings of restored forests. These describe the process that
     * loads a model, not the model, and are therefore not part of the state.
     */
    private boolean parallelExecutionEnabled = IsolationForest.DEFAULT_PARALLEL_EXECUTION_ENABLED;

    private int threadPoolSize = 0;

    /**
     * Names of the features, recorded in the state for operators. Defaults to the
     * single power column.
     */
    private List<String> featureNames = Collections.singletonList(FeatureMatrix.POWER_COLUMN);

    @Override
    public IsolationForestState toState(IsolationForest forest) {
        checkNotNull(forest, "forest must not be null");
        IsolationForestState state = new IsolationForestState();
        state.setVersion(Version.CURRENT);
        state.setDimensions(forest.getDimensions());
        state.setNumberOfTrees(forest.getNumberOfTrees());
        state.setSampleSize(forest.getSampleSize());
        state.setAutomaticContamination(forest.getContamination().isEmpty());
        state.setContamination(forest.getContamination().orElse(0.0));
        state.setOffset(forest.getOffset());
        if (featureNames != null && featureNames.size() == forest.getDimensions()) {
            state.setFeatureNames(new ArrayList<>(featureNames));
        }

        IsolationTreeMapper treeMapper = new IsolationTreeMapper();
        List<IsolationTreeState> treeStates = new ArrayList<>(forest.getNumberOfTrees());
        for (IsolationTree tree : forest.getTrees()) {
            treeStates.add(treeMapper.toState(tree));
        }
        state.setTreeStates(treeStates);
        return state;
    }

    @Override
    public IsolationForest toModel(IsolationForestState state, long seed) {
        checkNotNull(state, "state must not be null");
        checkArgument(Version.V1_0.equals(state.getVersion()), "unsupported model version " + state.getVersion());
        checkArgument(state.getDimensions() > 0, "dimensions must be greater than 0");
        checkArgument(state.getTreeStates() != null && !state.getTreeStates().isEmpty(),
                "the model contains no trees");
        checkArgument(state.getTreeStates().size() == state.getNumberOfTrees(), String.format(
                "the model declares %d trees but contains %d", state.getNumberOfTrees(), state.getTreeStates().size()));
        checkArgument(state.getFeatureNames() == null || state.getFeatureNames().size() == state.getDimensions(),
                "feature names do not match the dimensions");

        IsolationTreeMapper treeMapper = new IsolationTreeMapper();
        treeMapper.setDimensions(state.getDimensions());
        List<IsolationTree> trees = new ArrayList<>(state.getNumberOfTrees());
        for (IsolationTreeState treeState : state.getTreeStates()) {
            trees.add(treeMapper.toModel(treeState, seed));
        }

        IsolationForest.Builder<?> builder = IsolationForest.builder().dimensions(state.getDimensions())
                .randomSeed(seed).parallelExecutionEnabled(parallelExecutionEnabled);
        if (!state.isAutomaticContamination()) {
            builder.contamination(state.getContamination());
        }
        if (threadPoolSize > 0) {
            builder.threadPoolSize(threadPoolSize);
        }

        IsolationForest forest = new IsolationForest(builder, trees, state.getOffset());
        if (forest.getSampleSize() != state.getSampleSize()) {
            forest.close();
            throw new IllegalArgumentException(String.format("the model declares a sample size of %d but its trees "
                    + "were grown on %d points", state.getSampleSize(), forest.getSampleSize()));
        }
        return forest;
    }
}
