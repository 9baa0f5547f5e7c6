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

package com.aiot.powermonitor.state.tree;

import static com.aiot.powermonitor.CommonUtils.checkArgument;
import static com.aiot.powermonitor.CommonUtils.checkNotNull;

import lombok.Getter;
import lombok.Setter;

import com.aiot.powermonitor.state.IStateMapper;
import com.aiot.powermonitor.store.NodeStore;
import com.aiot.powermonitor.tree.IsolationTree;

/**
 * Maps a tree to its node arrays and back. Trees carry no randomness once
 * grown, so the seed is ignored.
 */
@Getter
@Setter
public class IsolationTreeMapper implements IStateMapper<IsolationTree, IsolationTreeState> {

    /**
     * Dimensions of the points the restored tree will split. Must be set before
     * calling {@link #toModel}.
     */
    private int dimensions;

    @Override
    public IsolationTreeState toState(IsolationTree tree) {
        NodeStore store = tree.getNodeStore();
        IsolationTreeState state = new IsolationTreeState();
        state.setLeftIndex(store.getLeftIndex());
        state.setRightIndex(store.getRightIndex());
        state.setCutDimension(store.getCutDimension());
        state.setCutValue(store.getCutValue());
        state.setMass(store.getMass());
        return state;
    }

    @Override
    public IsolationTree toModel(IsolationTreeState state, long seed) {
        checkNotNull(state, "tree state must not be null");
        checkArgument(dimensions > 0, "dimensions must be set before restoring a tree");
        checkArgument(state.getLeftIndex() != null && state.getRightIndex() != null
                && state.getCutDimension() != null && state.getCutValue() != null && state.getMass() != null,
                "tree state is incomplete");
        NodeStore store = new NodeStore(state.getLeftIndex(), state.getRightIndex(), state.getCutDimension(),
                state.getCutValue(), state.getMass());
        return new IsolationTree(store, dimensions);
    }
}
