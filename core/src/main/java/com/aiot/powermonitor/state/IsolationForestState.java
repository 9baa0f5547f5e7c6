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

import static com.aiot.powermonitor.state.Version.V1_0;

import java.util.List;

import lombok.Data;

import com.aiot.powermonitor.state.tree.IsolationTreeState;

/**
 * A class that encapsulates the data of a trained IsolationForest such that the
 * forest can be serialized and deserialized.
 */
@Data
public class IsolationForestState {

    private String version = V1_0;

    private int dimensions;

    private int numberOfTrees;

    private int sampleSize;

    private boolean automaticContamination;

    private double contamination;

    private double offset;

    private List<String> featureNames;

    private List<IsolationTreeState> treeStates;

}
