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

/**
 * Converts between a model and a plain state object that can be serialized.
 *
 * @param <Model> the model type
 * @param <State> the state type
 */
public interface IStateMapper<Model, State> {

    /**
     * @param model a model
     * @return a state object capturing everything needed to rebuild the model
     */
    State toState(Model model);

    /**
     * @param state a state object
     * @param seed  seed for any randomness the rebuilt model needs
     * @return the model described by the state
     * @throws IllegalArgumentException if the state is not a valid model
     */
    Model toModel(State state, long seed);

    default Model toModel(State state) {
        return toModel(state, 0L);
    }
}
