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

package com.amazon.forestcompiler.state;

/**
 * A mapper converts a model object to and from a state object. The state
 * object holds only plain values and arrays so it can be written by any
 * serialization library.
 *
 * @param <Model> the model type
 * @param <State> the state type
 */
public interface IStateMapper<Model, State> {

    /**
     * @param model a model object
     * @return a state object holding everything needed to rebuild the model
     */
    State toState(Model model);

    /**
     * @param state a state object created by {@link #toState(Object)}
     * @return the rebuilt model
     */
    Model toModel(State state);
}
