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

package com.amazon.forestcompiler.serialize;

import static com.amazon.forestcompiler.CommonUtils.checkNotNull;

import lombok.Getter;

import com.amazon.forestcompiler.forest.Forest;
import com.amazon.forestcompiler.state.ForestMapper;
import com.amazon.forestcompiler.state.ForestState;
import com.google.gson.Gson;

/**
 * {@link Forest} serialization. Internally we use the {@link ForestMapper}
 * class to convert a forest into a corresponding state object, and we use
 * <a href="https://github.com/google/gson">Gson</a> to write the state object
 * as a JSON string. The Gson instance is exposed so users can customize the
 * output (e.g., by enabling pretty printing).
 */
@Getter
public class ForestSerDe {

    private final ForestMapper mapper;
    private final Gson gson;

    public ForestSerDe() {
        this(new ForestMapper(), new Gson());
    }

    /**
     * @param mapper converts a forest to and from its state object
     * @param gson   writes and reads {@link ForestState} objects
     */
    public ForestSerDe(ForestMapper mapper, Gson gson) {
        this.mapper = checkNotNull(mapper, "mapper must not be null");
        this.gson = checkNotNull(gson, "gson must not be null");
    }

    /**
     * @param forest a compiled forest
     * @return a json string serialized from the forest
     */
    public String toJson(Forest forest) {
        return gson.toJson(mapper.toState(forest));
    }

    /**
     * @param json a json string created by {@link #toJson(Forest)}
     * @return the validated forest
     */
    public Forest fromJson(String json) {
        checkNotNull(json, "json must not be null");
        ForestState state = gson.fromJson(json, ForestState.class);
        checkNotNull(state, "json does not hold a forest");
        return mapper.toModel(state);
    }
}
