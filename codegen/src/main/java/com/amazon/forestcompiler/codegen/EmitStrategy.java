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

package com.amazon.forestcompiler.codegen;

import static com.amazon.forestcompiler.CommonUtils.checkConfig;

import java.util.Locale;

import com.amazon.forestcompiler.ConfigException;

/**
 * The ways a compiled forest can be executed on the target.
 */
public enum EmitStrategy {

    /**
     * node, root and leaf tables read by the table-driven runtime
     */
    LOADABLE,
    /**
     * one C function per tree with the thresholds compiled into branches
     */
    INLINE;

    /**
     * @param name strategy name, case-insensitive
     * @return the matching strategy
     * @throws ConfigException if no strategy has the name
     */
    public static EmitStrategy fromName(String name) {
        checkConfig(name != null, "strategy name must not be null");
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (EmitStrategy strategy : values()) {
            if (strategy.name().equals(normalized)) {
                return strategy;
            }
        }
        throw new ConfigException("unknown emit strategy '" + name + "'");
    }
}
