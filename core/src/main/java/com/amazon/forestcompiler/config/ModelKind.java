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

package com.amazon.forestcompiler.config;

/**
 * The kind of estimator the source trees came from. It determines the default
 * leaf construction and the default leaf bit width.
 */
public enum ModelKind {

    CLASSIFIER(LeafMode.MAJORITY, 0),

    REGRESSOR(LeafMode.VALUE, 32);

    private final LeafMode defaultLeafMode;
    private final int defaultLeafBitWidth;

    ModelKind(LeafMode defaultLeafMode, int defaultLeafBitWidth) {
        this.defaultLeafMode = defaultLeafMode;
        this.defaultLeafBitWidth = defaultLeafBitWidth;
    }

    public LeafMode getDefaultLeafMode() {
        return defaultLeafMode;
    }

    public int getDefaultLeafBitWidth() {
        return defaultLeafBitWidth;
    }
}
