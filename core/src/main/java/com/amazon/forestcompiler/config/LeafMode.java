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
 * How the value vector of a source leaf is turned into a leaf payload. The mode
 * is chosen once for a whole compilation.
 */
public enum LeafMode {

    /**
     * index of the largest entry of the value vector; ties go to the lowest index
     */
    MAJORITY,
    /**
     * the single scalar of the value vector, for regression
     */
    VALUE,
    /**
     * the normalized value vector, quantized per class into a small number of bits
     */
    PROBABILITIES;

    public boolean isClassification() {
        return this != VALUE;
    }
}
