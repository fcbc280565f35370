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

import static com.amazon.forestcompiler.state.Version.V1_0;

import java.io.Serializable;

import lombok.Data;

/**
 * Serializable form of a {@link com.amazon.forestcompiler.forest.Forest}.
 * References are stored in their signed encoding. Int arrays are packed with
 * {@link com.amazon.forestcompiler.util.ArrayPacking} when {@code compressed}
 * is set.
 */
@Data
public class ForestState implements Serializable {

    private static final long serialVersionUID = 1L;

    private String version = V1_0;

    private int featureCount;
    private int classCount;
    private int leafBitWidth;
    private String numericType;
    private String leafMode;
    private int quantizationBits;

    private boolean compressed;
    private int decisionNodeCount;
    private int[] roots;
    private int[] featureIndex;
    private byte[] thresholdData;
    private int[] leftRef;
    private int[] rightRef;

    private int leafCount;
    /**
     * class index per leaf, for majority leaves
     */
    private int[] leafClassIndex;
    /**
     * big-endian doubles, for regression leaves
     */
    private byte[] leafValueData;
    /**
     * probability codes of all leaves, concatenated, for probability leaves
     */
    private int[] leafProbabilityCodes;
    /**
     * number of codes per probability leaf
     */
    private int leafProbabilityWidth;
}
