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

package com.amazon.forestcompiler.testutils;

/**
 * The raw arrays of a trained tree, laid out the way tree-learning libraries
 * export them: parallel arrays indexed by node id, node 0 is the root, and a
 * child id of -1 means "no child". {@code value} has the shape
 * {@code [nodeCount][outputCount][valueCount]}.
 */
public class TreeArrays {

    public static final int NO_CHILD = -1;

    public final int[] childrenLeft;
    public final int[] childrenRight;
    public final int[] feature;
    public final double[] threshold;
    public final double[][][] value;

    public TreeArrays(int[] childrenLeft, int[] childrenRight, int[] feature, double[] threshold,
            double[][][] value) {
        this.childrenLeft = childrenLeft;
        this.childrenRight = childrenRight;
        this.feature = feature;
        this.threshold = threshold;
        this.value = value;
    }

    public int getNodeCount() {
        return childrenLeft.length;
    }

    /**
     * @return the number of nodes with two children
     */
    public int getDecisionNodeCount() {
        int count = 0;
        for (int i = 0; i < childrenLeft.length; i++) {
            if (childrenLeft[i] != NO_CHILD) {
                count++;
            }
        }
        return count;
    }

    public int getLeafCount() {
        return getNodeCount() - getDecisionNodeCount();
    }
}
