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

package com.amazon.forestcompiler.tree;

import static com.amazon.forestcompiler.CommonUtils.checkArgument;
import static com.amazon.forestcompiler.CommonUtils.checkNotNull;

/**
 * A trained tree as handed over by the tree-learning library: parallel arrays
 * indexed by source node id, with node 0 as the root. A child id of
 * {@link #NO_CHILD} means the node has no such child; a node without children
 * is a leaf.
 *
 * The value array has the shape {@code [nodeCount][outputCount][valueCount]}:
 * per-class statistics for classifiers, a single scalar for regressors. Only
 * single-output trees can be flattened.
 */
public class SourceTree {

    public static final int NO_CHILD = -1;

    private final int[] childrenLeft;
    private final int[] childrenRight;
    private final int[] feature;
    private final double[] threshold;
    private final double[][][] value;

    public SourceTree(int[] childrenLeft, int[] childrenRight, int[] feature, double[] threshold, double[][][] value) {
        checkNotNull(childrenLeft, "childrenLeft must not be null");
        checkNotNull(childrenRight, "childrenRight must not be null");
        checkNotNull(feature, "feature must not be null");
        checkNotNull(threshold, "threshold must not be null");
        checkNotNull(value, "value must not be null");
        int nodeCount = childrenLeft.length;
        checkArgument(nodeCount > 0, "a source tree must have at least one node");
        checkArgument(childrenRight.length == nodeCount && feature.length == nodeCount
                && threshold.length == nodeCount && value.length == nodeCount,
                "all array arguments must have the same length");
        this.childrenLeft = childrenLeft.clone();
        this.childrenRight = childrenRight.clone();
        this.feature = feature.clone();
        this.threshold = threshold.clone();
        this.value = copyValues(value);
    }

    private static double[][][] copyValues(double[][][] value) {
        double[][][] copy = new double[value.length][][];
        for (int node = 0; node < value.length; node++) {
            checkNotNull(value[node], "value of node " + node + " must not be null");
            copy[node] = new double[value[node].length][];
            for (int output = 0; output < value[node].length; output++) {
                checkNotNull(value[node][output], "value of node " + node + " must not be null");
                copy[node][output] = value[node][output].clone();
            }
        }
        return copy;
    }

    public int getNodeCount() {
        return childrenLeft.length;
    }

    public int getLeftChild(int node) {
        return childrenLeft[node];
    }

    public int getRightChild(int node) {
        return childrenRight[node];
    }

    public int getFeature(int node) {
        return feature[node];
    }

    public double getThreshold(int node) {
        return threshold[node];
    }

    public boolean isLeaf(int node) {
        return childrenLeft[node] == NO_CHILD && childrenRight[node] == NO_CHILD;
    }

    /**
     * @param node source node id
     * @return the number of output columns of the node
     */
    public int getOutputCount(int node) {
        return value[node].length;
    }

    /**
     * @param node source node id
     * @return a copy of the values of the first (and only supported) output of
     *         the node
     */
    public double[] getValues(int node) {
        return value[node][0].clone();
    }
}
