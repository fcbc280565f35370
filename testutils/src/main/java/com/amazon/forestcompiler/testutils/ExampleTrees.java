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

import static com.amazon.forestcompiler.testutils.TreeArrays.NO_CHILD;

import java.util.Arrays;

/**
 * Small hand-written trees with known flattened forms.
 */
public class ExampleTrees {

    private ExampleTrees() {
    }

    /**
     * One decision node on feature 0 at 0.5; the left leaf votes for class 0 and
     * the right leaf for class 1.
     */
    public static TreeArrays singleSplitClassifier() {
        return new TreeArrays(new int[] { 1, NO_CHILD, NO_CHILD }, new int[] { 2, NO_CHILD, NO_CHILD },
                new int[] { 0, -2, -2 }, new double[] { 0.5, -2.0, -2.0 },
                new double[][][] { { { 5, 5 } }, { { 4, 1 } }, { { 1, 4 } } });
    }

    public static TreeArrays regressionStump(int feature, double threshold, double left, double right) {
        return new TreeArrays(new int[] { 1, NO_CHILD, NO_CHILD }, new int[] { 2, NO_CHILD, NO_CHILD },
                new int[] { feature, -2, -2 }, new double[] { threshold, -2.0, -2.0 },
                new double[][][] { { { (left + right) / 2 } }, { { left } }, { { right } } });
    }

    /**
     * A tree that is a single leaf holding the given value vector.
     */
    public static TreeArrays singleLeaf(double... values) {
        return new TreeArrays(new int[] { NO_CHILD }, new int[] { NO_CHILD }, new int[] { -2 },
                new double[] { -2.0 }, new double[][][] { { values } });
    }

    /**
     * Three-class tree of depth two whose node ids are not in depth-first order:
     *
     * <pre>
     *            0: f1 &lt; 2.5
     *          /              \
     *   3: f0 &lt; 0.25       1: class 2
     *     /      \
     * 2: class 0  4: class 1
     * </pre>
     */
    public static TreeArrays unorderedThreeClass() {
        return new TreeArrays(new int[] { 3, NO_CHILD, NO_CHILD, 2, NO_CHILD },
                new int[] { 1, NO_CHILD, NO_CHILD, 4, NO_CHILD }, new int[] { 1, -2, -2, 0, -2 },
                new double[] { 2.5, -2.0, -2.0, 0.25, -2.0 }, new double[][][] { { { 3, 3, 3 } },
                        { { 0, 0, 3 } }, { { 3, 0, 0 } }, { { 0, 3, 3 } }, { { 0, 3, 0 } } });
    }

    /**
     * A chain of decision nodes where every left child is a leaf and every right
     * child but the last is the next decision node. Leaves alternate between
     * class 0 and class 1.
     *
     * @param decisionNodeCount number of decision nodes, at least 1
     * @return a tree with {@code 2 * decisionNodeCount + 1} nodes
     */
    public static TreeArrays chain(int decisionNodeCount) {
        if (decisionNodeCount < 1) {
            throw new IllegalArgumentException("decisionNodeCount must be at least 1");
        }
        int nodeCount = 2 * decisionNodeCount + 1;
        int[] left = new int[nodeCount];
        int[] right = new int[nodeCount];
        int[] feature = new int[nodeCount];
        double[] threshold = new double[nodeCount];
        double[][][] value = new double[nodeCount][][];
        for (int i = 0; i < decisionNodeCount; i++) {
            int id = 2 * i;
            left[id] = id + 1;
            right[id] = id + 2;
            feature[id] = i % 4;
            threshold[id] = i + 0.5;
            value[id] = new double[][] { { 1, 1 } };

            left[id + 1] = right[id + 1] = NO_CHILD;
            feature[id + 1] = -2;
            threshold[id + 1] = -2.0;
            value[id + 1] = classVotes(i % 2);
        }
        left[nodeCount - 1] = right[nodeCount - 1] = NO_CHILD;
        feature[nodeCount - 1] = -2;
        threshold[nodeCount - 1] = -2.0;
        value[nodeCount - 1] = classVotes(decisionNodeCount % 2);
        return new TreeArrays(left, right, feature, threshold, value);
    }

    /**
     * The single-split classifier with a second output column on every node.
     */
    public static TreeArrays multiOutput() {
        return new TreeArrays(new int[] { 1, NO_CHILD, NO_CHILD }, new int[] { 2, NO_CHILD, NO_CHILD },
                new int[] { 0, -2, -2 }, new double[] { 0.5, -2.0, -2.0 },
                new double[][][] { { { 5, 5 }, { 5, 5 } }, { { 4, 1 }, { 1, 4 } }, { { 1, 4 }, { 4, 1 } } });
    }

    /**
     * Copies a tree, appending zero entries to every value vector until it has
     * {@code classCount} entries. Majority classes are unchanged.
     */
    public static TreeArrays withClassCount(TreeArrays tree, int classCount) {
        double[][][] value = new double[tree.value.length][][];
        for (int node = 0; node < value.length; node++) {
            double[] values = tree.value[node][0];
            if (values.length > classCount) {
                throw new IllegalArgumentException("node " + node + " already has " + values.length + " values");
            }
            value[node] = new double[][] { Arrays.copyOf(values, classCount) };
        }
        return new TreeArrays(tree.childrenLeft.clone(), tree.childrenRight.clone(), tree.feature.clone(),
                tree.threshold.clone(), value);
    }

    private static double[][] classVotes(int winner) {
        return winner == 0 ? new double[][] { { 2, 1 } } : new double[][] { { 1, 2 } };
    }
}
