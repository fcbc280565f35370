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

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Generates random full binary trees for tests and benchmarks. Node ids other
 * than the root are shuffled, so the ids do not follow any traversal order.
 */
public class RandomTreeGenerator {

    private final Random rng;
    private final int featureCount;
    private final int classCount;
    private final double splitProbability;

    /**
     * @param seed             random seed
     * @param featureCount     number of features, split features are drawn from
     *                         {@code [0, featureCount)}
     * @param classCount       number of classes, or 0 for regression trees with
     *                         one value per node
     * @param splitProbability probability that a node below the maximum depth
     *                         is split
     */
    public RandomTreeGenerator(long seed, int featureCount, int classCount, double splitProbability) {
        this.rng = new Random(seed);
        this.featureCount = featureCount;
        this.classCount = classCount;
        this.splitProbability = splitProbability;
    }

    public RandomTreeGenerator(long seed, int featureCount, int classCount) {
        this(seed, featureCount, classCount, 0.8);
    }

    public TreeArrays generate(int maxDepth) {
        List<int[]> children = new ArrayList<>();
        List<Integer> depth = new ArrayList<>();
        children.add(new int[] { NO_CHILD, NO_CHILD });
        depth.add(0);
        for (int node = 0; node < children.size(); node++) {
            boolean split = depth.get(node) < maxDepth && (node == 0 || rng.nextDouble() < splitProbability);
            if (split) {
                int left = children.size();
                children.add(new int[] { NO_CHILD, NO_CHILD });
                depth.add(depth.get(node) + 1);
                children.add(new int[] { NO_CHILD, NO_CHILD });
                depth.add(depth.get(node) + 1);
                children.get(node)[0] = left;
                children.get(node)[1] = left + 1;
            }
        }

        int nodeCount = children.size();
        int[] id = new int[nodeCount];
        for (int i = 0; i < nodeCount; i++) {
            id[i] = i;
        }
        for (int i = nodeCount - 1; i > 1; i--) {
            int j = 1 + rng.nextInt(i);
            int swap = id[i];
            id[i] = id[j];
            id[j] = swap;
        }

        int[] left = new int[nodeCount];
        int[] right = new int[nodeCount];
        int[] feature = new int[nodeCount];
        double[] threshold = new double[nodeCount];
        double[][][] value = new double[nodeCount][][];
        for (int node = 0; node < nodeCount; node++) {
            int target = id[node];
            int[] pair = children.get(node);
            if (pair[0] == NO_CHILD) {
                left[target] = right[target] = NO_CHILD;
                feature[target] = -2;
                threshold[target] = -2.0;
            } else {
                left[target] = id[pair[0]];
                right[target] = id[pair[1]];
                feature[target] = rng.nextInt(featureCount);
                threshold[target] = Math.round(rng.nextGaussian() * 1000) / 100.0;
            }
            value[target] = new double[][] { randomValues() };
        }
        return new TreeArrays(left, right, feature, threshold, value);
    }

    public List<TreeArrays> generateForest(int treeCount, int maxDepth) {
        List<TreeArrays> trees = new ArrayList<>(treeCount);
        for (int i = 0; i < treeCount; i++) {
            trees.add(generate(maxDepth));
        }
        return trees;
    }

    private double[] randomValues() {
        if (classCount == 0) {
            return new double[] { Math.round(rng.nextDouble() * 100) / 10.0 };
        }
        double[] counts = new double[classCount];
        for (int i = 0; i < classCount; i++) {
            counts[i] = rng.nextInt(5);
        }
        return counts;
    }
}
