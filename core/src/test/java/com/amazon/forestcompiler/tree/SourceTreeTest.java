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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.amazon.forestcompiler.config.ForestConfig;
import com.amazon.forestcompiler.leaf.MajorityClassLeaf;
import com.amazon.forestcompiler.testutils.ExampleTrees;
import com.amazon.forestcompiler.testutils.TreeArrays;

public class SourceTreeTest {

    private static SourceTree of(TreeArrays arrays) {
        return new SourceTree(arrays.childrenLeft, arrays.childrenRight, arrays.feature, arrays.threshold,
                arrays.value);
    }

    @Test
    public void testCallerArraysAreCopied() {
        TreeArrays arrays = ExampleTrees.singleSplitClassifier();
        SourceTree tree = of(arrays);

        arrays.childrenLeft[0] = 2;
        arrays.feature[0] = 1;
        arrays.threshold[0] = 9.5;
        arrays.value[1][0][1] = 100;
        arrays.value[2] = new double[][] { { 100, 0 } };

        assertEquals(1, tree.getLeftChild(0));
        assertEquals(0, tree.getFeature(0));
        assertEquals(0.5, tree.getThreshold(0));
        assertArrayEquals(new double[] { 4, 1 }, tree.getValues(1));

        FlatTree flat = new TreeFlattener(ForestConfig.builder().featureCount(2).classCount(2).build())
                .flatten(tree);
        assertEquals(Arrays.asList(new DecisionNode(0, 0.5, NodeRef.leaf(0), NodeRef.leaf(1))),
                flat.getDecisionNodes());
        assertEquals(Arrays.asList(new MajorityClassLeaf(0), new MajorityClassLeaf(1)), flat.getLeaves());
    }

    @Test
    public void testValuesCannotBeChangedThroughTheGetter() {
        SourceTree tree = of(ExampleTrees.singleSplitClassifier());

        tree.getValues(2)[0] = 100;

        assertArrayEquals(new double[] { 1, 4 }, tree.getValues(2));
    }
}
