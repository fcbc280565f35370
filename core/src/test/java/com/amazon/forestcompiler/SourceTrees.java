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

package com.amazon.forestcompiler;

import java.util.ArrayList;
import java.util.List;

import com.amazon.forestcompiler.testutils.TreeArrays;
import com.amazon.forestcompiler.tree.SourceTree;

/**
 * Converts shared fixtures into source trees.
 */
public class SourceTrees {

    private SourceTrees() {
    }

    public static SourceTree of(TreeArrays arrays) {
        return new SourceTree(arrays.childrenLeft, arrays.childrenRight, arrays.feature, arrays.threshold,
                arrays.value);
    }

    public static List<SourceTree> of(List<TreeArrays> arrays) {
        List<SourceTree> trees = new ArrayList<>(arrays.size());
        for (TreeArrays tree : arrays) {
            trees.add(of(tree));
        }
        return trees;
    }
}
