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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.amazon.forestcompiler.ForestCompiler;
import com.amazon.forestcompiler.forest.Forest;
import com.amazon.forestcompiler.testutils.TreeArrays;
import com.amazon.forestcompiler.tree.SourceTree;

/**
 * Compiles shared fixtures into forests.
 */
public class Forests {

    private Forests() {
    }

    public static Forest compile(ForestCompiler compiler, TreeArrays... trees) {
        return compile(compiler, Arrays.asList(trees));
    }

    public static Forest compile(ForestCompiler compiler, List<TreeArrays> trees) {
        List<SourceTree> sourceTrees = new ArrayList<>(trees.size());
        for (TreeArrays tree : trees) {
            sourceTrees.add(new SourceTree(tree.childrenLeft, tree.childrenRight, tree.feature, tree.threshold,
                    tree.value));
        }
        return compiler.compile(sourceTrees);
    }
}
