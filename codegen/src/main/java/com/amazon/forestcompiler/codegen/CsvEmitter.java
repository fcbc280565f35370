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

import static com.amazon.forestcompiler.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import com.amazon.forestcompiler.forest.Forest;
import com.amazon.forestcompiler.tree.DecisionNode;
import com.amazon.forestcompiler.tree.NodeRef;

/**
 * Exports the tree structure as CSV lines separated by {@code \r\n}: one
 * {@code r,<root>} line per tree followed by one
 * {@code n,<feature>,<threshold>,<left>,<right>} line per decision node, with
 * references in their signed encoding. Leaves are not exported.
 * Thresholds are written with {@link Double#toString(double)}, so very small or
 * very large values use the exponent form, e.g. {@code 1.0E-5}.
 */
public class CsvEmitter implements ICodeEmitter {

    public static final String LINE_SEPARATOR = "\r\n";

    public String emit(Forest forest) {
        checkNotNull(forest, "forest must not be null");
        List<String> lines = new ArrayList<>(forest.getTreeCount() + forest.getDecisionNodes().size());
        for (NodeRef root : forest.getRoots()) {
            lines.add("r," + root.encode());
        }
        for (DecisionNode node : forest.getDecisionNodes()) {
            lines.add("n," + node.getFeatureIndex() + "," + Double.toString(node.getThreshold()) + ","
                    + node.getLeft().encode() + "," + node.getRight().encode());
        }
        return String.join(LINE_SEPARATOR, lines);
    }

    /**
     * The CSV carries no symbol names, so {@code name} is ignored.
     */
    @Override
    public String emit(Forest forest, String name) {
        return emit(forest);
    }
}
