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

import java.util.List;

import com.amazon.forestcompiler.CapacityException;
import com.amazon.forestcompiler.config.ForestConfig;
import com.amazon.forestcompiler.forest.Forest;
import com.amazon.forestcompiler.leaf.LeafSerializer;
import com.amazon.forestcompiler.tree.DecisionNode;
import com.amazon.forestcompiler.tree.NodeRef;

/**
 * Emits the forest as three static tables (decision nodes, tree roots and
 * leaf bytes) plus an {@code EmlTrees} descriptor for the table-driven
 * runtime. Child references use the signed encoding and are stored as 16-bit
 * values.
 */
public class LoadableEmitter implements ICodeEmitter {

    public static final String HEADER = "// This file is generated by forestcompiler. Do not edit.";

    public static final String RUNTIME_INCLUDE = "#include <eml_trees.h>";

    static final int MAX_CHILD_INDEX = Short.MAX_VALUE;

    @Override
    public String emit(Forest forest, String name) {
        checkNotNull(forest, "forest must not be null");
        CLiterals.checkIdentifier(name);
        ForestConfig config = forest.getConfig();
        List<DecisionNode> nodes = forest.getDecisionNodes();
        byte[] leafBytes = LeafSerializer.serialize(forest.getLeaves(), config.getLeafBitWidth());

        String nodesName = name + "_nodes";
        String rootsName = name + "_tree_roots";
        String leavesName = name + "_leaves";

        CodeWriter writer = new CodeWriter();
        writer.line(HEADER).blankLine().line(RUNTIME_INCLUDE).blankLine();

        if (!nodes.isEmpty()) {
            writer.open("EmlTreesNode " + nodesName + "[" + nodes.size() + "] = {");
            for (int i = 0; i < nodes.size(); i++) {
                DecisionNode node = nodes.get(i);
                writer.line(String.format("{ %d, %s, %d, %d }%s", node.getFeatureIndex(),
                        CLiterals.threshold(node.getThreshold(), config.getNumericType()),
                        childValue(node.getLeft(), i), childValue(node.getRight(), i),
                        i < nodes.size() - 1 ? "," : ""));
            }
            writer.close("};").blankLine();
        }

        StringBuilder roots = new StringBuilder();
        for (NodeRef root : forest.getRoots()) {
            roots.append(roots.length() == 0 ? "" : ", ").append(root.encode());
        }
        writer.line("int32_t " + rootsName + "[" + forest.getTreeCount() + "] = { " + roots + " };").blankLine();

        StringBuilder leaves = new StringBuilder();
        for (byte leafByte : leafBytes) {
            leaves.append(leaves.length() == 0 ? "" : ", ").append(leafByte & 0xFF);
        }
        writer.line("static const uint8_t " + leavesName + "[" + leafBytes.length + "] = { " + leaves + " };")
                .blankLine();

        writer.open("EmlTrees " + name + " = {");
        writer.line(String.format("%d, %s, %d, %s, %d, %s, %d, %d, %d,", nodes.size(),
                nodes.isEmpty() ? "NULL" : nodesName, forest.getTreeCount(), rootsName, leafBytes.length,
                leavesName, config.getLeafBitWidth(), config.getFeatureCount(), config.getClassCount()));
        writer.close("};");
        return writer.toString();
    }

    static int childValue(NodeRef ref, int nodeIndex) {
        if (ref.getIndex() > MAX_CHILD_INDEX) {
            throw new CapacityException((ref.isLeaf() ? "leaf" : "decision node") + " index referenced by node "
                    + nodeIndex, ref.getIndex(), MAX_CHILD_INDEX);
        }
        return ref.encode();
    }
}
