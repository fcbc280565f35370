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

import static com.amazon.forestcompiler.CommonUtils.checkNotNull;
import static com.amazon.forestcompiler.CommonUtils.validateStructure;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import com.amazon.forestcompiler.UnsupportedShapeException;
import com.amazon.forestcompiler.config.ForestConfig;
import com.amazon.forestcompiler.forest.ForestValidator;
import com.amazon.forestcompiler.leaf.LeafFactory;
import com.amazon.forestcompiler.leaf.LeafPayload;

/**
 * Converts one {@link SourceTree} into a {@link FlatTree}. Leaves are pulled
 * out into their own list, so decision nodes are renumbered: a decision node's
 * position is its rank among the decision nodes in source order, and a leaf's
 * position is the order in which its parent was visited (left child before
 * right child).
 *
 * Instances hold no mutable state and may flatten different trees
 * concurrently.
 */
public class TreeFlattener {

    private final int featureCount;

    private final LeafFactory leafFactory;

    public TreeFlattener(ForestConfig config) {
        checkNotNull(config, "config must not be null");
        this.featureCount = config.getFeatureCount();
        this.leafFactory = LeafFactory.forConfig(config);
    }

    public FlatTree flatten(SourceTree tree) {
        checkNotNull(tree, "tree must not be null");
        int nodeCount = tree.getNodeCount();
        for (int i = 0; i < nodeCount; i++) {
            if (tree.getOutputCount(i) != 1) {
                throw new UnsupportedShapeException(String.format(
                        "node %d has %d outputs, only single-output trees are supported", i, tree.getOutputCount(i)));
            }
        }

        checkTreeShape(tree);

        List<DecisionNode> decisionNodes = new ArrayList<>();
        List<LeafPayload> leaves = new ArrayList<>();
        int[] position = new int[nodeCount];
        Arrays.fill(position, -1);

        NodeRef root;
        if (tree.isLeaf(0)) {
            leaves.add(leafFactory.create(tree.getValues(0)));
            root = NodeRef.leaf(0);
        } else {
            root = NodeRef.internal(0);
        }

        // first pass: internal references still hold source ids
        for (int node = 0; node < nodeCount; node++) {
            if (tree.isLeaf(node)) {
                continue;
            }
            int feature = tree.getFeature(node);
            validateStructure(feature >= 0 && feature < featureCount, String.format(
                    "node %d tests feature %d but the forest has %d features", node, feature, featureCount));
            NodeRef left = classifyChild(tree, tree.getLeftChild(node), leaves);
            NodeRef right = classifyChild(tree, tree.getRightChild(node), leaves);
            position[node] = decisionNodes.size();
            decisionNodes.add(new DecisionNode(feature, tree.getThreshold(node), left, right));
        }

        for (int i = 0; i < decisionNodes.size(); i++) {
            DecisionNode node = decisionNodes.get(i);
            decisionNodes.set(i, node.withChildren(renumber(node.getLeft(), position),
                    renumber(node.getRight(), position)));
        }

        validateStructure(decisionNodes.size() + leaves.size() == nodeCount,
                String.format("flattening produced %d decision nodes and %d leaves from %d source nodes; "
                        + "the source tree has unreachable or shared nodes", decisionNodes.size(), leaves.size(),
                        nodeCount));

        ForestValidator.validate(Collections.singletonList(root), decisionNodes, leaves.size());
        return new FlatTree(root, decisionNodes, leaves);
    }

    /**
     * Every node must be reachable from node 0 along exactly one path: no
     * dangling child ids, no half-leaves, no shared subtrees and no cycles.
     */
    static void checkTreeShape(SourceTree tree) {
        int nodeCount = tree.getNodeCount();
        boolean[] visited = new boolean[nodeCount];
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(0);
        visited[0] = true;
        while (!stack.isEmpty()) {
            int node = stack.pop();
            if (tree.isLeaf(node)) {
                continue;
            }
            for (int child : new int[] { tree.getLeftChild(node), tree.getRightChild(node) }) {
                validateStructure(child != SourceTree.NO_CHILD, "node " + node + " has exactly one child");
                validateStructure(child >= 0 && child < nodeCount,
                        "node " + node + " references child " + child + " outside of the tree");
                validateStructure(!visited[child], "node " + child + " is reachable along more than one path");
                visited[child] = true;
                stack.push(child);
            }
        }
        for (int node = 0; node < nodeCount; node++) {
            validateStructure(visited[node], "node " + node + " is not reachable from the root");
        }
    }

    private NodeRef classifyChild(SourceTree tree, int child, List<LeafPayload> leaves) {
        if (tree.isLeaf(child)) {
            leaves.add(leafFactory.create(tree.getValues(child)));
            return NodeRef.leaf(leaves.size() - 1);
        }
        return NodeRef.internal(child);
    }

    private static NodeRef renumber(NodeRef ref, int[] position) {
        return ref.isLeaf() ? ref : NodeRef.internal(position[ref.getIndex()]);
    }
}
