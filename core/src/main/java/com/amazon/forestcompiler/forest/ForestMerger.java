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

package com.amazon.forestcompiler.forest;

import static com.amazon.forestcompiler.CommonUtils.checkNotNull;
import static com.amazon.forestcompiler.CommonUtils.validateStructure;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.forestcompiler.CapacityException;
import com.amazon.forestcompiler.ValidationException;
import com.amazon.forestcompiler.config.ForestConfig;
import com.amazon.forestcompiler.leaf.LeafPayload;
import com.amazon.forestcompiler.tree.DecisionNode;
import com.amazon.forestcompiler.tree.FlatTree;
import com.amazon.forestcompiler.tree.NodeRef;

/**
 * Concatenates flattened trees into a single {@link Forest}. Each tree's
 * decision nodes and leaves are appended to the shared lists and every
 * reference inside the appended nodes is moved by the number of decision nodes
 * and leaves already stored. The partial forest is validated after each tree so
 * that a failure names the tree that caused it.
 */
public class ForestMerger {

    private static final Logger LOG = LoggerFactory.getLogger(ForestMerger.class);

    public Forest merge(List<FlatTree> trees, ForestConfig config) {
        checkNotNull(trees, "trees must not be null");
        checkNotNull(config, "config must not be null");
        validateStructure(!trees.isEmpty(), "a forest needs at least one tree");

        List<NodeRef> roots = new ArrayList<>(trees.size());
        List<DecisionNode> decisionNodes = new ArrayList<>();
        List<LeafPayload> leaves = new ArrayList<>();

        for (int treeIndex = 0; treeIndex < trees.size(); treeIndex++) {
            FlatTree tree = checkNotNull(trees.get(treeIndex), "tree " + treeIndex + " must not be null");
            int nodeOffset = decisionNodes.size();
            int leafOffset = leaves.size();

            int total = nodeOffset + tree.getDecisionNodes().size();
            if (total > ForestValidator.MAX_DECISION_NODES) {
                throw new CapacityException("decision node count after merging tree " + treeIndex, total,
                        ForestValidator.MAX_DECISION_NODES);
            }

            for (DecisionNode node : tree.getDecisionNodes()) {
                decisionNodes.add(node.shift(nodeOffset, leafOffset));
            }
            leaves.addAll(tree.getLeaves());
            roots.add(tree.getRoot().shift(nodeOffset, leafOffset));

            try {
                ForestValidator.validate(roots, decisionNodes, leaves.size());
                ForestValidator.checkConsistency(config, tree.getDecisionNodes(), tree.getLeaves());
            } catch (ValidationException e) {
                throw new ValidationException(e.getMessage(), treeIndex);
            }
            LOG.debug("merged tree {}: {} decision nodes at offset {}, {} leaves at offset {}", treeIndex,
                    tree.getDecisionNodes().size(), nodeOffset, tree.getLeaves().size(), leafOffset);
        }

        Forest forest = new Forest(roots, decisionNodes, leaves, config);
        ForestValidator.validate(forest);
        LOG.debug("merged {} trees into {} decision nodes and {} leaves", roots.size(), decisionNodes.size(),
                leaves.size());
        return forest;
    }
}
