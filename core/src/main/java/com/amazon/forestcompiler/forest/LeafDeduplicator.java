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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.forestcompiler.leaf.LeafPayload;
import com.amazon.forestcompiler.tree.DecisionNode;
import com.amazon.forestcompiler.tree.NodeRef;

/**
 * Collapses leaves with equal payloads into one. Distinct payloads keep the
 * order in which they are first seen, and every leaf reference is rewritten to
 * the surviving copy. Running the deduplicator on its own output returns an
 * equal forest.
 */
public class LeafDeduplicator {

    private static final Logger LOG = LoggerFactory.getLogger(LeafDeduplicator.class);

    public Forest deduplicate(Forest forest) {
        checkNotNull(forest, "forest must not be null");
        List<LeafPayload> leaves = forest.getLeaves();

        Map<LeafPayload, Integer> unique = new LinkedHashMap<>();
        int[] remap = new int[leaves.size()];
        for (int i = 0; i < leaves.size(); i++) {
            Integer existing = unique.get(leaves.get(i));
            if (existing == null) {
                existing = unique.size();
                unique.put(leaves.get(i), existing);
            }
            remap[i] = existing;
        }

        List<DecisionNode> decisionNodes = new ArrayList<>(forest.getDecisionNodes().size());
        for (DecisionNode node : forest.getDecisionNodes()) {
            decisionNodes.add(node.withChildren(remap(node.getLeft(), remap), remap(node.getRight(), remap)));
        }
        List<NodeRef> roots = new ArrayList<>(forest.getRoots().size());
        for (NodeRef root : forest.getRoots()) {
            roots.add(remap(root, remap));
        }

        Forest result = new Forest(roots, decisionNodes, new ArrayList<>(unique.keySet()), forest.getConfig());
        ForestValidator.validate(result);
        LOG.info("deduplicated {} leaves to {}, wasted leaf ratio {}", leaves.size(), unique.size(),
                wastedLeafRatio(forest, result));
        return result;
    }

    /**
     * The number of leaves removed per decision node. Informational only.
     *
     * @param original     forest before deduplication
     * @param deduplicated forest after deduplication
     * @return {@code (originalLeaves - uniqueLeaves) / decisionNodes}, or 0 when
     *         there are no decision nodes
     */
    public static double wastedLeafRatio(Forest original, Forest deduplicated) {
        int decisionNodeCount = original.getDecisionNodes().size();
        if (decisionNodeCount == 0) {
            return 0;
        }
        return (double) (original.getLeaves().size() - deduplicated.getLeaves().size()) / decisionNodeCount;
    }

    private static NodeRef remap(NodeRef ref, int[] remap) {
        return ref.isLeaf() ? NodeRef.leaf(remap[ref.getIndex()]) : ref;
    }
}
