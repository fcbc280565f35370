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

import java.util.List;

import com.amazon.forestcompiler.CapacityException;
import com.amazon.forestcompiler.ValidationException;
import com.amazon.forestcompiler.config.ForestConfig;
import com.amazon.forestcompiler.config.LeafMode;
import com.amazon.forestcompiler.leaf.ILeafVisitor;
import com.amazon.forestcompiler.leaf.LeafPayload;
import com.amazon.forestcompiler.leaf.MajorityClassLeaf;
import com.amazon.forestcompiler.leaf.QuantizedProbabilitiesLeaf;
import com.amazon.forestcompiler.leaf.RegressionValueLeaf;
import com.amazon.forestcompiler.tree.DecisionNode;
import com.amazon.forestcompiler.tree.NodeRef;

/**
 * Checks the reference invariants of a flattened tree or forest:
 * <ol>
 * <li>every internal reference names an existing decision node,</li>
 * <li>every leaf reference names an existing leaf,</li>
 * <li>every decision node is a root or is referenced by another decision node,
 * and every leaf is referenced by a decision node or (for a tree that is a
 * single leaf) by a root,</li>
 * <li>there are at most {@link #MAX_DECISION_NODES} decision nodes.</li>
 * </ol>
 * A complete {@link Forest} is also checked against its configuration: every
 * feature index is below the feature count, and every leaf has the configured
 * kind and fits the configured class count.
 * The pipeline runs the validator after every structural change.
 */
public class ForestValidator {

    /**
     * Child references are stored as signed 16-bit values in the generated table.
     */
    public static final int MAX_DECISION_NODES = 1 << 15;

    private ForestValidator() {
    }

    public static void validate(Forest forest) {
        checkNotNull(forest, "forest must not be null");
        validate(forest.getRoots(), forest.getDecisionNodes(), forest.getLeaves().size());
        checkConsistency(forest.getConfig(), forest.getDecisionNodes(), forest.getLeaves());
    }

    public static void checkConsistency(ForestConfig config, List<DecisionNode> decisionNodes,
            List<LeafPayload> leaves) {
        checkNotNull(config, "config must not be null");
        int featureCount = config.getFeatureCount();
        for (int i = 0; i < decisionNodes.size(); i++) {
            int feature = decisionNodes.get(i).getFeatureIndex();
            if (feature < 0 || feature >= featureCount) {
                throw new ValidationException(String.format(
                        "decision node %d tests feature %d but the forest has %d features", i, feature,
                        featureCount));
            }
        }
        LeafCheck leafCheck = new LeafCheck(config);
        for (int i = 0; i < leaves.size(); i++) {
            String problem = leaves.get(i).accept(leafCheck);
            if (problem != null) {
                throw new ValidationException("leaf " + i + " " + problem);
            }
        }
    }

    public static void validate(List<NodeRef> roots, List<DecisionNode> decisionNodes, int leafCount) {
        checkNotNull(roots, "roots must not be null");
        checkNotNull(decisionNodes, "decisionNodes must not be null");
        checkCapacity(decisionNodes.size());

        int nodeCount = decisionNodes.size();
        boolean[] nodeReached = new boolean[nodeCount];
        boolean[] leafReached = new boolean[leafCount];

        for (int i = 0; i < roots.size(); i++) {
            mark(roots.get(i), "root " + i, nodeReached, leafReached);
        }
        for (int i = 0; i < nodeCount; i++) {
            DecisionNode node = decisionNodes.get(i);
            mark(node.getLeft(), "left child of decision node " + i, nodeReached, leafReached);
            mark(node.getRight(), "right child of decision node " + i, nodeReached, leafReached);
        }

        for (int i = 0; i < nodeCount; i++) {
            if (!nodeReached[i]) {
                throw new ValidationException("decision node " + i + " is neither a root nor referenced");
            }
        }
        for (int i = 0; i < leafCount; i++) {
            if (!leafReached[i]) {
                throw new ValidationException("leaf " + i + " is not referenced");
            }
        }
    }

    public static void checkCapacity(int decisionNodeCount) {
        if (decisionNodeCount > MAX_DECISION_NODES) {
            throw new CapacityException("decision node count", decisionNodeCount, MAX_DECISION_NODES);
        }
    }

    /**
     * Returns a description of what is wrong with a leaf, or null.
     */
    private static class LeafCheck implements ILeafVisitor<String> {

        private final LeafMode leafMode;
        private final int classCount;

        LeafCheck(ForestConfig config) {
            this.leafMode = config.getLeafMode();
            this.classCount = config.getClassCount();
        }

        @Override
        public String visitMajorityClass(MajorityClassLeaf leaf) {
            if (leafMode != LeafMode.MAJORITY) {
                return "is a majority class leaf in a forest with " + leafMode + " leaves";
            }
            if (leaf.getClassIndex() >= classCount) {
                return "votes for class " + leaf.getClassIndex() + " but the forest has " + classCount + " classes";
            }
            return null;
        }

        @Override
        public String visitRegressionValue(RegressionValueLeaf leaf) {
            return leafMode == LeafMode.VALUE ? null
                    : "is a regression leaf in a forest with " + leafMode + " leaves";
        }

        @Override
        public String visitQuantizedProbabilities(QuantizedProbabilitiesLeaf leaf) {
            if (leafMode != LeafMode.PROBABILITIES) {
                return "is a probability leaf in a forest with " + leafMode + " leaves";
            }
            if (leaf.getClassCount() != classCount) {
                return "holds " + leaf.getClassCount() + " probabilities but the forest has " + classCount
                        + " classes";
            }
            return null;
        }
    }

    private static void mark(NodeRef ref, String owner, boolean[] nodeReached, boolean[] leafReached) {
        boolean[] reached = ref.isLeaf() ? leafReached : nodeReached;
        if (ref.getIndex() >= reached.length) {
            throw new ValidationException(String.format("%s references %s but there are only %d %s", owner, ref,
                    reached.length, ref.isLeaf() ? "leaves" : "decision nodes"));
        }
        reached[ref.getIndex()] = true;
    }
}
