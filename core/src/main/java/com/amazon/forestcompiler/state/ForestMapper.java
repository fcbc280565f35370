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

package com.amazon.forestcompiler.state;

import static com.amazon.forestcompiler.CommonUtils.checkArgument;
import static com.amazon.forestcompiler.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.Setter;

import com.amazon.forestcompiler.config.ForestConfig;
import com.amazon.forestcompiler.config.LeafMode;
import com.amazon.forestcompiler.config.NumericType;
import com.amazon.forestcompiler.forest.Forest;
import com.amazon.forestcompiler.forest.ForestValidator;
import com.amazon.forestcompiler.leaf.LeafPayload;
import com.amazon.forestcompiler.leaf.MajorityClassLeaf;
import com.amazon.forestcompiler.leaf.QuantizedProbabilitiesLeaf;
import com.amazon.forestcompiler.leaf.RegressionValueLeaf;
import com.amazon.forestcompiler.tree.DecisionNode;
import com.amazon.forestcompiler.tree.NodeRef;
import com.amazon.forestcompiler.util.ArrayPacking;

@Getter
@Setter
public class ForestMapper implements IStateMapper<Forest, ForestState> {

    /**
     * If true, then the int arrays are compressed via simple data dependent scheme
     */
    private boolean compressionEnabled = true;

    @Override
    public ForestState toState(Forest model) {
        checkNotNull(model, "model must not be null");
        ForestConfig config = model.getConfig();
        ForestState state = new ForestState();
        state.setFeatureCount(config.getFeatureCount());
        state.setClassCount(config.getClassCount());
        state.setLeafBitWidth(config.getLeafBitWidth());
        state.setNumericType(config.getNumericType().name());
        state.setLeafMode(config.getLeafMode().name());
        state.setQuantizationBits(config.getQuantizationBits());
        state.setCompressed(compressionEnabled);

        List<DecisionNode> nodes = model.getDecisionNodes();
        int[] featureIndex = new int[nodes.size()];
        double[] threshold = new double[nodes.size()];
        int[] leftRef = new int[nodes.size()];
        int[] rightRef = new int[nodes.size()];
        for (int i = 0; i < nodes.size(); i++) {
            DecisionNode node = nodes.get(i);
            featureIndex[i] = node.getFeatureIndex();
            threshold[i] = node.getThreshold();
            leftRef[i] = node.getLeft().encode();
            rightRef[i] = node.getRight().encode();
        }
        int[] roots = new int[model.getTreeCount()];
        for (int i = 0; i < roots.length; i++) {
            roots[i] = model.getRoots().get(i).encode();
        }
        state.setDecisionNodeCount(nodes.size());
        state.setRoots(ArrayPacking.pack(roots, compressionEnabled));
        state.setFeatureIndex(ArrayPacking.pack(featureIndex, compressionEnabled));
        state.setThresholdData(ArrayPacking.pack(threshold));
        state.setLeftRef(ArrayPacking.pack(leftRef, compressionEnabled));
        state.setRightRef(ArrayPacking.pack(rightRef, compressionEnabled));

        toLeafState(model.getLeaves(), config.getLeafMode(), state);
        return state;
    }

    @Override
    public Forest toModel(ForestState state) {
        checkNotNull(state, "state must not be null");
        checkArgument(Version.V1_0.equals(state.getVersion()), "unsupported state version " + state.getVersion());
        ForestConfig config = ForestConfig.builder().featureCount(state.getFeatureCount())
                .classCount(state.getClassCount()).leafBitWidth(state.getLeafBitWidth())
                .numericType(NumericType.valueOf(state.getNumericType()))
                .leafMode(LeafMode.valueOf(state.getLeafMode())).quantizationBits(state.getQuantizationBits())
                .build();

        boolean compressed = state.isCompressed();
        int nodeCount = state.getDecisionNodeCount();
        ForestValidator.checkCapacity(nodeCount);
        int[] featureIndex = ArrayPacking.unpackInts(state.getFeatureIndex(), compressed);
        double[] threshold = ArrayPacking.unpackDoubles(state.getThresholdData());
        int[] leftRef = ArrayPacking.unpackInts(state.getLeftRef(), compressed);
        int[] rightRef = ArrayPacking.unpackInts(state.getRightRef(), compressed);
        checkArgument(featureIndex.length == nodeCount && threshold.length == nodeCount
                && leftRef.length == nodeCount && rightRef.length == nodeCount,
                "decision node arrays do not match the decision node count " + nodeCount);

        List<DecisionNode> nodes = new ArrayList<>(nodeCount);
        for (int i = 0; i < nodeCount; i++) {
            nodes.add(new DecisionNode(featureIndex[i], threshold[i], NodeRef.decode(leftRef[i]),
                    NodeRef.decode(rightRef[i])));
        }
        List<NodeRef> roots = new ArrayList<>();
        for (int root : ArrayPacking.unpackInts(state.getRoots(), compressed)) {
            roots.add(NodeRef.decode(root));
        }

        Forest forest = new Forest(roots, nodes, toLeaves(state, config.getLeafMode()), config);
        ForestValidator.validate(forest);
        return forest;
    }

    private void toLeafState(List<LeafPayload> leaves, LeafMode leafMode, ForestState state) {
        state.setLeafCount(leaves.size());
        switch (leafMode) {
        case MAJORITY:
            int[] classIndex = new int[leaves.size()];
            for (int i = 0; i < leaves.size(); i++) {
                classIndex[i] = ((MajorityClassLeaf) checkLeaf(leaves.get(i), MajorityClassLeaf.class, i))
                        .getClassIndex();
            }
            state.setLeafClassIndex(ArrayPacking.pack(classIndex, compressionEnabled));
            break;
        case VALUE:
            double[] values = new double[leaves.size()];
            for (int i = 0; i < leaves.size(); i++) {
                values[i] = ((RegressionValueLeaf) checkLeaf(leaves.get(i), RegressionValueLeaf.class, i))
                        .getValue();
            }
            state.setLeafValueData(ArrayPacking.pack(values));
            break;
        case PROBABILITIES:
            int width = leaves.isEmpty() ? 0
                    : ((QuantizedProbabilitiesLeaf) checkLeaf(leaves.get(0), QuantizedProbabilitiesLeaf.class, 0))
                            .getClassCount();
            int[] codes = new int[leaves.size() * width];
            for (int i = 0; i < leaves.size(); i++) {
                QuantizedProbabilitiesLeaf leaf = (QuantizedProbabilitiesLeaf) checkLeaf(leaves.get(i),
                        QuantizedProbabilitiesLeaf.class, i);
                checkArgument(leaf.getClassCount() == width,
                        "probability leaves must all have " + width + " codes, leaf " + i + " has "
                                + leaf.getClassCount());
                System.arraycopy(leaf.getCodes(), 0, codes, i * width, width);
            }
            state.setLeafProbabilityWidth(width);
            state.setLeafProbabilityCodes(ArrayPacking.pack(codes, compressionEnabled));
            break;
        default:
            throw new IllegalStateException("unknown leaf mode " + leafMode);
        }
    }

    private List<LeafPayload> toLeaves(ForestState state, LeafMode leafMode) {
        int leafCount = state.getLeafCount();
        List<LeafPayload> leaves = new ArrayList<>(leafCount);
        switch (leafMode) {
        case MAJORITY:
            int[] classIndex = ArrayPacking.unpackInts(state.getLeafClassIndex(), state.isCompressed());
            checkArgument(classIndex.length == leafCount, "class indexes do not match the leaf count");
            for (int value : classIndex) {
                leaves.add(new MajorityClassLeaf(value));
            }
            break;
        case VALUE:
            double[] values = ArrayPacking.unpackDoubles(state.getLeafValueData());
            checkArgument(values.length == leafCount, "leaf values do not match the leaf count");
            for (double value : values) {
                leaves.add(new RegressionValueLeaf(value));
            }
            break;
        case PROBABILITIES:
            int width = state.getLeafProbabilityWidth();
            int[] codes = ArrayPacking.unpackInts(state.getLeafProbabilityCodes(), state.isCompressed());
            checkArgument(codes.length == leafCount * width, "probability codes do not match the leaf count");
            for (int i = 0; i < leafCount; i++) {
                int[] leafCodes = new int[width];
                System.arraycopy(codes, i * width, leafCodes, 0, width);
                leaves.add(new QuantizedProbabilitiesLeaf(leafCodes));
            }
            break;
        default:
            throw new IllegalStateException("unknown leaf mode " + leafMode);
        }
        return leaves;
    }

    private static LeafPayload checkLeaf(LeafPayload leaf, Class<? extends LeafPayload> expected, int index) {
        checkArgument(expected.isInstance(leaf),
                "leaf " + index + " is " + leaf.getClass().getSimpleName() + ", expected " + expected.getSimpleName());
        return leaf;
    }
}
