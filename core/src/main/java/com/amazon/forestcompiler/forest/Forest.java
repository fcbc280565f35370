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
import java.util.Collections;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.amazon.forestcompiler.config.ForestConfig;
import com.amazon.forestcompiler.leaf.LeafPayload;
import com.amazon.forestcompiler.tree.DecisionNode;
import com.amazon.forestcompiler.tree.NodeRef;

/**
 * A collection of flattened trees sharing one decision-node list and one leaf
 * list. The trees are told apart only by their roots. A forest is immutable;
 * every pipeline stage returns a new instance.
 *
 * The decision-node count is bounded by
 * {@link ForestValidator#MAX_DECISION_NODES}; a larger forest cannot be
 * constructed.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Forest {

    private final List<NodeRef> roots;
    private final List<DecisionNode> decisionNodes;
    private final List<LeafPayload> leaves;
    private final ForestConfig config;

    public Forest(List<NodeRef> roots, List<DecisionNode> decisionNodes, List<LeafPayload> leaves,
            ForestConfig config) {
        checkNotNull(roots, "roots must not be null");
        checkNotNull(decisionNodes, "decisionNodes must not be null");
        checkNotNull(leaves, "leaves must not be null");
        ForestValidator.checkCapacity(decisionNodes.size());
        this.roots = Collections.unmodifiableList(new ArrayList<>(roots));
        this.decisionNodes = Collections.unmodifiableList(new ArrayList<>(decisionNodes));
        this.leaves = Collections.unmodifiableList(new ArrayList<>(leaves));
        this.config = checkNotNull(config, "config must not be null");
    }

    public int getTreeCount() {
        return roots.size();
    }

    public DecisionNode getDecisionNode(int index) {
        return decisionNodes.get(index);
    }

    public LeafPayload getLeaf(int index) {
        return leaves.get(index);
    }
}
