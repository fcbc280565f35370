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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.amazon.forestcompiler.leaf.LeafPayload;

/**
 * A single tree after flattening: decision nodes and leaves in two separate
 * lists, cross-referenced through {@link NodeRef}s local to this tree.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class FlatTree {

    private final NodeRef root;
    private final List<DecisionNode> decisionNodes;
    private final List<LeafPayload> leaves;

    public FlatTree(NodeRef root, List<DecisionNode> decisionNodes, List<LeafPayload> leaves) {
        this.root = checkNotNull(root, "root must not be null");
        this.decisionNodes = Collections
                .unmodifiableList(new ArrayList<>(checkNotNull(decisionNodes, "decisionNodes must not be null")));
        this.leaves = Collections.unmodifiableList(new ArrayList<>(checkNotNull(leaves, "leaves must not be null")));
    }

    public int size() {
        return decisionNodes.size() + leaves.size();
    }
}
