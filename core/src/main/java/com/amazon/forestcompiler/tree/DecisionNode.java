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

import static com.amazon.forestcompiler.CommonUtils.checkArgument;
import static com.amazon.forestcompiler.CommonUtils.checkNotNull;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * An internal node: features below the threshold go to the left child, all
 * others to the right child.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class DecisionNode {

    private final int featureIndex;
    private final double threshold;
    private final NodeRef left;
    private final NodeRef right;

    public DecisionNode(int featureIndex, double threshold, NodeRef left, NodeRef right) {
        checkArgument(featureIndex >= 0, "featureIndex must be non-negative");
        this.featureIndex = featureIndex;
        this.threshold = threshold;
        this.left = checkNotNull(left, "left must not be null");
        this.right = checkNotNull(right, "right must not be null");
    }

    public DecisionNode withChildren(NodeRef left, NodeRef right) {
        return new DecisionNode(featureIndex, threshold, left, right);
    }

    public DecisionNode shift(int nodeOffset, int leafOffset) {
        return withChildren(left.shift(nodeOffset, leafOffset), right.shift(nodeOffset, leafOffset));
    }
}
