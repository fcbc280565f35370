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

import lombok.EqualsAndHashCode;

/**
 * A reference from a decision node (or from a tree root) to either another
 * decision node or a leaf. References are plain indexes into the decision-node
 * list and the leaf list of the enclosing tree or forest; there are no object
 * pointers between nodes.
 *
 * The tag is explicit in memory. The signed form, where an internal reference
 * is the non-negative index and a leaf reference is {@code -(index + 1)}, is
 * only used when a forest is written out (see {@link #encode()} and
 * {@link #decode(int)}). Leaf 0 therefore encodes to -1, leaving 0 for decision
 * node 0.
 */
@EqualsAndHashCode
public final class NodeRef {

    private final boolean leaf;
    private final int index;

    private NodeRef(boolean leaf, int index) {
        checkArgument(index >= 0, "node index must be non-negative, got " + index);
        this.leaf = leaf;
        this.index = index;
    }

    public static NodeRef internal(int index) {
        return new NodeRef(false, index);
    }

    public static NodeRef leaf(int index) {
        return new NodeRef(true, index);
    }

    /**
     * @param encoded a value produced by {@link #encode()}
     * @return the reference denoted by the signed value
     */
    public static NodeRef decode(int encoded) {
        return encoded < 0 ? leaf(-(encoded + 1)) : internal(encoded);
    }

    public int encode() {
        return leaf ? -(index + 1) : index;
    }

    public boolean isLeaf() {
        return leaf;
    }

    public int getIndex() {
        return index;
    }

    /**
     * Returns this reference moved into a larger store where this tree's decision
     * nodes start at {@code nodeOffset} and its leaves at {@code leafOffset}. For a
     * leaf this is the same as subtracting {@code leafOffset} from the encoded
     * value.
     *
     * @param nodeOffset number of decision nodes stored before this tree
     * @param leafOffset number of leaves stored before this tree
     * @return the shifted reference
     */
    public NodeRef shift(int nodeOffset, int leafOffset) {
        return leaf ? leaf(index + leafOffset) : internal(index + nodeOffset);
    }

    @Override
    public String toString() {
        return (leaf ? "Leaf(" : "Internal(") + index + ")";
    }
}
