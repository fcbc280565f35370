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

package com.amazon.forestcompiler;

import java.util.OptionalInt;

/**
 * Thrown when a forest, or a tree being added to it, breaks a reference
 * invariant: a dangling internal or leaf reference, an orphan node, or a
 * malformed source tree. When the failure can be attributed to one input tree
 * the index of that tree is attached.
 */
public class ValidationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private static final int NO_TREE = -1;

    private final int treeIndex;

    public ValidationException(String message) {
        this(message, NO_TREE);
    }

    public ValidationException(String message, int treeIndex) {
        super(treeIndex == NO_TREE ? message : "tree " + treeIndex + ": " + message);
        this.treeIndex = treeIndex;
    }

    /**
     * @return the index of the input tree that caused the failure, if known.
     */
    public OptionalInt getTreeIndex() {
        return treeIndex == NO_TREE ? OptionalInt.empty() : OptionalInt.of(treeIndex);
    }
}
