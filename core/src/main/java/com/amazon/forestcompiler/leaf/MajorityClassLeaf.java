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

package com.amazon.forestcompiler.leaf;

import static com.amazon.forestcompiler.CommonUtils.checkArgument;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Leaf of a classification tree holding the winning class.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class MajorityClassLeaf extends LeafPayload {

    private final int classIndex;

    public MajorityClassLeaf(int classIndex) {
        checkArgument(classIndex >= 0, "classIndex must be non-negative");
        this.classIndex = classIndex;
    }

    @Override
    public double[] toScalars() {
        return new double[] { classIndex };
    }

    @Override
    public <R> R accept(ILeafVisitor<R> visitor) {
        return visitor.visitMajorityClass(this);
    }

    @Override
    public String toString() {
        return Integer.toString(classIndex);
    }
}
