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
import static com.amazon.forestcompiler.CommonUtils.checkNotNull;

import java.util.Arrays;

import lombok.EqualsAndHashCode;

/**
 * Leaf holding one quantized probability code per class, as produced by
 * {@link ProbabilityQuantizer}.
 */
@EqualsAndHashCode(callSuper = false)
public final class QuantizedProbabilitiesLeaf extends LeafPayload {

    private final int[] codes;

    public QuantizedProbabilitiesLeaf(int[] codes) {
        checkNotNull(codes, "codes must not be null");
        checkArgument(codes.length > 0, "codes must not be empty");
        this.codes = Arrays.copyOf(codes, codes.length);
    }

    public int[] getCodes() {
        return Arrays.copyOf(codes, codes.length);
    }

    public int getClassCount() {
        return codes.length;
    }

    @Override
    public double[] toScalars() {
        return Arrays.stream(codes).asDoubleStream().toArray();
    }

    @Override
    public <R> R accept(ILeafVisitor<R> visitor) {
        return visitor.visitQuantizedProbabilities(this);
    }

    @Override
    public String toString() {
        return Arrays.toString(codes);
    }
}
