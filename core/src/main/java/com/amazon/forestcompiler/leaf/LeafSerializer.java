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

import static com.amazon.forestcompiler.CommonUtils.checkConfig;
import static com.amazon.forestcompiler.CommonUtils.checkNotNull;

import java.util.List;

import com.amazon.forestcompiler.ConfigException;
import com.amazon.forestcompiler.config.ForestConfig;
import com.amazon.forestcompiler.util.ArrayPacking;

/**
 * Produces the byte table of leaves read by the table-driven runtime.
 *
 * A leaf bit width of 0 stores each leaf as its natural scalar, which for the
 * byte table means one unsigned byte holding the class index. A width of 32
 * stores every scalar of every payload as a little-endian IEEE-754 float. Widths
 * 1 to 8 are reserved for packed probability codes and are refused.
 */
public class LeafSerializer {

    private static final int MAX_UNSIGNED_BYTE = 255;

    private LeafSerializer() {
    }

    public static byte[] serialize(List<LeafPayload> leaves, int leafBitWidth) {
        checkNotNull(leaves, "leaves must not be null");
        if (leafBitWidth == ForestConfig.NATURAL_LEAF_BIT_WIDTH) {
            return toClassBytes(leaves);
        } else if (leafBitWidth == ForestConfig.FLOAT_LEAF_BIT_WIDTH) {
            return toFloatBytes(leaves);
        }
        if (ForestConfig.isAcceptedLeafBitWidth(leafBitWidth)) {
            throw new ConfigException("leaf bit width " + leafBitWidth
                    + " is reserved for quantized probabilities and cannot be serialized yet");
        }
        throw new ConfigException("unsupported leaf bit width " + leafBitWidth);
    }

    static byte[] toClassBytes(List<LeafPayload> leaves) {
        byte[] bytes = new byte[leaves.size()];
        for (int i = 0; i < leaves.size(); i++) {
            LeafPayload leaf = leaves.get(i);
            checkConfig(leaf instanceof MajorityClassLeaf,
                    "leaf bit width 0 can only store class indexes, leaf " + i + " is " + leaf);
            int classIndex = ((MajorityClassLeaf) leaf).getClassIndex();
            checkConfig(classIndex <= MAX_UNSIGNED_BYTE,
                    "class index " + classIndex + " of leaf " + i + " does not fit in a byte");
            bytes[i] = (byte) classIndex;
        }
        return bytes;
    }

    static byte[] toFloatBytes(List<LeafPayload> leaves) {
        int count = 0;
        for (LeafPayload leaf : leaves) {
            count += leaf.toScalars().length;
        }
        float[] values = new float[count];
        int offset = 0;
        for (LeafPayload leaf : leaves) {
            for (double scalar : leaf.toScalars()) {
                values[offset++] = (float) scalar;
            }
        }
        return ArrayPacking.packLittleEndian(values);
    }
}
