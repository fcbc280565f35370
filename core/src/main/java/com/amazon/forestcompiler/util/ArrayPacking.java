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

package com.amazon.forestcompiler.util;

import static com.amazon.forestcompiler.CommonUtils.checkArgument;
import static com.amazon.forestcompiler.CommonUtils.checkNotNull;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * Conversions between primitive arrays and their compact stored forms.
 *
 * Int arrays can be packed arithmetically: the output starts with a header of
 * {@code min, max, length} and every following int holds as many consecutive
 * values (offset by {@code min}) as fit in base {@code max - min + 1}. Node
 * references, feature indexes and class indexes span small ranges, so this
 * usually shrinks them several times over.
 */
public class ArrayPacking {

    private static final int HEADER_LENGTH = 3;

    private ArrayPacking() {
    }

    /**
     * @param base radix of the packed digits, greater than 1
     * @return how many base-{@code base} digits fit in one int, at least 1
     */
    public static int digitsPerInt(long base) {
        checkArgument(base > 1, "base must be greater than 1");
        int digits = 0;
        long reach = base;
        while (reach < Integer.MAX_VALUE) {
            reach *= base;
            ++digits;
        }
        return Math.max(digits, 1);
    }

    /**
     * Packs an array of ints.
     *
     * @param values   the ints to pack
     * @param compress if false a copy of the input is returned
     * @return the packed ints
     */
    public static int[] pack(int[] values, boolean compress) {
        checkNotNull(values, "values must not be null");
        if (!compress || values.length < HEADER_LENGTH) {
            return Arrays.copyOf(values, values.length);
        }
        int min = Arrays.stream(values).min().getAsInt();
        int max = Arrays.stream(values).max().getAsInt();
        long base = (long) max - min + 1;
        if (base == 1) {
            return new int[] { min, max, values.length };
        }
        int digits = digitsPerInt(base);
        int[] packed = new int[HEADER_LENGTH + (values.length + digits - 1) / digits];
        packed[0] = min;
        packed[1] = max;
        packed[2] = values.length;
        for (int start = 0, slot = HEADER_LENGTH; start < values.length; start += digits, slot++) {
            long code = 0;
            for (int i = Math.min(start + digits, values.length) - 1; i >= start; i--) {
                code = base * code + (values[i] - (long) min);
            }
            packed[slot] = (int) code;
        }
        return packed;
    }

    /**
     * Reverses {@link #pack(int[], boolean)}.
     *
     * @param packed     output of {@link #pack(int[], boolean)}
     * @param decompress must match the {@code compress} flag used when packing
     * @return the original ints
     */
    public static int[] unpackInts(int[] packed, boolean decompress) {
        checkNotNull(packed, "packed must not be null");
        if (!decompress || packed.length < HEADER_LENGTH) {
            return Arrays.copyOf(packed, packed.length);
        }
        int min = packed[0];
        int max = packed[1];
        int length = packed[2];
        checkArgument(length >= 0, "corrupt packed array, negative length");
        int[] values = new int[length];
        if (min == max) {
            Arrays.fill(values, min);
            return values;
        }
        long base = (long) max - min + 1;
        int digits = digitsPerInt(base);
        int count = 0;
        for (int slot = HEADER_LENGTH; slot < packed.length; slot++) {
            long code = Integer.toUnsignedLong(packed[slot]);
            for (int j = 0; j < digits && count < length; j++) {
                values[count++] = (int) (min + code % base);
                code /= base;
            }
        }
        checkArgument(count == length, "corrupt packed array, expected " + length + " values");
        return values;
    }

    /**
     * @param values doubles to store
     * @return the doubles as big-endian bytes
     */
    public static byte[] pack(double[] values) {
        checkNotNull(values, "values must not be null");
        ByteBuffer buffer = ByteBuffer.allocate(values.length * Double.BYTES);
        for (double value : values) {
            buffer.putDouble(value);
        }
        return buffer.array();
    }

    public static double[] unpackDoubles(byte[] bytes) {
        checkNotNull(bytes, "bytes must not be null");
        checkArgument(bytes.length % Double.BYTES == 0, "byte count must be a multiple of " + Double.BYTES);
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        double[] values = new double[bytes.length / Double.BYTES];
        for (int i = 0; i < values.length; i++) {
            values[i] = buffer.getDouble();
        }
        return values;
    }

    /**
     * Stores floats in the byte order of the little-endian targets the generated
     * tables are compiled for.
     *
     * @param values floats to store
     * @return four little-endian bytes per float
     */
    public static byte[] packLittleEndian(float[] values) {
        checkNotNull(values, "values must not be null");
        ByteBuffer buffer = ByteBuffer.allocate(values.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float value : values) {
            buffer.putFloat(value);
        }
        return buffer.array();
    }

    public static float[] unpackFloatsLittleEndian(byte[] bytes) {
        checkNotNull(bytes, "bytes must not be null");
        checkArgument(bytes.length % Float.BYTES == 0, "byte count must be a multiple of " + Float.BYTES);
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        float[] values = new float[bytes.length / Float.BYTES];
        for (int i = 0; i < values.length; i++) {
            values[i] = buffer.getFloat();
        }
        return values;
    }
}
