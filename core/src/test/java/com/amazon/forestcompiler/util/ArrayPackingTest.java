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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class ArrayPackingTest {

    @Test
    public void testDigitsPerInt() {
        assertEquals(30, ArrayPacking.digitsPerInt(2));
        assertEquals(1, ArrayPacking.digitsPerInt(1L << 31));
        assertEquals(1, ArrayPacking.digitsPerInt(1L << 32));
        assertThrows(IllegalArgumentException.class, () -> ArrayPacking.digitsPerInt(1));
    }

    @Test
    public void testSignedReferencesPackSmall() {
        int[] refs = new int[1000];
        for (int i = 0; i < refs.length; i++) {
            refs[i] = (i % 7) - 3;
        }
        int[] packed = ArrayPacking.pack(refs, true);
        assertTrue(packed.length < refs.length / 5);
        assertArrayEquals(refs, ArrayPacking.unpackInts(packed, true));
    }

    @ParameterizedTest
    @ValueSource(ints = { 2, 3, 255, 65536, Integer.MAX_VALUE })
    public void testRandomRanges(int range) {
        Random random = new Random(range);
        int[] values = new int[257];
        for (int i = 0; i < values.length; i++) {
            values[i] = random.nextInt(range) - range / 2;
        }
        assertArrayEquals(values, ArrayPacking.unpackInts(ArrayPacking.pack(values, true), true));
    }

    @Test
    public void testFullIntRange() {
        int[] values = { Integer.MIN_VALUE, Integer.MAX_VALUE, 0, -1, 1 };
        assertArrayEquals(values, ArrayPacking.unpackInts(ArrayPacking.pack(values, true), true));
    }

    @Test
    public void testConstantAndShortArrays() {
        int[] constant = { 4, 4, 4, 4, 4, 4 };
        assertArrayEquals(new int[] { 4, 4, 6 }, ArrayPacking.pack(constant, true));
        assertArrayEquals(constant, ArrayPacking.unpackInts(ArrayPacking.pack(constant, true), true));
        assertArrayEquals(new int[] { 9, -9 }, ArrayPacking.unpackInts(ArrayPacking.pack(new int[] { 9, -9 }, true),
                true));
        assertArrayEquals(new int[0], ArrayPacking.unpackInts(ArrayPacking.pack(new int[0], true), true));
    }

    @Test
    public void testUncompressedIsACopy() {
        int[] values = { 5, -6, 7 };
        int[] packed = ArrayPacking.pack(values, false);
        assertArrayEquals(values, packed);
        packed[0] = 0;
        assertEquals(5, values[0]);
    }

    @Test
    public void testDoubles() {
        double[] values = { 0.5, -1e-300, Double.MAX_VALUE, 0.1 };
        assertArrayEquals(values, ArrayPacking.unpackDoubles(ArrayPacking.pack(values)));
        assertThrows(IllegalArgumentException.class, () -> ArrayPacking.unpackDoubles(new byte[5]));
    }

    @Test
    public void testLittleEndianFloats() {
        byte[] bytes = ArrayPacking.packLittleEndian(new float[] { 1.0f, -2.0f });
        // 1.0f = 0x3f800000, -2.0f = 0xc0000000
        assertArrayEquals(new byte[] { 0, 0, (byte) 0x80, 0x3f, 0, 0, 0, (byte) 0xc0 }, bytes);
        assertArrayEquals(new float[] { 1.0f, -2.0f }, ArrayPacking.unpackFloatsLittleEndian(bytes));
    }
}
