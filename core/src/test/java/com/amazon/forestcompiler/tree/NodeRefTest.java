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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class NodeRefTest {

    @Test
    public void testLeafZeroEncodesToMinusOne() {
        assertEquals(-1, NodeRef.leaf(0).encode());
        assertEquals(0, NodeRef.internal(0).encode());
        assertNotEquals(NodeRef.leaf(0), NodeRef.internal(0));
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, 1, 2, 17, 32767, 32768, 1_000_000 })
    public void testEncodingIsABijection(int index) {
        assertEquals(-(index + 1), NodeRef.leaf(index).encode());
        assertEquals(NodeRef.leaf(index), NodeRef.decode(NodeRef.leaf(index).encode()));
        assertEquals(NodeRef.internal(index), NodeRef.decode(NodeRef.internal(index).encode()));
        assertTrue(NodeRef.decode(-(index + 1)).isLeaf());
        assertFalse(NodeRef.decode(index).isLeaf());
    }

    @Test
    public void testShift() {
        assertEquals(NodeRef.internal(7), NodeRef.internal(2).shift(5, 100));
        assertEquals(NodeRef.leaf(103), NodeRef.leaf(3).shift(5, 100));
        // shifting a leaf is the same as subtracting the offset from its encoding
        assertEquals(NodeRef.leaf(3).encode() - 100, NodeRef.leaf(3).shift(5, 100).encode());
    }

    @Test
    public void testNegativeIndexIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> NodeRef.leaf(-1));
        assertThrows(IllegalArgumentException.class, () -> NodeRef.internal(-3));
    }

    @Test
    public void testToString() {
        assertEquals("Leaf(4)", NodeRef.leaf(4).toString());
        assertEquals("Internal(2)", NodeRef.internal(2).toString());
    }
}
