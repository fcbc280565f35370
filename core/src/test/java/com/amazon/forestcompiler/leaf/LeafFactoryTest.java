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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.amazon.forestcompiler.ConfigException;
import com.amazon.forestcompiler.UnsupportedShapeException;
import com.amazon.forestcompiler.config.ForestConfig;
import com.amazon.forestcompiler.config.LeafMode;

public class LeafFactoryTest {

    private static LeafFactory factory(LeafMode leafMode, int classCount) {
        return LeafFactory.forConfig(ForestConfig.builder().featureCount(1).classCount(classCount)
                .leafMode(leafMode).quantizationBits(3).build());
    }

    @Test
    public void testMajorityPicksTheLargestEntry() {
        LeafFactory majority = factory(LeafMode.MAJORITY, 3);
        assertEquals(new MajorityClassLeaf(2), majority.create(new double[] { 1, 2, 3 }));
        assertEquals(new MajorityClassLeaf(0), majority.create(new double[] { 9, 2, 3 }));
    }

    @Test
    public void testMajorityTieGoesToLowestClass() {
        LeafFactory majority = factory(LeafMode.MAJORITY, 3);
        assertEquals(new MajorityClassLeaf(1), majority.create(new double[] { 0, 4, 4 }));
        assertEquals(new MajorityClassLeaf(0), majority.create(new double[] { 2, 2, 2 }));
    }

    @Test
    public void testValue() {
        LeafFactory value = factory(LeafMode.VALUE, 0);
        assertEquals(new RegressionValueLeaf(3.25), value.create(new double[] { 3.25 }));
        assertThrows(UnsupportedShapeException.class, () -> value.create(new double[] { 1, 2 }));
    }

    @Test
    public void testProbabilities() {
        LeafFactory probabilities = factory(LeafMode.PROBABILITIES, 2);
        // 3 bits: seven edges k / 7
        QuantizedProbabilitiesLeaf leaf = (QuantizedProbabilitiesLeaf) probabilities.create(new double[] { 3, 1 });
        assertEquals(2, leaf.getClassCount());
        assertEquals(6, leaf.getCodes()[0]);
        assertEquals(2, leaf.getCodes()[1]);
    }

    @Test
    public void testPayloadEquality() {
        assertEquals(new QuantizedProbabilitiesLeaf(new int[] { 1, 2 }),
                new QuantizedProbabilitiesLeaf(new int[] { 1, 2 }));
        assertEquals(new QuantizedProbabilitiesLeaf(new int[] { 1, 2 }).hashCode(),
                new QuantizedProbabilitiesLeaf(new int[] { 1, 2 }).hashCode());
        assertEquals(new RegressionValueLeaf(0.5), new RegressionValueLeaf(0.5));
    }

    @Test
    public void testClassStatisticsMustMatchTheClassCount() {
        LeafFactory majority = factory(LeafMode.MAJORITY, 2);
        assertThrows(ConfigException.class, () -> majority.create(new double[] { 0, 0, 7 }));
        assertThrows(ConfigException.class, () -> majority.create(new double[] { 7 }));

        LeafFactory probabilities = factory(LeafMode.PROBABILITIES, 3);
        assertThrows(ConfigException.class, () -> probabilities.create(new double[] { 1, 1 }));
    }
}
