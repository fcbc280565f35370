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

package com.amazon.forestcompiler.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.forestcompiler.ConfigException;

public class ForestConfigTest {

    @Test
    public void testDefaults() {
        ForestConfig config = ForestConfig.builder().featureCount(4).classCount(2).build();
        assertEquals(NumericType.FLOAT_32, config.getNumericType());
        assertEquals(LeafMode.MAJORITY, config.getLeafMode());
        assertEquals(0, config.getLeafBitWidth());
        assertEquals(8, config.getQuantizationBits());
        assertTrue(config.isClassifier());
    }

    @Test
    public void testDefaultLeafBitWidthFollowsLeafMode() {
        assertEquals(32, ForestConfig.builder().featureCount(1).leafMode(LeafMode.VALUE).build().getLeafBitWidth());
        assertEquals(32, ForestConfig.builder().featureCount(1).classCount(2).leafMode(LeafMode.PROBABILITIES)
                .build().getLeafBitWidth());
    }

    @Test
    public void testToBuilder() {
        ForestConfig config = ForestConfig.builder().featureCount(4).classCount(2).numericType(NumericType.INT_16)
                .build();
        assertEquals(config, config.toBuilder().build());
        assertEquals(5, config.toBuilder().featureCount(5).build().getFeatureCount());
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, 1, 5, 8, 32 })
    public void testAcceptedLeafBitWidths(int width) {
        assertTrue(ForestConfig.isAcceptedLeafBitWidth(width));
        assertEquals(width, ForestConfig.builder().featureCount(1).classCount(1).leafBitWidth(width).build()
                .getLeafBitWidth());
    }

    @ParameterizedTest
    @ValueSource(ints = { -1, 9, 16, 31, 33, 64 })
    public void testRejectedLeafBitWidths(int width) {
        assertFalse(ForestConfig.isAcceptedLeafBitWidth(width));
        assertThrows(ConfigException.class,
                () -> ForestConfig.builder().featureCount(1).classCount(1).leafBitWidth(width).build());
    }

    @Test
    public void testInvalidConfigurations() {
        assertThrows(ConfigException.class, () -> ForestConfig.builder().classCount(2).build());
        assertThrows(ConfigException.class, () -> ForestConfig.builder().featureCount(1).build());
        assertThrows(ConfigException.class,
                () -> ForestConfig.builder().featureCount(1).classCount(-1).leafMode(LeafMode.VALUE).build());
        assertThrows(ConfigException.class,
                () -> ForestConfig.builder().featureCount(1).classCount(2).numericType(null).build());
        assertThrows(ConfigException.class,
                () -> ForestConfig.builder().featureCount(1).classCount(2).quantizationBits(0).build());
        assertThrows(ConfigException.class,
                () -> ForestConfig.builder().featureCount(1).classCount(2).quantizationBits(9).build());
    }
}
