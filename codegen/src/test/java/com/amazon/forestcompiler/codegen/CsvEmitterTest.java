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

package com.amazon.forestcompiler.codegen;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.amazon.forestcompiler.ForestCompiler;
import com.amazon.forestcompiler.config.ModelKind;
import com.amazon.forestcompiler.forest.Forest;
import com.amazon.forestcompiler.testutils.ExampleTrees;

public class CsvEmitterTest {

    @Test
    public void testRootsThenNodes() {
        ForestCompiler compiler = ForestCompiler.builder().featureCount(2).classCount(2).deduplicationEnabled(false)
                .build();
        Forest forest = Forests.compile(compiler, ExampleTrees.singleSplitClassifier(),
                ExampleTrees.singleSplitClassifier());

        assertEquals("r,0\r\nr,1\r\nn,0,0.5,-1,-2\r\nn,0,0.5,-3,-4", new CsvEmitter().emit(forest));
    }

    @Test
    public void testLeafRoot() {
        Forest forest = Forests.compile(ForestCompiler.builder().featureCount(1).classCount(2).build(),
                ExampleTrees.singleLeaf(0, 1));

        assertEquals("r,-1", new CsvEmitter().emit(forest));
    }

    @Test
    public void testNameIsIgnored() {
        Forest forest = Forests.compile(
                ForestCompiler.builder().modelKind(ModelKind.REGRESSOR).featureCount(4).build(),
                ExampleTrees.regressionStump(3, 0.125, 1.0, 2.0));
        CsvEmitter emitter = new CsvEmitter();

        assertEquals("r,0\r\nn,3,0.125,-1,-2", emitter.emit(forest, "anything"));
        assertEquals(emitter.emit(forest), emitter.emit(forest, "other"));
    }

    @Test
    public void testThresholdsUseJavaDoubleFormat() {
        Forest forest = Forests.compile(
                ForestCompiler.builder().modelKind(ModelKind.REGRESSOR).featureCount(2).build(),
                ExampleTrees.regressionStump(0, 1e-5, 1.0, 2.0), ExampleTrees.regressionStump(1, 1e7, 3.0, 4.0),
                ExampleTrees.regressionStump(0, -1234.5, 5.0, 6.0));

        assertEquals("r,0\r\nr,1\r\nr,2\r\nn,0,1.0E-5,-1,-2\r\nn,1,1.0E7,-3,-4\r\nn,0,-1234.5,-5,-6",
                new CsvEmitter().emit(forest));
    }

    @Test
    public void testNullForest() {
        assertThrows(NullPointerException.class, () -> new CsvEmitter().emit(null));
    }
}
