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

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import com.amazon.forestcompiler.codegen.EmitStrategy;
import com.amazon.forestcompiler.codegen.ForestCodeGenerator;
import com.amazon.forestcompiler.forest.Forest;
import com.amazon.forestcompiler.testutils.RandomTreeGenerator;
import com.amazon.forestcompiler.testutils.TreeArrays;
import com.amazon.forestcompiler.tree.SourceTree;

@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Benchmark)
public class CompileBenchmark {

    public static final int FEATURE_COUNT = 16;
    public static final int CLASS_COUNT = 4;
    public static final long SEED = 42;

    @State(Scope.Thread)
    public static class BenchmarkState {
        @Param({ "10", "100" })
        int numberOfTrees;

        @Param({ "8" })
        int maxDepth;

        @Param({ "false", "true" })
        boolean parallelExecutionEnabled;

        List<SourceTree> trees;
        ForestCompiler compiler;
        Forest forest;

        @Setup(Level.Trial)
        public void setUp() {
            RandomTreeGenerator generator = new RandomTreeGenerator(SEED, FEATURE_COUNT, CLASS_COUNT);
            trees = new ArrayList<>();
            for (TreeArrays arrays : generator.generateForest(numberOfTrees, maxDepth)) {
                trees.add(new SourceTree(arrays.childrenLeft, arrays.childrenRight, arrays.feature,
                        arrays.threshold, arrays.value));
            }
            compiler = ForestCompiler.builder().featureCount(FEATURE_COUNT).classCount(CLASS_COUNT)
                    .parallelExecutionEnabled(parallelExecutionEnabled).build();
            forest = compiler.compile(trees);
        }
    }

    @Benchmark
    public Forest compile(BenchmarkState state) {
        return state.compiler.compile(state.trees);
    }

    @Benchmark
    public String generateLoadable(BenchmarkState state) {
        return new ForestCodeGenerator().generate(state.forest, "model", EnumSet.of(EmitStrategy.LOADABLE));
    }

    @Benchmark
    public String generateInline(BenchmarkState state) {
        return new ForestCodeGenerator().generate(state.forest, "model", EnumSet.of(EmitStrategy.INLINE));
    }
}
