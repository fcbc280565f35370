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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.amazon.forestcompiler.ConfigException;
import com.amazon.forestcompiler.ForestCompiler;
import com.amazon.forestcompiler.config.ForestConfig;
import com.amazon.forestcompiler.config.LeafMode;
import com.amazon.forestcompiler.config.ModelKind;
import com.amazon.forestcompiler.config.NumericType;
import com.amazon.forestcompiler.forest.Forest;
import com.amazon.forestcompiler.leaf.MajorityClassLeaf;
import com.amazon.forestcompiler.testutils.ExampleTrees;
import com.amazon.forestcompiler.tree.DecisionNode;
import com.amazon.forestcompiler.tree.NodeRef;

public class InlinedEmitterTest {

    private static final String VOTE_LOOP = "  int32_t most_voted_class = -1;\n" + "  int32_t most_voted_votes = 0;\n"
            + "  for (int32_t i = 0; i < %d; i++) {\n" + "    if (votes[i] > most_voted_votes) {\n"
            + "      most_voted_class = i;\n" + "      most_voted_votes = votes[i];\n" + "    }\n" + "  }\n"
            + "  return most_voted_class;\n" + "}\n";

    private InlinedEmitter emitter;

    @BeforeEach
    public void setUp() {
        emitter = new InlinedEmitter();
    }

    @Test
    public void testSingleSplitClassifier() {
        Forest forest = Forests.compile(ForestCompiler.builder().featureCount(2).classCount(2).build(),
                ExampleTrees.singleSplitClassifier());

        String expected = "static inline int32_t model_tree_0(const float *features, int32_t features_length) {\n"
                + "  if (features[0] < 0.5f) {\n" + "    return 0;\n" + "  } else {\n" + "    return 1;\n" + "  }\n"
                + "}\n" + "\n" + "int32_t model_predict(const float *features, int32_t features_length) {\n"
                + "  int32_t votes[2] = {0,};\n" + "  int32_t _class = -1;\n" + "\n"
                + "  _class = model_tree_0(features, features_length); votes[_class] += 1;\n" + "\n"
                + String.format(VOTE_LOOP, 2);
        assertEquals(expected, emitter.emit(forest, "model"));
    }

    @Test
    public void testLeftBranchIsEmittedFirst() {
        Forest forest = Forests.compile(ForestCompiler.builder().featureCount(2).classCount(3).build(),
                ExampleTrees.unorderedThreeClass());

        String expected = "static inline int32_t m_tree_0(const float *features, int32_t features_length) {\n"
                + "  if (features[1] < 2.5f) {\n" + "    if (features[0] < 0.25f) {\n" + "      return 0;\n"
                + "    } else {\n" + "      return 1;\n" + "    }\n" + "  } else {\n" + "    return 2;\n" + "  }\n"
                + "}\n";
        assertTrue(emitter.emit(forest, "m").startsWith(expected));
    }

    @Test
    public void testVotesOfEveryTreeAreTallied() {
        // trees voting 0, 1, 1: class 1 has the most votes
        Forest forest = Forests.compile(ForestCompiler.builder().featureCount(1).classCount(2).build(),
                ExampleTrees.singleLeaf(1, 0), ExampleTrees.singleLeaf(0, 1), ExampleTrees.singleLeaf(0, 1));
        String code = emitter.emit(forest, "vote");

        assertTrue(code.contains("static inline int32_t vote_tree_0(const float *features, int32_t features_length) {\n"
                + "  return 0;\n" + "}\n"));
        assertTrue(code.contains("static inline int32_t vote_tree_2(const float *features, int32_t features_length) {\n"
                + "  return 1;\n" + "}\n"));
        for (int i = 0; i < 3; i++) {
            assertTrue(code.contains("  _class = vote_tree_" + i + "(features, features_length); votes[_class] += 1;\n"));
        }
        assertTrue(code.endsWith(String.format(VOTE_LOOP, 2)));
    }

    @Test
    public void testTieGoesToLowestClass() {
        // trees voting 0 and 1; only a strictly larger count replaces the leader, so class 0 wins
        Forest forest = Forests.compile(ForestCompiler.builder().featureCount(1).classCount(2).build(),
                ExampleTrees.singleLeaf(1, 0), ExampleTrees.singleLeaf(0, 1));
        String code = emitter.emit(forest, "tie");

        assertTrue(code.contains("    if (votes[i] > most_voted_votes) {\n"));
        assertTrue(code.contains("  for (int32_t i = 0; i < 2; i++) {\n"));
    }

    @Test
    public void testRegressorAveragesTrees() {
        Forest forest = Forests.compile(
                ForestCompiler.builder().modelKind(ModelKind.REGRESSOR).featureCount(3).build(),
                ExampleTrees.regressionStump(2, 1.5, 2.0, 4.0), ExampleTrees.regressionStump(0, -1.0, 0.5, 8.0));
        String code = emitter.emit(forest, "reg");

        assertTrue(code.contains("static inline float reg_tree_0(const float *features, int32_t features_length) {\n"
                + "  if (features[2] < 1.5f) {\n" + "    return 2.0f;\n" + "  } else {\n" + "    return 4.0f;\n"
                + "  }\n" + "}\n"));
        assertTrue(code.contains("  if (features[0] < -1.0f) {\n"));
        assertTrue(code.endsWith("float reg_predict(const float *features, int32_t features_length) {\n"
                + "  float avg = 0;\n" + "\n" + "  avg += reg_tree_0(features, features_length);\n"
                + "  avg += reg_tree_1(features, features_length);\n" + "\n" + "  return avg / 2;\n" + "}\n"));
    }

    @Test
    public void testFeatureType() {
        Forest forest = Forests.compile(
                ForestCompiler.builder().featureCount(2).classCount(2).numericType(NumericType.INT_32).build(),
                ExampleTrees.singleSplitClassifier());
        String code = emitter.emit(forest, "ints");

        assertTrue(code.contains("ints_tree_0(const int32_t *features, int32_t features_length)"));
        assertTrue(code.contains("  if (features[0] < 1) {\n"));
        assertTrue(code.contains("int32_t ints_predict(const int32_t *features, int32_t features_length)"));
    }

    @Test
    public void testProbabilityLeavesCannotBeInlined() {
        Forest forest = Forests.compile(ForestCompiler.builder().featureCount(2).classCount(2)
                .leafMode(LeafMode.PROBABILITIES).build(), ExampleTrees.singleSplitClassifier());
        assertThrows(ConfigException.class, () -> emitter.emit(forest, "model"));
    }

    @Test
    public void testInvalidName() {
        Forest forest = Forests.compile(ForestCompiler.builder().featureCount(2).classCount(2).build(),
                ExampleTrees.singleSplitClassifier());
        assertThrows(ConfigException.class, () -> emitter.emit(forest, "2fast"));
    }

    @Test
    public void testNonFiniteThresholdIsRejected() {
        ForestConfig config = ForestConfig.builder().featureCount(1).classCount(2).build();
        Forest forest = new Forest(Collections.singletonList(NodeRef.internal(0)),
                Collections.singletonList(
                        new DecisionNode(0, Double.POSITIVE_INFINITY, NodeRef.leaf(0), NodeRef.leaf(1))),
                Arrays.asList(new MajorityClassLeaf(0), new MajorityClassLeaf(1)), config);
        assertThrows(IllegalArgumentException.class, () -> emitter.emit(forest, "model"));
    }

    @Tag("functional")
    @Test
    public void testDeepTree() {
        Forest forest = Forests.compile(ForestCompiler.builder().featureCount(4).classCount(2).build(),
                ExampleTrees.chain(5000));
        String code = emitter.emit(forest, "deep");

        int depth = 5000 * CodeWriter.DEFAULT_INDENT_SPACES;
        char[] indent = new char[depth];
        Arrays.fill(indent, ' ');
        assertTrue(code.contains("\n" + new String(indent) + "  return "));
    }
}
