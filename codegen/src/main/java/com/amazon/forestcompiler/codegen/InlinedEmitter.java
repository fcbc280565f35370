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

import static com.amazon.forestcompiler.CommonUtils.checkConfig;
import static com.amazon.forestcompiler.CommonUtils.checkNotNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.amazon.forestcompiler.ConfigException;
import com.amazon.forestcompiler.config.ForestConfig;
import com.amazon.forestcompiler.config.LeafMode;
import com.amazon.forestcompiler.forest.Forest;
import com.amazon.forestcompiler.leaf.ILeafVisitor;
import com.amazon.forestcompiler.leaf.MajorityClassLeaf;
import com.amazon.forestcompiler.leaf.QuantizedProbabilitiesLeaf;
import com.amazon.forestcompiler.leaf.RegressionValueLeaf;
import com.amazon.forestcompiler.tree.DecisionNode;
import com.amazon.forestcompiler.tree.NodeRef;

/**
 * Emits one {@code static inline} C function per tree, with every decision
 * node compiled into an {@code if/else} on one feature, and a
 * {@code <name>_predict} function combining the trees.
 *
 * For classifiers each tree returns a class index and the predict function
 * returns the class with the most votes; on a tie the lowest class index wins.
 * For regressors each tree returns a float and the predict function returns
 * their mean. Probability leaves cannot be inlined.
 */
public class InlinedEmitter implements ICodeEmitter {

    @Override
    public String emit(Forest forest, String name) {
        checkNotNull(forest, "forest must not be null");
        CLiterals.checkIdentifier(name);
        ForestConfig config = forest.getConfig();
        checkConfig(config.getLeafMode() != LeafMode.PROBABILITIES,
                "probability leaves cannot be inlined, use the loadable strategy");
        boolean classifier = config.isClassifier();
        checkConfig(!classifier || config.getClassCount() >= 1, "a classifier needs at least one class");

        String ctype = config.getNumericType().getCType();
        String returnType = classifier ? "int32_t" : "float";
        List<String> treeNames = new ArrayList<>(forest.getTreeCount());

        CodeWriter writer = new CodeWriter();
        for (int i = 0; i < forest.getTreeCount(); i++) {
            String treeName = name + "_tree_" + i;
            treeNames.add(treeName);
            writer.open("static inline " + returnType + " " + treeName + "(const " + ctype
                    + " *features, int32_t features_length) {");
            writeTree(writer, forest, forest.getRoots().get(i));
            writer.close("}").blankLine();
        }

        if (classifier) {
            writeVote(writer, name, ctype, config.getClassCount(), treeNames);
        } else {
            writeAverage(writer, name, ctype, treeNames);
        }
        return writer.toString();
    }

    /**
     * Walks the tree depth first with an explicit stack, left branch before
     * right branch.
     */
    private static void writeTree(CodeWriter writer, Forest forest, NodeRef root) {
        LeafLiteral leafLiteral = new LeafLiteral();
        Deque<Step> stack = new ArrayDeque<>();
        stack.push(new Step(root, null, writer.getDepth()));
        while (!stack.isEmpty()) {
            Step step = stack.pop();
            if (step.text != null) {
                writer.line(step.depth, step.text);
            } else if (step.ref.isLeaf()) {
                writer.line(step.depth, "return " + forest.getLeaf(step.ref.getIndex()).accept(leafLiteral) + ";");
            } else {
                DecisionNode node = forest.getDecisionNode(step.ref.getIndex());
                String threshold = CLiterals.threshold(node.getThreshold(), forest.getConfig().getNumericType());
                stack.push(new Step(null, "}", step.depth));
                stack.push(new Step(node.getRight(), null, step.depth + 1));
                stack.push(new Step(null, "} else {", step.depth));
                stack.push(new Step(node.getLeft(), null, step.depth + 1));
                stack.push(new Step(null, "if (features[" + node.getFeatureIndex() + "] < " + threshold + ") {",
                        step.depth));
            }
        }
    }

    private static void writeVote(CodeWriter writer, String name, String ctype, int classCount,
            List<String> treeNames) {
        writer.open("int32_t " + name + "_predict(const " + ctype + " *features, int32_t features_length) {");
        writer.line("int32_t votes[" + classCount + "] = {0,};");
        writer.line("int32_t _class = -1;");
        writer.blankLine();
        for (String treeName : treeNames) {
            writer.line("_class = " + treeName + "(features, features_length); votes[_class] += 1;");
        }
        writer.blankLine();
        writer.line("int32_t most_voted_class = -1;");
        writer.line("int32_t most_voted_votes = 0;");
        writer.open("for (int32_t i = 0; i < " + classCount + "; i++) {");
        writer.open("if (votes[i] > most_voted_votes) {");
        writer.line("most_voted_class = i;");
        writer.line("most_voted_votes = votes[i];");
        writer.close("}");
        writer.close("}");
        writer.line("return most_voted_class;");
        writer.close("}");
    }

    private static void writeAverage(CodeWriter writer, String name, String ctype, List<String> treeNames) {
        writer.open("float " + name + "_predict(const " + ctype + " *features, int32_t features_length) {");
        writer.line("float avg = 0;");
        writer.blankLine();
        for (String treeName : treeNames) {
            writer.line("avg += " + treeName + "(features, features_length);");
        }
        writer.blankLine();
        writer.line("return avg / " + treeNames.size() + ";");
        writer.close("}");
    }

    static class LeafLiteral implements ILeafVisitor<String> {

        @Override
        public String visitMajorityClass(MajorityClassLeaf leaf) {
            return Integer.toString(leaf.getClassIndex());
        }

        @Override
        public String visitRegressionValue(RegressionValueLeaf leaf) {
            return CLiterals.floatLiteral(leaf.getValue());
        }

        @Override
        public String visitQuantizedProbabilities(QuantizedProbabilitiesLeaf leaf) {
            throw new ConfigException("probability leaves cannot be inlined");
        }
    }

    /**
     * either a reference to expand or a line of text to write
     */
    private static class Step {
        private final NodeRef ref;
        private final String text;
        private final int depth;

        Step(NodeRef ref, String text, int depth) {
            this.ref = ref;
            this.text = text;
            this.depth = depth;
        }
    }
}
