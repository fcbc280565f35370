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

import static com.amazon.forestcompiler.CommonUtils.checkConfig;
import static com.amazon.forestcompiler.CommonUtils.checkNotNull;
import static com.amazon.forestcompiler.CommonUtils.validateStructure;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;

import lombok.AccessLevel;
import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.forestcompiler.config.ForestConfig;
import com.amazon.forestcompiler.config.LeafMode;
import com.amazon.forestcompiler.config.ModelKind;
import com.amazon.forestcompiler.config.NumericType;
import com.amazon.forestcompiler.forest.Forest;
import com.amazon.forestcompiler.forest.ForestMerger;
import com.amazon.forestcompiler.forest.ForestValidator;
import com.amazon.forestcompiler.forest.LeafDeduplicator;
import com.amazon.forestcompiler.tree.FlatTree;
import com.amazon.forestcompiler.tree.SourceTree;
import com.amazon.forestcompiler.tree.TreeFlattener;

/**
 * Runs the compilation pipeline over a trained ensemble: every source tree is
 * flattened, the flat trees are merged into one {@link Forest}, and equal
 * leaves are collapsed. The result is validated and ready to be handed to a
 * code generator.
 *
 * Instances are created with {@link #builder()}. The model kind picks the leaf
 * construction and the leaf bit width unless they are set explicitly.
 *
 * When parallel execution is enabled the trees are flattened on a private
 * {@link ForkJoinPool}. The flat trees are always merged in input order, so
 * the result does not depend on the execution mode.
 */
@Getter
public class ForestCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(ForestCompiler.class);

    public static final ModelKind DEFAULT_MODEL_KIND = ModelKind.CLASSIFIER;

    public static final boolean DEFAULT_DEDUPLICATION_ENABLED = true;

    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    private final ModelKind modelKind;

    private final ForestConfig config;

    private final boolean deduplicationEnabled;

    private final boolean parallelExecutionEnabled;

    /**
     * Number of threads used to flatten trees when parallel execution is enabled.
     */
    private final int threadPoolSize;

    @Getter(AccessLevel.NONE)
    private final TreeFlattener flattener;

    @Getter(AccessLevel.NONE)
    private final ForestMerger merger;

    @Getter(AccessLevel.NONE)
    private final LeafDeduplicator deduplicator;

    @Getter(AccessLevel.NONE)
    private ForkJoinPool forkJoinPool;

    protected ForestCompiler(Builder<?> builder) {
        this(builder, new TreeFlattener(builder.config), new ForestMerger(), new LeafDeduplicator());
    }

    ForestCompiler(Builder<?> builder, TreeFlattener flattener, ForestMerger merger, LeafDeduplicator deduplicator) {
        this.modelKind = builder.modelKind;
        this.config = builder.config;
        this.deduplicationEnabled = builder.deduplicationEnabled;
        this.parallelExecutionEnabled = builder.parallelExecutionEnabled;
        this.threadPoolSize = builder.resolvedThreadPoolSize;
        this.flattener = flattener;
        this.merger = merger;
        this.deduplicator = deduplicator;
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * Compiles an ensemble.
     *
     * @param trees the trees of the ensemble, in the order their roots should
     *              appear in the compiled forest
     * @return the validated compiled forest
     * @throws ValidationException       if a tree is malformed
     * @throws CapacityException         if the forest has too many decision nodes
     * @throws UnsupportedShapeException if a tree has more than one output
     */
    public Forest compile(List<SourceTree> trees) {
        checkNotNull(trees, "trees must not be null");
        validateStructure(!trees.isEmpty(), "a forest needs at least one tree");

        List<FlatTree> flatTrees = parallelExecutionEnabled ? flattenParallel(trees) : flattenSequential(trees);
        Forest forest = merger.merge(flatTrees, config);
        if (deduplicationEnabled) {
            forest = deduplicator.deduplicate(forest);
        }
        ForestValidator.validate(forest);

        LOG.info("compiled {} trees into {} decision nodes and {} leaves", forest.getTreeCount(),
                forest.getDecisionNodes().size(), forest.getLeaves().size());
        return forest;
    }

    List<FlatTree> flattenSequential(List<SourceTree> trees) {
        List<FlatTree> result = new ArrayList<>(trees.size());
        for (int i = 0; i < trees.size(); i++) {
            result.add(flattenTree(trees.get(i), i));
        }
        return result;
    }

    List<FlatTree> flattenParallel(List<SourceTree> trees) {
        List<Integer> indexes = new ArrayList<>(trees.size());
        for (int i = 0; i < trees.size(); i++) {
            indexes.add(i);
        }
        return submitAndJoin(() -> indexes.parallelStream().map(i -> flattenTree(trees.get(i), i))
                .collect(Collectors.toList()));
    }

    private FlatTree flattenTree(SourceTree tree, int treeIndex) {
        checkNotNull(tree, "tree " + treeIndex + " must not be null");
        try {
            FlatTree flatTree = flattener.flatten(tree);
            LOG.debug("flattened tree {}: {} source nodes, {} decision nodes, {} leaves", treeIndex,
                    tree.getNodeCount(), flatTree.getDecisionNodes().size(), flatTree.getLeaves().size());
            return flatTree;
        } catch (ValidationException e) {
            throw new ValidationException(e.getMessage(), treeIndex);
        }
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        if (forkJoinPool == null) {
            forkJoinPool = new ForkJoinPool(threadPoolSize);
        }
        return forkJoinPool.submit(callable).join();
    }

    public static class Builder<T extends Builder<T>> {

        private ModelKind modelKind = DEFAULT_MODEL_KIND;
        private Optional<LeafMode> leafMode = Optional.empty();
        private Optional<Integer> leafBitWidth = Optional.empty();
        private NumericType numericType = ForestConfig.DEFAULT_NUMERIC_TYPE;
        private int featureCount;
        private int classCount;
        private int quantizationBits = ForestConfig.DEFAULT_QUANTIZATION_BITS;
        private boolean deduplicationEnabled = DEFAULT_DEDUPLICATION_ENABLED;
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();
        private ForestConfig config;
        private int resolvedThreadPoolSize;

        public T modelKind(ModelKind modelKind) {
            this.modelKind = modelKind;
            return (T) this;
        }

        public T leafMode(LeafMode leafMode) {
            this.leafMode = Optional.ofNullable(leafMode);
            return (T) this;
        }

        public T leafBitWidth(int leafBitWidth) {
            this.leafBitWidth = Optional.of(leafBitWidth);
            return (T) this;
        }

        public T numericType(NumericType numericType) {
            this.numericType = numericType;
            return (T) this;
        }

        public T featureCount(int featureCount) {
            this.featureCount = featureCount;
            return (T) this;
        }

        public T classCount(int classCount) {
            this.classCount = classCount;
            return (T) this;
        }

        public T quantizationBits(int quantizationBits) {
            this.quantizationBits = quantizationBits;
            return (T) this;
        }

        public T deduplicationEnabled(boolean deduplicationEnabled) {
            this.deduplicationEnabled = deduplicationEnabled;
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        private int resolveThreadPoolSize() {
            if (!parallelExecutionEnabled) {
                return 0;
            }
            int size = threadPoolSize.orElse(Runtime.getRuntime().availableProcessors() - 1);
            return Math.max(size, 1);
        }

        public ForestCompiler build() {
            checkConfig(modelKind != null, "modelKind must not be null");
            LeafMode mode = leafMode.orElse(modelKind.getDefaultLeafMode());
            if (modelKind == ModelKind.CLASSIFIER) {
                checkConfig(mode.isClassification(), "a classifier cannot use " + mode + " leaves");
            } else {
                checkConfig(mode == LeafMode.VALUE, "a regressor can only use " + LeafMode.VALUE + " leaves");
                checkConfig(classCount == 0, "classCount must be 0 for a regressor");
            }
            threadPoolSize.ifPresent(size -> checkConfig(size > 0, "threadPoolSize must be greater than 0"));
            checkConfig(parallelExecutionEnabled || !threadPoolSize.isPresent(),
                    "threadPoolSize can only be set when parallel execution is enabled");

            ForestConfig.Builder configBuilder = ForestConfig.builder().featureCount(featureCount)
                    .classCount(classCount).numericType(numericType).leafMode(mode)
                    .quantizationBits(quantizationBits);
            if (leafBitWidth.isPresent()) {
                configBuilder.leafBitWidth(leafBitWidth.get());
            } else if (mode == modelKind.getDefaultLeafMode()) {
                configBuilder.leafBitWidth(modelKind.getDefaultLeafBitWidth());
            }
            config = configBuilder.build();
            resolvedThreadPoolSize = resolveThreadPoolSize();
            return new ForestCompiler(this);
        }
    }
}
