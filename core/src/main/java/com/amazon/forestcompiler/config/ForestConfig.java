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

import static com.amazon.forestcompiler.CommonUtils.checkConfig;

import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Scalar configuration carried by a forest: the shape of the model (features,
 * classes), how leaves are built and how they are serialized, and the numeric
 * type used on the target. Instances are immutable and are created with
 * {@link #builder()}.
 */
@Getter
@EqualsAndHashCode
@ToString
public class ForestConfig {

    public static final NumericType DEFAULT_NUMERIC_TYPE = NumericType.FLOAT_32;

    public static final LeafMode DEFAULT_LEAF_MODE = LeafMode.MAJORITY;

    public static final int DEFAULT_QUANTIZATION_BITS = 8;

    /**
     * leaf bit width meaning "use the natural scalar representation of the payload"
     */
    public static final int NATURAL_LEAF_BIT_WIDTH = 0;

    /**
     * leaf bit width meaning "one IEEE-754 single precision value per scalar"
     */
    public static final int FLOAT_LEAF_BIT_WIDTH = 32;

    public static final int MAX_QUANTIZATION_BITS = 8;

    private final int featureCount;
    private final int classCount;
    private final int leafBitWidth;
    private final NumericType numericType;
    private final LeafMode leafMode;
    private final int quantizationBits;

    protected ForestConfig(Builder builder) {
        this.featureCount = builder.featureCount;
        this.classCount = builder.classCount;
        this.numericType = builder.numericType;
        this.leafMode = builder.leafMode;
        this.quantizationBits = builder.quantizationBits;
        this.leafBitWidth = builder.leafBitWidth.orElse(defaultLeafBitWidth(builder.leafMode));
    }

    /**
     * Widths 0 and 32 are fully supported; widths 1 to 8 are reserved for
     * quantized probability tables and are accepted here but refused when leaves
     * are serialized.
     *
     * @param leafBitWidth candidate width
     * @return true if the width may appear in a configuration
     */
    public static boolean isAcceptedLeafBitWidth(int leafBitWidth) {
        return leafBitWidth == NATURAL_LEAF_BIT_WIDTH || leafBitWidth == FLOAT_LEAF_BIT_WIDTH
                || (leafBitWidth >= 1 && leafBitWidth <= MAX_QUANTIZATION_BITS);
    }

    static int defaultLeafBitWidth(LeafMode leafMode) {
        return leafMode == LeafMode.MAJORITY ? NATURAL_LEAF_BIT_WIDTH : FLOAT_LEAF_BIT_WIDTH;
    }

    public boolean isClassifier() {
        return leafMode.isClassification();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder preloaded with the values of this configuration
     */
    public Builder toBuilder() {
        return new Builder().featureCount(featureCount).classCount(classCount).leafBitWidth(leafBitWidth)
                .numericType(numericType).leafMode(leafMode).quantizationBits(quantizationBits);
    }

    public static class Builder {

        private int featureCount;
        private int classCount;
        private Optional<Integer> leafBitWidth = Optional.empty();
        private NumericType numericType = DEFAULT_NUMERIC_TYPE;
        private LeafMode leafMode = DEFAULT_LEAF_MODE;
        private int quantizationBits = DEFAULT_QUANTIZATION_BITS;

        public Builder featureCount(int featureCount) {
            this.featureCount = featureCount;
            return this;
        }

        public Builder classCount(int classCount) {
            this.classCount = classCount;
            return this;
        }

        public Builder leafBitWidth(int leafBitWidth) {
            this.leafBitWidth = Optional.of(leafBitWidth);
            return this;
        }

        public Builder numericType(NumericType numericType) {
            this.numericType = numericType;
            return this;
        }

        public Builder leafMode(LeafMode leafMode) {
            this.leafMode = leafMode;
            return this;
        }

        public Builder quantizationBits(int quantizationBits) {
            this.quantizationBits = quantizationBits;
            return this;
        }

        public ForestConfig build() {
            checkConfig(featureCount > 0, "featureCount must be greater than 0");
            checkConfig(numericType != null, "numericType must not be null");
            checkConfig(leafMode != null, "leafMode must not be null");
            checkConfig(classCount >= 0, "classCount must not be negative");
            checkConfig(!leafMode.isClassification() || classCount > 0,
                    "classCount must be greater than 0 for " + leafMode + " leaves");
            checkConfig(quantizationBits >= 1 && quantizationBits <= MAX_QUANTIZATION_BITS,
                    "quantizationBits must be between 1 and " + MAX_QUANTIZATION_BITS);
            leafBitWidth.ifPresent(width -> checkConfig(isAcceptedLeafBitWidth(width),
                    "leafBitWidth must be 0, 32 or between 1 and 8, got " + width));
            return new ForestConfig(this);
        }
    }
}
