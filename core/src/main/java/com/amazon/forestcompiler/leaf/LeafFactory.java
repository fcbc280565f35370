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

import static com.amazon.forestcompiler.CommonUtils.checkConfig;
import static com.amazon.forestcompiler.CommonUtils.checkNotNull;

import com.amazon.forestcompiler.UnsupportedShapeException;
import com.amazon.forestcompiler.config.ForestConfig;

/**
 * Builds the payload of a leaf from the value vector of a source leaf. One
 * factory is picked per compilation from the configured
 * {@link com.amazon.forestcompiler.config.LeafMode}.
 */
public abstract class LeafFactory {

    public abstract LeafPayload create(double[] values);

    public static LeafFactory forConfig(ForestConfig config) {
        checkNotNull(config, "config must not be null");
        switch (config.getLeafMode()) {
        case MAJORITY:
            return new MajorityLeafFactory(config.getClassCount());
        case VALUE:
            return new ValueLeafFactory();
        case PROBABILITIES:
            return new ProbabilitiesLeafFactory(config.getClassCount(), config.getQuantizationBits());
        default:
            throw new IllegalStateException("unknown leaf mode " + config.getLeafMode());
        }
    }

    /**
     * Class statistics hold exactly one entry per configured class.
     */
    static void checkClassCount(double[] values, int classCount) {
        checkConfig(values.length == classCount, String.format(
                "a leaf holds %d class values but the forest is configured for %d classes", values.length,
                classCount));
    }

    static class MajorityLeafFactory extends LeafFactory {

        private final int classCount;

        MajorityLeafFactory(int classCount) {
            this.classCount = classCount;
        }

        /**
         * The first maximal entry wins, so ties go to the lowest class index.
         */
        @Override
        public LeafPayload create(double[] values) {
            checkClassCount(values, classCount);
            int best = 0;
            for (int i = 1; i < values.length; i++) {
                if (values[i] > values[best]) {
                    best = i;
                }
            }
            return new MajorityClassLeaf(best);
        }
    }

    static class ValueLeafFactory extends LeafFactory {

        @Override
        public LeafPayload create(double[] values) {
            if (values.length != 1) {
                throw new UnsupportedShapeException(
                        "a regression leaf must hold exactly one value, got " + values.length);
            }
            return new RegressionValueLeaf(values[0]);
        }
    }

    static class ProbabilitiesLeafFactory extends LeafFactory {

        private final int classCount;
        private final int bits;

        ProbabilitiesLeafFactory(int classCount, int bits) {
            this.classCount = classCount;
            this.bits = bits;
        }

        @Override
        public LeafPayload create(double[] values) {
            checkClassCount(values, classCount);
            return new QuantizedProbabilitiesLeaf(
                    ProbabilityQuantizer.quantize(ProbabilityQuantizer.normalize(values), bits));
        }
    }
}
