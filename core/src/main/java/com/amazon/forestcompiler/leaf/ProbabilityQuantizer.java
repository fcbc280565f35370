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

import static com.amazon.forestcompiler.CommonUtils.checkArgument;
import static com.amazon.forestcompiler.CommonUtils.checkNotNull;

/**
 * Quantizes class probabilities into small unsigned integer codes.
 *
 * With {@code bits} bits there are {@code steps = 2^bits - 1} uniform bin edges
 * over [0, 1], {@code edge[k] = k / steps} for {@code k = 0 .. steps - 1}. The
 * code of a value is the number of edges that are less than or equal to it, so
 * a value at or above {@code edge[k]} gets a code of at least {@code k + 1}.
 * Negative values get 0 and values of 1 or more get {@code steps}. Codes never
 * decrease as the value increases.
 */
public class ProbabilityQuantizer {

    public static final int MIN_BITS = 1;
    public static final int MAX_BITS = 8;

    private ProbabilityQuantizer() {
    }

    /**
     * Unlike the variant with integer edges {@code 0 .. steps - 1}, the edges here
     * are the fractions {@code k / steps}, so probabilities spread over every code.
     *
     * @param probabilities class probabilities in [0, 1]
     * @param bits          code width, between {@link #MIN_BITS} and {@link #MAX_BITS}
     * @return one code per probability
     */
    public static int[] quantize(double[] probabilities, int bits) {
        checkNotNull(probabilities, "probabilities must not be null");
        checkArgument(bits >= MIN_BITS && bits <= MAX_BITS, "bits must be between 1 and 8");
        int steps = (1 << bits) - 1;
        int[] codes = new int[probabilities.length];
        for (int i = 0; i < probabilities.length; i++) {
            codes[i] = digitize(probabilities[i], steps);
        }
        return codes;
    }

    static int digitize(double value, int steps) {
        if (!(value >= 0)) {
            return 0;
        }
        int code = (int) Math.min(steps, Math.floor(value * steps) + 1);
        // correct for rounding in value * steps against the edges k / steps
        while (code < steps && (double) code / steps <= value) {
            code++;
        }
        while (code > 0 && (double) (code - 1) / steps > value) {
            code--;
        }
        return code;
    }

    /**
     * Scales a vector of non-negative class statistics so that it sums to one. A
     * vector summing to zero is returned unchanged.
     *
     * @param values class statistics, e.g. sample counts or weights
     * @return a new array holding the normalized values
     */
    public static double[] normalize(double[] values) {
        checkNotNull(values, "values must not be null");
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = sum > 0 ? values[i] / sum : values[i];
        }
        return result;
    }
}
