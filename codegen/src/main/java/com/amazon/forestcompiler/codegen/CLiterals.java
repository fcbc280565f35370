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

import static com.amazon.forestcompiler.CommonUtils.checkArgument;
import static com.amazon.forestcompiler.CommonUtils.checkConfig;
import static com.amazon.forestcompiler.CommonUtils.checkNotNull;

import java.util.regex.Pattern;

import com.amazon.forestcompiler.config.NumericType;

/**
 * Formatting of C identifiers and literals.
 */
public class CLiterals {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private CLiterals() {
    }

    /**
     * @param name a name used as a prefix of generated C symbols
     * @throws com.amazon.forestcompiler.ConfigException if the name is not a valid
     *                                                   C identifier
     */
    public static void checkIdentifier(String name) {
        checkConfig(name != null && IDENTIFIER.matcher(name).matches(),
                "'" + name + "' is not a valid C identifier");
    }

    /**
     * Renders a threshold in the numeric type of the feature vector. For integer
     * types the threshold is rounded up, so {@code x < ceil(t)} holds exactly when
     * {@code x < t} for every integer {@code x}.
     *
     * @param threshold   the threshold of a decision node
     * @param numericType the type of the feature vector
     * @return the C literal
     */
    public static String threshold(double threshold, NumericType numericType) {
        checkNotNull(numericType, "numericType must not be null");
        checkArgument(Double.isFinite(threshold), "threshold must be finite, got " + threshold);
        if (numericType.isIntegral()) {
            return Long.toString(integral(threshold, numericType));
        }
        return numericType == NumericType.FLOAT_64 ? Double.toString(threshold) : floatLiteral(threshold);
    }

    /**
     * @param value a finite value
     * @return the value as a single precision C literal, e.g. {@code 0.5f}
     */
    public static String floatLiteral(double value) {
        checkArgument(Double.isFinite(value), "value must be finite, got " + value);
        float narrowed = (float) value;
        checkArgument(Float.isFinite(narrowed), "value " + value + " does not fit in a float");
        return Float.toString(narrowed) + "f";
    }

    private static long integral(double threshold, NumericType numericType) {
        long min = numericType == NumericType.INT_16 ? Short.MIN_VALUE : Integer.MIN_VALUE;
        long max = numericType == NumericType.INT_16 ? Short.MAX_VALUE : Integer.MAX_VALUE;
        double rounded = Math.ceil(threshold);
        checkArgument(rounded >= min && rounded <= max,
                "threshold " + threshold + " is outside the range of " + numericType.getCType());
        return (long) rounded;
    }
}
