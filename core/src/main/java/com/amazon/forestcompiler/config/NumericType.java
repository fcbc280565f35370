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

/**
 * The numeric type used on the target for features and thresholds.
 */
public enum NumericType {

    FLOAT_32("float", false),

    FLOAT_64("double", false),

    INT_32("int32_t", true),

    INT_16("int16_t", true);

    private final String cType;
    private final boolean integral;

    NumericType(String cType, boolean integral) {
        this.cType = cType;
        this.integral = integral;
    }

    /**
     * @return the C type name used for feature vectors and thresholds
     */
    public String getCType() {
        return cType;
    }

    public boolean isIntegral() {
        return integral;
    }
}
