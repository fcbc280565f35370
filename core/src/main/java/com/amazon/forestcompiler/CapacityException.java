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

/**
 * Thrown when a forest holds more nodes than the signed 16-bit child references
 * of the emitted table can address.
 */
public class CapacityException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final long count;
    private final long limit;

    public CapacityException(String what, long count, long limit) {
        super(String.format("%s: %d exceeds the supported maximum of %d", what, count, limit));
        this.count = count;
        this.limit = limit;
    }

    public long getCount() {
        return count;
    }

    public long getLimit() {
        return limit;
    }
}
