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

/**
 * The statistics stored in a leaf. Payloads are immutable values; two payloads
 * are equal when their contents are equal, regardless of which source leaf they
 * came from.
 */
public abstract class LeafPayload {

    /**
     * @return the payload as a sequence of scalars, in the order they are
     *         serialized
     */
    public abstract double[] toScalars();

    public abstract <R> R accept(ILeafVisitor<R> visitor);
}
