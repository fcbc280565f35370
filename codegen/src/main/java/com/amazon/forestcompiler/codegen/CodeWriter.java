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

import static com.amazon.forestcompiler.CommonUtils.checkState;

/**
 * Accumulates generated source one line at a time, indenting each line by the
 * current nesting depth.
 */
public class CodeWriter {

    public static final int DEFAULT_INDENT_SPACES = 2;

    private final StringBuilder out = new StringBuilder();

    private final int indentSpaces;

    private int depth;

    public CodeWriter() {
        this(DEFAULT_INDENT_SPACES);
    }

    public CodeWriter(int indentSpaces) {
        this.indentSpaces = indentSpaces;
    }

    public CodeWriter line(String text) {
        return line(depth, text);
    }

    /**
     * Writes a line at an explicit depth, leaving the current depth unchanged.
     */
    public CodeWriter line(int lineDepth, String text) {
        for (int i = 0; i < lineDepth * indentSpaces; i++) {
            out.append(' ');
        }
        out.append(text).append('\n');
        return this;
    }

    public CodeWriter blankLine() {
        out.append('\n');
        return this;
    }

    /**
     * Writes the line and indents the lines that follow.
     */
    public CodeWriter open(String text) {
        line(text);
        depth++;
        return this;
    }

    /**
     * Outdents and writes the line.
     */
    public CodeWriter close(String text) {
        checkState(depth > 0, "no open block to close");
        depth--;
        return line(text);
    }

    public int getDepth() {
        return depth;
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
