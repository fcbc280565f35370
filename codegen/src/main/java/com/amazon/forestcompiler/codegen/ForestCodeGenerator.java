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

import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.forestcompiler.forest.Forest;
import com.amazon.forestcompiler.forest.ForestValidator;

/**
 * Generates C source for a compiled forest using one or more
 * {@link EmitStrategy strategies}. The output of every selected strategy is
 * preceded by a blank line and the strategies are written in declaration
 * order, loadable before inline, whatever order they were requested in.
 */
public class ForestCodeGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(ForestCodeGenerator.class);

    static final String SECTION_SEPARATOR = "\n\n";

    private final Map<EmitStrategy, ICodeEmitter> emitters;

    private final CsvEmitter csvEmitter;

    public ForestCodeGenerator() {
        this(new LoadableEmitter(), new InlinedEmitter(), new CsvEmitter());
    }

    public ForestCodeGenerator(ICodeEmitter loadableEmitter, ICodeEmitter inlinedEmitter, CsvEmitter csvEmitter) {
        emitters = new EnumMap<>(EmitStrategy.class);
        emitters.put(EmitStrategy.LOADABLE, checkNotNull(loadableEmitter, "loadableEmitter must not be null"));
        emitters.put(EmitStrategy.INLINE, checkNotNull(inlinedEmitter, "inlinedEmitter must not be null"));
        this.csvEmitter = checkNotNull(csvEmitter, "csvEmitter must not be null");
    }

    /**
     * @param forest     a compiled forest
     * @param name       prefix of every generated symbol, a valid C identifier
     * @param strategies at least one strategy
     * @return the concatenated source of all selected strategies
     * @throws com.amazon.forestcompiler.ConfigException if no strategy is
     *                                                   selected, the name is not
     *                                                   a C identifier, or the
     *                                                   forest cannot be emitted
     *                                                   with a selected strategy
     */
    public String generate(Forest forest, String name, Set<EmitStrategy> strategies) {
        checkNotNull(forest, "forest must not be null");
        checkNotNull(strategies, "strategies must not be null");
        checkConfig(!strategies.isEmpty(), "at least one emit strategy must be selected");
        CLiterals.checkIdentifier(name);
        ForestValidator.validate(forest);

        StringBuilder code = new StringBuilder();
        for (EmitStrategy strategy : EnumSet.copyOf(strategies)) {
            String section = emitters.get(strategy).emit(forest, name);
            LOG.debug("{} strategy produced {} characters for {}", strategy, section.length(), name);
            code.append(SECTION_SEPARATOR).append(section);
        }
        return code.toString();
    }

    /**
     * Same as {@link #generate(Forest, String, Set)} with strategies given by
     * name, e.g. {@code "loadable"} or {@code "inline"}.
     */
    public String generate(Forest forest, String name, Collection<String> strategyNames) {
        checkNotNull(strategyNames, "strategyNames must not be null");
        Set<EmitStrategy> strategies = EnumSet.noneOf(EmitStrategy.class);
        for (String strategyName : strategyNames) {
            strategies.add(EmitStrategy.fromName(strategyName));
        }
        return generate(forest, name, strategies);
    }

    public String toCsv(Forest forest) {
        checkNotNull(forest, "forest must not be null");
        ForestValidator.validate(forest);
        return csvEmitter.emit(forest);
    }
}
