/*
 * CompactNotation.java
 *
 * This source file is part of the Sample Space open source project
 *
 * Copyright 2020-2026 Sample Space project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.samplespace.notation;

import org.samplespace.annotation.API;
import org.samplespace.conditions.Condition;
import org.samplespace.expressions.Dimension;
import org.samplespace.expressions.Space;
import org.samplespace.logging.KeyValueLogMessage;
import org.samplespace.logging.LogMessageKeys;
import org.samplespace.serialization.DimensionConstructors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;

/**
 * Entry points of the compact notation, a dense textual form writing every dimension as one call.
 *
 * <pre>{@code
 * Space space = new Space();
 * CompactNotation.parseInto(space, "optimizer", "categorical(values=['sgd', 'adam'])");
 * CompactNotation.parseInto(space, "lr", "loguniform(lower=1, upper=2, condition=eq(optimizer, 'adam'))");
 * CompactNotation.parseDefinition(space, "momentum ~ uniform(0, 1)");
 * }</pre>
 *
 * A whole space renders to a nested mapping of such strings, which {@link Space#fromMap(Map)} reads back.
 */
@API(API.Status.STABLE)
public final class CompactNotation {
    private static final Logger LOGGER = LoggerFactory.getLogger(CompactNotation.class);
    private static final NotationInterpreter INTERPRETER = new NotationInterpreter(DimensionConstructors.defaults());

    private CompactNotation() {
    }

    /**
     * Add a dimension written in compact notation to a space.
     * @param target the space receiving the dimension
     * @param name the name of the dimension, possibly dotted
     * @param text the dimension in compact notation
     * @return the new dimension, or {@code null} for a directive such as {@code identity}
     * @throws CompactNotationException if the text cannot be read
     */
    @Nullable
    public static Dimension parseInto(@Nonnull Space target, @Nonnull String name, @Nonnull String text) {
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace(KeyValueLogMessage.of("parsing dimension",
                    LogMessageKeys.DIMENSION, name,
                    LogMessageKeys.TEXT, text));
        }
        return INTERPRETER.interpretDimension(target, name, text, new NotationParser(text).parseExpression());
    }

    /**
     * Add a dimension written as {@code name ~ definition} to a space.
     * @param target the space receiving the dimension
     * @param text the definition
     * @return the new dimension, or {@code null} for a directive such as {@code identity}
     * @throws CompactNotationException if the text cannot be read
     */
    @Nullable
    public static Dimension parseDefinition(@Nonnull Space target, @Nonnull String text) {
        final NotationAst.Argument definition = new NotationParser(text).parseDefinition();
        return INTERPRETER.interpretDimension(target, definition.getKeyword(), text, definition.getValue());
    }

    /**
     * Read a condition written in compact notation, as a call ({@code either(eq(a, 1), gt(b, 2))}) or with infix
     * operators ({@code a == 1 | b > 2}).
     * @param text the condition
     * @return the condition
     * @throws CompactNotationException if the text cannot be read
     */
    @Nonnull
    public static Condition parseCondition(@Nonnull String text) {
        return INTERPRETER.interpretCondition(text, new NotationParser(text).parseExpression());
    }

    @Nonnull
    public static Map<String, Object> render(@Nonnull Space space) {
        return NotationRenderer.renderSpace(space);
    }

    @Nonnull
    public static String render(@Nonnull Dimension dimension) {
        return NotationRenderer.renderDimension(dimension);
    }

    @Nonnull
    public static String render(@Nonnull Condition condition) {
        return NotationRenderer.renderCondition(condition);
    }
}
