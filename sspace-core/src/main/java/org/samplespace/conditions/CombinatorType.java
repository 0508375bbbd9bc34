/*
 * CombinatorType.java
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

package org.samplespace.conditions;

import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.annotation.API;
import org.samplespace.logging.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * The ways a {@link CompositeCondition} combines two conditions.
 */
@API(API.Status.STABLE)
public enum CombinatorType {
    AND("and", "both", "&"),
    OR("or", "either", "|");

    @Nonnull
    private final String name;
    @Nonnull
    private final String functionName;
    @Nonnull
    private final String symbol;

    CombinatorType(@Nonnull String name, @Nonnull String functionName, @Nonnull String symbol) {
        this.name = name;
        this.functionName = functionName;
        this.symbol = symbol;
    }

    /**
     * The operator name used by the canonical form.
     * @return the operator name
     */
    @Nonnull
    public String getOperatorName() {
        return name;
    }

    /**
     * The function name used by the compact notation.
     * @return the function name
     */
    @Nonnull
    public String getFunctionName() {
        return functionName;
    }

    @Nonnull
    public String getSymbol() {
        return symbol;
    }

    /**
     * Look up a combinator by operator or function name.
     * @param name {@code and}, {@code both}, {@code or} or {@code either}
     * @return the combinator
     * @throws SpaceCoreArgumentException if the name is not a combinator
     */
    @Nonnull
    public static CombinatorType fromOperatorName(@Nonnull String name) {
        for (CombinatorType type : values()) {
            if (type.name.equals(name) || type.functionName.equals(name)) {
                return type;
            }
        }
        throw new SpaceCoreArgumentException("unknown combinator operator", LogMessageKeys.OPERATOR, name);
    }

    public static boolean isOperatorName(@Nonnull String name) {
        for (CombinatorType type : values()) {
            if (type.name.equals(name) || type.functionName.equals(name)) {
                return true;
            }
        }
        return false;
    }
}
