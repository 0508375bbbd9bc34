/*
 * ComparisonType.java
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
 * The comparisons a {@link LeafCondition} can make between a dimension and a value.
 */
@API(API.Status.STABLE)
public enum ComparisonType {
    EQ("eq", "=="),
    NE("ne", "!="),
    LT("lt", "<"),
    GT("gt", ">"),
    IN("in", "in");

    @Nonnull
    private final String name;
    @Nonnull
    private final String symbol;

    ComparisonType(@Nonnull String name, @Nonnull String symbol) {
        this.name = name;
        this.symbol = symbol;
    }

    /**
     * The operator name used by the persisted forms.
     * @return the operator name
     */
    @Nonnull
    public String getOperatorName() {
        return name;
    }

    @Nonnull
    public String getSymbol() {
        return symbol;
    }

    /**
     * Look up a comparison by operator name. {@code contains} is accepted for {@link #IN}.
     * @param name the operator name
     * @return the comparison
     * @throws SpaceCoreArgumentException if the name is not a comparison
     */
    @Nonnull
    public static ComparisonType fromOperatorName(@Nonnull String name) {
        if ("contains".equals(name)) {
            return IN;
        }
        for (ComparisonType type : values()) {
            if (type.name.equals(name)) {
                return type;
            }
        }
        throw new SpaceCoreArgumentException("unknown comparison operator", LogMessageKeys.OPERATOR, name);
    }

    public static boolean isOperatorName(@Nonnull String name) {
        if ("contains".equals(name)) {
            return true;
        }
        for (ComparisonType type : values()) {
            if (type.name.equals(name)) {
                return true;
            }
        }
        return false;
    }
}
