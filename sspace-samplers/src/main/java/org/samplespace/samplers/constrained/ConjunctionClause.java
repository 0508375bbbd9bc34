/*
 * ConjunctionClause.java
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

package org.samplespace.samplers.constrained;

import org.samplespace.annotation.API;
import org.samplespace.conditions.CombinatorType;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Two clauses combined with {@code and} or {@code or}.
 */
@API(API.Status.INTERNAL)
public class ConjunctionClause implements Clause {
    @Nonnull
    private final CombinatorType type;
    @Nonnull
    private final Clause left;
    @Nonnull
    private final Clause right;

    public ConjunctionClause(@Nonnull CombinatorType type, @Nonnull Clause left, @Nonnull Clause right) {
        this.type = type;
        this.left = left;
        this.right = right;
    }

    @Override
    public boolean test(@Nonnull Map<String, Object> configuration) {
        if (type == CombinatorType.AND) {
            return left.test(configuration) && right.test(configuration);
        }
        return left.test(configuration) || right.test(configuration);
    }

    @Nonnull
    @Override
    public Clause withPrefix(@Nonnull String prefix) {
        return new ConjunctionClause(type, left.withPrefix(prefix), right.withPrefix(prefix));
    }

    @Override
    public String toString() {
        return "(" + left + " " + type.getSymbol() + " " + right + ")";
    }
}
