/*
 * Dimension.java
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

package org.samplespace.expressions;

import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.annotation.API;
import org.samplespace.conditions.Condition;
import org.samplespace.conditions.Conditions;
import org.samplespace.conditions.LeafCondition;
import org.samplespace.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Objects;

/**
 * A named node of a space tree. Every node except {@link Space} is a leaf parameter.
 *
 * <p>
 * A dimension may carry a condition, which gates whether it is active in a sample, and a forbidden clause,
 * whose truth excludes a sampled configuration. The comparison methods ({@link #eq}, {@link #lt}, ...) do not
 * compare anything: they build a {@link LeafCondition} referring to this dimension, for use with
 * {@link #enableIf} or {@link #forbid} on another dimension.
 * </p>
 *
 * <pre>{@code
 * Space space = new Space();
 * CategoricalDimension optimizer = space.categorical("optimizer", List.of("sgd", "adam"));
 * ContinuousDimension momentum = space.uniform("momentum", 0, 1);
 * momentum.enableIf(optimizer.eq("sgd"));
 * }</pre>
 *
 * The set of kinds is closed: subclasses only live in this package.
 */
@API(API.Status.STABLE)
public abstract class Dimension {
    @Nonnull
    private final String name;
    @Nullable
    private final Space space;
    @Nullable
    private Condition condition;
    @Nullable
    private Condition forbidden;

    Dimension(@Nonnull String name, @Nullable Space space) {
        this.name = Objects.requireNonNull(name);
        this.space = space;
    }

    /**
     * The local name of this dimension within the space holding it.
     * @return the local name
     */
    @Nonnull
    public String getName() {
        return name;
    }

    /**
     * The space this dimension was created in. This is a lookup reference, not ownership.
     * @return the enclosing space or {@code null} for a root space
     */
    @Nullable
    public Space getSpace() {
        return space;
    }

    /**
     * The dotted path of this dimension from the root of its tree.
     * @return the path, or the empty string for a root space
     */
    @Nonnull
    public String getPath() {
        if (space == null) {
            return name;
        }
        final String prefix = space.getPath();
        return prefix.isEmpty() ? name : prefix + Space.DELIMITER + name;
    }

    public abstract <T> T accept(@Nonnull DimensionVisitor<T> visitor);

    @Nullable
    public Condition getCondition() {
        return condition;
    }

    @Nullable
    public Condition getForbidden() {
        return forbidden;
    }

    /**
     * Enable this dimension only when the condition holds. A dimension takes one condition; combine several
     * with {@link Conditions#both} or {@link Conditions#either}.
     * @param condition the enablement condition
     * @throws SpaceCoreArgumentException if a condition is already set
     */
    public void enableIf(@Nonnull Condition condition) {
        checkMutable();
        if (this.condition != null) {
            throw new SpaceCoreArgumentException("condition already set, use either or both to combine conditions",
                    LogMessageKeys.DIMENSION, getPath());
        }
        this.condition = Objects.requireNonNull(condition);
    }

    /**
     * Exclude configurations for which the clause holds. Successive clauses are combined with {@code and}.
     * @param clause the forbidden clause
     */
    public void forbid(@Nonnull Condition clause) {
        checkMutable();
        Objects.requireNonNull(clause);
        this.forbidden = forbidden == null ? clause : Conditions.both(forbidden, clause);
    }

    /**
     * Forbid this dimension from taking the given value.
     * @param value the forbidden value
     */
    public void forbidEqual(@Nullable Object value) {
        forbid(eq(value));
    }

    /**
     * Forbid this dimension from taking any of the given values.
     * @param values the forbidden values
     */
    public void forbidIn(@Nonnull Collection<?> values) {
        forbid(in(values));
    }

    @Nonnull
    public LeafCondition eq(@Nullable Object value) {
        return Conditions.eq(this, value);
    }

    @Nonnull
    public LeafCondition ne(@Nullable Object value) {
        return Conditions.ne(this, value);
    }

    @Nonnull
    public LeafCondition lt(@Nonnull Object value) {
        return Conditions.lt(this, value);
    }

    @Nonnull
    public LeafCondition gt(@Nonnull Object value) {
        return Conditions.gt(this, value);
    }

    @Nonnull
    public LeafCondition in(@Nonnull Collection<?> values) {
        return Conditions.contains(this, values);
    }

    void checkMutable() {
        if (space != null) {
            space.checkMutable();
        }
    }

    boolean sameDecorations(@Nonnull Dimension other) {
        return Objects.equals(condition, other.condition) && Objects.equals(forbidden, other.forbidden);
    }

    @Nonnull
    String decorationsToString() {
        StringBuilder sb = new StringBuilder();
        if (condition != null) {
            sb.append(", condition=").append(condition);
        }
        if (forbidden != null) {
            sb.append(", forbid=").append(forbidden);
        }
        return sb.toString();
    }
}
