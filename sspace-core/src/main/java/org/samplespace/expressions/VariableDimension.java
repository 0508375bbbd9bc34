/*
 * VariableDimension.java
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
import org.samplespace.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A free variable. It is never sampled: its value is supplied by the caller of
 * {@link Space#sample(int, long, java.util.Map)} and merged into every sample. Variables are only stored
 * by the root space, under their full dotted name.
 */
@API(API.Status.STABLE)
public final class VariableDimension extends Dimension {

    VariableDimension(@Nonnull String name, @Nullable Space space) {
        super(name, space);
    }

    /**
     * Variables are already stored under their full name by the root.
     * @return the full dotted name of the variable
     */
    @Nonnull
    @Override
    public String getPath() {
        return getName();
    }

    @Override
    public void enableIf(@Nonnull Condition condition) {
        throw new SpaceCoreArgumentException("variables cannot be conditioned", LogMessageKeys.DIMENSION, getName());
    }

    @Override
    public void forbid(@Nonnull Condition clause) {
        throw new SpaceCoreArgumentException("variables cannot be forbidden", LogMessageKeys.DIMENSION, getName());
    }

    @Override
    public <T> T accept(@Nonnull DimensionVisitor<T> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o != null && getClass() == o.getClass() && getName().equals(((VariableDimension) o).getName());
    }

    @Override
    public int hashCode() {
        return getName().hashCode();
    }

    @Override
    public String toString() {
        return "var(" + getName() + ")";
    }
}
