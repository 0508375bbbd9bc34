/*
 * Hyperparameter.java
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

import org.apache.commons.math3.random.RandomGenerator;
import org.samplespace.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A parameter of a {@link ConfigurationSpace}: something that draws one value per configuration.
 */
@API(API.Status.INTERNAL)
public abstract class Hyperparameter {
    @Nonnull
    private final String name;

    protected Hyperparameter(@Nonnull String name) {
        this.name = name;
    }

    /**
     * The name of the parameter in its configuration space, dotted once mounted into an enclosing space.
     * @return the name
     */
    @Nonnull
    public String getName() {
        return name;
    }

    /**
     * Draw a value.
     * @param random the generator of the configuration space
     * @param position index of the configuration being drawn, offset by the seed
     * @return the value
     */
    @Nonnull
    public abstract Object sample(@Nonnull RandomGenerator random, long position);

    /**
     * A copy of this parameter under another name.
     * @param newName the new name
     * @return the renamed parameter
     */
    @Nonnull
    public abstract Hyperparameter withName(@Nonnull String newName);

    /**
     * Whether the parameter can take a value, used to check the values conditions compare against.
     * @param value a value
     * @return whether {@code value} can be drawn
     */
    public abstract boolean isLegal(@Nullable Object value);

    /**
     * Whether values of this parameter have an order, so that {@code lt} and {@code gt} apply.
     * @return whether the values are ordered
     */
    public boolean isOrdered() {
        return true;
    }

    /**
     * Compare two values of this parameter.
     * @param left first value
     * @param right second value
     * @return a negative number, zero or a positive number as {@code left} is below, equal to or above {@code right}
     */
    public int compare(@Nonnull Object left, @Nonnull Object right) {
        return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + ")";
    }
}
