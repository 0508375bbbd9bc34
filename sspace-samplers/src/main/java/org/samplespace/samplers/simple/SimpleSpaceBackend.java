/*
 * SimpleSpaceBackend.java
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

package org.samplespace.samplers.simple;

import org.samplespace.annotation.API;
import org.samplespace.backend.SpaceBackend;
import org.samplespace.backend.SpaceCompiler;
import org.samplespace.backend.UnsupportedOperatorException;
import org.samplespace.conditions.CombinatorType;
import org.samplespace.conditions.ComparisonType;
import org.samplespace.conditions.CompositeCondition;
import org.samplespace.conditions.ConditionMode;
import org.samplespace.conditions.LeafCondition;
import org.samplespace.expressions.CategoricalDimension;
import org.samplespace.expressions.ContinuousDimension;
import org.samplespace.expressions.Distribution;
import org.samplespace.expressions.OrdinalDimension;
import org.samplespace.expressions.Space;
import org.samplespace.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;

/**
 * A reduced engine drawing independent uniform, log-uniform, normal and categorical dimensions.
 *
 * <p>
 * It has no ordinal dimensions, no quantization, no log-normal distribution, no enablement conditions and
 * no forbidden clauses. A tree using any of them fails to compile with {@link UnsupportedOperatorException}.
 * </p>
 */
@API(API.Status.STABLE)
public class SimpleSpaceBackend extends SpaceCompiler<SimpleSpace, SimpleDimension, Void> {
    public static final String NAME = "simple";

    @Nonnull
    @Override
    public String getName() {
        return NAME;
    }

    @Nonnull
    @Override
    protected SimpleSpace newSpace(@Nonnull Space space) {
        return new SimpleSpace();
    }

    @Nonnull
    @Override
    protected SimpleDimension compileContinuous(@Nonnull ContinuousDimension dimension) {
        if (dimension.getQuantization() != null) {
            throw new UnsupportedOperatorException(NAME, "quantization", LogMessageKeys.DIMENSION, dimension.getName());
        }
        if (dimension.getDistribution() == Distribution.NORMAL && dimension.isLog()) {
            throw new UnsupportedOperatorException(NAME, dimension.getCompactKind(), LogMessageKeys.DIMENSION, dimension.getName());
        }
        final double a = dimension.getLower().doubleValue();
        final double b = dimension.getUpper().doubleValue();
        if (dimension.isDiscrete()) {
            return new IntegerDimension(dimension.getName(), dimension.getDistribution(), a, b, dimension.isLog());
        }
        return new RealDimension(dimension.getName(), dimension.getDistribution(), a, b, dimension.isLog());
    }

    @Nonnull
    @Override
    protected SimpleDimension compileCategorical(@Nonnull CategoricalDimension dimension) {
        return new ChoiceDimension(dimension.getName(), dimension.getOptions());
    }

    @Nonnull
    @Override
    protected SimpleDimension compileOrdinal(@Nonnull OrdinalDimension dimension) {
        throw new UnsupportedOperatorException(NAME, "ordinal", LogMessageKeys.DIMENSION, dimension.getName());
    }

    @Override
    protected void addParameter(@Nonnull SimpleSpace handle, @Nonnull String name, @Nonnull SimpleDimension parameter) {
        handle.register(parameter);
    }

    @Nonnull
    @Override
    protected Map<String, SimpleDimension> mountSpace(@Nonnull SimpleSpace handle, @Nonnull String prefix,
                                                      @Nonnull SimpleSpace nested) {
        return handle.mount(prefix, nested);
    }

    @Nonnull
    @Override
    protected Map<String, SimpleDimension> parameters(@Nonnull SimpleSpace handle) {
        return handle.getDimensions();
    }

    @Override
    protected boolean supports(@Nonnull ConditionMode mode, @Nonnull ComparisonType comparison) {
        return false;
    }

    @Override
    protected boolean supports(@Nonnull ConditionMode mode, @Nonnull CombinatorType combinator) {
        return false;
    }

    @Nonnull
    @Override
    protected Void compileLeafCondition(@Nonnull ConditionMode mode, @Nonnull LeafCondition leaf,
                                        @Nonnull SimpleDimension target, @Nonnull SimpleDimension referenced) {
        throw new UnsupportedOperatorException(NAME, leaf.getType().getOperatorName());
    }

    @Nonnull
    @Override
    protected Void compileCompositeCondition(@Nonnull ConditionMode mode, @Nonnull CompositeCondition composite,
                                             @Nonnull Void left, @Nonnull Void right) {
        throw new UnsupportedOperatorException(NAME, composite.getType().getOperatorName());
    }

    @Override
    protected void addCondition(@Nonnull SimpleSpace handle, @Nonnull SimpleDimension target, @Nonnull Void condition) {
        throw new UnsupportedOperatorException(NAME, ConditionMode.CONDITIONALS.getKey());
    }

    @Override
    protected void addForbidden(@Nonnull SimpleSpace handle, @Nonnull Void clause) {
        throw new UnsupportedOperatorException(NAME, ConditionMode.FORBID.getKey());
    }

    @Nonnull
    @Override
    public List<Map<String, Object>> sample(@Nonnull SimpleSpace handle, int count, long seed) {
        return handle.sample(count, seed);
    }

    /**
     * Registers the engine under {@value #NAME}.
     */
    public static class Factory implements SpaceBackend.Factory {
        @Nonnull
        @Override
        public String getName() {
            return NAME;
        }

        @Nonnull
        @Override
        public SpaceBackend<?> createBackend() {
            return new SimpleSpaceBackend();
        }
    }
}
