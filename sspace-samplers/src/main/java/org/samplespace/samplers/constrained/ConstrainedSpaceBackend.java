/*
 * ConstrainedSpaceBackend.java
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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import org.samplespace.SpaceCoreArgumentException;
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
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The full featured engine. It supports every dimension kind and feature, enablement conditions with any
 * comparison and combinator, and forbidden clauses made of {@code eq} and {@code in} comparisons joined with
 * {@code and}.
 *
 * <p>
 * Sampling seeds a Mersenne twister with the given seed, so the same handle, count and seed give the same
 * configurations. Ordinal dimensions are walked rather than drawn: sample {@code i} of a call with seed
 * {@code s} takes {@code sequence[(s + i) mod length]}.
 * </p>
 */
@API(API.Status.STABLE)
public class ConstrainedSpaceBackend extends SpaceCompiler<ConfigurationSpace, Hyperparameter, Clause> {
    public static final String NAME = "constrained";
    /**
     * Number of draws of one configuration before sampling fails because every draw was forbidden.
     */
    public static final int DEFAULT_MAX_ATTEMPTS = 1000;

    private static final Set<ComparisonType> FORBIDDEN_COMPARISONS = ImmutableSet.of(ComparisonType.EQ, ComparisonType.IN);
    private static final Set<CombinatorType> FORBIDDEN_COMBINATORS = ImmutableSet.of(CombinatorType.AND);

    private final int maxAttempts;

    public ConstrainedSpaceBackend() {
        this(DEFAULT_MAX_ATTEMPTS);
    }

    public ConstrainedSpaceBackend(int maxAttempts) {
        Preconditions.checkArgument(maxAttempts > 0, "maxAttempts must be positive");
        this.maxAttempts = maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    @Nonnull
    @Override
    public String getName() {
        return NAME;
    }

    @Nonnull
    @Override
    protected ConfigurationSpace newSpace(@Nonnull Space space) {
        return new ConfigurationSpace();
    }

    @Nonnull
    @Override
    protected Hyperparameter compileContinuous(@Nonnull ContinuousDimension dimension) {
        final double a = dimension.getLower().doubleValue();
        final double b = dimension.getUpper().doubleValue();
        final Double quantization = dimension.getQuantization() == null ? null : dimension.getQuantization().doubleValue();
        if (dimension.getDistribution() == Distribution.UNIFORM) {
            if (dimension.isDiscrete()) {
                return new UniformIntegerHyperparameter(dimension.getName(), a, b, dimension.isLog(), quantization);
            }
            return new UniformFloatHyperparameter(dimension.getName(), a, b, dimension.isLog(), quantization);
        }
        if (dimension.isDiscrete()) {
            return new NormalIntegerHyperparameter(dimension.getName(), a, b, dimension.isLog(), quantization);
        }
        return new NormalFloatHyperparameter(dimension.getName(), a, b, dimension.isLog(), quantization);
    }

    @Nonnull
    @Override
    protected Hyperparameter compileCategorical(@Nonnull CategoricalDimension dimension) {
        return new CategoricalHyperparameter(dimension.getName(), dimension.getChoices(), dimension.getWeights());
    }

    @Nonnull
    @Override
    protected Hyperparameter compileOrdinal(@Nonnull OrdinalDimension dimension) {
        return new OrdinalHyperparameter(dimension.getName(), dimension.getSequence());
    }

    @Override
    protected void addParameter(@Nonnull ConfigurationSpace handle, @Nonnull String name, @Nonnull Hyperparameter parameter) {
        handle.addHyperparameter(parameter);
    }

    @Nonnull
    @Override
    protected Map<String, Hyperparameter> mountSpace(@Nonnull ConfigurationSpace handle, @Nonnull String prefix,
                                                     @Nonnull ConfigurationSpace nested) {
        return handle.addConfigurationSpace(prefix, nested);
    }

    @Nonnull
    @Override
    protected Map<String, Hyperparameter> parameters(@Nonnull ConfigurationSpace handle) {
        return handle.getHyperparameters();
    }

    @Override
    protected boolean supports(@Nonnull ConditionMode mode, @Nonnull ComparisonType comparison) {
        return mode == ConditionMode.CONDITIONALS || FORBIDDEN_COMPARISONS.contains(comparison);
    }

    @Override
    protected boolean supports(@Nonnull ConditionMode mode, @Nonnull CombinatorType combinator) {
        return mode == ConditionMode.CONDITIONALS || FORBIDDEN_COMBINATORS.contains(combinator);
    }

    @Nonnull
    @Override
    protected Clause compileLeafCondition(@Nonnull ConditionMode mode, @Nonnull LeafCondition leaf,
                                          @Nonnull Hyperparameter target, @Nonnull Hyperparameter referenced) {
        final ComparisonType type = leaf.getType();
        if ((type == ComparisonType.LT || type == ComparisonType.GT) && !referenced.isOrdered()) {
            throw new UnsupportedOperatorException(NAME, type.getOperatorName(),
                    LogMessageKeys.REFERENCE, leaf.getReference(),
                    LogMessageKeys.KIND, "categorical");
        }
        if (type == ComparisonType.IN) {
            for (Object value : leaf.getValues()) {
                checkLegal(leaf, referenced, value);
            }
        } else {
            checkLegal(leaf, referenced, leaf.getValue());
        }
        return new ComparisonClause(type, referenced, leaf.getValue());
    }

    private static void checkLegal(@Nonnull LeafCondition leaf, @Nonnull Hyperparameter referenced,
                                   @Nullable Object value) {
        if (!referenced.isLegal(value)) {
            throw new SpaceCoreArgumentException("condition compares with a value the dimension cannot take",
                    LogMessageKeys.REFERENCE, leaf.getReference(),
                    LogMessageKeys.OPERATOR, leaf.getType().getOperatorName(),
                    "value", value);
        }
    }

    @Nonnull
    @Override
    protected Clause compileCompositeCondition(@Nonnull ConditionMode mode, @Nonnull CompositeCondition composite,
                                               @Nonnull Clause left, @Nonnull Clause right) {
        return new ConjunctionClause(composite.getType(), left, right);
    }

    @Override
    protected void addCondition(@Nonnull ConfigurationSpace handle, @Nonnull Hyperparameter target,
                                @Nonnull Clause condition) {
        handle.addCondition(target.getName(), condition);
    }

    @Override
    protected void addForbidden(@Nonnull ConfigurationSpace handle, @Nonnull Clause clause) {
        handle.addForbiddenClause(clause);
    }

    @Nonnull
    @Override
    public List<Map<String, Object>> sample(@Nonnull ConfigurationSpace handle, int count, long seed) {
        return handle.sample(count, seed, maxAttempts);
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
            return new ConstrainedSpaceBackend();
        }
    }
}
