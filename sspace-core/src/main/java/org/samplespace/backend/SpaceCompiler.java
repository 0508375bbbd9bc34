/*
 * SpaceCompiler.java
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

package org.samplespace.backend;

import org.samplespace.SpaceCoreException;
import org.samplespace.annotation.API;
import org.samplespace.conditions.CombinatorType;
import org.samplespace.conditions.ComparisonType;
import org.samplespace.conditions.CompositeCondition;
import org.samplespace.conditions.Condition;
import org.samplespace.conditions.ConditionMode;
import org.samplespace.conditions.ConditionVisitor;
import org.samplespace.conditions.LeafCondition;
import org.samplespace.expressions.CategoricalDimension;
import org.samplespace.expressions.ContinuousDimension;
import org.samplespace.expressions.Dimension;
import org.samplespace.expressions.DimensionVisitor;
import org.samplespace.expressions.OrdinalDimension;
import org.samplespace.expressions.Space;
import org.samplespace.expressions.VariableDimension;
import org.samplespace.logging.KeyValueLogMessage;
import org.samplespace.logging.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Base class of the backends, walking a space tree in a fixed order and leaving the engine specific
 * representation to subclasses.
 *
 * <p>
 * The children of every space are compiled in insertion order. A nested space is compiled on its own and its
 * result mounted into the enclosing handle under the nested space's name. A leaf dimension is compiled into a
 * parameter and registered first; only then are its condition and its forbidden clause compiled and attached,
 * in that order. A condition can thus refer to any dimension added before the one it decorates, including
 * dimensions of nested spaces through their dotted path.
 * </p>
 *
 * <p>
 * Every condition operator is checked against {@link #supports(ConditionMode, ComparisonType)} or
 * {@link #supports(ConditionMode, CombinatorType)} before its operands are compiled, so an unsupported operator
 * fails compilation with {@link UnsupportedOperatorException}.
 * </p>
 *
 * @param <H> the type of the compiled handle
 * @param <P> the type of a compiled parameter
 * @param <C> the type of a compiled condition
 */
@API(API.Status.UNSTABLE)
public abstract class SpaceCompiler<H, P, C> implements SpaceBackend<H> {
    private static final Logger LOGGER = LoggerFactory.getLogger(SpaceCompiler.class);

    @Nonnull
    @Override
    public final H compile(@Nonnull Space space) {
        final H handle = compileSpace(space);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("compiled space",
                    LogMessageKeys.BACKEND, getName(),
                    LogMessageKeys.DIMENSION_COUNT, parameters(handle).size()));
        }
        return handle;
    }

    @Nonnull
    private H compileSpace(@Nonnull Space space) {
        final H handle = newSpace(space);
        final CompilationScope<P> scope = new CompilationScope<>(space.getPath());
        final NodeCompiler nodeCompiler = new NodeCompiler(handle, scope);
        for (Dimension child : space.getChildren().values()) {
            child.accept(nodeCompiler);
        }
        return handle;
    }

    /**
     * Create an empty handle for a space.
     * @param space the space about to be compiled
     * @return the empty handle
     */
    @Nonnull
    protected abstract H newSpace(@Nonnull Space space);

    @Nonnull
    protected abstract P compileContinuous(@Nonnull ContinuousDimension dimension);

    @Nonnull
    protected abstract P compileCategorical(@Nonnull CategoricalDimension dimension);

    @Nonnull
    protected abstract P compileOrdinal(@Nonnull OrdinalDimension dimension);

    /**
     * Register a compiled leaf parameter in a handle.
     * @param handle the handle of the enclosing space
     * @param name the local name of the dimension
     * @param parameter the compiled parameter
     */
    protected abstract void addParameter(@Nonnull H handle, @Nonnull String name, @Nonnull P parameter);

    /**
     * Mount the compiled handle of a nested space into the handle of its parent. Every parameter, condition and
     * forbidden clause of the nested handle is carried over under {@code prefix + "." + name}.
     * @param handle the handle of the enclosing space
     * @param prefix the name of the nested space
     * @param nested the compiled nested space
     * @return the mounted parameters keyed by their name in {@code handle}
     */
    @Nonnull
    protected abstract Map<String, P> mountSpace(@Nonnull H handle, @Nonnull String prefix, @Nonnull H nested);

    /**
     * The parameters of a handle, by name.
     * @param handle a compiled handle
     * @return the parameters
     */
    @Nonnull
    protected abstract Map<String, P> parameters(@Nonnull H handle);

    protected abstract boolean supports(@Nonnull ConditionMode mode, @Nonnull ComparisonType comparison);

    protected abstract boolean supports(@Nonnull ConditionMode mode, @Nonnull CombinatorType combinator);

    /**
     * Compile one comparison.
     * @param mode whether the comparison is part of a condition or of a forbidden clause
     * @param leaf the comparison
     * @param target the parameter carrying the condition
     * @param referenced the parameter the comparison refers to
     * @return the compiled comparison
     */
    @Nonnull
    protected abstract C compileLeafCondition(@Nonnull ConditionMode mode, @Nonnull LeafCondition leaf,
                                              @Nonnull P target, @Nonnull P referenced);

    @Nonnull
    protected abstract C compileCompositeCondition(@Nonnull ConditionMode mode, @Nonnull CompositeCondition composite,
                                                   @Nonnull C left, @Nonnull C right);

    protected abstract void addCondition(@Nonnull H handle, @Nonnull P target, @Nonnull C condition);

    protected abstract void addForbidden(@Nonnull H handle, @Nonnull C clause);

    @Nonnull
    private C compileCondition(@Nonnull ConditionMode mode, @Nonnull Condition condition, @Nonnull P target,
                               @Nonnull CompilationScope<P> scope) {
        return condition.accept(new ConditionCompiler(scope), mode, target);
    }

    private void registerLeaf(@Nonnull H handle, @Nonnull CompilationScope<P> scope,
                              @Nonnull Dimension dimension, @Nonnull P parameter) {
        addParameter(handle, dimension.getName(), parameter);
        scope.register(dimension.getName(), parameter);
        final Condition condition = dimension.getCondition();
        if (condition != null) {
            addCondition(handle, parameter, compileCondition(ConditionMode.CONDITIONALS, condition, parameter, scope));
        }
        final Condition forbidden = dimension.getForbidden();
        if (forbidden != null) {
            addForbidden(handle, compileCondition(ConditionMode.FORBID, forbidden, parameter, scope));
        }
    }

    private class NodeCompiler implements DimensionVisitor<Void> {
        @Nonnull
        private final H handle;
        @Nonnull
        private final CompilationScope<P> scope;

        NodeCompiler(@Nonnull H handle, @Nonnull CompilationScope<P> scope) {
            this.handle = handle;
            this.scope = scope;
        }

        @Override
        public Void visitContinuous(@Nonnull ContinuousDimension dimension) {
            registerLeaf(handle, scope, dimension, compileContinuous(dimension));
            return null;
        }

        @Override
        public Void visitCategorical(@Nonnull CategoricalDimension dimension) {
            registerLeaf(handle, scope, dimension, compileCategorical(dimension));
            return null;
        }

        @Override
        public Void visitOrdinal(@Nonnull OrdinalDimension dimension) {
            registerLeaf(handle, scope, dimension, compileOrdinal(dimension));
            return null;
        }

        @Override
        public Void visitVariable(@Nonnull VariableDimension dimension) {
            throw new SpaceCoreException("variables are supplied at sample time and cannot be compiled",
                    LogMessageKeys.DIMENSION, dimension.getName());
        }

        @Override
        public Void visitSpace(@Nonnull Space space) {
            final H nested = compileSpace(space);
            for (Map.Entry<String, P> mounted : mountSpace(handle, space.getName(), nested).entrySet()) {
                scope.register(mounted.getKey(), mounted.getValue());
            }
            return null;
        }
    }

    private class ConditionCompiler implements ConditionVisitor<C, P> {
        @Nonnull
        private final CompilationScope<P> scope;

        ConditionCompiler(@Nonnull CompilationScope<P> scope) {
            this.scope = scope;
        }

        @Override
        public C visitLeaf(@Nonnull ConditionMode mode, @Nonnull LeafCondition leaf, P target) {
            if (!supports(mode, leaf.getType())) {
                throw new UnsupportedOperatorException(getName(), leaf.getType().getOperatorName(),
                        LogMessageKeys.MODE, mode.getKey(),
                        LogMessageKeys.REFERENCE, leaf.getReference());
            }
            return compileLeafCondition(mode, leaf, target, scope.resolve(leaf.getReference()));
        }

        @Override
        public C visitComposite(@Nonnull ConditionMode mode, @Nonnull CompositeCondition composite, P target) {
            if (!supports(mode, composite.getType())) {
                throw new UnsupportedOperatorException(getName(), composite.getType().getOperatorName(),
                        LogMessageKeys.MODE, mode.getKey());
            }
            final C left = composite.getLeft().accept(this, mode, target);
            final C right = composite.getRight().accept(this, mode, target);
            return compileCompositeCondition(mode, composite, left, right);
        }
    }
}
