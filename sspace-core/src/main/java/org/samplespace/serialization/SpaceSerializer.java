/*
 * SpaceSerializer.java
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

package org.samplespace.serialization;

import org.samplespace.annotation.API;
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a space in canonical form: a nested mapping from each child's local name to its body.
 *
 * <pre>{@code
 * {
 *   "optimizer": {"categorical": {"values": ["sgd", "adam"], "weights": [1.0, 3.0]}},
 *   "model": {
 *     "lr": {"uniform": {"lower": 0, "upper": 1, "discrete": false, "log": true, "quantization": null,
 *                        "conditionals": {"eq": {"name": "optimizer", "value": "sgd"}}}}
 *   },
 *   "epoch": {"var": {}},
 *   "uid": {"identity": {"size": 16}}
 * }
 * }</pre>
 *
 * A leaf body is a single-entry mapping from the dimension kind to its attributes, with the condition and
 * the forbidden clause folded in under {@code conditionals} and {@code forbid}. Categorical values are kept in
 * a list, never as mapping keys, so they survive JSON. A subspace body is the subspace's own mapping; a
 * subspace without dimensions has no body and is left out. Variables and the identity directive of the root
 * follow its children. The result only holds mappings, lists and scalars, and can be written as JSON.
 */
@API(API.Status.STABLE)
public final class SpaceSerializer implements DimensionVisitor<Map<String, Object>> {
    private static final ConditionWriter CONDITION_WRITER = new ConditionWriter();

    private SpaceSerializer() {
    }

    @Nonnull
    public static Map<String, Object> serialize(@Nonnull Space space) {
        return space.accept(new SpaceSerializer());
    }

    /**
     * Write a condition in canonical form.
     * @param condition the condition
     * @return {@code {op: {"name": reference, "value": value}}} for a comparison, {@code {op: [left, right]}}
     * for a combination
     */
    @Nonnull
    public static Map<String, Object> serializeCondition(@Nonnull Condition condition) {
        return condition.accept(CONDITION_WRITER, ConditionMode.CONDITIONALS, null);
    }

    @Override
    public Map<String, Object> visitContinuous(@Nonnull ContinuousDimension dimension) {
        final Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(dimension.getDistribution().getFirstParameter(), dimension.getLower());
        attributes.put(dimension.getDistribution().getSecondParameter(), dimension.getUpper());
        attributes.put("discrete", dimension.isDiscrete());
        attributes.put("log", dimension.isLog());
        attributes.put("quantization", dimension.getQuantization());
        return leaf(dimension, dimension.getDistribution().getKind(), attributes);
    }

    @Override
    public Map<String, Object> visitCategorical(@Nonnull CategoricalDimension dimension) {
        final Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("values", new ArrayList<>(dimension.getChoices()));
        if (!dimension.hasEqualWeights()) {
            attributes.put("weights", new ArrayList<>(dimension.getWeights()));
        }
        return leaf(dimension, DimensionConstructors.CATEGORICAL, attributes);
    }

    @Override
    public Map<String, Object> visitOrdinal(@Nonnull OrdinalDimension dimension) {
        final Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("sequence", new ArrayList<>(dimension.getSequence()));
        return leaf(dimension, DimensionConstructors.ORDINAL, attributes);
    }

    @Override
    public Map<String, Object> visitVariable(@Nonnull VariableDimension dimension) {
        return single(DimensionConstructors.VARIABLE, new LinkedHashMap<>());
    }

    @Override
    public Map<String, Object> visitSpace(@Nonnull Space space) {
        final Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, Dimension> child : space.getChildren().entrySet()) {
            final Map<String, Object> body = child.getValue().accept(this);
            if (!body.isEmpty()) {
                result.put(child.getKey(), body);
            }
        }
        for (Map.Entry<String, VariableDimension> variable : space.getVariables().entrySet()) {
            result.put(variable.getKey(), variable.getValue().accept(this));
        }
        if (space.getIdentityField() != null) {
            final Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("size", space.getIdentitySize());
            result.put(space.getIdentityField(), single(DimensionConstructors.IDENTITY, attributes));
        }
        return result;
    }

    @Nonnull
    private static Map<String, Object> leaf(@Nonnull Dimension dimension, @Nonnull String kind,
                                            @Nonnull Map<String, Object> attributes) {
        if (dimension.getCondition() != null) {
            attributes.put(ConditionMode.CONDITIONALS.getKey(), serializeCondition(dimension.getCondition()));
        }
        if (dimension.getForbidden() != null) {
            attributes.put(ConditionMode.FORBID.getKey(), serializeCondition(dimension.getForbidden()));
        }
        return single(kind, attributes);
    }

    @Nonnull
    private static Map<String, Object> single(@Nonnull String key, @Nullable Object value) {
        final Map<String, Object> result = new LinkedHashMap<>();
        result.put(key, value);
        return result;
    }

    private static class ConditionWriter implements ConditionVisitor<Map<String, Object>, Void> {
        @Override
        public Map<String, Object> visitLeaf(@Nonnull ConditionMode mode, @Nonnull LeafCondition leaf, Void target) {
            final Map<String, Object> body = new LinkedHashMap<>();
            body.put("name", leaf.getReference());
            final Object value = leaf.getValue();
            body.put("value", value instanceof List ? new ArrayList<>((List<?>) value) : value);
            return single(leaf.getType().getOperatorName(), body);
        }

        @Override
        public Map<String, Object> visitComposite(@Nonnull ConditionMode mode, @Nonnull CompositeCondition composite,
                                                  Void target) {
            final List<Object> operands = new ArrayList<>(2);
            operands.add(composite.getLeft().accept(this, mode, target));
            operands.add(composite.getRight().accept(this, mode, target));
            return single(composite.getType().getOperatorName(), operands);
        }
    }
}
