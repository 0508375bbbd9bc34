/*
 * NotationRenderer.java
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

package org.samplespace.notation;

import com.google.common.collect.ImmutableSet;
import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.annotation.API;
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
import org.samplespace.logging.LogMessageKeys;
import org.samplespace.serialization.DimensionConstructors;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Renders dimensions and conditions in compact notation.
 *
 * <p>
 * Continuous dimensions fold their log flag into the constructor name ({@code loguniform}, {@code lognormal})
 * and leave out {@code discrete} and {@code quantization} when they have their defaults. Categorical
 * dimensions list their weights only when they differ from the equal default. Conditions are written as
 * calls, with the referenced dimension as a bare identifier when it is one and quoted otherwise.
 * </p>
 */
@API(API.Status.INTERNAL)
public final class NotationRenderer implements DimensionVisitor<Object> {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");
    private static final Set<String> KEYWORDS = ImmutableSet.of("true", "false", "none");
    private static final ConditionWriter CONDITION_WRITER = new ConditionWriter();

    /**
     * Render a whole space: a mapping from each local name to its rendered dimension, with subspaces as nested
     * mappings. The root also lists its variables and identity directive.
     * @param space the space
     * @return the rendered space
     */
    @Nonnull
    @SuppressWarnings("unchecked")
    public static Map<String, Object> renderSpace(@Nonnull Space space) {
        return (Map<String, Object>) space.accept(new NotationRenderer());
    }

    /**
     * Render one leaf dimension.
     * @param dimension the dimension, not a space
     * @return the rendered dimension
     */
    @Nonnull
    public static String renderDimension(@Nonnull Dimension dimension) {
        if (dimension instanceof Space) {
            throw new SpaceCoreArgumentException("a space renders as a mapping", LogMessageKeys.SPACE, dimension.getPath());
        }
        return (String) dimension.accept(new NotationRenderer());
    }

    @Nonnull
    public static String renderCondition(@Nonnull Condition condition) {
        return condition.accept(CONDITION_WRITER, ConditionMode.CONDITIONALS, null);
    }

    @Override
    public Object visitContinuous(@Nonnull ContinuousDimension dimension) {
        final StringJoiner arguments = new StringJoiner(", ");
        arguments.add(dimension.getDistribution().getFirstParameter() + "=" + renderValue(dimension.getLower()));
        arguments.add(dimension.getDistribution().getSecondParameter() + "=" + renderValue(dimension.getUpper()));
        if (dimension.isDiscrete()) {
            arguments.add("discrete=true");
        }
        if (dimension.getQuantization() != null) {
            arguments.add("quantization=" + renderValue(dimension.getQuantization()));
        }
        return call(dimension.getCompactKind(), arguments, dimension);
    }

    @Override
    public Object visitCategorical(@Nonnull CategoricalDimension dimension) {
        final StringJoiner arguments = new StringJoiner(", ");
        arguments.add("values=" + renderValue(dimension.getChoices()));
        if (!dimension.hasEqualWeights()) {
            arguments.add("weights=" + renderValue(dimension.getWeights()));
        }
        return call(DimensionConstructors.CATEGORICAL, arguments, dimension);
    }

    @Override
    public Object visitOrdinal(@Nonnull OrdinalDimension dimension) {
        final StringJoiner arguments = new StringJoiner(", ");
        arguments.add("sequence=" + renderValue(dimension.getSequence()));
        return call(DimensionConstructors.ORDINAL, arguments, dimension);
    }

    @Override
    public Object visitVariable(@Nonnull VariableDimension dimension) {
        return DimensionConstructors.VARIABLE + "()";
    }

    @Override
    public Object visitSpace(@Nonnull Space space) {
        final Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, Dimension> child : space.getChildren().entrySet()) {
            final Object body = child.getValue().accept(this);
            if (!(body instanceof Map) || !((Map<?, ?>) body).isEmpty()) {
                result.put(child.getKey(), body);
            }
        }
        for (Map.Entry<String, VariableDimension> variable : space.getVariables().entrySet()) {
            result.put(variable.getKey(), variable.getValue().accept(this));
        }
        if (space.getIdentityField() != null) {
            result.put(space.getIdentityField(), DimensionConstructors.IDENTITY + "(size=" + space.getIdentitySize() + ")");
        }
        return result;
    }

    @Nonnull
    private static String call(@Nonnull String name, @Nonnull StringJoiner arguments, @Nonnull Dimension dimension) {
        if (dimension.getCondition() != null) {
            arguments.add(NotationInterpreter.CONDITION + "=" + renderCondition(dimension.getCondition()));
        }
        if (dimension.getForbidden() != null) {
            arguments.add(ConditionMode.FORBID.getKey() + "=" + renderCondition(dimension.getForbidden()));
        }
        return name + "(" + arguments + ")";
    }

    /**
     * Render a value: numbers as written by Java, strings single quoted, booleans as {@code true} and
     * {@code false}, {@code null} as {@code none}, lists in brackets.
     * @param value the value
     * @return the rendered value
     */
    @Nonnull
    public static String renderValue(@Nullable Object value) {
        if (value == null) {
            return "none";
        }
        if (value instanceof String) {
            return quote((String) value);
        }
        if (value instanceof Double || value instanceof Float) {
            final double number = ((Number) value).doubleValue();
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                throw new SpaceCoreArgumentException("value cannot be written in compact notation", "value", value);
            }
            return Double.toString(number);
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof List) {
            final StringJoiner elements = new StringJoiner(", ", "[", "]");
            for (Object element : (List<?>) value) {
                elements.add(renderValue(element));
            }
            return elements.toString();
        }
        throw new SpaceCoreArgumentException("value cannot be written in compact notation",
                "value", value,
                LogMessageKeys.KIND, value.getClass().getSimpleName());
    }

    @Nonnull
    private static String renderReference(@Nonnull String reference) {
        if (IDENTIFIER.matcher(reference).matches() && !KEYWORDS.contains(reference)) {
            return reference;
        }
        return quote(reference);
    }

    @Nonnull
    private static String quote(@Nonnull String value) {
        final StringBuilder quoted = new StringBuilder(value.length() + 2).append('\'');
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            switch (c) {
                case '\'':
                case '\\':
                    quoted.append('\\').append(c);
                    break;
                case '\n':
                    quoted.append("\\n");
                    break;
                case '\t':
                    quoted.append("\\t");
                    break;
                case '\r':
                    quoted.append("\\r");
                    break;
                default:
                    quoted.append(c);
            }
        }
        return quoted.append('\'').toString();
    }

    private static class ConditionWriter implements ConditionVisitor<String, Void> {
        @Override
        public String visitLeaf(@Nonnull ConditionMode mode, @Nonnull LeafCondition leaf, Void target) {
            final String name = leaf.getType() == ComparisonType.IN ? "contains" : leaf.getType().getOperatorName();
            return name + "(" + renderReference(leaf.getReference()) + ", " + renderValue(leaf.getValue()) + ")";
        }

        @Override
        public String visitComposite(@Nonnull ConditionMode mode, @Nonnull CompositeCondition composite, Void target) {
            return composite.getType().getFunctionName() + "(" + composite.getLeft().accept(this, mode, target)
                    + ", " + composite.getRight().accept(this, mode, target) + ")";
        }
    }
}
