/*
 * SpaceDeserializer.java
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

import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.annotation.API;
import org.samplespace.conditions.CombinatorType;
import org.samplespace.conditions.ComparisonType;
import org.samplespace.conditions.Condition;
import org.samplespace.conditions.ConditionMode;
import org.samplespace.conditions.Conditions;
import org.samplespace.expressions.Dimension;
import org.samplespace.expressions.Space;
import org.samplespace.logging.LogMessageKeys;
import org.samplespace.notation.CompactNotation;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds a space from its canonical form, reading compact notation wherever a body is a string.
 *
 * <p>
 * For every entry of the mapping: a string body is a compact notation dimension; a single-entry mapping whose
 * key is a {@linkplain DimensionConstructors constructor} and whose value holds that constructor's attributes is
 * a leaf dimension; any other mapping is a subspace, reused when the target already has one of that name. The two encodings can
 * therefore be mixed at every level.
 * </p>
 */
@API(API.Status.STABLE)
public final class SpaceDeserializer {
    private static final String OPTIONS = "options";

    @Nonnull
    private final DimensionConstructors constructors;

    private SpaceDeserializer(@Nonnull DimensionConstructors constructors) {
        this.constructors = constructors;
    }

    /**
     * Add the dimensions described by a mapping to a space.
     * @param data the serialized space
     * @param target the space receiving the dimensions
     * @return {@code target}
     */
    @Nonnull
    public static Space deserialize(@Nonnull Map<String, ?> data, @Nonnull Space target) {
        new SpaceDeserializer(DimensionConstructors.defaults()).readSpace(data, target);
        return target;
    }

    /**
     * Read a condition written by {@link SpaceSerializer#serializeCondition(Condition)}.
     * @param data the serialized condition
     * @return the condition
     * @throws SpaceCoreArgumentException if the mapping is not a condition
     */
    @Nonnull
    public static Condition deserializeCondition(@Nonnull Object data) {
        if (!(data instanceof Map) || ((Map<?, ?>) data).size() != 1) {
            throw new SpaceCoreArgumentException("condition must be a single-entry mapping", "condition", data);
        }
        final Map.Entry<?, ?> entry = ((Map<?, ?>) data).entrySet().iterator().next();
        final String operator = String.valueOf(entry.getKey());
        if (CombinatorType.isOperatorName(operator)) {
            if (!(entry.getValue() instanceof List) || ((List<?>) entry.getValue()).size() != 2) {
                throw new SpaceCoreArgumentException("combined condition must have two operands",
                        LogMessageKeys.OPERATOR, operator);
            }
            final List<?> operands = (List<?>) entry.getValue();
            return Conditions.combine(operator, deserializeCondition(operands.get(0)), deserializeCondition(operands.get(1)));
        }
        if (ComparisonType.isOperatorName(operator)) {
            if (!(entry.getValue() instanceof Map) || !(((Map<?, ?>) entry.getValue()).get("name") instanceof String)) {
                throw new SpaceCoreArgumentException("comparison must name a dimension",
                        LogMessageKeys.OPERATOR, operator);
            }
            final Map<?, ?> body = (Map<?, ?>) entry.getValue();
            return Conditions.leaf(operator, (String) body.get("name"), body.get("value"));
        }
        throw new SpaceCoreArgumentException("unknown condition operator", LogMessageKeys.OPERATOR, operator);
    }

    private void readSpace(@Nonnull Map<String, ?> data, @Nonnull Space target) {
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            final String name = entry.getKey();
            final Object body = entry.getValue();
            if (body instanceof String) {
                CompactNotation.parseInto(target, name, (String) body);
            } else if (body instanceof Map) {
                final Map<?, ?> mapping = (Map<?, ?>) body;
                final String kind = leafKind(mapping);
                if (kind != null) {
                    readLeaf(target, name, kind, (Map<?, ?>) mapping.get(kind));
                } else {
                    readSpace(asStringMap(name, mapping), subspace(target, name));
                }
            } else {
                throw new SpaceCoreArgumentException("cannot read dimension",
                        LogMessageKeys.DIMENSION, name,
                        LogMessageKeys.KIND, body == null ? "null" : body.getClass().getSimpleName());
            }
        }
    }

    /**
     * The constructor of a leaf body, or {@code null} when the mapping is a subspace. A leaf body is a
     * single-entry mapping from a constructor name to its attributes. Attribute values are numbers, booleans,
     * {@code null} or lists, except {@code options}, which maps values to weights, and {@code conditionals} and
     * {@code forbid}, which hold conditions. A subspace body maps names to mappings or compact notation strings,
     * so it never passes.
     */
    @Nullable
    private String leafKind(@Nonnull Map<?, ?> mapping) {
        if (mapping.size() != 1) {
            return null;
        }
        final Map.Entry<?, ?> entry = mapping.entrySet().iterator().next();
        if (!(entry.getKey() instanceof String) || !constructors.contains((String) entry.getKey())
                || !(entry.getValue() instanceof Map)) {
            return null;
        }
        for (Map.Entry<?, ?> attribute : ((Map<?, ?>) entry.getValue()).entrySet()) {
            if (!isAttribute(String.valueOf(attribute.getKey()), attribute.getValue())) {
                return null;
            }
        }
        return (String) entry.getKey();
    }

    private static boolean isAttribute(@Nonnull String key, @Nullable Object value) {
        if (ConditionMode.CONDITIONALS.getKey().equals(key) || ConditionMode.FORBID.getKey().equals(key)) {
            return isCondition(value);
        }
        if (OPTIONS.equals(key) && value instanceof Map) {
            final Map<?, ?> options = (Map<?, ?>) value;
            return !options.isEmpty() && options.values().stream().noneMatch(weight -> weight instanceof Map);
        }
        return !(value instanceof Map) && !(value instanceof String);
    }

    private static boolean isCondition(@Nullable Object value) {
        if (!(value instanceof Map) || ((Map<?, ?>) value).size() != 1) {
            return false;
        }
        final Object body = ((Map<?, ?>) value).values().iterator().next();
        if (body instanceof List) {
            return true;
        }
        return body instanceof Map && ((Map<?, ?>) body).containsKey("name")
                && !(((Map<?, ?>) body).get("name") instanceof Map);
    }

    private void readLeaf(@Nonnull Space target, @Nonnull String name, @Nonnull String kind,
                          @Nonnull Map<?, ?> attributes) {
        final Map<String, Object> arguments = asStringMap(name, attributes);
        final Object condition = arguments.remove(ConditionMode.CONDITIONALS.getKey());
        final Object forbidden = arguments.remove(ConditionMode.FORBID.getKey());
        if ((condition != null || forbidden != null) && !constructors.acceptsConditions(kind)) {
            throw new SpaceCoreArgumentException("directive cannot carry conditions",
                    LogMessageKeys.DIMENSION, name,
                    LogMessageKeys.KIND, kind);
        }
        final Condition enablement = condition == null ? null : deserializeCondition(condition);
        final Condition forbiddenClause = forbidden == null ? null : deserializeCondition(forbidden);
        final Dimension dimension = constructors.construct(kind, target, name,
                ConstructorArguments.ofKeywords(kind, arguments));
        if (dimension == null) {
            return;
        }
        if (enablement != null) {
            dimension.enableIf(enablement);
        }
        if (forbiddenClause != null) {
            dimension.forbid(forbiddenClause);
        }
    }

    @Nonnull
    private static Space subspace(@Nonnull Space target, @Nonnull String name) {
        final Dimension existing = target.getChild(name);
        if (existing instanceof Space) {
            return (Space) existing;
        }
        return target.subspace(name);
    }

    @Nonnull
    private static Map<String, Object> asStringMap(@Nonnull String name, @Nonnull Map<?, ?> mapping) {
        final Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : mapping.entrySet()) {
            if (!(entry.getKey() instanceof String)) {
                throw new SpaceCoreArgumentException("keys must be strings",
                        LogMessageKeys.DIMENSION, name,
                        "key", entry.getKey());
            }
            result.put((String) entry.getKey(), entry.getValue());
        }
        return result;
    }
}
