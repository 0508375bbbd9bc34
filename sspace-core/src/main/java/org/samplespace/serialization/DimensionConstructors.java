/*
 * DimensionConstructors.java
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

import com.google.common.collect.ImmutableMap;
import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.annotation.API;
import org.samplespace.expressions.Dimension;
import org.samplespace.expressions.Space;
import org.samplespace.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The fixed table of dimension constructors known to the persisted forms, by name.
 *
 * <table>
 *     <caption>Constructors and their arguments, in positional order</caption>
 *     <tr><th>name</th><th>arguments</th></tr>
 *     <tr><td>{@code uniform}</td><td>{@code lower, upper, discrete, log, quantization}</td></tr>
 *     <tr><td>{@code loguniform}</td><td>{@code lower, upper, discrete, quantization}</td></tr>
 *     <tr><td>{@code normal}</td><td>{@code loc, scale, discrete, log, quantization}</td></tr>
 *     <tr><td>{@code lognormal}</td><td>{@code loc, scale, discrete, quantization}</td></tr>
 *     <tr><td>{@code categorical}, {@code choices}</td><td>{@code options} or {@code values, weights}</td></tr>
 *     <tr><td>{@code ordinal}</td><td>{@code sequence} or the values themselves</td></tr>
 *     <tr><td>{@code var}</td><td>none</td></tr>
 *     <tr><td>{@code identity}</td><td>{@code size}</td></tr>
 * </table>
 */
@API(API.Status.INTERNAL)
public final class DimensionConstructors {
    public static final String UNIFORM = "uniform";
    public static final String LOGUNIFORM = "loguniform";
    public static final String NORMAL = "normal";
    public static final String LOGNORMAL = "lognormal";
    public static final String CATEGORICAL = "categorical";
    public static final String CHOICES = "choices";
    public static final String ORDINAL = "ordinal";
    public static final String VARIABLE = "var";
    public static final String IDENTITY = "identity";

    private static final DimensionConstructors DEFAULT = new DimensionConstructors(ImmutableMap.<String, DimensionConstructor>builder()
            .put(UNIFORM, DimensionConstructors::uniform)
            .put(LOGUNIFORM, DimensionConstructors::loguniform)
            .put(NORMAL, DimensionConstructors::normal)
            .put(LOGNORMAL, DimensionConstructors::lognormal)
            .put(CATEGORICAL, DimensionConstructors::categorical)
            .put(CHOICES, DimensionConstructors::categorical)
            .put(ORDINAL, DimensionConstructors::ordinal)
            .put(VARIABLE, DimensionConstructors::variable)
            .put(IDENTITY, DimensionConstructors::identity)
            .build());

    @Nonnull
    private final Map<String, DimensionConstructor> constructors;

    private DimensionConstructors(@Nonnull ImmutableMap<String, DimensionConstructor> constructors) {
        this.constructors = constructors;
    }

    @Nonnull
    public static DimensionConstructors defaults() {
        return DEFAULT;
    }

    public boolean contains(@Nonnull String name) {
        return constructors.containsKey(name);
    }

    @Nonnull
    public Set<String> names() {
        return constructors.keySet();
    }

    /**
     * Whether the dimensions built by a constructor take an enablement condition and a forbidden clause.
     * Variables and the identity directive do not.
     * @param name the constructor name
     * @return whether conditions may be attached
     */
    public boolean acceptsConditions(@Nonnull String name) {
        return !VARIABLE.equals(name) && !IDENTITY.equals(name);
    }

    @Nonnull
    public DimensionConstructor get(@Nonnull String name) {
        final DimensionConstructor constructor = constructors.get(name);
        if (constructor == null) {
            throw new SpaceCoreArgumentException("unknown constructor", LogMessageKeys.CONSTRUCTOR, name);
        }
        return constructor;
    }

    /**
     * Look up a constructor and call it, rejecting unused arguments.
     * @param name the constructor name
     * @param target the space receiving the dimension
     * @param dimensionName the name of the new dimension
     * @param arguments the arguments of the call
     * @return the new dimension, or {@code null} for a directive
     */
    @Nullable
    public Dimension construct(@Nonnull String name, @Nonnull Space target, @Nonnull String dimensionName,
                               @Nonnull ConstructorArguments arguments) {
        final Dimension dimension = get(name).construct(target, dimensionName, arguments);
        arguments.checkAllUsed();
        return dimension;
    }

    @Nonnull
    private static Dimension uniform(@Nonnull Space target, @Nonnull String name, @Nonnull ConstructorArguments args) {
        return target.uniform(name, args.getNumber(0, "lower"), args.getNumber(1, "upper"),
                args.getBoolean(2, "discrete", false), args.getBoolean(3, "log", false),
                args.getOptionalNumber(4, "quantization"));
    }

    @Nonnull
    private static Dimension loguniform(@Nonnull Space target, @Nonnull String name, @Nonnull ConstructorArguments args) {
        return target.loguniform(name, args.getNumber(0, "lower"), args.getNumber(1, "upper"),
                args.getBoolean(2, "discrete", false), args.getOptionalNumber(3, "quantization"));
    }

    @Nonnull
    private static Dimension normal(@Nonnull Space target, @Nonnull String name, @Nonnull ConstructorArguments args) {
        return target.normal(name, args.getNumber(0, "loc"), args.getNumber(1, "scale"),
                args.getBoolean(2, "discrete", false), args.getBoolean(3, "log", false),
                args.getOptionalNumber(4, "quantization"));
    }

    @Nonnull
    private static Dimension lognormal(@Nonnull Space target, @Nonnull String name, @Nonnull ConstructorArguments args) {
        return target.lognormal(name, args.getNumber(0, "loc"), args.getNumber(1, "scale"),
                args.getBoolean(2, "discrete", false), args.getOptionalNumber(3, "quantization"));
    }

    @Nonnull
    private static Dimension categorical(@Nonnull Space target, @Nonnull String name, @Nonnull ConstructorArguments args) {
        if (args.has(-1, "options") || (args.getPositionalCount() == 1 && args.getOptional(0, "values") instanceof Map)) {
            return target.categorical(name, weights(args, args.getMap(0, "options")));
        }
        final List<?> values = args.getList(0, "values");
        if (!args.has(1, "weights")) {
            return target.categorical(name, values);
        }
        final List<?> weights = args.getList(1, "weights");
        if (weights.size() != values.size()) {
            throw new SpaceCoreArgumentException("values and weights must have the same length",
                    LogMessageKeys.DIMENSION, name);
        }
        final Map<Object, Object> options = new LinkedHashMap<>();
        for (int i = 0; i < values.size(); i++) {
            if (options.put(values.get(i), weights.get(i)) != null) {
                throw new SpaceCoreArgumentException("categorical values must be distinct",
                        LogMessageKeys.DIMENSION, name);
            }
        }
        return target.categorical(name, weights(args, options));
    }

    @Nonnull
    private static Map<Object, Number> weights(@Nonnull ConstructorArguments args, @Nonnull Map<?, ?> options) {
        final Map<Object, Number> weights = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : options.entrySet()) {
            if (!(entry.getValue() instanceof Number)) {
                throw new SpaceCoreArgumentException("categorical weights must be numbers",
                        LogMessageKeys.CONSTRUCTOR, args.getConstructor());
            }
            weights.put(entry.getKey(), (Number) entry.getValue());
        }
        return weights;
    }

    @Nonnull
    private static Dimension ordinal(@Nonnull Space target, @Nonnull String name, @Nonnull ConstructorArguments args) {
        if (args.has(-1, "sequence")) {
            return target.ordinal(name, args.getList(-1, "sequence"));
        }
        if (args.getPositionalCount() == 1 && args.getOptional(0, "sequence") instanceof List) {
            return target.ordinal(name, args.getList(0, "sequence"));
        }
        return target.ordinal(name, args.getRemaining(0));
    }

    @Nonnull
    private static Dimension variable(@Nonnull Space target, @Nonnull String name, @Nonnull ConstructorArguments args) {
        return target.variable(name);
    }

    @Nullable
    private static Dimension identity(@Nonnull Space target, @Nonnull String name, @Nonnull ConstructorArguments args) {
        final Number size = args.getOptionalNumber(0, "size");
        if (size == null) {
            target.identity(name);
        } else {
            target.identity(name, size.intValue());
        }
        return null;
    }
}
