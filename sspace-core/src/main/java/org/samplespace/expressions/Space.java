/*
 * Space.java
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

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import org.samplespace.MissingVariableException;
import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.SpaceProperties;
import org.samplespace.annotation.API;
import org.samplespace.backend.CompiledSpace;
import org.samplespace.backend.SpaceBackend;
import org.samplespace.backend.SpaceBackends;
import org.samplespace.conditions.Condition;
import org.samplespace.logging.KeyValueLogMessage;
import org.samplespace.logging.LogMessageKeys;
import org.samplespace.notation.CompactNotation;
import org.samplespace.serialization.SpaceDeserializer;
import org.samplespace.serialization.SpaceFiles;
import org.samplespace.serialization.SpaceSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

/**
 * A named, possibly nested container of dimensions, and the root artifact everything else builds, walks or
 * reconstructs.
 *
 * <p>
 * Children are kept in insertion order, which positional engines rely on. Names passed to the building
 * methods may be dotted: {@code space.uniform("model.lr", 0, 1)} creates (or reuses) a subspace {@code model}
 * holding a dimension {@code lr}. When a segment of the path is already taken by a leaf dimension, the rest of
 * the path is kept as a literal dotted name instead: after {@code space.categorical("optimizer", ...)},
 * {@code space.loguniform("optimizer.lr", 1, 2)} adds a dimension named {@code optimizer.lr} next to
 * {@code optimizer}. {@link #unflatten(Map)} resolves dotted sample keys with the same rule.
 * </p>
 *
 * <p>
 * Variables and the identity directive live on the root only; declaring them on a subspace forwards them to
 * the root under the subspace's dotted prefix.
 * </p>
 *
 * <p>
 * The tree is built by a single thread. Once {@linkplain #instantiate() instantiated} it, and every subspace
 * below it, rejects further modification; the compiled handle is cached and reused by {@link #sample}.
 * </p>
 */
@API(API.Status.STABLE)
public class Space extends Dimension {
    public static final String DELIMITER = SpaceProperties.DELIMITER;

    private static final Logger LOGGER = LoggerFactory.getLogger(Space.class);
    private static final Splitter PATH_SPLITTER = Splitter.on(DELIMITER);

    @Nullable
    private final Space parent;
    @Nonnull
    private final SpaceProperties properties;
    @Nonnull
    private final Map<String, Dimension> children = new LinkedHashMap<>();
    @Nonnull
    private final Map<String, VariableDimension> variables = new LinkedHashMap<>();
    @Nullable
    private String identityField;
    private int identitySize;
    @Nullable
    private CompiledSpace<?> compiled;

    public Space() {
        this(SpaceProperties.DEFAULT);
    }

    /**
     * Create a root space compiled by the named backend.
     * @param backend the name of the backend, see {@link SpaceBackends}
     */
    public Space(@Nonnull String backend) {
        this(SpaceProperties.DEFAULT.toBuilder().setBackend(backend).build());
    }

    public Space(@Nonnull SpaceProperties properties) {
        this("", null, properties);
    }

    private Space(@Nonnull String name, @Nullable Space parent, @Nonnull SpaceProperties properties) {
        super(name, parent);
        this.parent = parent;
        this.properties = properties;
        this.identitySize = properties.getIdentitySize();
    }

    @Nullable
    public Space getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    @Nonnull
    public Space getRoot() {
        Space current = this;
        while (current.parent != null) {
            current = current.parent;
        }
        return current;
    }

    @Nonnull
    public SpaceProperties getProperties() {
        return properties;
    }

    @Nonnull
    public String getBackend() {
        return properties.getBackend();
    }

    /**
     * The children of this space by local name, in insertion order.
     * @return an unmodifiable view of the children
     */
    @Nonnull
    public Map<String, Dimension> getChildren() {
        return Collections.unmodifiableMap(children);
    }

    @Nullable
    public Dimension getChild(@Nonnull String name) {
        return children.get(name);
    }

    /**
     * The variables declared on this tree by full dotted name. Only the root holds variables.
     * @return an unmodifiable view of the variables
     */
    @Nonnull
    public Map<String, VariableDimension> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    @Nullable
    public String getIdentityField() {
        return identityField;
    }

    public int getIdentitySize() {
        return identitySize;
    }

    public boolean isInstantiated() {
        return compiled != null;
    }

    @Nonnull
    public ContinuousDimension uniform(@Nonnull String name, @Nonnull Number lower, @Nonnull Number upper) {
        return uniform(name, lower, upper, false, false, null);
    }

    /**
     * Add a dimension drawn uniformly between two bounds.
     * @param name name of the dimension, possibly dotted
     * @param lower lower bound
     * @param upper upper bound
     * @param discrete whether values are integers
     * @param log whether values are drawn uniformly in log space
     * @param quantization step values are rounded to, or {@code null}
     * @return the new dimension
     */
    @Nonnull
    public ContinuousDimension uniform(@Nonnull String name, @Nonnull Number lower, @Nonnull Number upper,
                                       boolean discrete, boolean log, @Nullable Number quantization) {
        return add(name, (local, container) -> new ContinuousDimension(local, container, Distribution.UNIFORM,
                lower, upper, discrete, log, quantization));
    }

    @Nonnull
    public ContinuousDimension loguniform(@Nonnull String name, @Nonnull Number lower, @Nonnull Number upper) {
        return uniform(name, lower, upper, false, true, null);
    }

    @Nonnull
    public ContinuousDimension loguniform(@Nonnull String name, @Nonnull Number lower, @Nonnull Number upper,
                                          boolean discrete, @Nullable Number quantization) {
        return uniform(name, lower, upper, discrete, true, quantization);
    }

    @Nonnull
    public ContinuousDimension normal(@Nonnull String name, @Nonnull Number loc, @Nonnull Number scale) {
        return normal(name, loc, scale, false, false, null);
    }

    /**
     * Add a dimension drawn from a normal distribution.
     * @param name name of the dimension, possibly dotted
     * @param loc mean of the distribution
     * @param scale standard deviation of the distribution
     * @param discrete whether values are integers
     * @param log whether the logarithm of the values is normally distributed
     * @param quantization step values are rounded to, or {@code null}
     * @return the new dimension
     */
    @Nonnull
    public ContinuousDimension normal(@Nonnull String name, @Nonnull Number loc, @Nonnull Number scale,
                                      boolean discrete, boolean log, @Nullable Number quantization) {
        return add(name, (local, container) -> new ContinuousDimension(local, container, Distribution.NORMAL,
                loc, scale, discrete, log, quantization));
    }

    @Nonnull
    public ContinuousDimension lognormal(@Nonnull String name, @Nonnull Number loc, @Nonnull Number scale) {
        return normal(name, loc, scale, false, true, null);
    }

    @Nonnull
    public ContinuousDimension lognormal(@Nonnull String name, @Nonnull Number loc, @Nonnull Number scale,
                                         boolean discrete, @Nullable Number quantization) {
        return normal(name, loc, scale, discrete, true, quantization);
    }

    /**
     * Add a categorical dimension whose values are equally likely.
     * @param name name of the dimension, possibly dotted
     * @param values the distinct values
     * @return the new dimension
     */
    @Nonnull
    public CategoricalDimension categorical(@Nonnull String name, @Nonnull List<?> values) {
        return categorical(name, CategoricalDimension.equalWeights(name, values));
    }

    /**
     * Add a categorical dimension with a relative weight per value.
     * @param name name of the dimension, possibly dotted
     * @param options values mapped to their weights, in order
     * @return the new dimension
     */
    @Nonnull
    public CategoricalDimension categorical(@Nonnull String name, @Nonnull Map<?, ? extends Number> options) {
        return add(name, (local, container) -> new CategoricalDimension(local, container, options));
    }

    @Nonnull
    public CategoricalDimension choices(@Nonnull String name, @Nonnull List<?> values) {
        return categorical(name, values);
    }

    @Nonnull
    public CategoricalDimension choices(@Nonnull String name, @Nonnull Map<?, ? extends Number> options) {
        return categorical(name, options);
    }

    /**
     * Add an ordinal dimension, whose samples walk the sequence in order.
     * @param name name of the dimension, possibly dotted
     * @param sequence the values in walk order
     * @return the new dimension
     */
    @Nonnull
    public OrdinalDimension ordinal(@Nonnull String name, @Nonnull List<?> sequence) {
        return add(name, (local, container) -> new OrdinalDimension(local, container, sequence));
    }

    @Nonnull
    public OrdinalDimension ordinal(@Nonnull String name, @Nonnull Object... sequence) {
        return ordinal(name, List.of(sequence));
    }

    /**
     * Declare a variable whose value is supplied at sample time. On a subspace the declaration is forwarded
     * to the root as {@code <subspace path>.<name>}.
     * @param name name of the variable
     * @return the variable as stored by the root
     */
    @Nonnull
    public VariableDimension variable(@Nonnull String name) {
        checkMutable();
        validateName(name);
        if (parent != null) {
            return parent.variable(getName() + DELIMITER + name);
        }
        if (variables.containsKey(name) || children.containsKey(name)) {
            throw new SpaceCoreArgumentException("name is already used in space",
                    LogMessageKeys.DIMENSION, name);
        }
        final VariableDimension variable = new VariableDimension(name, this);
        variables.put(name, variable);
        return variable;
    }

    public void identity(@Nonnull String name) {
        identity(name, properties.getIdentitySize());
    }

    /**
     * Append a field holding a digest of every sample's values. On a subspace the directive is forwarded to
     * the root as {@code <subspace path>.<name>}.
     * @param name name of the field added to samples
     * @param size number of hexadecimal characters kept from the digest
     * @see SampleIdentity
     */
    public void identity(@Nonnull String name, int size) {
        checkMutable();
        validateName(name);
        Preconditions.checkArgument(size > 0 && size <= SpaceProperties.MAX_IDENTITY_SIZE,
                "identity size must be between 1 and %s", SpaceProperties.MAX_IDENTITY_SIZE);
        if (parent != null) {
            parent.identity(getName() + DELIMITER + name, size);
            return;
        }
        identityField = name;
        identitySize = size;
    }

    /**
     * Add a nested space, which inherits the backend of this one.
     * @param name name of the subspace, possibly dotted
     * @return the new subspace
     */
    @Nonnull
    public Space subspace(@Nonnull String name) {
        return add(name, (local, container) -> new Space(local, container, container.properties));
    }

    /**
     * Conditions decorate leaf dimensions only.
     * @param condition ignored
     * @throws SpaceCoreArgumentException always
     */
    @Override
    public void enableIf(@Nonnull Condition condition) {
        throw new SpaceCoreArgumentException("subspaces cannot be conditioned", LogMessageKeys.SPACE, getPath());
    }

    /**
     * Forbidden clauses decorate leaf dimensions only.
     * @param clause ignored
     * @throws SpaceCoreArgumentException always
     */
    @Override
    public void forbid(@Nonnull Condition clause) {
        throw new SpaceCoreArgumentException("subspaces cannot carry forbidden clauses", LogMessageKeys.SPACE, getPath());
    }

    @Override
    public <T> T accept(@Nonnull DimensionVisitor<T> visitor) {
        return visitor.visitSpace(this);
    }

    /**
     * Compile this space with its configured backend.
     * @return the backend handle
     */
    @Nonnull
    public Object instantiate() {
        return instantiate(properties.getBackend());
    }

    @Nonnull
    public Object instantiate(@Nonnull String backend) {
        return instantiate(SpaceBackends.instance().getBackend(backend));
    }

    /**
     * Compile this space with the given backend and cache the handle for sampling. After this call the
     * structure of the tree is frozen.
     * @param backend the backend compiling the tree
     * @param <H> the type of the backend handle
     * @return the backend handle
     */
    @Nonnull
    public <H> H instantiate(@Nonnull SpaceBackend<H> backend) {
        final H handle = backend.compile(this);
        compiled = new CompiledSpace<>(backend, handle);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("instantiated space",
                    LogMessageKeys.BACKEND, backend.getName(),
                    LogMessageKeys.PATH, getPath(),
                    LogMessageKeys.DIMENSION_COUNT, children.size()));
        }
        return handle;
    }

    @Nonnull
    public List<Map<String, Object>> sample() {
        return sample(1);
    }

    @Nonnull
    public List<Map<String, Object>> sample(int count) {
        return sample(count, 0L);
    }

    @Nonnull
    public List<Map<String, Object>> sample(int count, long seed) {
        return sample(count, seed, Collections.emptyMap());
    }

    /**
     * Draw samples. Sampling is deterministic: the same tree, backend, count and seed always give the same
     * samples. Each sample is keyed by dimension name, with subspaces as nested maps, the supplied variables
     * merged in and the identity field appended when one is declared. The space is instantiated with its
     * configured backend first if needed.
     * @param count number of samples
     * @param seed seed of the backend's generator
     * @param variableValues values of the declared variables, by full dotted name; entries naming no declared
     * variable are left out of the samples
     * @return one map per sample
     * @throws MissingVariableException if a declared variable is not supplied, before anything is sampled
     */
    @Nonnull
    public List<Map<String, Object>> sample(int count, long seed, @Nonnull Map<String, ?> variableValues) {
        Preconditions.checkArgument(count >= 0, "sample count must not be negative");
        final List<String> missing = variables.keySet().stream()
                .filter(name -> !variableValues.containsKey(name))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new MissingVariableException(missing);
        }
        if (compiled == null) {
            instantiate();
        }
        final List<Map<String, Object>> configurations = compiled.sample(count, seed);
        final List<Map<String, Object>> samples = new ArrayList<>(configurations.size());
        for (Map<String, Object> configuration : configurations) {
            final Map<String, Object> flat = new LinkedHashMap<>(new TreeMap<>(configuration));
            for (String variable : variables.keySet()) {
                flat.put(variable, variableValues.get(variable));
            }
            if (identityField != null) {
                flat.put(identityField, SampleIdentity.compute(flat, identitySize));
            }
            samples.add(unflatten(flat));
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("sampled space",
                    LogMessageKeys.BACKEND, compiled.getBackend().getName(),
                    LogMessageKeys.SAMPLE_COUNT, count,
                    LogMessageKeys.SEED, seed));
        }
        return samples;
    }

    /**
     * Nest the dotted keys of a flat mapping using the shape of this tree. A key is only split as deep as the
     * tree has matching subspaces; an unmatched remainder stays a single dotted key.
     * @param dictionary flat mapping keyed by dotted paths
     * @return the nested mapping
     */
    @Nonnull
    public Map<String, Object> unflatten(@Nonnull Map<String, ?> dictionary) {
        final Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : dictionary.entrySet()) {
            final List<String> segments = PATH_SPLITTER.splitToList(entry.getKey());
            String lastName = segments.get(segments.size() - 1);
            Map<String, Object> current = result;
            Space scope = this;
            for (int i = 0; i < segments.size() - 1; i++) {
                final Dimension child = scope.children.get(segments.get(i));
                if (!(child instanceof Space)) {
                    lastName = String.join(DELIMITER, segments.subList(i, segments.size()));
                    break;
                }
                scope = (Space) child;
                current = nestedMap(current, segments.get(i), entry.getKey());
            }
            current.put(lastName, entry.getValue());
        }
        return result;
    }

    /**
     * Join nested keys with the delimiter. Empty nested mappings are kept as values.
     * @param nested nested mapping
     * @return the flat mapping keyed by dotted paths
     */
    @Nonnull
    public static Map<String, Object> flatten(@Nonnull Map<String, ?> nested) {
        final Map<String, Object> flat = new LinkedHashMap<>();
        flattenInto("", nested, flat);
        return flat;
    }

    private static void flattenInto(@Nonnull String prefix, @Nonnull Map<?, ?> nested, @Nonnull Map<String, Object> flat) {
        for (Map.Entry<?, ?> entry : nested.entrySet()) {
            final String key = prefix.isEmpty() ? String.valueOf(entry.getKey()) : prefix + DELIMITER + entry.getKey();
            if (entry.getValue() instanceof Map && !((Map<?, ?>) entry.getValue()).isEmpty()) {
                flattenInto(key, (Map<?, ?>) entry.getValue(), flat);
            } else {
                flat.put(key, entry.getValue());
            }
        }
    }

    @SuppressWarnings("unchecked")
    @Nonnull
    private static Map<String, Object> nestedMap(@Nonnull Map<String, Object> current, @Nonnull String segment,
                                                 @Nonnull String key) {
        final Object existing = current.computeIfAbsent(segment, ignored -> new LinkedHashMap<String, Object>());
        if (!(existing instanceof Map)) {
            throw new SpaceCoreArgumentException("sample key collides with a subspace",
                    LogMessageKeys.PATH, key,
                    LogMessageKeys.SPACE, segment);
        }
        return (Map<String, Object>) existing;
    }

    /**
     * Canonical nested-mapping form of this space.
     * @return the serialized space
     * @see SpaceSerializer
     */
    @Nonnull
    public Map<String, Object> serialize() {
        return SpaceSerializer.serialize(this);
    }

    /**
     * Compact notation form of this space: every dimension rendered as a call-like string.
     * @return the rendered space
     * @see CompactNotation
     */
    @Nonnull
    public Map<String, Object> toCompactNotation() {
        return CompactNotation.render(this);
    }

    /**
     * Write the canonical form of this space to a JSON file.
     * @param file destination file
     * @throws IOException if writing fails
     */
    public void toJson(@Nonnull Path file) throws IOException {
        SpaceFiles.write(file, serialize());
    }

    @Nonnull
    public static Space fromMap(@Nonnull Map<String, ?> data) {
        return fromMap(data, new Space());
    }

    /**
     * Rebuild a space from a nested mapping in canonical form, compact notation, or a mix of both.
     * @param data the serialized space
     * @param target space receiving the dimensions
     * @return {@code target}
     */
    @Nonnull
    public static Space fromMap(@Nonnull Map<String, ?> data, @Nonnull Space target) {
        return SpaceDeserializer.deserialize(data, target);
    }

    @Nonnull
    public static Space fromJson(@Nonnull Path file) throws IOException {
        return fromJson(file, new Space());
    }

    @Nonnull
    public static Space fromJson(@Nonnull Path file, @Nonnull Space target) throws IOException {
        return fromMap(SpaceFiles.read(file), target);
    }

    @Override
    void checkMutable() {
        for (Space current = this; current != null; current = current.parent) {
            if (current.compiled != null) {
                throw new SpaceCoreArgumentException("space is instantiated and can no longer be modified",
                        LogMessageKeys.SPACE, current.getPath());
            }
        }
    }

    @Nonnull
    private <D extends Dimension> D add(@Nonnull String name, @Nonnull BiFunction<String, Space, D> constructor) {
        checkMutable();
        validateName(name);
        final List<String> segments = PATH_SPLITTER.splitToList(name);
        Space container = this;
        String localName = segments.get(segments.size() - 1);
        for (int i = 0; i < segments.size() - 1; i++) {
            final String segment = segments.get(i);
            final Dimension existing = container.children.get(segment);
            if (existing == null) {
                container = container.register(segment, new Space(segment, container, container.properties));
            } else if (existing instanceof Space) {
                container = (Space) existing;
            } else {
                // a leaf owns this segment, keep the remainder as one literal dotted name
                localName = String.join(DELIMITER, segments.subList(i, segments.size()));
                break;
            }
        }
        return container.register(localName, constructor.apply(localName, container));
    }

    @Nonnull
    private <D extends Dimension> D register(@Nonnull String localName, @Nonnull D dimension) {
        if (children.containsKey(localName) || (parent == null && variables.containsKey(localName))) {
            throw new SpaceCoreArgumentException("name is already used in space",
                    LogMessageKeys.DIMENSION, localName,
                    LogMessageKeys.SPACE, getPath());
        }
        children.put(localName, dimension);
        return dimension;
    }

    private static void validateName(@Nonnull String name) {
        if (name.isEmpty() || PATH_SPLITTER.splitToList(name).contains("")) {
            throw new SpaceCoreArgumentException("invalid dimension name", LogMessageKeys.DIMENSION, name);
        }
    }

    @Override
    public String toString() {
        return "space(" + (isRoot() ? "<root>" : getPath()) + ", " + children.values() + ")";
    }
}
