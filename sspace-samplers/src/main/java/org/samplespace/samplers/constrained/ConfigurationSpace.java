/*
 * ConfigurationSpace.java
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

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.annotation.API;
import org.samplespace.backend.SamplingException;
import org.samplespace.expressions.Space;
import org.samplespace.logging.KeyValueLogMessage;
import org.samplespace.logging.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The compiled form of a space for the constrained engine: parameters in insertion order, activation
 * conditions and forbidden clauses.
 *
 * <p>
 * A configuration draws every parameter, then walks them in order and drops those whose condition does not
 * hold on the values still active. Conditions only refer to parameters added before the one they decorate,
 * so one pass is enough and a parameter conditioned on an inactive one is inactive too. A configuration for
 * which any forbidden clause holds is drawn again, up to a fixed number of attempts.
 * </p>
 */
@API(API.Status.INTERNAL)
public class ConfigurationSpace {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigurationSpace.class);

    @Nonnull
    private final Map<String, Hyperparameter> hyperparameters = new LinkedHashMap<>();
    @Nonnull
    private final Map<String, Clause> conditions = new LinkedHashMap<>();
    @Nonnull
    private final List<Clause> forbiddenClauses = new ArrayList<>();

    public void addHyperparameter(@Nonnull Hyperparameter hyperparameter) {
        if (hyperparameters.putIfAbsent(hyperparameter.getName(), hyperparameter) != null) {
            throw new SpaceCoreArgumentException("hyperparameter already exists",
                    LogMessageKeys.DIMENSION, hyperparameter.getName());
        }
    }

    /**
     * Make a parameter active only when a clause holds.
     * @param target name of the conditioned parameter
     * @param clause the activation condition
     */
    public void addCondition(@Nonnull String target, @Nonnull Clause clause) {
        if (!hyperparameters.containsKey(target)) {
            throw new SpaceCoreArgumentException("condition on unknown hyperparameter", LogMessageKeys.DIMENSION, target);
        }
        if (conditions.putIfAbsent(target, clause) != null) {
            throw new SpaceCoreArgumentException("hyperparameter already has a condition", LogMessageKeys.DIMENSION, target);
        }
    }

    public void addForbiddenClause(@Nonnull Clause clause) {
        forbiddenClauses.add(clause);
    }

    /**
     * Copy the parameters, conditions and forbidden clauses of another space into this one, each name
     * prefixed with {@code prefix + "."}.
     * @param prefix the prefix
     * @param nested the space to copy
     * @return the copied parameters by their new name
     */
    @Nonnull
    public Map<String, Hyperparameter> addConfigurationSpace(@Nonnull String prefix, @Nonnull ConfigurationSpace nested) {
        final Map<String, Hyperparameter> mounted = new LinkedHashMap<>();
        for (Hyperparameter hyperparameter : nested.hyperparameters.values()) {
            final Hyperparameter renamed = hyperparameter.withName(prefix + Space.DELIMITER + hyperparameter.getName());
            addHyperparameter(renamed);
            mounted.put(renamed.getName(), renamed);
        }
        for (Map.Entry<String, Clause> condition : nested.conditions.entrySet()) {
            addCondition(prefix + Space.DELIMITER + condition.getKey(), condition.getValue().withPrefix(prefix));
        }
        for (Clause clause : nested.forbiddenClauses) {
            addForbiddenClause(clause.withPrefix(prefix));
        }
        return mounted;
    }

    @Nonnull
    public Map<String, Hyperparameter> getHyperparameters() {
        return Collections.unmodifiableMap(hyperparameters);
    }

    @Nonnull
    public Map<String, Clause> getConditions() {
        return Collections.unmodifiableMap(conditions);
    }

    @Nonnull
    public List<Clause> getForbiddenClauses() {
        return Collections.unmodifiableList(forbiddenClauses);
    }

    /**
     * Draw configurations.
     * @param count number of configurations
     * @param seed seed of the generator, also the position of the first configuration
     * @param maxAttempts number of draws per configuration before giving up on forbidden ones
     * @return the configurations, each sorted by parameter name
     * @throws SamplingException if every attempt for a configuration is forbidden
     */
    @Nonnull
    public List<Map<String, Object>> sample(int count, long seed, int maxAttempts) {
        final RandomGenerator random = new MersenneTwister(seed);
        final List<Map<String, Object>> configurations = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            configurations.add(sampleConfiguration(random, seed + i, maxAttempts));
        }
        return configurations;
    }

    @Nonnull
    private Map<String, Object> sampleConfiguration(@Nonnull RandomGenerator random, long position, int maxAttempts) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            final Map<String, Object> configuration = draw(random, position);
            if (forbiddenClauses.stream().noneMatch(clause -> clause.test(configuration))) {
                return new TreeMap<>(configuration);
            }
            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace(KeyValueLogMessage.of("rejected forbidden configuration",
                        LogMessageKeys.ATTEMPTS, attempt,
                        LogMessageKeys.POSITION, position));
            }
        }
        throw new SamplingException("every drawn configuration was forbidden",
                LogMessageKeys.ATTEMPTS, maxAttempts,
                LogMessageKeys.POSITION, position);
    }

    @Nonnull
    private Map<String, Object> draw(@Nonnull RandomGenerator random, long position) {
        final Map<String, Object> configuration = new LinkedHashMap<>();
        for (Hyperparameter hyperparameter : hyperparameters.values()) {
            configuration.put(hyperparameter.getName(), hyperparameter.sample(random, position));
        }
        for (Hyperparameter hyperparameter : hyperparameters.values()) {
            final Clause condition = conditions.get(hyperparameter.getName());
            if (condition != null && !condition.test(configuration)) {
                configuration.remove(hyperparameter.getName());
            }
        }
        return configuration;
    }
}
