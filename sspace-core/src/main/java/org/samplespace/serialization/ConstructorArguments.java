/*
 * ConstructorArguments.java
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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.annotation.API;
import org.samplespace.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The arguments of a {@link DimensionConstructor} call: positional arguments followed by keyword arguments.
 * Lookups take both the position and the keyword of an argument, so a call may use either form.
 * Values may be {@code null}, which reads the same as an absent argument.
 */
@API(API.Status.INTERNAL)
public final class ConstructorArguments {
    @Nonnull
    private final String constructor;
    @Nonnull
    private final List<Object> positional;
    @Nonnull
    private final Map<String, Object> keywords;
    @Nonnull
    private final BitSet usedPositions = new BitSet();
    @Nonnull
    private final Set<String> usedKeywords = new HashSet<>();

    public ConstructorArguments(@Nonnull String constructor, @Nonnull List<?> positional,
                                @Nonnull Map<String, ?> keywords) {
        this.constructor = constructor;
        this.positional = Collections.unmodifiableList(new ArrayList<>(positional));
        this.keywords = Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
    }

    @Nonnull
    public static ConstructorArguments ofKeywords(@Nonnull String constructor, @Nonnull Map<String, ?> keywords) {
        return new ConstructorArguments(constructor, ImmutableList.of(), keywords);
    }

    @Nonnull
    public static ConstructorArguments none(@Nonnull String constructor) {
        return new ConstructorArguments(constructor, ImmutableList.of(), ImmutableMap.of());
    }

    @Nonnull
    public String getConstructor() {
        return constructor;
    }

    public int getPositionalCount() {
        return positional.size();
    }

    /**
     * All positional arguments from a position onwards.
     * @param from first position
     * @return the remaining positional arguments
     */
    @Nonnull
    public List<Object> getRemaining(int from) {
        if (from >= positional.size()) {
            return Collections.emptyList();
        }
        usedPositions.set(from, positional.size());
        return positional.subList(from, positional.size());
    }

    public boolean has(int position, @Nonnull String keyword) {
        return getOptional(position, keyword, false) != null;
    }

    @Nullable
    public Object getOptional(int position, @Nonnull String keyword) {
        return getOptional(position, keyword, true);
    }

    @Nullable
    private Object getOptional(int position, @Nonnull String keyword, boolean markUsed) {
        if (keywords.containsKey(keyword)) {
            if (markUsed) {
                usedKeywords.add(keyword);
            }
            return keywords.get(keyword);
        }
        if (position >= 0 && position < positional.size()) {
            if (markUsed) {
                usedPositions.set(position);
            }
            return positional.get(position);
        }
        return null;
    }

    @Nonnull
    public Object get(int position, @Nonnull String keyword) {
        final Object value = getOptional(position, keyword);
        if (value == null) {
            throw error("missing argument", keyword);
        }
        return value;
    }

    @Nonnull
    public Number getNumber(int position, @Nonnull String keyword) {
        final Object value = get(position, keyword);
        if (!(value instanceof Number)) {
            throw error("argument must be a number", keyword);
        }
        return (Number) value;
    }

    @Nullable
    public Number getOptionalNumber(int position, @Nonnull String keyword) {
        final Object value = getOptional(position, keyword);
        if (value != null && !(value instanceof Number)) {
            throw error("argument must be a number", keyword);
        }
        return (Number) value;
    }

    public boolean getBoolean(int position, @Nonnull String keyword, boolean defaultValue) {
        final Object value = getOptional(position, keyword);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Boolean)) {
            throw error("argument must be a boolean", keyword);
        }
        return (Boolean) value;
    }

    @Nonnull
    public List<?> getList(int position, @Nonnull String keyword) {
        final Object value = get(position, keyword);
        if (!(value instanceof List)) {
            throw error("argument must be a list", keyword);
        }
        return (List<?>) value;
    }

    @Nonnull
    public Map<?, ?> getMap(int position, @Nonnull String keyword) {
        final Object value = get(position, keyword);
        if (!(value instanceof Map)) {
            throw error("argument must be a mapping", keyword);
        }
        return (Map<?, ?>) value;
    }

    /**
     * Reject arguments that no lookup consumed.
     * @throws SpaceCoreArgumentException if an argument was not used
     */
    public void checkAllUsed() {
        for (String keyword : keywords.keySet()) {
            if (!usedKeywords.contains(keyword)) {
                throw error("unexpected argument", keyword);
            }
        }
        for (int i = 0; i < positional.size(); i++) {
            if (!usedPositions.get(i)) {
                throw error("unexpected argument", "#" + i);
            }
        }
    }

    @Nonnull
    private SpaceCoreArgumentException error(@Nonnull String message, @Nonnull String argument) {
        return new SpaceCoreArgumentException(message,
                LogMessageKeys.CONSTRUCTOR, constructor,
                "argument", argument);
    }
}
