/*
 * CompilationScope.java
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

import org.samplespace.annotation.API;
import org.samplespace.expressions.Space;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The compiled parameters visible while compiling one space: its own leaf dimensions by local name, and the
 * parameters of its nested spaces by their prefixed name.
 *
 * <p>
 * A condition reference resolves first as written, then with the path of the compiled space stripped from
 * its front. A condition built from a handle in a nested space carries the full path of that handle, and
 * still resolves while that nested space is compiled on its own.
 * </p>
 *
 * @param <P> the type of a compiled parameter
 */
@API(API.Status.INTERNAL)
public final class CompilationScope<P> {
    @Nonnull
    private final String path;
    @Nonnull
    private final Map<String, P> parameters = new LinkedHashMap<>();

    public CompilationScope(@Nonnull String path) {
        this.path = path;
    }

    @Nonnull
    public String getPath() {
        return path;
    }

    public void register(@Nonnull String name, @Nonnull P parameter) {
        parameters.put(name, parameter);
    }

    @Nonnull
    public Map<String, P> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    /**
     * Resolve a condition reference.
     * @param reference dotted path of the referenced dimension
     * @return the compiled parameter
     * @throws UnresolvedReferenceException if the reference names no parameter of this scope
     */
    @Nonnull
    public P resolve(@Nonnull String reference) {
        P parameter = parameters.get(reference);
        if (parameter == null) {
            parameter = parameters.get(relativeReference(reference));
        }
        if (parameter == null) {
            throw new UnresolvedReferenceException(reference, path);
        }
        return parameter;
    }

    /**
     * The name a reference resolves to in this scope.
     * @param reference dotted path of the referenced dimension
     * @return the local name of the referenced parameter
     * @throws UnresolvedReferenceException if the reference names no parameter of this scope
     */
    @Nonnull
    public String resolveName(@Nonnull String reference) {
        if (parameters.containsKey(reference)) {
            return reference;
        }
        final String relative = relativeReference(reference);
        if (relative != null && parameters.containsKey(relative)) {
            return relative;
        }
        throw new UnresolvedReferenceException(reference, path);
    }

    @Nullable
    private String relativeReference(@Nonnull String reference) {
        final String prefix = path + Space.DELIMITER;
        if (!path.isEmpty() && reference.startsWith(prefix)) {
            return reference.substring(prefix.length());
        }
        return null;
    }
}
