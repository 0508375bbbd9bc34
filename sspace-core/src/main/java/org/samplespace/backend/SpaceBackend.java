/*
 * SpaceBackend.java
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
import java.util.List;
import java.util.Map;

/**
 * A sampling engine. A backend compiles a {@link Space} into its own representation, the handle, and draws
 * samples from that handle.
 *
 * <p>
 * Sampling must be deterministic: the same handle, count and seed always give the same samples. Any
 * feature of the tree the backend cannot honor must be rejected by {@link #compile}, never skipped.
 * </p>
 *
 * <p>
 * Backends are discovered with {@link java.util.ServiceLoader} through their {@link Factory} and looked up by
 * name in {@link SpaceBackends}. Most implementations extend {@link SpaceCompiler}.
 * </p>
 *
 * @param <H> the type of the compiled handle
 */
@API(API.Status.STABLE)
public interface SpaceBackend<H> {

    /**
     * The name a {@link Space} selects this backend with.
     * @return the backend name
     */
    @Nonnull
    String getName();

    /**
     * Compile a space tree.
     * @param space the root of the compiled tree
     * @return the compiled handle
     * @throws UnsupportedOperatorException if the tree uses a feature this backend does not support
     * @throws UnresolvedReferenceException if a condition refers to a dimension outside its scope
     */
    @Nonnull
    H compile(@Nonnull Space space);

    /**
     * Draw samples from a compiled handle.
     * @param handle a handle returned by {@link #compile}
     * @param count number of samples
     * @param seed seed of the random generator
     * @return one flat mapping per sample, keyed by dotted dimension path; inactive dimensions are absent
     * @throws SamplingException if the engine cannot produce a valid sample
     */
    @Nonnull
    List<Map<String, Object>> sample(@Nonnull H handle, int count, long seed);

    /**
     * A factory for a backend, registered with {@link java.util.ServiceLoader}.
     */
    interface Factory {
        @Nonnull
        String getName();

        @Nonnull
        SpaceBackend<?> createBackend();
    }
}
