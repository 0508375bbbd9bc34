/*
 * CompiledSpace.java
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

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;

/**
 * A backend bound to the handle it compiled.
 *
 * @param <H> the type of the compiled handle
 */
@API(API.Status.INTERNAL)
public final class CompiledSpace<H> {
    @Nonnull
    private final SpaceBackend<H> backend;
    @Nonnull
    private final H handle;

    public CompiledSpace(@Nonnull SpaceBackend<H> backend, @Nonnull H handle) {
        this.backend = backend;
        this.handle = handle;
    }

    @Nonnull
    public SpaceBackend<H> getBackend() {
        return backend;
    }

    @Nonnull
    public H getHandle() {
        return handle;
    }

    @Nonnull
    public List<Map<String, Object>> sample(int count, long seed) {
        return backend.sample(handle, count, seed);
    }
}
