/*
 * SpaceBackends.java
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

import com.google.common.collect.ImmutableMap;
import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.SpaceCoreException;
import org.samplespace.annotation.API;
import org.samplespace.logging.KeyValueLogMessage;
import org.samplespace.logging.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Registry of the {@link SpaceBackend}s available on the class path, keyed by name.
 */
@API(API.Status.UNSTABLE)
public class SpaceBackends {
    private static final Logger LOGGER = LoggerFactory.getLogger(SpaceBackends.class);
    private static final SpaceBackends INSTANCE = new SpaceBackends();

    @Nullable
    private volatile Map<String, SpaceBackend<?>> backends;

    private SpaceBackends() {
        // Will be initialized the first time a backend is requested
        backends = null;
    }

    @Nonnull
    public static SpaceBackends instance() {
        return INSTANCE;
    }

    /**
     * Look up a backend by name.
     * @param name the backend name
     * @return the backend
     * @throws SpaceCoreArgumentException if no backend of that name is registered
     */
    @Nonnull
    public SpaceBackend<?> getBackend(@Nonnull String name) {
        final Map<String, SpaceBackend<?>> registry = initOrGetRegistry();
        final SpaceBackend<?> backend = registry.get(name);
        if (backend == null) {
            throw new SpaceCoreArgumentException("unknown backend",
                    LogMessageKeys.BACKEND, name,
                    LogMessageKeys.AVAILABLE_BACKENDS, registry.keySet());
        }
        return backend;
    }

    @Nonnull
    public Set<String> getBackendNames() {
        return initOrGetRegistry().keySet();
    }

    @Nonnull
    private Map<String, SpaceBackend<?>> initOrGetRegistry() {
        // The reference to the registry is copied into a local variable to avoid referencing the
        // volatile multiple times
        Map<String, SpaceBackend<?>> currRegistry = backends;
        if (currRegistry != null) {
            return currRegistry;
        }
        synchronized (this) {
            currRegistry = backends;
            if (currRegistry == null) {
                Map<String, SpaceBackend<?>> newRegistry = initRegistry();
                backends = newRegistry;
                return newRegistry;
            } else {
                // Another thread created the registry for us
                return currRegistry;
            }
        }
    }

    @Nonnull
    private static Map<String, SpaceBackend<?>> initRegistry() {
        try {
            final ImmutableMap.Builder<String, SpaceBackend<?>> registry = ImmutableMap.builder();
            for (SpaceBackend.Factory factory : ServiceLoader.load(SpaceBackend.Factory.class)) {
                registry.put(factory.getName(), factory.createBackend());
            }
            final Map<String, SpaceBackend<?>> built = registry.buildOrThrow();
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("loaded space backends",
                        LogMessageKeys.AVAILABLE_BACKENDS, built.keySet()));
            }
            return built;
        } catch (ServiceConfigurationError | IllegalArgumentException err) {
            throw new SpaceCoreException("Unable to load all defined space backends", err);
        }
    }
}
