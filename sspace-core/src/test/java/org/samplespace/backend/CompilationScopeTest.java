/*
 * CompilationScopeTest.java
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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link CompilationScope}.
 */
public class CompilationScopeTest {

    @Test
    public void resolvesAsWrittenFirst() {
        CompilationScope<Integer> scope = new CompilationScope<>("model");
        scope.register("model.kind", 1);
        scope.register("kind", 2);
        assertEquals(1, scope.resolve("model.kind"));
        assertEquals("model.kind", scope.resolveName("model.kind"));
    }

    @Test
    public void stripsOwnPrefix() {
        CompilationScope<Integer> scope = new CompilationScope<>("outer.model");
        scope.register("kind", 2);
        scope.register("encoder.depth", 3);
        assertEquals(2, scope.resolve("outer.model.kind"));
        assertEquals(3, scope.resolve("outer.model.encoder.depth"));
        assertEquals("encoder.depth", scope.resolveName("outer.model.encoder.depth"));
    }

    @Test
    public void rootScopeDoesNotStrip() {
        CompilationScope<Integer> scope = new CompilationScope<>("");
        scope.register("kind", 2);
        assertThrows(UnresolvedReferenceException.class, () -> scope.resolve(".kind"));
        assertThrows(UnresolvedReferenceException.class, () -> scope.resolveName("other"));
    }
}
