/*
 * SpaceBackendsTest.java
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
import org.samplespace.SpaceCoreArgumentException;
import org.samplespace.expressions.Space;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasKey;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link SpaceBackends}.
 */
public class SpaceBackendsTest {

    @Test
    public void registryIsShared() {
        assertSame(SpaceBackends.instance().getBackendNames(), SpaceBackends.instance().getBackendNames());
    }

    @Test
    public void unknownBackend() {
        SpaceCoreArgumentException e = assertThrows(SpaceCoreArgumentException.class,
                () -> SpaceBackends.instance().getBackend("no-such-backend"));
        assertEquals("unknown backend", e.getMessage());
        assertThat(e.getLogInfo(), hasKey("available_backends"));
    }

    @Test
    public void instantiateWithUnknownBackendLeavesSpaceMutable() {
        Space space = new Space("no-such-backend");
        space.uniform("a", 0, 1);
        assertThrows(SpaceCoreArgumentException.class, space::instantiate);
        space.uniform("b", 0, 1);
        assertEquals(2, space.getChildren().size());
    }
}
