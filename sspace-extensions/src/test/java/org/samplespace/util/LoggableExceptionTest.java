/*
 * LoggableExceptionTest.java
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

package org.samplespace.util;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.anEmptyMap;
import static org.hamcrest.Matchers.arrayContaining;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link LoggableException}.
 */
public class LoggableExceptionTest {

    @Test
    public void keysAndValuesFromConstructor() {
        LoggableException e = new LoggableException("unknown constructor", "token", "uniformm", "position", 3);
        assertEquals("unknown constructor", e.getMessage());
        assertEquals(Map.of("token", "uniformm", "position", 3), e.getLogInfo());
    }

    @Test
    public void exportKeepsInsertionOrder() {
        LoggableException e = new LoggableException("missing variables")
                .addLogInfo("backend", "constrained")
                .addLogInfo("dimension", "lr", "reference", "optimizer");
        assertThat(e.getLogInfo().keySet(), contains("backend", "dimension", "reference"));
        assertThat(e.exportLogInfo(), arrayContaining("backend", "constrained", "dimension", "lr", "reference", "optimizer"));
    }

    @Test
    public void emptyLogInfo() {
        LoggableException e = new LoggableException("no info", (Throwable) null);
        assertThat(e.getLogInfo(), anEmptyMap());
        assertEquals(0, e.exportLogInfo().length);
    }

    @Test
    public void unbalancedKeysAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new LoggableException("odd", "key"));
    }
}
