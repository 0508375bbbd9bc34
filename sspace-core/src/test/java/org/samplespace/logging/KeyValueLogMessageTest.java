/*
 * KeyValueLogMessageTest.java
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

package org.samplespace.logging;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link KeyValueLogMessage}.
 */
public class KeyValueLogMessageTest {

    @Test
    public void keysAreSortedAndQuoted() {
        String message = KeyValueLogMessage.of("compiled space",
                LogMessageKeys.DIMENSION_COUNT, 2,
                LogMessageKeys.BACKEND, "constrained");
        assertEquals("compiled space backend=\"constrained\" dimension_count=\"2\"", message);
    }

    @Test
    public void quotesAndEqualsAreSanitized() {
        KeyValueLogMessage message = KeyValueLogMessage.build("parsed")
                .addKeyAndValue("a=b", "say \"hi\"")
                .addKeyAndValue(LogMessageKeys.TITLE, null);
        assertEquals("parsed ab=\"say 'hi'\" ttl=\"null\"", message.toString());
    }

    @Test
    public void unbalancedArguments() {
        assertThrows(IllegalArgumentException.class, () -> KeyValueLogMessage.of("bad", LogMessageKeys.SPACE));
    }
}
