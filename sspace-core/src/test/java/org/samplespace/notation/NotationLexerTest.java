/*
 * NotationLexerTest.java
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

package org.samplespace.notation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link NotationLexer}.
 */
public class NotationLexerTest {

    private static List<NotationToken> tokenize(String text) {
        return new NotationLexer(text).tokenize();
    }

    @Test
    public void tokenTypes() {
        List<NotationToken> tokens = tokenize("lr ~ loguniform(lower=1e-4, upper=0.1, condition=opt.kind != 'sgd')");
        assertThat(tokens.stream().map(NotationToken::getType).collect(Collectors.toList()), contains(
                NotationToken.Type.IDENTIFIER, NotationToken.Type.OPERATOR, NotationToken.Type.IDENTIFIER,
                NotationToken.Type.SEPARATOR,
                NotationToken.Type.IDENTIFIER, NotationToken.Type.OPERATOR, NotationToken.Type.NUMBER,
                NotationToken.Type.SEPARATOR,
                NotationToken.Type.IDENTIFIER, NotationToken.Type.OPERATOR, NotationToken.Type.NUMBER,
                NotationToken.Type.SEPARATOR,
                NotationToken.Type.IDENTIFIER, NotationToken.Type.OPERATOR, NotationToken.Type.IDENTIFIER,
                NotationToken.Type.OPERATOR, NotationToken.Type.STRING,
                NotationToken.Type.SEPARATOR, NotationToken.Type.END));
        assertEquals("opt.kind", tokens.get(14).getText());
        assertEquals(49, tokens.get(14).getPosition());
        assertEquals("sgd", tokens.get(16).getValue());
    }

    @Test
    public void numbers() {
        List<NotationToken> tokens = tokenize("3 -2 2.5 1e3 4E-2 9999999999 99999999999999999999");
        assertEquals(3, tokens.get(0).getValue());
        assertEquals(-2, tokens.get(1).getValue());
        assertEquals(2.5, tokens.get(2).getValue());
        assertEquals(1000.0, tokens.get(3).getValue());
        assertEquals(0.04, tokens.get(4).getValue());
        assertEquals(9999999999L, tokens.get(5).getValue());
        assertEquals(1e20, tokens.get(6).getValue());
    }

    @Test
    public void stringEscapes() {
        List<NotationToken> tokens = tokenize("'it\\'s' \"a\\tb\"");
        assertEquals("it's", tokens.get(0).getValue());
        assertEquals("a\tb", tokens.get(1).getValue());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "uniform(0, 1) $      | unsupported character | 14 | $",
            "a >= 1               | unknown operator      | 2  | >=",
            "1.2.3                | invalid number        | 0  | 1.2.",
            "12abc                | invalid number        | 0  | 12a",
            "1e+                  | invalid number        | 0  | 1e+",
            "'open                | unterminated string   | 0  | 'open",
    })
    public void errorsCarryPosition(String text, String message, int position, String token) {
        CompactNotationException e = assertThrows(CompactNotationException.class, () -> tokenize(text));
        assertEquals(position, e.getPosition());
        assertEquals(token, e.getToken());
        assertEquals(message + " '" + token + "' at position " + position, e.getMessage());
    }
}
