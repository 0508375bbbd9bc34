/*
 * NotationParserTest.java
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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link NotationParser}.
 */
public class NotationParserTest {

    @Test
    public void callWithKeywordsAndLists() {
        NotationAst.Node node = new NotationParser("categorical(values=['a', 1, none], weights=[1, 2, 3])").parseExpression();
        assertThat(node, instanceOf(NotationAst.Call.class));
        NotationAst.Call call = (NotationAst.Call) node;
        assertEquals("categorical", call.getName());
        assertEquals(2, call.getArguments().size());
        assertEquals("values", call.getArguments().get(0).getKeyword());
        NotationAst.ListExpression values = (NotationAst.ListExpression) call.getArguments().get(0).getValue();
        assertEquals(3, values.getElements().size());
        assertNull(((NotationAst.Literal) values.getElements().get(2)).getValue());
    }

    @Test
    public void conjunctionBindsTighterThanDisjunction() {
        NotationAst.Node node = new NotationParser("a == 1 | b > 2 & c != 'x'").parseExpression();
        NotationAst.Binary or = (NotationAst.Binary) node;
        assertEquals("|", or.getOperator());
        assertEquals("==", ((NotationAst.Binary) or.getLeft()).getOperator());
        NotationAst.Binary and = (NotationAst.Binary) or.getRight();
        assertEquals("&", and.getOperator());
        assertEquals(">", ((NotationAst.Binary) and.getLeft()).getOperator());
    }

    @Test
    public void parenthesesGroup() {
        NotationAst.Binary and = (NotationAst.Binary) new NotationParser("(a == 1 | b == 2) & c == 3").parseExpression();
        assertEquals("&", and.getOperator());
        assertEquals("|", ((NotationAst.Binary) and.getLeft()).getOperator());
    }

    @Test
    public void definition() {
        NotationAst.Argument definition = new NotationParser("model.lr ~ uniform(0, 1)").parseDefinition();
        assertEquals("model.lr", definition.getKeyword());
        assertEquals("uniform", ((NotationAst.Call) definition.getValue()).getName());
    }

    @Test
    public void syntaxErrors() {
        CompactNotationException e = assertThrows(CompactNotationException.class,
                () -> new NotationParser("uniform(0, 1").parseExpression());
        assertEquals(12, e.getPosition());
        assertEquals("expected ')' but found '' at position 12", e.getMessage());

        e = assertThrows(CompactNotationException.class, () -> new NotationParser("uniform(0, 1) 2").parseExpression());
        assertEquals("unexpected trailing token '2' at position 14", e.getMessage());

        e = assertThrows(CompactNotationException.class, () -> new NotationParser("uniform(0, )").parseExpression());
        assertEquals(11, e.getPosition());

        e = assertThrows(CompactNotationException.class, () -> new NotationParser("uniform(0, 1)").parseDefinition());
        assertEquals("expected '~' but found '(' at position 7", e.getMessage());

        e = assertThrows(CompactNotationException.class, () -> new NotationParser("").parseExpression());
        assertEquals("unexpected end of text '' at position 0", e.getMessage());
    }
}
