/*
 * NotationParser.java
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

import org.samplespace.annotation.API;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser of compact notation.
 *
 * <pre>
 * definition  := IDENTIFIER '~' expression
 * expression  := disjunction
 * disjunction := conjunction ( '|' conjunction )*
 * conjunction := comparison ( '&amp;' comparison )*
 * comparison  := primary ( ('==' | '!=' | '&lt;' | '&gt;') primary )?
 * primary     := call | list | NUMBER | STRING | IDENTIFIER | '(' expression ')'
 * call        := IDENTIFIER '(' [ argument ( ',' argument )* ] ')'
 * argument    := [ IDENTIFIER '=' ] expression
 * list        := '[' [ expression ( ',' expression )* ] ']'
 * </pre>
 *
 * {@code true}, {@code false} and {@code none} are read as literals.
 */
@API(API.Status.INTERNAL)
public final class NotationParser {
    @Nonnull
    private final String text;
    @Nonnull
    private final List<NotationToken> tokens;
    private int index;

    public NotationParser(@Nonnull String text) {
        this.text = text;
        this.tokens = new NotationLexer(text).tokenize();
    }

    /**
     * Parse the whole text as one expression.
     * @return the root of the syntax tree
     * @throws CompactNotationException if the text is not a single well-formed expression
     */
    @Nonnull
    public NotationAst.Node parseExpression() {
        index = 0;
        final NotationAst.Node expression = expression();
        expectEnd();
        return expression;
    }

    /**
     * Parse a {@code name ~ expression} definition.
     * @return the defined name and its expression, as a keyword argument
     * @throws CompactNotationException if the text is not a definition
     */
    @Nonnull
    public NotationAst.Argument parseDefinition() {
        index = 0;
        final NotationToken name = peek();
        if (name.getType() != NotationToken.Type.IDENTIFIER) {
            throw unexpected(name, "expected a dimension name");
        }
        index++;
        expect(NotationToken.Type.OPERATOR, "~");
        final NotationAst.Node expression = expression();
        expectEnd();
        return new NotationAst.Argument(name.getText(), expression);
    }

    @Nonnull
    private NotationAst.Node expression() {
        NotationAst.Node left = conjunction();
        while (peek().is(NotationToken.Type.OPERATOR, "|")) {
            final NotationToken operator = advance();
            left = new NotationAst.Binary(operator.getPosition(), operator.getText(), left, conjunction());
        }
        return left;
    }

    @Nonnull
    private NotationAst.Node conjunction() {
        NotationAst.Node left = comparison();
        while (peek().is(NotationToken.Type.OPERATOR, "&")) {
            final NotationToken operator = advance();
            left = new NotationAst.Binary(operator.getPosition(), operator.getText(), left, comparison());
        }
        return left;
    }

    @Nonnull
    private NotationAst.Node comparison() {
        final NotationAst.Node left = primary();
        final NotationToken next = peek();
        if (next.getType() == NotationToken.Type.OPERATOR
                && ("==".equals(next.getText()) || "!=".equals(next.getText())
                    || "<".equals(next.getText()) || ">".equals(next.getText()))) {
            advance();
            return new NotationAst.Binary(next.getPosition(), next.getText(), left, primary());
        }
        return left;
    }

    @Nonnull
    private NotationAst.Node primary() {
        final NotationToken token = advance();
        switch (token.getType()) {
            case NUMBER:
            case STRING:
                return new NotationAst.Literal(token.getPosition(), token.getValue());
            case IDENTIFIER:
                if (peek().is(NotationToken.Type.SEPARATOR, "(")) {
                    return call(token);
                }
                return identifierOrKeyword(token);
            case SEPARATOR:
                if ("[".equals(token.getText())) {
                    return list(token);
                }
                if ("(".equals(token.getText())) {
                    final NotationAst.Node inner = expression();
                    expect(NotationToken.Type.SEPARATOR, ")");
                    return inner;
                }
                throw unexpected(token, "unexpected separator");
            case END:
                throw unexpected(token, "unexpected end of text");
            default:
                throw unexpected(token, "unexpected token");
        }
    }

    @Nonnull
    private NotationAst.Node identifierOrKeyword(@Nonnull NotationToken token) {
        switch (token.getText()) {
            case "true":
                return new NotationAst.Literal(token.getPosition(), Boolean.TRUE);
            case "false":
                return new NotationAst.Literal(token.getPosition(), Boolean.FALSE);
            case "none":
                return new NotationAst.Literal(token.getPosition(), null);
            default:
                return new NotationAst.Identifier(token.getPosition(), token.getText());
        }
    }

    @Nonnull
    private NotationAst.Node call(@Nonnull NotationToken name) {
        expect(NotationToken.Type.SEPARATOR, "(");
        final List<NotationAst.Argument> arguments = new ArrayList<>();
        if (!peek().is(NotationToken.Type.SEPARATOR, ")")) {
            do {
                arguments.add(argument());
            } while (acceptSeparator(","));
        }
        expect(NotationToken.Type.SEPARATOR, ")");
        return new NotationAst.Call(name.getPosition(), name.getText(), arguments);
    }

    @Nonnull
    private NotationAst.Argument argument() {
        if (peek().getType() == NotationToken.Type.IDENTIFIER && peek(1).is(NotationToken.Type.OPERATOR, "=")) {
            final NotationToken keyword = advance();
            advance();
            return new NotationAst.Argument(keyword.getText(), expression());
        }
        return new NotationAst.Argument(null, expression());
    }

    @Nonnull
    private NotationAst.Node list(@Nonnull NotationToken open) {
        final List<NotationAst.Node> elements = new ArrayList<>();
        if (!peek().is(NotationToken.Type.SEPARATOR, "]")) {
            do {
                elements.add(expression());
            } while (acceptSeparator(","));
        }
        expect(NotationToken.Type.SEPARATOR, "]");
        return new NotationAst.ListExpression(open.getPosition(), elements);
    }

    private boolean acceptSeparator(@Nonnull String separator) {
        if (peek().is(NotationToken.Type.SEPARATOR, separator)) {
            index++;
            return true;
        }
        return false;
    }

    private void expect(@Nonnull NotationToken.Type type, @Nonnull String expected) {
        final NotationToken token = peek();
        if (!token.is(type, expected)) {
            throw unexpected(token, "expected '" + expected + "' but found");
        }
        index++;
    }

    private void expectEnd() {
        final NotationToken token = peek();
        if (token.getType() != NotationToken.Type.END) {
            throw unexpected(token, "unexpected trailing token");
        }
    }

    @Nonnull
    private NotationToken peek() {
        return peek(0);
    }

    @Nonnull
    private NotationToken peek(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    @Nonnull
    private NotationToken advance() {
        final NotationToken token = peek();
        if (token.getType() != NotationToken.Type.END) {
            index++;
        }
        return token;
    }

    @Nonnull
    private CompactNotationException unexpected(@Nonnull NotationToken token, @Nonnull String message) {
        return new CompactNotationException(message, text, token.getPosition(), token.getText());
    }
}
