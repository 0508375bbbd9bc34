/*
 * NotationLexer.java
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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.samplespace.annotation.API;
import org.samplespace.expressions.Values;

import javax.annotation.Nonnull;
import java.math.BigInteger;
import java.util.List;
import java.util.Set;

/**
 * Splits compact notation text into {@link NotationToken}s.
 *
 * <p>
 * Operators are runs of at most two characters among {@code ~ = ! < > & |}; only {@code ~ = == != < > & |}
 * are valid. Separators are {@code , ( ) [ ]}. Whitespace only separates tokens. Identifiers start with a letter
 * or {@code _} and may contain letters, digits, {@code _} and {@code .}. Numbers may start with {@code -} and
 * have one decimal point and an exponent; integers become {@link Integer} or {@link Long} when they fit, other
 * numbers {@link Double}. Strings are single or double quoted, with backslash escapes.
 * </p>
 */
@API(API.Status.INTERNAL)
public final class NotationLexer {
    private static final String OPERATOR_CHARACTERS = "~=!<>&|";
    private static final String SEPARATOR_CHARACTERS = ",()[]";
    private static final Set<String> OPERATORS = ImmutableSet.of("~", "=", "==", "!=", "<", ">", "&", "|");

    @Nonnull
    private final String text;
    private int position;

    public NotationLexer(@Nonnull String text) {
        this.text = text;
    }

    /**
     * Tokenize the whole text.
     * @return the tokens, ending with a {@link NotationToken.Type#END} token
     * @throws CompactNotationException on an unsupported character, a malformed number or an unterminated string
     */
    @Nonnull
    public List<NotationToken> tokenize() {
        final ImmutableList.Builder<NotationToken> tokens = ImmutableList.builder();
        position = 0;
        while (true) {
            skipWhitespace();
            if (position >= text.length()) {
                tokens.add(new NotationToken(NotationToken.Type.END, "", null, position));
                return tokens.build();
            }
            tokens.add(next());
        }
    }

    @Nonnull
    private NotationToken next() {
        final char c = text.charAt(position);
        if (OPERATOR_CHARACTERS.indexOf(c) >= 0) {
            return operator();
        }
        if (SEPARATOR_CHARACTERS.indexOf(c) >= 0) {
            position++;
            return new NotationToken(NotationToken.Type.SEPARATOR, String.valueOf(c), null, position - 1);
        }
        if (Character.isLetter(c) || c == '_') {
            return identifier();
        }
        if (Character.isDigit(c) || (c == '-' && position + 1 < text.length() && Character.isDigit(text.charAt(position + 1)))) {
            return number();
        }
        if (c == '\'' || c == '"') {
            return string(c);
        }
        throw new CompactNotationException("unsupported character", text, position, String.valueOf(c));
    }

    @Nonnull
    private NotationToken operator() {
        final int start = position;
        while (position < text.length() && position - start < 2 && OPERATOR_CHARACTERS.indexOf(text.charAt(position)) >= 0) {
            position++;
        }
        final String operator = text.substring(start, position);
        if (!OPERATORS.contains(operator)) {
            throw new CompactNotationException("unknown operator", text, start, operator);
        }
        return new NotationToken(NotationToken.Type.OPERATOR, operator, null, start);
    }

    @Nonnull
    private NotationToken identifier() {
        final int start = position;
        while (position < text.length()) {
            final char c = text.charAt(position);
            if (!Character.isLetterOrDigit(c) && c != '_' && c != '.') {
                break;
            }
            position++;
        }
        return new NotationToken(NotationToken.Type.IDENTIFIER, text.substring(start, position), null, start);
    }

    @Nonnull
    private NotationToken number() {
        final int start = position;
        if (text.charAt(position) == '-') {
            position++;
        }
        boolean decimal = false;
        boolean exponent = false;
        while (position < text.length()) {
            final char c = text.charAt(position);
            if (Character.isDigit(c)) {
                position++;
            } else if (c == '.') {
                if (decimal || exponent) {
                    throw new CompactNotationException("invalid number", text, start, text.substring(start, position + 1));
                }
                decimal = true;
                position++;
            } else if ((c == 'e' || c == 'E') && !exponent) {
                exponent = true;
                position++;
                if (position < text.length() && (text.charAt(position) == '+' || text.charAt(position) == '-')) {
                    position++;
                }
                if (position >= text.length() || !Character.isDigit(text.charAt(position))) {
                    throw new CompactNotationException("invalid number", text, start,
                            text.substring(start, Math.min(position + 1, text.length())));
                }
            } else {
                break;
            }
        }
        if (position < text.length() && (Character.isLetter(text.charAt(position)) || text.charAt(position) == '_')) {
            throw new CompactNotationException("invalid number", text, start, text.substring(start, position + 1));
        }
        final String literal = text.substring(start, position);
        final Number value;
        if (decimal || exponent) {
            value = Double.parseDouble(literal);
        } else {
            final BigInteger integer = new BigInteger(literal);
            value = integer.bitLength() < Long.SIZE ? Values.normalizeNumber(integer.longValue()) : (Number) integer.doubleValue();
        }
        return new NotationToken(NotationToken.Type.NUMBER, literal, value, start);
    }

    @Nonnull
    private NotationToken string(char quote) {
        final int start = position;
        final StringBuilder value = new StringBuilder();
        position++;
        while (position < text.length()) {
            final char c = text.charAt(position);
            if (c == quote) {
                position++;
                return new NotationToken(NotationToken.Type.STRING, text.substring(start, position), value.toString(), start);
            }
            if (c == '\\') {
                if (position + 1 >= text.length()) {
                    break;
                }
                value.append(unescape(text.charAt(position + 1)));
                position += 2;
            } else {
                value.append(c);
                position++;
            }
        }
        throw new CompactNotationException("unterminated string", text, start, text.substring(start));
    }

    private char unescape(char c) {
        switch (c) {
            case 'n':
                return '\n';
            case 't':
                return '\t';
            case 'r':
                return '\r';
            default:
                return c;
        }
    }

    private void skipWhitespace() {
        while (position < text.length() && Character.isWhitespace(text.charAt(position))) {
            position++;
        }
    }
}
