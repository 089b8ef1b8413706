/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.ucklang.parser;

import io.ucklang.common.Resource;

import static io.ucklang.parser.TokenType.*;

/**
 * Single pass scanner for uck source text. The scanner is total: any input it
 * cannot match becomes an {@link TokenType#ERROR} token and scanning carries
 * on after it.
 */
public class UckLexer extends BaseLexer {

    public UckLexer(Resource resource) {
        super(resource);
    }

    // ========== Main Scanner ==========

    @Override
    protected TokenType scanToken() {
        char c = source.charAt(pos);

        if (c == '/' && (peek(1) == '/' || peek(1) == '*')) {
            return peek(1) == '/' ? scanLineComment() : scanBlockComment();
        }

        if (c == '"') {
            advance();
            return scanString(false);
        }
        if (c == '\'') {
            advance();
            return scanChar(false);
        }
        // `l` prefix must win over the identifier rule
        if (c == 'l' && (peek(1) == '"' || peek(1) == '\'')) {
            advance();
            return advance() == '"' ? scanString(true) : scanChar(true);
        }

        if (isIdentifierStart(source.codePointAt(pos))) {
            return scanIdentifier();
        }

        if (isDigit(c)) {
            return scanNumber();
        }

        return scanOperator();
    }

    // ========== Comments ==========

    private TokenType scanLineComment() {
        while (!isAtEnd() && peek() != '\n') {
            advance();
        }
        return COMMENT;
    }

    private TokenType scanBlockComment() {
        advance(); // '/'
        advance(); // '*'
        int depth = 1;
        while (!isAtEnd()) {
            char c = advance();
            if (c == '/' && peek() == '*') {
                advance();
                depth++;
            } else if (c == '*' && peek() == '/') {
                advance();
                if (--depth == 0) {
                    return COMMENT;
                }
            }
        }
        return ERROR; // unterminated
    }

    // ========== Strings ==========

    private TokenType scanString(boolean raw) {
        while (!isAtEnd()) {
            char c = advance();
            if (c == '"') {
                return STRING_LIT;
            }
            if (c == '\\' && !raw && !isAtEnd()) {
                advance();
            }
        }
        return ERROR; // unterminated
    }

    private TokenType scanChar(boolean raw) {
        // exactly one character or escape pair, then the closing quote
        int width;
        if (!raw && peek() == '\\') {
            width = 2;
        } else if (peek() != '\'' && !isAtEnd()) {
            width = 1;
        } else {
            return ERROR;
        }
        if (pos + width >= length || source.charAt(pos + width) != '\'') {
            return ERROR;
        }
        for (int i = 0; i <= width; i++) {
            advance();
        }
        return CHAR_LIT;
    }

    // ========== Numbers ==========

    private TokenType scanNumber() {
        if (peek() == '0' && (peek(1) == 'x' || peek(1) == 'X') && isHexDigit(peek(2))) {
            advance();
            advance();
            while (isHexDigit(peek())) {
                advance();
            }
            return checked(WORD_LIT);
        }
        if (peek() == '0' && (peek(1) == 'b' || peek(1) == 'B') && isBinaryDigit(peek(2))) {
            advance();
            advance();
            while (isBinaryDigit(peek())) {
                advance();
            }
            return checked(WORD_LIT);
        }
        while (isDigit(peek())) {
            advance();
        }
        if (peek() == 'u') {
            advance();
            return checked(WORD_LIT);
        }
        boolean isFloat = false;
        // `1..2` is a range, not the float `1.`
        if (peek() == '.' && peek(1) != '.') {
            advance();
            isFloat = true;
            while (isDigit(peek())) {
                advance();
            }
        }
        if ((peek() == 'e' || peek() == 'E') && exponentAhead()) {
            advance();
            if (peek() == '+' || peek() == '-') {
                advance();
            }
            while (isDigit(peek())) {
                advance();
            }
            isFloat = true;
        }
        return checked(isFloat ? FLOAT_LIT : INT_LIT);
    }

    private boolean exponentAhead() {
        char c = peek(1);
        if (c == '+' || c == '-') {
            return isDigit(peek(2));
        }
        return isDigit(c);
    }

    private TokenType checked(TokenType type) {
        String text = source.substring(tokenStart, pos);
        return Literals.fits(type, text) ? type : ERROR;
    }

    // ========== Identifiers and Keywords ==========

    private TokenType scanIdentifier() {
        while (!isAtEnd() && isIdentifierPart(peekCodePoint())) {
            advanceCodePoint();
        }
        String word = source.substring(tokenStart, pos);
        if ("true".equals(word) || "false".equals(word)) {
            return BOOL_LIT;
        }
        TokenType keyword = TokenType.keyword(word);
        return keyword == null ? IDENT : keyword;
    }

    // ========== Operators and Punctuation ==========

    private TokenType scanOperator() {
        char c = advance();
        return switch (c) {
            case ',' -> COMMA;
            case ':' -> COLON;
            case ';' -> SEMI;
            case '(' -> L_PAREN;
            case ')' -> R_PAREN;
            case '{' -> L_CURLY;
            case '}' -> R_CURLY;
            case '[' -> L_BRACKET;
            case ']' -> R_BRACKET;
            case '?' -> QUES;
            case '+' -> PLUS;
            case '/' -> SLASH;
            case '%' -> PERCENT;
            case '^' -> CARET;
            case '~' -> TILDE;
            case '$' -> DOLLAR;
            case '@' -> AT;
            case '#' -> HASH;
            case '.' -> match('.') ? DOT_DOT : DOT;
            case '-' -> match('>') ? MINUS_GT : MINUS;
            case '*' -> match('*') ? STAR_STAR : STAR;
            case '&' -> match('&') ? AMP_AMP : AMP;
            case '|' -> match('|') ? PIPE_PIPE : PIPE;
            case '!' -> match('=') ? NOT_EQ : NOT;
            case '=' -> {
                if (match('=')) {
                    yield EQ_EQ;
                }
                yield match('>') ? EQ_GT : EQ;
            }
            case '<' -> {
                if (match('<')) {
                    yield LT_LT;
                }
                yield match('=') ? LT_EQ : LT;
            }
            case '>' -> {
                if (match('>')) {
                    yield GT_GT;
                }
                yield match('=') ? GT_EQ : GT;
            }
            default -> {
                if (Character.isHighSurrogate(c) && Character.isLowSurrogate(peek())) {
                    advance();
                }
                yield ERROR;
            }
        };
    }

}
