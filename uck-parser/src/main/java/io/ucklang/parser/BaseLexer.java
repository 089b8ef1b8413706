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

import java.util.ArrayList;
import java.util.List;

import static io.ucklang.parser.TokenType.*;

/**
 * Abstract base class for lexers. Provides common utilities for character
 * handling, position tracking, and tokenization. Whitespace never reaches the
 * token stream, subclasses only scan significant tokens.
 */
public abstract class BaseLexer {

    protected final Resource resource;
    protected final String source;
    protected final int length;

    protected int pos;
    protected int line;
    protected int col;
    protected int tokenStart;
    protected int tokenLine;
    protected int tokenCol;

    protected BaseLexer(Resource resource) {
        this.resource = resource;
        this.source = resource.getText();
        this.length = source.length();
        this.pos = 0;
        this.line = 0;
        this.col = 0;
    }

    // ========== Public API ==========

    /**
     * Produces the next token. Once the input is exhausted every call returns
     * a zero-length {@link TokenType#EOF} token at the end of the source.
     */
    public Token nextToken() {
        skipWhitespace();
        tokenStart = pos;
        tokenLine = line;
        tokenCol = col;
        TokenType type = isAtEnd() ? EOF : scanToken();
        return new Token(resource, type, tokenStart, tokenLine, tokenCol, pos - tokenStart);
    }

    protected abstract TokenType scanToken();

    public Resource getResource() {
        return resource;
    }

    // ========== Tokenization Utilities ==========

    /**
     * Tokenizes the whole source, comments included. The last entry is always
     * the EOF token.
     */
    public static List<Token> tokenize(BaseLexer lexer) {
        List<Token> list = new ArrayList<>();
        Token token;
        do {
            token = lexer.nextToken();
            list.add(token);
        } while (token.type != EOF);
        return list;
    }

    // ========== Character Utilities ==========

    protected boolean isAtEnd() {
        return pos >= length;
    }

    protected char peek() {
        return pos >= length ? '\0' : source.charAt(pos);
    }

    protected char peek(int offset) {
        int index = pos + offset;
        return (index < 0 || index >= length) ? '\0' : source.charAt(index);
    }

    protected char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 0;
        } else if (!Character.isLowSurrogate(c) || pos < 2 || !Character.isHighSurrogate(source.charAt(pos - 2))) {
            col++; // one column per code point
        }
        return c;
    }

    /**
     * @return the code point at the current position, or 0 at end of input
     */
    protected int peekCodePoint() {
        return pos >= length ? 0 : source.codePointAt(pos);
    }

    protected void advanceCodePoint() {
        int cp = source.codePointAt(pos);
        for (int i = Character.charCount(cp); i > 0; i--) {
            advance();
        }
    }

    protected boolean match(char expected) {
        if (pos >= length || source.charAt(pos) != expected) {
            return false;
        }
        advance();
        return true;
    }

    protected void skipWhitespace() {
        while (pos < length) {
            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\f') {
                advance();
            } else {
                break;
            }
        }
    }

    // ========== Character Classification ==========

    protected static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    protected static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    protected static boolean isBinaryDigit(char c) {
        return c == '0' || c == '1';
    }

    protected static boolean isIdentifierStart(int c) {
        return c == '_' || Character.isLetter(c);
    }

    protected static boolean isIdentifierPart(int c) {
        if (c == '_' || Character.isLetterOrDigit(c)) {
            return true;
        }
        int type = Character.getType(c);
        return type == Character.LETTER_NUMBER || type == Character.OTHER_NUMBER;
    }

}
