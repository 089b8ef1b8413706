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
import io.ucklang.common.Span;

/**
 * Lookahead and backtracking over the token stream. Every token pulled from
 * the lexer is kept in a {@link TokenBuffer}, so rewinding to a saved position
 * and scanning forward again replays the exact same tokens without
 * re-tokenizing. The lexer is asked for a token only when the cursor moves
 * past the end of the cache, and never again once EOF has been produced.
 */
public class TokenCursor {

    private final BaseLexer lexer;
    private final TokenBuffer buffer;

    private int index;
    private Token current;
    private boolean exhausted;

    public TokenCursor(BaseLexer lexer) {
        this.lexer = lexer;
        this.buffer = new TokenBuffer(lexer.length);
    }

    public static TokenCursor of(Resource resource) {
        return new TokenCursor(new UckLexer(resource));
    }

    public Resource getResource() {
        return lexer.getResource();
    }

    public Token next() {
        Token token;
        if (index < buffer.size()) {
            token = buffer.get(index);
        } else if (exhausted) {
            token = buffer.last();
        } else {
            token = lexer.nextToken();
            buffer.add(token);
            if (token.type == TokenType.EOF) {
                exhausted = true;
            }
        }
        index++;
        current = token;
        return token;
    }

    public Token peek() {
        Token token = next();
        index--;
        return token;
    }

    public TokenType peekType() {
        return peek().type;
    }

    /**
     * @return the token most recently returned by {@link #next()} or
     * {@link #peek()}, or null before the first call
     */
    public Token current() {
        return current;
    }

    public Span span() {
        return current == null ? null : current.getSpan();
    }

    public String slice() {
        return current == null ? null : current.getText();
    }

    /**
     * @return the last token consumed before the current position, or null at
     * the very start
     */
    public Token previous() {
        return index == 0 ? null : tokenAt(index - 1);
    }

    public int savePosition() {
        return index;
    }

    public void returnToPosition(int position) {
        if (position < 0) {
            throw new IllegalArgumentException("invalid cursor position: " + position);
        }
        index = position;
        current = previous();
    }

    /**
     * @return how many tokens have been pulled from the lexer so far
     */
    public int cachedCount() {
        return buffer.size();
    }

    private Token tokenAt(int i) {
        // positions past the cache can only be repeated reads of EOF
        return i < buffer.size() ? buffer.get(i) : buffer.last();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int start = Math.max(0, index - 7);
        int end = Math.min(index + 7, buffer.size());
        for (int i = start; i < end; i++) {
            if (i == 0) {
                sb.append("| ");
            }
            if (i == index) {
                sb.append(">>");
            }
            sb.append(buffer.get(i));
            sb.append(' ');
        }
        if (index >= buffer.size()) {
            sb.append(">>");
        }
        sb.append('|');
        return sb.toString();
    }

}
