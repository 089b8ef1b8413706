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

import io.ucklang.ast.Slice;
import io.ucklang.common.Resource;
import io.ucklang.common.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

import static io.ucklang.parser.TokenType.*;

/**
 * Cursor helpers shared by recursive-descent productions. A production signals
 * failure by throwing a {@link ParseException}; callers that want to try
 * another alternative save the cursor position, catch the non-fatal ones and
 * rewind.
 */
public abstract class BaseParser {

    static final Logger logger = LoggerFactory.getLogger(BaseParser.class);

    static final int MAX_DEPTH = 256;

    protected final Resource resource;
    protected final TokenCursor cursor;

    private int depth;

    protected BaseParser(Resource resource) {
        this.resource = resource;
        this.cursor = TokenCursor.of(resource);
    }

    @Override
    public String toString() {
        return cursor.toString();
    }

    // ========== Token Access ==========

    protected Token next() {
        return cursor.next();
    }

    protected TokenType peekType() {
        return cursor.peekType();
    }

    protected void skipComments() {
        while (cursor.peekType() == COMMENT) {
            cursor.next();
        }
    }

    /**
     * Looks past comments without consuming them, so a comment stays in place
     * when the lookahead does not lead anywhere.
     */
    protected TokenType peekSignificant() {
        int position = cursor.savePosition();
        skipComments();
        TokenType type = cursor.peekType();
        cursor.returnToPosition(position);
        return type;
    }

    /**
     * Consumes the next significant token if it has the given type.
     *
     * @return the token, or null (and nothing consumed) if it did not match
     */
    protected Token accept(TokenType type) {
        if (peekSignificant() != type) {
            return null;
        }
        skipComments();
        return next();
    }

    protected boolean consumeIf(TokenType type) {
        return accept(type) != null;
    }

    protected Token expect(TokenType type, boolean fatal, String... expected) {
        skipComments();
        Token token = next();
        if (token.type != type) {
            throw error(token, fatal, expected);
        }
        return token;
    }

    protected Span previousSpan() {
        Token token = cursor.previous();
        return token == null ? Span.empty(0) : token.getSpan();
    }

    protected Slice slice(Token token) {
        return new Slice(token.getSpan(), resource.getText());
    }

    // ========== Errors ==========

    protected ParseException error(Token token, boolean fatal, String... expected) {
        ParseError error = ParseError.unexpected(token, fatal, expected);
        if (logger.isTraceEnabled()) {
            logger.trace("{}\nparser state: {}", error, this);
        }
        return new ParseException(error);
    }

    /**
     * Runs a production that has already seen its defining token: any failure
     * inside it is fatal.
     */
    protected <T> T committed(Supplier<T> production) {
        try {
            return production.get();
        } catch (ParseException e) {
            throw e.toFatal();
        }
    }

    // ========== Recursion Guard ==========

    protected void descend() {
        if (++depth > MAX_DEPTH) {
            depth--;
            throw error(cursor.peek(), true, "at most " + MAX_DEPTH + " levels of nesting");
        }
    }

    protected void ascend() {
        depth--;
    }

    protected void resetDepth() {
        depth = 0;
    }

}
