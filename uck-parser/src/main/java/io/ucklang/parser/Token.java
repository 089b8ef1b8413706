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
 * One lexical unit. The text is never copied out of the source, it is sliced
 * from the shared {@link Resource} on demand.
 */
public class Token {

    final Resource resource;

    public final TokenType type;
    public final int pos;
    public final int length;
    public final int line;
    public final int col;

    private final Span span;

    public Token(Resource resource, TokenType type, int pos, int line, int col, int length) {
        this.resource = resource;
        this.type = type;
        this.pos = pos;
        this.line = line;
        this.col = col;
        this.length = length;
        this.span = new Span(pos, pos + length);
    }

    public Resource getResource() {
        return resource;
    }

    public Span getSpan() {
        return span;
    }

    public String getText() {
        return resource.getText().substring(pos, pos + length);
    }

    /**
     * @return the decoded literal value, or null if this is not a literal
     * @see Literals#valueOf(Token)
     */
    public Object getValue() {
        return Literals.valueOf(this);
    }

    public String getPositionDisplay() {
        return (line + 1) + ":" + (col + 1);
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "_EOF_" : getText();
    }

}
