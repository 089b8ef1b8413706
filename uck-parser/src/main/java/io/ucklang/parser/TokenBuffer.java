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

import java.util.Arrays;

/**
 * Append-only store of every token produced for one source. Entries are never
 * removed or replaced, so an index handed out once always resolves to the
 * same token.
 */
public class TokenBuffer {

    private static final int MIN_CAPACITY = 64;
    // Heuristic: roughly 1 token per 4 characters of source
    private static final int CHARS_PER_TOKEN = 4;

    private Token[] tokens;
    private int count;

    public TokenBuffer(int sourceLength) {
        this.tokens = new Token[Math.max(MIN_CAPACITY, sourceLength / CHARS_PER_TOKEN)];
        this.count = 0;
    }

    /**
     * Registers a token and returns its index in the buffer.
     */
    public int add(Token token) {
        if (count >= tokens.length) {
            tokens = Arrays.copyOf(tokens, tokens.length * 2);
        }
        int index = count++;
        tokens[index] = token;
        return index;
    }

    public Token get(int index) {
        return (index >= 0 && index < count) ? tokens[index] : null;
    }

    public Token last() {
        return count == 0 ? null : tokens[count - 1];
    }

    public int size() {
        return count;
    }

}
