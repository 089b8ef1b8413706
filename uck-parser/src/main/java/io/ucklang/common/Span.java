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
package io.ucklang.common;

/**
 * Half-open range {@code [start, end)} of offsets into a resource's text.
 * Offsets count UTF-16 {@code char}s as in {@link String#substring(int, int)},
 * not UTF-8 bytes; a letter outside the basic plane is two units wide.
 * {@link #END_OF_INPUT} is the one span allowed to lie past the text.
 */
public final class Span {

    public static final Span END_OF_INPUT = new Span(Integer.MAX_VALUE, Integer.MAX_VALUE);

    public final int start;
    public final int end;

    public Span(int start, int end) {
        if (start < 0 || start > end) {
            throw new IllegalArgumentException("invalid span: " + start + ".." + end);
        }
        this.start = start;
        this.end = end;
    }

    public static Span empty(int at) {
        return new Span(at, at);
    }

    /**
     * @return a span from the start of this one to the end of {@code other}
     */
    public Span to(Span other) {
        if (isEndOfInput() || other.isEndOfInput()) {
            return END_OF_INPUT;
        }
        return new Span(start, Math.max(start, other.end));
    }

    public boolean isEndOfInput() {
        return start == Integer.MAX_VALUE;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public int length() {
        return end - start;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Span other)) {
            return false;
        }
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return isEndOfInput() ? "<end of input>" : start + ".." + end;
    }

}
