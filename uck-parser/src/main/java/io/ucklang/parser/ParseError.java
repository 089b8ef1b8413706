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

import io.ucklang.common.Span;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A syntax error as a value: what the parser would have accepted, where it
 * gave up, and whether the failure is fatal. A non-fatal error only means
 * "this alternative did not match" and lets the caller try another one.
 */
public final class ParseError {

    private final Set<String> expected;
    private final Span span;
    private final String found;
    private final boolean fatal;

    private ParseError(Set<String> expected, Span span, String found, boolean fatal) {
        this.expected = Collections.unmodifiableSet(expected);
        this.span = span;
        this.found = found;
        this.fatal = fatal;
    }

    public static ParseError endOfInput(boolean fatal, String... expected) {
        return new ParseError(toSet(expected), Span.END_OF_INPUT, null, fatal);
    }

    public static ParseError unexpected(String found, Span span, boolean fatal, String... expected) {
        return new ParseError(toSet(expected), span, found, fatal);
    }

    public static ParseError unexpected(Token token, boolean fatal, String... expected) {
        if (token.type == TokenType.EOF) {
            return endOfInput(fatal, expected);
        }
        return unexpected(token.getText(), token.getSpan(), fatal, expected);
    }

    private static Set<String> toSet(String... expected) {
        Set<String> set = new LinkedHashSet<>();
        Collections.addAll(set, expected);
        return set;
    }

    /**
     * Merges two alternatives that both failed. Expectations are unioned, the
     * location is end-of-input if either is, else the earliest one, and the
     * result is fatal if either side is.
     */
    public static ParseError combine(ParseError a, ParseError b) {
        Set<String> expected = new LinkedHashSet<>(a.expected);
        expected.addAll(b.expected);
        boolean fatal = a.fatal || b.fatal;
        if (a.isEndOfInput() || b.isEndOfInput()) {
            return new ParseError(expected, Span.END_OF_INPUT, null, fatal);
        }
        ParseError first = b.span.start < a.span.start ? b : a;
        return new ParseError(expected, first.span, first.found, fatal);
    }

    public ParseError combine(ParseError other) {
        return combine(this, other);
    }

    public ParseError withFatal(boolean fatal) {
        return fatal == this.fatal ? this : new ParseError(expected, span, found, fatal);
    }

    public ParseError asFatal() {
        return withFatal(true);
    }

    public Set<String> getExpected() {
        return expected;
    }

    public Span getSpan() {
        return span;
    }

    /**
     * @return the offending source text, null at end of input
     */
    public String getFound() {
        return found;
    }

    public boolean isFatal() {
        return fatal;
    }

    public boolean isEndOfInput() {
        return span.isEndOfInput();
    }

    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        if (isEndOfInput()) {
            sb.append("unexpected end of input");
        } else {
            sb.append("unexpected `").append(found).append("` at ").append(span);
        }
        if (!expected.isEmpty()) {
            sb.append(", expected ").append(String.join(" or ", expected));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return (fatal ? "fatal: " : "") + getMessage();
    }

}
