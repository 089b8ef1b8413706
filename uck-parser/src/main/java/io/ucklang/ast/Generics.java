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
package io.ucklang.ast;

import io.ucklang.common.Span;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * A {@code <...>} block. In a declaration the keys are the generic names; when
 * types are applied the keys are the positions {@code "0"}, {@code "1"} and so
 * on. Iteration follows source order.
 */
public record Generics(Span span, Map<String, GenericEntry> entries) implements AstNode {

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public GenericEntry get(String key) {
        return entries.get(key);
    }

    @Override
    public String toString() {
        return entries.entrySet().stream()
                .map(e -> e.getValue().name() == null ? String.valueOf(e.getValue().bound())
                        : e.getValue().bound() == null ? e.getKey() : e.getKey() + ": " + e.getValue().bound())
                .collect(Collectors.joining(", ", "<", ">"));
    }

}
