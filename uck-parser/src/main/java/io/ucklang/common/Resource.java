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

import java.io.InputStream;
import java.nio.file.Path;

/**
 * Source text handed to the front end. Everything the tokenizer and the AST
 * refer to is a range into {@link #getText()}, so a resource must return the
 * same string instance for its whole lifetime.
 */
public interface Resource {

    String STDIN = "<stdin>";

    static Resource text(String text) {
        return new MemoryResource(text);
    }

    static Resource text(String text, String relativePath) {
        return new MemoryResource(text, relativePath);
    }

    static Resource path(Path path) {
        return new PathResource(path);
    }

    static Resource stream(InputStream is, String relativePath) {
        return new MemoryResource(FileUtils.toString(is), relativePath);
    }

    String getRelativePath();

    String getText();

    String getLine(int index);

    /**
     * Converts an offset into the text into a 1-based "line:col" display string,
     * counting one column per code point. Offsets past the end of the text are
     * clamped to the end.
     */
    default String getPositionDisplay(int offset) {
        String text = getText();
        int limit = Math.min(Math.max(offset, 0), text.length());
        int line = 1;
        int col = 1;
        for (int i = 0; i < limit; i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                line++;
                col = 1;
            } else if (!Character.isLowSurrogate(c) || i == 0 || !Character.isHighSurrogate(text.charAt(i - 1))) {
                col++;
            }
        }
        return line + ":" + col;
    }

}
