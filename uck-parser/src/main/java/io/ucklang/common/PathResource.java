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

import java.nio.file.Files;
import java.nio.file.Path;

public class PathResource implements Resource {

    private final Path path;
    private final String relativePath;

    // lazy
    private String text;
    private String[] lines;

    /**
     * The relative path is taken against the working directory, or is the
     * absolute path when the file lies outside it.
     */
    public PathResource(Path path) {
        this.path = path.toAbsolutePath().normalize();
        Path root = FileUtils.WORKING_DIR.toPath().normalize();
        String display = this.path.startsWith(root)
                ? root.relativize(this.path).toString() : this.path.toString();
        this.relativePath = display.replace('\\', '/');
    }

    @Override
    public String getRelativePath() {
        return relativePath;
    }

    @Override
    public String getText() {
        if (text == null) {
            try {
                text = FileUtils.toString(Files.readAllBytes(path));
            } catch (Exception e) {
                throw new RuntimeException("Failed to read text from: " + path, e);
            }
        }
        return text;
    }

    @Override
    public String getLine(int index) {
        if (lines == null) {
            lines = getText().split("\\r?\\n");
        }
        if (index < 0 || index >= lines.length) {
            return "";
        }
        return lines[index];
    }

    @Override
    public String toString() {
        return relativePath;
    }

}
