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

/**
 * Decodes literal tokens into Java values. Unsigned 64-bit words are returned
 * as a {@link Long} holding the same bit pattern, use
 * {@link Long#toUnsignedString(long)} to display them.
 */
public class Literals {

    private Literals() {
        // only static methods
    }

    public static Object valueOf(Token token) {
        String text = token.getText();
        return switch (token.type) {
            case INT_LIT -> Long.parseLong(text);
            case WORD_LIT -> parseWord(text);
            case FLOAT_LIT -> Double.parseDouble(text);
            case BOOL_LIT -> "true".equals(text);
            case CHAR_LIT -> charValue(text);
            case STRING_LIT -> stringValue(text);
            default -> null;
        };
    }

    /**
     * @return true if the numeric literal text is representable in its type
     */
    static boolean fits(TokenType type, String text) {
        try {
            switch (type) {
                case INT_LIT -> Long.parseLong(text);
                case WORD_LIT -> parseWord(text);
                case FLOAT_LIT -> {
                    return !Double.isInfinite(Double.parseDouble(text));
                }
                default -> {
                    return true;
                }
            }
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    static long parseWord(String text) {
        if (text.length() > 2 && text.charAt(0) == '0') {
            char radix = text.charAt(1);
            if (radix == 'x' || radix == 'X') {
                return Long.parseUnsignedLong(text.substring(2), 16);
            }
            if (radix == 'b' || radix == 'B') {
                return Long.parseUnsignedLong(text.substring(2), 2);
            }
        }
        // trailing `u`
        return Long.parseUnsignedLong(text.substring(0, text.length() - 1));
    }

    static Character charValue(String text) {
        if (text.startsWith("l")) {
            return text.charAt(2);
        }
        return unescape(text.substring(1, text.length() - 1)).charAt(0);
    }

    static String stringValue(String text) {
        if (text.startsWith("l")) {
            return text.substring(2, text.length() - 1);
        }
        return unescape(text.substring(1, text.length() - 1));
    }

    public static String unescape(String text) {
        if (text.indexOf('\\') == -1) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != '\\' || i + 1 == text.length()) {
                sb.append(c);
                continue;
            }
            char next = text.charAt(++i);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case '0' -> sb.append('\0');
                default -> sb.append(next); // \" \' \\ and anything else stands for itself
            }
        }
        return sb.toString();
    }

}
