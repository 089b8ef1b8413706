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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LiteralsTest {

    private static Object value(String text) {
        return new UckLexer(Resource.text(text)).nextToken().getValue();
    }

    @Test
    void testIntegers() {
        assertEquals(42L, value("42"));
        assertEquals(Long.MAX_VALUE, value("9223372036854775807"));
    }

    @Test
    void testWords() {
        assertEquals(7L, value("7u"));
        assertEquals(255L, value("0xff"));
        assertEquals(255L, value("0xFF"));
        assertEquals(10L, value("0b1010"));
        // unsigned bit pattern
        assertEquals(-1L, value("0xFFFFFFFFFFFFFFFF"));
        assertEquals("18446744073709551615", Long.toUnsignedString((Long) value("18446744073709551615u")));
    }

    @Test
    void testFloats() {
        assertEquals(1.5, value("1.5"));
        assertEquals(1.0, value("1."));
        assertEquals(1e10, value("1e10"));
        assertEquals(0.0015, value("1.5E-3"));
    }

    @Test
    void testStringsAndChars() {
        assertEquals("tab\there", value("\"tab\\there\""));
        assertEquals("nul\0", value("\"nul\\0\""));
        assertEquals("back\\slash", value("\"back\\\\slash\""));
        assertEquals("raw\\t", value("l\"raw\\t\""));
        assertEquals('a', value("'a'"));
        assertEquals('\r', value("'\\r'"));
        assertEquals('"', value("'\\\"'"));
    }

    @Test
    void testNonLiteral() {
        assertNull(value("foo"));
        assertNull(value("{"));
    }

    @Test
    void testUnescape() {
        assertEquals("plain", Literals.unescape("plain"));
        assertEquals("a\nb\tc", Literals.unescape("a\\nb\\tc"));
        assertEquals("q\"'", Literals.unescape("q\\\"\\'"));
        // unknown escapes stand for the escaped character
        assertEquals("x", Literals.unescape("\\x"));
    }

}
