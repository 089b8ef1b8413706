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
package io.ucklang.cli;

import io.ucklang.common.Resource;
import io.ucklang.parser.ParseError;
import io.ucklang.parser.ParseException;
import io.ucklang.parser.UckParser;
import net.minidev.json.JSONValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String stdin, String... args) {
        Main main = new Main(new ByteArrayInputStream(stdin.getBytes(UTF_8)),
                new PrintStream(out, true, UTF_8), new PrintStream(err, true, UTF_8));
        return new CommandLine(main).execute(args);
    }

    private String out() {
        return out.toString(UTF_8);
    }

    private String err() {
        return err.toString(UTF_8);
    }

    @Test
    void testParseStdin() {
        assertEquals(Main.EXIT_OK, run("type A = B;"));
        Map<?, ?> json = (Map<?, ?>) JSONValue.parse(out());
        assertEquals("program", json.get("kind"));
        assertEquals(1, ((List<?>) json.get("statements")).size());
    }

    @Test
    void testCompact() {
        assertEquals(Main.EXIT_OK, run("struct S {}", "--compact"));
        assertEquals(1, out().strip().lines().count());
    }

    @Test
    void testParseFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("shapes.uck");
        Files.writeString(file, "interface Shape { fun area(this) -> Float }\n");
        assertEquals(Main.EXIT_OK, run("", file.toString()));
        assertTrue(out().contains("\"interface\""));
    }

    @Test
    void testSyntaxError() {
        assertEquals(Main.EXIT_SYNTAX_ERROR, run("struct S {\n  pub x -> T pub y -> U\n}"));
        String[] lines = err().split("\\R");
        assertTrue(lines[0].startsWith("<stdin>:2:14 unexpected `pub` at 24..27"), lines[0]);
        assertEquals("    pub x -> T pub y -> U", lines[1]);
        assertEquals("               ^", lines[2]);
        assertEquals("", out());
    }

    @Test
    void testSyntaxErrorCaretKeepsTabs() {
        assertEquals(Main.EXIT_SYNTAX_ERROR, run("struct S {\n\tpub x -> T pub y -> U\n}"));
        String[] lines = err().split("\\R");
        assertTrue(lines[0].startsWith("<stdin>:2:13 unexpected `pub`"), lines[0]);
        assertEquals("  \tpub x -> T pub y -> U", lines[1]);
        assertEquals("  \t           ^", lines[2]);
        assertEquals("\t  ^", Main.caret("\tab", 3));
        assertEquals("   ^", Main.caret("", 3));
    }

    @Test
    void testSyntaxErrorAtEndOfInput() {
        assertEquals(Main.EXIT_SYNTAX_ERROR, run("struct S { pub x ->"));
        assertTrue(err().startsWith("<stdin>:1:20 unexpected end of input"), err());
    }

    @Test
    void testMissingFile(@TempDir Path dir) {
        assertEquals(Main.EXIT_IO_ERROR, run("", dir.resolve("nope.uck").toString()));
        assertTrue(err().startsWith("cannot read "), err());
    }

    @Test
    void testTokens() {
        assertEquals(Main.EXIT_OK, run("pub x", "--tokens"));
        assertEquals(List.of("1:1 PUB pub", "1:5 IDENT x", "1:6 EOF _EOF_"), out().lines().toList());
    }

    @Test
    void testRelease() {
        assertEquals(Main.EXIT_OK, run("garbage that would not parse", "--release"));
        assertEquals(Main.BANNER, out().strip());
    }

    @Test
    void testVerbose() {
        assertEquals(Main.EXIT_OK, run("", "-v"));
        assertTrue(Main.setLogLevel("io.ucklang", "info"));
    }

    @Test
    void testParseArgs() {
        Main main = Main.parse("--tokens", "--compact", "a.uck");
        assertTrue(main.tokens);
        assertTrue(main.compact);
        assertEquals(Path.of("a.uck"), main.file);
    }

    @Test
    void testDescribe() {
        Resource resource = Resource.text("type A B;", "a.uck");
        ParseException e = assertThrows(ParseException.class, () -> new UckParser(resource).parse());
        ParseError error = e.getError();
        assertEquals("a.uck:1:8 " + error.getMessage(), Main.describe(resource, error));
    }

}
