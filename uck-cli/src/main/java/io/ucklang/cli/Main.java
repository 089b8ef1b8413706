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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import io.ucklang.ast.AstJson;
import io.ucklang.ast.Program;
import io.ucklang.common.Resource;
import io.ucklang.parser.BaseLexer;
import io.ucklang.parser.ParseError;
import io.ucklang.parser.ParseException;
import io.ucklang.parser.Token;
import io.ucklang.parser.UckLexer;
import io.ucklang.parser.UckParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command line entry point. Parses one source file (or standard input) and
 * prints the program tree as JSON, or the diagnostic for the first fatal
 * syntax error.
 */
@Command(
        name = "uckc",
        mixinStandardHelpOptions = true,
        versionProvider = Main.VersionProvider.class,
        description = "Front end of the uck compiler: parses a source file and prints its syntax tree"
)
public class Main implements Callable<Integer> {

    static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static final String VERSION = "0.1.0";
    public static final String BANNER = "Compiler for uck-lang coming soon!";

    public static final int EXIT_OK = 0;
    public static final int EXIT_SYNTAX_ERROR = 1;
    public static final int EXIT_IO_ERROR = 2;

    static class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[]{"uckc " + VERSION};
        }
    }

    @Parameters(
            arity = "0..1",
            paramLabel = "FILE",
            description = "Source file to parse, standard input if omitted"
    )
    Path file;

    @Option(
            names = {"--tokens"},
            description = "Print the token stream instead of the syntax tree"
    )
    boolean tokens;

    @Option(
            names = {"--compact"},
            description = "Print JSON on a single line"
    )
    boolean compact;

    @Option(
            names = {"--release"},
            description = "Only print the release banner"
    )
    boolean release;

    @Option(
            names = {"-v", "--verbose"},
            description = "Enable debug logging"
    )
    boolean verbose;

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    public Main() {
        this(System.in, System.out, System.err);
    }

    public Main(InputStream in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (verbose) {
            setLogLevel("io.ucklang", "debug");
        }
        if (release) {
            out.println(BANNER);
            return EXIT_OK;
        }
        Resource resource;
        try {
            resource = file == null ? Resource.stream(in, Resource.STDIN) : Resource.path(file);
            // forces the read, so that I/O problems surface here
            resource.getText();
        } catch (RuntimeException e) {
            logger.debug("failed to read input", e);
            err.println("cannot read " + (file == null ? Resource.STDIN : file) + ": " + rootMessage(e));
            return EXIT_IO_ERROR;
        }
        if (tokens) {
            for (Token token : BaseLexer.tokenize(new UckLexer(resource))) {
                out.println(token.getPositionDisplay() + " " + token.type + " " + token);
            }
            return EXIT_OK;
        }
        try {
            Program program = new UckParser(resource).parse();
            out.println(AstJson.toJson(program, !compact));
            return EXIT_OK;
        } catch (ParseException e) {
            ParseError error = e.getError();
            err.println(describe(resource, error));
            if (!error.isEndOfInput()) {
                String[] position = resource.getPositionDisplay(error.getSpan().start).split(":");
                String line = resource.getLine(Integer.parseInt(position[0]) - 1);
                err.println("  " + line);
                err.println("  " + caret(line, Integer.parseInt(position[1]) - 1));
            }
            return EXIT_SYNTAX_ERROR;
        }
    }

    /**
     * Pads up to code point {@code col} of {@code line}, keeping its tabs so the
     * caret lines up however tabs are rendered.
     */
    static String caret(String line, int col) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        for (int n = 0; n < col; n++) {
            if (i < line.length()) {
                int cp = line.codePointAt(i);
                sb.append(cp == '\t' ? '\t' : ' ');
                i += Character.charCount(cp);
            } else {
                sb.append(' ');
            }
        }
        return sb.append('^').toString();
    }

    /**
     * @return {@code path:line:col message}, the position being the end of the
     * text for an end-of-input error
     */
    public static String describe(Resource resource, ParseError error) {
        int offset = error.isEndOfInput() ? resource.getText().length() : error.getSpan().start;
        return resource.getRelativePath() + ":" + resource.getPositionDisplay(offset) + " " + error.getMessage();
    }

    private static String rootMessage(Throwable t) {
        while (t.getCause() != null) {
            t = t.getCause();
        }
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }

    /**
     * Changes a logger level at runtime.
     *
     * @return false if the slf4j binding is not logback
     */
    static boolean setLogLevel(String name, String level) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            logger.debug("runtime log level not supported: not using logback");
            return false;
        }
        context.getLogger(name).setLevel(Level.toLevel(level.toUpperCase()));
        logger.debug("set log level of {} to {}", name, level);
        return true;
    }

    /**
     * Parse command-line arguments without executing.
     */
    public static Main parse(String... args) {
        Main main = new Main();
        new CommandLine(main).parseArgs(args);
        return main;
    }

}
