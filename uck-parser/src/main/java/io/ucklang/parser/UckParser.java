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

import io.ucklang.ast.*;
import io.ucklang.common.Resource;
import io.ucklang.common.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.ucklang.parser.TokenType.*;

/**
 * Recursive-descent parser for the declarations of a uck source file.
 * <p>
 * Every production throws a {@link ParseException} when it cannot match. A
 * failure before the production has seen its defining token is non-fatal and
 * leaves the caller free to rewind and try something else. Once the defining
 * token is consumed every failure is fatal and aborts the whole parse.
 */
public class UckParser extends BaseParser {

    static final Logger logger = LoggerFactory.getLogger(UckParser.class);

    static final String[] TOP_LEVEL = {
            "`import` (to start an import statement)",
            "`export` (to start an export statement)",
            "`enum` (to declare an enum)",
            "`struct` (to declare a struct)",
            "`class` (to declare a class)",
            "`interface` (to declare an interface)",
            "`type` (to declare a type alias)"
    };

    static final String TYPE_START = "identifier (as part of a type)";
    static final String CLOSE_GENERICS = "`>` (to close the generics)";
    static final String NEXT_GENERIC = "`,` (to add another generic)";

    private final BodyParser bodyParser;

    // a `>>` closed an inner generics block and still has to close the enclosing one
    private Token pendingClose;
    private int genericsDepth;

    public UckParser(Resource resource) {
        this(resource, new OpaqueBodyParser());
    }

    public UckParser(Resource resource, BodyParser bodyParser) {
        super(resource);
        this.bodyParser = bodyParser;
    }

    public static Program parse(String text) {
        return new UckParser(Resource.text(text)).parse();
    }

    /**
     * Parses top-level statements until the input runs out.
     *
     * @throws ParseException holding the first fatal error, the statements
     *                        parsed before it are discarded
     */
    public Program parse() {
        resetDepth();
        pendingClose = null;
        genericsDepth = 0;
        List<TopLevelNode> statements = new ArrayList<>();
        while (true) {
            try {
                statements.add(topLevel());
            } catch (ParseException e) {
                if (e.isFatal()) {
                    logger.debug("{}: syntax error after {} statement(s): {}", resource, statements.size(), e.getMessage());
                    throw e;
                }
                break;
            }
        }
        logger.debug("{}: parsed {} statement(s), {} token(s)", resource, statements.size(), cursor.cachedCount());
        return new Program(List.copyOf(statements));
    }

    // ========== Top Level ==========

    TopLevelNode topLevel() {
        List<Token> comments = new ArrayList<>();
        Token token = next();
        while (token.type == COMMENT) {
            comments.add(token);
            token = next();
        }
        final Token keyword = token;
        TopLevelNode node = switch (keyword.type) {
            case IMPORT -> committed(this::importStatement);
            case EXPORT -> committed(() -> exportStatement(keyword));
            case ENUM, STRUCT, CLASS, INTERFACE, TYPE -> committed(() -> declaration(keyword));
            // running out of input between statements is the normal way out
            case EOF -> throw error(keyword, false, TOP_LEVEL);
            default -> throw error(keyword, true, TOP_LEVEL);
        };
        for (int i = comments.size() - 1; i >= 0; i--) {
            Token comment = comments.get(i);
            node = new CommentedNode(comment.getSpan().to(node.span()), slice(comment), node);
        }
        return node;
    }

    private TopLevelNode declaration(Token keyword) {
        return switch (keyword.type) {
            case ENUM -> enumDeclaration(keyword);
            case STRUCT -> structDeclaration(keyword);
            case CLASS -> classDeclaration(keyword);
            case INTERFACE -> interfaceDeclaration(keyword);
            case TYPE -> typeAlias(keyword);
            default -> throw new IllegalStateException("not a declaration keyword: " + keyword.type);
        };
    }

    ExportStatement exportStatement(Token keyword) {
        boolean defaultExport = consumeIf(DEFAULT);
        TopLevelNode exported;
        if (peekSignificant() == IDENT) {
            exported = importStatement();
        } else {
            skipComments();
            Token token = next();
            if (!token.type.oneOf(ENUM, STRUCT, CLASS, INTERFACE, TYPE)) {
                throw error(token, true, "identifier (to start a re-export)",
                        TOP_LEVEL[2], TOP_LEVEL[3], TOP_LEVEL[4], TOP_LEVEL[5], TOP_LEVEL[6]);
            }
            exported = declaration(token);
        }
        return new ExportStatement(keyword.getSpan().to(exported.span()), defaultExport, exported);
    }

    // ========== Imports ==========

    ImportStatement importStatement() {
        DestructuringPattern pattern = destructuringPattern();
        expect(FROM, true, "`from` (to name the module to import from)");
        ModulePath modulePath = modulePath();
        Token semi = expect(SEMI, true, "`;` (to end the import)");
        return new ImportStatement(pattern.span().to(semi.getSpan()), pattern, modulePath);
    }

    ModulePath modulePath() {
        Token segment = expect(IDENT, true, "identifier (as part of a module path)");
        ModulePath path = new ModulePath(segment.getSpan(), null, slice(segment));
        while (consumeIf(DOT)) {
            segment = expect(IDENT, true, "identifier (as part of a module path)");
            path = new ModulePath(path.span().to(segment.getSpan()), path, slice(segment));
        }
        return path;
    }

    DestructuringPattern destructuringPattern() {
        Token name = expect(IDENT, false, "identifier (as part of a destructuring pattern)");
        if (!consumeIf(COLON)) {
            return new NamePattern(name.getSpan(), slice(name));
        }
        skipComments();
        Token token = next();
        if (token.type == IDENT) {
            return new AliasedPattern(name.getSpan().to(token.getSpan()), slice(name), slice(token));
        }
        if (token.type != L_CURLY) {
            throw error(token, true, "identifier (to alias the import)", "`{` (to destructure the import)");
        }
        descend();
        try {
            List<DestructuringPattern> children = new ArrayList<>();
            while (true) {
                if (peekSignificant() != IDENT) {
                    // empty block, or a trailing comma
                    skipComments();
                    Token close = next();
                    if (close.type == R_CURLY) {
                        return new DestructuredPattern(name.getSpan().to(close.getSpan()), slice(name), List.copyOf(children));
                    }
                    throw error(close, true, "identifier (as part of a destructuring pattern)", "`}` (to end the destructuring)");
                }
                children.add(destructuringPattern());
                skipComments();
                Token separator = next();
                if (separator.type == R_CURLY) {
                    return new DestructuredPattern(name.getSpan().to(separator.getSpan()), slice(name), List.copyOf(children));
                }
                if (separator.type != COMMA) {
                    throw error(separator, true, "`,` (to continue the destructuring)", "`}` (to end the destructuring)");
                }
            }
        } finally {
            ascend();
        }
    }

    // ========== Types ==========

    TypeExpr type() {
        descend();
        try {
            Token name = expect(IDENT, true, TYPE_START);
            TypeExpr type = new RootName(name.getSpan(), slice(name));
            boolean applied = false;
            while (pendingClose == null) {
                // no comments inside a type
                TokenType next = peekType();
                if (next == DOT) {
                    next();
                    Token member = expect(IDENT, true, "identifier (to continue the type)");
                    type = new MemberOf(type.span().to(member.getSpan()), type, slice(member));
                    applied = false;
                } else if (next == LT) {
                    Token open = next();
                    if (applied) {
                        throw error(open, true, "`.` (to continue type)", "end of type");
                    }
                    Generics generics = generics(open, false);
                    type = new GenericOf(type.span().to(generics.span()), type, generics);
                    applied = true;
                } else {
                    break;
                }
            }
            return type;
        } finally {
            ascend();
        }
    }

    /**
     * A declared name with its optional generics, as found after
     * {@code struct}, {@code fun} etc.
     */
    GenericOf typeHeader() {
        Token name = expect(IDENT, true, "identifier (to name the declaration)");
        RootName base = new RootName(name.getSpan(), slice(name));
        Token open = accept(LT);
        Generics generics = open == null ? new Generics(Span.empty(name.getSpan().end), Map.of()) : generics(open, true);
        return new GenericOf(base.span().to(generics.span()), base, generics);
    }

    /**
     * Parses a generics block whose {@code <} was already consumed. In
     * declaration mode entries are {@code Name} or {@code Name: Bound}, else
     * each entry is a type keyed by its position.
     */
    Generics generics(Token open, boolean declarations) {
        descend();
        genericsDepth++;
        try {
            Map<String, GenericEntry> entries = new LinkedHashMap<>();
            while (true) {
                GenericEntry entry;
                String key;
                if (declarations) {
                    skipComments();
                    Token token = next();
                    if (isClosing(token)) {
                        return new Generics(open.getSpan().to(close(token)), entries);
                    }
                    if (token.type != IDENT) {
                        throw error(token, true, CLOSE_GENERICS, "identifier (to declare a new generic)");
                    }
                    key = token.getText();
                    if (entries.containsKey(key)) {
                        throw error(token, true, "a unique generic name");
                    }
                    TypeExpr bound = consumeIf(COLON) ? type() : null;
                    Span span = bound == null ? token.getSpan() : token.getSpan().to(bound.span());
                    entry = new GenericEntry(span, slice(token), bound);
                } else {
                    TypeExpr argument = type();
                    key = String.valueOf(entries.size());
                    entry = new GenericEntry(argument.span(), null, argument);
                }
                entries.put(key, entry);
                if (pendingClose != null) {
                    Token token = pendingClose;
                    pendingClose = null;
                    return new Generics(new Span(open.pos, token.getSpan().end), entries);
                }
                skipComments();
                Token separator = next();
                if (isClosing(separator)) {
                    return new Generics(open.getSpan().to(close(separator)), entries);
                }
                if (separator.type != COMMA) {
                    if (declarations && entry.bound() == null) {
                        throw error(separator, true, CLOSE_GENERICS, NEXT_GENERIC, "`:` (to bound the generic)");
                    }
                    throw error(separator, true, CLOSE_GENERICS, NEXT_GENERIC);
                }
            }
        } finally {
            genericsDepth--;
            ascend();
        }
    }

    private static boolean isClosing(Token token) {
        return token.type == GT || token.type == GT_GT;
    }

    /**
     * @return the span of the {@code >} that closes the current block; for a
     * {@code >>} only its first character, the second one is left pending for
     * the enclosing block
     */
    private Span close(Token token) {
        if (token.type == GT) {
            return token.getSpan();
        }
        if (genericsDepth < 2) {
            throw error(token, true, CLOSE_GENERICS);
        }
        pendingClose = token;
        return new Span(token.pos, token.pos + 1);
    }

    private TypeExpr clause(TokenType keyword) {
        return consumeIf(keyword) ? type() : null;
    }

    // ========== Declarations ==========

    TypeAlias typeAlias(Token keyword) {
        GenericOf alias = typeHeader();
        expect(EQ, true, "`=` (to give the aliased type)");
        TypeExpr target = type();
        Token semi = expect(SEMI, true, "`;` (to end the type alias)");
        return new TypeAlias(keyword.getSpan().to(semi.getSpan()), alias, target);
    }

    EnumDeclaration enumDeclaration(Token keyword) {
        GenericOf header = typeHeader();
        TypeExpr implemented = clause(IMPLEMENTS);
        openBody("enum", implemented == null ? IMPLEMENTS : null);
        Items<EnumCase> cases = enumCases();
        Items<MethodEntry> methods = methods(VisibilityRule.STRUCT);
        Token close = closing("`}` (to close the enum)", cases.trigger(), methods.trigger());
        return new EnumDeclaration(keyword.getSpan().to(close.getSpan()), header, implemented, cases.items(), methods.items());
    }

    StructDeclaration structDeclaration(Token keyword) {
        GenericOf header = typeHeader();
        TypeExpr implemented = clause(IMPLEMENTS);
        openBody("struct", implemented == null ? IMPLEMENTS : null);
        Items<Field> fields = fields(VisibilityRule.STRUCT);
        Items<MethodEntry> methods = methods(VisibilityRule.STRUCT);
        Token close = closing("`}` (to close the struct)", fields.trigger(), methods.trigger());
        return new StructDeclaration(keyword.getSpan().to(close.getSpan()), header, implemented, fields.items(), methods.items());
    }

    ClassDeclaration classDeclaration(Token keyword) {
        GenericOf header = typeHeader();
        TypeExpr extended = clause(EXTENDS);
        TypeExpr implemented = clause(IMPLEMENTS);
        if (extended == null && implemented == null) {
            openBody("class", EXTENDS, IMPLEMENTS);
        } else {
            openBody("class", implemented == null ? IMPLEMENTS : null);
        }
        Items<Field> fields = fields(VisibilityRule.CLASS);
        Items<MethodEntry> methods = methods(VisibilityRule.CLASS);
        Token close = closing("`}` (to close the class)", fields.trigger(), methods.trigger());
        return new ClassDeclaration(keyword.getSpan().to(close.getSpan()), header, extended, implemented,
                fields.items(), methods.items());
    }

    InterfaceDeclaration interfaceDeclaration(Token keyword) {
        GenericOf header = typeHeader();
        TypeExpr extended = clause(EXTENDS);
        openBody("interface", extended == null ? EXTENDS : null);
        Items<MethodEntry> methods = methods(VisibilityRule.INTERFACE);
        Token close = closing("`}` (to close the interface)", methods.trigger());
        return new InterfaceDeclaration(keyword.getSpan().to(close.getSpan()), header, extended, methods.items());
    }

    /**
     * Expects the {@code {} of a declaration body. Clauses that could still
     * have been written before it are listed in the error.
     */
    private void openBody(String kind, TokenType... clauses) {
        List<String> expected = new ArrayList<>();
        for (TokenType clause : clauses) {
            if (clause != null) {
                expected.add("`" + clause.name().toLowerCase() + "` (to continue the " + kind + " header)");
            }
        }
        expected.add("`{` (to open the " + kind + ")");
        expect(L_CURLY, true, expected.toArray(new String[0]));
    }

    /**
     * Expects a closing brace. If it is missing, the errors that ended the
     * preceding lists are merged in, since any of them may be what was meant.
     */
    private Token closing(String expected, ParseError... triggers) {
        skipComments();
        Token token = next();
        if (token.type == R_CURLY) {
            return token;
        }
        ParseError error = null;
        for (ParseError trigger : triggers) {
            if (trigger != null) {
                error = error == null ? trigger : error.combine(trigger);
            }
        }
        ParseError own = ParseError.unexpected(token, true, expected);
        throw new ParseException(error == null ? own : error.combine(own));
    }

    // ========== Members ==========

    /**
     * Items parsed by a repetition, together with the non-fatal error that
     * stopped it.
     */
    record Items<T>(List<T> items, ParseError trigger) {
    }

    Items<EnumCase> enumCases() {
        List<EnumCase> cases = new ArrayList<>();
        while (true) {
            int position = cursor.savePosition();
            try {
                cases.add(enumCase());
                position = cursor.savePosition();
                expect(COMMA, false, "`,` (to declare another enum case)");
            } catch (ParseException e) {
                if (e.isFatal()) {
                    throw e;
                }
                cursor.returnToPosition(position);
                return new Items<>(List.copyOf(cases), e.getError());
            }
        }
    }

    EnumCase enumCase() {
        Token name = expect(IDENT, false, "identifier (to name an enum case)");
        Token open = accept(L_PAREN);
        if (open == null) {
            return new EnumCase(name.getSpan(), slice(name), List.of());
        }
        return committed(() -> {
            List<TypeExpr> arguments = new ArrayList<>();
            while (true) {
                if (peekSignificant() != R_PAREN) {
                    arguments.add(type());
                }
                skipComments();
                Token token = next();
                if (token.type == R_PAREN) {
                    return new EnumCase(name.getSpan().to(token.getSpan()), slice(name), List.copyOf(arguments));
                }
                if (token.type != COMMA) {
                    throw error(token, true, "`,` (to add another type)", "`)` (to end the enum case)");
                }
            }
        });
    }

    Items<Field> fields(VisibilityRule rule) {
        List<Field> fields = new ArrayList<>();
        while (true) {
            int position = cursor.savePosition();
            try {
                fields.add(field(rule));
                position = cursor.savePosition();
                expect(COMMA, false, "`,` (to declare another field)");
            } catch (ParseException e) {
                if (e.isFatal()) {
                    throw e;
                }
                cursor.returnToPosition(position);
                return new Items<>(List.copyOf(fields), e.getError());
            }
        }
    }

    Field field(VisibilityRule rule) {
        skipComments();
        Token marker = next();
        Visibility visibility = rule.visibility(marker.type);
        if (visibility == null) {
            throw error(marker, false, rule.expectation);
        }
        Token name = expect(IDENT, false, "identifier (to name the field)");
        expect(MINUS_GT, false, "`->` (to give the type of the field)");
        TypeExpr type = type();
        return new Field(marker.getSpan().to(type.span()), visibility, slice(name), type);
    }

    Items<MethodEntry> methods(VisibilityRule rule) {
        List<MethodEntry> methods = new ArrayList<>();
        while (true) {
            int position = cursor.savePosition();
            try {
                methods.add(methodEntry(rule));
            } catch (ParseException e) {
                if (e.isFatal()) {
                    throw e;
                }
                cursor.returnToPosition(position);
                return new Items<>(List.copyOf(methods), e.getError());
            }
            consumeIf(COMMA);
        }
    }

    MethodEntry methodEntry(VisibilityRule rule) {
        List<Token> comments = new ArrayList<>();
        Token token = next();
        while (token.type == COMMENT) {
            comments.add(token);
            token = next();
        }
        if (token.type == LT) {
            // doc comments only attach to methods
            final Token open = token;
            return committed(() -> constraintBlock(open, rule));
        }
        final Token start = token;
        Visibility marker = rule.visibility(token.type);
        if (marker == null) {
            if (!(rule.isMarkerOptional() && token.type == FUN)) {
                throw error(token, false, rule.expectation, "`<` (to open a constraint block)");
            }
            marker = Visibility.PUBLIC;
        } else {
            skipComments();
            token = next();
        }
        if (token.type != FUN) {
            throw error(token, false, "`fun` (to declare a method)");
        }
        final Visibility visibility = marker;
        DocumentableMethod method = committed(() -> method(start, visibility));
        for (int i = comments.size() - 1; i >= 0; i--) {
            Token comment = comments.get(i);
            method = new DocumentedMethod(comment.getSpan().to(method.span()), slice(comment), method);
        }
        return method;
    }

    /**
     * The rest of a method once {@code fun} has been consumed.
     */
    MethodDeclaration method(Token start, Visibility visibility) {
        GenericOf header = typeHeader();
        List<MethodArgument> arguments = arguments();
        TypeExpr returnType = consumeIf(MINUS_GT) ? type() : null;
        BlockBody body = bodyParser.parse(cursor);
        Span end = body.isEmpty() ? previousSpan() : body.span();
        return new MethodDeclaration(start.getSpan().to(end), visibility, header, List.copyOf(arguments), returnType, body);
    }

    List<MethodArgument> arguments() {
        expect(L_PAREN, true, "`(` (to open the argument list)");
        List<MethodArgument> arguments = new ArrayList<>();
        while (true) {
            skipComments();
            Token token = next();
            switch (token.type) {
                case IDENT -> {
                    expect(MINUS_GT, true, "`->` (to give the type of the argument)");
                    TypeExpr type = type();
                    arguments.add(new RegularArgument(token.getSpan().to(type.span()), slice(token), type));
                }
                case THIS -> arguments.add(new ThisArgument(token.getSpan(), false));
                case MUT -> {
                    Token self = expect(THIS, true, "`this` (after `mut`)");
                    arguments.add(new ThisArgument(token.getSpan().to(self.getSpan()), true));
                }
                case R_PAREN -> {
                    return arguments;
                }
                default -> throw error(token, true, "identifier (to declare an argument)", "`this`", "`mut this`",
                        "`)` (to close the argument list)");
            }
            skipComments();
            Token separator = next();
            if (separator.type == R_PAREN) {
                return arguments;
            }
            if (separator.type != COMMA) {
                throw error(separator, true, "`,` (to add another argument)", "`)` (to close the argument list)");
            }
        }
    }

    ConstraintBlock constraintBlock(Token open, VisibilityRule rule) {
        descend();
        try {
            Generics constraints = generics(open, true);
            expect(L_CURLY, true, "`{` (to open the constraint block)");
            Items<MethodEntry> methods = methods(rule);
            Token close = closing("`}` (to close the constraint block)", methods.trigger());
            return new ConstraintBlock(open.getSpan().to(close.getSpan()), constraints, methods.items());
        } finally {
            ascend();
        }
    }

}
