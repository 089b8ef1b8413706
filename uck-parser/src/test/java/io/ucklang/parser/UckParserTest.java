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
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UckParserTest {

    private static Program program(String text) {
        return UckParser.parse(text);
    }

    private static TopLevelNode single(String text) {
        Program program = program(text);
        assertEquals(1, program.size(), "statements: " + program.statements());
        return program.statements().get(0);
    }

    private static ParseError error(String text) {
        ParseException e = assertThrows(ParseException.class, () -> program(text));
        assertTrue(e.isFatal());
        return e.getError();
    }

    // ========== Driver ==========

    @Test
    void testEmptyProgram() {
        assertTrue(program("").isEmpty());
        assertTrue(program("  \n\t ").isEmpty());
        assertTrue(program("// nothing to see").isEmpty());
    }

    @Test
    void testUnknownTopLevelTokenIsFatal() {
        ParseError error = error("foo");
        assertEquals("foo", error.getFound());
        assertEquals(new Span(0, 3), error.getSpan());
        assertTrue(error.getExpected().containsAll(List.of(UckParser.TOP_LEVEL)));
    }

    @Test
    void testErrorAfterValidStatementsDiscardsProgram() {
        ParseError error = error("type A = B; struct S {} 42");
        assertEquals("42", error.getFound());
    }

    @Test
    void testLexicalErrorIsFatal() {
        ParseError error = error("struct S {} `");
        assertEquals("`", error.getFound());
    }

    // ========== Imports and Exports ==========

    @Test
    void testSimpleImport() {
        ImportStatement is = (ImportStatement) single("import x from std;");
        assertEquals(new Span(7, 18), is.span());
        NamePattern pattern = (NamePattern) is.pattern();
        assertEquals("x", pattern.name().getText());
        assertEquals(new Span(7, 8), pattern.span());
        assertEquals(List.of("std"), is.modulePath().segments());
        assertTrue(is.modulePath().isRoot());
    }

    @Test
    void testImportOfSupplementaryLetterName() {
        ImportStatement is = (ImportStatement) single("import \uD835\uDC00 from std;");
        NamePattern pattern = (NamePattern) is.pattern();
        assertEquals("\uD835\uDC00", pattern.name().getText());
        assertEquals(new Span(7, 9), pattern.span());
        assertEquals(new Span(7, 19), is.span());
    }

    @Test
    void testDestructuringImport() {
        ImportStatement is = (ImportStatement) single("import a: { b, c: d } from mod.sub;");
        DestructuredPattern pattern = (DestructuredPattern) is.pattern();
        assertEquals("a", pattern.name().getText());
        assertEquals(new Span(7, 21), pattern.span());
        assertEquals(2, pattern.children().size());
        NamePattern b = (NamePattern) pattern.children().get(0);
        assertEquals("b", b.name().getText());
        AliasedPattern cd = (AliasedPattern) pattern.children().get(1);
        assertEquals("c", cd.name().getText());
        assertEquals("d", cd.alias().getText());
        assertEquals(new Span(15, 19), cd.span());
        assertEquals(List.of("mod", "sub"), is.modulePath().segments());
        assertEquals(new Span(27, 34), is.modulePath().span());
        assertEquals("mod", is.modulePath().parent().segment().getText());
        assertEquals(new Span(7, 35), is.span());
    }

    @Test
    void testNestedDestructuring() {
        ImportStatement is = (ImportStatement) single("import a: { b: { c, d: e, }, f } from m;");
        DestructuredPattern a = (DestructuredPattern) is.pattern();
        DestructuredPattern b = (DestructuredPattern) a.children().get(0);
        assertEquals(2, b.children().size());
        assertEquals("f", a.children().get(1).name().getText());
    }

    @Test
    void testImportErrors() {
        ParseError error = error("import x std;");
        assertEquals("std", error.getFound());
        assertTrue(error.getExpected().stream().anyMatch(s -> s.startsWith("`from`")));
        error = error("import x from std");
        assertTrue(error.isEndOfInput());
        error = error("import x: 1 from std;");
        assertEquals("1", error.getFound());
        error = error("import x: { b c } from std;");
        assertEquals("c", error.getFound());
        // the pattern is required, the error becomes fatal once `import` is seen
        error = error("import from std;");
        assertEquals("from", error.getFound());
    }

    @Test
    void testExportDeclaration() {
        ExportStatement es = (ExportStatement) single("export struct S {}");
        assertFalse(es.defaultExport());
        assertEquals(new Span(0, 18), es.span());
        StructDeclaration sd = (StructDeclaration) es.exported();
        assertEquals(new Span(7, 18), sd.span());
    }

    @Test
    void testExportDefault() {
        ExportStatement es = (ExportStatement) single("export default type A = B;");
        assertTrue(es.defaultExport());
        assertInstanceOf(TypeAlias.class, es.exported());
        assertEquals(new Span(0, 26), es.span());
    }

    @Test
    void testReExport() {
        ExportStatement es = (ExportStatement) single("export a: { b } from m;");
        ImportStatement is = (ImportStatement) es.exported();
        assertEquals("a", is.pattern().name().getText());
        assertEquals(new Span(0, 23), es.span());
    }

    @Test
    void testExportErrorsAreFatal() {
        ParseError error = error("export 42");
        assertEquals("42", error.getFound());
        error = error("export");
        assertTrue(error.isEndOfInput());
    }

    // ========== Comments ==========

    @Test
    void testCommentWrapsStatement() {
        CommentedNode cn = (CommentedNode) single("// the answer\ntype A = B;");
        assertEquals("// the answer", cn.comment().getText());
        assertEquals(new Span(0, 25), cn.span());
        assertEquals(new Span(14, 25), cn.node().span());
    }

    @Test
    void testConsecutiveCommentsNest() {
        CommentedNode outer = (CommentedNode) single("/* a */ /* b */ type A = B;");
        assertEquals("/* a */", outer.comment().getText());
        CommentedNode inner = (CommentedNode) outer.node();
        assertEquals("/* b */", inner.comment().getText());
        assertEquals(new Span(0, 27), outer.span());
        assertEquals(new Span(8, 27), inner.span());
        assertInstanceOf(TypeAlias.class, inner.node());
    }

    @Test
    void testCommentsInsideStatementsAreSkipped() {
        ImportStatement is = (ImportStatement) single("import /* x */ a /* y */ : /* z */ b from /* w */ m;");
        AliasedPattern pattern = (AliasedPattern) is.pattern();
        assertEquals("b", pattern.alias().getText());
    }

    // ========== Types ==========

    @Test
    void testTypeAlias() {
        TypeAlias ta = (TypeAlias) single("type Alias<T> = Other.Inner<T>;");
        assertEquals(new Span(0, 31), ta.span());
        GenericOf alias = ta.alias();
        assertEquals("Alias", ((RootName) alias.base()).name().getText());
        assertEquals(new Span(5, 13), alias.span());
        assertEquals(new Span(10, 13), alias.generics().span());
        GenericEntry t = alias.generics().get("T");
        assertEquals("T", t.name().getText());
        assertNull(t.bound());
        GenericOf target = (GenericOf) ta.target();
        assertEquals(new Span(16, 30), target.span());
        MemberOf member = (MemberOf) target.base();
        assertEquals("Inner", member.member().getText());
        assertEquals(new Span(16, 27), member.span());
        assertEquals("Other", ((RootName) member.owner()).name().getText());
        GenericEntry argument = target.generics().get("0");
        assertNull(argument.name());
        assertEquals("T", ((RootName) argument.bound()).name().getText());
        assertEquals("Other.Inner<T>", target.toString());
    }

    @Test
    void testHeaderWithoutGenerics() {
        TypeAlias ta = (TypeAlias) single("type A = B;");
        assertTrue(ta.alias().generics().isEmpty());
        assertEquals(new Span(6, 6), ta.alias().generics().span());
        assertEquals(new Span(5, 6), ta.alias().span());
        assertInstanceOf(RootName.class, ta.target());
    }

    @Test
    void testGenericBoundsAndOrder() {
        TypeAlias ta = (TypeAlias) single("type M<K: Hash, V, W: a.B<K>> = Map<K, V>;");
        Generics generics = ta.alias().generics();
        assertEquals(List.of("K", "V", "W"), List.copyOf(generics.entries().keySet()));
        assertEquals("Hash", generics.get("K").bound().toString());
        assertEquals("a.B<K>", generics.get("W").bound().toString());
        assertEquals(new Span(19, 28), generics.get("W").span());
        GenericOf target = (GenericOf) ta.target();
        assertEquals(List.of("0", "1"), List.copyOf(target.generics().entries().keySet()));
    }

    @Test
    void testDoubleCloseOfNestedGenerics() {
        TypeAlias ta = (TypeAlias) single("type A = List<Map<K, V>>;");
        GenericOf list = (GenericOf) ta.target();
        assertEquals(new Span(13, 24), list.generics().span());
        GenericOf map = (GenericOf) list.generics().get("0").bound();
        assertEquals(new Span(17, 23), map.generics().span());
        assertEquals(new Span(14, 23), map.span());
        assertEquals("List<Map<K, V>>", list.toString());
    }

    @Test
    void testDoubleCloseInDeclaration() {
        TypeAlias ta = (TypeAlias) single("type A<T: B<C>> = T;");
        assertEquals(new Span(6, 15), ta.alias().generics().span());
        assertEquals("B<C>", ta.alias().generics().get("T").bound().toString());
    }

    @Test
    void testDoubleCloseAtOutermostLevelIsFatal() {
        ParseError error = error("type A = B<C>>;");
        assertEquals(">>", error.getFound());
    }

    @Test
    void testDuplicateGenericIsFatal() {
        ParseError error = error("struct Foo<T, T> {}");
        assertTrue(error.isFatal());
        assertEquals(new Span(14, 15), error.getSpan());
        assertTrue(error.getExpected().contains("a unique generic name"));
    }

    @Test
    void testReapplyingGenericsIsFatal() {
        ParseError error = error("type A = B<C><D>;");
        assertEquals("<", error.getFound());
        assertTrue(error.getExpected().contains("`.` (to continue type)"));
        assertTrue(error.getExpected().contains("end of type"));
    }

    @Test
    void testMemberAfterGenericApplication() {
        TypeAlias ta = (TypeAlias) single("type A = B<C>.D<E>;");
        GenericOf outer = (GenericOf) ta.target();
        MemberOf member = (MemberOf) outer.base();
        assertInstanceOf(GenericOf.class, member.owner());
        assertEquals("B<C>.D<E>", outer.toString());
    }

    @Test
    void testTypeAliasErrors() {
        assertEquals("B", error("type A B;").getFound());
        assertTrue(error("type A =").isEndOfInput());
        assertTrue(error("type A = B").isEndOfInput());
        assertEquals("}", error("type A<T }").getFound());
    }

    // ========== Structs ==========

    @Test
    void testStruct() {
        StructDeclaration sd = (StructDeclaration) single("struct Point<T> { pub x -> T, priv y -> T, mpriv label -> String }");
        assertEquals("Point", sd.header().base().toString());
        assertNull(sd.implemented());
        assertEquals(3, sd.fields().size());
        Field x = sd.fields().get(0);
        assertEquals(Visibility.PUBLIC, x.visibility());
        assertEquals("x", x.name().getText());
        assertEquals(new Span(18, 28), x.span());
        assertEquals(Visibility.PRIVATE, sd.fields().get(1).visibility());
        assertEquals(Visibility.MODULE_PRIVATE, sd.fields().get(2).visibility());
        assertTrue(sd.methods().isEmpty());
        assertEquals(new Span(0, 66), sd.span());
    }

    @Test
    void testEmptyStructWithImplements() {
        StructDeclaration sd = (StructDeclaration) single("struct S implements a.Show<S> {}");
        assertEquals("a.Show<S>", sd.implemented().toString());
        assertTrue(sd.fields().isEmpty());
    }

    @Test
    void testStructTrailingComma() {
        StructDeclaration sd = (StructDeclaration) single("struct S { pub x -> T, }");
        assertEquals(1, sd.fields().size());
    }

    @Test
    void testTruncatedFieldIsFatalEndOfInput() {
        ParseError error = error("struct S { pub x ->");
        assertTrue(error.isFatal());
        assertTrue(error.isEndOfInput());
        assertTrue(error.getExpected().contains(UckParser.TYPE_START));
    }

    @Test
    void testMissingCommaMergesAlternatives() {
        ParseError error = error("struct S { pub x -> T pub y -> U }");
        assertEquals("pub", error.getFound());
        assertEquals(new Span(22, 25), error.getSpan());
        assertTrue(error.getExpected().contains("`,` (to declare another field)"));
        assertTrue(error.getExpected().contains("`}` (to close the struct)"));
        assertTrue(error.getExpected().contains("`fun` (to declare a method)"));
    }

    @Test
    void testStructRejectsClassVisibility() {
        ParseError error = error("struct S { prot x -> T }");
        assertEquals("prot", error.getFound());
        assertTrue(error.getExpected().contains(VisibilityRule.STRUCT.expectation));
    }

    @Test
    void testStructHeaderErrors() {
        ParseError error = error("struct S [");
        assertEquals("[", error.getFound());
        assertTrue(error.getExpected().contains("`{` (to open the struct)"));
        assertTrue(error.getExpected().contains("`implements` (to continue the struct header)"));
        assertTrue(error("struct {}").getExpected().contains("identifier (to name the declaration)"));
    }

    // ========== Methods ==========

    @Test
    void testStructMethods() {
        String text = "struct S { pub x -> T, pub fun get(this) -> T { return x; } mpriv fun set<U: T>(mut this, value -> U) }";
        StructDeclaration sd = (StructDeclaration) single(text);
        assertEquals(1, sd.fields().size());
        assertEquals(2, sd.methods().size());
        MethodDeclaration get = (MethodDeclaration) sd.methods().get(0);
        assertEquals(Visibility.PUBLIC, get.visibility());
        assertEquals("get", get.name().getText());
        assertEquals(List.of(new ThisArgument(new Span(35, 39), false)), get.arguments());
        assertEquals("T", get.returnType().toString());
        assertFalse(get.body().isEmpty());
        int open = text.indexOf("{ return");
        assertEquals(new Span(open, open + 13), get.body().span());
        assertEquals(new Span(23, open + 13), get.span());
        MethodDeclaration set = (MethodDeclaration) sd.methods().get(1);
        assertEquals(Visibility.MODULE_PRIVATE, set.visibility());
        assertEquals("T", set.header().generics().get("U").bound().toString());
        ThisArgument self = (ThisArgument) set.arguments().get(0);
        assertTrue(self.mutable());
        RegularArgument value = (RegularArgument) set.arguments().get(1);
        assertEquals("value", value.name().getText());
        assertEquals("U", value.type().toString());
        assertNull(set.returnType());
        assertTrue(set.body().isEmpty());
        assertEquals(text.length() - 2, set.span().end);
    }

    @Test
    void testMethodsWithOptionalCommas() {
        StructDeclaration sd = (StructDeclaration) single("struct S { pub fun a() {}, pub fun b() {} pub fun c() }");
        assertEquals(3, sd.methods().size());
    }

    @Test
    void testNestedBracesInBody() {
        StructDeclaration sd = (StructDeclaration) single("struct S { pub fun a() { if x { y } else { { } } } }");
        MethodDeclaration a = (MethodDeclaration) sd.methods().get(0);
        assertEquals(new Span(23, 50), a.body().span());
    }

    @Test
    void testUnterminatedBodyIsFatal() {
        ParseError error = error("struct S { pub fun a() { {");
        assertTrue(error.isEndOfInput());
        assertTrue(error.getExpected().contains("`}` (to close the method body)"));
    }

    @Test
    void testDocumentedMethod() {
        String text = "struct S {\n  /// Gets it\n  // twice\n  pub fun get(this) -> T\n}";
        StructDeclaration sd = (StructDeclaration) single(text);
        DocumentedMethod doc = (DocumentedMethod) sd.methods().get(0);
        assertEquals("/// Gets it", doc.comment().getText());
        DocumentedMethod inner = (DocumentedMethod) doc.documented();
        assertEquals("// twice", inner.comment().getText());
        assertEquals("get", doc.method().name().getText());
        assertEquals(text.indexOf("///"), doc.span().start);
        assertEquals(text.indexOf("-> T") + 4, doc.span().end);
    }

    @Test
    void testDocCommentAfterFieldStaysWithMethod() {
        StructDeclaration sd = (StructDeclaration) single("struct S { pub x -> T, /* doc */ pub fun f() }");
        assertEquals(1, sd.fields().size());
        assertInstanceOf(DocumentedMethod.class, sd.methods().get(0));
    }

    @Test
    void testConstraintBlock() {
        String text = "struct S<T> { pub fun a() <T: Eq> { pub fun eq(this, other -> T) -> Bool, <T: Ord> { pub fun lt(this) } } }";
        StructDeclaration sd = (StructDeclaration) single(text);
        assertEquals(2, sd.methods().size());
        ConstraintBlock block = (ConstraintBlock) sd.methods().get(1);
        assertEquals("Eq", block.constraints().get("T").bound().toString());
        assertEquals(2, block.methods().size());
        ConstraintBlock nested = (ConstraintBlock) block.methods().get(1);
        assertEquals(1, nested.methods().size());
        assertEquals(text.indexOf("<T: Eq>"), block.span().start);
        assertEquals(text.length() - 2, block.span().end);
    }

    @Test
    void testConstraintBlockErrors() {
        ParseError error = error("struct S { <T> pub fun a() }");
        assertEquals("pub", error.getFound());
        error = error("struct S { <T> { pub fun a() ");
        assertTrue(error.isEndOfInput());
    }

    @Test
    void testMethodErrors() {
        assertEquals("{", error("struct S { pub fun a { } }").getFound());
        assertEquals("T", error("struct S { pub fun a(x T) }").getFound());
        assertEquals("x", error("struct S { pub fun a(mut x) }").getFound());
        assertEquals("y", error("struct S { pub fun a(this y) }").getFound());
        assertTrue(error("struct S { pub fun a(this) ->").isEndOfInput());
    }

    // ========== Enums ==========

    @Test
    void testEnum() {
        String text = "enum Option<T> implements Show { None, Some(T), Pair(T, List<T>), pub fun get(this) -> T }";
        EnumDeclaration ed = (EnumDeclaration) single(text);
        assertEquals("Show", ed.implemented().toString());
        assertEquals(3, ed.cases().size());
        EnumCase none = ed.cases().get(0);
        assertEquals("None", none.name().getText());
        assertTrue(none.arguments().isEmpty());
        EnumCase some = ed.cases().get(1);
        assertEquals(List.of("T"), some.arguments().stream().map(Object::toString).toList());
        assertEquals(new Span(39, 46), some.span());
        EnumCase pair = ed.cases().get(2);
        assertEquals("List<T>", pair.arguments().get(1).toString());
        assertEquals(1, ed.methods().size());
        assertEquals(new Span(0, text.length()), ed.span());
    }

    @Test
    void testEnumErrors() {
        assertEquals("1", error("enum E { A(1) }").getFound());
        ParseError error = error("enum E { A B }");
        assertEquals("B", error.getFound());
        assertTrue(error.getExpected().contains("`,` (to declare another enum case)"));
        assertTrue(error.getExpected().contains("`}` (to close the enum)"));
    }

    // ========== Classes and Interfaces ==========

    @Test
    void testClass() {
        String text = "class Dog extends Animal implements Pet { prot name -> String, mprot age -> Int, pub fun bark(this) {} }";
        ClassDeclaration cd = (ClassDeclaration) single(text);
        assertEquals("Animal", cd.extended().toString());
        assertEquals("Pet", cd.implemented().toString());
        assertEquals(Visibility.PROTECTED, cd.fields().get(0).visibility());
        assertEquals(Visibility.MODULE_PROTECTED, cd.fields().get(1).visibility());
        assertEquals(1, cd.methods().size());
        assertEquals(new Span(0, text.length()), cd.span());
    }

    @Test
    void testClassMethodVisibility() {
        ClassDeclaration cd = (ClassDeclaration) single("class C { prot fun a() mprot fun b() priv fun c() }");
        List<Visibility> visibilities = cd.methods().stream()
                .map(m -> ((MethodDeclaration) m).visibility()).toList();
        assertEquals(List.of(Visibility.PROTECTED, Visibility.MODULE_PROTECTED, Visibility.PRIVATE), visibilities);
    }

    @Test
    void testClassHeaderError() {
        ParseError error = error("class C ;");
        assertTrue(error.getExpected().contains("`extends` (to continue the class header)"));
        assertTrue(error.getExpected().contains("`implements` (to continue the class header)"));
    }

    @Test
    void testInterface() {
        InterfaceDeclaration id = (InterfaceDeclaration) single("interface Show<T> extends Base { fun show(this) -> String pub fun debug(this) }");
        assertEquals("Base", id.extended().toString());
        assertEquals(2, id.methods().size());
        for (MethodEntry entry : id.methods()) {
            assertEquals(Visibility.PUBLIC, ((MethodDeclaration) entry).visibility());
        }
        MethodDeclaration show = (MethodDeclaration) id.methods().get(0);
        assertEquals(new Span(33, 57), show.span());
    }

    @Test
    void testInterfaceRejectsOtherVisibility() {
        ParseError error = error("interface I { priv fun a() }");
        assertEquals("priv", error.getFound());
        assertTrue(error.getExpected().contains(VisibilityRule.INTERFACE.expectation));
    }

    @Test
    void testInterfaceHasNoFields() {
        // the failed method attempt is rewound, so the error points at its start
        assertEquals("pub", error("interface I { pub x -> T }").getFound());
    }

    // ========== Whole Programs ==========

    @Test
    void testProgram() {
        String text = """
                import io: { print, read: input } from std.io;

                /// A point
                export struct Point { pub x -> Int, pub y -> Int }

                interface Shape { fun area(this) -> Float }

                class Circle implements Shape {
                    priv center -> Point,
                    priv radius -> Float,
                    pub fun area(this) -> Float { return 3.14 * radius * radius; }
                }

                enum Color { Red, Green, Rgb(Int, Int, Int) }

                type Points = List<Point>;
                """;
        Program program = program(text);
        assertEquals(6, program.size());
        assertInstanceOf(ImportStatement.class, program.statements().get(0));
        CommentedNode commented = (CommentedNode) program.statements().get(1);
        assertInstanceOf(ExportStatement.class, commented.node());
        assertInstanceOf(InterfaceDeclaration.class, program.statements().get(2));
        assertInstanceOf(ClassDeclaration.class, program.statements().get(3));
        assertInstanceOf(EnumDeclaration.class, program.statements().get(4));
        assertInstanceOf(TypeAlias.class, program.statements().get(5));
    }

    @Test
    void testCustomBodyParser() {
        BodyParser none = cursor -> BlockBody.empty(cursor.previous().getSpan().end);
        Program program = new UckParser(Resource.text("interface I { fun a() fun b() }"), none).parse();
        InterfaceDeclaration id = (InterfaceDeclaration) program.statements().get(0);
        assertEquals(2, id.methods().size());
    }

    @Test
    void testDeepNestingIsFatalNotStackOverflow() {
        StringBuilder sb = new StringBuilder("type A = ");
        for (int i = 0; i < 1000; i++) {
            sb.append("B<");
        }
        ParseError error = error(sb.toString());
        assertTrue(error.getExpected().stream().anyMatch(s -> s.contains("levels of nesting")));
    }

}
