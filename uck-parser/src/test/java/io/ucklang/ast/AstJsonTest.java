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

import io.ucklang.parser.UckParser;
import net.minidev.json.JSONValue;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AstJsonTest {

    private static Object first(String text) {
        Program program = UckParser.parse(text);
        return AstJson.toValue(program.statements().get(0));
    }

    @Test
    void testImport() {
        NodeUtils.match(first("import a: { b, c: d } from mod.sub;"), """
                {kind:'import',
                 pattern:{kind:'destructure',name:'a',children:[
                   {kind:'name',name:'b',span:'12..13'},
                   {kind:'alias',name:'c',alias:'d',span:'15..19'}],span:'7..21'},
                 from:'mod.sub',span:'7..35'}
                """);
    }

    @Test
    void testTypeAlias() {
        NodeUtils.match(first("type A<T> = B.C<T>;"), """
                {kind:'type_alias',
                 alias:{kind:'generic',base:{kind:'root',name:'A',span:'5..6'},
                   generics:{kind:'generics',entries:{T:null},span:'6..9'},span:'5..9'},
                 target:{kind:'generic',
                   base:{kind:'member',owner:{kind:'root',name:'B',span:'12..13'},member:'C',span:'12..15'},
                   generics:{kind:'generics',entries:{'0':{kind:'root',name:'T',span:'16..17'}},span:'15..18'},
                   span:'12..18'},
                 span:'0..19'}
                """);
    }

    @Test
    void testStructWithMethod() {
        NodeUtils.match(first("struct S { pub x -> T, priv fun f(mut this, y -> T) -> T {} }"), """
                {kind:'struct',
                 header:{kind:'generic',base:{kind:'root',name:'S',span:'7..8'},
                   generics:{kind:'generics',entries:{},span:'8..8'},span:'7..8'},
                 implements:null,
                 fields:[{kind:'field',visibility:'pub',name:'x',type:{kind:'root',name:'T',span:'20..21'},span:'11..21'}],
                 methods:[{kind:'method',visibility:'priv',
                   header:{kind:'generic',base:{kind:'root',name:'f',span:'32..33'},
                     generics:{kind:'generics',entries:{},span:'33..33'},span:'32..33'},
                   arguments:[{kind:'mut_this',span:'34..42'},
                     {kind:'argument',name:'y',type:{kind:'root',name:'T',span:'49..50'},span:'44..50'}],
                   returns:{kind:'root',name:'T',span:'55..56'},
                   body:'57..59',span:'23..59'}],
                 span:'0..61'}
                """);
    }

    @Test
    void testCommentedExport() {
        NodeUtils.match(first("// hi\nexport default enum E { A }"), """
                {kind:'commented',comment:'// hi',
                 node:{kind:'export_default',
                   exported:{kind:'enum',
                     header:{kind:'generic',base:{kind:'root',name:'E',span:'26..27'},
                       generics:{kind:'generics',entries:{},span:'27..27'},span:'26..27'},
                     implements:null,
                     cases:[{kind:'enum_case',name:'A',arguments:[],span:'30..31'}],
                     methods:[],span:'21..33'},
                   span:'6..33'},
                 span:'0..33'}
                """);
    }

    @Test
    void testProgramJsonKeepsKeyOrder() {
        Program program = UckParser.parse("type A = B;");
        Map<String, Object> map = AstJson.toMap(program);
        assertEquals(List.of("kind", "statements"), List.copyOf(map.keySet()));
        Map<?, ?> alias = (Map<?, ?>) ((List<?>) map.get("statements")).get(0);
        assertEquals(List.of("kind", "alias", "target", "span"), List.copyOf(alias.keySet()));
    }

    @Test
    void testPrettyAndCompactParseBack() {
        Program program = UckParser.parse("interface I { fun a(this) }");
        String pretty = AstJson.toJson(program, true);
        String compact = AstJson.toJson(program, false);
        assertTrue(pretty.contains("\n  \"statements\": ["));
        assertFalse(compact.contains("\n"));
        assertEquals(JSONValue.parse(compact), JSONValue.parse(pretty));
    }

}
