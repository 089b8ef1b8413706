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
import io.ucklang.common.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Debug form of the tree as nested maps and lists. Every node becomes a map
 * whose first key is {@code "kind"} and whose last key is {@code "span"};
 * source slices become plain strings.
 */
public class AstJson {

    private AstJson() {
        // only static methods
    }

    public static String toJson(Program program, boolean pretty) {
        return StringUtils.formatJson(toMap(program), pretty);
    }

    public static Map<String, Object> toMap(Program program) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("kind", "program");
        map.put("statements", toList(program.statements()));
        return map;
    }

    public static List<Object> toList(List<? extends AstNode> nodes) {
        List<Object> list = new ArrayList<>(nodes.size());
        for (AstNode node : nodes) {
            list.add(toValue(node));
        }
        return list;
    }

    public static String span(Span span) {
        return span.isEndOfInput() ? "eoi" : span.start + ".." + span.end;
    }

    /**
     * @return a map for a node, the text for a {@link Slice}, null for null
     */
    public static Object toValue(AstNode node) {
        if (node == null) {
            return null;
        }
        if (node instanceof Slice slice) {
            return slice.getText();
        }
        Map<String, Object> map = new LinkedHashMap<>();
        if (node instanceof ImportStatement is) {
            map.put("kind", "import");
            map.put("pattern", toValue(is.pattern()));
            map.put("from", is.modulePath().toString());
        } else if (node instanceof ExportStatement es) {
            map.put("kind", es.defaultExport() ? "export_default" : "export");
            map.put("exported", toValue(es.exported()));
        } else if (node instanceof CommentedNode cn) {
            map.put("kind", "commented");
            map.put("comment", cn.comment().getText());
            map.put("node", toValue(cn.node()));
        } else if (node instanceof TypeAlias ta) {
            map.put("kind", "type_alias");
            map.put("alias", toValue(ta.alias()));
            map.put("target", toValue(ta.target()));
        } else if (node instanceof EnumDeclaration ed) {
            map.put("kind", "enum");
            map.put("header", toValue(ed.header()));
            map.put("implements", toValue(ed.implemented()));
            map.put("cases", toList(ed.cases()));
            map.put("methods", toList(ed.methods()));
        } else if (node instanceof StructDeclaration sd) {
            map.put("kind", "struct");
            map.put("header", toValue(sd.header()));
            map.put("implements", toValue(sd.implemented()));
            map.put("fields", toList(sd.fields()));
            map.put("methods", toList(sd.methods()));
        } else if (node instanceof ClassDeclaration cd) {
            map.put("kind", "class");
            map.put("header", toValue(cd.header()));
            map.put("extends", toValue(cd.extended()));
            map.put("implements", toValue(cd.implemented()));
            map.put("fields", toList(cd.fields()));
            map.put("methods", toList(cd.methods()));
        } else if (node instanceof InterfaceDeclaration id) {
            map.put("kind", "interface");
            map.put("header", toValue(id.header()));
            map.put("extends", toValue(id.extended()));
            map.put("methods", toList(id.methods()));
        } else if (node instanceof EnumCase ec) {
            map.put("kind", "enum_case");
            map.put("name", ec.name().getText());
            map.put("arguments", toList(ec.arguments()));
        } else if (node instanceof Field f) {
            map.put("kind", "field");
            map.put("visibility", f.visibility().keyword);
            map.put("name", f.name().getText());
            map.put("type", toValue(f.type()));
        } else if (node instanceof DocumentedMethod dm) {
            map.put("kind", "documented");
            map.put("comment", dm.comment().getText());
            map.put("method", toValue(dm.documented()));
        } else if (node instanceof MethodDeclaration md) {
            map.put("kind", "method");
            map.put("visibility", md.visibility().keyword);
            map.put("header", toValue(md.header()));
            map.put("arguments", toList(md.arguments()));
            map.put("returns", toValue(md.returnType()));
            map.put("body", md.body().isEmpty() ? null : span(md.body().span()));
        } else if (node instanceof ConstraintBlock cb) {
            map.put("kind", "constraint");
            map.put("generics", toValue(cb.constraints()));
            map.put("methods", toList(cb.methods()));
        } else if (node instanceof ThisArgument th) {
            map.put("kind", th.mutable() ? "mut_this" : "this");
        } else if (node instanceof RegularArgument ra) {
            map.put("kind", "argument");
            map.put("name", ra.name().getText());
            map.put("type", toValue(ra.type()));
        } else if (node instanceof RootName rn) {
            map.put("kind", "root");
            map.put("name", rn.name().getText());
        } else if (node instanceof MemberOf mo) {
            map.put("kind", "member");
            map.put("owner", toValue(mo.owner()));
            map.put("member", mo.member().getText());
        } else if (node instanceof GenericOf go) {
            map.put("kind", "generic");
            map.put("base", toValue(go.base()));
            map.put("generics", toValue(go.generics()));
        } else if (node instanceof Generics g) {
            map.put("kind", "generics");
            Map<String, Object> entries = new LinkedHashMap<>();
            g.entries().forEach((k, v) -> entries.put(k, toValue(v.bound())));
            map.put("entries", entries);
        } else if (node instanceof GenericEntry ge) {
            map.put("kind", "generic_entry");
            map.put("name", toValue(ge.name()));
            map.put("bound", toValue(ge.bound()));
        } else if (node instanceof NamePattern np) {
            map.put("kind", "name");
            map.put("name", np.name().getText());
        } else if (node instanceof AliasedPattern ap) {
            map.put("kind", "alias");
            map.put("name", ap.name().getText());
            map.put("alias", ap.alias().getText());
        } else if (node instanceof DestructuredPattern dp) {
            map.put("kind", "destructure");
            map.put("name", dp.name().getText());
            map.put("children", toList(dp.children()));
        } else if (node instanceof ModulePath mp) {
            map.put("kind", "module_path");
            map.put("segments", mp.segments());
        } else if (node instanceof BlockBody) {
            map.put("kind", "body");
        } else {
            throw new IllegalArgumentException("unexpected node: " + node.getClass());
        }
        map.put("span", span(node.span()));
        return map;
    }

}
