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

import net.minidev.json.JSONStyle;
import net.minidev.json.JSONValue;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

public class StringUtils {

    private StringUtils() {
        // only static methods
    }

    public static String formatJson(Object o) {
        return formatJson(o, true);
    }

    /**
     * Renders maps and lists as JSON. Map entries keep their iteration order,
     * pretty output puts one entry per line with two-space indent.
     */
    public static String formatJson(Object o, boolean pretty) {
        if (!pretty) {
            return JSONValue.toJSONString(o, JSONStyle.NO_COMPRESS);
        }
        StringBuilder sb = new StringBuilder();
        formatRecurse(o, sb, 0);
        return sb.toString();
    }

    private static void formatRecurse(Object o, StringBuilder sb, int depth) {
        if (o == null) {
            sb.append("null");
        } else if (o instanceof List<?> list) {
            if (list.isEmpty()) {
                sb.append("[]");
                return;
            }
            sb.append('[').append('\n');
            Iterator<?> iterator = list.iterator();
            while (iterator.hasNext()) {
                pad(sb, depth + 1);
                formatRecurse(iterator.next(), sb, depth + 1);
                if (iterator.hasNext()) {
                    sb.append(',');
                }
                sb.append('\n');
            }
            pad(sb, depth);
            sb.append(']');
        } else if (o instanceof Map<?, ?> map) {
            if (map.isEmpty()) {
                sb.append("{}");
                return;
            }
            sb.append('{').append('\n');
            Iterator<? extends Map.Entry<?, ?>> iterator = map.entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<?, ?> entry = iterator.next();
                pad(sb, depth + 1);
                sb.append('"').append(JSONValue.escape(String.valueOf(entry.getKey()))).append('"');
                sb.append(':').append(' ');
                formatRecurse(entry.getValue(), sb, depth + 1);
                if (iterator.hasNext()) {
                    sb.append(',');
                }
                sb.append('\n');
            }
            pad(sb, depth);
            sb.append('}');
        } else if (o instanceof Number || o instanceof Boolean) {
            sb.append(o);
        } else {
            sb.append('"').append(JSONValue.escape(o.toString())).append('"');
        }
    }

    private static void pad(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append(' ').append(' ');
        }
    }

}
