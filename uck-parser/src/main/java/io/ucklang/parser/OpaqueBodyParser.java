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

import io.ucklang.ast.BlockBody;
import io.ucklang.common.Span;

import static io.ucklang.parser.TokenType.*;

/**
 * Skips a brace-balanced {@code { ... }} block without looking inside it.
 */
public class OpaqueBodyParser implements BodyParser {

    @Override
    public BlockBody parse(TokenCursor cursor) {
        int position = cursor.savePosition();
        Token previous = cursor.previous();
        Token open = cursor.next();
        while (open.type == COMMENT) {
            open = cursor.next();
        }
        if (open.type != L_CURLY) {
            cursor.returnToPosition(position);
            return BlockBody.empty(previous == null ? 0 : previous.getSpan().end);
        }
        int depth = 1;
        while (true) {
            Token token = cursor.next();
            switch (token.type) {
                case L_CURLY -> depth++;
                case R_CURLY -> {
                    if (--depth == 0) {
                        return new BlockBody(new Span(open.pos, token.getSpan().end));
                    }
                }
                case EOF -> throw new ParseException(ParseError.endOfInput(true, "`}` (to close the method body)"));
                default -> {
                    // opaque
                }
            }
        }
    }

}
