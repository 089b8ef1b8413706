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

import java.util.HashMap;
import java.util.Map;

public enum TokenType {

    EOF,
    ERROR,
    COMMENT,
    IDENT,
    //==== keywords
    IMPORT(true),
    FROM(true),
    DEFAULT(true),
    EXPORT(true),
    ENUM(true),
    STRUCT(true),
    CLASS(true),
    INTERFACE(true),
    TYPE(true),
    FUN(true),
    AS(true),
    EXTENDS(true),
    IMPLEMENTS(true),
    IF(true),
    ELSE(true),
    MATCH(true),
    FOR(true),
    WHILE(true),
    LOOP(true),
    BREAK(true),
    CONTINUE(true),
    LET(true),
    CONST(true),
    MUT(true),
    RETURN(true),
    YIELD(true),
    THIS(true),
    // visibility markers
    PUB(true),
    PRIV(true),
    MPRIV(true),
    PROT(true),
    MPROT(true),
    //==== literals
    STRING_LIT,
    CHAR_LIT,
    INT_LIT,
    WORD_LIT,
    FLOAT_LIT,
    BOOL_LIT,
    //==== punctuation
    COMMA,
    COLON,
    SEMI,
    L_PAREN,
    R_PAREN,
    L_CURLY,
    R_CURLY,
    L_BRACKET,
    R_BRACKET,
    DOT_DOT,
    DOT,
    QUES,
    //====
    EQ_EQ,
    EQ_GT, // fat arrow
    EQ,
    NOT_EQ,
    NOT,
    LT_LT,
    LT_EQ,
    LT,
    GT_GT,
    GT_EQ,
    GT,
    MINUS_GT, // thin arrow
    MINUS,
    PLUS,
    STAR_STAR,
    STAR,
    SLASH,
    PERCENT,
    AMP_AMP,
    AMP,
    PIPE_PIPE,
    PIPE,
    CARET,
    //==== reserved symbols
    TILDE,
    DOLLAR,
    AT,
    HASH;

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (TokenType type : values()) {
            if (type.keyword) {
                KEYWORDS.put(type.name().toLowerCase(), type);
            }
        }
    }

    public final boolean keyword;

    TokenType() {
        this(false);
    }

    TokenType(boolean keyword) {
        this.keyword = keyword;
    }

    // not set in the constructor, the switch reads values()
    public boolean isLiteral() {
        return switch (this) {
            case STRING_LIT, CHAR_LIT, INT_LIT, WORD_LIT, FLOAT_LIT, BOOL_LIT -> true;
            default -> false;
        };
    }

    public boolean isReserved() {
        return switch (this) {
            case TILDE, DOLLAR, AT, HASH -> true;
            default -> false;
        };
    }

    /**
     * @return the keyword spelled exactly as {@code word}, or null
     */
    public static TokenType keyword(String word) {
        return KEYWORDS.get(word);
    }

    public boolean oneOf(TokenType... types) {
        for (TokenType type : types) {
            if (this == type) {
                return true;
            }
        }
        return false;
    }

}
