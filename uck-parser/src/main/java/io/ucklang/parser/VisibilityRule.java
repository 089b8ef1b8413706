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

import io.ucklang.ast.Visibility;

/**
 * Which visibility markers a declaration kind accepts for its members.
 */
public enum VisibilityRule {

    /**
     * Structs and enums.
     */
    STRUCT("`pub`, `mpriv` or `priv` (to set the visibility of the item)") {
        @Override
        public Visibility visibility(TokenType type) {
            return switch (type) {
                case PUB -> Visibility.PUBLIC;
                case MPRIV -> Visibility.MODULE_PRIVATE;
                case PRIV -> Visibility.PRIVATE;
                default -> null;
            };
        }
    },

    CLASS("`pub`, `mprot`, `prot`, `mpriv` or `priv` (to set the visibility of the item)") {
        @Override
        public Visibility visibility(TokenType type) {
            return switch (type) {
                case PROT -> Visibility.PROTECTED;
                case MPROT -> Visibility.MODULE_PROTECTED;
                default -> STRUCT.visibility(type);
            };
        }
    },

    /**
     * Interface methods are always public, {@code pub} may be left out.
     */
    INTERFACE("`pub` or `fun` (interface methods are always public)") {
        @Override
        public Visibility visibility(TokenType type) {
            return type == TokenType.PUB ? Visibility.PUBLIC : null;
        }

        @Override
        public boolean isMarkerOptional() {
            return true;
        }
    };

    public final String expectation;

    VisibilityRule(String expectation) {
        this.expectation = expectation;
    }

    /**
     * @return the visibility the token stands for, or null if it is not a
     * marker allowed here
     */
    public abstract Visibility visibility(TokenType type);

    public boolean isMarkerOptional() {
        return false;
    }

}
