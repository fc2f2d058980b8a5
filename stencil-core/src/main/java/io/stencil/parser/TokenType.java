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
package io.stencil.parser;

public enum TokenType {

    WS(false),
    EOF,
    //==== template level
    TEXT,
    STATEMENT_OPEN,
    STATEMENT_CLOSE,
    SHORT_PRINT_OPEN,
    //==== literals
    IDENT,
    STRING,
    NUMBER,
    //==== keywords
    TRUE(true, false),
    FALSE(true, false),
    NULL(true, false),
    UNDEFINED(true, false),
    //==== punctuation
    L_PAREN,
    R_PAREN,
    L_BRACKET,
    R_BRACKET,
    DOT,
    COMMA,
    AT,
    //==== operators
    EQ_EQ_EQ(false, true),
    EQ_EQ(false, true),
    NOT_EQ_EQ(false, true),
    NOT_EQ(false, true),
    LT_EQ(false, true),
    LT(false, true),
    GT_EQ(false, true),
    GT(false, true),
    AMP_AMP(false, true),
    PIPE_PIPE(false, true),
    NOT(false, true),
    EQ(false, true);

    public final boolean primary;
    public final boolean keyword;
    public final boolean operator;

    TokenType() {
        this(true);
    }

    TokenType(boolean primary) {
        this.primary = primary;
        keyword = false;
        operator = false;
    }

    TokenType(boolean keyword, boolean operator) {
        primary = true;
        this.keyword = keyword;
        this.operator = operator;
    }

    static TokenType keyword(String text) {
        return switch (text) {
            case "true" -> TRUE;
            case "false" -> FALSE;
            case "null" -> NULL;
            case "undefined" -> UNDEFINED;
            default -> null;
        };
    }

}
