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

import java.util.Arrays;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The statements recognized after a {@code $} sign. Statements with
 * {@link #args} take an argument list immediately after the keyword.
 */
public enum StatementType {

    PRINT(true),
    LOG(true),
    IF(true),
    ELSEIF(true),
    ELSE(false),
    ENDIF(false),
    FOREACH(true),
    ENDFOREACH(false),
    RENDER(true),
    ENDRENDER(false),
    REPLACE(true),
    ENDREPLACE(false),
    PLACE(true),
    INCLUDE(true);

    private static final Map<String, StatementType> BY_KEYWORD = new HashMap<>();

    static {
        Arrays.stream(values()).forEach(st -> BY_KEYWORD.put(st.keyword, st));
    }

    public final boolean args;
    public final String keyword;

    StatementType(boolean args) {
        this.args = args;
        this.keyword = name().toLowerCase(Locale.ROOT);
    }

    public static StatementType of(String keyword) {
        return BY_KEYWORD.get(keyword);
    }

    public String display() {
        return "$" + keyword;
    }

}
