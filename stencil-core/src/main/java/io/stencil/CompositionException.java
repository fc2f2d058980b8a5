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
package io.stencil;

/**
 * A placeholder was not supplied by the caller, or a placeholder was declared
 * where it is not allowed (inside a replacement body).
 */
public class CompositionException extends TemplateException {

    private final String placeholder;

    public CompositionException(ErrorKind kind, String placeholder, String detail, String component, int line) {
        super(kind, detail, component, line);
        this.placeholder = placeholder;
    }

    public static CompositionException missing(String placeholder, String component, int line) {
        return new CompositionException(ErrorKind.MISSING_PLACEHOLDER, placeholder,
                "no replacement supplied for placeholder '" + placeholder + "'", component, line);
    }

    public static CompositionException misplaced(String placeholder, String component, int line) {
        return new CompositionException(ErrorKind.MISPLACED_PLACEHOLDER, placeholder,
                "placeholder '" + placeholder + "' cannot be declared inside a $replace body", component, line);
    }

    public String getPlaceholder() {
        return placeholder;
    }

}
