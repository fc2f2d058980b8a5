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
 * Base class for every failure surfaced by {@link Engine#render}. A render is
 * all or nothing, so once one of these is raised no output is produced.
 */
public class TemplateException extends RuntimeException {

    private final ErrorKind kind;
    private final String detail;
    private final String component;
    private final int line;

    public TemplateException(ErrorKind kind, String detail, String component, int line) {
        this(kind, detail, component, line, null);
    }

    public TemplateException(ErrorKind kind, String detail, String component, int line, Throwable cause) {
        super(format(kind, detail, component, line), cause);
        this.kind = kind;
        this.detail = detail;
        this.component = component;
        this.line = line;
    }

    private static String format(ErrorKind kind, String detail, String component, int line) {
        StringBuilder sb = new StringBuilder();
        sb.append(kind);
        if (component != null && !component.isEmpty()) {
            sb.append(' ').append(component);
            if (line > 0) {
                sb.append(':').append(line);
            }
        } else if (line > 0) {
            sb.append(" line ").append(line);
        }
        sb.append(" - ").append(detail);
        return sb.toString();
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * The human readable message without the kind / position prefix.
     */
    public String getDetail() {
        return detail;
    }

    /**
     * The component identifier the failure is attributed to, or null when
     * rendering inline text.
     */
    public String getComponent() {
        return component;
    }

    /**
     * 1-based line number, or -1 when not determinable.
     */
    public int getLine() {
        return line;
    }

}
