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
package io.stencil.template;

import java.util.Collections;
import java.util.Map;

/**
 * One lexical frame. A frame never mutates its parent, lookups walk from the
 * innermost frame outwards and yield {@link Terms#UNDEFINED} when nothing
 * binds the name. Every frame knows the component it belongs to, which is
 * what errors raised while evaluating against it are attributed to.
 */
public class Scope {

    private final Scope parent;
    private final Map<String, Object> bindings;
    private final Map<String, Object> globals;
    private final String component;
    private final int depth;

    private Scope(Scope parent, Map<String, Object> bindings, Map<String, Object> globals, String component) {
        this.parent = parent;
        this.bindings = bindings == null ? Collections.emptyMap() : bindings;
        this.globals = globals == null ? Collections.emptyMap() : globals;
        this.component = component;
        this.depth = parent == null ? 0 : parent.depth + 1;
    }

    /**
     * A frame with no parent, used for the top level render and for every
     * nested component.
     */
    public static Scope root(String component, Map<String, Object> bindings, Map<String, Object> globals) {
        return new Scope(null, bindings, globals, component);
    }

    public Scope push(Map<String, Object> bindings) {
        return new Scope(this, bindings, globals, component);
    }

    public Object resolveLocal(String name) {
        Scope scope = this;
        while (scope != null) {
            if (scope.bindings.containsKey(name)) {
                return scope.bindings.get(name);
            }
            scope = scope.parent;
        }
        return Terms.UNDEFINED;
    }

    public Object resolveGlobal(String name) {
        if (globals.containsKey(name)) {
            return globals.get(name);
        }
        return Terms.UNDEFINED;
    }

    public Scope getParent() {
        return parent;
    }

    public String getComponent() {
        return component;
    }

    public int getDepth() {
        return depth;
    }

    @Override
    public String toString() {
        String name = component == null ? "(inline)" : component;
        return depth == 0 ? name : name + "[" + depth + "]";
    }

}
