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

import java.util.List;
import java.util.Map;

/**
 * Template syntax tree. The set of node kinds is closed, every consumer
 * walks it through a {@link NodeVisitor} so that adding a statement kind
 * forces each of them to handle it. Lines are 1-based.
 */
public sealed interface Node {

    int line();

    <R> R accept(NodeVisitor<R> visitor);

    record Text(String text, int line) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitText(this);
        }
    }

    /**
     * {@code $print(expr)} or the short form {@code $(expr)}.
     */
    record Print(Expr expr, boolean shortForm, int line) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitPrint(this);
        }
    }

    record Log(Expr expr, int line) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitLog(this);
        }
    }

    record Branch(Expr condition, List<Node> body, int line) {

    }

    /**
     * An {@code $if} / {@code $elseif} chain, {@code elseBody} is null when
     * there is no {@code $else}.
     */
    record If(List<Branch> branches, List<Node> elseBody, int line) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    /**
     * {@code indexName} is null for the two argument form.
     */
    record Foreach(String itemName, String indexName, Expr collection, List<Node> body, int line) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitForeach(this);
        }
    }

    /**
     * Both maps keep source order.
     */
    record Render(Expr component, Map<String, Expr> bindings, Map<String, List<Node>> replacements, int line) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitRender(this);
        }
    }

    record Include(String componentName, int line) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitInclude(this);
        }
    }

    record Place(String name, int line) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitPlace(this);
        }
    }

}
