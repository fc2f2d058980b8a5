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

import io.stencil.template.Terms;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a syntax tree as compact single line text, for diagnostics and for
 * asserting on parse results, for example
 * {@code [if((a == 1)){"x"} else {print(b.c)}]}.
 */
public class AstPrinter implements NodeVisitor<String>, ExprVisitor<String> {

    private static final AstPrinter INSTANCE = new AstPrinter();

    public static String print(List<Node> body) {
        return INSTANCE.body(body);
    }

    public static String print(Expr expr) {
        return expr.accept(INSTANCE);
    }

    private String body(List<Node> body) {
        return body.stream().map(node -> node.accept(this)).collect(Collectors.joining(", ", "[", "]"));
    }

    private String block(List<Node> body) {
        return body.stream().map(node -> node.accept(this)).collect(Collectors.joining(", ", "{", "}"));
    }

    private static String quote(String text) {
        return '"' + text.replace("\\", "\\\\").replace("\n", "\\n").replace("\"", "\\\"") + '"';
    }

    @Override
    public String visitText(Node.Text node) {
        return quote(node.text());
    }

    @Override
    public String visitPrint(Node.Print node) {
        return "print(" + node.expr().accept(this) + ")";
    }

    @Override
    public String visitLog(Node.Log node) {
        return "log(" + node.expr().accept(this) + ")";
    }

    @Override
    public String visitIf(Node.If node) {
        StringBuilder sb = new StringBuilder();
        for (Node.Branch branch : node.branches()) {
            sb.append(sb.length() == 0 ? "if(" : " elseif(");
            sb.append(branch.condition().accept(this)).append(')').append(block(branch.body()));
        }
        if (node.elseBody() != null) {
            sb.append(" else ").append(block(node.elseBody()));
        }
        return sb.toString();
    }

    @Override
    public String visitForeach(Node.Foreach node) {
        String vars = node.indexName() == null ? node.itemName() : node.itemName() + ", " + node.indexName();
        return "foreach(" + vars + " : " + node.collection().accept(this) + ")" + block(node.body());
    }

    @Override
    public String visitRender(Node.Render node) {
        StringBuilder sb = new StringBuilder("render(");
        sb.append(node.component().accept(this));
        for (Map.Entry<String, Expr> entry : node.bindings().entrySet()) {
            sb.append(", ").append(entry.getKey()).append('=').append(entry.getValue().accept(this));
        }
        sb.append(')');
        for (Map.Entry<String, List<Node>> entry : node.replacements().entrySet()) {
            sb.append(" replace(").append(entry.getKey()).append(')').append(block(entry.getValue()));
        }
        return sb.toString();
    }

    @Override
    public String visitInclude(Node.Include node) {
        return "include(" + node.componentName() + ")";
    }

    @Override
    public String visitPlace(Node.Place node) {
        return "place(" + node.name() + ")";
    }

    @Override
    public String visitLiteral(Expr.Literal expr) {
        Object value = expr.value();
        return value instanceof String ? "'" + value + "'" : Terms.toText(value);
    }

    @Override
    public String visitLocal(Expr.Local expr) {
        return expr.name();
    }

    @Override
    public String visitGlobal(Expr.Global expr) {
        return "@" + expr.name();
    }

    @Override
    public String visitMember(Expr.Member expr) {
        return expr.target().accept(this) + "." + expr.name();
    }

    @Override
    public String visitIndex(Expr.Index expr) {
        return expr.target().accept(this) + "[" + expr.index().accept(this) + "]";
    }

    @Override
    public String visitToolCall(Expr.ToolCall expr) {
        return expr.name() + expr.args().stream().map(arg -> arg.accept(this)).collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public String visitBinary(Expr.Binary expr) {
        return "(" + expr.left().accept(this) + " " + symbol(expr.operator()) + " " + expr.right().accept(this) + ")";
    }

    @Override
    public String visitUnary(Expr.Unary expr) {
        return symbol(expr.operator()) + expr.operand().accept(this);
    }

    @Override
    public String visitGroup(Expr.Group expr) {
        return "(" + expr.inner().accept(this) + ")";
    }

    static String symbol(TokenType type) {
        return switch (type) {
            case EQ_EQ_EQ -> "===";
            case EQ_EQ -> "==";
            case NOT_EQ_EQ -> "!==";
            case NOT_EQ -> "!=";
            case LT_EQ -> "<=";
            case LT -> "<";
            case GT_EQ -> ">=";
            case GT -> ">";
            case AMP_AMP -> "&&";
            case PIPE_PIPE -> "||";
            case NOT -> "!";
            case EQ -> "=";
            default -> type.name();
        };
    }

}
