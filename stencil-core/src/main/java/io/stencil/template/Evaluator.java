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

import io.stencil.ErrorKind;
import io.stencil.TemplateException;
import io.stencil.UnresolvedToolException;
import io.stencil.parser.Expr;
import io.stencil.parser.ExprVisitor;
import io.stencil.parser.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

/**
 * Evaluates expressions against a scope. Every result is a future because a
 * tool may answer asynchronously; operands are evaluated left to right and
 * each completes before the next one starts.
 */
class Evaluator {

    private final Map<String, Tool> tools;
    private final Consumer<RenderState> stateListener;

    Evaluator(Map<String, Tool> tools, Consumer<RenderState> stateListener) {
        this.tools = tools;
        this.stateListener = stateListener;
    }

    CompletableFuture<Object> evaluate(Expr expr, Scope scope) {
        return expr.accept(new Visitor(scope));
    }

    private static CompletableFuture<Object> done(Object value) {
        return CompletableFuture.completedFuture(value);
    }

    private static Throwable unwrap(Throwable t) {
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private class Visitor implements ExprVisitor<CompletableFuture<Object>> {

        private final Scope scope;

        Visitor(Scope scope) {
            this.scope = scope;
        }

        @Override
        public CompletableFuture<Object> visitLiteral(Expr.Literal expr) {
            return done(expr.value());
        }

        @Override
        public CompletableFuture<Object> visitLocal(Expr.Local expr) {
            return done(scope.resolveLocal(expr.name()));
        }

        @Override
        public CompletableFuture<Object> visitGlobal(Expr.Global expr) {
            return done(scope.resolveGlobal(expr.name()));
        }

        @Override
        public CompletableFuture<Object> visitMember(Expr.Member expr) {
            return expr.target().accept(this).thenApply(target -> PropertyAccess.get(target, expr.name()));
        }

        @Override
        public CompletableFuture<Object> visitIndex(Expr.Index expr) {
            return expr.target().accept(this).thenCompose(target ->
                    expr.index().accept(this).thenApply(index -> PropertyAccess.get(target, index)));
        }

        @Override
        public CompletableFuture<Object> visitToolCall(Expr.ToolCall expr) {
            Tool tool = tools.get(expr.name());
            if (tool == null) {
                throw new UnresolvedToolException(expr.name(), scope.getComponent(), expr.line());
            }
            CompletableFuture<List<Object>> args = CompletableFuture.completedFuture(new ArrayList<>(expr.args().size()));
            for (Expr arg : expr.args()) {
                args = args.thenCompose(list -> arg.accept(this).thenApply(value -> {
                    list.add(Terms.isUndefined(value) ? null : value);
                    return list;
                }));
            }
            return args.thenCompose(list -> invoke(tool, expr, list.toArray()));
        }

        private CompletableFuture<Object> invoke(Tool tool, Expr.ToolCall expr, Object[] args) {
            Object result;
            try {
                result = tool.call(args);
            } catch (TemplateException e) {
                throw e;
            } catch (Exception e) {
                throw toolFailure(expr, e);
            }
            if (!(result instanceof CompletionStage)) {
                return done(result);
            }
            @SuppressWarnings("unchecked")
            CompletableFuture<Object> deferred = ((CompletionStage<Object>) result).toCompletableFuture();
            if (deferred.isDone()) {
                return deferred.handle((value, error) -> settle(expr, value, error));
            }
            stateListener.accept(RenderState.SUSPENDED);
            return deferred.handle((value, error) -> {
                stateListener.accept(RenderState.EVALUATING);
                return settle(expr, value, error);
            });
        }

        private Object settle(Expr.ToolCall expr, Object value, Throwable error) {
            if (error == null) {
                return value;
            }
            Throwable cause = unwrap(error);
            if (cause instanceof TemplateException) {
                throw (TemplateException) cause;
            }
            throw toolFailure(expr, cause);
        }

        private TemplateException toolFailure(Expr.ToolCall expr, Throwable cause) {
            String detail = "tool '" + expr.name() + "' failed: " + cause;
            return new TemplateException(ErrorKind.TOOL_FAILURE, detail, scope.getComponent(), expr.line(), cause);
        }

        @Override
        public CompletableFuture<Object> visitBinary(Expr.Binary expr) {
            TokenType operator = expr.operator();
            if (operator == TokenType.AMP_AMP) {
                return expr.left().accept(this).thenCompose(left ->
                        Terms.isTruthy(left) ? expr.right().accept(this) : done(left));
            }
            if (operator == TokenType.PIPE_PIPE) {
                return expr.left().accept(this).thenCompose(left ->
                        Terms.isTruthy(left) ? done(left) : expr.right().accept(this));
            }
            return expr.left().accept(this).thenCompose(left ->
                    expr.right().accept(this).thenApply(right -> compare(operator, left, right)));
        }

        @Override
        public CompletableFuture<Object> visitUnary(Expr.Unary expr) {
            return expr.operand().accept(this).thenApply(value -> !Terms.isTruthy(value));
        }

        @Override
        public CompletableFuture<Object> visitGroup(Expr.Group expr) {
            return expr.inner().accept(this);
        }

    }

    static Object compare(TokenType operator, Object left, Object right) {
        return switch (operator) {
            case EQ_EQ_EQ -> Terms.eq(left, right, true);
            case EQ_EQ -> Terms.eq(left, right, false);
            case NOT_EQ_EQ -> !Terms.eq(left, right, true);
            case NOT_EQ -> !Terms.eq(left, right, false);
            case LT -> Terms.lt(left, right);
            case LT_EQ -> Terms.ltEq(left, right);
            case GT -> Terms.gt(left, right);
            case GT_EQ -> Terms.gtEq(left, right);
            default -> throw new IllegalArgumentException("not a binary operator: " + operator);
        };
    }

}
