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

import io.stencil.CompositionException;
import io.stencil.ErrorKind;
import io.stencil.TemplateException;
import io.stencil.parser.Node;
import io.stencil.parser.NodeVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Walks the tree of one top level render. A renderer is used once: output of
 * nested components and replacements goes to the same buffer in document
 * order, and each node completes before the next one is started, so a tool
 * that answers later never lets following text overtake it.
 */
public class Renderer {

    private static final Logger logger = LoggerFactory.getLogger(Renderer.class);

    // $log output
    private static final Logger LOG = LoggerFactory.getLogger("io.stencil.log");

    private final EngineConfig config;
    private final ComponentLoader loader;
    private final Evaluator evaluator;
    private final StringBuilder out = new StringBuilder();

    private volatile RenderState state = RenderState.IDLE;
    private volatile String currentComponent;
    private volatile int currentLine = -1;

    public Renderer(EngineConfig config, ComponentLoader loader) {
        this.config = config;
        this.loader = loader;
        this.evaluator = new Evaluator(config.getTools(), this::setState);
    }

    /**
     * Carries what a component body needs besides its scope: the
     * pre-rendered replacement text supplied by its caller and how deeply it
     * is nested.
     */
    record Invocation(String identifier, Map<String, String> replacements, int depth) {

    }

    public RenderState getState() {
        return state;
    }

    private void setState(RenderState next) {
        if (logger.isTraceEnabled()) {
            logger.trace("{} -> {} at {}:{}", state, next, currentComponent, currentLine);
        }
        state = next;
    }

    public CompletableFuture<String> render(String identifier, Map<String, Object> locals) {
        return start(() -> CompletableFuture.completedFuture(null)
                .thenApply(v -> loader.resolve(identifier))
                .thenCompose(component -> renderComponent(component, locals)));
    }

    public CompletableFuture<String> render(Component component, Map<String, Object> locals) {
        return start(() -> CompletableFuture.completedFuture(null)
                .thenCompose(v -> renderComponent(component, locals)));
    }

    private CompletableFuture<String> start(Supplier<CompletableFuture<Void>> body) {
        if (state != RenderState.IDLE) {
            throw new IllegalStateException("renderer already used, state: " + state);
        }
        setState(RenderState.EVALUATING);
        CompletableFuture<String> result = new CompletableFuture<>();
        body.get().whenComplete((v, error) -> {
            if (error == null) {
                setState(RenderState.DONE);
                result.complete(out.toString());
            } else {
                setState(RenderState.FAILED);
                result.completeExceptionally(toTemplateException(error));
            }
        });
        return result;
    }

    private CompletableFuture<Void> renderComponent(Component component, Map<String, Object> locals) {
        Map<String, Object> bindings = locals == null ? Collections.emptyMap() : locals;
        Scope scope = Scope.root(component.identifier(), bindings, config.getGlobals());
        Invocation invocation = new Invocation(component.identifier(), Collections.emptyMap(), 0);
        return renderBody(component.body(), scope, invocation, out);
    }

    private CompletableFuture<Void> renderBody(List<Node> body, Scope scope, Invocation invocation, StringBuilder sb) {
        NodeRenderer visitor = new NodeRenderer(scope, invocation, sb);
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Node node : body) {
            chain = chain.thenCompose(v -> {
                currentComponent = invocation.identifier();
                currentLine = node.line();
                return node.accept(visitor);
            });
        }
        return chain;
    }

    private TemplateException toTemplateException(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TemplateException) {
            return (TemplateException) cause;
        }
        String detail = cause.getMessage() == null ? cause.toString() : cause.getMessage();
        return new TemplateException(ErrorKind.EVALUATION_ERROR, detail, currentComponent, currentLine, cause);
    }

    private static List<Object> toItems(Object value) {
        if (value instanceof Iterable<?> iterable) {
            List<Object> items = new ArrayList<>();
            iterable.forEach(items::add);
            return items;
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> items = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                items.add(Array.get(value, i));
            }
            return items;
        }
        return Collections.emptyList();
    }

    private class NodeRenderer implements NodeVisitor<CompletableFuture<Void>> {

        private final Scope scope;
        private final Invocation invocation;
        private final StringBuilder sb;

        NodeRenderer(Scope scope, Invocation invocation, StringBuilder sb) {
            this.scope = scope;
            this.invocation = invocation;
            this.sb = sb;
        }

        private CompletableFuture<Void> append(String text) {
            sb.append(text);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletableFuture<Void> visitText(Node.Text node) {
            return append(node.text());
        }

        @Override
        public CompletableFuture<Void> visitPrint(Node.Print node) {
            return evaluator.evaluate(node.expr(), scope).thenAccept(value -> sb.append(Terms.toText(value)));
        }

        @Override
        public CompletableFuture<Void> visitLog(Node.Log node) {
            return evaluator.evaluate(node.expr(), scope).thenAccept(value -> log(Terms.toText(value), node.line()));
        }

        private void log(String text, int line) {
            LOG.info("[{}:{}] {}", invocation.identifier(), line, text);
            Consumer<String> onLog = config.getOnLog();
            if (onLog == null) {
                return;
            }
            try {
                onLog.accept(text);
            } catch (Exception e) {
                logger.warn("log consumer failed at {}:{} - {}", invocation.identifier(), line, e.toString());
            }
        }

        @Override
        public CompletableFuture<Void> visitIf(Node.If node) {
            return branch(node, 0);
        }

        private CompletableFuture<Void> branch(Node.If node, int index) {
            if (index == node.branches().size()) {
                return node.elseBody() == null ? CompletableFuture.completedFuture(null)
                        : renderBody(node.elseBody(), scope, invocation, sb);
            }
            Node.Branch branch = node.branches().get(index);
            return evaluator.evaluate(branch.condition(), scope).thenCompose(value -> Terms.isTruthy(value)
                    ? renderBody(branch.body(), scope, invocation, sb)
                    : branch(node, index + 1));
        }

        @Override
        public CompletableFuture<Void> visitForeach(Node.Foreach node) {
            return evaluator.evaluate(node.collection(), scope).thenCompose(value -> {
                List<Object> items = toItems(value);
                CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
                for (int i = 0; i < items.size(); i++) {
                    Map<String, Object> frame = new LinkedHashMap<>(2);
                    if (node.indexName() != null) {
                        frame.put(node.indexName(), i);
                    }
                    frame.put(node.itemName(), items.get(i));
                    Scope iteration = scope.push(frame);
                    chain = chain.thenCompose(v -> renderBody(node.body(), iteration, invocation, sb));
                }
                return chain;
            });
        }

        @Override
        public CompletableFuture<Void> visitRender(Node.Render node) {
            return evaluator.evaluate(node.component(), scope).thenCompose(name -> {
                String identifier = Terms.toText(name);
                Map<String, Object> bindings = new LinkedHashMap<>(node.bindings().size());
                CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
                for (String key : node.bindings().keySet()) {
                    chain = chain.thenCompose(v -> evaluator.evaluate(node.bindings().get(key), scope)
                            .thenAccept(value -> bindings.put(key, value)));
                }
                return chain.thenCompose(v -> invoke(node, identifier, bindings));
            });
        }

        private CompletableFuture<Void> invoke(Node.Render node, String identifier, Map<String, Object> bindings) {
            int depth = invocation.depth() + 1;
            if (depth > config.getMaxDepth()) {
                throw new TemplateException(ErrorKind.RECURSION_LIMIT, "nested render depth exceeds "
                        + config.getMaxDepth() + " at: " + identifier, invocation.identifier(), node.line());
            }
            Component component = loader.resolve(identifier);
            Map<String, String> replacements = new LinkedHashMap<>(node.replacements().size());
            CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
            for (Map.Entry<String, List<Node>> entry : node.replacements().entrySet()) {
                StringBuilder buffer = new StringBuilder();
                chain = chain.thenCompose(v -> renderBody(entry.getValue(), scope, invocation, buffer)
                        .thenRun(() -> replacements.put(entry.getKey(), buffer.toString())));
            }
            return chain.thenCompose(v -> {
                Scope callee = Scope.root(identifier, bindings, config.getGlobals());
                Invocation next = new Invocation(identifier, replacements, depth);
                return renderBody(component.body(), callee, next, sb);
            });
        }

        @Override
        public CompletableFuture<Void> visitInclude(Node.Include node) {
            return append(loader.source(node.componentName()));
        }

        @Override
        public CompletableFuture<Void> visitPlace(Node.Place node) {
            String text = invocation.replacements().get(node.name());
            if (text == null) {
                throw CompositionException.missing(node.name(), invocation.identifier(), node.line());
            }
            return append(text);
        }

    }

}
