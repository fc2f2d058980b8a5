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

import io.stencil.common.Resource;
import io.stencil.common.StringUtils;
import io.stencil.parser.TemplateParser;
import io.stencil.template.Component;
import io.stencil.template.ComponentLoader;
import io.stencil.template.EngineConfig;
import io.stencil.template.Renderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Renders components by identifier.
 * <pre>
 * Engine engine = new Engine(EngineConfig.builder()
 *         .sourceLoader(new PathSourceLoader("classpath:templates"))
 *         .tool("upper", args -&gt; String.valueOf(args[0]).toUpperCase())
 *         .build());
 * String html = engine.render("pages.home", Map.of("title", "Hi")).join();
 * </pre>
 * An engine is safe for concurrent use, each call to {@link #render} walks
 * its own tree evaluation and only the component cache is shared.
 */
public class Engine {

    private static final Logger logger = LoggerFactory.getLogger(Engine.class);

    private final EngineConfig config;
    private final ComponentLoader loader;

    public Engine(EngineConfig config) {
        this.config = config;
        this.loader = new ComponentLoader(config.getSourceLoader(), config.isCaching());
    }

    /**
     * The returned future fails with a {@link TemplateException} and never
     * yields partial output.
     */
    public CompletableFuture<String> render(String identifier, Map<String, Object> locals) {
        return logFailure(new Renderer(config, loader).render(identifier, locals), identifier);
    }

    /**
     * Renders template text that is not known to the source loader. The text
     * may still render and include loader components.
     */
    public CompletableFuture<String> renderText(String text, Map<String, Object> locals) {
        Component component;
        try {
            Resource resource = Resource.text(text);
            component = new Component(null, new TemplateParser(resource).parse(), StringUtils.sha256(text));
        } catch (TemplateException e) {
            logger.debug("render failed: {}", e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
        return logFailure(new Renderer(config, loader).render(component, locals), "(inline)");
    }

    /**
     * Blocks until {@link #render} completes.
     *
     * @throws TemplateException if the render fails
     */
    public String renderNow(String identifier, Map<String, Object> locals) {
        try {
            return render(identifier, locals).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof TemplateException) {
                throw (TemplateException) e.getCause();
            }
            throw e;
        }
    }

    public void clearCache() {
        loader.clear();
    }

    public void clearCache(String identifier) {
        loader.clear(identifier);
    }

    public EngineConfig getConfig() {
        return config;
    }

    private static CompletableFuture<String> logFailure(CompletableFuture<String> future, String identifier) {
        future.whenComplete((text, error) -> {
            if (error != null) {
                logger.debug("render failed: {} - {}", identifier, error.getMessage());
            }
        });
        return future;
    }

}
