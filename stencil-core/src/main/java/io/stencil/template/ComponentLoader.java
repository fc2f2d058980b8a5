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

import io.stencil.MissingSourceException;
import io.stencil.common.Resource;
import io.stencil.common.StringUtils;
import io.stencil.parser.Node;
import io.stencil.parser.TemplateParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Resolves component identifiers to parsed trees through a {@link SourceLoader}.
 * <p>
 * In caching mode the first resolution of an identifier is shared by every
 * concurrent caller and its result is kept until {@link #clear()}. Failed
 * loads are never cached. Without caching every resolution fetches and parses
 * again, so edits to the source are picked up on the next render.
 */
public class ComponentLoader {

    private static final Logger logger = LoggerFactory.getLogger(ComponentLoader.class);

    private final SourceLoader sourceLoader;
    private final boolean caching;

    private final Map<String, CompletableFuture<Component>> components = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<String>> sources = new ConcurrentHashMap<>();

    public ComponentLoader(SourceLoader sourceLoader, boolean caching) {
        this.sourceLoader = sourceLoader;
        this.caching = caching;
    }

    public Component resolve(String identifier) {
        if (!caching) {
            return parse(identifier);
        }
        return singleFlight(components, identifier, this::parse);
    }

    /**
     * Raw text of a component, as spliced by {@code $include}.
     */
    public String source(String identifier) {
        if (!caching) {
            return fetch(identifier);
        }
        return singleFlight(sources, identifier, this::fetch);
    }

    public void clear() {
        components.clear();
        sources.clear();
        logger.debug("component cache cleared");
    }

    public void clear(String identifier) {
        components.remove(identifier);
        sources.remove(identifier);
        logger.debug("component cache cleared for: {}", identifier);
    }

    public boolean isCaching() {
        return caching;
    }

    public boolean isCached(String identifier) {
        CompletableFuture<Component> future = components.get(identifier);
        return future != null && future.isDone() && !future.isCompletedExceptionally();
    }

    private static <T> T singleFlight(Map<String, CompletableFuture<T>> cache, String identifier, Function<String, T> loader) {
        CompletableFuture<T> future = cache.get(identifier);
        if (future == null) {
            CompletableFuture<T> created = new CompletableFuture<>();
            future = cache.putIfAbsent(identifier, created);
            if (future == null) {
                try {
                    T value = loader.apply(identifier);
                    created.complete(value);
                    return value;
                } catch (RuntimeException e) {
                    cache.remove(identifier, created);
                    created.completeExceptionally(e);
                    throw e;
                }
            }
            logger.trace("waiting on in-flight load: {}", identifier);
        } else {
            logger.debug("cache hit: {}", identifier);
        }
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    private Component parse(String identifier) {
        String text = fetch(identifier);
        Resource resource = Resource.text(text, identifier);
        List<Node> body = new TemplateParser(resource).parse();
        logger.debug("parsed component: {} ({} top level nodes)", identifier, body.size());
        return new Component(identifier, List.copyOf(body), StringUtils.sha256(text));
    }

    private String fetch(String identifier) {
        String text;
        try {
            text = sourceLoader.load(identifier);
        } catch (IOException e) {
            throw new MissingSourceException(identifier, "failed to read component: " + identifier + " - " + e.getMessage(), e);
        }
        if (text == null) {
            throw new MissingSourceException(identifier);
        }
        logger.debug("loaded source: {} from {}", identifier, sourceLoader);
        return text;
    }

}
