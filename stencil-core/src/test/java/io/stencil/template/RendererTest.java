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
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RendererTest {

    private static Renderer renderer(EngineConfig config) {
        return new Renderer(config, new ComponentLoader(config.getSourceLoader(), config.isCaching()));
    }

    @Test
    void testSuspendAndResume() {
        CompletableFuture<Object> pending = new CompletableFuture<>();
        MapSourceLoader sources = new MapSourceLoader().put("page", "[$(wait())]");
        EngineConfig config = EngineConfig.builder().sourceLoader(sources).tool("wait", args -> pending).build();
        Renderer renderer = renderer(config);
        assertEquals(RenderState.IDLE, renderer.getState());
        CompletableFuture<String> result = renderer.render("page", Map.of());
        assertEquals(RenderState.SUSPENDED, renderer.getState());
        assertFalse(result.isDone());
        pending.complete("done");
        assertEquals("[done]", result.join());
        assertEquals(RenderState.DONE, renderer.getState());
    }

    @Test
    void testFailedState() {
        MapSourceLoader sources = new MapSourceLoader().put("page", "a$(missing())b");
        Renderer renderer = renderer(EngineConfig.builder().sourceLoader(sources).build());
        CompletableFuture<String> result = renderer.render("page", Map.of());
        CompletionException e = assertThrows(CompletionException.class, result::join);
        assertEquals(ErrorKind.UNRESOLVED_TOOL, ((TemplateException) e.getCause()).getKind());
        assertEquals(RenderState.FAILED, renderer.getState());
    }

    @Test
    void testSingleUse() {
        MapSourceLoader sources = new MapSourceLoader().put("page", "x");
        Renderer renderer = renderer(EngineConfig.builder().sourceLoader(sources).build());
        assertEquals("x", renderer.render("page", Map.of()).join());
        assertThrows(IllegalStateException.class, () -> renderer.render("page", Map.of()));
    }

    @Test
    void testShortCircuit() {
        AtomicInteger calls = new AtomicInteger();
        MapSourceLoader sources = new MapSourceLoader().put("page", "$(false && count())|$(1 || count())|$(0 || count())");
        EngineConfig config = EngineConfig.builder().sourceLoader(sources).tool("count", args -> calls.incrementAndGet()).build();
        assertEquals("false|1|1", renderer(config).render("page", Map.of()).join());
        assertEquals(1, calls.get());
    }

    @Test
    void testToolArgumentsInOrder() {
        List<Object> seen = new ArrayList<>();
        MapSourceLoader sources = new MapSourceLoader().put("page", "$(pair(echo('a'), echo('b')))");
        EngineConfig config = EngineConfig.builder().sourceLoader(sources)
                .tool("echo", args -> CompletableFuture.supplyAsync(() -> {
                    synchronized (seen) {
                        seen.add(args[0]);
                    }
                    return args[0];
                }))
                .tool("pair", args -> args[0] + "+" + args[1])
                .build();
        assertEquals("a+b", renderer(config).render("page", Map.of()).join());
        assertEquals(List.of("a", "b"), seen);
    }

    @Test
    void testInlineComponent() {
        EngineConfig config = EngineConfig.builder().sourceLoader(new MapSourceLoader()).build();
        Component component = new Component(null, List.of(), "");
        assertEquals("", renderer(config).render(component, null).join());
    }

}
