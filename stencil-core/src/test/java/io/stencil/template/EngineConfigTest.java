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

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    @Test
    void testDefaults() {
        EngineConfig config = EngineConfig.builder().sourceLoader(new MapSourceLoader()).build();
        assertTrue(config.isCaching());
        assertEquals(EngineConfig.DEFAULT_MAX_DEPTH, config.getMaxDepth());
        assertTrue(config.getTools().isEmpty());
        assertTrue(config.getGlobals().isEmpty());
        assertNull(config.getOnLog());
    }

    @Test
    void testBuilder() {
        Tool upper = args -> String.valueOf(args[0]).toUpperCase();
        EngineConfig config = EngineConfig.builder()
                .sourceLoader(new MapSourceLoader())
                .tool("upper", upper)
                .global("site", "Acme")
                .globals(Map.of("year", 2025))
                .caching(false)
                .maxDepth(3)
                .onLog(text -> { })
                .build();
        assertSame(upper, config.getTools().get("upper"));
        assertEquals("Acme", config.getGlobals().get("site"));
        assertEquals(2025, config.getGlobals().get("year"));
        assertFalse(config.isCaching());
        assertEquals(3, config.getMaxDepth());
        assertNotNull(config.getOnLog());
        assertThrows(UnsupportedOperationException.class, () -> config.getGlobals().put("x", 1));
    }

    @Test
    void testValidation() {
        assertThrows(IllegalStateException.class, () -> EngineConfig.builder().build());
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.builder().maxDepth(0));
    }

    @Test
    void testLoadJson() throws Exception {
        Path path = Path.of(getClass().getResource("/config/engine.json").toURI());
        EngineConfig config = EngineConfig.load(path).build();
        assertFalse(config.isCaching());
        assertEquals(8, config.getMaxDepth());
        assertEquals("Acme", config.getGlobals().get("siteName"));
        assertEquals(2025, config.getGlobals().get("year"));
        PathSourceLoader loader = (PathSourceLoader) config.getSourceLoader();
        assertTrue(loader.classpath);
        assertEquals("templates/", loader.root);
        assertEquals(".stl", loader.extension);
        assertEquals("Hello $(name)!", loader.load("hello"));
    }

    @Test
    void testParseJson() {
        EngineConfig config = EngineConfig.parse("{ \"root\": \"views\" }")
                .tool("now", args -> "today")
                .build();
        assertTrue(config.isCaching());
        assertEquals(".stl", ((PathSourceLoader) config.getSourceLoader()).extension);
        assertEquals(1, config.getTools().size());
    }

    @Test
    void testInvalidJson() {
        assertThrows(RuntimeException.class, () -> EngineConfig.parse("[1, 2]"));
        assertThrows(RuntimeException.class, () -> EngineConfig.parse(" "));
        assertThrows(RuntimeException.class, () -> EngineConfig.load(Path.of("does-not-exist.json")));
        // no root means no loader
        assertThrows(IllegalStateException.class, () -> EngineConfig.parse("{}").build());
    }

}
