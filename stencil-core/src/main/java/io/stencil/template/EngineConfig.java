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

import net.minidev.json.JSONValue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Everything an engine needs, fixed at construction. Build it with
 * {@link #builder()}, or start from a JSON settings file with {@link #load(Path)}:
 * <pre>
 * {
 *   "root": "classpath:templates",
 *   "extension": ".stl",
 *   "caching": true,
 *   "maxDepth": 64,
 *   "globals": { "siteName": "Acme" }
 * }
 * </pre>
 * Tools and the log consumer are code, so they are always added on the builder.
 */
public class EngineConfig {

    public static final int DEFAULT_MAX_DEPTH = 64;

    private final Map<String, Tool> tools;
    private final Map<String, Object> globals;
    private final SourceLoader sourceLoader;
    private final boolean caching;
    private final int maxDepth;
    private final Consumer<String> onLog;

    private EngineConfig(Builder builder) {
        this.tools = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tools));
        this.globals = Collections.unmodifiableMap(new LinkedHashMap<>(builder.globals));
        this.sourceLoader = builder.sourceLoader;
        this.caching = builder.caching;
        this.maxDepth = builder.maxDepth;
        this.onLog = builder.onLog;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads settings from a JSON file.
     *
     * @throws RuntimeException if the file cannot be read or is not a JSON object
     */
    public static Builder load(Path path) {
        try {
            return parse(Files.readString(path));
        } catch (Exception e) {
            throw new RuntimeException("failed to load engine config from: " + path, e);
        }
    }

    @SuppressWarnings("unchecked")
    public static Builder parse(String json) {
        if (json == null || json.isBlank()) {
            throw new RuntimeException("invalid config: input is null or blank");
        }
        Object parsed = JSONValue.parseKeepingOrder(json);
        if (!(parsed instanceof Map)) {
            throw new RuntimeException("invalid config: expected JSON object");
        }
        Map<String, Object> map = (Map<String, Object>) parsed;
        Builder builder = new Builder();
        if (map.get("caching") instanceof Boolean) {
            builder.caching((Boolean) map.get("caching"));
        }
        if (map.get("maxDepth") instanceof Number) {
            builder.maxDepth(((Number) map.get("maxDepth")).intValue());
        }
        if (map.get("root") instanceof String) {
            Object extension = map.get("extension");
            String ext = extension instanceof String ? (String) extension : PathSourceLoader.DEFAULT_EXTENSION;
            builder.sourceLoader(new PathSourceLoader((String) map.get("root"), ext));
        }
        if (map.get("globals") instanceof Map) {
            builder.globals((Map<String, Object>) map.get("globals"));
        }
        return builder;
    }

    public Map<String, Tool> getTools() {
        return tools;
    }

    public Map<String, Object> getGlobals() {
        return globals;
    }

    public SourceLoader getSourceLoader() {
        return sourceLoader;
    }

    public boolean isCaching() {
        return caching;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public Consumer<String> getOnLog() {
        return onLog;
    }

    public static class Builder {

        private final Map<String, Tool> tools = new LinkedHashMap<>();
        private final Map<String, Object> globals = new LinkedHashMap<>();
        private SourceLoader sourceLoader;
        private boolean caching = true;
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private Consumer<String> onLog;

        private Builder() {

        }

        public Builder tool(String name, Tool tool) {
            tools.put(name, tool);
            return this;
        }

        public Builder tools(Map<String, Tool> tools) {
            this.tools.putAll(tools);
            return this;
        }

        public Builder global(String name, Object value) {
            globals.put(name, value);
            return this;
        }

        public Builder globals(Map<String, Object> globals) {
            this.globals.putAll(globals);
            return this;
        }

        public Builder sourceLoader(SourceLoader sourceLoader) {
            this.sourceLoader = sourceLoader;
            return this;
        }

        public Builder caching(boolean caching) {
            this.caching = caching;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            if (maxDepth < 1) {
                throw new IllegalArgumentException("maxDepth must be at least 1: " + maxDepth);
            }
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder onLog(Consumer<String> onLog) {
            this.onLog = onLog;
            return this;
        }

        public EngineConfig build() {
            if (sourceLoader == null) {
                throw new IllegalStateException("a source loader is required");
            }
            return new EngineConfig(this);
        }

    }

}
