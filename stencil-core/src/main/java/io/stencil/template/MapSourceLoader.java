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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps component sources in memory, keyed by identifier.
 */
public class MapSourceLoader implements SourceLoader {

    private final Map<String, String> sources = new ConcurrentHashMap<>();

    public MapSourceLoader() {

    }

    public MapSourceLoader(Map<String, String> sources) {
        this.sources.putAll(sources);
    }

    public MapSourceLoader put(String identifier, String text) {
        sources.put(identifier, text);
        return this;
    }

    public MapSourceLoader remove(String identifier) {
        sources.remove(identifier);
        return this;
    }

    @Override
    public String load(String identifier) {
        return sources.get(identifier);
    }

    @Override
    public String toString() {
        return "memory" + sources.keySet();
    }

}
