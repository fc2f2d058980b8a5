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

import io.stencil.common.FileUtils;
import io.stencil.common.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Maps {@code a.b.c} to {@code <root>/a/b/c<extension>}. A root starting with
 * {@code classpath:} is looked up through the context class loader,
 * anything else is a file system directory.
 */
public class PathSourceLoader implements SourceLoader {

    static final Logger logger = LoggerFactory.getLogger(PathSourceLoader.class);

    public static final String DEFAULT_EXTENSION = ".stl";

    private static final String SLASH = "/";

    public final boolean classpath;
    public final String root;
    public final String extension;

    public PathSourceLoader(String root) {
        this(root, DEFAULT_EXTENSION);
    }

    public PathSourceLoader(String root, String extension) {
        if (root == null) {
            root = "";
        }
        classpath = root.startsWith(Resource.CLASSPATH_COLON);
        root = Resource.removePrefix(root);
        if (!root.isEmpty() && !root.endsWith(SLASH)) {
            root = root + SLASH;
        }
        if (classpath && root.startsWith(SLASH)) {
            root = root.substring(1);
        }
        this.root = root;
        this.extension = extension == null ? "" : extension;
    }

    /**
     * Returns the relative location of a component, or null if the
     * identifier is not a well formed dotted name.
     */
    public String toPath(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return null;
        }
        String[] segments = identifier.split("\\.", -1);
        for (String segment : segments) {
            if (segment.isEmpty() || segment.contains(SLASH) || segment.contains("\\")) {
                return null;
            }
        }
        return root + String.join(SLASH, segments) + extension;
    }

    @Override
    public String load(String identifier) throws IOException {
        String path = toPath(identifier);
        if (path == null) {
            logger.debug("invalid component identifier: {}", identifier);
            return null;
        }
        if (classpath) {
            ClassLoader cl = Thread.currentThread().getContextClassLoader();
            if (cl == null) {
                cl = PathSourceLoader.class.getClassLoader();
            }
            try (InputStream is = cl.getResourceAsStream(path)) {
                return is == null ? null : FileUtils.toString(is);
            }
        }
        Path file = Path.of(path);
        if (!Files.isRegularFile(file)) {
            return null;
        }
        return FileUtils.toString(file);
    }

    @Override
    public String toString() {
        return (classpath ? Resource.CLASSPATH_COLON + root : root) + "*" + extension;
    }

}
