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

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Member and index access on template values. Never fails for absent data:
 * a missing base, an unknown key or an index out of range all yield
 * {@link Terms#UNDEFINED}.
 */
class PropertyAccess {

    private static final String LENGTH = "length";
    private static final String SIZE = "size";

    private PropertyAccess() {
        // only static methods
    }

    static Object get(Object target, Object key) {
        if (target == null || target == Terms.UNDEFINED || key == null || key == Terms.UNDEFINED) {
            return Terms.UNDEFINED;
        }
        if (target instanceof Map<?, ?> map) {
            String name = key instanceof String s ? s : Terms.toText(key);
            return map.containsKey(name) ? map.get(name) : Terms.UNDEFINED;
        }
        if (target instanceof List<?> list) {
            if (isLength(key)) {
                return list.size();
            }
            int index = toIndex(key);
            return index >= 0 && index < list.size() ? list.get(index) : Terms.UNDEFINED;
        }
        if (target.getClass().isArray()) {
            int length = Array.getLength(target);
            if (isLength(key)) {
                return length;
            }
            int index = toIndex(key);
            return index >= 0 && index < length ? Array.get(target, index) : Terms.UNDEFINED;
        }
        if (target instanceof String s) {
            if (LENGTH.equals(key)) {
                return s.length();
            }
            int index = toIndex(key);
            return index >= 0 && index < s.length() ? String.valueOf(s.charAt(index)) : Terms.UNDEFINED;
        }
        if (target instanceof Collection<?> collection) {
            return isLength(key) ? collection.size() : Terms.UNDEFINED;
        }
        if (key instanceof String name && !Terms.isScalar(target)) {
            return getBeanProperty(target, name);
        }
        return Terms.UNDEFINED;
    }

    private static boolean isLength(Object key) {
        return LENGTH.equals(key) || SIZE.equals(key);
    }

    private static int toIndex(Object key) {
        if (key instanceof Number n) {
            double d = n.doubleValue();
            return d % 1 == 0 ? (int) d : -1;
        }
        if (key instanceof String s) {
            try {
                return Integer.parseInt(s);
            } catch (NumberFormatException e) {
                return -1;
            }
        }
        return -1;
    }

    /**
     * Looks up a public no-argument accessor: {@code name()} (records),
     * {@code getName()} or {@code isName()}.
     */
    private static Object getBeanProperty(Object target, String name) {
        if (name.isEmpty() || "class".equals(name)) {
            return Terms.UNDEFINED;
        }
        String suffix = Character.toUpperCase(name.charAt(0)) + name.substring(1);
        Method method = findAccessor(target.getClass(), name);
        if (method == null) {
            method = findAccessor(target.getClass(), "get" + suffix);
        }
        if (method == null) {
            method = findAccessor(target.getClass(), "is" + suffix);
        }
        if (method == null) {
            return Terms.UNDEFINED;
        }
        try {
            return method.invoke(target);
        } catch (InvocationTargetException e) {
            throw new IllegalStateException("property '" + name + "' of " + target.getClass().getSimpleName()
                    + " failed: " + e.getCause(), e.getCause());
        } catch (IllegalAccessException e) {
            return Terms.UNDEFINED;
        }
    }

    private static Method findAccessor(Class<?> type, String methodName) {
        try {
            Method method = type.getMethod(methodName);
            if (method.getReturnType() == void.class || Modifier.isStatic(method.getModifiers())
                    || method.getDeclaringClass() == Object.class) {
                return null;
            }
            return method;
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

}
