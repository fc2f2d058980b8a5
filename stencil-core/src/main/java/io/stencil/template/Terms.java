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

import io.stencil.parser.Token;
import net.minidev.json.JSONValue;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Value semantics shared by the evaluator and the renderer: the missing
 * sentinel, truthiness, equality, ordering and conversion to output text.
 */
public class Terms {

    /**
     * The value of anything that cannot be resolved: unknown locals and
     * globals, members of missing values, out of range indexes. Prints as
     * {@code undefined} and is falsy.
     */
    public static final Object UNDEFINED = new Object() {
        @Override
        public String toString() {
            return "undefined";
        }
    };

    static final Number NAN = Double.NaN;

    private Terms() {
        // only static methods
    }

    public static boolean isUndefined(Object value) {
        return value == UNDEFINED;
    }

    // ========== Literals ==========

    public static Object literalValue(Token token) {
        return switch (token.type) {
            case STRING -> unquote(token.text);
            case NUMBER -> toNumber(token.text);
            case TRUE -> true;
            case FALSE -> false;
            case UNDEFINED -> UNDEFINED;
            default -> null; // includes NULL
        };
    }

    static String unquote(String text) {
        String raw = text.substring(1, text.length() - 1);
        if (raw.indexOf('\\') == -1) {
            return raw;
        }
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c != '\\' || i == raw.length() - 1) {
                sb.append(c);
                continue;
            }
            char next = raw.charAt(++i);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                default -> sb.append(next); // \\ \' \" \$ and anything else
            }
        }
        return sb.toString();
    }

    // ========== Numbers ==========

    public static Number toNumber(String text) {
        text = text.trim();
        if (text.isEmpty()) {
            return 0;
        }
        try {
            return narrow(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            return NAN;
        }
    }

    static Number objectToNumber(Object o) {
        if (o == null) {
            return 0;
        }
        if (o instanceof Number n) {
            return n;
        }
        if (o instanceof Boolean b) {
            return b ? 1 : 0;
        }
        if (o instanceof String s) {
            return toNumber(s);
        }
        return NAN; // includes undefined
    }

    public static Number narrow(double d) {
        if (d % 1 != 0 || Double.isNaN(d) || Double.isInfinite(d)) {
            return d;
        }
        if (d == 0 && Double.doubleToRawLongBits(d) != 0) { // -0.0
            return d;
        }
        if (d <= Integer.MAX_VALUE && d >= Integer.MIN_VALUE) {
            return (int) d;
        }
        if (d <= Long.MAX_VALUE && d >= Long.MIN_VALUE) {
            return (long) d;
        }
        return d;
    }

    // ========== Truthiness and comparison ==========

    public static boolean isTruthy(Object value) {
        if (value == null || value == UNDEFINED) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        return true;
    }

    static boolean eq(Object lhs, Object rhs, boolean strict) {
        if (lhs == null) {
            return rhs == null || !strict && rhs == UNDEFINED;
        }
        if (lhs == UNDEFINED) {
            return rhs == UNDEFINED || !strict && rhs == null;
        }
        if (rhs == null || rhs == UNDEFINED) {
            return false;
        }
        if (lhs == rhs) { // instance equality !
            return true;
        }
        // objects and arrays are only ever equal to themselves
        if (lhs instanceof Map || lhs instanceof Collection || lhs.getClass().isArray()) {
            return false;
        }
        if (lhs instanceof Number l && rhs instanceof Number r) {
            return l.doubleValue() == r.doubleValue();
        }
        if (lhs.equals(rhs)) {
            return true;
        }
        if (strict) {
            return false;
        }
        if (isScalar(lhs) && isScalar(rhs)) {
            if (lhs instanceof String && rhs instanceof String) {
                return false;
            }
            return objectToNumber(lhs).doubleValue() == objectToNumber(rhs).doubleValue();
        }
        return false;
    }

    static boolean lt(Object lhs, Object rhs) {
        if (lhs instanceof String l && rhs instanceof String r) {
            return l.compareTo(r) < 0;
        }
        return objectToNumber(lhs).doubleValue() < objectToNumber(rhs).doubleValue();
    }

    static boolean ltEq(Object lhs, Object rhs) {
        if (lhs instanceof String l && rhs instanceof String r) {
            return l.compareTo(r) <= 0;
        }
        return objectToNumber(lhs).doubleValue() <= objectToNumber(rhs).doubleValue();
    }

    static boolean gt(Object lhs, Object rhs) {
        if (lhs instanceof String l && rhs instanceof String r) {
            return l.compareTo(r) > 0;
        }
        return objectToNumber(lhs).doubleValue() > objectToNumber(rhs).doubleValue();
    }

    static boolean gtEq(Object lhs, Object rhs) {
        if (lhs instanceof String l && rhs instanceof String r) {
            return l.compareTo(r) >= 0;
        }
        return objectToNumber(lhs).doubleValue() >= objectToNumber(rhs).doubleValue();
    }

    static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    // ========== Output ==========

    /**
     * Converts a value to the text emitted by a print statement. Maps, lists
     * and arrays are written as compact JSON in their own iteration order.
     */
    public static String toText(Object value) {
        if (value == null) {
            return "null";
        }
        if (value == UNDEFINED) {
            return "undefined";
        }
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            Number narrowed = narrow(d);
            return narrowed instanceof Double ? narrowed.toString() : String.valueOf(narrowed);
        }
        if (value instanceof BigDecimal bd) {
            return bd.toPlainString();
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof Character) {
            return value.toString();
        }
        if (value instanceof Map || value instanceof Collection || value.getClass().isArray()) {
            return JSONValue.toJSONString(toJsonValue(value));
        }
        return value.toString();
    }

    static Object toJsonValue(Object value) {
        if (value == null || value == UNDEFINED) {
            return null;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>(map.size());
            map.forEach((k, v) -> result.put(String.valueOf(k), toJsonValue(v)));
            return result;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> result = new ArrayList<>(collection.size());
            collection.forEach(v -> result.add(toJsonValue(v)));
            return result;
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> result = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                result.add(toJsonValue(Array.get(value, i)));
            }
            return result;
        }
        if (value instanceof Double || value instanceof Float) {
            return narrow(((Number) value).doubleValue());
        }
        if (isScalar(value)) {
            return value;
        }
        return toText(value);
    }

}
