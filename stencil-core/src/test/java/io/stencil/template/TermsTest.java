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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.stencil.template.Terms.UNDEFINED;
import static org.junit.jupiter.api.Assertions.*;

class TermsTest {

    @Test
    void testTruthy() {
        assertFalse(Terms.isTruthy(0));
        assertFalse(Terms.isTruthy(0.0));
        assertFalse(Terms.isTruthy(""));
        assertFalse(Terms.isTruthy(false));
        assertFalse(Terms.isTruthy(null));
        assertFalse(Terms.isTruthy(UNDEFINED));
        assertFalse(Terms.isTruthy(Double.NaN));
        assertTrue(Terms.isTruthy(1));
        assertTrue(Terms.isTruthy(-0.5));
        assertTrue(Terms.isTruthy("a"));
        assertTrue(Terms.isTruthy(" "));
        assertTrue(Terms.isTruthy(true));
        assertTrue(Terms.isTruthy(Collections.emptyMap()));
        assertTrue(Terms.isTruthy(Collections.emptyList()));
        assertTrue(Terms.isTruthy(new Object()));
    }

    @Test
    void testToText() {
        assertEquals("undefined", Terms.toText(UNDEFINED));
        assertEquals("null", Terms.toText(null));
        assertEquals("Hi", Terms.toText("Hi"));
        assertEquals("2", Terms.toText(2.0));
        assertEquals("2.5", Terms.toText(2.5));
        assertEquals("42", Terms.toText(42L));
        assertEquals("1.10", Terms.toText(new BigDecimal("1.10")));
        assertEquals("true", Terms.toText(true));
        assertEquals("x", Terms.toText('x'));
    }

    @Test
    void testToTextJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("b", 1);
        map.put("a", Arrays.asList(1, "x", null, UNDEFINED));
        assertEquals("{\"b\":1,\"a\":[1,\"x\",null,null]}", Terms.toText(map));
        assertEquals("[]", Terms.toText(new ArrayList<>()));
        assertEquals("[1,2]", Terms.toText(new int[]{1, 2}));
        assertEquals("{}", Terms.toText(new HashMap<>()));
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("n", 2.0);
        assertEquals("[{\"n\":2}]", Terms.toText(List.of(nested)));
    }

    @Test
    void testLooseEquality() {
        assertTrue(Terms.eq(1, 1.0, false));
        assertTrue(Terms.eq(1, "1", false));
        assertTrue(Terms.eq(true, 1, false));
        assertTrue(Terms.eq(null, UNDEFINED, false));
        assertTrue(Terms.eq(UNDEFINED, null, false));
        assertFalse(Terms.eq(null, 0, false));
        assertFalse(Terms.eq("a", "b", false));
        assertFalse(Terms.eq("1", "1.0", false));
    }

    @Test
    void testStrictEquality() {
        assertTrue(Terms.eq(1, 1.0, true));
        assertTrue(Terms.eq("a", "a", true));
        assertFalse(Terms.eq(1, "1", true));
        assertFalse(Terms.eq(null, UNDEFINED, true));
        assertTrue(Terms.eq(UNDEFINED, UNDEFINED, true));
    }

    @Test
    void testObjectIdentity() {
        List<Object> list = new ArrayList<>();
        assertTrue(Terms.eq(list, list, true));
        assertFalse(Terms.eq(list, new ArrayList<>(), false));
        assertFalse(Terms.eq(new HashMap<>(), new HashMap<>(), true));
    }

    @Test
    void testRelational() {
        assertTrue(Terms.lt(1, 2));
        assertTrue(Terms.ltEq(2, 2.0));
        assertTrue(Terms.gt("10", 9));
        assertTrue(Terms.gtEq(3, 2));
        // both strings compare lexicographically
        assertTrue(Terms.lt("10", "9"));
        assertFalse(Terms.lt(UNDEFINED, 1));
        assertFalse(Terms.gtEq(UNDEFINED, 1));
        assertTrue(Terms.lt(null, 1));
    }

    @Test
    void testNumbers() {
        assertEquals(1, Terms.toNumber("1"));
        assertEquals(1.5, Terms.toNumber("1.5"));
        assertEquals(-3, Terms.toNumber("-3"));
        assertEquals(1000, Terms.toNumber("1e3"));
        assertEquals(0, Terms.toNumber(" "));
        assertTrue(Double.isNaN(Terms.toNumber("abc").doubleValue()));
        assertEquals(3000000000L, Terms.narrow(3000000000.0));
    }

    @Test
    void testUnquote() {
        assertEquals("abc", Terms.unquote("'abc'"));
        assertEquals("a\nb", Terms.unquote("'a\\nb'"));
        assertEquals("it's", Terms.unquote("'it\\'s'"));
        assertEquals("say \"hi\"", Terms.unquote("\"say \\\"hi\\\"\""));
        assertEquals("a\\b", Terms.unquote("'a\\\\b'"));
    }

}
