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

import io.stencil.template.EngineConfig;
import io.stencil.template.MapSourceLoader;
import io.stencil.template.PathSourceLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EngineTest {

    MapSourceLoader sources;
    EngineConfig.Builder builder;

    public static class Broken {

        public String getValue() {
            throw new IllegalStateException("no value");
        }

    }

    @BeforeEach
    void beforeEach() {
        sources = new MapSourceLoader();
        builder = EngineConfig.builder().sourceLoader(sources);
    }

    private String render(String text) {
        return render(text, Map.of());
    }

    private String render(String text, Map<String, Object> locals) {
        sources.put("main", text);
        return new Engine(builder.build()).renderNow("main", locals);
    }

    private TemplateException fail(String text, Map<String, Object> locals) {
        sources.put("main", text);
        Engine engine = new Engine(builder.build());
        return assertThrows(TemplateException.class, () -> engine.renderNow("main", locals));
    }

    private static Map<String, Object> locals(Object... pairs) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], pairs[i + 1]);
        }
        return map;
    }

    @Test
    void testLiteralIdentity() {
        String text = "Just text\n  with $ signs, $5 and $unknown(stuff)\n";
        assertEquals(text, render(text));
        assertEquals("", render(""));
    }

    @Test
    void testShortPrint() {
        assertEquals("<b>Hi</b>", render("<b>$(title)</b>", locals("title", "Hi")));
        assertEquals("<b>undefined</b>", render("<b>$(title)</b>"));
        assertEquals("<b>Hi</b>", render("<b>$print(title)</b>", locals("title", "Hi")));
    }

    @Test
    void testPrintValues() {
        assertEquals("null", render("$(x)", locals("x", null)));
        assertEquals("2|2.5|true", render("$(a)|$(b)|$(c)", locals("a", 2.0, "b", 2.5, "c", true)));
        assertEquals("[1,\"two\"]", render("$(x)", locals("x", List.of(1, "two"))));
        assertEquals("{\"k\":\"v\"}", render("$(x)", locals("x", locals("k", "v"))));
        assertEquals("it's 3", render("$('it\\'s') $(3)"));
    }

    @Test
    void testReplaceExample() {
        sources.put("A", "$place('main')");
        assertEquals(" X ", render("$render('A') $replace('main') X $endreplace $endrender"));
    }

    @Test
    void testTruthMatrix() {
        String template = "[$if(v)T$else F$endif]";
        Map<String, Object> nullValue = new HashMap<>();
        nullValue.put("v", null);
        assertEquals("[ F]", render(template, locals("v", 0)));
        assertEquals("[ F]", render(template, locals("v", "")));
        assertEquals("[ F]", render(template, locals("v", false)));
        assertEquals("[ F]", render(template, nullValue));
        assertEquals("[ F]", render(template));
        assertEquals("[ F]", render(template, locals("v", Double.NaN)));
        assertEquals("[ F]", render("[$if(undefined)T$else F$endif]"));
        assertEquals("[T]", render(template, locals("v", 1)));
        assertEquals("[T]", render(template, locals("v", "a")));
        assertEquals("[T]", render(template, locals("v", true)));
        assertEquals("[T]", render(template, locals("v", new HashMap<>())));
        assertEquals("[T]", render(template, locals("v", new ArrayList<>())));
    }

    @Test
    void testIfChain() {
        String template = "$if(n == 1)one$elseif(n == 2)two$elseif(n > 2)many$else none$endif";
        assertEquals("one", render(template, locals("n", 1)));
        assertEquals("two", render(template, locals("n", 2)));
        assertEquals("many", render(template, locals("n", 7)));
        assertEquals(" none", render(template, locals("n", 0)));
        assertEquals("", render("$if(false)x$endif"));
    }

    @Test
    void testOperators() {
        assertEquals("default", render("$(a || 'default')"));
        assertEquals("given", render("$(a || 'default')", locals("a", "given")));
        assertEquals("undefined", render("$(a && a.b)"));
        assertEquals("x", render("$(a && a.b)", locals("a", locals("b", "x"))));
        assertEquals("true|false|true|true", render("$(1 == '1')|$(1 === '1')|$(!'')|$(2 >= 1.5)"));
        assertEquals("true", render("$((a || b) && !(c))", locals("b", 1)));
        assertEquals("true", render("$(name != null && name.length > 2)", locals("name", "Ann")));
    }

    @Test
    void testMissingMembers() {
        assertEquals("undefined", render("$(a.b.c)"));
        assertEquals("undefined", render("$(items[5])", locals("items", List.of(1))));
        assertEquals(" y", render("$if(a.b.c)x$else y$endif"));
        assertEquals("2", render("$(items[i])", locals("items", List.of(1, 2), "i", 1)));
        assertEquals("v", render("$(m[k])", locals("m", locals("key", "v"), "k", "key")));
    }

    @Test
    void testForeach() {
        assertEquals("0=a;1=b;2=c;", render("$foreach(x, i, items)$(i)=$(x);$endforeach", locals("items", List.of("a", "b", "c"))));
        assertEquals("12", render("$foreach(x, items)$(x)$endforeach", locals("items", new int[]{1, 2})));
        assertEquals("", render("$foreach(x, items)$(x)$endforeach", locals("items", List.of())));
    }

    @Test
    void testForeachNonIterable() {
        assertEquals("", render("$foreach(x, items)$(x)$endforeach", locals("items", locals("a", 1))));
        assertEquals("", render("$foreach(x, items)$(x)$endforeach", locals("items", "abc")));
        assertEquals("", render("$foreach(x, items)$(x)$endforeach"));
    }

    @Test
    void testForeachShadowing() {
        Map<String, Object> locals = locals("post", "outer", "posts", List.of("a", "b"));
        assertEquals("ab|outer", render("$foreach(post, posts)$(post)$endforeach|$(post)", locals));
        assertEquals("ab|undefined", render("$foreach(x, posts)$(x)$endforeach|$(x)", locals));
    }

    @Test
    void testNestedForeachRestoresOuter() {
        List<Object> posts = List.of(
                locals("title", "p1", "categories", List.of("c1", "c2")),
                locals("title", "p2", "categories", List.of("c3")));
        String template = "$foreach(post, posts)$(post.title)[$foreach(post, post.categories)$(post)$endforeach]$(post.title);$endforeach";
        assertEquals("p1[c1c2]p1;p2[c3]p2;", render(template, locals("posts", posts)));
    }

    @Test
    void testMissingPlaceholder() {
        sources.put("card", "<div>\n$place('body')</div>");
        TemplateException e = fail("$render('card')$endrender", Map.of());
        CompositionException ce = assertInstanceOf(CompositionException.class, e);
        assertEquals(ErrorKind.MISSING_PLACEHOLDER, ce.getKind());
        assertEquals("body", ce.getPlaceholder());
        assertEquals("card", ce.getComponent());
        assertEquals(2, ce.getLine());
        // the top level component has no caller to fill its placeholders
        e = fail("x$place('body')", Map.of());
        assertEquals(ErrorKind.MISSING_PLACEHOLDER, e.getKind());
    }

    @Test
    void testPlaceholderFilledTwice() {
        sources.put("twice", "$place('x')-$place('x')");
        assertEquals("ab-ab", render("$render('twice')$replace('x')a$(v)$endreplace$endrender", locals("v", "b")));
    }

    @Test
    void testMisplacedPlaceholder() {
        TemplateException e = fail("$render('card')$replace('body')$place('body')$endreplace$endrender", Map.of());
        assertEquals(ErrorKind.MISPLACED_PLACEHOLDER, e.getKind());
        assertEquals("main", e.getComponent());
    }

    @Test
    void testParseErrorSurfaces() {
        TemplateException e = fail("ok\n$if(a)", Map.of());
        assertInstanceOf(ParseException.class, e);
        assertEquals(2, e.getLine());
        assertEquals("main", e.getComponent());
    }

    @Test
    void testUnresolvedTool() {
        TemplateException e = fail("a\n$(nope(1))", Map.of());
        UnresolvedToolException ue = assertInstanceOf(UnresolvedToolException.class, e);
        assertEquals(ErrorKind.UNRESOLVED_TOOL, ue.getKind());
        assertEquals("nope", ue.getToolName());
        assertEquals(2, ue.getLine());
        assertEquals("main", ue.getComponent());
        // not reached, not resolved
        assertEquals("", render("$if(false)$(nope())$endif"));
    }

    @Test
    void testMissingSource() {
        Engine engine = new Engine(builder.build());
        TemplateException e = assertThrows(TemplateException.class, () -> engine.renderNow("nope", Map.of()));
        assertEquals(ErrorKind.MISSING_SOURCE, e.getKind());
        assertEquals("nope", ((MissingSourceException) e).getIdentifier());
        e = fail("$render('ghost')$endrender", Map.of());
        assertEquals("ghost", assertInstanceOf(MissingSourceException.class, e).getIdentifier());
        e = fail("$include('ghost')", Map.of());
        assertEquals(ErrorKind.MISSING_SOURCE, e.getKind());
    }

    @Test
    void testFailedFuture() {
        sources.put("main", "before $(boom())");
        Engine engine = new Engine(builder.tool("boom", args -> {
            throw new IllegalArgumentException("bad input");
        }).build());
        CompletableFuture<String> future = engine.render("main", Map.of());
        CompletionException e = assertThrows(CompletionException.class, future::join);
        TemplateException te = assertInstanceOf(TemplateException.class, e.getCause());
        assertEquals(ErrorKind.TOOL_FAILURE, te.getKind());
        assertInstanceOf(IllegalArgumentException.class, te.getCause());
        assertTrue(te.getDetail().contains("boom"));
    }

    @Test
    void testTools() {
        builder.tool("upper", args -> String.valueOf(args[0]).toUpperCase())
                .tool("join", args -> String.join("-", Arrays.stream(args).map(String::valueOf).toList()))
                .tool("show", args -> Arrays.toString(args));
        assertEquals("HI", render("$(upper(x))", locals("x", "hi")));
        assertEquals("a-b-c", render("$(join('a', x, upper('c')))", locals("x", "b")));
        assertEquals("[null, 1, a]", render("$(show(missing, 1, 'a'))"));
        assertEquals("yes", render("$if(upper(x) == 'HI')yes$endif", locals("x", "hi")));
    }

    @Test
    void testAsyncToolKeepsDocumentOrder() {
        builder.tool("slow", args -> CompletableFuture.supplyAsync(() -> args[0],
                        CompletableFuture.delayedExecutor(50, TimeUnit.MILLISECONDS)))
                .tool("fast", args -> args[0]);
        String template = "A$(slow('x'))B$(fast('y'))C$foreach(i, items)$(slow(i))$endforeach";
        Map<String, Object> locals = locals("items", List.of(1, 2, 3));
        String first = render(template, locals);
        assertEquals("AxByC123", first);
        assertEquals(first, render(template, locals));
    }

    @Test
    void testAsyncToolFailure() {
        builder.tool("later", args -> CompletableFuture.supplyAsync(() -> {
            throw new IllegalStateException("later failed");
        }));
        TemplateException e = fail("$(later())", Map.of());
        assertEquals(ErrorKind.TOOL_FAILURE, e.getKind());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void testEvaluationError() {
        TemplateException e = fail("\n$(bean.value)", locals("bean", new Broken()));
        assertEquals(ErrorKind.EVALUATION_ERROR, e.getKind());
        assertEquals("main", e.getComponent());
        assertEquals(2, e.getLine());
    }

    @Test
    void testRecursionLimit() {
        sources.put("loop", "$render('loop')$endrender");
        TemplateException e = fail("$render('loop')$endrender", Map.of());
        assertEquals(ErrorKind.RECURSION_LIMIT, e.getKind());
        assertEquals("loop", e.getComponent());
        sources.put("a", "a$render('b')$endrender").put("b", "b$render('c')$endrender").put("c", "c");
        builder.maxDepth(3);
        assertEquals("abc", render("$render('a')$endrender"));
        builder.maxDepth(2);
        assertEquals(ErrorKind.RECURSION_LIMIT, fail("$render('a')$endrender", Map.of()).getKind());
    }

    @Test
    void testRenderBindingsAreIsolated() {
        sources.put("child", "$(secret)|$(name)|$(title)");
        Map<String, Object> locals = locals("secret", "s", "name", "n");
        assertEquals("undefined|undefined|n", render("$render('child', title=name)$endrender", locals));
    }

    @Test
    void testReplacementUsesCallerScope() {
        sources.put("child", "<$(who)>$place('body')");
        Map<String, Object> locals = locals("who", "caller", "items", List.of("x", "y"));
        assertEquals("<child>caller", render("$render('child', who='child')$replace('body')$(who)$endreplace$endrender", locals));
        assertEquals("<child>x<child>y", render("$foreach(item, items)$render('child', who='child')$replace('body')$(item)$endreplace$endrender$endforeach", locals));
    }

    @Test
    void testNestedComposition() {
        sources.put("layout", "<main>$place('content')</main>");
        sources.put("card", "<div class=\"card\">$(title):$place('body')</div>");
        String template = "$render('layout')$replace('content')$foreach(p, posts)"
                + "$render('card', title=p.title)$replace('body')$(p.body)$endreplace$endrender"
                + "$endforeach$endreplace$endrender";
        List<Object> posts = List.of(locals("title", "T1", "body", "B1"), locals("title", "T2", "body", "B2"));
        assertEquals("<main><div class=\"card\">T1:B1</div><div class=\"card\">T2:B2</div></main>", render(template, locals("posts", posts)));
    }

    @Test
    void testDynamicComponentName() {
        sources.put("widgets.badge", "[badge $(n)]");
        assertEquals("[badge 1]", render("$render(kind, n=1)$endrender", locals("kind", "widgets.badge")));
    }

    @Test
    void testGlobals() {
        builder.global("siteName", "Acme").global("site", locals("name", "Acme"));
        sources.put("footer", "(c) $(@siteName) $(siteName)");
        assertEquals("Acme (c) Acme undefined", render("$(@siteName) $render('footer')$endrender", locals("siteName", "local")));
        assertEquals("undefined", render("$(@nope)"));
        assertEquals("Acme/4", render("$(@site.name)/$(@site.name.length)"));
    }

    @Test
    void testInclude() {
        sources.put("snippet", "$(raw) $if(");
        assertEquals("[$(raw) $if(]", render("[$include('snippet')]"));
    }

    @Test
    void testLog() {
        List<String> logged = new ArrayList<>();
        builder.onLog(logged::add);
        assertEquals("x", render("$log('a' == 'a')x$if(false)$log('hidden')$endif"));
        assertEquals(List.of("true"), logged);
    }

    @Test
    void testLogConsumerFailureIgnored() {
        builder.onLog(text -> {
            throw new IllegalStateException("consumer down");
        });
        assertEquals("ok", render("$log(1)ok"));
    }

    @Test
    void testCaching() {
        AtomicInteger loads = new AtomicInteger();
        MapSourceLoader counted = new MapSourceLoader() {
            @Override
            public String load(String identifier) {
                loads.incrementAndGet();
                return super.load(identifier);
            }
        };
        counted.put("page", "v1");
        Engine engine = new Engine(EngineConfig.builder().sourceLoader(counted).build());
        assertEquals("v1", engine.renderNow("page", Map.of()));
        counted.put("page", "v2");
        assertEquals("v1", engine.renderNow("page", Map.of()));
        assertEquals(1, loads.get());
        engine.clearCache("page");
        assertEquals("v2", engine.renderNow("page", Map.of()));
        counted.put("page", "v3");
        engine.clearCache();
        assertEquals("v3", engine.renderNow("page", Map.of()));
        assertEquals(3, loads.get());
    }

    @Test
    void testNoCaching() {
        AtomicInteger loads = new AtomicInteger();
        MapSourceLoader counted = new MapSourceLoader() {
            @Override
            public String load(String identifier) {
                loads.incrementAndGet();
                return super.load(identifier);
            }
        };
        counted.put("page", "v1");
        Engine engine = new Engine(EngineConfig.builder().sourceLoader(counted).caching(false).build());
        assertEquals("v1", engine.renderNow("page", Map.of()));
        counted.put("page", "v2");
        assertEquals("v2", engine.renderNow("page", Map.of()));
        assertEquals(2, loads.get());
    }

    @Test
    void testRenderText() {
        sources.put("name", "World");
        Engine engine = new Engine(builder.build());
        assertEquals("Hello World 1", engine.renderText("Hello $include('name') $(x)", locals("x", 1)).join());
        CompletionException e = assertThrows(CompletionException.class, () -> engine.renderText("$if(x)", Map.of()).join());
        assertEquals(ErrorKind.PARSE_ERROR, ((TemplateException) e.getCause()).getKind());
    }

    @Test
    void testConcurrentRenders() {
        builder.tool("later", args -> CompletableFuture.supplyAsync(() -> args[0],
                CompletableFuture.delayedExecutor(5, TimeUnit.MILLISECONDS)));
        sources.put("item", "<$(later(n))>");
        sources.put("main", "$foreach(i, items)$render('item', n=i)$endrender$endforeach");
        Engine engine = new Engine(builder.build());
        List<CompletableFuture<String>> futures = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            futures.add(engine.render("main", locals("items", List.of(i, i + 1))));
        }
        for (int i = 0; i < 20; i++) {
            assertEquals("<" + i + "><" + (i + 1) + ">", futures.get(i).join());
        }
    }

    @Test
    void testClasspathTemplates() {
        Engine engine = new Engine(EngineConfig.builder().sourceLoader(new PathSourceLoader("classpath:templates")).build());
        assertEquals("<html><h1>T</h1></html>", engine.renderNow("home", locals("title", "T")));
        assertEquals("Hello Ann!", engine.renderNow("hello", locals("name", "Ann")));
    }

}
