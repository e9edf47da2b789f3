package io.lighting.quill.view;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lighting.quill.value.Value;
import io.lighting.quill.value.Values;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TemplateRendererTest {

    private final TemplateRenderer renderer = new TemplateRenderer();

    @Test
    void rendersGreeting() {
        assertEquals("Hello World!", render("Hello @{M.name}!", Values.objectOf("name", "World")));
    }

    @Test
    void selectsConditionalBranch() {
        String source = "@{if M.logged_in}Welcome back!@{else}Please sign in@{fi}";
        assertEquals("Welcome back!", render(source, Values.objectOf("logged_in", true)));
        assertEquals("Please sign in", render(source, Values.objectOf("logged_in", false)));
    }

    @Test
    void evaluatesElseIfChain() {
        String source = "@{if M.n > 10}big@{else if M.n > 5}medium@{elif M.n > 0}small@{else}none@{fi}";
        assertEquals("big", render(source, Values.objectOf("n", 11)));
        assertEquals("medium", render(source, Values.objectOf("n", 6)));
        assertEquals("small", render(source, Values.objectOf("n", 1)));
        assertEquals("none", render(source, Values.objectOf("n", 0)));
    }

    @Test
    void iteratesArrays() {
        Value data = Values.objectOf("items", List.of("A", "B", "C"));
        assertEquals("A B C ", render("@{foreach item in M.items}@{item} @{end}", data));
    }

    @Test
    void exposesLoopIndex() {
        Value data = Values.objectOf("items", List.of("a", "b"));
        assertEquals("0:a,1:b,", render("@{foreach item in M.items}@{index}:@{item},@{end}", data));
    }

    @Test
    void iteratesObjectEntries() {
        Map<String, Object> scores = new LinkedHashMap<>();
        scores.put("ann", 3);
        scores.put("bob", 5);
        Value data = Values.objectOf("scores", scores);
        assertEquals("ann=3;bob=5;", render("@{foreach e in M.scores}@{e.key}=@{e.value};@{end}", data));
    }

    @Test
    void breakAndContinueAffectOnlyInnermostLoop() {
        Value data = Values.objectOf("rows", List.of(List.of(1, 2, 3), List.of(4, 5, 6)));
        String source = "@{foreach row in M.rows}[@{foreach n in row}"
            + "@{if n == 2}@{continue}@{fi}@{if n == 5}@{break}@{fi}@{n}@{end}]@{end}";
        assertEquals("[13][4]", render(source, data));
    }

    @Test
    void loopStackUnwindsAfterLoops() {
        Template template = Template.parse(
            "@{foreach a in M.xs}@{foreach b in M.xs}@{if b == 2}@{break}@{fi}@{end}@{continue}@{end}"
        );
        RenderContext context = RenderContext.of(Values.objectOf("xs", List.of(1, 2, 3)));
        renderer.render(template, context);
        assertEquals(0, context.loopDepth());
    }

    @Test
    void loopStackUnwindsWhenBodyFails() {
        TemplateRenderer failing = new TemplateRenderer(name -> {
            throw new TemplateRenderException(name, "Template not found: " + name);
        }, true, 8);
        Template template = Template.parse("@{foreach a in M.xs}@{foreach b in M.xs}@{view('gone')}@{end}@{end}");
        RenderContext context = RenderContext.of(Values.objectOf("xs", List.of(1, 2)));

        assertThrows(TemplateRenderException.class, () -> failing.render(template, context));
        assertEquals(0, context.loopDepth());
    }

    @Test
    void breakAndContinueOutsideLoopsAreIgnored() {
        assertEquals("abcd", render("a@{if true}b@{break}c@{fi}d", Value.NULL));
        assertEquals("xyz", render("x@{continue}y@{if 1}@{break}@{fi}z", Value.NULL));
    }

    @Test
    void loopVariableShadowsModelField() {
        Value data = Values.objectOf("x", "model", "items", List.of("loop"));
        assertEquals("loop|model", render("@{foreach x in M.items}@{x}@{end}|@{x}", data));
    }

    @Test
    void escapesOutputUnlessRaw() {
        Value data = Values.objectOf("x", "<script>");
        assertTrue(render("@{M.x}", data).contains("&lt;script&gt;"));
        assertEquals("<script>", render("@{!M.x}", data));
    }

    @Test
    void missingValuesRenderEmpty() {
        assertEquals("[]", render("[@{M.missing.deep}@{nothing}@{M.list[3]}]", Values.objectOf("list", List.of())));
    }

    @Test
    void nonIterableCollectionRendersNothing() {
        assertEquals("", render("@{foreach x in M.name}@{x}@{end}", Values.objectOf("name", "text")));
    }

    @Test
    void evaluatesExpressions() {
        Value data = Values.objectOf("a", 6, "b", 4, "name", "quill", "tags", List.of("x", "y"));
        assertEquals("10", render("@{M.a + M.b}", data));
        assertEquals("1.5", render("@{M.a / M.b}", data));
        assertEquals("2", render("@{M.a % M.b}", data));
        assertEquals("quill!", render("@{M.name + '!'}", data));
        assertEquals("yes", render("@{M.a > M.b && !false ? 'yes' : 'no'}", data));
        assertEquals("2", render("@{M.tags.length}", data));
        assertEquals("y", render("@{M.tags[1]}", data));
        assertEquals("", render("@{M.a / 0}", data));
        assertEquals("true", render("@{[1, 2] == [1, 2]}", data));
        assertEquals("false", render("@{'a' < 'b'}", data));
        assertEquals("-6", render("@{-M.a}", data));
    }

    @Test
    void callsBuiltInFunctions() {
        Value data = Values.objectOf("name", "Quill", "items", List.of(1, 2, 3));
        assertEquals("QUILL", render("@{upper(M.name)}", data));
        assertEquals("quill", render("@{toLowerCase(M.name)}", data));
        assertEquals("3", render("@{len(M.items)}", data));
        assertEquals("0,1,2,", render("@{foreach i in range(3)}@{i},@{end}", data));
        assertEquals("<link rel=\"stylesheet\" href=\"/css/site.css\">", render("@{css('/css/site.css')}", data));
        assertEquals("", render("@{nope(1)}", data));
    }

    @Test
    void nonMarkupFunctionOutputIsEscaped() {
        assertEquals("&lt;B&gt;", render("@{upper('<b>')}", Value.NULL));
    }

    @Test
    void rendersHelpersWithArguments() {
        String source = "@{helper badge(label, count)}<span>@{label}:@{count}</span>@{end}"
            + "@{badge('new', M.n)}@{badge('old')}";
        assertEquals("<span>new:3</span><span>old:</span>", render(source, Values.objectOf("n", 3)));
    }

    @Test
    void helperLocalsDoNotLeak() {
        String source = "@{helper show(v)}@{v}@{end}@{show('in')}|@{v}";
        assertEquals("in|", render(source, Value.NULL));
    }

    @Test
    void rendersSectionsByName() {
        assertEquals("<i>x</i>", render("@{section tail}<i>x</i>@{end}@{section('tail')}@{section('none')}", Value.NULL));
    }

    @Test
    void resolvesFrameworkNamespaces() {
        Template template = Template.parse(
            "@{R.title}|@{session.user}|@{query.q}|@{user.name}|@{APP.version}|@{CONF.name}|@{'%site'}|@{url}|@{root}"
        );
        RenderContext context = RenderContext.builder(Value.NULL)
            .repository(Values.objectOf("title", "Home"))
            .session(Values.objectOf("user", "ann"))
            .query(Values.objectOf("q", "books"))
            .user(Values.objectOf("name", "Ann"))
            .globalRepository(Values.objectOf("version", "1.0"))
            .conf(Values.objectOf("name", "quill", "default_root", "/app"))
            .config(Map.of("site", "Quill"))
            .url("/home?x=1")
            .build();
        assertEquals("Home|ann|books|Ann|1.0|quill|Quill|/home?x=1|/app", renderer.render(template, context));
    }

    @Test
    void rendersCsrfFieldFromSession() {
        Template template = Template.parse("@{csrf}");
        RenderContext context = RenderContext.builder(Value.NULL)
            .session(Values.objectOf("_csrf_token", Map.of("token", "abc")))
            .build();
        assertEquals("<input type=\"hidden\" name=\"_csrf_token\" value=\"abc\">", renderer.render(template, context));
    }

    @Test
    void rendersImportsAndMeta() {
        String output = render("@{import('site.css', 'app.js', 'logo.png')}@{meta('A & B', 'Desc')}", Value.NULL);
        assertEquals(
            "<link rel=\"stylesheet\" href=\"/css/site.css\">\n"
                + "<script src=\"/js/app.js\"></script>\n"
                + "<title>A &amp; B</title>\n"
                + "<meta name=\"description\" content=\"Desc\">\n",
            output
        );
    }

    @Test
    void bareMetaReadsRepository() {
        RenderContext context = RenderContext.builder(Value.NULL)
            .repository(Values.objectOf("title", "Shop", "keywords", "a, b"))
            .build();
        assertEquals(
            "<title>Shop</title>\n<meta name=\"keywords\" content=\"a, b\">\n",
            renderer.render(Template.parse("@{meta}"), context)
        );
    }

    @Test
    void translatesWithAndWithoutTranslator() {
        assertEquals("Sign in [#greeting]", render("@(Sign in) @(#greeting)", Value.NULL));

        TranslationSystem translations = new TranslationSystem()
            .addTranslations("fr", Map.of("Sign in", "Se connecter", "greeting", "Bonjour"));
        RenderContext context = RenderContext.builder(Value.NULL).translator(translations.translator("fr")).build();
        assertEquals("Se connecter Bonjour [missing]", renderer.render(Template.parse("@(Sign in) @(#greeting) @(#missing)"), context));
    }

    @Test
    void renderingIsRepeatable() {
        Template template = Template.parse("@{foreach i in M.xs}@{i * 2}@{end}@{M.t}");
        Value data = Values.objectOf("xs", List.of(1, 2), "t", "!");
        String first = renderer.render(template, RenderContext.of(data));
        String second = renderer.render(template, RenderContext.of(data));
        assertEquals("24!", first);
        assertEquals(first, second);
    }

    @Test
    void includesPartialsThroughLoader() {
        Map<String, Template> views = new HashMap<>();
        views.put("item", Template.parse("<li>@{M.name}</li>"));
        TemplateRenderer withViews = new TemplateRenderer(views::get, true, 8);
        Value data = Values.objectOf("first", Map.of("name", "one"));
        assertEquals("<ul><li>one</li></ul>", withViews.render(Template.parse("<ul>@{view('item', M.first)}</ul>"), RenderContext.of(data)));
    }

    @Test
    void missingPartialRendersCommentUnlessStrict() {
        TemplateRenderer lenient = new TemplateRenderer(name -> {
            throw new TemplateRenderException(name, "Template not found: " + name);
        }, false, 8);
        assertEquals("<!-- Error loading view 'gone' -->", lenient.render(Template.parse("@{view('gone')}"), RenderContext.of(Value.NULL)));

        TemplateRenderer strict = new TemplateRenderer(name -> {
            throw new TemplateRenderException(name, "Template not found: " + name);
        }, true, 8);
        TemplateRenderException ex = assertThrows(
            TemplateRenderException.class,
            () -> strict.render(Template.parse("@{view('gone')}"), RenderContext.of(Value.NULL))
        );
        assertEquals("gone", ex.templateName());
    }

    @Test
    void loaderReturningNullCountsAsMissingPartial() {
        Map<String, Template> views = new HashMap<>();
        Template page = Template.parse("[@{view('absent')}]");

        TemplateRenderer lenient = new TemplateRenderer(views::get, false, 8);
        assertEquals("[<!-- Error loading view 'absent' -->]", lenient.render(page, RenderContext.of(Value.NULL)));

        TemplateRenderer strict = new TemplateRenderer(views::get, true, 8);
        TemplateRenderException ex = assertThrows(
            TemplateRenderException.class,
            () -> strict.render(page, RenderContext.of(Value.NULL))
        );
        assertEquals("absent", ex.templateName());
    }

    @Test
    void selfIncludingPartialHitsDepthLimit() {
        Map<String, Template> views = new HashMap<>();
        views.put("loop", Template.parse("x@{view('loop')}"));
        TemplateRenderer bounded = new TemplateRenderer(views::get, false, 4);
        TemplateRenderException ex = assertThrows(
            TemplateRenderException.class,
            () -> bounded.render(Template.parse("@{view('loop')}"), RenderContext.of(Value.NULL))
        );
        assertTrue(ex.getMessage().contains("Maximum include depth of 4"));
    }

    private String render(String source, Value data) {
        return renderer.render(Template.parse(source), RenderContext.of(data));
    }
}
