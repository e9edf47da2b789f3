package io.lighting.quill.view;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lighting.quill.value.Value;
import io.lighting.quill.value.Values;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ViewEngineTest {

    @Test
    void rendersClasspathViewInsideLayout() {
        ViewEngine engine = ViewEngine.builder()
            .source(new ClasspathTemplateSource("views"))
            .defaultLayout("main")
            .build();

        String html = engine.render("index", Values.objectOf("title", "Quill", "items", List.of("a", "b")));

        assertEquals(
            "<html><head><title>Quill</title></head>"
                + "<body><h1>Quill</h1>\n<ul><li>a</li><li>b</li></ul>\n</body></html>\n",
            html
        );
    }

    @Test
    void rendersWithoutLayoutWhenNoneGiven() {
        ViewEngine engine = ViewEngine.builder().source(new ClasspathTemplateSource("/views/")).build();
        String html = engine.render("/index", Values.objectOf("title", "T", "items", List.of()));
        assertEquals("<h1>T</h1>\n<ul></ul>\n", html);
    }

    @Test
    void childSectionsOverrideLayoutSections() {
        InMemoryTemplateSource source = new InMemoryTemplateSource()
            .put("page.html", "@{section side}child@{end}main")
            .put("layouts/base.html", "@{section side}layout@{end}[@{section('side')}|@{body}]");
        ViewEngine engine = ViewEngine.builder().source(source).build();

        assertEquals("[child|main]", engine.render("page", Value.NULL, "base"));
    }

    @Test
    void childSectionsCallChildHelpersInsideLayout() {
        InMemoryTemplateSource source = new InMemoryTemplateSource()
            .put("page.html", "@{helper badge(t)}<b>@{t}</b>@{end}@{section side}@{badge('hi')}@{end}body")
            .put("layouts/base.html", "[@{section('side')}]@{body}");
        ViewEngine engine = ViewEngine.builder().source(source).build();

        assertEquals("[<b>hi</b>]body", engine.render("page", Value.NULL, "base"));
    }

    @Test
    void layoutFallsBackToItsOwnSection() {
        InMemoryTemplateSource source = new InMemoryTemplateSource()
            .put("page.html", "main")
            .put("layouts/base.html", "@{section side}layout@{end}[@{section('side')}|@{content}]");
        ViewEngine engine = ViewEngine.builder().source(source).build();

        assertEquals("[layout|main]", engine.render("page", Value.NULL, "base"));
    }

    @Test
    void layoutNamesWithSlashAreUsedAsPaths() {
        InMemoryTemplateSource source = new InMemoryTemplateSource()
            .put("page.html", "x")
            .put("shared/frame.html", "<@{body}>");
        ViewEngine engine = ViewEngine.builder().source(source).build();

        assertEquals("<x>", engine.render("page", Value.NULL, "shared/frame"));
    }

    @Test
    void missingPartialIsCommentedOutWhenLenient() {
        InMemoryTemplateSource source = new InMemoryTemplateSource().put("page.html", "a@{view('missing')}b");
        ViewEngine engine = ViewEngine.builder().source(source).build();

        assertEquals("a<!-- Error loading view 'missing' -->b", engine.render("page", Value.NULL));
    }

    @Test
    void missingPartialFailsWhenStrict() {
        InMemoryTemplateSource source = new InMemoryTemplateSource().put("page.html", "a@{view('missing')}b");
        ViewEngine engine = ViewEngine.builder().source(source).strict(true).build();

        TemplateRenderException ex = assertThrows(TemplateRenderException.class, () -> engine.render("page", Value.NULL));
        assertEquals("missing.html", ex.templateName());
    }

    @Test
    void missingViewAlwaysFails() {
        ViewEngine engine = ViewEngine.builder().source(new InMemoryTemplateSource()).build();
        assertThrows(TemplateRenderException.class, () -> engine.render("nope", Value.NULL));
    }

    @Test
    void selfIncludingViewStopsAtConfiguredDepth() {
        InMemoryTemplateSource source = new InMemoryTemplateSource().put("loop.html", "@{view('loop')}");
        ViewEngine engine = ViewEngine.builder().source(source).maxIncludeDepth(3).build();

        TemplateRenderException ex = assertThrows(TemplateRenderException.class, () -> engine.render("loop", Value.NULL));
        assertTrue(ex.getMessage().contains("Maximum include depth of 3"));
    }

    @Test
    void partialWithoutModelSharesParentData() {
        InMemoryTemplateSource source = new InMemoryTemplateSource()
            .put("page.html", "@{view('greet')}")
            .put("greet.html", "Hi @{M.name}");
        ViewEngine engine = ViewEngine.builder().source(source).build();

        assertEquals("Hi Ann", engine.render("page", Values.objectOf("name", "Ann")));
    }

    @Test
    void renderStringUsesEngineGlobals() {
        ViewEngine engine = ViewEngine.builder()
            .source(new InMemoryTemplateSource().put("part.html", "(@{APP.name})"))
            .globalRepository(Values.objectOf("name", "quill"))
            .config(Map.of("title", "Docs"))
            .build();

        assertEquals("Docs (quill)", engine.renderString("@{'%title'} @{view('part')}", Value.NULL));
    }

    @Test
    void requestScopeFeedsNamespacesAndLanguage() {
        TranslationSystem translations = new TranslationSystem()
            .addTranslations("en", Map.of("greeting", "Hello"))
            .addTranslations("fr", Map.of("greeting", "Bonjour"));
        ViewEngine engine = ViewEngine.builder()
            .source(new InMemoryTemplateSource().put("home.html", "@(#greeting) @{user.name} @{query.page}"))
            .translations(translations)
            .build();
        ViewRequest request = ViewRequest.builder()
            .user(Values.objectOf("name", "Ann"))
            .query(Values.objectOf("page", "2"))
            .language("fr")
            .build();

        assertEquals("Bonjour Ann 2", engine.render("home", Value.NULL, null, request));
        assertEquals("Hello  ", engine.render("home", Value.NULL));
    }

    @Test
    void customFunctionsAreCallable() {
        TemplateFunctions functions = TemplateFunctions.standard()
            .register("twice", (args, context) -> Value.of(args.get(0).asText() + args.get(0).asText()));
        ViewEngine engine = ViewEngine.builder()
            .source(new InMemoryTemplateSource())
            .functions(functions)
            .build();

        assertEquals("abab", engine.renderString("@{twice('ab')}", Value.NULL));
    }

    @Test
    void mapsViewAndLayoutNamesToPaths() {
        assertEquals("users/list.html", ViewEngine.templatePath("/users/list"));
        assertEquals("index.html", ViewEngine.templatePath("index.html"));
        assertEquals("layouts/main.html", ViewEngine.layoutPath("main"));
        assertEquals("themes/dark.html", ViewEngine.layoutPath("themes/dark"));
    }

    @Test
    void requiresATemplateSource() {
        assertThrows(IllegalStateException.class, () -> ViewEngine.builder().build());
    }
}
