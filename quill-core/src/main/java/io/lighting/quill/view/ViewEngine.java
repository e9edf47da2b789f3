package io.lighting.quill.view;

import io.lighting.quill.value.Value;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for rendering views by name, optionally wrapped in a layout.
 * <p>
 * View names map to {@code <name>.html} relative to the template source; a leading {@code /}
 * is ignored. Layout names map to {@code layouts/<name>.html} unless they contain a {@code /}.
 * Thread-safe: each call builds its own {@link RenderContext}.
 */
public final class ViewEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(ViewEngine.class);
    private static final String EXTENSION = ".html";

    private final TemplateCache cache;
    private final TemplateRenderer renderer;
    private final Value globalRepository;
    private final Map<String, String> config;
    private final Value conf;
    private final TranslationSystem translations;
    private final String defaultLanguage;
    private final String defaultLayout;
    private final TemplateFunctions functions;

    private ViewEngine(Builder builder, TemplateCache cache) {
        this.cache = cache;
        this.renderer = new TemplateRenderer(
            name -> cache.get(templatePath(name)),
            builder.strict,
            builder.maxIncludeDepth
        );
        this.globalRepository = builder.globalRepository;
        this.config = Map.copyOf(builder.config);
        this.conf = builder.conf;
        this.translations = builder.translations;
        this.defaultLanguage = builder.defaultLanguage;
        this.defaultLayout = builder.defaultLayout;
        this.functions = builder.functions;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Renders with the configured default layout, if any.
     */
    public String render(String name, Value data) {
        return render(name, data, defaultLayout, ViewRequest.empty());
    }

    public String render(String name, Value data, String layout) {
        return render(name, data, layout, ViewRequest.empty());
    }

    /**
     * Renders a view. A null or blank layout renders the view alone.
     *
     * @throws TemplateRenderException when the view, the layout or a partial (strict mode) cannot be loaded
     * @throws TemplateParseException when one of them does not compile
     */
    public String render(String name, Value data, String layout, ViewRequest request) {
        Objects.requireNonNull(name, "name");
        ViewRequest scope = request == null ? ViewRequest.empty() : request;
        LOGGER.debug("Rendering view {} with layout {}", name, layout);
        Template template = cache.get(templatePath(name));
        RenderContext context = newContext(data, scope);
        String content = renderer.render(template, context);
        if (layout == null || layout.isBlank()) {
            return content;
        }
        Template layoutTemplate = cache.get(layoutPath(layout));
        RenderContext layoutContext = newContext(withContent(data, content), scope);
        layoutContext.addSections(context.sections());
        layoutContext.addHelpers(context.helpers());
        return renderer.render(layoutTemplate, layoutContext);
    }

    /**
     * Compiles and renders template text without touching the cache. Partials still load through it.
     */
    public String renderString(String source, Value data) {
        return renderString(source, data, ViewRequest.empty());
    }

    public String renderString(String source, Value data, ViewRequest request) {
        Template template = Template.parse(Objects.requireNonNull(source, "source"));
        return renderer.render(template, newContext(data, request == null ? ViewRequest.empty() : request));
    }

    public Template compile(String name) {
        return cache.get(templatePath(name));
    }

    public void clearCache() {
        cache.clear();
    }

    public TemplateCache cache() {
        return cache;
    }

    public TemplateFunctions functions() {
        return functions;
    }

    public static String templatePath(String name) {
        String path = name.startsWith("/") ? name.substring(1) : name;
        return path.endsWith(EXTENSION) ? path : path + EXTENSION;
    }

    public static String layoutPath(String layout) {
        if (layout.contains("/")) {
            return templatePath(layout);
        }
        return templatePath("layouts/" + layout);
    }

    private RenderContext newContext(Value data, ViewRequest request) {
        String language = request.language() == null ? defaultLanguage : request.language();
        return RenderContext.builder(data)
            .globalRepository(globalRepository)
            .repository(request.repository())
            .session(request.session())
            .query(request.query())
            .user(request.user())
            .url(request.url())
            .hostname(request.hostname())
            .config(config)
            .conf(conf)
            .functions(functions)
            .translator(translations == null ? null : translations.translator(language))
            .build();
    }

    private Value withContent(Value data, String content) {
        if (data instanceof Value.ObjectValue object) {
            return object.with("content", Value.of(content));
        }
        Map<String, Value> entries = new LinkedHashMap<>();
        entries.put("content", Value.of(content));
        return Value.object(entries);
    }

    public static final class Builder {
        private TemplateSource source;
        private TemplateCache cache;
        private boolean hotReload;
        private boolean strict;
        private int maxIncludeDepth = TemplateRenderer.DEFAULT_MAX_INCLUDE_DEPTH;
        private Value globalRepository = Value.NULL;
        private Map<String, String> config = Map.of();
        private Value conf = Value.NULL;
        private TranslationSystem translations;
        private String defaultLanguage;
        private String defaultLayout;
        private TemplateFunctions functions = TemplateFunctions.standard();

        private Builder() {
        }

        // 模板来源：文件系统、classpath 或内存，三选一。
        public Builder source(TemplateSource source) {
            this.source = source;
            return this;
        }

        public Builder directory(Path directory) {
            this.source = new FileSystemTemplateSource(directory);
            return this;
        }

        // 共享缓存：多个引擎可复用同一个 TemplateCache。
        public Builder cache(TemplateCache cache) {
            this.cache = cache;
            return this;
        }

        // 开发模式：每次渲染都重新解析模板。
        public Builder hotReload(boolean hotReload) {
            this.hotReload = hotReload;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder maxIncludeDepth(int maxIncludeDepth) {
            this.maxIncludeDepth = maxIncludeDepth;
            return this;
        }

        public Builder globalRepository(Value globalRepository) {
            this.globalRepository = globalRepository == null ? Value.NULL : globalRepository;
            return this;
        }

        public Builder config(Map<String, String> config) {
            this.config = config == null ? Map.of() : config;
            return this;
        }

        public Builder conf(Value conf) {
            this.conf = conf == null ? Value.NULL : conf;
            return this;
        }

        public Builder translations(TranslationSystem translations) {
            this.translations = translations;
            return this;
        }

        public Builder defaultLanguage(String defaultLanguage) {
            this.defaultLanguage = defaultLanguage;
            return this;
        }

        public Builder defaultLayout(String defaultLayout) {
            this.defaultLayout = defaultLayout;
            return this;
        }

        public Builder functions(TemplateFunctions functions) {
            this.functions = Objects.requireNonNull(functions, "functions");
            return this;
        }

        public ViewEngine build() {
            TemplateCache resolvedCache = cache;
            if (resolvedCache == null) {
                if (source == null) {
                    throw new IllegalStateException("A template source, directory or cache is required");
                }
                resolvedCache = new TemplateCache(source, hotReload);
            }
            if (defaultLanguage == null && translations != null) {
                defaultLanguage = translations.defaultLanguage();
            }
            return new ViewEngine(this, resolvedCache);
        }
    }
}
