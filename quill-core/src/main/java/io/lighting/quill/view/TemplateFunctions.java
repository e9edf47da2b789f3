package io.lighting.quill.view;

import io.lighting.quill.value.Value;
import io.lighting.quill.value.Values;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named functions callable from template expressions.
 * <p>
 * Names are matched case-insensitively. Functions registered as markup produce HTML and are
 * written unescaped when invoked directly as {@code @{name(args)}}.
 */
public final class TemplateFunctions {
    private static final Logger LOGGER = LoggerFactory.getLogger(TemplateFunctions.class);
    private static final String DEFAULT_CSRF_ID = "_csrf_token";

    private final Map<String, Registration> functions = new ConcurrentHashMap<>();

    public TemplateFunctions register(String name, TemplateFunction function) {
        return put(name, function, false);
    }

    public TemplateFunctions registerMarkup(String name, TemplateFunction function) {
        return put(name, function, true);
    }

    public boolean contains(String name) {
        return functions.containsKey(normalize(name));
    }

    public boolean isMarkup(String name) {
        Registration registration = functions.get(normalize(name));
        return registration != null && registration.markup();
    }

    /**
     * Calls a function. Unknown names and failing functions yield {@link Value#NULL}.
     */
    public Value call(String name, List<Value> args, RenderContext context) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(args, "args");
        Registration registration = functions.get(normalize(name));
        if (registration == null) {
            return Value.NULL;
        }
        try {
            Value result = registration.function().apply(args, context);
            return result == null ? Value.NULL : result;
        } catch (RuntimeException ex) {
            LOGGER.warn("Template function '{}' failed: {}", name, ex.getMessage());
            return Value.NULL;
        }
    }

    public static TemplateFunctions standard() {
        TemplateFunctions registry = new TemplateFunctions();
        registry.registerMarkup("css", TemplateFunctions::css);
        registry.registerMarkup("js", TemplateFunctions::js);
        registry.registerMarkup("image", TemplateFunctions::image);
        registry.registerMarkup("meta", TemplateFunctions::meta);
        registry.registerMarkup("csrf", TemplateFunctions::csrf);
        registry.register("json", (args, context) -> Value.of(args.isEmpty() ? "{}" : Values.toJson(args.get(0))));
        registry.register("range", TemplateFunctions::range);
        registry.register("len", TemplateFunctions::length);
        registry.register("length", TemplateFunctions::length);
        registry.register("upper", (args, context) -> mapText(args, text -> text.toUpperCase(Locale.ROOT)));
        registry.register("toUpperCase", (args, context) -> mapText(args, text -> text.toUpperCase(Locale.ROOT)));
        registry.register("lower", (args, context) -> mapText(args, text -> text.toLowerCase(Locale.ROOT)));
        registry.register("toLowerCase", (args, context) -> mapText(args, text -> text.toLowerCase(Locale.ROOT)));
        registry.register("url", (args, context) -> Value.of(context == null ? "" : context.url()));
        return registry;
    }

    private TemplateFunctions put(String name, TemplateFunction function, boolean markup) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(function, "function");
        functions.put(normalize(name), new Registration(function, markup));
        return this;
    }

    private static Value css(List<Value> args, RenderContext context) {
        if (args.isEmpty() || !(args.get(0) instanceof Value.StringValue url)) {
            return Value.of("");
        }
        return Value.of("<link rel=\"stylesheet\" href=\"" + HtmlEscaper.escapeAttribute(url.value()) + "\">");
    }

    private static Value js(List<Value> args, RenderContext context) {
        if (args.isEmpty() || !(args.get(0) instanceof Value.StringValue url)) {
            return Value.of("");
        }
        return Value.of("<script src=\"" + HtmlEscaper.escapeAttribute(url.value()) + "\"></script>");
    }

    private static Value image(List<Value> args, RenderContext context) {
        if (args.isEmpty() || !(args.get(0) instanceof Value.StringValue url)) {
            return Value.of("");
        }
        StringBuilder tag = new StringBuilder("<img src=\"").append(HtmlEscaper.escapeAttribute(url.value())).append('"');
        if (args.size() > 1 && args.get(1) instanceof Value.NumberValue width) {
            tag.append(" width=\"").append(width.asText()).append('"');
        }
        if (args.size() > 2 && args.get(2) instanceof Value.NumberValue height) {
            tag.append(" height=\"").append(height.asText()).append('"');
        }
        if (args.size() > 3 && args.get(3) instanceof Value.StringValue alt) {
            tag.append(" alt=\"").append(HtmlEscaper.escapeAttribute(alt.value())).append('"');
        }
        return Value.of(tag.append('>').toString());
    }

    private static Value meta(List<Value> args, RenderContext context) {
        StringBuilder tags = new StringBuilder();
        if (!args.isEmpty() && args.get(0) instanceof Value.StringValue title) {
            String escaped = HtmlEscaper.escapeAttribute(title.value());
            tags.append("<meta property=\"og:title\" content=\"").append(escaped).append("\">");
            tags.append("<meta name=\"twitter:title\" content=\"").append(escaped).append("\">");
        }
        if (args.size() > 1 && args.get(1) instanceof Value.StringValue description) {
            String escaped = HtmlEscaper.escapeAttribute(description.value());
            tags.append("<meta name=\"description\" content=\"").append(escaped).append("\">");
            tags.append("<meta property=\"og:description\" content=\"").append(escaped).append("\">");
        }
        return Value.of(tags.toString());
    }

    private static Value csrf(List<Value> args, RenderContext context) {
        String tokenId = DEFAULT_CSRF_ID;
        if (!args.isEmpty() && args.get(0) instanceof Value.StringValue id) {
            tokenId = id.value();
        }
        if (context == null) {
            return Value.of("");
        }
        Value token = RenderContext.getNestedValue(context.session(), tokenId + ".token");
        if (!(token instanceof Value.StringValue text)) {
            return Value.of("");
        }
        return Value.of("<input type=\"hidden\" name=\"" + HtmlEscaper.escapeAttribute(tokenId)
            + "\" value=\"" + HtmlEscaper.escapeAttribute(text.value()) + "\">");
    }

    private static Value range(List<Value> args, RenderContext context) {
        if (args.isEmpty()) {
            return Value.array(List.of());
        }
        for (int i = 0; i < Math.min(args.size(), 2); i++) {
            if (!(args.get(i) instanceof Value.NumberValue)) {
                return Value.array(List.of());
            }
        }
        long start = 0;
        long stop;
        long step = 1;
        if (args.size() == 1) {
            stop = ((Value.NumberValue) args.get(0)).asLong();
        } else {
            start = ((Value.NumberValue) args.get(0)).asLong();
            stop = ((Value.NumberValue) args.get(1)).asLong();
            if (args.size() > 2 && args.get(2) instanceof Value.NumberValue stepValue) {
                step = stepValue.asLong();
            }
        }
        List<Value> items = new ArrayList<>();
        if (step > 0) {
            for (long i = start; i < stop; i += step) {
                items.add(Value.of(i));
            }
        } else if (step < 0) {
            for (long i = start; i > stop; i += step) {
                items.add(Value.of(i));
            }
        }
        return Value.array(items);
    }

    private static Value length(List<Value> args, RenderContext context) {
        if (args.size() != 1) {
            return Value.NULL;
        }
        Value arg = args.get(0);
        if (arg instanceof Value.StringValue text) {
            return Value.of(text.value().length());
        }
        if (arg instanceof Value.ArrayValue array) {
            return Value.of(array.size());
        }
        if (arg instanceof Value.ObjectValue object) {
            return Value.of(object.entries().size());
        }
        return Value.of(0);
    }

    private static Value mapText(List<Value> args, UnaryOperator<String> mapper) {
        if (args.size() != 1) {
            return Value.NULL;
        }
        Value arg = args.get(0);
        if (arg instanceof Value.StringValue text) {
            return Value.of(mapper.apply(text.value()));
        }
        return arg;
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private record Registration(TemplateFunction function, boolean markup) {
    }
}
