package io.lighting.quill.view;

import io.lighting.quill.value.Value;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tree-walking renderer for compiled templates.
 * <p>
 * Value anomalies degrade to empty output. Only structural failures raise
 * {@link TemplateRenderException}: partial loading in strict mode and include depth overflow.
 */
public final class TemplateRenderer {
    private static final Logger LOGGER = LoggerFactory.getLogger(TemplateRenderer.class);
    public static final int DEFAULT_MAX_INCLUDE_DEPTH = 32;

    private final Function<String, Template> loader;
    private final boolean strict;
    private final int maxIncludeDepth;

    public TemplateRenderer() {
        this(name -> {
            throw new TemplateRenderException(name, "No template loader configured");
        }, false, DEFAULT_MAX_INCLUDE_DEPTH);
    }

    /**
     * @param loader resolves partial names to compiled templates, normally through the parse cache
     * @param strict whether a partial that fails to load aborts the render
     * @param maxIncludeDepth maximum nesting of {@code @{view(...)}} includes
     */
    public TemplateRenderer(Function<String, Template> loader, boolean strict, int maxIncludeDepth) {
        this.loader = Objects.requireNonNull(loader, "loader");
        if (maxIncludeDepth < 1) {
            throw new IllegalArgumentException("maxIncludeDepth must be positive");
        }
        this.strict = strict;
        this.maxIncludeDepth = maxIncludeDepth;
    }

    public String render(Template template, RenderContext context) {
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(context, "context");
        context.addSections(template.sections());
        context.addHelpers(template.helpers());
        StringBuilder out = new StringBuilder(estimateCapacity(template.nodes()));
        renderNodes(template.nodes(), context, out);
        return out.toString();
    }

    private ControlSignal renderNodes(List<TemplateNode> nodes, RenderContext context, StringBuilder out) {
        for (TemplateNode node : nodes) {
            ControlSignal signal = renderNode(node, context, out);
            if (signal != ControlSignal.NONE) {
                return signal;
            }
        }
        return ControlSignal.NONE;
    }

    private ControlSignal renderNode(TemplateNode node, RenderContext context, StringBuilder out) {
        if (node instanceof TextNode text) {
            out.append(text.text());
        } else if (node instanceof VariableNode variable) {
            appendVariable(variable, context, out);
        } else if (node instanceof ConditionalNode conditional) {
            List<TemplateNode> branch = selectBranch(conditional, context);
            if (branch != null) {
                return renderNodes(branch, context, out);
            }
        } else if (node instanceof LoopNode loop) {
            renderLoop(loop, context, out);
        } else if (node instanceof BreakNode) {
            // Outside any loop break and continue are ignored.
            return context.loopDepth() > 0 ? ControlSignal.BREAK : ControlSignal.NONE;
        } else if (node instanceof ContinueNode) {
            return context.loopDepth() > 0 ? ControlSignal.CONTINUE : ControlSignal.NONE;
        } else if (node instanceof IndexNode) {
            out.append(context.currentLoopIndex().asText());
        } else if (node instanceof SectionCallNode call) {
            List<TemplateNode> section = context.section(call.name());
            if (section != null) {
                renderNodes(section, context, out);
            }
        } else if (node instanceof HelperCallNode call) {
            renderHelperCall(call, context, out);
        } else if (node instanceof ViewNode view) {
            renderPartial(view, context, out);
        } else if (node instanceof ImportNode importNode) {
            appendImports(importNode, out);
        } else if (node instanceof MetaNode meta) {
            appendMeta(meta, context, out);
        } else if (node instanceof BodyNode || node instanceof ContentNode) {
            Value content = TemplateExpression.property(context.data(), "content");
            if (content instanceof Value.StringValue text) {
                out.append(text.value());
            }
        } else if (node instanceof HeadNode) {
            List<TemplateNode> head = context.section("head");
            if (head != null) {
                renderNodes(head, context, out);
            }
        } else if (node instanceof CsrfNode) {
            out.append(context.callFunction("csrf", List.of()).asText());
        } else if (node instanceof TranslateNode translate) {
            appendTranslation(translate, context, out);
        } else if (node instanceof ConfigNode config) {
            out.append(context.config(config.key()));
        } else if (node instanceof NamespaceNode namespace) {
            Value value = RenderContext.getNestedValue(context.namespace(namespace.namespace()), namespace.path());
            out.append(HtmlEscaper.escape(value.asText()));
        }
        // Section and helper definitions render nothing in place.
        return ControlSignal.NONE;
    }

    private void appendVariable(VariableNode variable, RenderContext context, StringBuilder out) {
        Value value = variable.expression() != null
            ? variable.expression().evaluate(context)
            : context.resolveVariable(variable.name());
        String text = value.asText();
        if (variable.raw() || isUnescapedName(variable.name())) {
            out.append(text);
        } else {
            out.append(HtmlEscaper.escape(text));
        }
    }

    private boolean isUnescapedName(String name) {
        return name.equals("root") || name.equals("url") || name.equals("hostname");
    }

    private List<TemplateNode> selectBranch(ConditionalNode conditional, RenderContext context) {
        if (conditional.condition().evaluate(context).isTruthy()) {
            return conditional.thenBranch();
        }
        for (ElseIfBranch branch : conditional.elseIfBranches()) {
            if (branch.condition().evaluate(context).isTruthy()) {
                return branch.body();
            }
        }
        return conditional.elseBranch();
    }

    private void renderLoop(LoopNode loop, RenderContext context, StringBuilder out) {
        Value source = loop.collection().evaluate(context);
        List<Value> items;
        if (source instanceof Value.ArrayValue array) {
            items = array.items();
        } else if (source instanceof Value.ObjectValue object) {
            items = new ArrayList<>(object.entries().size());
            for (Map.Entry<String, Value> entry : object.entries().entrySet()) {
                Map<String, Value> pair = new LinkedHashMap<>();
                pair.put("key", Value.of(entry.getKey()));
                pair.put("value", entry.getValue());
                items.add(Value.object(pair));
            }
        } else {
            if (!source.isNull()) {
                LOGGER.warn("Cannot iterate over {} in foreach '{}'", source.getClass().getSimpleName(), loop.itemName());
            }
            return;
        }
        LoopContext frame = new LoopContext(loop.itemName(), items);
        context.pushLoop(frame);
        try {
            for (int i = 0; i < frame.size(); i++) {
                frame.moveTo(i);
                if (renderNodes(loop.body(), context, out) == ControlSignal.BREAK) {
                    break;
                }
            }
        } finally {
            context.popLoop();
        }
    }

    private void renderHelperCall(HelperCallNode call, RenderContext context, StringBuilder out) {
        List<Value> args = new ArrayList<>(call.args().size());
        for (TemplateExpression arg : call.args()) {
            args.add(arg.evaluate(context));
        }
        Template.Helper helper = context.helper(call.name());
        if (helper == null) {
            String result = context.callFunction(call.name(), args).asText();
            TemplateFunctions functions = context.functions();
            out.append(functions != null && functions.isMarkup(call.name()) ? result : HtmlEscaper.escape(result));
            return;
        }
        Map<String, Value> bindings = new HashMap<>();
        for (int i = 0; i < helper.params().size(); i++) {
            bindings.put(helper.params().get(i), i < args.size() ? args.get(i) : Value.NULL);
        }
        Map<String, Value> previous = context.bindLocals(bindings);
        try {
            renderNodes(helper.body(), context, out);
        } finally {
            context.restoreLocals(previous);
        }
    }

    private void renderPartial(ViewNode view, RenderContext context, StringBuilder out) {
        int depth = context.enterInclude();
        try {
            if (depth > maxIncludeDepth) {
                throw new TemplateRenderException(
                    view.name(),
                    "Maximum include depth of " + maxIncludeDepth + " exceeded"
                );
            }
            Template partial;
            try {
                partial = loader.apply(view.name());
                if (partial == null) {
                    throw new TemplateRenderException(view.name(), "Template not found: " + view.name());
                }
            } catch (RuntimeException ex) {
                if (strict) {
                    throw ex instanceof TemplateRenderException renderException
                        ? renderException
                        : new TemplateRenderException(view.name(), "Failed to load view: " + ex.getMessage(), ex);
                }
                LOGGER.warn("Failed to load view '{}': {}", view.name(), ex.getMessage());
                out.append("<!-- Error loading view '").append(view.name()).append("' -->");
                return;
            }
            RenderContext partialContext = view.model() == null
                ? context
                : context.forModel(view.model().evaluate(context));
            out.append(render(partial, partialContext));
        } finally {
            context.exitInclude();
        }
    }

    private void appendImports(ImportNode importNode, StringBuilder out) {
        for (String file : importNode.files()) {
            String escaped = HtmlEscaper.escapeAttribute(file);
            if (file.endsWith(".css")) {
                out.append("<link rel=\"stylesheet\" href=\"/css/").append(escaped).append("\">\n");
            } else if (file.endsWith(".js")) {
                out.append("<script src=\"/js/").append(escaped).append("\"></script>\n");
            }
        }
    }

    private void appendMeta(MetaNode meta, RenderContext context, StringBuilder out) {
        if (meta.title() == null && meta.description() == null && meta.keywords() == null) {
            // Bare @{meta} reads the page metadata from the repository.
            Value repository = context.namespace(Namespace.REPOSITORY);
            meta = new MetaNode(
                textOrNull(TemplateExpression.property(repository, "title")),
                textOrNull(TemplateExpression.property(repository, "description")),
                textOrNull(TemplateExpression.property(repository, "keywords"))
            );
        }
        if (meta.title() != null) {
            out.append("<title>").append(HtmlEscaper.escape(meta.title())).append("</title>\n");
        }
        if (meta.description() != null) {
            out.append("<meta name=\"description\" content=\"")
                .append(HtmlEscaper.escapeAttribute(meta.description()))
                .append("\">\n");
        }
        if (meta.keywords() != null) {
            out.append("<meta name=\"keywords\" content=\"")
                .append(HtmlEscaper.escapeAttribute(meta.keywords()))
                .append("\">\n");
        }
    }

    private static String textOrNull(Value value) {
        return value.isNull() ? null : value.asText();
    }

    private void appendTranslation(TranslateNode translate, RenderContext context, StringBuilder out) {
        Translator translator = context.translator();
        if (translator == null) {
            out.append(translate.key() ? "[#" + translate.text() + "]" : translate.text());
        } else if (translate.key()) {
            out.append(translator.translateKey(translate.text()));
        } else {
            out.append(translator.translateText(translate.text()));
        }
    }

    private int estimateCapacity(List<TemplateNode> nodes) {
        int capacity = 0;
        for (TemplateNode node : nodes) {
            capacity += node instanceof TextNode text ? text.text().length() : 16;
        }
        return Math.max(64, capacity);
    }
}
