package io.lighting.quill.view;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Compiled view template.
 * <p>
 * Immutable once built, so a single instance can be rendered concurrently from many threads.
 * Section and helper definitions are lifted into lookup maps; the definition nodes stay in the
 * node sequence and render as nothing.
 */
public final class Template {
    private final List<TemplateNode> nodes;
    private final Map<String, List<TemplateNode>> sections;
    private final Map<String, Helper> helpers;

    Template(List<TemplateNode> nodes) {
        this.nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        Map<String, List<TemplateNode>> collectedSections = new LinkedHashMap<>();
        Map<String, Helper> collectedHelpers = new LinkedHashMap<>();
        extract(this.nodes, collectedSections, collectedHelpers);
        this.sections = Collections.unmodifiableMap(collectedSections);
        this.helpers = Collections.unmodifiableMap(collectedHelpers);
    }

    /**
     * Compiles template source.
     *
     * @throws TemplateParseException on malformed directives or unterminated blocks
     */
    public static Template parse(String source) {
        return new TemplateParser(source).parse();
    }

    public Set<String> sectionNames() {
        return sections.keySet();
    }

    public Set<String> helperNames() {
        return helpers.keySet();
    }

    List<TemplateNode> nodes() {
        return nodes;
    }

    Map<String, List<TemplateNode>> sections() {
        return sections;
    }

    Map<String, Helper> helpers() {
        return helpers;
    }

    private static void extract(
        List<TemplateNode> nodes,
        Map<String, List<TemplateNode>> sections,
        Map<String, Helper> helpers
    ) {
        for (TemplateNode node : nodes) {
            if (node instanceof SectionDefNode section) {
                sections.put(section.name(), section.body());
                extract(section.body(), sections, helpers);
            } else if (node instanceof HelperDefNode helper) {
                helpers.put(helper.name(), new Helper(helper.name(), helper.params(), helper.body()));
            } else if (node instanceof ConditionalNode conditional) {
                extract(conditional.thenBranch(), sections, helpers);
                for (ElseIfBranch branch : conditional.elseIfBranches()) {
                    extract(branch.body(), sections, helpers);
                }
                if (conditional.elseBranch() != null) {
                    extract(conditional.elseBranch(), sections, helpers);
                }
            } else if (node instanceof LoopNode loop) {
                extract(loop.body(), sections, helpers);
            }
        }
    }

    record Helper(String name, List<String> params, List<TemplateNode> body) {
        Helper {
            Objects.requireNonNull(name, "name");
            params = List.copyOf(params);
            body = List.copyOf(body);
        }
    }
}
