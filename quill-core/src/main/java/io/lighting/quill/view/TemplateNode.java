package io.lighting.quill.view;

import java.util.List;
import java.util.Objects;

sealed interface TemplateNode permits TextNode, VariableNode, ConditionalNode, LoopNode, BreakNode,
    ContinueNode, IndexNode, SectionCallNode, SectionDefNode, HelperCallNode, HelperDefNode, ViewNode,
    ImportNode, MetaNode, BodyNode, HeadNode, ContentNode, CsrfNode, TranslateNode, ConfigNode,
    NamespaceNode {
}

record TextNode(String text) implements TemplateNode {
    TextNode {
        Objects.requireNonNull(text, "text");
    }
}

/**
 * {@code expression} is null when the directive body is not a valid expression;
 * the name is then resolved as a plain variable path.
 */
record VariableNode(String name, boolean raw, TemplateExpression expression) implements TemplateNode {
    VariableNode {
        Objects.requireNonNull(name, "name");
    }
}

record ElseIfBranch(TemplateExpression condition, List<TemplateNode> body) {
    ElseIfBranch {
        Objects.requireNonNull(condition, "condition");
        body = List.copyOf(body);
    }
}

record ConditionalNode(
    TemplateExpression condition,
    List<TemplateNode> thenBranch,
    List<ElseIfBranch> elseIfBranches,
    List<TemplateNode> elseBranch
) implements TemplateNode {
    ConditionalNode {
        Objects.requireNonNull(condition, "condition");
        thenBranch = List.copyOf(thenBranch);
        elseIfBranches = List.copyOf(elseIfBranches);
        elseBranch = elseBranch == null ? null : List.copyOf(elseBranch);
    }
}

record LoopNode(String itemName, TemplateExpression collection, List<TemplateNode> body) implements TemplateNode {
    LoopNode {
        Objects.requireNonNull(itemName, "itemName");
        Objects.requireNonNull(collection, "collection");
        body = List.copyOf(body);
    }
}

record BreakNode() implements TemplateNode {
}

record ContinueNode() implements TemplateNode {
}

record IndexNode() implements TemplateNode {
}

record SectionCallNode(String name) implements TemplateNode {
    SectionCallNode {
        Objects.requireNonNull(name, "name");
    }
}

record SectionDefNode(String name, List<TemplateNode> body) implements TemplateNode {
    SectionDefNode {
        Objects.requireNonNull(name, "name");
        body = List.copyOf(body);
    }
}

record HelperCallNode(String name, List<TemplateExpression> args) implements TemplateNode {
    HelperCallNode {
        Objects.requireNonNull(name, "name");
        args = List.copyOf(args);
    }
}

record HelperDefNode(String name, List<String> params, List<TemplateNode> body) implements TemplateNode {
    HelperDefNode {
        Objects.requireNonNull(name, "name");
        params = List.copyOf(params);
        body = List.copyOf(body);
    }
}

record ViewNode(String name, TemplateExpression model) implements TemplateNode {
    ViewNode {
        Objects.requireNonNull(name, "name");
    }
}

record ImportNode(List<String> files) implements TemplateNode {
    ImportNode {
        files = List.copyOf(files);
    }
}

record MetaNode(String title, String description, String keywords) implements TemplateNode {
}

record BodyNode() implements TemplateNode {
}

record HeadNode() implements TemplateNode {
}

record ContentNode() implements TemplateNode {
}

record CsrfNode() implements TemplateNode {
}

record TranslateNode(String text, boolean key) implements TemplateNode {
    TranslateNode {
        Objects.requireNonNull(text, "text");
    }
}

record ConfigNode(String key) implements TemplateNode {
    ConfigNode {
        Objects.requireNonNull(key, "key");
    }
}

/**
 * Namespace sugar such as {@code @{M.title}} or {@code @{session.user.name}}.
 * An empty path addresses the whole namespace.
 */
record NamespaceNode(Namespace namespace, String path) implements TemplateNode {
    NamespaceNode {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(path, "path");
    }
}

enum Namespace {
    REPOSITORY("repository"),
    R("R"),
    SESSION("session"),
    QUERY("query"),
    USER("user"),
    APP("APP"),
    MAIN("MAIN"),
    MODEL("model"),
    M("M"),
    CONF("CONF");

    private final String prefix;

    Namespace(String prefix) {
        this.prefix = prefix;
    }

    String prefix() {
        return prefix;
    }

    static Namespace fromPrefix(String prefix) {
        for (Namespace namespace : values()) {
            if (namespace.prefix.equals(prefix)) {
                return namespace;
            }
        }
        return null;
    }
}
