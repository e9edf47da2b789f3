package io.lighting.quill.view;

import io.lighting.quill.view.TemplateLexer.TemplateToken;
import io.lighting.quill.view.TemplateLexer.TokenKind;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

final class TemplateParser {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");
    private static final Pattern PATH = Pattern.compile("[A-Za-z0-9_$]+(\\.[A-Za-z0-9_$]+)*");

    private final List<TemplateToken> tokens;
    private int index;

    TemplateParser(String input) {
        this.tokens = new TemplateLexer(input).tokenize();
    }

    Template parse() {
        List<TemplateNode> nodes = new ArrayList<>();
        while (!isAtEnd()) {
            TemplateToken token = next();
            Directive directive = classify(token);
            if (directive.kind().closesBlock()) {
                throw error("Unexpected @{" + token.text() + "} without an open block", token);
            }
            nodes.add(parseNode(token, directive));
        }
        return new Template(nodes);
    }

    private TemplateNode parseNode(TemplateToken token, Directive directive) {
        return switch (directive.kind()) {
            case TEXT -> new TextNode(token.text());
            case VARIABLE -> variable(directive.arg(0), false, token);
            case RAW_VARIABLE -> variable(directive.arg(0), true, token);
            case TRANSLATE -> new TranslateNode(token.text(), false);
            case TRANSLATE_KEY -> new TranslateNode(token.text(), true);
            case IF -> parseConditional(token, directive);
            case FOREACH -> parseLoop(token, directive);
            case BREAK -> new BreakNode();
            case CONTINUE -> new ContinueNode();
            case INDEX -> new IndexNode();
            case SECTION_CALL -> new SectionCallNode(directive.arg(0));
            case SECTION_DEF -> new SectionDefNode(directive.arg(0), parseUntilEnd(token, "section"));
            case HELPER_DEF -> new HelperDefNode(
                directive.arg(0),
                directive.args().subList(1, directive.args().size()),
                parseUntilEnd(token, "helper")
            );
            case HELPER_CALL -> new HelperCallNode(directive.arg(0), expressions(directive.args(), 1, token));
            case VIEW -> new ViewNode(
                directive.arg(0),
                directive.args().size() > 1 ? expression(directive.arg(1), token) : null
            );
            case IMPORT -> new ImportNode(directive.args());
            case META -> new MetaNode(directive.optionalArg(0), directive.optionalArg(1), directive.optionalArg(2));
            case BODY -> new BodyNode();
            case HEAD -> new HeadNode();
            case CONTENT -> new ContentNode();
            case CSRF -> new CsrfNode();
            case CONFIG -> new ConfigNode(directive.arg(0));
            case NAMESPACE -> new NamespaceNode(Namespace.valueOf(directive.arg(0)), directive.arg(1));
            case ELSE, ELSE_IF, FI, END -> throw error("Unexpected @{" + token.text() + "}", token);
        };
    }

    private TemplateNode parseConditional(TemplateToken opener, Directive directive) {
        TemplateExpression condition = expression(directive.arg(0), opener);
        List<TemplateNode> thenBranch = new ArrayList<>();
        List<ElseIfBranch> elseIfs = new ArrayList<>();
        List<TemplateNode> elseBranch = null;
        List<TemplateNode> current = thenBranch;
        TemplateExpression pendingCondition = null;
        while (!isAtEnd()) {
            TemplateToken token = next();
            Directive inner = classify(token);
            switch (inner.kind()) {
                case FI -> {
                    if (pendingCondition != null) {
                        elseIfs.add(new ElseIfBranch(pendingCondition, current));
                    }
                    return new ConditionalNode(condition, thenBranch, elseIfs, elseBranch);
                }
                case ELSE_IF -> {
                    if (elseBranch != null) {
                        throw error("@{else if} after @{else}", token);
                    }
                    if (pendingCondition != null) {
                        elseIfs.add(new ElseIfBranch(pendingCondition, current));
                    }
                    pendingCondition = expression(inner.arg(0), token);
                    current = new ArrayList<>();
                }
                case ELSE -> {
                    if (elseBranch != null) {
                        throw error("Duplicate @{else}", token);
                    }
                    if (pendingCondition != null) {
                        elseIfs.add(new ElseIfBranch(pendingCondition, current));
                        pendingCondition = null;
                    }
                    elseBranch = new ArrayList<>();
                    current = elseBranch;
                }
                case END -> throw error("@{end} inside @{if}; expected @{fi}", token);
                default -> current.add(parseNode(token, inner));
            }
        }
        throw error("Unterminated @{if " + directive.arg(0) + "}, missing @{fi}", opener);
    }

    private TemplateNode parseLoop(TemplateToken opener, Directive directive) {
        String itemName = directive.arg(0);
        TemplateExpression collection = expression(directive.arg(1), opener);
        return new LoopNode(itemName, collection, parseUntilEnd(opener, "foreach"));
    }

    private List<TemplateNode> parseUntilEnd(TemplateToken opener, String block) {
        List<TemplateNode> body = new ArrayList<>();
        while (!isAtEnd()) {
            TemplateToken token = next();
            Directive inner = classify(token);
            if (inner.kind() == DirectiveKind.END) {
                return body;
            }
            if (inner.kind().closesBlock()) {
                throw error("Unexpected @{" + token.text() + "} inside @{" + block + "}", token);
            }
            body.add(parseNode(token, inner));
        }
        throw error("Unterminated @{" + opener.text() + "}, missing @{end}", opener);
    }

    private TemplateNode variable(String name, boolean raw, TemplateToken token) {
        if (name.isEmpty()) {
            throw error("Empty raw directive @{!}", token);
        }
        TemplateExpression expression;
        try {
            expression = TemplateExpressionParser.parse(name);
        } catch (IllegalArgumentException ex) {
            expression = null;
        }
        return new VariableNode(name, raw, expression);
    }

    private TemplateExpression expression(String source, TemplateToken token) {
        try {
            return TemplateExpressionParser.parse(source);
        } catch (IllegalArgumentException ex) {
            throw error("Invalid expression '" + source + "': " + ex.getMessage(), token);
        }
    }

    private List<TemplateExpression> expressions(List<String> sources, int from, TemplateToken token) {
        List<TemplateExpression> result = new ArrayList<>();
        for (int i = from; i < sources.size(); i++) {
            result.add(expression(sources.get(i), token));
        }
        return result;
    }

    /**
     * Maps a raw token onto a directive kind and its string arguments.
     */
    private Directive classify(TemplateToken token) {
        if (token.kind() == TokenKind.TEXT) {
            return new Directive(DirectiveKind.TEXT, List.of());
        }
        if (token.kind() == TokenKind.TRANSLATE) {
            return new Directive(DirectiveKind.TRANSLATE, List.of());
        }
        if (token.kind() == TokenKind.TRANSLATE_KEY) {
            return new Directive(DirectiveKind.TRANSLATE_KEY, List.of());
        }
        String content = token.text();
        if (token.kind() == TokenKind.RAW_DIRECTIVE) {
            return new Directive(DirectiveKind.RAW_VARIABLE, List.of(content));
        }
        if (startsWithKeyword(content, "if")) {
            return withCondition(DirectiveKind.IF, content.substring(2), token);
        }
        if (startsWithKeyword(content, "elif")) {
            return withCondition(DirectiveKind.ELSE_IF, content.substring(4), token);
        }
        if (content.startsWith("else") && startsWithKeyword(content.substring(4).trim(), "if")
            && Character.isWhitespace(content.charAt(4))) {
            return withCondition(DirectiveKind.ELSE_IF, content.substring(4).trim().substring(2), token);
        }
        switch (content) {
            case "else":
                return new Directive(DirectiveKind.ELSE, List.of());
            case "fi":
                return new Directive(DirectiveKind.FI, List.of());
            case "end":
                return new Directive(DirectiveKind.END, List.of());
            case "break":
                return new Directive(DirectiveKind.BREAK, List.of());
            case "continue":
                return new Directive(DirectiveKind.CONTINUE, List.of());
            case "index":
                return new Directive(DirectiveKind.INDEX, List.of());
            case "body":
                return new Directive(DirectiveKind.BODY, List.of());
            case "head":
                return new Directive(DirectiveKind.HEAD, List.of());
            case "content":
                return new Directive(DirectiveKind.CONTENT, List.of());
            case "csrf":
                return new Directive(DirectiveKind.CSRF, List.of());
            case "meta":
                return new Directive(DirectiveKind.META, List.of());
            case "user":
                return new Directive(DirectiveKind.NAMESPACE, List.of(Namespace.USER.name(), ""));
            default:
                break;
        }
        if (startsWithKeyword(content, "foreach")) {
            return parseForeachHeader(content.substring(7).trim(), token);
        }
        if (content.startsWith("section") && isCall(content, "section")) {
            List<String> args = callArgs(content, "section");
            if (args.size() != 1) {
                throw error("@{section(...)} requires exactly one name", token);
            }
            return new Directive(DirectiveKind.SECTION_CALL, List.of(unquote(args.get(0))));
        }
        if (startsWithKeyword(content, "section")) {
            String name = content.substring(7).trim();
            if (!IDENTIFIER.matcher(name).matches()) {
                throw error("Invalid section name '" + name + "'", token);
            }
            return new Directive(DirectiveKind.SECTION_DEF, List.of(name));
        }
        if (startsWithKeyword(content, "helper")) {
            return parseHelperHeader(content.substring(6).trim(), token);
        }
        if (isCall(content, "view")) {
            List<String> args = callArgs(content, "view");
            if (args.isEmpty() || args.size() > 2) {
                throw error("@{view(...)} requires a name and an optional model", token);
            }
            List<String> values = new ArrayList<>();
            values.add(unquote(args.get(0)));
            if (args.size() == 2) {
                values.add(args.get(1));
            }
            return new Directive(DirectiveKind.VIEW, values);
        }
        if (isCall(content, "import")) {
            List<String> files = new ArrayList<>();
            for (String arg : callArgs(content, "import")) {
                files.add(unquote(arg));
            }
            return new Directive(DirectiveKind.IMPORT, files);
        }
        if (isCall(content, "meta")) {
            List<String> parts = new ArrayList<>();
            for (String arg : callArgs(content, "meta")) {
                parts.add(unquote(arg));
            }
            return new Directive(DirectiveKind.META, parts);
        }
        if (content.length() > 3 && content.startsWith("'%") && content.endsWith("'")) {
            return new Directive(DirectiveKind.CONFIG, List.of(content.substring(2, content.length() - 1)));
        }
        int dot = content.indexOf('.');
        if (dot > 0) {
            Namespace namespace = Namespace.fromPrefix(content.substring(0, dot));
            String path = content.substring(dot + 1);
            if (namespace != null && PATH.matcher(path).matches()) {
                return new Directive(DirectiveKind.NAMESPACE, List.of(namespace.name(), path));
            }
        }
        int paren = content.indexOf('(');
        if (paren > 0 && IDENTIFIER.matcher(content.substring(0, paren).trim()).matches()
            && closingParen(content, paren) == content.length() - 1) {
            String name = content.substring(0, paren).trim();
            List<String> values = new ArrayList<>();
            values.add(name);
            values.addAll(callArgs(content, name));
            return new Directive(DirectiveKind.HELPER_CALL, values);
        }
        return new Directive(DirectiveKind.VARIABLE, List.of(content));
    }

    private Directive withCondition(DirectiveKind kind, String condition, TemplateToken token) {
        String trimmed = condition.trim();
        if (trimmed.isEmpty()) {
            throw error("Missing condition in @{" + token.text() + "}", token);
        }
        return new Directive(kind, List.of(trimmed));
    }

    private Directive parseForeachHeader(String header, TemplateToken token) {
        int in = header.indexOf(" in ");
        if (in <= 0) {
            throw error("Invalid @{foreach} syntax, expected 'item in collection'", token);
        }
        String item = header.substring(0, in).trim();
        if (item.startsWith("var ")) {
            item = item.substring(4).trim();
        }
        String collection = header.substring(in + 4).trim();
        if (!IDENTIFIER.matcher(item).matches() || collection.isEmpty()) {
            throw error("Invalid @{foreach} syntax, expected 'item in collection'", token);
        }
        return new Directive(DirectiveKind.FOREACH, List.of(item, collection));
    }

    private Directive parseHelperHeader(String header, TemplateToken token) {
        int paren = header.indexOf('(');
        if (paren <= 0 || !header.endsWith(")")) {
            throw error("Invalid @{helper} syntax, expected 'helper name(params)'", token);
        }
        String name = header.substring(0, paren).trim();
        if (!IDENTIFIER.matcher(name).matches()) {
            throw error("Invalid helper name '" + name + "'", token);
        }
        List<String> values = new ArrayList<>();
        values.add(name);
        for (String param : splitTopLevel(header.substring(paren + 1, header.length() - 1))) {
            if (!IDENTIFIER.matcher(param).matches()) {
                throw error("Invalid helper parameter '" + param + "'", token);
            }
            values.add(param);
        }
        return new Directive(DirectiveKind.HELPER_DEF, values);
    }

    private boolean startsWithKeyword(String content, String keyword) {
        return content.startsWith(keyword)
            && content.length() > keyword.length()
            && (Character.isWhitespace(content.charAt(keyword.length()))
                || (content.charAt(keyword.length()) == '(' && !keyword.equals("section")
                    && !keyword.equals("helper") && !keyword.equals("foreach")));
    }

    private boolean isCall(String content, String name) {
        if (!content.startsWith(name)) {
            return false;
        }
        String rest = content.substring(name.length()).trim();
        if (!rest.startsWith("(") || !rest.endsWith(")")) {
            return false;
        }
        int open = content.indexOf('(', name.length());
        return closingParen(content, open) == content.length() - 1;
    }

    private List<String> callArgs(String content, String name) {
        int open = content.indexOf('(', name.length());
        return splitTopLevel(content.substring(open + 1, content.length() - 1));
    }

    private int closingParen(String content, int open) {
        int depth = 0;
        char quote = '\0';
        for (int i = open; i < content.length(); i++) {
            char ch = content.charAt(i);
            if (quote != '\0') {
                if (ch == '\\') {
                    i++;
                } else if (ch == quote) {
                    quote = '\0';
                }
                continue;
            }
            if (ch == '\'' || ch == '"') {
                quote = ch;
            } else if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private List<String> splitTopLevel(String input) {
        List<String> parts = new ArrayList<>();
        if (input.isBlank()) {
            return parts;
        }
        int depth = 0;
        char quote = '\0';
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < input.length(); i++) {
            char ch = input.charAt(i);
            if (quote != '\0') {
                current.append(ch);
                if (ch == '\\' && i + 1 < input.length()) {
                    current.append(input.charAt(++i));
                } else if (ch == quote) {
                    quote = '\0';
                }
                continue;
            }
            if (ch == '\'' || ch == '"') {
                quote = ch;
            } else if (ch == '(' || ch == '[' || ch == '{') {
                depth++;
            } else if (ch == ')' || ch == ']' || ch == '}') {
                depth = Math.max(0, depth - 1);
            } else if (ch == ',' && depth == 0) {
                parts.add(current.toString().trim());
                current.setLength(0);
                continue;
            }
            current.append(ch);
        }
        parts.add(current.toString().trim());
        parts.removeIf(String::isEmpty);
        return parts;
    }

    private String unquote(String value) {
        String trimmed = value.trim();
        if (trimmed.length() >= 2
            && ((trimmed.startsWith("'") && trimmed.endsWith("'"))
                || (trimmed.startsWith("\"") && trimmed.endsWith("\"")))) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }

    private TemplateParseException error(String message, TemplateToken token) {
        return new TemplateParseException(message, token.line(), token.column());
    }

    private TemplateToken next() {
        return tokens.get(index++);
    }

    private boolean isAtEnd() {
        return index >= tokens.size();
    }

    private enum DirectiveKind {
        TEXT,
        VARIABLE,
        RAW_VARIABLE,
        TRANSLATE,
        TRANSLATE_KEY,
        IF,
        ELSE_IF,
        ELSE,
        FI,
        FOREACH,
        END,
        BREAK,
        CONTINUE,
        INDEX,
        SECTION_CALL,
        SECTION_DEF,
        HELPER_DEF,
        HELPER_CALL,
        VIEW,
        IMPORT,
        META,
        BODY,
        HEAD,
        CONTENT,
        CSRF,
        CONFIG,
        NAMESPACE;

        boolean closesBlock() {
            return this == ELSE || this == ELSE_IF || this == FI || this == END;
        }
    }

    private record Directive(DirectiveKind kind, List<String> args) {
        Directive {
            args = List.copyOf(args);
        }

        String arg(int position) {
            return args.get(position);
        }

        String optionalArg(int position) {
            return position < args.size() ? args.get(position) : null;
        }
    }
}
