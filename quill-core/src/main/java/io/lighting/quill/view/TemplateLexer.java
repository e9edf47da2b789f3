package io.lighting.quill.view;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits template source into literal text runs and {@code @{...}} / {@code @(...)} directives.
 */
final class TemplateLexer {
    private final String input;
    private int index;
    private int line = 1;
    private int column = 1;

    TemplateLexer(String input) {
        this.input = Objects.requireNonNull(input, "input");
    }

    List<TemplateToken> tokenize() {
        List<TemplateToken> tokens = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        int textLine = line;
        int textColumn = column;
        while (!isAtEnd()) {
            if (peek() == '@' && (peekNext() == '{' || peekNext() == '(')) {
                if (text.length() > 0) {
                    tokens.add(new TemplateToken(TokenKind.TEXT, text.toString(), textLine, textColumn));
                    text.setLength(0);
                }
                tokens.add(peekNext() == '{' ? readDirective() : readTranslation());
                textLine = line;
                textColumn = column;
                continue;
            }
            text.append(peek());
            advance();
        }
        if (text.length() > 0) {
            tokens.add(new TemplateToken(TokenKind.TEXT, text.toString(), textLine, textColumn));
        }
        return tokens;
    }

    private TemplateToken readDirective() {
        int startLine = line;
        int startColumn = column;
        advance();
        advance();
        String content = readUntil('{', '}', true, startLine, startColumn, "@{").trim();
        if (content.startsWith("!")) {
            return new TemplateToken(TokenKind.RAW_DIRECTIVE, content.substring(1).trim(), startLine, startColumn);
        }
        if (content.isEmpty()) {
            throw new TemplateParseException("Empty directive @{}", startLine, startColumn);
        }
        return new TemplateToken(TokenKind.DIRECTIVE, content, startLine, startColumn);
    }

    private TemplateToken readTranslation() {
        int startLine = line;
        int startColumn = column;
        advance();
        advance();
        String content = readUntil('(', ')', false, startLine, startColumn, "@(").trim();
        if (content.startsWith("#")) {
            return new TemplateToken(TokenKind.TRANSLATE_KEY, content.substring(1).trim(), startLine, startColumn);
        }
        return new TemplateToken(TokenKind.TRANSLATE, content, startLine, startColumn);
    }

    /**
     * Reads up to the matching close character, honouring nesting and, for directives,
     * quoted strings. Translation text may contain apostrophes. The close character is consumed.
     */
    private String readUntil(char open, char close, boolean quotes, int startLine, int startColumn, String opener) {
        StringBuilder content = new StringBuilder();
        int depth = 0;
        char quote = '\0';
        while (!isAtEnd()) {
            char ch = peek();
            if (quote != '\0') {
                if (ch == '\\' && index + 1 < input.length()) {
                    content.append(ch);
                    advance();
                    content.append(peek());
                    advance();
                    continue;
                }
                if (ch == quote) {
                    quote = '\0';
                }
            } else if (quotes && (ch == '\'' || ch == '"')) {
                quote = ch;
            } else if (ch == open) {
                depth++;
            } else if (ch == close) {
                if (depth == 0) {
                    advance();
                    return content.toString();
                }
                depth--;
            }
            content.append(ch);
            advance();
        }
        throw new TemplateParseException("Unterminated " + opener + " directive", startLine, startColumn);
    }

    private void advance() {
        if (peek() == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        index++;
    }

    private char peek() {
        if (isAtEnd()) {
            return '\0';
        }
        return input.charAt(index);
    }

    private char peekNext() {
        if (index + 1 >= input.length()) {
            return '\0';
        }
        return input.charAt(index + 1);
    }

    private boolean isAtEnd() {
        return index >= input.length();
    }

    enum TokenKind {
        TEXT,
        DIRECTIVE,
        RAW_DIRECTIVE,
        TRANSLATE,
        TRANSLATE_KEY
    }

    record TemplateToken(TokenKind kind, String text, int line, int column) {
        TemplateToken {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(text, "text");
        }
    }
}
