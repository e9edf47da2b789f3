package io.lighting.quill.view;

import io.lighting.quill.value.Value;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive-descent parser for directive expressions.
 * <p>
 * Precedence, lowest first: ternary, {@code ||}, {@code &&}, equality, relational,
 * additive, multiplicative, unary, postfix (property, index, call).
 */
final class TemplateExpressionParser {
    private final String input;
    private int index;

    TemplateExpressionParser(String input) {
        this.input = input;
        this.index = 0;
    }

    static TemplateExpression parse(String input) {
        return new TemplateExpressionParser(input).parse();
    }

    TemplateExpression parse() {
        TemplateExpression expression = parseTernary();
        skipWhitespace();
        if (!isAtEnd()) {
            throw new IllegalArgumentException("Unexpected token at position " + index + " in expression: " + input);
        }
        return expression;
    }

    private TemplateExpression parseTernary() {
        TemplateExpression condition = parseOr();
        if (match("?")) {
            TemplateExpression whenTrue = parseTernary();
            expect(":");
            TemplateExpression whenFalse = parseTernary();
            return new TernaryExpression(condition, whenTrue, whenFalse);
        }
        return condition;
    }

    private TemplateExpression parseOr() {
        TemplateExpression left = parseAnd();
        while (match("||")) {
            TemplateExpression right = parseAnd();
            left = new BinaryExpression(left, BinaryOperator.OR, right);
        }
        return left;
    }

    private TemplateExpression parseAnd() {
        TemplateExpression left = parseEquality();
        while (match("&&")) {
            TemplateExpression right = parseEquality();
            left = new BinaryExpression(left, BinaryOperator.AND, right);
        }
        return left;
    }

    private TemplateExpression parseEquality() {
        TemplateExpression left = parseRelational();
        while (true) {
            BinaryOperator op;
            if (match("===")) {
                op = BinaryOperator.STRICT_EQ;
            } else if (match("!==")) {
                op = BinaryOperator.STRICT_NE;
            } else if (match("==")) {
                op = BinaryOperator.EQ;
            } else if (match("!=")) {
                op = BinaryOperator.NE;
            } else {
                return left;
            }
            left = new BinaryExpression(left, op, parseRelational());
        }
    }

    private TemplateExpression parseRelational() {
        TemplateExpression left = parseAdditive();
        while (true) {
            BinaryOperator op;
            if (match("<=")) {
                op = BinaryOperator.LE;
            } else if (match(">=")) {
                op = BinaryOperator.GE;
            } else if (match("<")) {
                op = BinaryOperator.LT;
            } else if (match(">")) {
                op = BinaryOperator.GT;
            } else {
                return left;
            }
            left = new BinaryExpression(left, op, parseAdditive());
        }
    }

    private TemplateExpression parseAdditive() {
        TemplateExpression left = parseMultiplicative();
        while (true) {
            BinaryOperator op;
            if (match("+")) {
                op = BinaryOperator.ADD;
            } else if (match("-")) {
                op = BinaryOperator.SUB;
            } else {
                return left;
            }
            left = new BinaryExpression(left, op, parseMultiplicative());
        }
    }

    private TemplateExpression parseMultiplicative() {
        TemplateExpression left = parseUnary();
        while (true) {
            BinaryOperator op;
            if (match("*")) {
                op = BinaryOperator.MUL;
            } else if (match("/")) {
                op = BinaryOperator.DIV;
            } else if (match("%")) {
                op = BinaryOperator.MOD;
            } else {
                return left;
            }
            left = new BinaryExpression(left, op, parseUnary());
        }
    }

    private TemplateExpression parseUnary() {
        skipWhitespace();
        if (peek() == '!' && peekNext() != '=') {
            index++;
            return new UnaryExpression(UnaryOperator.NOT, parseUnary());
        }
        if (peek() == '-') {
            index++;
            skipWhitespace();
            if (Character.isDigit(peek())) {
                return parsePostfix(new LiteralExpression(Value.of(-parseNumber())));
            }
            return new UnaryExpression(UnaryOperator.NEGATE, parseUnary());
        }
        return parsePostfix(parsePrimary());
    }

    private TemplateExpression parsePostfix(TemplateExpression target) {
        TemplateExpression current = target;
        while (true) {
            skipWhitespace();
            if (peek() == '.' && !Character.isDigit(peekNext())) {
                index++;
                current = new PropertyAccessExpression(current, parseIdentifier());
            } else if (peek() == '[') {
                index++;
                TemplateExpression key = parseTernary();
                expect("]");
                current = new IndexExpression(current, key);
            } else {
                return current;
            }
        }
    }

    private TemplateExpression parsePrimary() {
        skipWhitespace();
        if (match("(")) {
            TemplateExpression inner = parseTernary();
            expect(")");
            return inner;
        }
        if (peek() == '"' || peek() == '\'') {
            return new LiteralExpression(Value.of(parseStringLiteral()));
        }
        if (Character.isDigit(peek())) {
            return new LiteralExpression(Value.of(parseNumber()));
        }
        if (peek() == '[') {
            return parseArray();
        }
        if (peek() == '{') {
            return parseObject();
        }
        if (matchKeyword("null") || matchKeyword("undefined")) {
            return new LiteralExpression(Value.NULL);
        }
        if (matchKeyword("true")) {
            return new LiteralExpression(Value.TRUE);
        }
        if (matchKeyword("false")) {
            return new LiteralExpression(Value.FALSE);
        }
        if (isIdentifierStart(peek())) {
            return parseNameOrCall();
        }
        throw new IllegalArgumentException("Unexpected token at position " + index + " in expression: " + input);
    }

    /**
     * Dotted identifier chains stay a single variable so reserved prefixes such as
     * {@code csrf_token.login} resolve as a whole.
     */
    private TemplateExpression parseNameOrCall() {
        String name = parseIdentifier();
        skipWhitespace();
        if (peek() == '(') {
            index++;
            List<TemplateExpression> args = parseArguments(')');
            return new FunctionCallExpression(name, args);
        }
        StringBuilder path = new StringBuilder(name);
        while (peek() == '.' && isIdentifierPart(peekNext())) {
            index++;
            int start = index;
            while (!isAtEnd() && isIdentifierPart(peek())) {
                index++;
            }
            path.append('.').append(input, start, index);
        }
        return new VariableExpression(path.toString());
    }

    private TemplateExpression parseArray() {
        expect("[");
        return new ArrayExpression(parseArguments(']'));
    }

    private TemplateExpression parseObject() {
        expect("{");
        Map<String, TemplateExpression> entries = new LinkedHashMap<>();
        if (match("}")) {
            return new ObjectExpression(entries);
        }
        do {
            skipWhitespace();
            String key;
            if (peek() == '"' || peek() == '\'') {
                key = parseStringLiteral();
            } else {
                key = parseIdentifier();
            }
            expect(":");
            entries.put(key, parseTernary());
        } while (match(","));
        expect("}");
        return new ObjectExpression(entries);
    }

    private List<TemplateExpression> parseArguments(char terminator) {
        List<TemplateExpression> args = new ArrayList<>();
        String close = String.valueOf(terminator);
        if (match(close)) {
            return args;
        }
        do {
            args.add(parseTernary());
        } while (match(","));
        expect(close);
        return args;
    }

    private String parseIdentifier() {
        skipWhitespace();
        if (!isIdentifierStart(peek())) {
            throw new IllegalArgumentException("Expected identifier at position " + index + " in expression: " + input);
        }
        int start = index;
        index++;
        while (!isAtEnd() && isIdentifierPart(peek())) {
            index++;
        }
        return input.substring(start, index);
    }

    private String parseStringLiteral() {
        char quote = peek();
        index++;
        StringBuilder builder = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char ch = peek();
            if (ch == '\\') {
                index++;
                if (isAtEnd()) {
                    throw new IllegalArgumentException("Unterminated string literal in expression: " + input);
                }
                char escaped = peek();
                switch (escaped) {
                    case 'n' -> builder.append('\n');
                    case 't' -> builder.append('\t');
                    case 'r' -> builder.append('\r');
                    default -> builder.append(escaped);
                }
            } else {
                builder.append(ch);
            }
            index++;
        }
        if (isAtEnd()) {
            throw new IllegalArgumentException("Unterminated string literal in expression: " + input);
        }
        index++;
        return builder.toString();
    }

    private double parseNumber() {
        int start = index;
        while (!isAtEnd() && Character.isDigit(peek())) {
            index++;
        }
        if (peek() == '.' && Character.isDigit(peekNext())) {
            index++;
            while (!isAtEnd() && Character.isDigit(peek())) {
                index++;
            }
        }
        return Double.parseDouble(input.substring(start, index));
    }

    private boolean matchKeyword(String keyword) {
        skipWhitespace();
        int length = keyword.length();
        if (!input.startsWith(keyword, index)) {
            return false;
        }
        int end = index + length;
        if (end < input.length() && isIdentifierPart(input.charAt(end))) {
            return false;
        }
        index = end;
        return true;
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            index++;
        }
    }

    private boolean match(String token) {
        skipWhitespace();
        if (input.startsWith(token, index)) {
            index += token.length();
            return true;
        }
        return false;
    }

    private void expect(String token) {
        if (!match(token)) {
            throw new IllegalArgumentException("Expected '" + token + "' at position " + index + " in expression: " + input);
        }
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

    private boolean isIdentifierStart(char ch) {
        return Character.isLetter(ch) || ch == '_' || ch == '$';
    }

    private boolean isIdentifierPart(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_' || ch == '$';
    }

}
