package io.lighting.quill.view;

import io.lighting.quill.value.Value;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pure expression tree. Evaluation never fails: type mismatches and unknown names yield {@link Value#NULL}.
 */
sealed interface TemplateExpression permits LiteralExpression, VariableExpression, PropertyAccessExpression,
    IndexExpression, ArrayExpression, ObjectExpression, BinaryExpression, UnaryExpression,
    FunctionCallExpression, TernaryExpression {

    Value evaluate(RenderContext context);

    /**
     * Property lookup shared by dotted paths and {@code a.b} access: object keys,
     * numeric array indexes and the synthetic {@code length}/{@code size}.
     */
    static Value property(Value target, String property) {
        if (target instanceof Value.ObjectValue object) {
            return object.get(property);
        }
        if (target instanceof Value.ArrayValue array) {
            if (property.equals("length") || property.equals("size")) {
                return Value.of(array.size());
            }
            try {
                return array.get(Integer.parseInt(property));
            } catch (NumberFormatException ex) {
                return Value.NULL;
            }
        }
        if (target instanceof Value.StringValue text
            && (property.equals("length") || property.equals("size"))) {
            return Value.of(text.value().length());
        }
        return Value.NULL;
    }
}

record LiteralExpression(Value value) implements TemplateExpression {
    LiteralExpression {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public Value evaluate(RenderContext context) {
        return value;
    }
}

/**
 * A bare name or dotted identifier path, resolved through the context's namespace precedence.
 */
record VariableExpression(String name) implements TemplateExpression {
    VariableExpression {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public Value evaluate(RenderContext context) {
        return context.resolveVariable(name);
    }
}

record PropertyAccessExpression(TemplateExpression object, String property) implements TemplateExpression {
    PropertyAccessExpression {
        Objects.requireNonNull(object, "object");
        Objects.requireNonNull(property, "property");
    }

    @Override
    public Value evaluate(RenderContext context) {
        return TemplateExpression.property(object.evaluate(context), property);
    }
}

record IndexExpression(TemplateExpression object, TemplateExpression index) implements TemplateExpression {
    IndexExpression {
        Objects.requireNonNull(object, "object");
        Objects.requireNonNull(index, "index");
    }

    @Override
    public Value evaluate(RenderContext context) {
        Value key = index.evaluate(context);
        if (key instanceof Value.NullValue) {
            return Value.NULL;
        }
        return TemplateExpression.property(object.evaluate(context), key.asText());
    }
}

record ArrayExpression(List<TemplateExpression> items) implements TemplateExpression {
    ArrayExpression {
        items = List.copyOf(items);
    }

    @Override
    public Value evaluate(RenderContext context) {
        List<Value> values = new ArrayList<>(items.size());
        for (TemplateExpression item : items) {
            values.add(item.evaluate(context));
        }
        return Value.array(values);
    }
}

record ObjectExpression(Map<String, TemplateExpression> entries) implements TemplateExpression {
    ObjectExpression {
        entries = java.util.Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    @Override
    public Value evaluate(RenderContext context) {
        Map<String, Value> values = new LinkedHashMap<>();
        for (Map.Entry<String, TemplateExpression> entry : entries.entrySet()) {
            values.put(entry.getKey(), entry.getValue().evaluate(context));
        }
        return Value.object(values);
    }
}

enum BinaryOperator {
    OR,
    AND,
    EQ,
    NE,
    STRICT_EQ,
    STRICT_NE,
    LT,
    LE,
    GT,
    GE,
    ADD,
    SUB,
    MUL,
    DIV,
    MOD
}

record BinaryExpression(TemplateExpression left, BinaryOperator op, TemplateExpression right)
    implements TemplateExpression {
    BinaryExpression {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public Value evaluate(RenderContext context) {
        Value l = left.evaluate(context);
        Value r = right.evaluate(context);
        return switch (op) {
            case OR -> Value.of(l.isTruthy() || r.isTruthy());
            case AND -> Value.of(l.isTruthy() && r.isTruthy());
            case EQ, STRICT_EQ -> Value.of(l.equals(r));
            case NE, STRICT_NE -> Value.of(!l.equals(r));
            case LT, LE, GT, GE -> compare(l, r);
            case ADD -> add(l, r);
            case SUB, MUL, DIV, MOD -> arithmetic(l, r);
        };
    }

    private Value compare(Value l, Value r) {
        if (!(l instanceof Value.NumberValue a) || !(r instanceof Value.NumberValue b)) {
            return Value.FALSE;
        }
        return switch (op) {
            case LT -> Value.of(a.value() < b.value());
            case LE -> Value.of(a.value() <= b.value());
            case GT -> Value.of(a.value() > b.value());
            default -> Value.of(a.value() >= b.value());
        };
    }

    private Value add(Value l, Value r) {
        if (l instanceof Value.NumberValue a && r instanceof Value.NumberValue b) {
            return Value.of(a.value() + b.value());
        }
        if (l instanceof Value.StringValue || r instanceof Value.StringValue) {
            return Value.of(l.asText() + r.asText());
        }
        return Value.NULL;
    }

    private Value arithmetic(Value l, Value r) {
        if (!(l instanceof Value.NumberValue a) || !(r instanceof Value.NumberValue b)) {
            return Value.NULL;
        }
        return switch (op) {
            case SUB -> Value.of(a.value() - b.value());
            case MUL -> Value.of(a.value() * b.value());
            case DIV -> b.value() == 0.0d ? Value.NULL : Value.of(a.value() / b.value());
            default -> b.value() == 0.0d ? Value.NULL : Value.of(a.value() % b.value());
        };
    }
}

enum UnaryOperator {
    NOT,
    NEGATE
}

record UnaryExpression(UnaryOperator op, TemplateExpression operand) implements TemplateExpression {
    UnaryExpression {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public Value evaluate(RenderContext context) {
        Value value = operand.evaluate(context);
        if (op == UnaryOperator.NOT) {
            return Value.of(!value.isTruthy());
        }
        if (value instanceof Value.NumberValue number) {
            return Value.of(-number.value());
        }
        return Value.NULL;
    }
}

record FunctionCallExpression(String name, List<TemplateExpression> args) implements TemplateExpression {
    FunctionCallExpression {
        Objects.requireNonNull(name, "name");
        args = List.copyOf(args);
    }

    @Override
    public Value evaluate(RenderContext context) {
        List<Value> values = new ArrayList<>(args.size());
        for (TemplateExpression arg : args) {
            values.add(arg.evaluate(context));
        }
        return context.callFunction(name, values);
    }
}

record TernaryExpression(TemplateExpression condition, TemplateExpression whenTrue, TemplateExpression whenFalse)
    implements TemplateExpression {
    TernaryExpression {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(whenTrue, "whenTrue");
        Objects.requireNonNull(whenFalse, "whenFalse");
    }

    @Override
    public Value evaluate(RenderContext context) {
        return condition.evaluate(context).isTruthy()
            ? whenTrue.evaluate(context)
            : whenFalse.evaluate(context);
    }
}
