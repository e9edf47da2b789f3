package io.lighting.quill.sql;

import java.util.Objects;

/**
 * One WHERE predicate. An empty column marks raw SQL held in {@code operator}.
 * {@code IN (...)}, {@code NOT IN (...)} and {@code BETWEEN} carry their literals in
 * {@code operator} and bind nothing.
 */
public record WhereCondition(String column, String operator, SqlValue value, Connector connector) {
    public enum Connector {
        AND,
        OR
    }

    public WhereCondition {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(connector, "connector");
    }

    public boolean isRaw() {
        return column.isEmpty();
    }

    public boolean isNullCheck() {
        return operator.equals("IS") || operator.equals("IS NOT");
    }

    public boolean isEmbedded() {
        return operator.startsWith("IN (") || operator.startsWith("NOT IN (") || operator.startsWith("BETWEEN ");
    }

    /**
     * Whether this condition contributes a bound parameter.
     */
    public boolean bindsParameter() {
        return !isRaw() && !isNullCheck() && !isEmbedded();
    }
}
