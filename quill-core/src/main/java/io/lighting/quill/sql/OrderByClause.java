package io.lighting.quill.sql;

import java.util.Objects;

public record OrderByClause(String column, OrderDirection direction) {
    public enum OrderDirection {
        ASC,
        DESC
    }

    public OrderByClause {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(direction, "direction");
    }
}
