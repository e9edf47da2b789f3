package io.lighting.quill.sql;

import java.util.List;
import java.util.Objects;

/**
 * Generated SQL text and its positional parameters, in placeholder order.
 */
public record RenderedSql(String sql, List<SqlValue> params) {
    public RenderedSql {
        Objects.requireNonNull(sql, "sql");
        params = List.copyOf(params);
    }
}
