package io.lighting.quill.sql;

import java.util.Objects;

/**
 * A join. {@code table} may carry an alias ({@code "posts p"} or {@code "posts AS p"});
 * {@code on} is raw SQL.
 */
public record JoinClause(JoinType type, String table, String on) {
    public enum JoinType {
        INNER("INNER JOIN"),
        LEFT("LEFT JOIN"),
        RIGHT("RIGHT JOIN"),
        FULL("FULL JOIN");

        private final String keyword;

        JoinType(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    public JoinClause {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(on, "on");
    }
}
