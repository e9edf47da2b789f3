package io.lighting.quill.sql;

import java.util.List;
import java.util.Optional;

/**
 * Backend-specific SQL surface syntax: identifier quoting, placeholders, paging and DDL types.
 */
public interface SqlDialect {
    DatabaseBackend backend();

    /**
     * Quotes a simple identifier. Qualified names such as {@code users.id} are returned unchanged.
     */
    String quoteIdentifier(String identifier);

    /**
     * Placeholder for the 1-based parameter position.
     */
    String placeholder(int position);

    /**
     * {@code LIMIT}/{@code OFFSET} suffix with a leading space, or an empty string when both are absent.
     */
    String limitSyntax(Long limit, Long offset);

    /**
     * {@code RETURNING} suffix, or empty when the backend has no such clause.
     */
    Optional<String> returningSyntax(List<String> columns);

    /**
     * Insert-or-update statement over already quoted table and column names.
     */
    String upsertSyntax(String table, List<String> columns, List<String> conflictColumns);

    /**
     * Single-quoted string literal with embedded quotes doubled.
     */
    default String quoteLiteral(String text) {
        return "'" + text.replace("'", "''") + "'";
    }

    String currentTimestamp();

    String autoIncrementSyntax();

    String booleanType();

    /**
     * Column type for strings of at most {@code maxLength} characters; null means unbounded.
     */
    String stringType(Integer maxLength);

    default String integerType() {
        return "INTEGER";
    }

    default String bigIntegerType() {
        return "BIGINT";
    }

    default String timestampType() {
        return "TIMESTAMP";
    }

    default boolean supportsFullJoin() {
        return true;
    }

    /**
     * Quotes a simple identifier with the given quote character, doubling embedded quotes.
     */
    static String quote(String identifier, char quote) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier must not be blank");
        }
        if (identifier.indexOf('.') >= 0) {
            return identifier;
        }
        String q = String.valueOf(quote);
        return q + identifier.replace(q, q + q) + q;
    }
}
