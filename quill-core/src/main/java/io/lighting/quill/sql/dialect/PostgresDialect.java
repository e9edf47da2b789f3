package io.lighting.quill.sql.dialect;

import io.lighting.quill.sql.DatabaseBackend;
import io.lighting.quill.sql.SqlDialect;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class PostgresDialect implements SqlDialect {
    public static final PostgresDialect INSTANCE = new PostgresDialect();

    private PostgresDialect() {
    }

    @Override
    public DatabaseBackend backend() {
        return DatabaseBackend.POSTGRES;
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return SqlDialect.quote(identifier, '"');
    }

    @Override
    public String placeholder(int position) {
        return "$" + position;
    }

    /**
     * Appends a {@code ::type} cast for enum parameters.
     */
    public String placeholderWithCast(int position, String type) {
        return type == null || type.isBlank() ? placeholder(position) : placeholder(position) + "::" + type;
    }

    @Override
    public String limitSyntax(Long limit, Long offset) {
        StringBuilder sql = new StringBuilder();
        if (limit != null) {
            sql.append(" LIMIT ").append(limit);
        }
        if (offset != null) {
            sql.append(" OFFSET ").append(offset);
        }
        return sql.toString();
    }

    @Override
    public Optional<String> returningSyntax(List<String> columns) {
        return Optional.of(" RETURNING " + String.join(", ", columns));
    }

    @Override
    public String upsertSyntax(String table, List<String> columns, List<String> conflictColumns) {
        Objects.requireNonNull(table, "table");
        List<String> placeholders = new ArrayList<>();
        List<String> assignments = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            placeholders.add(placeholder(i + 1));
            assignments.add(columns.get(i) + " = " + placeholder(i + 1));
        }
        return "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES ("
            + String.join(", ", placeholders) + ") ON CONFLICT (" + String.join(", ", conflictColumns)
            + ") DO UPDATE SET " + String.join(", ", assignments);
    }

    @Override
    public String currentTimestamp() {
        return "CURRENT_TIMESTAMP";
    }

    @Override
    public String autoIncrementSyntax() {
        return "SERIAL PRIMARY KEY";
    }

    @Override
    public String booleanType() {
        return "BOOLEAN";
    }

    @Override
    public String stringType(Integer maxLength) {
        if (maxLength != null && maxLength <= 255) {
            return "VARCHAR(" + maxLength + ")";
        }
        return "TEXT";
    }
}
