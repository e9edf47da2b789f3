package io.lighting.quill.sql.dialect;

import io.lighting.quill.sql.DatabaseBackend;
import io.lighting.quill.sql.SqlDialect;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class SqliteDialect implements SqlDialect {
    public static final SqliteDialect INSTANCE = new SqliteDialect();

    private SqliteDialect() {
    }

    @Override
    public DatabaseBackend backend() {
        return DatabaseBackend.SQLITE;
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return SqlDialect.quote(identifier, '"');
    }

    @Override
    public String placeholder(int position) {
        return "?";
    }

    @Override
    public String limitSyntax(Long limit, Long offset) {
        if (limit == null && offset == null) {
            return "";
        }
        // SQLite only accepts OFFSET after a LIMIT; -1 means no limit.
        StringBuilder sql = new StringBuilder(" LIMIT ").append(limit == null ? -1L : limit);
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
        List<String> assignments = new ArrayList<>();
        for (String column : columns) {
            assignments.add(column + " = excluded." + column);
        }
        return "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES ("
            + String.join(", ", Collections.nCopies(columns.size(), "?")) + ") ON CONFLICT("
            + String.join(", ", conflictColumns) + ") DO UPDATE SET " + String.join(", ", assignments);
    }

    @Override
    public String currentTimestamp() {
        return "CURRENT_TIMESTAMP";
    }

    @Override
    public String autoIncrementSyntax() {
        return "INTEGER PRIMARY KEY AUTOINCREMENT";
    }

    @Override
    public String booleanType() {
        return "INTEGER";
    }

    @Override
    public String stringType(Integer maxLength) {
        return "TEXT";
    }
}
