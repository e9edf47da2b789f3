package io.lighting.quill.sql.dialect;

import io.lighting.quill.sql.DatabaseBackend;
import io.lighting.quill.sql.SqlDialect;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MySQL and MariaDB. Neither has {@code RETURNING} nor {@code FULL JOIN}.
 */
public final class MySqlDialect implements SqlDialect {
    public static final MySqlDialect MYSQL = new MySqlDialect(DatabaseBackend.MYSQL);
    public static final MySqlDialect MARIADB = new MySqlDialect(DatabaseBackend.MARIADB);

    // Largest unsigned BIGINT; MySQL has no OFFSET without LIMIT.
    private static final String UNBOUNDED_LIMIT = "18446744073709551615";

    private final DatabaseBackend backend;

    private MySqlDialect(DatabaseBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend");
    }

    @Override
    public DatabaseBackend backend() {
        return backend;
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return SqlDialect.quote(identifier, '`');
    }

    /**
     * Backslash is an escape character under the default {@code sql_mode}, so it is doubled along with quotes.
     */
    @Override
    public String quoteLiteral(String text) {
        return "'" + text.replace("\\", "\\\\").replace("'", "''") + "'";
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
        StringBuilder sql = new StringBuilder(" LIMIT ");
        sql.append(limit == null ? UNBOUNDED_LIMIT : limit.toString());
        if (offset != null) {
            sql.append(" OFFSET ").append(offset);
        }
        return sql.toString();
    }

    @Override
    public Optional<String> returningSyntax(List<String> columns) {
        return Optional.empty();
    }

    @Override
    public String upsertSyntax(String table, List<String> columns, List<String> conflictColumns) {
        Objects.requireNonNull(table, "table");
        List<String> assignments = new ArrayList<>();
        for (String column : columns) {
            assignments.add(column + " = VALUES(" + column + ")");
        }
        return "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES ("
            + String.join(", ", Collections.nCopies(columns.size(), "?")) + ") ON DUPLICATE KEY UPDATE "
            + String.join(", ", assignments);
    }

    @Override
    public String currentTimestamp() {
        return "CURRENT_TIMESTAMP()";
    }

    @Override
    public String autoIncrementSyntax() {
        return "AUTO_INCREMENT PRIMARY KEY";
    }

    @Override
    public String booleanType() {
        return "TINYINT(1)";
    }

    @Override
    public String stringType(Integer maxLength) {
        if (maxLength != null && maxLength <= 255) {
            return "VARCHAR(" + maxLength + ")";
        }
        if (maxLength != null && maxLength <= 65535) {
            return "TEXT";
        }
        return "LONGTEXT";
    }

    @Override
    public String timestampType() {
        return "DATETIME";
    }

    @Override
    public boolean supportsFullJoin() {
        return false;
    }
}
