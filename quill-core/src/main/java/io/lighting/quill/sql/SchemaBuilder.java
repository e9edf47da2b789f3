package io.lighting.quill.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Generates backend-specific {@code CREATE TABLE} statements.
 */
public final class SchemaBuilder {
    private final DatabaseBackend backend;
    private final SqlDialect dialect;

    public SchemaBuilder(DatabaseBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.dialect = backend.dialect();
    }

    public CreateTableBuilder createTable(String table) {
        return new CreateTableBuilder(Objects.requireNonNull(table, "table"));
    }

    public final class CreateTableBuilder {
        private final String table;
        private final List<Column> columns = new ArrayList<>();
        private final List<String> constraints = new ArrayList<>();

        private CreateTableBuilder(String table) {
            this.table = table;
        }

        /**
         * Auto-incrementing integer primary key named {@code id}.
         */
        public CreateTableBuilder id() {
            String type = backend.isMySqlFamily()
                ? "INT " + dialect.autoIncrementSyntax()
                : dialect.autoIncrementSyntax();
            columns.add(new Column("id", type, true));
            return this;
        }

        /**
         * @param maxLength the longest value stored; null for unbounded text
         */
        public CreateTableBuilder string(String name, Integer maxLength) {
            return add(name, dialect.stringType(maxLength));
        }

        public CreateTableBuilder integer(String name) {
            return add(name, dialect.integerType());
        }

        public CreateTableBuilder bigInteger(String name) {
            return add(name, dialect.bigIntegerType());
        }

        /**
         * Boolean column, {@code NOT NULL DEFAULT FALSE}.
         */
        public CreateTableBuilder bool(String name) {
            add(name, dialect.booleanType());
            Column column = last();
            column.notNull = true;
            column.defaultValue = "FALSE";
            return this;
        }

        public CreateTableBuilder timestamp(String name) {
            return add(name, dialect.timestampType());
        }

        /**
         * Timestamp column defaulting to the current time.
         */
        public CreateTableBuilder timestampDefaultNow(String name) {
            add(name, dialect.timestampType());
            last().defaultValue = dialect.currentTimestamp();
            return this;
        }

        public CreateTableBuilder notNull() {
            last().notNull = true;
            return this;
        }

        public CreateTableBuilder unique() {
            last().constraints.add("UNIQUE");
            return this;
        }

        /**
         * Default for the last column, as SQL text ({@code 0}, {@code 'draft'}, ...).
         */
        public CreateTableBuilder defaultValue(String sql) {
            last().defaultValue = Objects.requireNonNull(sql, "sql");
            return this;
        }

        /**
         * Table constraint appended after the columns, e.g. {@code UNIQUE (email)}.
         */
        public CreateTableBuilder constraint(String sql) {
            constraints.add(Objects.requireNonNull(sql, "sql"));
            return this;
        }

        public String build() {
            if (columns.isEmpty()) {
                throw QueryException.invalidSyntax(backend, "No columns defined for table " + table);
            }
            List<String> definitions = new ArrayList<>(columns.size() + constraints.size());
            for (Column column : columns) {
                StringBuilder definition = new StringBuilder("  ")
                    .append(dialect.quoteIdentifier(column.name))
                    .append(' ')
                    .append(column.type);
                if (column.notNull && !column.primaryKey) {
                    definition.append(" NOT NULL");
                }
                if (column.defaultValue != null) {
                    definition.append(" DEFAULT ").append(column.defaultValue);
                }
                for (String constraint : column.constraints) {
                    definition.append(' ').append(constraint);
                }
                definitions.add(definition.toString());
            }
            for (String constraint : constraints) {
                definitions.add("  " + constraint);
            }
            return "CREATE TABLE " + dialect.quoteIdentifier(table) + " (\n" + String.join(",\n", definitions) + "\n)";
        }

        private CreateTableBuilder add(String name, String type) {
            columns.add(new Column(name, type, false));
            return this;
        }

        private Column last() {
            if (columns.isEmpty()) {
                throw new IllegalStateException("No column defined yet");
            }
            return columns.get(columns.size() - 1);
        }
    }

    private static final class Column {
        private final String name;
        private final String type;
        private final boolean primaryKey;
        private boolean notNull;
        private String defaultValue;
        private final List<String> constraints = new ArrayList<>();

        private Column(String name, String type, boolean primaryKey) {
            this.name = Objects.requireNonNull(name, "name");
            this.type = type;
            this.primaryKey = primaryKey;
        }
    }
}
