package io.lighting.quill.sql;

import io.lighting.quill.sql.JoinClause.JoinType;
import io.lighting.quill.sql.OrderByClause.OrderDirection;
import io.lighting.quill.sql.WhereCondition.Connector;
import io.lighting.quill.sql.dialect.PostgresDialect;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fluent builder for parameterized SELECT, INSERT, UPDATE, DELETE and upsert statements.
 * <p>
 * Builder calls mutate and return this instance; terminal {@code build*} methods leave it untouched,
 * so one builder may produce several statements. Conditions render in call order, the connector of
 * each applying between it and the previous one. Instances are not thread-safe.
 */
public final class QueryBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryBuilder.class);

    private final DatabaseBackend backend;
    private final SqlDialect dialect;
    private String table;
    private String alias;
    private final List<String> selectColumns = new ArrayList<>(List.of("*"));
    private final List<WhereCondition> whereConditions = new ArrayList<>();
    private final List<JoinClause> joins = new ArrayList<>();
    private final List<OrderByClause> orderBy = new ArrayList<>();
    private final List<String> groupBy = new ArrayList<>();
    private final List<String> returning = new ArrayList<>();
    private Long limit;
    private Long offset;

    public QueryBuilder(DatabaseBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.dialect = backend.dialect();
    }

    public QueryBuilder from(String table) {
        this.table = Objects.requireNonNull(table, "table");
        return this;
    }

    public QueryBuilder asAlias(String alias) {
        this.alias = Objects.requireNonNull(alias, "alias");
        return this;
    }

    /**
     * Replaces the select list. Columns are emitted verbatim so expressions are allowed.
     */
    public QueryBuilder select(String... columns) {
        Objects.requireNonNull(columns, "columns");
        return select(List.of(columns));
    }

    public QueryBuilder select(List<String> columns) {
        Objects.requireNonNull(columns, "columns");
        selectColumns.clear();
        selectColumns.addAll(columns);
        return this;
    }

    public QueryBuilder count() {
        return select("COUNT(*)");
    }

    public QueryBuilder countColumn(String column) {
        return select("COUNT(" + dialect.quoteIdentifier(column) + ")");
    }

    public QueryBuilder whereEq(String column, Object value) {
        return addCondition(column, "=", value, Connector.AND);
    }

    public QueryBuilder whereNe(String column, Object value) {
        return addCondition(column, "!=", value, Connector.AND);
    }

    public QueryBuilder whereGt(String column, Object value) {
        return addCondition(column, ">", value, Connector.AND);
    }

    public QueryBuilder whereLt(String column, Object value) {
        return addCondition(column, "<", value, Connector.AND);
    }

    public QueryBuilder whereGte(String column, Object value) {
        return addCondition(column, ">=", value, Connector.AND);
    }

    public QueryBuilder whereLte(String column, Object value) {
        return addCondition(column, "<=", value, Connector.AND);
    }

    public QueryBuilder whereLike(String column, Object pattern) {
        return addCondition(column, "LIKE", pattern, Connector.AND);
    }

    public QueryBuilder whereNotLike(String column, Object pattern) {
        return addCondition(column, "NOT LIKE", pattern, Connector.AND);
    }

    public QueryBuilder whereNull(String column) {
        return addCondition(column, "IS", null, Connector.AND);
    }

    public QueryBuilder whereNotNull(String column) {
        return addCondition(column, "IS NOT", null, Connector.AND);
    }

    /**
     * {@code column IN (...)} with the values embedded as SQL literals. An empty collection matches nothing.
     */
    public QueryBuilder whereIn(String column, Collection<?> values) {
        return addIn(column, values, false, Connector.AND);
    }

    /**
     * {@code column NOT IN (...)} with the values embedded as SQL literals. An empty collection matches everything.
     */
    public QueryBuilder whereNotIn(String column, Collection<?> values) {
        return addIn(column, values, true, Connector.AND);
    }

    public QueryBuilder whereBetween(String column, Object start, Object end) {
        return addBetween(column, start, end, Connector.AND);
    }

    /**
     * Appends a raw SQL predicate. Nothing is bound or escaped.
     */
    public QueryBuilder whereRaw(String sql) {
        return addRaw(sql, Connector.AND);
    }

    public QueryBuilder orWhereEq(String column, Object value) {
        return addCondition(column, "=", value, Connector.OR);
    }

    public QueryBuilder orWhereNe(String column, Object value) {
        return addCondition(column, "!=", value, Connector.OR);
    }

    public QueryBuilder orWhereGt(String column, Object value) {
        return addCondition(column, ">", value, Connector.OR);
    }

    public QueryBuilder orWhereLt(String column, Object value) {
        return addCondition(column, "<", value, Connector.OR);
    }

    public QueryBuilder orWhereGte(String column, Object value) {
        return addCondition(column, ">=", value, Connector.OR);
    }

    public QueryBuilder orWhereLte(String column, Object value) {
        return addCondition(column, "<=", value, Connector.OR);
    }

    public QueryBuilder orWhereLike(String column, Object pattern) {
        return addCondition(column, "LIKE", pattern, Connector.OR);
    }

    public QueryBuilder orWhereNotLike(String column, Object pattern) {
        return addCondition(column, "NOT LIKE", pattern, Connector.OR);
    }

    public QueryBuilder orWhereNull(String column) {
        return addCondition(column, "IS", null, Connector.OR);
    }

    public QueryBuilder orWhereNotNull(String column) {
        return addCondition(column, "IS NOT", null, Connector.OR);
    }

    public QueryBuilder orWhereIn(String column, Collection<?> values) {
        return addIn(column, values, false, Connector.OR);
    }

    public QueryBuilder orWhereNotIn(String column, Collection<?> values) {
        return addIn(column, values, true, Connector.OR);
    }

    public QueryBuilder orWhereBetween(String column, Object start, Object end) {
        return addBetween(column, start, end, Connector.OR);
    }

    public QueryBuilder orWhereRaw(String sql) {
        return addRaw(sql, Connector.OR);
    }

    public QueryBuilder join(String table, String on) {
        return addJoin(JoinType.INNER, table, on);
    }

    public QueryBuilder leftJoin(String table, String on) {
        return addJoin(JoinType.LEFT, table, on);
    }

    public QueryBuilder rightJoin(String table, String on) {
        return addJoin(JoinType.RIGHT, table, on);
    }

    /**
     * Adds a FULL JOIN. MySQL and MariaDB reject it when the statement is built.
     */
    public QueryBuilder fullJoin(String table, String on) {
        return addJoin(JoinType.FULL, table, on);
    }

    public QueryBuilder orderBy(String column, OrderDirection direction) {
        orderBy.add(new OrderByClause(column, direction));
        return this;
    }

    public QueryBuilder orderBy(String column) {
        return orderBy(column, OrderDirection.ASC);
    }

    public QueryBuilder limit(long limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        this.limit = limit;
        return this;
    }

    public QueryBuilder offset(long offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        this.offset = offset;
        return this;
    }

    /**
     * Sets {@code LIMIT perPage OFFSET (page - 1) * perPage}. Pages are 1-based; page 0 is treated as 1
     * and the offset saturates instead of overflowing.
     */
    public QueryBuilder paginate(long page, long perPage) {
        if (page < 0 || perPage < 0) {
            throw new IllegalArgumentException("page and perPage must not be negative");
        }
        long skipped = Math.max(page - 1, 0);
        long start = perPage != 0 && skipped > Long.MAX_VALUE / perPage ? Long.MAX_VALUE : skipped * perPage;
        this.limit = perPage;
        this.offset = start;
        return this;
    }

    public QueryBuilder groupBy(String... columns) {
        Objects.requireNonNull(columns, "columns");
        for (String column : columns) {
            groupBy.add(Objects.requireNonNull(column, "column"));
        }
        return this;
    }

    /**
     * Columns for a {@code RETURNING} clause on INSERT, UPDATE, DELETE and upsert.
     * MySQL and MariaDB reject it when the statement is built.
     */
    public QueryBuilder returning(String... columns) {
        Objects.requireNonNull(columns, "columns");
        for (String column : columns) {
            returning.add(Objects.requireNonNull(column, "column"));
        }
        return this;
    }

    /**
     * @throws QueryException MISSING_CLAUSE without a table, UNSUPPORTED_FEATURE for FULL JOIN on MySQL/MariaDB
     */
    public RenderedSql build() {
        requireTable("from");
        StringBuilder sql = new StringBuilder("SELECT ");
        sql.append(String.join(", ", selectColumns));
        sql.append(" FROM ").append(dialect.quoteIdentifier(table));
        if (alias != null) {
            sql.append(" AS ").append(dialect.quoteIdentifier(alias));
        }
        appendJoins(sql);
        List<SqlValue> params = new ArrayList<>();
        appendWhere(sql, params, 1);
        if (!groupBy.isEmpty()) {
            sql.append(" GROUP BY ").append(joinQuoted(groupBy));
        }
        if (!orderBy.isEmpty()) {
            List<String> items = new ArrayList<>(orderBy.size());
            for (OrderByClause clause : orderBy) {
                items.add(dialect.quoteIdentifier(clause.column()) + " " + clause.direction().name());
            }
            sql.append(" ORDER BY ").append(String.join(", ", items));
        }
        sql.append(dialect.limitSyntax(limit, offset));
        return rendered("SELECT", sql, params);
    }

    /**
     * Insert in the map's iteration order. {@link SqlValue#NULL} and {@link SqlValue#DEFAULT}
     * are written as literals; everything else is bound.
     *
     * @throws QueryException MISSING_CLAUSE without a table, INVALID_SYNTAX for empty data,
     *     UNSUPPORTED_FEATURE for RETURNING on MySQL/MariaDB
     */
    public RenderedSql buildInsert(Map<String, ?> data) {
        requireTable("table");
        requireData(data, "INSERT");
        List<String> columns = new ArrayList<>(data.size());
        List<String> expressions = new ArrayList<>(data.size());
        List<SqlValue> params = new ArrayList<>();
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            columns.add(dialect.quoteIdentifier(entry.getKey()));
            expressions.add(valueExpression(SqlValue.of(entry.getValue()), params));
        }
        StringBuilder sql = new StringBuilder("INSERT INTO ")
            .append(dialect.quoteIdentifier(table))
            .append(" (").append(String.join(", ", columns)).append(")")
            .append(" VALUES (").append(String.join(", ", expressions)).append(")");
        appendReturning(sql);
        return rendered("INSERT", sql, params);
    }

    /**
     * Update with SET parameters numbered before WHERE parameters.
     *
     * @throws QueryException as for {@link #buildInsert(Map)}
     */
    public RenderedSql buildUpdate(Map<String, ?> data) {
        requireTable("table");
        requireData(data, "UPDATE");
        List<String> assignments = new ArrayList<>(data.size());
        List<SqlValue> params = new ArrayList<>();
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            String expression = valueExpression(SqlValue.of(entry.getValue()), params);
            assignments.add(dialect.quoteIdentifier(entry.getKey()) + " = " + expression);
        }
        StringBuilder sql = new StringBuilder("UPDATE ")
            .append(dialect.quoteIdentifier(table))
            .append(" SET ").append(String.join(", ", assignments));
        appendWhere(sql, params, params.size() + 1);
        appendReturning(sql);
        return rendered("UPDATE", sql, params);
    }

    public RenderedSql buildDelete() {
        requireTable("table");
        StringBuilder sql = new StringBuilder("DELETE FROM ").append(dialect.quoteIdentifier(table));
        List<SqlValue> params = new ArrayList<>();
        appendWhere(sql, params, 1);
        appendReturning(sql);
        return rendered("DELETE", sql, params);
    }

    /**
     * Insert-or-update keyed on {@code conflictColumns}; every value is bound. MySQL and MariaDB
     * ignore the conflict columns and rely on the table's unique keys.
     *
     * @throws QueryException INVALID_SYNTAX for empty data, for DEFAULT values, or for missing
     *     conflict columns on PostgreSQL/SQLite
     */
    public RenderedSql buildUpsert(Map<String, ?> data, List<String> conflictColumns) {
        requireTable("table");
        requireData(data, "UPSERT");
        Objects.requireNonNull(conflictColumns, "conflictColumns");
        if (conflictColumns.isEmpty() && !backend.isMySqlFamily()) {
            throw QueryException.invalidSyntax(backend, "No conflict columns provided for UPSERT");
        }
        List<String> columns = new ArrayList<>(data.size());
        List<SqlValue> params = new ArrayList<>(data.size());
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            SqlValue value = SqlValue.of(entry.getValue());
            if (value instanceof SqlValue.DefaultValue) {
                throw QueryException.invalidSyntax(backend, "DEFAULT is not allowed in UPSERT for " + entry.getKey());
            }
            columns.add(dialect.quoteIdentifier(entry.getKey()));
            params.add(value);
        }
        StringBuilder sql = new StringBuilder(
            dialect.upsertSyntax(dialect.quoteIdentifier(table), columns, quoteAll(conflictColumns))
        );
        appendReturning(sql);
        return rendered("UPSERT", sql, params);
    }

    public DatabaseBackend backend() {
        return backend;
    }

    public SqlDialect dialect() {
        return dialect;
    }

    public List<WhereCondition> whereConditions() {
        return Collections.unmodifiableList(whereConditions);
    }

    private QueryBuilder addCondition(String column, String operator, Object value, Connector connector) {
        Objects.requireNonNull(column, "column");
        whereConditions.add(new WhereCondition(column, operator, SqlValue.of(value), connector));
        return this;
    }

    private QueryBuilder addIn(String column, Collection<?> values, boolean negated, Connector connector) {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(values, "values");
        if (values.isEmpty()) {
            return addRaw(negated ? "1 = 1" : "1 = 0", connector);
        }
        List<String> literals = new ArrayList<>(values.size());
        for (Object value : values) {
            literals.add(SqlValue.of(value).toSqlLiteral(dialect));
        }
        String operator = (negated ? "NOT IN (" : "IN (") + String.join(", ", literals) + ")";
        whereConditions.add(new WhereCondition(column, operator, SqlValue.NULL, connector));
        return this;
    }

    private QueryBuilder addBetween(String column, Object start, Object end, Connector connector) {
        Objects.requireNonNull(column, "column");
        String operator = "BETWEEN " + SqlValue.of(start).toSqlLiteral(dialect)
            + " AND " + SqlValue.of(end).toSqlLiteral(dialect);
        whereConditions.add(new WhereCondition(column, operator, SqlValue.NULL, connector));
        return this;
    }

    private QueryBuilder addRaw(String sql, Connector connector) {
        Objects.requireNonNull(sql, "sql");
        whereConditions.add(new WhereCondition("", sql, SqlValue.NULL, connector));
        return this;
    }

    private QueryBuilder addJoin(JoinType type, String table, String on) {
        joins.add(new JoinClause(type, table, on));
        return this;
    }

    private void requireTable(String clause) {
        if (table == null) {
            throw QueryException.missingClause(clause);
        }
    }

    private void requireData(Map<String, ?> data, String statement) {
        if (data == null || data.isEmpty()) {
            throw QueryException.invalidSyntax(backend, "No data provided for " + statement);
        }
    }

    private void appendJoins(StringBuilder sql) {
        for (JoinClause join : joins) {
            if (join.type() == JoinType.FULL && !dialect.supportsFullJoin()) {
                throw QueryException.unsupportedFeature(backend, "FULL JOIN");
            }
            sql.append(' ').append(join.type().keyword()).append(' ');
            String[] parts = join.table().trim().split("\\s+");
            if (parts.length == 3 && parts[1].equalsIgnoreCase("AS")) {
                sql.append(dialect.quoteIdentifier(parts[0])).append(" AS ").append(parts[2]);
            } else if (parts.length == 2) {
                sql.append(dialect.quoteIdentifier(parts[0])).append(' ').append(parts[1]);
            } else {
                sql.append(dialect.quoteIdentifier(join.table()));
            }
            sql.append(" ON ").append(join.on());
        }
    }

    private void appendWhere(StringBuilder sql, List<SqlValue> params, int firstPosition) {
        if (whereConditions.isEmpty()) {
            return;
        }
        int position = firstPosition;
        sql.append(" WHERE ");
        for (int i = 0; i < whereConditions.size(); i++) {
            WhereCondition condition = whereConditions.get(i);
            if (i > 0) {
                sql.append(' ').append(condition.connector().name()).append(' ');
            }
            if (condition.isRaw()) {
                sql.append(condition.operator());
                continue;
            }
            sql.append(dialect.quoteIdentifier(condition.column())).append(' ').append(condition.operator());
            if (condition.isNullCheck()) {
                sql.append(" NULL");
            } else if (!condition.isEmbedded()) {
                sql.append(' ').append(placeholder(condition.value(), position++));
                params.add(condition.value());
            }
        }
    }

    private void appendReturning(StringBuilder sql) {
        if (returning.isEmpty()) {
            return;
        }
        Optional<String> clause = dialect.returningSyntax(returning);
        if (clause.isEmpty()) {
            throw QueryException.unsupportedFeature(backend, "RETURNING");
        }
        sql.append(clause.get());
    }

    // NULL and DEFAULT are literals; anything else takes the next placeholder.
    private String valueExpression(SqlValue value, List<SqlValue> params) {
        if (value instanceof SqlValue.NullValue || value instanceof SqlValue.DefaultValue) {
            return value.toSqlLiteral(dialect);
        }
        params.add(value);
        return placeholder(value, params.size());
    }

    private String placeholder(SqlValue value, int position) {
        if (dialect instanceof PostgresDialect postgres && value instanceof SqlValue.EnumValue enumValue) {
            return postgres.placeholderWithCast(position, enumValue.typeName());
        }
        return dialect.placeholder(position);
    }

    private String joinQuoted(List<String> columns) {
        return String.join(", ", quoteAll(columns));
    }

    private List<String> quoteAll(List<String> columns) {
        List<String> quoted = new ArrayList<>(columns.size());
        for (String column : columns) {
            quoted.add(dialect.quoteIdentifier(column));
        }
        return quoted;
    }

    private RenderedSql rendered(String statement, StringBuilder sql, List<SqlValue> params) {
        String text = sql.toString();
        LOGGER.debug("Built {} for {}: {} ({} params)", statement, backend, text, params.size());
        return new RenderedSql(text, params);
    }
}
