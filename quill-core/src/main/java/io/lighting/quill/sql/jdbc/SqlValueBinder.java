package io.lighting.quill.sql.jdbc;

import io.lighting.quill.sql.RenderedSql;
import io.lighting.quill.sql.SqlValue;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Objects;

/**
 * Binds {@link SqlValue} parameters to JDBC statements, one value per {@code ?} in order.
 * PostgreSQL {@code $N} text targets native drivers and is not rewritten here.
 */
public final class SqlValueBinder {
    private SqlValueBinder() {
    }

    public static PreparedStatement prepare(Connection connection, RenderedSql renderedSql) throws SQLException {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(renderedSql, "renderedSql");
        PreparedStatement statement = connection.prepareStatement(renderedSql.sql());
        try {
            bind(statement, renderedSql.params());
        } catch (SQLException | RuntimeException ex) {
            statement.close();
            throw ex;
        }
        return statement;
    }

    public static void bind(PreparedStatement statement, List<SqlValue> params) throws SQLException {
        Objects.requireNonNull(statement, "statement");
        for (int i = 0; i < params.size(); i++) {
            int index = i + 1;
            SqlValue value = params.get(i);
            if (value instanceof SqlValue.NullValue) {
                statement.setNull(index, Types.NULL);
            } else if (value instanceof SqlValue.DefaultValue) {
                throw new IllegalArgumentException("DEFAULT cannot be bound at parameter " + index);
            } else if (value instanceof SqlValue.BytesValue bytes) {
                statement.setBytes(index, bytes.value());
            } else if (value instanceof SqlValue.TextValue
                || value instanceof SqlValue.EnumValue
                || value instanceof SqlValue.JsonValue) {
                statement.setString(index, (String) value.jdbcValue());
            } else {
                statement.setObject(index, value.jdbcValue());
            }
        }
    }
}
