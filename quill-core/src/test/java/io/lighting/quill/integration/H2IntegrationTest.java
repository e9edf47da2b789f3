package io.lighting.quill.integration;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.lighting.quill.sql.DatabaseBackend;
import io.lighting.quill.sql.OrderByClause.OrderDirection;
import io.lighting.quill.sql.QueryBuilder;
import io.lighting.quill.sql.RenderedSql;
import io.lighting.quill.sql.dialect.DialectResolver;
import io.lighting.quill.sql.jdbc.SqlValueBinder;
import io.lighting.quill.value.Values;
import io.lighting.quill.view.InMemoryTemplateSource;
import io.lighting.quill.view.ViewEngine;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.sql.DataSource;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

class H2IntegrationTest {

    @Test
    void rendersQueryResultsThroughViews() throws SQLException {
        DataSource dataSource = dataSource();
        DatabaseBackend backend = DialectResolver.resolve(dataSource);
        try (Connection connection = dataSource.getConnection()) {
            initializeSchema(connection);
            seedOrders(connection, backend);

            RenderedSql select = new QueryBuilder(backend)
                .from("orders")
                .whereIn("status", List.of("NEW", "PAID"))
                .orderBy("total", OrderDirection.DESC)
                .build();
            List<Map<String, Object>> rows = new ArrayList<>();
            try (PreparedStatement statement = SqlValueBinder.prepare(connection, select);
                 ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("status", rs.getString("status"));
                    row.put("total", rs.getInt("total"));
                    rows.add(row);
                }
            }

            ViewEngine engine = ViewEngine.builder()
                .source(new InMemoryTemplateSource()
                    .put("orders.html", "@{foreach o in M.orders}@{o.status}=@{o.total};@{end}"))
                .build();
            String html = engine.render("orders", Values.objectOf("orders", rows));

            assertEquals("PAID=30;NEW=20;NEW=10;", html);
        }
    }

    private static DataSource dataSource() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:quill_orders;DB_CLOSE_DELAY=-1");
        return dataSource;
    }

    private static void initializeSchema(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("DROP TABLE IF EXISTS \"orders\"");
            statement.execute(
                "CREATE TABLE \"orders\" (\"id\" INT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, \"status\" VARCHAR(16), \"total\" INT)"
            );
        }
    }

    private static void seedOrders(Connection connection, DatabaseBackend backend) throws SQLException {
        Object[][] orders = {{"NEW", 10}, {"NEW", 20}, {"PAID", 30}, {"VOID", 40}};
        for (Object[] order : orders) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("status", order[0]);
            data.put("total", order[1]);
            try (PreparedStatement statement = SqlValueBinder.prepare(
                connection,
                new QueryBuilder(backend).from("orders").buildInsert(data)
            )) {
                statement.executeUpdate();
            }
        }
    }
}
