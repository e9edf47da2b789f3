package io.lighting.quill.sql.dialect;

import io.lighting.quill.sql.DatabaseBackend;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Objects;
import javax.sql.DataSource;

/**
 * Picks a backend from JDBC metadata. Databases other than PostgreSQL, MySQL and MariaDB
 * (SQLite, H2 and other ANSI databases) share the SQLite dialect: double-quoted identifiers,
 * {@code ?} placeholders and {@code LIMIT}/{@code OFFSET}.
 */
public final class DialectResolver {
    private DialectResolver() {
    }

    public static DatabaseBackend resolve(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource");
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData meta = connection.getMetaData();
            return resolve(meta.getDatabaseProductName(), meta.getDriverName(), meta.getURL());
        } catch (SQLException ex) {
            throw new IllegalStateException("Failed to resolve database backend from dataSource", ex);
        }
    }

    static DatabaseBackend resolve(String productName, String driverName, String url) {
        String product = normalize(productName);
        String driver = normalize(driverName);
        String jdbcUrl = normalize(url);
        if (matches(product, driver, jdbcUrl, "mariadb")) {
            return DatabaseBackend.MARIADB;
        }
        if (matches(product, driver, jdbcUrl, "mysql")) {
            return DatabaseBackend.MYSQL;
        }
        if (matches(product, driver, jdbcUrl, "postgres")) {
            return DatabaseBackend.POSTGRES;
        }
        return DatabaseBackend.SQLITE;
    }

    private static boolean matches(String product, String driver, String url, String token) {
        return product.contains(token) || driver.contains(token) || url.contains(token);
    }

    private static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase(Locale.ROOT);
    }
}
