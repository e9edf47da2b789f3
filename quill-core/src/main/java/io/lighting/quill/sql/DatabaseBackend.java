package io.lighting.quill.sql;

import io.lighting.quill.sql.dialect.MySqlDialect;
import io.lighting.quill.sql.dialect.PostgresDialect;
import io.lighting.quill.sql.dialect.SqliteDialect;
import java.util.Locale;
import java.util.Objects;

public enum DatabaseBackend {
    POSTGRES,
    MYSQL,
    MARIADB,
    SQLITE;

    public SqlDialect dialect() {
        return switch (this) {
            case POSTGRES -> PostgresDialect.INSTANCE;
            case MYSQL -> MySqlDialect.MYSQL;
            case MARIADB -> MySqlDialect.MARIADB;
            case SQLITE -> SqliteDialect.INSTANCE;
        };
    }

    public boolean isMySqlFamily() {
        return this == MYSQL || this == MARIADB;
    }

    /**
     * Maps a connection URL scheme ({@code postgres://}, {@code mysql://}, {@code jdbc:sqlite:}, ...)
     * to a backend.
     */
    public static DatabaseBackend fromUrl(String url) {
        Objects.requireNonNull(url, "url");
        String normalized = url.toLowerCase(Locale.ROOT);
        if (normalized.startsWith("jdbc:")) {
            normalized = normalized.substring(5);
        }
        if (normalized.startsWith("postgresql:") || normalized.startsWith("postgres:")) {
            return POSTGRES;
        }
        if (normalized.startsWith("mariadb:")) {
            return MARIADB;
        }
        if (normalized.startsWith("mysql:")) {
            return MYSQL;
        }
        if (normalized.startsWith("sqlite:")) {
            return SQLITE;
        }
        throw new IllegalArgumentException("Unsupported database URL scheme: " + url);
    }

    /**
     * Parses a backend name as used in configuration ({@code postgres}, {@code postgresql},
     * {@code mysql}, {@code mariadb}, {@code sqlite}).
     */
    public static DatabaseBackend fromName(String name) {
        Objects.requireNonNull(name, "name");
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "postgres", "postgresql", "pg" -> POSTGRES;
            case "mysql" -> MYSQL;
            case "mariadb" -> MARIADB;
            case "sqlite", "sqlite3" -> SQLITE;
            default -> throw new IllegalArgumentException("Unknown database backend: " + name);
        };
    }
}
