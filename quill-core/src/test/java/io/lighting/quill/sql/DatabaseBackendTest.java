package io.lighting.quill.sql;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lighting.quill.sql.dialect.MySqlDialect;
import io.lighting.quill.sql.dialect.PostgresDialect;
import io.lighting.quill.sql.dialect.SqliteDialect;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DatabaseBackendTest {

    @Test
    void parsesUrlsAndNames() {
        assertEquals(DatabaseBackend.POSTGRES, DatabaseBackend.fromUrl("postgres://localhost/app"));
        assertEquals(DatabaseBackend.POSTGRES, DatabaseBackend.fromUrl("jdbc:postgresql://localhost/app"));
        assertEquals(DatabaseBackend.MYSQL, DatabaseBackend.fromUrl("mysql://root@localhost/app"));
        assertEquals(DatabaseBackend.MARIADB, DatabaseBackend.fromUrl("jdbc:mariadb://localhost/app"));
        assertEquals(DatabaseBackend.SQLITE, DatabaseBackend.fromUrl("sqlite://data.db"));
        assertThrows(IllegalArgumentException.class, () -> DatabaseBackend.fromUrl("oracle:thin"));

        assertEquals(DatabaseBackend.POSTGRES, DatabaseBackend.fromName(" PG "));
        assertEquals(DatabaseBackend.SQLITE, DatabaseBackend.fromName("sqlite3"));
        assertThrows(IllegalArgumentException.class, () -> DatabaseBackend.fromName("db2"));
    }

    @Test
    void mapsBackendsToDialects() {
        assertSame(PostgresDialect.INSTANCE, DatabaseBackend.POSTGRES.dialect());
        assertSame(MySqlDialect.MYSQL, DatabaseBackend.MYSQL.dialect());
        assertSame(MySqlDialect.MARIADB, DatabaseBackend.MARIADB.dialect());
        assertSame(SqliteDialect.INSTANCE, DatabaseBackend.SQLITE.dialect());
        assertEquals(DatabaseBackend.MARIADB, MySqlDialect.MARIADB.backend());
        assertTrue(DatabaseBackend.MARIADB.isMySqlFamily());
        assertFalse(DatabaseBackend.SQLITE.isMySqlFamily());
    }

    @Test
    void quotesIdentifiers() {
        assertEquals("\"a\"\"b\"", PostgresDialect.INSTANCE.quoteIdentifier("a\"b"));
        assertEquals("`a``b`", MySqlDialect.MYSQL.quoteIdentifier("a`b"));
        assertEquals("users.id", SqliteDialect.INSTANCE.quoteIdentifier("users.id"));
        assertThrows(IllegalArgumentException.class, () -> SqliteDialect.INSTANCE.quoteIdentifier(" "));
    }

    @Test
    void rendersPlaceholdersAndPaging() {
        assertEquals("$3", PostgresDialect.INSTANCE.placeholder(3));
        assertEquals("$2::mood", PostgresDialect.INSTANCE.placeholderWithCast(2, "mood"));
        assertEquals("$2", PostgresDialect.INSTANCE.placeholderWithCast(2, " "));
        assertEquals("?", MySqlDialect.MARIADB.placeholder(9));
        assertEquals("", PostgresDialect.INSTANCE.limitSyntax(null, null));
        assertEquals(" LIMIT 5", MySqlDialect.MYSQL.limitSyntax(5L, null));
        assertEquals(" LIMIT 5 OFFSET 10", SqliteDialect.INSTANCE.limitSyntax(5L, 10L));
    }

    @Test
    void describesBackendCapabilities() {
        assertEquals(Optional.of(" RETURNING id"), SqliteDialect.INSTANCE.returningSyntax(List.of("id")));
        assertEquals(Optional.empty(), MySqlDialect.MYSQL.returningSyntax(List.of("id")));
        assertFalse(MySqlDialect.MARIADB.supportsFullJoin());
        assertTrue(PostgresDialect.INSTANCE.supportsFullJoin());
        assertEquals("CURRENT_TIMESTAMP()", MySqlDialect.MYSQL.currentTimestamp());
        assertEquals("INTEGER", SqliteDialect.INSTANCE.booleanType());
        assertEquals("TEXT", PostgresDialect.INSTANCE.stringType(1000));
    }
}
