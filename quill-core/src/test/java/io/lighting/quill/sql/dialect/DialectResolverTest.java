package io.lighting.quill.sql.dialect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.lighting.quill.sql.DatabaseBackend;
import java.lang.reflect.Proxy;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

class DialectResolverTest {

    @Test
    void resolvesFromProductDriverOrUrl() {
        assertEquals(DatabaseBackend.POSTGRES, DialectResolver.resolve("PostgreSQL", "PostgreSQL JDBC Driver", null));
        assertEquals(DatabaseBackend.MYSQL, DialectResolver.resolve("MySQL", null, "jdbc:mysql://db/app"));
        assertEquals(DatabaseBackend.MARIADB, DialectResolver.resolve("MySQL", "MariaDB Connector/J", "jdbc:mariadb://db"));
        assertEquals(DatabaseBackend.SQLITE, DialectResolver.resolve("SQLite", "SQLite JDBC", "jdbc:sqlite:app.db"));
        assertEquals(DatabaseBackend.SQLITE, DialectResolver.resolve(null, null, null));
    }

    @Test
    void resolvesH2DataSourceToAnsiDialect() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:resolver;DB_CLOSE_DELAY=-1");
        assertEquals(DatabaseBackend.SQLITE, DialectResolver.resolve(dataSource));
    }

    @Test
    void wrapsConnectionFailures() {
        DataSource broken = (DataSource) Proxy.newProxyInstance(
            DataSource.class.getClassLoader(),
            new Class<?>[] {DataSource.class},
            (proxy, method, args) -> {
                throw new SQLException("down");
            }
        );
        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> DialectResolver.resolve(broken));
        assertEquals("down", ex.getCause().getMessage());
    }
}
