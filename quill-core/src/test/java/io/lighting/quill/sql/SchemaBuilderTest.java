package io.lighting.quill.sql;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class SchemaBuilderTest {

    @Test
    void createsPostgresTable() {
        String ddl = new SchemaBuilder(DatabaseBackend.POSTGRES)
            .createTable("users")
            .id()
            .string("email", 255).notNull().unique()
            .string("bio", null)
            .bool("active")
            .bigInteger("visits").defaultValue("0")
            .timestampDefaultNow("created_at")
            .build();

        assertEquals(
            "CREATE TABLE \"users\" (\n"
                + "  \"id\" SERIAL PRIMARY KEY,\n"
                + "  \"email\" VARCHAR(255) NOT NULL UNIQUE,\n"
                + "  \"bio\" TEXT,\n"
                + "  \"active\" BOOLEAN NOT NULL DEFAULT FALSE,\n"
                + "  \"visits\" BIGINT DEFAULT 0,\n"
                + "  \"created_at\" TIMESTAMP DEFAULT CURRENT_TIMESTAMP\n"
                + ")",
            ddl
        );
    }

    @Test
    void createsMySqlTable() {
        String ddl = new SchemaBuilder(DatabaseBackend.MYSQL)
            .createTable("posts")
            .id()
            .string("title", 200)
            .string("body", 5000)
            .string("raw", null)
            .bool("published")
            .timestamp("published_at")
            .build();

        assertEquals(
            "CREATE TABLE `posts` (\n"
                + "  `id` INT AUTO_INCREMENT PRIMARY KEY,\n"
                + "  `title` VARCHAR(200),\n"
                + "  `body` TEXT,\n"
                + "  `raw` LONGTEXT,\n"
                + "  `published` TINYINT(1) NOT NULL DEFAULT FALSE,\n"
                + "  `published_at` DATETIME\n"
                + ")",
            ddl
        );
    }

    @Test
    void createsSqliteTableWithConstraints() {
        String ddl = new SchemaBuilder(DatabaseBackend.SQLITE)
            .createTable("memberships")
            .id()
            .integer("user_id").notNull()
            .integer("group_id").notNull()
            .string("role", 20).defaultValue("'member'")
            .constraint("UNIQUE (user_id, group_id)")
            .build();

        assertEquals(
            "CREATE TABLE \"memberships\" (\n"
                + "  \"id\" INTEGER PRIMARY KEY AUTOINCREMENT,\n"
                + "  \"user_id\" INTEGER NOT NULL,\n"
                + "  \"group_id\" INTEGER NOT NULL,\n"
                + "  \"role\" TEXT DEFAULT 'member',\n"
                + "  UNIQUE (user_id, group_id)\n"
                + ")",
            ddl
        );
    }

    @Test
    void primaryKeyNeverGetsNotNull() {
        String ddl = new SchemaBuilder(DatabaseBackend.POSTGRES).createTable("t").id().notNull().build();
        assertEquals("CREATE TABLE \"t\" (\n  \"id\" SERIAL PRIMARY KEY\n)", ddl);
    }

    @Test
    void rejectsModifiersWithoutColumnAndEmptyTables() {
        SchemaBuilder schema = new SchemaBuilder(DatabaseBackend.SQLITE);
        assertThrows(IllegalStateException.class, () -> schema.createTable("t").notNull());
        QueryException ex = assertThrows(QueryException.class, () -> schema.createTable("t").build());
        assertEquals(QueryException.Kind.INVALID_SYNTAX, ex.kind());
    }
}
