package io.lighting.tessera.sql.dialect;

import io.lighting.tessera.sql.Dialect;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DialectResolverTest {
    @Test
    void resolvesKnownProducts() {
        assertDialect("mariadb", "MariaDB", "MariaDB JDBC", "jdbc:mariadb://", "`id`");
        assertDialect("mysql", "MySQL", "MySQL Connector/J", "jdbc:mysql://", "`id`");
        assertDialect("postgres", "PostgreSQL", "PostgreSQL JDBC Driver", "jdbc:postgresql://", "\"id\"");
        assertDialect("h2", "H2", "H2 JDBC Driver", "jdbc:h2:mem:", "\"id\"");
        assertDialect("sqlite", "SQLite", "SQLite JDBC", "jdbc:sqlite::memory:", "\"id\"");
    }

    @Test
    void resolvesOracleDialect() {
        Dialect dialect = DialectResolver.resolve("Oracle", "Oracle JDBC", "jdbc:oracle:thin:@localhost");
        assertEquals("oracle", dialect.id());
        assertEquals("\"id\"", dialect.quoteIdent("id"));
        assertTrue(dialect.supportsMultiInsertAsSelect());
    }

    @Test
    void resolvesSqlServerDialect() {
        Dialect dialect = DialectResolver.resolve(
            "Microsoft SQL Server",
            "Microsoft JDBC Driver for SQL Server",
            "jdbc:sqlserver://localhost"
        );
        assertEquals("sqlserver", dialect.id());
        assertEquals("[id]", dialect.quoteIdent("id"));
        assertEquals("[a]]b]", dialect.quoteIdent("a]b"));
        assertFalse(dialect.supportsMultiInsertAsSelect());
    }

    @Test
    void fallsBackToAnsi() {
        Dialect dialect = DialectResolver.resolve("UnknownDB", null, null);
        assertEquals("ansi", dialect.id());
        assertEquals("\"id\"", dialect.quoteIdent("id"));
    }

    private static void assertDialect(
        String expectedId,
        String productName,
        String driverName,
        String url,
        String quoted
    ) {
        Dialect dialect = DialectResolver.resolve(productName, driverName, url);
        assertEquals(expectedId, dialect.id());
        assertEquals(quoted, dialect.quoteIdent("id"));
    }
}
