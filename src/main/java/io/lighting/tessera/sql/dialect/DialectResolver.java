package io.lighting.tessera.sql.dialect;

import io.lighting.tessera.sql.Dialect;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Stream;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks a {@link Dialect} from JDBC metadata. Candidates are tried in order, so MariaDB is checked
 * before MySQL (its drivers also report "mysql").
 */
public final class DialectResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(DialectResolver.class);

    private static final List<Candidate> CANDIDATES = List.of(
        new Candidate(List.of("mariadb"), () -> new MySqlDialect("mariadb")),
        new Candidate(List.of("mysql"), MySqlDialect::new),
        new Candidate(List.of("postgres"), () -> new AnsiDialect("postgres", "\"")),
        new Candidate(List.of("h2"), () -> new AnsiDialect("h2", "\"")),
        new Candidate(List.of("sqlite"), () -> new AnsiDialect("sqlite", "\"")),
        new Candidate(List.of("oracle"), OracleDialect::new),
        new Candidate(List.of("sql server", "sqlserver"), () -> new AnsiDialect("sqlserver", "[", "]", false))
    );

    private DialectResolver() {
    }

    public static Dialect resolve(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource");
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData meta = connection.getMetaData();
            Dialect dialect = resolve(meta.getDatabaseProductName(), meta.getDriverName(), meta.getURL());
            LOGGER.debug("Resolved dialect {} for {}", dialect.id(), meta.getDatabaseProductName());
            return dialect;
        } catch (SQLException ex) {
            throw new IllegalStateException("Failed to resolve dialect from dataSource", ex);
        }
    }

    static Dialect resolve(String productName, String driverName, String url) {
        // product, driver and url are searched together
        String haystack = Stream.of(productName, driverName, url)
            .filter(Objects::nonNull)
            .map(value -> value.toLowerCase(Locale.ROOT))
            .reduce("", (left, right) -> left + '\n' + right);
        for (Candidate candidate : CANDIDATES) {
            if (candidate.matches(haystack)) {
                return candidate.factory().get();
            }
        }
        return new AnsiDialect();
    }

    private record Candidate(List<String> tokens, Supplier<Dialect> factory) {
        boolean matches(String haystack) {
            return tokens.stream().anyMatch(haystack::contains);
        }
    }
}
