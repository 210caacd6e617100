package io.lighting.tessera.sql;

import java.util.List;
import java.util.Objects;

/**
 * Preprocessed statement: SQL text plus the values to bind, in order, against its {@code ?} markers.
 */
public record RenderedSql(String sql, List<Object> params) {
    public RenderedSql {
        Objects.requireNonNull(sql, "sql");
        Objects.requireNonNull(params, "params");
        params = List.copyOf(params);
    }
}
