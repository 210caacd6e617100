package io.lighting.tessera.sql;

import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalAmount;

public interface Dialect {
    String id();

    /**
     * Delimits a single identifier segment. Dotted names are split by the caller.
     */
    String quoteIdent(String ident);

    String quoteLiteral(String value);

    String quoteBinary(byte[] value);

    String formatDateTime(TemporalAccessor value);

    String formatInterval(TemporalAmount value);

    /**
     * Whether multi-row inserts must be written as {@code SELECT ... UNION ALL SELECT ...}
     * instead of a {@code VALUES (...), (...)} list.
     */
    default boolean supportsMultiInsertAsSelect() {
        return false;
    }
}
