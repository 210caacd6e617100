package io.lighting.tessera.sql.dialect;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.TemporalAccessor;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Oracle has no multi-row VALUES list, so multi-inserts are rendered as {@code SELECT ... UNION ALL}.
 */
public final class OracleDialect extends AnsiDialect {
    public OracleDialect() {
        super("oracle", "\"", "\"", true);
    }

    @Override
    public String quoteBinary(byte[] value) {
        Objects.requireNonNull(value, "value");
        return "HEXTORAW('" + HexFormat.of().withUpperCase().formatHex(value) + "')";
    }

    @Override
    public String formatDateTime(TemporalAccessor value) {
        Objects.requireNonNull(value, "value");
        if (value instanceof LocalDate date) {
            return "TO_DATE('" + DATE.format(date) + "', 'YYYY-MM-DD')";
        }
        if (value instanceof LocalTime) {
            throw new IllegalArgumentException("oracle has no TIME type: " + value);
        }
        return "TO_TIMESTAMP('" + DATE_TIME.format(toLocalDateTime(value)) + "', 'YYYY-MM-DD HH24:MI:SS.FF6')";
    }
}
