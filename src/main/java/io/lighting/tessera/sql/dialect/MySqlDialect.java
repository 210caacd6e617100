package io.lighting.tessera.sql.dialect;

import java.time.temporal.TemporalAmount;
import java.util.Objects;

/**
 * MySQL and MariaDB: backtick identifiers, backslash escapes in string literals.
 */
public final class MySqlDialect extends AnsiDialect {
    public MySqlDialect() {
        this("mysql");
    }

    public MySqlDialect(String id) {
        super(id, "`", "`", false);
    }

    @Override
    public String quoteLiteral(String value) {
        Objects.requireNonNull(value, "value");
        StringBuilder out = new StringBuilder(value.length() + 2);
        out.append('\'');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '\\' -> out.append("\\\\");
                case '\'' -> out.append("\\'");
                case '\0' -> out.append("\\0");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\u001A' -> out.append("\\Z");
                default -> out.append(ch);
            }
        }
        return out.append('\'').toString();
    }

    /**
     * MySQL has no interval type; durations are written as TIME literals.
     */
    @Override
    public String formatInterval(TemporalAmount value) {
        Objects.requireNonNull(value, "value");
        return "'" + dayTime(toDuration(value)) + "'";
    }
}
