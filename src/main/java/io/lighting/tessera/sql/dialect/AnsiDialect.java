package io.lighting.tessera.sql.dialect;

import io.lighting.tessera.sql.Dialect;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.Period;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalAmount;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

public class AnsiDialect implements Dialect {
    protected static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");
    protected static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE;
    protected static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss.SSSSSS");

    private final String id;
    private final String quoteStart;
    private final String quoteEnd;
    private final boolean multiInsertAsSelect;

    public AnsiDialect() {
        this("ansi", "\"", "\"", false);
    }

    public AnsiDialect(String id, String quote) {
        this(id, quote, quote, false);
    }

    public AnsiDialect(String id, String quoteStart, String quoteEnd, boolean multiInsertAsSelect) {
        this.id = Objects.requireNonNull(id, "id");
        this.quoteStart = Objects.requireNonNull(quoteStart, "quoteStart");
        this.quoteEnd = Objects.requireNonNull(quoteEnd, "quoteEnd");
        this.multiInsertAsSelect = multiInsertAsSelect;
        if (this.id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (this.quoteStart.isBlank() || this.quoteEnd.isBlank()) {
            throw new IllegalArgumentException("quote must not be blank");
        }
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String quoteIdent(String ident) {
        Objects.requireNonNull(ident, "ident");
        if (ident.isBlank()) {
            throw new IllegalArgumentException("ident must not be blank");
        }
        return quoteStart + ident.replace(quoteEnd, quoteEnd + quoteEnd) + quoteEnd;
    }

    @Override
    public String quoteLiteral(String value) {
        Objects.requireNonNull(value, "value");
        return "'" + value.replace("'", "''") + "'";
    }

    @Override
    public String quoteBinary(byte[] value) {
        Objects.requireNonNull(value, "value");
        return "X'" + HexFormat.of().withUpperCase().formatHex(value) + "'";
    }

    @Override
    public String formatDateTime(TemporalAccessor value) {
        Objects.requireNonNull(value, "value");
        if (value instanceof LocalDate date) {
            return "'" + DATE.format(date) + "'";
        }
        if (value instanceof LocalTime time) {
            return "'" + TIME.format(time) + "'";
        }
        return "'" + DATE_TIME.format(toLocalDateTime(value)) + "'";
    }

    @Override
    public String formatInterval(TemporalAmount value) {
        Objects.requireNonNull(value, "value");
        if (value instanceof Period period && (period.getYears() != 0 || period.getMonths() != 0)) {
            if (period.getDays() != 0) {
                throw new IllegalArgumentException("Cannot mix months and days in one interval: " + period);
            }
            long months = period.toTotalMonths();
            return "INTERVAL '" + (months < 0 ? "-" : "") + Math.abs(months / 12) + "-" + Math.abs(months % 12)
                + "' YEAR TO MONTH";
        }
        return "INTERVAL '" + dayTime(toDuration(value)) + "' DAY TO SECOND";
    }

    @Override
    public boolean supportsMultiInsertAsSelect() {
        return multiInsertAsSelect;
    }

    /**
     * Wall-clock value of a date-time; instants are shown in the system zone.
     */
    protected LocalDateTime toLocalDateTime(TemporalAccessor value) {
        if (value instanceof LocalDateTime dateTime) {
            return dateTime;
        }
        if (value instanceof OffsetDateTime dateTime) {
            return dateTime.toLocalDateTime();
        }
        if (value instanceof ZonedDateTime dateTime) {
            return dateTime.toLocalDateTime();
        }
        if (value instanceof Instant instant) {
            return LocalDateTime.ofInstant(instant, ZoneId.systemDefault());
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay();
        }
        return LocalDateTime.from(value);
    }

    protected Duration toDuration(TemporalAmount value) {
        if (value instanceof Duration duration) {
            return duration;
        }
        if (value instanceof Period period && period.getYears() == 0 && period.getMonths() == 0) {
            return Duration.ofDays(period.getDays());
        }
        throw new IllegalArgumentException("Unsupported interval for " + id + ": " + value);
    }

    /**
     * {@code [-]D HH:MM:SS.ffffff}
     */
    protected static String dayTime(Duration duration) {
        Duration abs = duration.abs();
        return String.format(
            Locale.ROOT,
            "%s%d %02d:%02d:%02d.%06d",
            duration.isNegative() ? "-" : "",
            abs.toDays(),
            abs.toHoursPart(),
            abs.toMinutesPart(),
            abs.toSecondsPart(),
            abs.toNanosPart() / 1000
        );
    }
}
