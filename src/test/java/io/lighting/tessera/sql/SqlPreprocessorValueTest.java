package io.lighting.tessera.sql;

import static io.lighting.tessera.sql.SqlPreprocessorTest.map;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.lighting.tessera.row.ActiveRow;
import io.lighting.tessera.sql.dialect.AnsiDialect;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.Period;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class SqlPreprocessorValueTest {
    private final SqlPreprocessor preprocessor = new SqlPreprocessor(new AnsiDialect());

    enum Color {
        RED
    }

    enum Status implements BackedValue {
        ACTIVE("A"),
        CLOSED("C");

        private final String code;

        Status(String code) {
            this.code = code;
        }

        @Override
        public Object backingValue() {
            return code;
        }
    }

    @Test
    void formatsNumbers() {
        assertEquals("42", inline(42));
        assertEquals("-7", inline(-7L));
        assertEquals("3", inline((short) 3));
        assertEquals("123456789012345678901234567890", inline(new BigInteger("123456789012345678901234567890")));
        assertEquals("12.34", inline(new BigDecimal("12.3400")));
        assertEquals("100", inline(new BigDecimal("100")));
    }

    @Test
    void formatsFloatsWithoutExponent() {
        assertEquals("1.5", inline(1.5000000000));
        assertEquals("2", inline(2.0));
        assertEquals("-2.5", inline(-2.5));
        assertEquals("0.3", inline(0.1 + 0.2));
        assertEquals("100000000000000000000", inline(1e20));
        assertEquals("0", inline(1e-11));
        assertEquals("0.0000000001", inline(1e-10));
        assertEquals("1.1", inline(1.1f));
    }

    @Test
    void rejectsNonFiniteFloats() {
        assertThrows(IllegalArgumentException.class, () -> inline(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> inline(Double.POSITIVE_INFINITY));
    }

    @Test
    void formatsBooleansAndNull() {
        assertEquals("1", inline(true));
        assertEquals("0", inline(false));
        assertEquals("NULL", inline(null));
    }

    @Test
    void quotesStrings() {
        assertEquals("'O''Reilly'", inline("O'Reilly"));
        assertEquals("'x'", inline('x'));
        assertEquals("'abc'", inline(new StringBuilder("abc")));
        UUID id = UUID.fromString("123e4567-e89b-12d3-a456-426614174000");
        assertEquals("'123e4567-e89b-12d3-a456-426614174000'", inline(id));
    }

    @Test
    void quotesBinaryContent() {
        byte[] bytes = {1, 2, (byte) 0xAB};

        assertEquals("X'0102AB'", inline(bytes));
        assertEquals("X'0102AB'", inline(new ByteArrayInputStream(bytes)));
    }

    @Test
    void formatsTemporalValues() {
        assertEquals("'2024-01-02 03:04:05.000000'", inline(LocalDateTime.of(2024, 1, 2, 3, 4, 5)));
        assertEquals("'2024-01-02'", inline(LocalDate.of(2024, 1, 2)));
        assertEquals("'2024-01-02 03:04:05.123456'", inline(Timestamp.valueOf("2024-01-02 03:04:05.123456")));
        assertEquals(
            "'2024-01-02 03:04:05.000000'",
            inline(OffsetDateTime.of(2024, 1, 2, 3, 4, 5, 0, ZoneOffset.ofHours(8)))
        );
    }

    @Test
    void formatsIntervals() {
        assertEquals("INTERVAL '1 02:03:00.000000' DAY TO SECOND", inline(Duration.ofHours(26).plusMinutes(3)));
        assertEquals("INTERVAL '1-2' YEAR TO MONTH", inline(Period.ofMonths(14)));
    }

    @Test
    void formatsEnums() {
        assertEquals("'A'", inline(Status.ACTIVE));
        assertEquals("'RED'", inline(Color.RED));
    }

    @Test
    void formatsActiveRowAsPrimaryKey() {
        ActiveRow author = () -> 11;

        RenderedSql rendered = preprocessor.process(List.of("SELECT * FROM book WHERE author_id = ?", author));

        assertEquals("SELECT * FROM book WHERE author_id = ?", rendered.sql());
        assertEquals(List.of(11), rendered.params());
    }

    @Test
    void defersScalarsBackingEnumsAndBinaryValues() {
        InputStream stream = new ByteArrayInputStream(new byte[] {1});

        RenderedSql rendered = preprocessor.process(
            List.of("SELECT * FROM t WHERE a = ? AND b = ? AND c = ? AND d = ?", Status.CLOSED, stream, 1.5, 'z')
        );

        assertEquals("SELECT * FROM t WHERE a = ? AND b = ? AND c = ? AND d = ?", rendered.sql());
        assertEquals("C", rendered.params().get(0));
        assertSame(stream, rendered.params().get(1));
        assertEquals(1.5, rendered.params().get(2));
        assertEquals('z', rendered.params().get(3));
    }

    @Test
    void inlinesNullEvenWhenDeferring() {
        RenderedSql rendered = preprocessor.process(Arrays.asList("UPDATE t SET a = ?", null));

        assertEquals("UPDATE t SET a = NULL", rendered.sql());
        assertEquals(List.of(), rendered.params());
    }

    @Test
    void expandsLiteralWithoutParentheses() {
        RenderedSql rendered = preprocessor.process(List.of("SELECT ?", SqlLiteral.of("NOW()")));

        assertEquals("SELECT NOW()", rendered.sql());
        assertEquals("a = b + 1", preprocessor.process(List.of("a = ?", SqlLiteral.of("b + ?", 1))).sql());
    }

    @Test
    void mergesLiteralParamsInEncounterOrder() {
        RenderedSql rendered = preprocessor.process(List.of(
            "SELECT * FROM t WHERE ?",
            map("a", 1, 0, SqlLiteral.of("b > ? OR b < ?", 2, 3), "c", 4)
        ));

        assertEquals("SELECT * FROM t WHERE (\"a\" = ?) AND (b > ? OR b < ?) AND (\"c\" = ?)", rendered.sql());
        assertEquals(List.of(1, 2, 3, 4), rendered.params());
    }

    @Test
    void literalDetectsItsOwnStatement() {
        RenderedSql rendered = preprocessor.process(List.of(
            "x = (?) AND y = ?",
            SqlLiteral.of("SELECT MAX(id) FROM t WHERE a = ?", 5),
            6
        ));

        assertEquals("x = (SELECT MAX(id) FROM t WHERE a = ?) AND y = 6", rendered.sql());
        assertEquals(List.of(5), rendered.params());
    }

    @Test
    void nestsLiteralsRecursively() {
        SqlLiteral inner = SqlLiteral.of("c IN (?)", List.of(1, 2));
        SqlLiteral outer = SqlLiteral.of("a = ? AND ?", "x", inner);

        RenderedSql rendered = preprocessor.process(List.of("DELETE FROM t WHERE ?", outer));

        assertEquals("DELETE FROM t WHERE a = ? AND c IN (?, ?)", rendered.sql());
        assertEquals(List.of("x", 1, 2), rendered.params());
    }

    @Test
    void rejectsUnknownValueInList() {
        assertThrows(
            IllegalArgumentException.class,
            () -> preprocessor.process(List.of("?list", List.of(new Object())))
        );
    }

    private String inline(Object value) {
        return preprocessor.process(Arrays.asList("?", value)).sql();
    }
}
