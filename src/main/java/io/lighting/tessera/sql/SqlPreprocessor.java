package io.lighting.tessera.sql;

import io.lighting.tessera.row.ActiveRow;
import io.lighting.tessera.row.Row;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.Period;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands placeholders of a SQL template into SQL text plus values left for driver binding.
 * <p>
 * The parameter list starts with a template; every placeholder in it consumes the next parameter:
 * <ul>
 *   <li>{@code ?} formats a value; maps and lists are expanded by the mode of the last SQL command seen
 *   (INSERT gives {@code ?values}, SET gives {@code ?set}, WHERE gives {@code ?and}, ORDER BY gives
 *   {@code ?order}).</li>
 *   <li>{@code ?name} delimits an identifier.</li>
 *   <li>{@code ?and}, {@code ?or}, {@code ?set}, {@code ?values}, {@code ?order}, {@code ?list} force a mode.</li>
 *   <li>{@code IN (?)} expands a list into {@code IN (a, b, c)}.</li>
 * </ul>
 * Once a SELECT, INSERT, UPDATE, DELETE, REPLACE or EXPLAIN statement is detected, scalar values are
 * left as {@code ?} and returned in {@link RenderedSql#params()} instead of being inlined.
 * <p>
 * Instances are immutable and may be shared; each call keeps its own state.
 */
public final class SqlPreprocessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(SqlPreprocessor.class);

    private static final Pattern TOKEN = Pattern.compile("""
        '[^']*+'
        |"[^"]*+"
        |\\?[a-z]*
        |^\\s*+(?:\\(?\\s*SELECT|INSERT|UPDATE|DELETE|REPLACE|EXPLAIN)\\b
        |\\b(?:SET|WHERE|HAVING|ORDER\\ BY|GROUP\\ BY|KEY\\ UPDATE)(?=\\s*\\z|\\s*\\?)
        |\\bIN\\s+(?:\\?|\\(\\?\\))
        |/\\*.*?\\*/
        |--[^\\n]*
        """, Pattern.CASE_INSENSITIVE | Pattern.DOTALL | Pattern.COMMENTS);

    private static final Map<String, ArrayMode> COMMAND_MODES = Map.of(
        "INSERT", ArrayMode.VALUES,
        "REPLACE", ArrayMode.VALUES,
        "KEY UPDATE", ArrayMode.SET,
        "SET", ArrayMode.SET,
        "WHERE", ArrayMode.AND,
        "HAVING", ArrayMode.AND,
        "ORDER BY", ArrayMode.ORDER,
        "GROUP BY", ArrayMode.ORDER
    );

    private static final Set<String> PARAMETRIC_COMMANDS = Set.of(
        "SELECT", "INSERT", "UPDATE", "DELETE", "REPLACE", "EXPLAIN"
    );

    private static final String NULL = "NULL";

    private final Dialect dialect;

    public SqlPreprocessor(Dialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    public Dialect dialect() {
        return dialect;
    }

    public RenderedSql process(List<?> params) {
        return process(params, false);
    }

    public RenderedSql process(List<?> params, boolean useParams) {
        Objects.requireNonNull(params, "params");
        if (params.isEmpty()) {
            throw new IllegalArgumentException("params must not be empty");
        }
        RenderedSql rendered = new Session(params, useParams).run();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Preprocessed [{}] {} | params={}", dialect.id(), rendered.sql(), rendered.params());
        }
        return rendered;
    }

    private final class Session {
        private final List<?> params;
        private final List<Object> remaining = new ArrayList<>();
        private int counter;
        private boolean useParams;
        private ArrayMode arrayMode;

        private Session(List<?> params, boolean useParams) {
            this.params = params;
            this.useParams = useParams;
        }

        private RenderedSql run() {
            List<String> fragments = new ArrayList<>();
            int prev = -1;
            while (counter < params.size()) {
                Object param = params.get(counter++);
                if ((counter == 2 && params.size() == 2) || !isScalar(param)) {
                    fragments.add(formatParameter(param));
                } else if (param instanceof String template && counter > prev + 1) {
                    prev = counter;
                    arrayMode = null;
                    fragments.add(scan(template));
                } else {
                    throw new IllegalArgumentException("There are more parameters than placeholders.");
                }
            }
            return new RenderedSql(String.join(" ", fragments), remaining);
        }

        private String scan(String template) {
            Matcher matcher = TOKEN.matcher(template);
            StringBuilder sql = new StringBuilder(template.length() + 16);
            int last = 0;
            while (matcher.find()) {
                sql.append(template, last, matcher.start());
                sql.append(parsePart(matcher.group()));
                last = matcher.end();
            }
            sql.append(template, last, template.length());
            return sql.toString();
        }

        private String parsePart(String token) {
            char first = token.charAt(0);
            if (first == '\'' || first == '"' || first == '/' || first == '-') {
                return token;
            }
            if (token.indexOf('?') < 0) {
                enterCommand(token);
                return token;
            }

            if (counter >= params.size()) {
                throw new IllegalArgumentException("There are more placeholders than passed parameters.");
            }
            Object param = params.get(counter++);
            if (first != '?') {
                return "IN (" + (isArrayLike(param) ? formatList(elements(param)) : formatValue(param, false)) + ")";
            }
            String suffix = token.substring(1);
            if (suffix.isEmpty()) {
                return formatParameter(param);
            }
            if (suffix.equals("name")) {
                return formatNameParameter(param);
            }
            ArrayMode mode = ArrayMode.fromPlaceholder(suffix);
            if (mode == null) {
                throw new IllegalArgumentException("Unknown placeholder " + token + ".");
            }
            return formatArrayParameter(param, mode);
        }

        private void enterCommand(String token) {
            String upper = token.toUpperCase(Locale.ROOT);
            int start = 0;
            while (start < upper.length() && (Character.isWhitespace(upper.charAt(start)) || upper.charAt(start) == '(')) {
                start++;
            }
            String command = upper.substring(start);
            arrayMode = COMMAND_MODES.get(command);
            useParams = useParams || PARAMETRIC_COMMANDS.contains(command);
        }

        private String formatParameter(Object value) {
            return formatValue(value, true);
        }

        private String formatNameParameter(Object value) {
            if (!(value instanceof String name)) {
                throw new IllegalArgumentException("Placeholder ?name expects string, " + typeName(value) + " given.");
            }
            return delimit(name);
        }

        private String formatArrayParameter(Object value, ArrayMode mode) {
            Map<Object, Object> items = toItems(value, mode);
            return switch (mode) {
                case VALUES -> items.containsKey(0) ? formatMultiInsert(items) : formatInsert(items);
                case SET -> formatAssigns(items);
                case LIST -> formatList(new ArrayList<>(items.values()));
                case AND, OR -> formatWhere(items, mode);
                case ORDER -> formatOrderBy(items);
            };
        }

        /**
         * The fallback (array expansion by the current mode) only applies to values coming straight
         * from a {@code ?} placeholder or a standalone parameter.
         */
        private String formatValue(Object value, boolean fallback) {
            if (useParams && (isScalar(value) || isBinary(value))) {
                remaining.add(value);
                return "?";
            }
            if (value instanceof SqlLiteral literal) {
                return formatLiteral(literal);
            }

            if (value == null) {
                return NULL;
            }
            if (value instanceof Boolean bool) {
                return bool ? "1" : "0";
            }
            if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
                return value.toString();
            }
            if (value instanceof Double || value instanceof Float) {
                return formatFloat((Number) value);
            }
            if (value instanceof BigDecimal decimal) {
                return trimFraction(decimal.toPlainString());
            }
            if (value instanceof InputStream stream) {
                return dialect.quoteBinary(readAll(stream));
            }
            if (value instanceof byte[] bytes) {
                return dialect.quoteBinary(bytes);
            }
            if (value instanceof String string) {
                return dialect.quoteLiteral(string);
            }
            if (value instanceof Character character) {
                return dialect.quoteLiteral(character.toString());
            }
            if (value instanceof ActiveRow row) {
                return formatValue(row.primaryKey(), false);
            }
            TemporalAccessor dateTime = toDateTime(value);
            if (dateTime != null) {
                return dialect.formatDateTime(dateTime);
            }
            if (value instanceof Duration duration) {
                return dialect.formatInterval(duration);
            }
            if (value instanceof Period period) {
                return dialect.formatInterval(period);
            }
            if (value instanceof BackedValue backed && isScalar(backed.backingValue())) {
                return formatValue(backed.backingValue(), false);
            }
            if (value instanceof Enum<?> constant) {
                return formatValue(constant.name(), false);
            }
            if (value instanceof CharSequence || value instanceof UUID) {
                return formatValue(value.toString(), false);
            }
            if (fallback && (isArrayLike(value) || value instanceof Row)) {
                return formatArrayParameter(value, arrayMode == null ? ArrayMode.SET : arrayMode);
            }
            throw new IllegalArgumentException("Unexpected type of parameter: " + typeName(value));
        }

        private String formatLiteral(SqlLiteral literal) {
            List<Object> nested = new ArrayList<>(literal.params().size() + 1);
            nested.add(literal.sql());
            nested.addAll(literal.params());
            RenderedSql rendered = new Session(nested, useParams).run();
            remaining.addAll(rendered.params());
            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace("Expanded literal {} -> {} | params={}", literal.sql(), rendered.sql(), rendered.params());
            }
            return rendered.sql();
        }

        /**
         * Output: value, value, ... | (tuple), (tuple), ...
         */
        private String formatList(List<?> values) {
            List<String> res = new ArrayList<>(values.size());
            for (Object value : values) {
                res.add(isArrayLike(value)
                    ? "(" + formatList(elements(value)) + ")"
                    : formatValue(value, false));
            }
            return String.join(", ", res);
        }

        /**
         * Output: (key, key, ...) VALUES (value, value, ...)
         */
        private String formatInsert(Map<Object, Object> items) {
            List<String> cols = new ArrayList<>(items.size());
            List<String> vals = new ArrayList<>(items.size());
            for (Map.Entry<Object, Object> entry : items.entrySet()) {
                cols.add(delimit(columnName(entry.getKey())));
                vals.add(formatValue(entry.getValue(), false));
            }
            return "(" + String.join(", ", cols) + ") VALUES (" + String.join(", ", vals) + ")";
        }

        /**
         * Output: (key, key, ...) VALUES (value, value, ...), (value, value, ...), ...
         * or (key, key, ...) SELECT value, value UNION ALL SELECT ... where the dialect requires it.
         */
        private String formatMultiInsert(Map<Object, Object> groups) {
            Object first = groups.get(0);
            if (!isRowShaped(first)) {
                throw new IllegalArgumentException(
                    "Automatically detected multi-insert, but values aren't array. If you need, try to change ?mode."
                );
            }

            List<Object> cols = new ArrayList<>(rowItems(first).keySet());
            List<String> vals = new ArrayList<>(groups.size());
            int index = 0;
            for (Object group : groups.values()) {
                if (!isRowShaped(group)) {
                    throw new IllegalArgumentException(
                        "Multi-insert row " + index + " must be a map or row, " + typeName(group) + " given."
                    );
                }
                Map<Object, Object> row = rowItems(group);
                List<String> rowVals = new ArrayList<>(cols.size());
                for (Object col : cols) {
                    if (!row.containsKey(col)) {
                        throw new IllegalArgumentException("Multi-insert row " + index + " is missing column " + col + ".");
                    }
                    rowVals.add(formatValue(row.get(col), false));
                }
                vals.add(String.join(", ", rowVals));
                index++;
            }

            List<String> delimited = new ArrayList<>(cols.size());
            for (Object col : cols) {
                delimited.add(delimit(columnName(col)));
            }
            boolean useSelect = dialect.supportsMultiInsertAsSelect();
            return "(" + String.join(", ", delimited)
                + (useSelect ? ") SELECT " : ") VALUES (")
                + String.join(useSelect ? " UNION ALL SELECT " : "), (", vals)
                + (useSelect ? "" : ")");
        }

        /**
         * Output: key=value, key=value, ... with key+=value and key-=value turning into key=key + value.
         */
        private String formatAssigns(Map<Object, Object> items) {
            List<String> res = new ArrayList<>(items.size());
            for (Map.Entry<Object, Object> entry : items.entrySet()) {
                Object key = entry.getKey();
                if (key instanceof Integer) {
                    res.add(formatValue(entry.getValue(), false));
                } else if (key instanceof String name && name.length() > 2 && name.endsWith("=")) {
                    String col = delimit(name.substring(0, name.length() - 2));
                    char operator = name.charAt(name.length() - 2);
                    res.add(col + "=" + col + " " + operator + " " + formatValue(entry.getValue(), false));
                } else {
                    res.add(delimit(columnName(key)) + "=" + formatValue(entry.getValue(), false));
                }
            }
            return String.join(", ", res);
        }

        /**
         * Output: (key [operator] value) AND/OR ...
         */
        private String formatWhere(Map<Object, Object> items, ArrayMode mode) {
            List<String> res = new ArrayList<>(items.size());
            for (Map.Entry<Object, Object> entry : items.entrySet()) {
                Object key = entry.getKey();
                Object value = entry.getValue();
                if (key instanceof Integer) {
                    res.add(formatValue(value, false));
                    continue;
                }

                // "col", "col op" or "col NOT"; anything after the operator is ignored
                String[] parts = (columnName(key) + " ").split(" ", -1);
                String col = delimit(parts[0]);
                String operator = parts[1];

                if (isArrayLike(value)) {
                    List<Object> values = elements(value);
                    if (!values.isEmpty()) {
                        res.add(col + " " + (operator.isEmpty() ? "" : operator + " ") + "IN (" + formatList(values) + ")");
                    } else if (!operator.equals("NOT")) {
                        res.add("1=0");
                    }
                } else {
                    String formatted = formatValue(value, false);
                    String op;
                    if (formatted.equals(NULL)) {
                        op = operator.equals("NOT") ? "IS NOT" : (operator.isEmpty() ? "IS" : operator);
                    } else {
                        op = operator.isEmpty() ? "=" : operator;
                    }
                    res.add(col + " " + op + " " + formatted);
                }
            }

            if (res.isEmpty()) {
                return "1=1";
            }
            return "(" + String.join(") " + mode.name() + " (", res) + ")";
        }

        /**
         * Output: key, key DESC, ...
         */
        private String formatOrderBy(Map<Object, Object> items) {
            List<String> res = new ArrayList<>(items.size());
            for (Map.Entry<Object, Object> entry : items.entrySet()) {
                String col = columnName(entry.getKey());
                res.add(delimit(col) + (isAscending(col, entry.getValue()) ? "" : " DESC"));
            }
            return String.join(", ", res);
        }

        /**
         * Positive means ascending; zero, negative and null mean descending.
         */
        private boolean isAscending(String col, Object direction) {
            if (direction == null) {
                return false;
            }
            if (direction instanceof CharSequence text) {
                try {
                    return new BigDecimal(text.toString().strip()).signum() > 0;
                } catch (NumberFormatException ex) {
                    throw new IllegalArgumentException(
                        "Placeholder ?order expects numeric direction for " + col + ", '" + text + "' given.", ex
                    );
                }
            }
            if (direction instanceof Boolean bool) {
                return bool;
            }
            if (direction instanceof BigDecimal decimal) {
                return decimal.signum() > 0;
            }
            if (direction instanceof BigInteger integer) {
                return integer.signum() > 0;
            }
            if (direction instanceof Number number) {
                return number.doubleValue() > 0;
            }
            throw new IllegalArgumentException(
                "Placeholder ?order expects numeric direction for " + col + ", " + typeName(direction) + " given."
            );
        }
    }

    private Map<Object, Object> toItems(Object value, ArrayMode mode) {
        if (value instanceof Map<?, ?> || value instanceof Row) {
            return rowItems(value);
        }
        if (isArrayLike(value)) {
            Map<Object, Object> items = new LinkedHashMap<>();
            int index = 0;
            for (Object element : elements(value)) {
                items.put(index++, element);
            }
            return items;
        }
        throw new IllegalArgumentException(
            "Placeholder ?" + mode.placeholder() + " expects array or iterable object, " + typeName(value) + " given."
        );
    }

    private Map<Object, Object> rowItems(Object value) {
        Map<Object, Object> items = new LinkedHashMap<>();
        if (value instanceof Row row) {
            items.putAll(row.asMap());
            return items;
        }
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            items.put(normalizeKey(entry.getKey()), entry.getValue());
        }
        return items;
    }

    private String delimit(String name) {
        String[] parts = name.split("\\.", -1);
        StringBuilder sql = new StringBuilder(name.length() + parts.length * 2);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sql.append('.');
            }
            sql.append(dialect.quoteIdent(parts[i]));
        }
        return sql.toString();
    }

    private static Object normalizeKey(Object key) {
        if (key instanceof Integer || key instanceof String) {
            return key;
        }
        if (key instanceof Long || key instanceof Short || key instanceof Byte) {
            long value = ((Number) key).longValue();
            if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Unsupported key " + value + ": outside int range");
            }
            return (int) value;
        }
        if (key instanceof CharSequence text) {
            return text.toString();
        }
        throw new IllegalArgumentException("Unsupported key type: " + typeName(key));
    }

    private static String columnName(Object key) {
        if (key instanceof String name) {
            return name;
        }
        throw new IllegalArgumentException("Expected column name, positional key " + key + " given.");
    }

    private static boolean isRowShaped(Object value) {
        return value instanceof Map<?, ?> || value instanceof Row;
    }

    private static boolean isScalar(Object value) {
        return value instanceof String
            || value instanceof Integer
            || value instanceof Long
            || value instanceof Boolean
            || value instanceof Double
            || value instanceof BigDecimal
            || value instanceof Short
            || value instanceof Byte
            || value instanceof Float
            || value instanceof BigInteger
            || value instanceof Character;
    }

    private static boolean isBinary(Object value) {
        return value instanceof byte[] || value instanceof InputStream;
    }

    private static boolean isArrayLike(Object value) {
        if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
            return true;
        }
        return value != null && value.getClass().isArray() && !(value instanceof byte[]);
    }

    private static List<Object> elements(Object value) {
        List<Object> elements = new ArrayList<>();
        if (value instanceof Map<?, ?> map) {
            elements.addAll(map.values());
        } else if (value instanceof Iterable<?> iterable) {
            for (Object element : iterable) {
                elements.add(element);
            }
        } else if (value instanceof Object[] array) {
            elements.addAll(Arrays.asList(array));
        } else {
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                elements.add(Array.get(value, i));
            }
        }
        return elements;
    }

    private static TemporalAccessor toDateTime(Object value) {
        if (value instanceof LocalDateTime || value instanceof LocalDate || value instanceof LocalTime
            || value instanceof OffsetDateTime || value instanceof ZonedDateTime || value instanceof Instant) {
            return (TemporalAccessor) value;
        }
        if (value instanceof java.sql.Timestamp timestamp) {
            return timestamp.toLocalDateTime();
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate();
        }
        if (value instanceof java.sql.Time time) {
            return time.toLocalTime();
        }
        if (value instanceof java.util.Date date) {
            return LocalDateTime.ofInstant(date.toInstant(), ZoneId.systemDefault());
        }
        return null;
    }

    private static String formatFloat(Number number) {
        double raw = number.doubleValue();
        if (Double.isNaN(raw) || Double.isInfinite(raw)) {
            throw new IllegalArgumentException("Unsupported float value: " + number);
        }
        // Float.toString keeps 1.1f as 1.1 instead of its widened double expansion
        BigDecimal decimal = number instanceof Float ? new BigDecimal(number.toString()) : BigDecimal.valueOf(raw);
        return trimFraction(decimal.setScale(10, RoundingMode.HALF_UP).toPlainString());
    }

    private static String trimFraction(String text) {
        if (text.indexOf('.') < 0) {
            return text;
        }
        int end = text.length();
        while (text.charAt(end - 1) == '0') {
            end--;
        }
        if (text.charAt(end - 1) == '.') {
            end--;
        }
        return text.substring(0, end);
    }

    private static byte[] readAll(InputStream stream) {
        try {
            return stream.readAllBytes();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read stream parameter", ex);
        }
    }

    private static String typeName(Object value) {
        if (value == null) {
            return "null";
        }
        String name = value.getClass().getSimpleName();
        return name.isEmpty() ? value.getClass().getName() : name;
    }
}
