package io.lighting.tessera.row;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable result row: column values in column order.
 */
public final class Row {
    private final Map<String, Object> values;

    private Row(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Row empty() {
        return new Row(Map.of());
    }

    public static Row from(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        Map<String, Object> entries = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            entries.put(Objects.requireNonNull(entry.getKey(), "column"), entry.getValue());
        }
        return new Row(entries);
    }

    public static Row of(String column, Object value, Object... more) {
        Objects.requireNonNull(column, "column");
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put(column, value);
        if (more.length % 2 != 0) {
            throw new IllegalArgumentException("Row values must be column/value pairs");
        }
        for (int i = 0; i < more.length; i += 2) {
            Object key = more[i];
            if (!(key instanceof String columnName)) {
                throw new IllegalArgumentException("Column name must be a String");
            }
            if (entries.containsKey(columnName)) {
                throw new IllegalArgumentException("Duplicate column: " + columnName);
            }
            entries.put(columnName, more[i + 1]);
        }
        return new Row(entries);
    }

    public boolean contains(String column) {
        return values.containsKey(column);
    }

    public Object get(String column) {
        if (!values.containsKey(column)) {
            throw new IllegalArgumentException("Missing column: " + column);
        }
        return values.get(column);
    }

    public List<String> columns() {
        return List.copyOf(values.keySet());
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "Row" + values;
    }
}
