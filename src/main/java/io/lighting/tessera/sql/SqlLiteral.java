package io.lighting.tessera.sql;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Raw SQL fragment with its own placeholders and parameters.
 * <p>
 * When passed as a parameter it is preprocessed recursively and inserted into the
 * surrounding statement verbatim; its bound values are merged into the outer ones.
 */
public final class SqlLiteral {
    private final String sql;
    private final List<Object> params;

    public SqlLiteral(String sql, List<?> params) {
        this.sql = Objects.requireNonNull(sql, "sql");
        Objects.requireNonNull(params, "params");
        // nulls are legal parameters, so no List.copyOf here
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
    }

    /**
     * A bare {@code null} passed as the only parameter arrives as a null array and is taken as one SQL NULL.
     */
    public static SqlLiteral of(String sql, Object... params) {
        Object[] values = params == null ? new Object[] {null} : params;
        return new SqlLiteral(sql, Arrays.asList(values));
    }

    public String sql() {
        return sql;
    }

    public List<Object> params() {
        return params;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SqlLiteral literal)) {
            return false;
        }
        return sql.equals(literal.sql) && params.equals(literal.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sql, params);
    }

    @Override
    public String toString() {
        return sql;
    }
}
