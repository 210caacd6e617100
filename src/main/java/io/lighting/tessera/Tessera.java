package io.lighting.tessera;

import io.lighting.tessera.sql.Dialect;
import io.lighting.tessera.sql.RenderedSql;
import io.lighting.tessera.sql.SqlLiteral;
import io.lighting.tessera.sql.SqlPreprocessor;
import io.lighting.tessera.sql.dialect.AnsiDialect;
import io.lighting.tessera.sql.dialect.DialectResolver;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import javax.sql.DataSource;

public final class Tessera {
    private final Dialect dialect;
    private final SqlPreprocessor preprocessor;
    private final boolean useParams;

    private Tessera(Dialect dialect, SqlPreprocessor preprocessor, boolean useParams) {
        this.dialect = dialect;
        this.preprocessor = preprocessor;
        this.useParams = useParams;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SqlLiteral literal(String sql, Object... params) {
        return SqlLiteral.of(sql, params);
    }

    /**
     * Preprocesses {@code sql} followed by {@code params}; a bare {@code null} as the only parameter
     * is bound as one SQL NULL rather than read as an empty parameter list.
     */
    public RenderedSql preprocess(String sql, Object... params) {
        Objects.requireNonNull(sql, "sql");
        Object[] values = params == null ? new Object[] {null} : params;
        List<Object> args = new ArrayList<>(values.length + 1);
        args.add(sql);
        args.addAll(Arrays.asList(values));
        return preprocessor.process(args, useParams);
    }

    public RenderedSql preprocess(List<?> params) {
        return preprocessor.process(params, useParams);
    }

    public Dialect dialect() {
        return dialect;
    }

    public SqlPreprocessor preprocessor() {
        return preprocessor;
    }

    public boolean useParams() {
        return useParams;
    }

    public static final class Builder {
        private DataSource dataSource;
        private Dialect dialect;
        private boolean useParams;

        private Builder() {
        }

        public Builder dataSource(DataSource dataSource) {
            this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
            return this;
        }

        // 方言：未指定时按 DataSource 元数据识别，都没有则回退到 ANSI。
        public Builder dialect(Dialect dialect) {
            this.dialect = Objects.requireNonNull(dialect, "dialect");
            return this;
        }

        // 为 true 时标量一律留作 ? 绑定，即使模板不是 SELECT/INSERT/UPDATE/DELETE。
        public Builder useParams(boolean useParams) {
            this.useParams = useParams;
            return this;
        }

        public Tessera build() {
            Dialect resolvedDialect = resolveDialect();
            return new Tessera(resolvedDialect, new SqlPreprocessor(resolvedDialect), useParams);
        }

        private Dialect resolveDialect() {
            if (dialect != null) {
                return dialect;
            }
            if (dataSource != null) {
                return DialectResolver.resolve(dataSource);
            }
            return new AnsiDialect();
        }
    }
}
