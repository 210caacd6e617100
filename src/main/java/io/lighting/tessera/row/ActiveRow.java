package io.lighting.tessera.row;

/**
 * Table-backed row. As a parameter it stands for its primary key, e.g. {@code WHERE author_id = ?}.
 */
@FunctionalInterface
public interface ActiveRow {
    Object primaryKey();
}
