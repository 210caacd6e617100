package io.lighting.tessera.sql;

import java.util.Locale;

/**
 * How a map or list parameter is expanded into SQL.
 */
public enum ArrayMode {
    /** (key [operator] value) AND ... */
    AND,
    /** (key [operator] value) OR ... */
    OR,
    /** key=value, key=value, ... */
    SET,
    /** (key, key, ...) VALUES (value, value, ...) */
    VALUES,
    /** key, key DESC, ... */
    ORDER,
    /** value, value, ... | (tuple), (tuple), ... */
    LIST;

    /**
     * Placeholder suffix selecting this mode, e.g. {@code values} for {@code ?values}.
     */
    public String placeholder() {
        return name().toLowerCase(Locale.ROOT);
    }

    static ArrayMode fromPlaceholder(String suffix) {
        for (ArrayMode mode : values()) {
            if (mode.placeholder().equals(suffix)) {
                return mode;
            }
        }
        return null;
    }
}
