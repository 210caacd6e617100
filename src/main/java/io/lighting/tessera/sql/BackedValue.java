package io.lighting.tessera.sql;

/**
 * Implemented by enums that are stored as a scalar code rather than by name.
 */
public interface BackedValue {
    Object backingValue();
}
