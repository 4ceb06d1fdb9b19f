package io.github.costql.core.time;

import io.github.costql.core.exception.InvalidParameterException;

import java.util.Locale;

/**
 * Timestamp columns rows can be bucketed on.
 *
 * @since 1.0.0
 */
public enum TimeColumn {
    DAY("day"),
    USAGE_START_TIME("usage_start_time"),
    USAGE_END_TIME("usage_end_time");

    private final String column;

    TimeColumn(String column) {
        this.column = column;
    }

    public String getColumn() {
        return column;
    }

    /**
     * @param value the column name, may be {@code null}
     * @return the column, {@link #DAY} for a {@code null} or blank value
     * @throws InvalidParameterException for an unknown column
     */
    public static TimeColumn parse(String value) {
        if (value == null || value.isBlank()) {
            return DAY;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TimeColumn column : values()) {
            if (column.column.equals(normalized)) {
                return column;
            }
        }
        throw new InvalidParameterException("Unknown time column: " + value);
    }
}
