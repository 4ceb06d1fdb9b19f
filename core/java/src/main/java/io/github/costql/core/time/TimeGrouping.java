package io.github.costql.core.time;

import java.util.Objects;

/**
 * SQL fragments bucketing rows by time.
 *
 * @param field     expression selected in the inner query, e.g. {@code FORMAT_DATE("%Y%m", day) as day}
 * @param formula   expression re-parsing the bucket in the outer query
 * @param separator {@code ","} when a bucket is selected, empty otherwise
 * @since 1.0.0
 */
public record TimeGrouping(String field, String formula, String separator) {

    private static final TimeGrouping NONE = new TimeGrouping("", "", "");

    public TimeGrouping {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(formula, "formula must not be null");
        Objects.requireNonNull(separator, "separator must not be null");
    }

    /**
     * @return the no-op grouping: three empty strings
     */
    public static TimeGrouping none() {
        return NONE;
    }

    public boolean isNone() {
        return field.isEmpty();
    }
}
