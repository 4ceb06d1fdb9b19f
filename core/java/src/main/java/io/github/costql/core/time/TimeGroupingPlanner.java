package io.github.costql.core.time;

/**
 * Plans the time bucket of a total-cost query.
 * <p>
 * The inner query formats the chosen time column into a string bucket named
 * {@code day}; the outer query parses it back into a date. Invoice months are
 * already {@code YYYYMM} strings and are selected as they are.
 * </p>
 *
 * <pre>{@code
 * TimeGrouping grouping = TimeGroupingPlanner.plan(TimeGranularity.MONTH, TimeColumn.DAY);
 * // field:   FORMAT_DATE("%Y%m", day) as day
 * // formula: PARSE_DATE("%Y%m", day) as day
 * }</pre>
 *
 * @since 1.0.0
 */
public final class TimeGroupingPlanner {

    private static final String SEPARATOR = ",";

    private TimeGroupingPlanner() {
    }

    /**
     * @param granularity the bucket size, {@code null} for no bucketing
     * @param column      the column to bucket, {@code null} for {@link TimeColumn#DAY}
     * @return the fragments, {@link TimeGrouping#none()} when {@code granularity} is null
     */
    public static TimeGrouping plan(TimeGranularity granularity, TimeColumn column) {
        if (granularity == null) {
            return TimeGrouping.none();
        }
        String source = (column == null ? TimeColumn.DAY : column).getColumn();
        return switch (granularity) {
            case DAY -> formatted("%Y-%m-%d", source);
            case WEEK -> formatted("%Y%W", source);
            case MONTH -> formatted("%Y%m", source);
            case INVOICE_MONTH -> new TimeGrouping("invoice_month as day", "PARSE_DATE(\"%Y%m\", day) as day", SEPARATOR);
        };
    }

    private static TimeGrouping formatted(String pattern, String source) {
        return new TimeGrouping(
                "FORMAT_DATE(\"" + pattern + "\", " + source + ") as day",
                "PARSE_DATE(\"" + pattern + "\", day) as day",
                SEPARATOR);
    }
}
