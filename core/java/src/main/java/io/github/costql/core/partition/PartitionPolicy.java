package io.github.costql.core.partition;

import io.github.costql.core.api.FilterComparator;
import io.github.costql.core.model.FilterModel;

import java.time.LocalDate;
import java.util.List;

/**
 * Time bounding required by one physical warehouse table.
 * <p>
 * Every cost table is partitioned on a different timestamp column; a query that
 * does not bound that column scans the whole table. A policy supplies the bounds
 * for a date-range query, the optimisation clause of running-cost queries, the
 * "last fully loaded day" lookup and the clause of the same-day delta query.
 * </p>
 *
 * <p>Query fragments reference the parameters {@code @start_day}, {@code @last_day},
 * {@code @last_loaded_day} and {@code @days}; the caller binds them.</p>
 *
 * @since 1.0.0
 */
public interface PartitionPolicy {

    /**
     * Days subtracted from the newest partition to find the last fully loaded day.
     * One day is not enough: same-day data is routinely incomplete.
     */
    int LAST_LOADED_DAY_LAG_DAYS = 2;

    /**
     * @return the column the table is partitioned on
     */
    String partitionColumn();

    /**
     * @param startDate first requested day
     * @param endDate   last requested day
     * @return the windows to apply, partition column first
     */
    List<PartitionWindow> windows(LocalDate startDate, LocalDate endDate);

    /**
     * Clause bounding a running-cost scan to {@code @start_day .. @last_day}.
     */
    String runningCostClause();

    /**
     * Extra clause of the same-day delta subquery, starting with {@code AND}, or empty.
     */
    String dailyDeltaClause();

    /**
     * Adds {@link #windows(LocalDate, LocalDate)} to {@code filters} as timestamp
     * comparators: {@code greaterOrEqual} the first day, then {@code lessOrEqual} the
     * last day, or {@code lessThan} the day after it for
     * {@link PartitionWindow#timeOfDay() time-of-day} columns. A filter the caller
     * set on a window column is replaced.
     *
     * @param filters   the caller's filters
     * @param startDate first requested day
     * @param endDate   last requested day
     * @return the bounded filters
     */
    default FilterModel bound(FilterModel filters, LocalDate startDate, LocalDate endDate) {
        FilterModel.Builder builder = filters.toBuilder();
        for (PartitionWindow window : windows(startDate, endDate)) {
            FilterComparator.Builder<Object> range = FilterComparator.<Object>builder()
                    .greaterOrEqual(window.lowerBound().atStartOfDay());
            if (window.timeOfDay()) {
                range.lessThan(window.effectiveUpperBound().plusDays(1).atStartOfDay());
            } else {
                range.lessOrEqual(window.effectiveUpperBound().atStartOfDay());
            }
            builder.field(window.column(), range.build());
        }
        return builder.build();
    }

    /**
     * Query returning one row with a {@code last_loaded_day} timestamp, scanning only
     * partitions newer than {@code @days} (a negative day offset).
     *
     * @param table the fully qualified table name
     * @return the query text
     */
    default String lastLoadedDayQuery(String table) {
        String column = partitionColumn();
        return "SELECT TIMESTAMP_ADD(MAX(" + column + "), INTERVAL -" + LAST_LOADED_DAY_LAG_DAYS
                + " DAY) as last_loaded_day\n"
                + "FROM `" + table + "`\n"
                + "WHERE " + column + " > TIMESTAMP_ADD(CURRENT_TIMESTAMP(), INTERVAL @days DAY)";
    }
}
