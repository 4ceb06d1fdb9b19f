package io.github.costql.core.partition;

import java.time.LocalDate;
import java.util.List;

/**
 * Raw consolidated table partitioned directly on {@code usage_end_time}.
 * <p>
 * The column carries a time of day, so the last requested day is kept by bounding
 * with the start of the day after it.
 * </p>
 *
 * @since 1.0.0
 */
public final class UsageEndTimePartitionPolicy implements PartitionPolicy {

    public static final String USAGE_END_TIME = "usage_end_time";

    public static final UsageEndTimePartitionPolicy INSTANCE = new UsageEndTimePartitionPolicy();

    private UsageEndTimePartitionPolicy() {
    }

    @Override
    public String partitionColumn() {
        return USAGE_END_TIME;
    }

    @Override
    public List<PartitionWindow> windows(LocalDate startDate, LocalDate endDate) {
        return List.of(PartitionWindow.ofTimestamps(USAGE_END_TIME, startDate, endDate));
    }

    @Override
    public String runningCostClause() {
        return "usage_end_time >= TIMESTAMP(@start_day)"
                + " AND usage_end_time < TIMESTAMP_ADD(TIMESTAMP(@last_day), INTERVAL 1 DAY)";
    }

    @Override
    public String dailyDeltaClause() {
        return "";
    }
}
