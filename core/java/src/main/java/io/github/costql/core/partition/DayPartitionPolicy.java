package io.github.costql.core.partition;

import java.time.LocalDate;
import java.util.List;

/**
 * Tables partitioned on the logical usage {@code day}.
 *
 * @since 1.0.0
 */
public final class DayPartitionPolicy implements PartitionPolicy {

    public static final String DAY = "day";

    public static final DayPartitionPolicy INSTANCE = new DayPartitionPolicy();

    private DayPartitionPolicy() {
    }

    @Override
    public String partitionColumn() {
        return DAY;
    }

    @Override
    public List<PartitionWindow> windows(LocalDate startDate, LocalDate endDate) {
        return List.of(PartitionWindow.of(DAY, startDate, endDate));
    }

    @Override
    public String runningCostClause() {
        return "day >= TIMESTAMP(@start_day) AND day <= TIMESTAMP(@last_day)";
    }

    @Override
    public String dailyDeltaClause() {
        return "";
    }
}
