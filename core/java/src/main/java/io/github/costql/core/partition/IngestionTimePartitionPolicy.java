package io.github.costql.core.partition;

import java.time.LocalDate;
import java.util.List;

/**
 * Raw billing export partitioned on ingestion time ({@code part_time}).
 * <p>
 * Rows land up to about five days after their usage day, so the partition bound
 * is widened by {@value #SLACK_DAYS} days and the logical {@code day} range is
 * applied on top of it.
 * </p>
 *
 * @since 1.0.0
 */
public final class IngestionTimePartitionPolicy implements PartitionPolicy {

    public static final String PART_TIME = "part_time";

    public static final int SLACK_DAYS = 7;

    public static final IngestionTimePartitionPolicy INSTANCE = new IngestionTimePartitionPolicy();

    private IngestionTimePartitionPolicy() {
    }

    @Override
    public String partitionColumn() {
        return PART_TIME;
    }

    @Override
    public List<PartitionWindow> windows(LocalDate startDate, LocalDate endDate) {
        return List.of(
                new PartitionWindow(PART_TIME, startDate, endDate, SLACK_DAYS),
                PartitionWindow.of(DayPartitionPolicy.DAY, startDate, endDate));
    }

    @Override
    public String runningCostClause() {
        return "part_time >= TIMESTAMP(@start_day)"
                + " AND part_time <= TIMESTAMP_ADD(TIMESTAMP(@last_day), INTERVAL " + SLACK_DAYS + " DAY)";
    }

    @Override
    public String dailyDeltaClause() {
        return "AND part_time >= TIMESTAMP(@last_loaded_day)"
                + " AND part_time <= TIMESTAMP_ADD(TIMESTAMP(@last_loaded_day), INTERVAL " + SLACK_DAYS + " DAY)";
    }
}
