package io.github.costql.core.partition;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Inclusive day range applied to a partition column.
 * <p>
 * A day-granular column holds midnight timestamps, so the last day is matched with
 * {@code <=} its start. A column carrying a time of day ({@code timeOfDay}) is
 * bounded with {@code <} the start of the following day instead, keeping the whole
 * last day.
 * </p>
 *
 * @param column     the partition column
 * @param lowerBound first day, inclusive
 * @param upperBound last logical day, inclusive
 * @param slackDays  extra days added to the upper bound to tolerate ingestion lag
 * @param timeOfDay  whether the column carries a time of day
 * @since 1.0.0
 */
public record PartitionWindow(String column, LocalDate lowerBound, LocalDate upperBound, int slackDays,
                              boolean timeOfDay) {

    public PartitionWindow {
        Objects.requireNonNull(column, "column must not be null");
        Objects.requireNonNull(lowerBound, "lowerBound must not be null");
        Objects.requireNonNull(upperBound, "upperBound must not be null");
        if (slackDays < 0) {
            throw new IllegalArgumentException("slackDays must not be negative, got: " + slackDays);
        }
        if (upperBound.isBefore(lowerBound)) {
            throw new IllegalArgumentException(
                    String.format("upperBound %s is before lowerBound %s", upperBound, lowerBound));
        }
    }

    public PartitionWindow(String column, LocalDate lowerBound, LocalDate upperBound, int slackDays) {
        this(column, lowerBound, upperBound, slackDays, false);
    }

    public static PartitionWindow of(String column, LocalDate lowerBound, LocalDate upperBound) {
        return new PartitionWindow(column, lowerBound, upperBound, 0);
    }

    /**
     * Window on a timestamp column whose rows fall anywhere within a day.
     */
    public static PartitionWindow ofTimestamps(String column, LocalDate lowerBound, LocalDate upperBound) {
        return new PartitionWindow(column, lowerBound, upperBound, 0, true);
    }

    /**
     * @return the upper bound actually scanned: {@code upperBound + slackDays}
     */
    public LocalDate effectiveUpperBound() {
        return upperBound.plusDays(slackDays);
    }
}
