package io.github.costql.billing.tables;

import io.github.costql.billing.config.BillingConfig;
import io.github.costql.billing.model.BillingSource;

import java.util.Objects;

/**
 * The four billing tables of one deployment.
 *
 * @param aggregate  daily aggregate view
 * @param extended   extended daily aggregate view
 * @param gcpBilling view over the raw billing export
 * @param raw        consolidated raw table
 * @since 1.0.0
 */
public record BillingTables(
        AggregateDailyTable aggregate,
        AggregateDailyExtendedTable extended,
        GcpBillingDailyTable gcpBilling,
        RawConsolidatedTable raw
) {

    public BillingTables {
        Objects.requireNonNull(aggregate, "aggregate must not be null");
        Objects.requireNonNull(extended, "extended must not be null");
        Objects.requireNonNull(gcpBilling, "gcpBilling must not be null");
        Objects.requireNonNull(raw, "raw must not be null");
    }

    public static BillingTables from(BillingConfig config) {
        return new BillingTables(
                new AggregateDailyTable(config.getAggregateView()),
                new AggregateDailyExtendedTable(config.getExtendedView()),
                new GcpBillingDailyTable(config.getGcpBillingView()),
                new RawConsolidatedTable(config.getRawTable()));
    }

    public BillingTable forSource(BillingSource source) {
        return switch (source) {
            case AGGREGATE -> aggregate;
            case EXTENDED -> extended;
            case GCP_BILLING -> gcpBilling;
            case RAW -> raw;
        };
    }
}
