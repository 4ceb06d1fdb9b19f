package io.github.costql.billing.tables;

import io.github.costql.billing.model.BillingSource;
import io.github.costql.core.partition.IngestionTimePartitionPolicy;
import io.github.costql.core.partition.PartitionPolicy;

/**
 * View over the raw cloud billing export.
 * <p>
 * The view can only be partitioned like its base table, on ingestion time
 * ({@code part_time}), which trails the usage day by up to about five days.
 * </p>
 *
 * @since 1.0.0
 */
public final class GcpBillingDailyTable extends BillingTable {

    public GcpBillingDailyTable(String tableName) {
        super(tableName, AggregateDailyTable.COLUMNS);
    }

    @Override
    public BillingSource getSource() {
        return BillingSource.GCP_BILLING;
    }

    @Override
    public PartitionPolicy getPartitionPolicy() {
        return IngestionTimePartitionPolicy.INSTANCE;
    }
}
