package io.github.costql.billing.tables;

import io.github.costql.billing.model.BillingColumn;
import io.github.costql.billing.model.BillingSource;
import io.github.costql.core.partition.PartitionPolicy;
import io.github.costql.core.partition.UsageEndTimePartitionPolicy;

import java.util.EnumSet;
import java.util.Set;

/**
 * Consolidated raw billing table, partitioned by {@code usage_end_time}.
 *
 * @since 1.0.0
 */
public final class RawConsolidatedTable extends BillingTable {

    public RawConsolidatedTable(String tableName) {
        super(tableName, columns());
    }

    private static Set<BillingColumn> columns() {
        Set<BillingColumn> columns = EnumSet.copyOf(AggregateDailyTable.COLUMNS);
        columns.addAll(EnumSet.of(BillingColumn.ID, BillingColumn.SERVICE, BillingColumn.USAGE_START_TIME,
                BillingColumn.USAGE_END_TIME, BillingColumn.PROJECT, BillingColumn.LOCATION,
                BillingColumn.EXPORT_TIME, BillingColumn.COST_TYPE));
        return columns;
    }

    @Override
    public BillingSource getSource() {
        return BillingSource.RAW;
    }

    @Override
    public PartitionPolicy getPartitionPolicy() {
        return UsageEndTimePartitionPolicy.INSTANCE;
    }
}
