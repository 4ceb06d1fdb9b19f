package io.github.costql.billing.tables;

import io.github.costql.billing.model.BillingColumn;
import io.github.costql.billing.model.BillingSource;
import io.github.costql.core.partition.DayPartitionPolicy;
import io.github.costql.core.partition.PartitionPolicy;

import java.util.EnumSet;
import java.util.Set;

/**
 * Daily aggregate view carrying the batch and workflow columns, partitioned by {@code day}.
 *
 * @since 1.0.0
 */
public final class AggregateDailyExtendedTable extends BillingTable {

    public AggregateDailyExtendedTable(String tableName) {
        super(tableName, columns());
    }

    private static Set<BillingColumn> columns() {
        Set<BillingColumn> columns = EnumSet.copyOf(AggregateDailyTable.COLUMNS);
        columns.addAll(BillingColumn.extendedColumns());
        return columns;
    }

    @Override
    public BillingSource getSource() {
        return BillingSource.EXTENDED;
    }

    @Override
    public PartitionPolicy getPartitionPolicy() {
        return DayPartitionPolicy.INSTANCE;
    }
}
