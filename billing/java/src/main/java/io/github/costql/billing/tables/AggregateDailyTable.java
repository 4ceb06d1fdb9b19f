package io.github.costql.billing.tables;

import io.github.costql.billing.model.BillingColumn;
import io.github.costql.billing.model.BillingSource;
import io.github.costql.core.partition.DayPartitionPolicy;
import io.github.costql.core.partition.PartitionPolicy;

import java.util.EnumSet;
import java.util.Set;

/**
 * Daily aggregate view, partitioned by {@code day}.
 *
 * @since 1.0.0
 */
public final class AggregateDailyTable extends BillingTable {

    static final Set<BillingColumn> COLUMNS = EnumSet.of(
            BillingColumn.TOPIC, BillingColumn.GCP_PROJECT, BillingColumn.SKU, BillingColumn.CURRENCY,
            BillingColumn.COST, BillingColumn.LABELS, BillingColumn.DAY, BillingColumn.COST_CATEGORY,
            BillingColumn.INVOICE_MONTH, BillingColumn.AR_GUID);

    public AggregateDailyTable(String tableName) {
        super(tableName, COLUMNS);
    }

    @Override
    public BillingSource getSource() {
        return BillingSource.AGGREGATE;
    }

    @Override
    public PartitionPolicy getPartitionPolicy() {
        return DayPartitionPolicy.INSTANCE;
    }
}
