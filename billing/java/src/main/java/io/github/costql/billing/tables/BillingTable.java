package io.github.costql.billing.tables;

import io.github.costql.billing.model.BillingColumn;
import io.github.costql.billing.model.BillingSource;
import io.github.costql.core.exception.DisallowedFieldException;
import io.github.costql.core.model.FilterModel;
import io.github.costql.core.partition.PartitionPolicy;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Handle of one physical billing table or view.
 * <p>
 * A table knows its name, the columns that can be selected and filtered on, and
 * the {@link PartitionPolicy} that keeps its scans bounded. The set of
 * implementations is closed: {@link AggregateDailyTable},
 * {@link AggregateDailyExtendedTable}, {@link GcpBillingDailyTable} and
 * {@link RawConsolidatedTable}.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class BillingTable {

    private final String tableName;
    private final Set<BillingColumn> columns;

    BillingTable(String tableName, Set<BillingColumn> columns) {
        this.tableName = Objects.requireNonNull(tableName, "tableName must not be null");
        this.columns = Collections.unmodifiableSet(EnumSet.copyOf(columns));
    }

    /**
     * @return the fully qualified name, without backquotes
     */
    public String getTableName() {
        return tableName;
    }

    public abstract BillingSource getSource();

    public abstract PartitionPolicy getPartitionPolicy();

    public Set<BillingColumn> getColumns() {
        return columns;
    }

    public boolean supports(BillingColumn column) {
        return columns.contains(column);
    }

    /**
     * @param requested columns a query selects or filters on
     * @throws DisallowedFieldException for the first column this table does not have
     */
    public void requireColumns(Collection<BillingColumn> requested) {
        for (BillingColumn column : requested) {
            if (!supports(column)) {
                throw new DisallowedFieldException(column.getColumn(), allowedNames());
            }
        }
    }

    /**
     * Adds this table's partition bounds for {@code startDate..endDate} to {@code filters}.
     */
    public FilterModel partitioned(FilterModel filters, LocalDate startDate, LocalDate endDate) {
        return getPartitionPolicy().bound(filters, startDate, endDate);
    }

    public String lastLoadedDayQuery() {
        return getPartitionPolicy().lastLoadedDayQuery(tableName);
    }

    /**
     * @return the name in backquotes, ready for a {@code FROM} clause
     */
    public String quoted() {
        return "`" + tableName + "`";
    }

    List<String> allowedNames() {
        return columns.stream().map(BillingColumn::getColumn).sorted().collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + tableName + "]";
    }
}
