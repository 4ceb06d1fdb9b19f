package io.github.costql.billing.tables;

import io.github.costql.billing.model.BillingColumn;
import io.github.costql.billing.model.BillingSource;
import io.github.costql.core.exception.DisallowedFieldException;
import io.github.costql.core.model.FilterModel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Chooses the table that serves a billing query.
 * <p>
 * Selection is a pure function of the requested source, the requested columns and
 * the filtered columns:
 * </p>
 * <ul>
 *   <li>any extended column, selected or filtered, selects the extended view</li>
 *   <li>otherwise the requested source's table serves the query</li>
 *   <li>running-cost queries have no raw variant and fall back to the aggregate view</li>
 * </ul>
 * <p>
 * The chosen table then checks that it has every requested column.
 * </p>
 *
 * @since 1.0.0
 */
public class BillingBackendSelector {

    private static final Logger log = Logger.getLogger(BillingBackendSelector.class.getName());

    /**
     * Fields a running-cost query can group on.
     */
    public static final Set<BillingColumn> RUNNING_COST_FIELDS = EnumSet.of(
            BillingColumn.TOPIC,
            BillingColumn.GCP_PROJECT,
            BillingColumn.DATASET,
            BillingColumn.STAGE,
            BillingColumn.COMPUTE_CATEGORY,
            BillingColumn.WDL_TASK_NAME,
            BillingColumn.CROMWELL_SUB_WORKFLOW_NAME,
            BillingColumn.NAMESPACE);

    private final BillingTables tables;

    public BillingBackendSelector(BillingTables tables) {
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
    }

    /**
     * @param source  the requested source, {@code null} for the aggregate view
     * @param fields  the selected columns
     * @param filters the filters; every top-level name must be a billing column
     * @return the table serving the query
     * @throws DisallowedFieldException if a column is unknown or missing from the chosen table
     */
    public BillingTable selectForTotalCost(BillingSource source, Collection<BillingColumn> fields, FilterModel filters) {
        List<BillingColumn> requested = new ArrayList<>(fields);
        requested.addAll(filterColumns(filters));

        BillingTable table = requested.stream().anyMatch(BillingColumn::isExtended)
                ? tables.extended()
                : tables.forSource(source == null ? BillingSource.AGGREGATE : source);
        table.requireColumns(requested);

        log.fine(() -> String.format("Total cost for %s from %s", requested, table));
        return table;
    }

    /**
     * @param source the requested source, {@code null} for the aggregate view
     * @param field  the grouping column
     * @param filters the filters
     * @return the table serving the query
     * @throws DisallowedFieldException if {@code field} cannot be grouped on for running cost,
     *                                  or a filtered column is unknown or missing
     */
    public BillingTable selectForRunningCost(BillingSource source, BillingColumn field, FilterModel filters) {
        if (field == null || !RUNNING_COST_FIELDS.contains(field)) {
            throw new DisallowedFieldException(field == null ? null : field.getColumn(),
                    RUNNING_COST_FIELDS.stream().map(BillingColumn::getColumn).collect(Collectors.toList()));
        }
        List<BillingColumn> filtered = filterColumns(filters);

        BillingTable table;
        if (field.isExtended() || filtered.stream().anyMatch(BillingColumn::isExtended)) {
            table = tables.extended();
        } else if (source == BillingSource.GCP_BILLING) {
            table = tables.gcpBilling();
        } else {
            table = tables.aggregate();
        }
        table.requireColumns(filtered);

        log.fine(() -> String.format("Running cost by %s from %s", field, table));
        return table;
    }

    /**
     * Batch and analysis-run summaries read the batch and workflow columns, which only
     * the extended view has.
     *
     * @return the extended view
     */
    public BillingTable selectForBatchSummary() {
        return tables.extended();
    }

    private static List<BillingColumn> filterColumns(FilterModel filters) {
        if (filters == null) {
            return List.of();
        }
        return filters.entries().keySet().stream().map(BillingColumn::parse).collect(Collectors.toList());
    }
}
