package io.github.costql.billing.aggregation;

import io.github.costql.billing.model.AnalysisCostRecord;
import io.github.costql.billing.model.BillingColumn;
import io.github.costql.billing.model.BillingCostBudgetRecord;
import io.github.costql.billing.model.CostRow;
import io.github.costql.billing.model.InvoiceMonth;
import io.github.costql.billing.model.MonthState;
import io.github.costql.billing.model.RunningCostQuery;
import io.github.costql.billing.model.TotalCostQuery;
import io.github.costql.billing.tables.BillingBackendSelector;
import io.github.costql.billing.tables.BillingTable;
import io.github.costql.billing.warehouse.WarehouseConnection;
import io.github.costql.billing.warehouse.WarehouseStatement;
import io.github.costql.core.exception.DisallowedFieldException;
import io.github.costql.core.exception.InvalidParameterException;
import io.github.costql.core.exception.MissingParameterException;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Runs total-cost, running-cost and batch summary queries.
 * <p>
 * Every request is validated completely before the first warehouse call. Queries
 * run one after the other on the caller's {@link WarehouseConnection}, which keeps
 * the estimated price of all of them.
 * </p>
 *
 * <h2>Running cost</h2>
 * <ol>
 *   <li>check the field and the invoice month, choose the table</li>
 *   <li>for the current month, look up the last fully loaded day</li>
 *   <li>run the month query, joined with the daily delta for the current month</li>
 *   <li>for GCP projects in the current month, read the budgets</li>
 *   <li>fold the rows with {@link RunningCostRollup}</li>
 * </ol>
 *
 * <pre>{@code
 * CostAggregator aggregator = new CostAggregator(selector, Clock.systemUTC(),
 *     CostCategoryClassifier.prefixHeuristic());
 * List<BillingCostBudgetRecord> records = aggregator.getRunningCost(connection,
 *     RunningCostQuery.of(BillingColumn.TOPIC, "202403"));
 * }</pre>
 *
 * @since 1.0.0
 */
public class CostAggregator {

    private static final Logger log = Logger.getLogger(CostAggregator.class.getName());

    private final BillingBackendSelector selector;
    private final Clock clock;
    private final CostCategoryClassifier classifier;

    public CostAggregator(BillingBackendSelector selector, Clock clock, CostCategoryClassifier classifier) {
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    /**
     * Total cost of the requested fields over a date range.
     *
     * @param connection the caller's connection
     * @param query      the request
     * @return one ordered map per result row; label structs are flattened into the row
     * @throws MissingParameterException if dates or fields are missing
     * @throws InvalidParameterException if a date or paging value is malformed
     * @throws DisallowedFieldException  if a field, filter or ordering column is not in the chosen table
     */
    public List<Map<String, Object>> getTotalCost(WarehouseConnection connection, TotalCostQuery query) {
        TotalCostStatement.validate(query);
        BillingTable table = selector.selectForTotalCost(query.getSource(), query.getFields(), query.getFilters());
        WarehouseStatement statement = TotalCostStatement.build(table, query);

        List<Map<String, Object>> rows = statement.executeOn(connection);
        List<Map<String, Object>> results = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            results.add(flattenLabels(row));
        }
        return results;
    }

    /**
     * Running cost of one invoice month grouped by one field.
     *
     * @param connection the caller's connection
     * @param query      the request
     * @return the synthetic total first, then one record per field value; empty when no cost was found
     * @throws DisallowedFieldException  if the field cannot be grouped on for running cost
     * @throws MissingParameterException if the invoice month is missing
     * @throws InvalidParameterException if the invoice month is malformed
     */
    public List<BillingCostBudgetRecord> getRunningCost(WarehouseConnection connection, RunningCostQuery query) {
        BillingColumn field = query.field();
        BillingTable table = selector.selectForRunningCost(query.source(), field, query.filters());
        InvoiceMonth month = InvoiceMonth.parse(query.invoiceMonth());
        MonthState state = MonthState.of(month, LocalDate.now(clock));

        String lastLoadedDay = null;
        if (state.isCurrent()) {
            lastLoadedDay = lastLoadedDay(connection, table);
        }

        List<Map<String, Object>> rows = RunningCostStatement
                .build(table, field, month, query.filters(), lastLoadedDay)
                .executeOn(connection);
        if (rows.isEmpty()) {
            log.fine(() -> String.format("No running cost for %s in %s", field, month));
            return List.of();
        }

        RunningCostRollup rollup = new RunningCostRollup(field, state, LastLoadedDay.toDisplay(lastLoadedDay), classifier);
        for (Map<String, Object> row : rows) {
            rollup.add(toCostRow(row));
        }

        Map<String, Double> budgets = field == BillingColumn.GCP_PROJECT && state.isCurrent()
                ? BudgetLookup.fetch(connection)
                : Map.of();
        return rollup.build(budgets);
    }

    /**
     * Cost summary of one analysis run.
     *
     * @param connection the caller's connection
     * @param arGuid     the analysis run
     * @return one record, or none when the run has no batches
     * @throws MissingParameterException if {@code arGuid} is blank
     */
    public List<AnalysisCostRecord> getCostByArGuid(WarehouseConnection connection, String arGuid) {
        requireId("ar_guid", arGuid);
        return summarize(connection, BatchLookup.forRun(connection, arGuid));
    }

    /**
     * Cost summary of the analysis run a batch belongs to, or of the batch alone when
     * it belongs to none.
     *
     * @param connection the caller's connection
     * @param batchId    the batch
     * @return one record, or none when the batch is unknown
     * @throws MissingParameterException if {@code batchId} is blank
     * @throws InvalidParameterException if the batch belongs to more than one analysis run
     */
    public List<AnalysisCostRecord> getCostByBatchId(WarehouseConnection connection, String batchId) {
        requireId("batch_id", batchId);
        return summarize(connection, BatchLookup.forBatch(connection, batchId));
    }

    private List<AnalysisCostRecord> summarize(WarehouseConnection connection, BatchLookup.Scope scope) {
        if (scope == null) {
            log.fine("No batches found for the batch summary");
            return List.of();
        }
        List<Map<String, Object>> rows = BatchCostStatement
                .build(selector.selectForBatchSummary(), scope)
                .executeOn(connection);
        List<AnalysisCostRecord> records = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            records.add(AnalysisCostRows.toRecord(row));
        }
        return records;
    }

    private static void requireId(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new MissingParameterException(name + " is required");
        }
    }

    private String lastLoadedDay(WarehouseConnection connection, BillingTable table) {
        List<Map<String, Object>> rows = RunningCostStatement
                .lastLoadedDay(table, connection.getConfig().getDaysBackOptimal())
                .executeOn(connection);
        if (rows.isEmpty()) {
            return null;
        }
        String lastLoadedDay = LastLoadedDay.toParameter(rows.get(0).get("last_loaded_day"));
        if (lastLoadedDay == null) {
            log.warning(() -> String.format("No loaded day found in %s within %d days",
                    table.getTableName(), connection.getConfig().getDaysBackOptimal()));
        }
        return lastLoadedDay;
    }

    static CostRow toCostRow(Map<String, Object> row) {
        Object field = row.get("field");
        Object category = row.get("cost_category");
        return new CostRow(
                field == null ? "N/A" : field.toString(),
                category == null ? "N/A" : category.toString(),
                WarehouseValues.number(row.get("monthly_cost")),
                row.get("daily_cost") == null ? null : WarehouseValues.number(row.get("daily_cost")));
    }

    /**
     * Copies {@code row} and adds every {@code labels} key/value struct as a column.
     * Existing columns are never overwritten by a label of the same name.
     */
    static Map<String, Object> flattenLabels(Map<String, Object> row) {
        Map<String, Object> flat = new LinkedHashMap<>(row);
        if (row.get(BillingColumn.LABELS.getColumn()) instanceof List<?> labels) {
            for (Object label : labels) {
                if (label instanceof Map<?, ?> struct && struct.get("key") != null) {
                    flat.putIfAbsent(struct.get("key").toString(), struct.get("value"));
                }
            }
        }
        return Collections.unmodifiableMap(flat);
    }
}
