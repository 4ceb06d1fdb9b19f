package io.github.costql.billing.aggregation;

import io.github.costql.billing.model.BillingColumn;
import io.github.costql.billing.model.InvoiceMonth;
import io.github.costql.billing.tables.BillingTable;
import io.github.costql.billing.tables.LabelFilter;
import io.github.costql.billing.warehouse.WarehouseParameters;
import io.github.costql.billing.warehouse.WarehouseStatement;
import io.github.costql.core.impl.PredicateCompiler;
import io.github.costql.core.impl.WarehouseDialect;
import io.github.costql.core.model.CompiledPredicate;
import io.github.costql.core.model.FilterEntry;
import io.github.costql.core.model.FilterModel;
import io.github.costql.core.model.ParameterBinding;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the queries of a running-cost request.
 * <p>
 * The month subquery sums cost per (field, cost category) for one invoice month,
 * keeping groups above {@value #MIN_MONTHLY_COST}. When a last loaded day is given
 * the cost of that single day is LEFT JOINed as {@code daily_cost}; otherwise
 * {@code daily_cost} is {@code NULL}.
 * </p>
 *
 * @since 1.0.0
 */
final class RunningCostStatement {

    static final String MIN_MONTHLY_COST = "0.1";

    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final String INDENT = "    ";

    private RunningCostStatement() {
    }

    /**
     * @param table    the table to read
     * @param lookback days of partitions scanned, e.g. 40
     * @return the statement returning one {@code last_loaded_day} row
     */
    static WarehouseStatement lastLoadedDay(BillingTable table, int lookback) {
        return new WarehouseStatement(table.lastLoadedDayQuery(),
                List.of(WarehouseParameters.int64("days", -lookback)));
    }

    /**
     * @param table         the table to read
     * @param field         the grouping column
     * @param month         the invoice month
     * @param filters       extra filters, may be empty
     * @param lastLoadedDay parameter form of the last loaded day, {@code null} to skip the daily join
     * @return the statement returning {@code field}, {@code cost_category}, {@code monthly_cost}
     *         and {@code daily_cost}
     */
    static WarehouseStatement build(BillingTable table, BillingColumn field, InvoiceMonth month,
                                    FilterModel filters, String lastLoadedDay) {
        CompiledPredicate where = filterPredicate(filters);
        boolean labels = filters.contains(BillingColumn.LABELS.getColumn());

        StringBuilder sql = new StringBuilder();
        if (labels) {
            sql.append(LabelFilter.FUNCTION_DEFINITION).append("\n\n");
        }
        sql.append("SELECT\n")
                .append(INDENT).append("CASE WHEN month.field IS NULL THEN 'N/A' ELSE month.field END as field,\n")
                .append(INDENT).append("month.cost_category,\n")
                .append(INDENT).append("month.cost as monthly_cost,\n")
                .append(INDENT).append(lastLoadedDay == null ? "NULL as daily_cost" : "day.cost as daily_cost").append('\n')
                .append("FROM\n(\n")
                .append(INDENT).append("SELECT ").append(field.getColumn()).append(" as field, cost_category, SUM(cost) as cost\n")
                .append(INDENT).append("FROM ").append(table.quoted()).append('\n')
                .append(INDENT).append("WHERE ").append(table.getPartitionPolicy().runningCostClause()).append('\n');
        if (!where.isTrue()) {
            sql.append(INDENT).append("AND ").append(where.text()).append('\n');
        }
        sql.append(INDENT).append("AND invoice_month = @invoice_month\n")
                .append(INDENT).append("GROUP BY field, cost_category\n")
                .append(INDENT).append("HAVING cost > ").append(MIN_MONTHLY_COST).append('\n')
                .append(") month\n");

        if (lastLoadedDay != null) {
            String delta = table.getPartitionPolicy().dailyDeltaClause();
            sql.append("LEFT JOIN (\n")
                    .append(INDENT).append("SELECT ").append(field.getColumn()).append(" as field, cost_category, SUM(cost) as cost\n")
                    .append(INDENT).append("FROM ").append(table.quoted()).append('\n')
                    .append(INDENT).append("WHERE day = TIMESTAMP(@last_loaded_day)")
                    .append(delta.isEmpty() ? "" : " " + delta).append('\n')
                    .append(INDENT).append("GROUP BY field, cost_category\n")
                    .append(") day\n")
                    .append("ON month.field = day.field\n")
                    .append("AND month.cost_category = day.cost_category\n");
        }
        sql.append("ORDER BY field ASC, daily_cost DESC, monthly_cost DESC");

        List<ParameterBinding> parameters = new ArrayList<>(where.bindings());
        parameters.add(WarehouseParameters.string("start_day", DAY_FORMAT.format(month.scanStart())));
        parameters.add(WarehouseParameters.string("last_day", DAY_FORMAT.format(month.scanEnd())));
        parameters.add(WarehouseParameters.string("invoice_month", month.code()));
        if (lastLoadedDay != null) {
            parameters.add(WarehouseParameters.string("last_loaded_day", lastLoadedDay));
        }
        return new WarehouseStatement(sql.toString(), parameters);
    }

    private static CompiledPredicate filterPredicate(FilterModel filters) {
        FilterModel plain = filters.toBuilder().remove(BillingColumn.LABELS.getColumn()).build();
        CompiledPredicate where = plain.isEmpty()
                ? CompiledPredicate.TRUE
                : PredicateCompiler.compile(plain, WarehouseDialect.INSTANCE);
        FilterEntry labels = filters.get(BillingColumn.LABELS.getColumn());
        if (labels != null) {
            where = where.and(LabelFilter.compile(labels, filters.filtersOp()));
        }
        return where;
    }
}
