package io.github.costql.billing.aggregation;

import io.github.costql.billing.model.BillingColumn;
import io.github.costql.billing.model.TotalCostQuery;
import io.github.costql.billing.tables.BillingTable;
import io.github.costql.billing.tables.LabelFilter;
import io.github.costql.billing.warehouse.WarehouseParameters;
import io.github.costql.billing.warehouse.WarehouseStatement;
import io.github.costql.core.exception.InvalidParameterException;
import io.github.costql.core.exception.MissingParameterException;
import io.github.costql.core.impl.PredicateCompiler;
import io.github.costql.core.impl.WarehouseDialect;
import io.github.costql.core.model.CompiledPredicate;
import io.github.costql.core.model.FilterEntry;
import io.github.costql.core.model.FilterModel;
import io.github.costql.core.model.ParameterBinding;
import io.github.costql.core.partition.PartitionWindow;
import io.github.costql.core.time.TimeColumn;
import io.github.costql.core.time.TimeGrouping;
import io.github.costql.core.time.TimeGroupingPlanner;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the total-cost query of one {@link TotalCostQuery} against one table.
 *
 * <h2>Shape</h2>
 * <pre>
 * [CREATE TEMP FUNCTION getLabelValue(...);]
 * WITH t AS (
 *     SELECT [bucket as day, ]fields, SUM(cost) as cost
 *     FROM `table`
 *     WHERE partition bounds [AND filters] [AND (label filters)]
 *     GROUP BY day,fields
 *     [ORDER BY ...]
 * )
 * SELECT [PARSE_DATE(...) as day, ]fields, cost FROM t[ WHERE cost > @min_cost][ LIMIT @limit_val][ OFFSET @offset_val]
 * </pre>
 * <p>
 * Partition bounds are compiled apart from the caller's filters and always ANDed,
 * so an {@code OR} join never widens the scan. A caller filter on a partition
 * column is replaced by the bound.
 * </p>
 *
 * @since 1.0.0
 */
final class TotalCostStatement {

    private static final String INDENT = "    ";

    private TotalCostStatement() {
    }

    /**
     * Checks the parts of {@code query} that do not depend on the table.
     *
     * @throws MissingParameterException if a date or the fields are missing
     * @throws InvalidParameterException if a date is malformed, the range is reversed,
     *                                   or limit/offset is negative
     */
    static void validate(TotalCostQuery query) {
        if (isBlank(query.getStartDate()) || isBlank(query.getEndDate()) || query.getFields().isEmpty()) {
            throw new MissingParameterException("Date and Fields are required");
        }
        LocalDate start = parseDate("startDate", query.getStartDate());
        LocalDate end = parseDate("endDate", query.getEndDate());
        if (end.isBefore(start)) {
            throw new InvalidParameterException(
                    String.format("endDate %s is before startDate %s", end, start));
        }
        if (query.getLimit() != null && query.getLimit() < 0) {
            throw new InvalidParameterException("limit must not be negative, got: " + query.getLimit());
        }
        if (query.getOffset() != null && query.getOffset() < 0) {
            throw new InvalidParameterException("offset must not be negative, got: " + query.getOffset());
        }
        if (query.isGroupBy() && query.getFields().contains(BillingColumn.LABELS)) {
            throw new InvalidParameterException("labels cannot be selected when rows are grouped");
        }
    }

    /**
     * @param table the table chosen for {@code query}
     * @param query a query that passed {@link #validate(TotalCostQuery)}
     * @return the statement
     */
    static WarehouseStatement build(BillingTable table, TotalCostQuery query) {
        LocalDate start = LocalDate.parse(query.getStartDate());
        LocalDate end = LocalDate.parse(query.getEndDate());

        TimeColumn timeColumn = query.getTimeColumn() == null ? TimeColumn.DAY : query.getTimeColumn();
        table.requireColumns(List.of(BillingColumn.parse(timeColumn.getColumn())));
        table.requireColumns(query.getOrderBy().keySet());
        TimeGrouping time = TimeGroupingPlanner.plan(query.getTimePeriods(), timeColumn);

        CompiledPredicate where = partitionPredicate(table, start, end)
                .and(filterPredicate(table, query.getFilters(), start, end));

        CompiledPredicate labels = CompiledPredicate.TRUE;
        FilterEntry labelEntry = query.getFilters().get(BillingColumn.LABELS.getColumn());
        if (labelEntry != null) {
            labels = LabelFilter.compile(labelEntry, query.getFilters().filtersOp());
            where = where.and(labels);
        }

        List<String> fields = selectedFields(query, time);
        String costColumn = query.isGroupBy() ? "SUM(cost) as cost" : "cost";

        List<String> inner = new ArrayList<>();
        if (!time.isNone()) {
            inner.add(time.field());
        }
        inner.addAll(fields);
        inner.add(costColumn);

        List<String> outer = new ArrayList<>();
        if (!time.isNone()) {
            outer.add(time.formula());
        }
        outer.addAll(fields);
        outer.add("cost");

        StringBuilder sql = new StringBuilder();
        if (!labels.isTrue()) {
            sql.append(LabelFilter.FUNCTION_DEFINITION).append("\n\n");
        }
        sql.append("WITH t AS (\n")
                .append(INDENT).append("SELECT ").append(String.join(", ", inner)).append('\n')
                .append(INDENT).append("FROM ").append(table.quoted()).append('\n')
                .append(INDENT).append("WHERE ").append(where.text()).append('\n');
        if (query.isGroupBy()) {
            sql.append(INDENT).append("GROUP BY ").append(String.join(",", groupColumns(query))).append('\n');
        }
        String orderBy = orderBy(query.getOrderBy());
        if (!orderBy.isEmpty()) {
            sql.append(INDENT).append(orderBy).append('\n');
        }
        sql.append(")\n")
                .append("SELECT ").append(String.join(", ", outer)).append(" FROM t");

        List<ParameterBinding> parameters = new ArrayList<>(where.bindings());
        if (query.getMinCost() != null && query.getMinCost() != 0d) {
            sql.append(" WHERE cost > @min_cost");
            parameters.add(WarehouseParameters.float64("min_cost", query.getMinCost()));
        }
        if (query.getLimit() != null && query.getLimit() > 0) {
            sql.append(" LIMIT @limit_val");
            parameters.add(WarehouseParameters.int64("limit_val", query.getLimit()));
        }
        if (query.getOffset() != null && query.getOffset() > 0) {
            sql.append(" OFFSET @offset_val");
            parameters.add(WarehouseParameters.int64("offset_val", query.getOffset()));
        }
        return new WarehouseStatement(sql.toString(), parameters);
    }

    private static CompiledPredicate partitionPredicate(BillingTable table, LocalDate start, LocalDate end) {
        FilterModel bounds = table.partitioned(FilterModel.empty(), start, end);
        return PredicateCompiler.compile(bounds, WarehouseDialect.INSTANCE);
    }

    private static CompiledPredicate filterPredicate(BillingTable table, FilterModel filters,
                                                     LocalDate start, LocalDate end) {
        FilterModel.Builder builder = filters.toBuilder().remove(BillingColumn.LABELS.getColumn());
        for (PartitionWindow window : table.getPartitionPolicy().windows(start, end)) {
            builder.remove(window.column());
        }
        FilterModel remaining = builder.build();
        return remaining.isEmpty()
                ? CompiledPredicate.TRUE
                : PredicateCompiler.compile(remaining, WarehouseDialect.INSTANCE);
    }

    private static List<String> selectedFields(TotalCostQuery query, TimeGrouping time) {
        List<String> fields = new ArrayList<>();
        for (BillingColumn field : query.getFields()) {
            if (field == BillingColumn.COST || fields.contains(field.getColumn())) {
                continue;
            }
            // the bucket is already selected as day
            if (field == BillingColumn.DAY && !time.isNone()) {
                continue;
            }
            fields.add(field.getColumn());
        }
        return fields;
    }

    private static List<String> groupColumns(TotalCostQuery query) {
        List<String> columns = new ArrayList<>();
        columns.add(BillingColumn.DAY.getColumn());
        for (BillingColumn field : query.getFields()) {
            if (field.canGroupBy() && !columns.contains(field.getColumn())) {
                columns.add(field.getColumn());
            }
        }
        return columns;
    }

    static String orderBy(Map<BillingColumn, Boolean> orderBy) {
        if (orderBy.isEmpty()) {
            return "";
        }
        return "ORDER BY " + orderBy.entrySet().stream()
                .map(e -> e.getKey().getColumn() + (Boolean.TRUE.equals(e.getValue()) ? " DESC" : " ASC"))
                .collect(Collectors.joining(","));
    }

    private static LocalDate parseDate(String name, String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new InvalidParameterException(
                    String.format("%s must be a yyyy-MM-dd date, got: %s", name, value), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
