package io.github.costql.billing.model;

import io.github.costql.core.model.FilterModel;

import java.util.Objects;

/**
 * Running cost of one invoice month, grouped by one field.
 *
 * @param field        the grouping column
 * @param invoiceMonth the raw {@code YYYYMM} text, validated when the query runs
 * @param source       the requested table family
 * @param filters      extra filters, empty for none
 * @since 1.0.0
 */
public record RunningCostQuery(BillingColumn field, String invoiceMonth, BillingSource source, FilterModel filters) {

    public RunningCostQuery {
        source = source == null ? BillingSource.AGGREGATE : source;
        filters = filters == null ? FilterModel.empty() : filters;
    }

    public static RunningCostQuery of(BillingColumn field, String invoiceMonth) {
        return new RunningCostQuery(field, invoiceMonth, BillingSource.AGGREGATE, FilterModel.empty());
    }

    public RunningCostQuery withField(BillingColumn other) {
        return new RunningCostQuery(Objects.requireNonNull(other, "field"), invoiceMonth, source, filters);
    }
}
