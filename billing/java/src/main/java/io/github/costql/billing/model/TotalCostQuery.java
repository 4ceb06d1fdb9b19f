package io.github.costql.billing.model;

import io.github.costql.core.model.FilterModel;
import io.github.costql.core.model.FilterOp;
import io.github.costql.core.time.TimeColumn;
import io.github.costql.core.time.TimeGranularity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cost of arbitrary grouping fields over a date range.
 * <p>
 * Dates stay as the caller sent them ({@code yyyy-MM-dd}) and are validated when the
 * query runs, so that a bad request is reported with the other validation errors.
 * {@code orderBy} maps a column to {@code true} for descending order.
 * </p>
 *
 * <pre>{@code
 * TotalCostQuery query = TotalCostQuery.builder()
 *     .startDate("2024-03-01")
 *     .endDate("2024-03-31")
 *     .fields(List.of(BillingColumn.TOPIC, BillingColumn.COST_CATEGORY))
 *     .filters(FilterModel.builder().field("topic", "hail").build())
 *     .timePeriods(TimeGranularity.MONTH)
 *     .orderBy(BillingColumn.COST_CATEGORY, false)
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class TotalCostQuery {

    private final String startDate;
    private final String endDate;
    private final List<BillingColumn> fields;
    private final FilterModel filters;
    private final boolean groupBy;
    private final TimeGranularity timePeriods;
    private final TimeColumn timeColumn;
    private final BillingSource source;
    private final Map<BillingColumn, Boolean> orderBy;
    private final Double minCost;
    private final Integer limit;
    private final Integer offset;

    private TotalCostQuery(Builder builder) {
        this.startDate = builder._startDate;
        this.endDate = builder._endDate;
        this.fields = Collections.unmodifiableList(new ArrayList<>(builder._fields));
        FilterModel model = builder._filters == null ? FilterModel.empty() : builder._filters;
        this.filters = builder._filtersOp == null ? model : model.toBuilder().filtersOp(builder._filtersOp).build();
        this.groupBy = builder._groupBy;
        this.timePeriods = builder._timePeriods;
        this.timeColumn = builder._timeColumn;
        this.source = builder._source == null ? BillingSource.AGGREGATE : builder._source;
        this.orderBy = Collections.unmodifiableMap(new LinkedHashMap<>(builder._orderBy));
        this.minCost = builder._minCost;
        this.limit = builder._limit;
        this.offset = builder._offset;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getStartDate() { return startDate; }
    public String getEndDate() { return endDate; }
    public List<BillingColumn> getFields() { return fields; }
    public FilterModel getFilters() { return filters; }
    public boolean isGroupBy() { return groupBy; }
    public TimeGranularity getTimePeriods() { return timePeriods; }
    public TimeColumn getTimeColumn() { return timeColumn; }
    public BillingSource getSource() { return source; }
    public Map<BillingColumn, Boolean> getOrderBy() { return orderBy; }
    public Double getMinCost() { return minCost; }
    public Integer getLimit() { return limit; }
    public Integer getOffset() { return offset; }

    public static class Builder {
        private String _startDate;
        private String _endDate;
        private final List<BillingColumn> _fields = new ArrayList<>();
        private FilterModel _filters;
        private FilterOp _filtersOp;
        private boolean _groupBy = true;
        private TimeGranularity _timePeriods;
        private TimeColumn _timeColumn;
        private BillingSource _source;
        private final Map<BillingColumn, Boolean> _orderBy = new LinkedHashMap<>();
        private Double _minCost;
        private Integer _limit;
        private Integer _offset;

        private Builder() {
        }

        public Builder startDate(String startDate) {
            this._startDate = startDate;
            return this;
        }

        public Builder endDate(String endDate) {
            this._endDate = endDate;
            return this;
        }

        public Builder fields(List<BillingColumn> fields) {
            this._fields.clear();
            if (fields != null) {
                this._fields.addAll(fields);
            }
            return this;
        }

        public Builder filters(FilterModel filters) {
            this._filters = filters;
            return this;
        }

        /**
         * Overrides the join operator of {@link #filters(FilterModel)}.
         */
        public Builder filtersOp(FilterOp filtersOp) {
            this._filtersOp = filtersOp;
            return this;
        }

        public Builder groupBy(boolean groupBy) {
            this._groupBy = groupBy;
            return this;
        }

        public Builder timePeriods(TimeGranularity timePeriods) {
            this._timePeriods = timePeriods;
            return this;
        }

        public Builder timeColumn(TimeColumn timeColumn) {
            this._timeColumn = timeColumn;
            return this;
        }

        public Builder source(BillingSource source) {
            this._source = source;
            return this;
        }

        public Builder orderBy(BillingColumn column, boolean descending) {
            this._orderBy.put(column, descending);
            return this;
        }

        public Builder minCost(Double minCost) {
            this._minCost = minCost;
            return this;
        }

        public Builder limit(Integer limit) {
            this._limit = limit;
            return this;
        }

        public Builder offset(Integer offset) {
            this._offset = offset;
            return this;
        }

        public TotalCostQuery build() {
            return new TotalCostQuery(this);
        }
    }
}
