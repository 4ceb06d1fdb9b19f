package io.github.costql.billing.config;

import io.github.costql.core.exception.InternalQueryException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Names of the billing views and the knobs of warehouse queries.
 *
 * <h2>Properties</h2>
 * <p>{@link #fromProperties(Properties)} reads the keys below; absent keys keep the
 * builder defaults.</p>
 * <ul>
 *   <li>{@code costql.billing.aggregate-view}</li>
 *   <li>{@code costql.billing.extended-view}</li>
 *   <li>{@code costql.billing.gcp-billing-view}</li>
 *   <li>{@code costql.billing.raw-table}</li>
 *   <li>{@code costql.billing.budget-view}</li>
 *   <li>{@code costql.billing.batches-view}, the batch to analysis-run lookup</li>
 *   <li>{@code costql.billing.days-back-optimal} (default 40)</li>
 *   <li>{@code costql.billing.cost-per-tb} (default 6.25)</li>
 *   <li>{@code costql.billing.label.<name>} query labels (default {@code source=costql})</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class BillingConfig {

    public static final String PREFIX = "costql.billing.";

    private final String aggregateView;
    private final String extendedView;
    private final String gcpBillingView;
    private final String rawTable;
    private final String budgetView;
    private final String batchesView;
    private final int daysBackOptimal;
    private final double costPerTb;
    private final Map<String, String> queryLabels;

    private BillingConfig(Builder builder) {
        this.aggregateView = builder.aggregateView;
        this.extendedView = builder.extendedView;
        this.gcpBillingView = builder.gcpBillingView;
        this.rawTable = builder.rawTable;
        this.budgetView = builder.budgetView;
        this.batchesView = builder.batchesView;
        this.daysBackOptimal = builder.daysBackOptimal;
        this.costPerTb = builder.costPerTb;
        this.queryLabels = Collections.unmodifiableMap(new LinkedHashMap<>(builder.queryLabels));
    }

    public static Builder builder() { return new Builder(); }

    public static BillingConfig defaults() { return builder().build(); }

    /**
     * Reads a configuration from {@code costql.billing.*} properties.
     *
     * @param properties the properties, e.g. loaded from {@code costql.properties}
     * @return the configuration
     * @throws InternalQueryException if a numeric property cannot be parsed
     */
    public static BillingConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Builder builder = builder();
        String value;
        if ((value = properties.getProperty(PREFIX + "aggregate-view")) != null) builder.aggregateView(value);
        if ((value = properties.getProperty(PREFIX + "extended-view")) != null) builder.extendedView(value);
        if ((value = properties.getProperty(PREFIX + "gcp-billing-view")) != null) builder.gcpBillingView(value);
        if ((value = properties.getProperty(PREFIX + "raw-table")) != null) builder.rawTable(value);
        if ((value = properties.getProperty(PREFIX + "budget-view")) != null) builder.budgetView(value);
        if ((value = properties.getProperty(PREFIX + "batches-view")) != null) builder.batchesView(value);
        try {
            if ((value = properties.getProperty(PREFIX + "days-back-optimal")) != null) {
                builder.daysBackOptimal(Integer.parseInt(value.trim()));
            }
            if ((value = properties.getProperty(PREFIX + "cost-per-tb")) != null) {
                builder.costPerTb(Double.parseDouble(value.trim()));
            }
        } catch (NumberFormatException e) {
            throw new InternalQueryException("Invalid numeric billing property: " + value, e);
        }
        String labelPrefix = PREFIX + "label.";
        for (String name : properties.stringPropertyNames()) {
            if (name.startsWith(labelPrefix)) {
                builder.queryLabel(name.substring(labelPrefix.length()), properties.getProperty(name));
            }
        }
        return builder.build();
    }

    public String getAggregateView() { return aggregateView; }
    public String getExtendedView() { return extendedView; }
    public String getGcpBillingView() { return gcpBillingView; }
    public String getRawTable() { return rawTable; }
    public String getBudgetView() { return budgetView; }
    public String getBatchesView() { return batchesView; }

    /**
     * @return how many days back reference lookups and the last-loaded-day query scan
     */
    public int getDaysBackOptimal() { return daysBackOptimal; }

    /**
     * @return price of one TiB processed, used for the estimated query cost
     */
    public double getCostPerTb() { return costPerTb; }

    /**
     * @return labels attached to every warehouse job
     */
    public Map<String, String> getQueryLabels() { return queryLabels; }

    public static final class Builder {
        private String aggregateView = "billing_aggregate.aggregate_daily_cost";
        private String extendedView = "billing_aggregate.aggregate_daily_cost_extended";
        private String gcpBillingView = "billing.gcp_billing_daily";
        private String rawTable = "billing_aggregate.aggregate";
        private String budgetView = "billing_aggregate.budget";
        private String batchesView = "billing_aggregate.ar_batch_lookup";
        private int daysBackOptimal = 40;
        private double costPerTb = 6.25;
        private final Map<String, String> queryLabels = new LinkedHashMap<>(Map.of("source", "costql"));

        public Builder aggregateView(String name) {
            this.aggregateView = requireName(name, "aggregateView");
            return this;
        }

        public Builder extendedView(String name) {
            this.extendedView = requireName(name, "extendedView");
            return this;
        }

        public Builder gcpBillingView(String name) {
            this.gcpBillingView = requireName(name, "gcpBillingView");
            return this;
        }

        public Builder rawTable(String name) {
            this.rawTable = requireName(name, "rawTable");
            return this;
        }

        public Builder budgetView(String name) {
            this.budgetView = requireName(name, "budgetView");
            return this;
        }

        public Builder batchesView(String name) {
            this.batchesView = requireName(name, "batchesView");
            return this;
        }

        public Builder daysBackOptimal(int days) {
            if (days <= 0) {
                throw new InternalQueryException("daysBackOptimal must be positive, got: " + days);
            }
            this.daysBackOptimal = days;
            return this;
        }

        public Builder costPerTb(double cost) {
            if (cost < 0 || Double.isNaN(cost)) {
                throw new InternalQueryException("costPerTb must not be negative, got: " + cost);
            }
            this.costPerTb = cost;
            return this;
        }

        public Builder queryLabel(String name, String value) {
            this.queryLabels.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public BillingConfig build() { return new BillingConfig(this); }

        private static String requireName(String name, String what) {
            if (name == null || name.isBlank() || name.indexOf('`') >= 0) {
                throw new InternalQueryException("Invalid " + what + ": " + name);
            }
            return name.trim();
        }
    }
}
