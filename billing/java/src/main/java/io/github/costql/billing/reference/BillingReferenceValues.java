package io.github.costql.billing.reference;

import io.github.costql.billing.config.BillingConfig;
import io.github.costql.billing.model.BillingColumn;
import io.github.costql.billing.warehouse.WarehouseClient;
import io.github.costql.billing.warehouse.WarehouseConnection;
import io.github.costql.billing.warehouse.WarehouseParameters;
import io.github.costql.billing.warehouse.WarehouseStatement;
import io.github.costql.core.cache.BoundedTtlCache;
import io.github.costql.core.config.CachePolicy;
import io.github.costql.core.exception.DisallowedFieldException;
import io.github.costql.core.exception.InvalidParameterException;
import io.github.costql.core.model.ParameterBinding;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Distinct values used to populate filter choices: topics, GCP projects, cost
 * categories, invoice months, SKUs and the values of some extended columns.
 * <p>
 * Lookups other than invoice months only scan the last
 * {@link BillingConfig#getDaysBackOptimal()} days. Results are cached in a
 * {@link BoundedTtlCache} owned by this instance; each load runs on a fresh
 * {@link WarehouseConnection}.
 * </p>
 *
 * <pre>{@code
 * BillingReferenceValues references = new BillingReferenceValues(client, config, CachePolicy.defaults());
 * List<String> topics = references.topics();
 * references.invalidate(BillingReferenceValues.TOPICS);
 * }</pre>
 *
 * @since 1.0.0
 */
public class BillingReferenceValues {

    private static final Logger log = Logger.getLogger(BillingReferenceValues.class.getName());

    public static final String TOPICS = "topics";
    public static final String GCP_PROJECTS = "gcp_projects";
    public static final String COST_CATEGORIES = "cost_categories";
    public static final String INVOICE_MONTHS = "invoice_months";

    /**
     * Extended columns whose distinct values can be listed.
     */
    public static final Set<BillingColumn> EXTENDED_VALUE_COLUMNS = EnumSet.of(
            BillingColumn.DATASET,
            BillingColumn.STAGE,
            BillingColumn.SEQUENCING_TYPE,
            BillingColumn.SEQUENCING_GROUP,
            BillingColumn.COMPUTE_CATEGORY,
            BillingColumn.CROMWELL_SUB_WORKFLOW_NAME,
            BillingColumn.WDL_TASK_NAME);

    private final WarehouseClient client;
    private final BillingConfig config;
    private final BoundedTtlCache<String, List<String>> cache;

    public BillingReferenceValues(WarehouseClient client, BillingConfig config, CachePolicy cachePolicy) {
        this(client, config, new BoundedTtlCache<>(cachePolicy));
    }

    BillingReferenceValues(WarehouseClient client, BillingConfig config, BoundedTtlCache<String, List<String>> cache) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
    }

    public List<String> topics() {
        return cache.computeIfAbsent(TOPICS, key ->
                load(key, recentDistinct("topic", config.getAggregateView(), "day"), "topic"));
    }

    public List<String> gcpProjects() {
        return cache.computeIfAbsent(GCP_PROJECTS, key ->
                load(key, recentDistinct("gcp_project", config.getGcpBillingView(), "part_time",
                        "gcp_project IS NOT NULL"), "gcp_project"));
    }

    public List<String> costCategories() {
        return cache.computeIfAbsent(COST_CATEGORIES, key ->
                load(key, recentDistinct("cost_category", config.getAggregateView(), "day"), "cost_category"));
    }

    /**
     * All invoice months, newest first. Not bounded by the lookback window.
     */
    public List<String> invoiceMonths() {
        return cache.computeIfAbsent(INVOICE_MONTHS, key -> {
            String sql = "SELECT DISTINCT invoice_month\n"
                    + "FROM `" + config.getAggregateView() + "`\n"
                    + "ORDER BY invoice_month DESC";
            return run(key, new WarehouseStatement(sql, List.of()), "invoice_month");
        });
    }

    /**
     * @param limit  page size, {@code null} or 0 for all
     * @param offset rows to skip, {@code null} or 0 for none
     * @throws InvalidParameterException if either value is negative
     */
    public List<String> skus(Integer limit, Integer offset) {
        if ((limit != null && limit < 0) || (offset != null && offset < 0)) {
            throw new InvalidParameterException(
                    String.format("limit and offset must not be negative, got: %s, %s", limit, offset));
        }
        String cacheKey = "skus:" + limit + ":" + offset;
        return cache.computeIfAbsent(cacheKey, key -> {
            StringBuilder sql = new StringBuilder(recentDistinct("sku", config.getAggregateView(), "day"));
            List<ParameterBinding> parameters = new ArrayList<>(List.of(days()));
            if (limit != null && limit > 0) {
                sql.append(" LIMIT @limit_val");
                parameters.add(WarehouseParameters.int64("limit_val", limit));
            }
            if (offset != null && offset > 0) {
                sql.append(" OFFSET @offset_val");
                parameters.add(WarehouseParameters.int64("offset_val", offset));
            }
            return run(key, new WarehouseStatement(sql.toString(), parameters), "sku");
        });
    }

    /**
     * @param column one of {@link #EXTENDED_VALUE_COLUMNS}
     * @return the distinct non-null values of {@code column} in the extended view
     * @throws DisallowedFieldException for any other column
     */
    public List<String> extendedValues(BillingColumn column) {
        if (column == null || !EXTENDED_VALUE_COLUMNS.contains(column)) {
            throw new DisallowedFieldException(column == null ? null : column.getColumn(),
                    EXTENDED_VALUE_COLUMNS.stream().map(BillingColumn::getColumn).collect(Collectors.toList()));
        }
        String name = column.getColumn();
        return cache.computeIfAbsent("extended:" + name, key -> {
            String sql = "SELECT DISTINCT " + name + "\n"
                    + "FROM `" + config.getExtendedView() + "`\n"
                    + "WHERE " + name + " IS NOT NULL\n"
                    + "AND day > TIMESTAMP_ADD(CURRENT_TIMESTAMP(), INTERVAL @days DAY)\n"
                    + "ORDER BY 1 ASC";
            return run(key, new WarehouseStatement(sql, List.of(days())), name);
        });
    }

    public void invalidate(String key) {
        cache.invalidate(key);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public String getCacheStats() {
        return cache.getStats();
    }

    private static String recentDistinct(String column, String view, String partitionColumn) {
        return recentDistinct(column, view, partitionColumn, null);
    }

    private static String recentDistinct(String column, String view, String partitionColumn, String condition) {
        return "SELECT DISTINCT " + column + "\n"
                + "FROM `" + view + "`\n"
                + "WHERE " + partitionColumn + " > TIMESTAMP_ADD(CURRENT_TIMESTAMP(), INTERVAL @days DAY)\n"
                + (condition == null ? "" : "AND " + condition + "\n")
                + "ORDER BY " + column + " ASC";
    }

    private ParameterBinding days() {
        return WarehouseParameters.int64("days", -config.getDaysBackOptimal());
    }

    private List<String> load(String key, String sql, String column) {
        return run(key, new WarehouseStatement(sql, List.of(days())), column);
    }

    private List<String> run(String key, WarehouseStatement statement, String column) {
        WarehouseConnection connection = new WarehouseConnection(client, config);
        List<String> values = statement.executeOn(connection).stream()
                .map(row -> row.get(column))
                .filter(Objects::nonNull)
                .map(Object::toString)
                .collect(Collectors.toUnmodifiableList());
        log.fine(() -> String.format("Loaded %d values for %s", values.size(), key));
        return values;
    }
}
