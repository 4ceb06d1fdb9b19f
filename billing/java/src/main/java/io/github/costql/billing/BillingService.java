package io.github.costql.billing;

import io.github.costql.billing.aggregation.CostAggregator;
import io.github.costql.billing.aggregation.CostCategoryClassifier;
import io.github.costql.billing.config.BillingConfig;
import io.github.costql.billing.model.AnalysisCostRecord;
import io.github.costql.billing.model.BillingColumn;
import io.github.costql.billing.model.BillingCostBudgetRecord;
import io.github.costql.billing.model.RunningCostQuery;
import io.github.costql.billing.model.TotalCostQuery;
import io.github.costql.billing.tables.BillingBackendSelector;
import io.github.costql.billing.tables.BillingTables;
import io.github.costql.billing.warehouse.WarehouseClient;
import io.github.costql.billing.warehouse.WarehouseConnection;
import io.github.costql.core.exception.FilterValidationException;
import io.github.costql.core.exception.InvalidParameterException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Asynchronous entry point of the billing queries.
 * <p>
 * Each task opens its own {@link WarehouseConnection} and runs on the executor
 * given at construction. {@link #getRunningCosts(RunningCostQuery, List)} fans out
 * one running-cost query per field and joins them; a single failure fails the
 * whole result, and cancelling the returned future abandons the join.
 * </p>
 *
 * <pre>{@code
 * BillingService service = BillingService.create(client, BillingConfig.defaults(), executor);
 * Map<BillingColumn, List<BillingCostBudgetRecord>> costs = service.getRunningCosts(
 *         RunningCostQuery.of(BillingColumn.TOPIC, "202403"),
 *         List.of(BillingColumn.TOPIC, BillingColumn.GCP_PROJECT))
 *     .join();
 * }</pre>
 *
 * @since 1.0.0
 */
public class BillingService {

    private static final Logger log = Logger.getLogger(BillingService.class.getName());

    private final WarehouseClient client;
    private final BillingConfig config;
    private final CostAggregator aggregator;
    private final Executor executor;

    public BillingService(WarehouseClient client, BillingConfig config, CostAggregator aggregator, Executor executor) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /**
     * Wires the default tables, the system UTC clock and the prefix classifier.
     */
    public static BillingService create(WarehouseClient client, BillingConfig config, Executor executor) {
        CostAggregator aggregator = new CostAggregator(
                new BillingBackendSelector(BillingTables.from(config)),
                Clock.systemUTC(),
                CostCategoryClassifier.prefixHeuristic());
        return new BillingService(client, config, aggregator, executor);
    }

    public CompletableFuture<List<Map<String, Object>>> getTotalCost(TotalCostQuery query) {
        return submit("total cost", connection -> aggregator.getTotalCost(connection, query));
    }

    public CompletableFuture<List<BillingCostBudgetRecord>> getRunningCost(RunningCostQuery query) {
        return submit("running cost by " + query.field(), connection -> aggregator.getRunningCost(connection, query));
    }

    public CompletableFuture<List<AnalysisCostRecord>> getCostByArGuid(String arGuid) {
        return submit("cost of analysis run " + arGuid, connection -> aggregator.getCostByArGuid(connection, arGuid));
    }

    public CompletableFuture<List<AnalysisCostRecord>> getCostByBatchId(String batchId) {
        return submit("cost of batch " + batchId, connection -> aggregator.getCostByBatchId(connection, batchId));
    }

    /**
     * Runs {@code base} once per field, concurrently.
     *
     * @param base   the invoice month, source and filters shared by every query
     * @param fields the grouping columns, without duplicates
     * @return records per field, in the order of {@code fields}
     * @throws InvalidParameterException if {@code fields} is empty or repeats a column
     */
    public CompletableFuture<Map<BillingColumn, List<BillingCostBudgetRecord>>> getRunningCosts(
            RunningCostQuery base, List<BillingColumn> fields) {
        if (fields == null || fields.isEmpty() || new LinkedHashSet<>(fields).size() != fields.size()) {
            InvalidParameterException rejected = new InvalidParameterException(
                    "Running cost fields must be a non-empty list without duplicates, got: " + fields);
            log.warning(() -> "Rejected running cost request: " + rejected.getMessage());
            throw rejected;
        }

        List<CompletableFuture<List<BillingCostBudgetRecord>>> futures = new ArrayList<>(fields.size());
        for (BillingColumn field : fields) {
            futures.add(getRunningCost(base.withField(field)));
        }

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    Map<BillingColumn, List<BillingCostBudgetRecord>> results = new LinkedHashMap<>();
                    for (int i = 0; i < fields.size(); i++) {
                        results.put(fields.get(i), futures.get(i).join());
                    }
                    return Collections.unmodifiableMap(results);
                });
    }

    private <T> CompletableFuture<T> submit(String description, Function<WarehouseConnection, T> task) {
        return CompletableFuture.supplyAsync(() -> {
            long startTime = System.nanoTime();
            WarehouseConnection connection = new WarehouseConnection(client, config);
            T result = task.apply(connection);
            long durationMs = (System.nanoTime() - startTime) / 1_000_000;
            log.info(() -> String.format("Completed %s in %dms: %d queries, estimated cost %.6f",
                    description, durationMs, connection.getQueryCount(), connection.getEstimatedCost()));
            return result;
        }, executor).whenComplete((result, error) -> {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            if (cause instanceof FilterValidationException) {
                log.warning(() -> String.format("Rejected %s request: %s", description, cause.getMessage()));
            }
        });
    }
}
