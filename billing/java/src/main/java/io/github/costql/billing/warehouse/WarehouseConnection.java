package io.github.costql.billing.warehouse;

import io.github.costql.billing.config.BillingConfig;
import io.github.costql.core.model.ParameterBinding;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * One logical caller's session with the warehouse.
 * <p>
 * Every query is dry-run first to learn the bytes it will process, the estimated
 * price is added to {@link #getEstimatedCost()}, and then the query runs. Queries
 * of one connection run strictly one after the other, so the counter is a plain
 * field.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>Not thread-safe. Concurrent work uses one connection per task.</p>
 *
 * @since 1.0.0
 */
public class WarehouseConnection {

    private static final Logger log = Logger.getLogger(WarehouseConnection.class.getName());

    static final double BYTES_PER_TB = 1024d * 1024d * 1024d * 1024d;

    private final WarehouseClient client;
    private final BillingConfig config;
    private double estimatedCost;
    private int queryCount;

    public WarehouseConnection(WarehouseClient client, BillingConfig config) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Dry-runs, accounts and executes {@code sql}.
     *
     * @param sql        the query
     * @param parameters its parameters
     * @return the rows
     * @throws WarehouseException if either call fails; the cost of a successful dry run is kept
     */
    public List<Map<String, Object>> execute(String sql, List<ParameterBinding> parameters) {
        long startTime = System.nanoTime();
        Map<String, String> labels = config.getQueryLabels();

        log.fine(() -> String.format("Warehouse query: %s, parameters=%s", sql,
                parameters.stream().map(p -> p.name() + ":" + p.declaredType()).collect(Collectors.toList())));

        long bytes = client.dryRun(sql, parameters, labels);
        double cost = bytes / BYTES_PER_TB * config.getCostPerTb();
        estimatedCost += cost;
        queryCount++;

        List<Map<String, Object>> rows = client.query(sql, parameters, labels);

        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        log.info(() -> String.format("Warehouse query completed in %dms: %d rows, %d bytes, estimated cost %.6f",
                durationMs, rows.size(), bytes, cost));
        return rows;
    }

    /**
     * @return the estimated price of every query run on this connection so far
     */
    public double getEstimatedCost() {
        return estimatedCost;
    }

    public int getQueryCount() {
        return queryCount;
    }

    public BillingConfig getConfig() {
        return config;
    }
}
