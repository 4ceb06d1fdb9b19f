package io.github.costql.billing.warehouse;

import io.github.costql.core.model.ParameterBinding;

import java.util.List;
import java.util.Map;

/**
 * Driver of the analytical warehouse.
 * <p>
 * Implementations submit standard SQL with named, typed parameters: each
 * {@link ParameterBinding} carries the parameter name, its declared type
 * ({@code STRING}, {@code INT64}, {@code FLOAT64}, {@code ARRAY<...>}) and the
 * value to send. Implementations must be safe for use from several threads;
 * callers never share one {@link WarehouseConnection} between threads.
 * </p>
 *
 * @since 1.0.0
 */
public interface WarehouseClient {

    /**
     * Validates a query without running it.
     *
     * @param sql        the query
     * @param parameters its parameters
     * @param labels     job labels
     * @return the number of bytes the query would process
     * @throws WarehouseException if the warehouse rejects the query
     */
    long dryRun(String sql, List<ParameterBinding> parameters, Map<String, String> labels);

    /**
     * Runs a query.
     *
     * @param sql        the query
     * @param parameters its parameters
     * @param labels     job labels
     * @return the rows, each an ordered map of column name to value
     * @throws WarehouseException if the query fails
     */
    List<Map<String, Object>> query(String sql, List<ParameterBinding> parameters, Map<String, String> labels);
}
