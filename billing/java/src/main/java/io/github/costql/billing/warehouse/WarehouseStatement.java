package io.github.costql.billing.warehouse;

import io.github.costql.core.model.ParameterBinding;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Query text with its typed parameters.
 *
 * @param sql        the query
 * @param parameters the parameters, names unique
 * @since 1.0.0
 */
public record WarehouseStatement(String sql, List<ParameterBinding> parameters) {

    public WarehouseStatement {
        Objects.requireNonNull(sql, "sql must not be null");
        parameters = List.copyOf(parameters);
    }

    public List<Map<String, Object>> executeOn(WarehouseConnection connection) {
        return connection.execute(sql, parameters);
    }
}
