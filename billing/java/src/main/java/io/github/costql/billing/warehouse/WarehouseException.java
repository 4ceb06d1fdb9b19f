package io.github.costql.billing.warehouse;

/**
 * Failure reported by a {@link WarehouseClient}. Propagated to callers as is; no
 * query is retried.
 *
 * @since 1.0.0
 */
public class WarehouseException extends RuntimeException {

    public WarehouseException(String message) {
        super(message);
    }

    public WarehouseException(String message, Throwable cause) {
        super(message, cause);
    }
}
