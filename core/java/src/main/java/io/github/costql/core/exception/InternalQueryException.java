package io.github.costql.core.exception;

/**
 * Programming or configuration error detected while building a query.
 * <p>
 * Typical causes are a blank column name, a column override for a field that the
 * filter does not carry, or a misconfigured connection. The detailed message is
 * meant for logs only; callers facing end users should report
 * {@link #getPublicMessage()} instead.
 * </p>
 *
 * @since 1.0.0
 */
public class InternalQueryException extends RuntimeException {

    private static final String PUBLIC_MESSAGE = "Internal error while building the query";

    public InternalQueryException(String message) {
        super(message);
    }

    public InternalQueryException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return a generic message that leaks no implementation detail
     */
    public String getPublicMessage() {
        return PUBLIC_MESSAGE;
    }
}
