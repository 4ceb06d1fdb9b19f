package io.github.costql.core.exception;

/**
 * Thrown when a filter cannot be constructed: an empty {@code oneOf}, a comparator
 * without any operator, a metadata key containing a quote character, or the
 * single-{@code null} list produced by a trailing-comma mistake.
 *
 * @since 1.0.0
 */
public class InvalidFilterException extends FilterValidationException {

    public InvalidFilterException(String message) {
        super(message);
    }

    public InvalidFilterException(String message, Throwable cause) {
        super(message, cause);
    }
}
