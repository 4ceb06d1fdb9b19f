package io.github.costql.core.exception;

/**
 * Thrown when a query parameter is present but malformed, for example an invoice
 * month that is not six digits or does not name a real calendar month.
 *
 * @since 1.0.0
 */
public class InvalidParameterException extends FilterValidationException {

    public InvalidParameterException(String message) {
        super(message);
    }

    public InvalidParameterException(String message, Throwable cause) {
        super(message, cause);
    }
}
