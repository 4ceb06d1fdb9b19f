package io.github.costql.core.exception;

/**
 * Thrown when a required query parameter is absent.
 *
 * @since 1.0.0
 */
public class MissingParameterException extends FilterValidationException {

    public MissingParameterException(String message) {
        super(message);
    }
}
