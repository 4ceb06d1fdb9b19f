package io.github.costql.core.exception;

/**
 * Base exception for every request that is rejected before a query is built.
 * <p>
 * All subclasses describe a caller mistake (a malformed filter, a missing or
 * invalid parameter, a field outside an allow-list) and map to a
 * "bad request" response in the excluded request-handling layer. None of them
 * is ever retried.
 * </p>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     List<BillingCostBudgetRecord> records = aggregator.getRunningCost(query);
 * } catch (FilterValidationException e) {
 *     // message is safe to show to the caller
 *     return badRequest(e.getMessage());
 * }
 * }</pre>
 *
 * @since 1.0.0
 * @see InvalidFilterException
 * @see MissingParameterException
 * @see InvalidParameterException
 * @see DisallowedFieldException
 */
public class FilterValidationException extends RuntimeException {

    /**
     * Creates an exception with an explanatory message.
     *
     * @param message the description of the problem, shown to the caller
     */
    public FilterValidationException(String message) {
        super(message);
    }

    /**
     * Creates an exception with an explanatory message and an underlying cause.
     *
     * @param message the description of the problem, shown to the caller
     * @param cause   the original cause (e.g. a {@link java.time.format.DateTimeParseException})
     */
    public FilterValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
