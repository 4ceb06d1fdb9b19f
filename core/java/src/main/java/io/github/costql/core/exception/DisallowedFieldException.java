package io.github.costql.core.exception;

import java.util.Collection;

/**
 * Thrown when a grouping or running-cost field is not in the allow-list of the
 * backend that would serve the query.
 *
 * @since 1.0.0
 */
public class DisallowedFieldException extends FilterValidationException {

    private final String field;

    public DisallowedFieldException(String field, Collection<String> allowed) {
        super(String.format("Field '%s' is not allowed here. Allowed fields: %s", field, allowed));
        this.field = field;
    }

    /**
     * @return the rejected field name
     */
    public String getField() {
        return field;
    }
}
