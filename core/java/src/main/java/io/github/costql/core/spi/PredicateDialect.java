package io.github.costql.core.spi;

import io.github.costql.core.api.Op;
import io.github.costql.core.model.BindValue;

/**
 * Backend-specific rendering used by the predicate compiler.
 * <p>
 * The compiler walks the filter and decides which predicates and parameters
 * exist; a dialect only decides how a placeholder, a comparison, a membership
 * test and a metadata extraction are spelled, and how values are declared and
 * handed to the driver.
 * </p>
 *
 * @since 1.0.0
 */
public interface PredicateDialect {

    /**
     * @return a short name used in logs
     */
    String name();

    /**
     * @param parameterName the generated parameter name
     * @return the placeholder referencing it in query text
     */
    String placeholder(String parameterName);

    /**
     * Renders a scalar comparison ({@code =}, {@code >}, {@code >=}, {@code <}, {@code <=}).
     */
    String comparison(String column, Op op, String parameterName, BindValue value);

    /**
     * Renders {@code IN} or {@code NOT IN} against an array parameter.
     */
    String membership(String column, Op op, String parameterName);

    /**
     * Renders the expression reading {@code key} out of the document stored in {@code column}.
     * The key has already been checked for quote characters.
     */
    String metaExtraction(String column, String key);

    /**
     * @return the type name declared to the backend for {@code value}
     */
    String declaredType(BindValue value);

    /**
     * @return the object handed to the driver for {@code value}
     */
    Object wireValue(BindValue value);
}
