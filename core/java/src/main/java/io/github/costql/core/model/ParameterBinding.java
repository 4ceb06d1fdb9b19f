package io.github.costql.core.model;

import java.util.Objects;

/**
 * A named parameter of a compiled predicate.
 *
 * @param name         placeholder name, unique within one compiled query
 * @param value        the typed value
 * @param declaredType type declared to the backend, e.g. {@code INT64} or {@code ARRAY<STRING>}
 * @param wireValue    the value handed to the backend driver
 * @since 1.0.0
 */
public record ParameterBinding(String name, BindValue value, String declaredType, Object wireValue) {

    public ParameterBinding {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(declaredType, "declaredType must not be null");
        Objects.requireNonNull(wireValue, "wireValue must not be null");
    }
}
