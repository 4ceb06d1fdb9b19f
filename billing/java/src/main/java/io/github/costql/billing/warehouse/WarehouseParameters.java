package io.github.costql.billing.warehouse;

import io.github.costql.core.impl.WarehouseDialect;
import io.github.costql.core.model.BindValue;
import io.github.costql.core.model.ParameterBinding;

/**
 * Typed parameters written by hand rather than compiled from a filter.
 *
 * @since 1.0.0
 */
public final class WarehouseParameters {

    private WarehouseParameters() {
    }

    public static ParameterBinding string(String name, String value) {
        return of(name, BindValue.ofString(value));
    }

    public static ParameterBinding int64(String name, long value) {
        return of(name, BindValue.ofInt(value));
    }

    public static ParameterBinding float64(String name, double value) {
        return of(name, BindValue.ofFloat(value));
    }

    /**
     * Types {@code value} the way {@link WarehouseDialect} types compiled parameters.
     */
    public static ParameterBinding of(String name, BindValue value) {
        WarehouseDialect dialect = WarehouseDialect.INSTANCE;
        return new ParameterBinding(name, value, dialect.declaredType(value), dialect.wireValue(value));
    }
}
