package io.github.costql.core.impl;

import io.github.costql.core.api.Op;
import io.github.costql.core.model.BindValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Dialect of the column-oriented analytical warehouse.
 * <p>
 * Placeholders are {@code @name} and every parameter carries an explicit type:
 * </p>
 * <ul>
 *   <li>INT values are declared {@code INT64}, FLOAT values {@code FLOAT64}, strings {@code STRING}</li>
 *   <li>timestamps are declared {@code STRING} in {@code yyyy-MM-dd HH:mm:ss} form and
 *       the predicate compares against {@code TIMESTAMP(@name)}</li>
 *   <li>arrays are {@code ARRAY<INT64>} or {@code ARRAY<FLOAT64>} when every element
 *       has that type, otherwise {@code ARRAY<STRING>} of the element text</li>
 * </ul>
 * <p>
 * Membership tests use {@code IN UNNEST(@name)} and metadata keys are read with
 * {@code JSON_EXTRACT(column, '$.key')}.
 * </p>
 *
 * @since 1.0.0
 */
public final class WarehouseDialect extends AbstractPredicateDialect {

    public static final WarehouseDialect INSTANCE = new WarehouseDialect();

    private WarehouseDialect() {
    }

    @Override
    public String name() {
        return "warehouse";
    }

    @Override
    public String placeholder(String parameterName) {
        return "@" + parameterName;
    }

    @Override
    public String comparison(String column, Op op, String parameterName, BindValue value) {
        if (value.kind() == BindValue.Kind.TIMESTAMP) {
            return column + " " + op.getSymbol() + " TIMESTAMP(" + placeholder(parameterName) + ")";
        }
        return super.comparison(column, op, parameterName, value);
    }

    @Override
    public String membership(String column, Op op, String parameterName) {
        return column + " " + op.getSymbol() + " UNNEST(" + placeholder(parameterName) + ")";
    }

    @Override
    public String metaExtraction(String column, String key) {
        return "JSON_EXTRACT(" + column + ", '$." + key + "')";
    }

    @Override
    public String declaredType(BindValue value) {
        if (value.isArray()) {
            return "ARRAY<" + scalarType(value.elementKind()) + ">";
        }
        return scalarType(value.kind());
    }

    @Override
    public Object wireValue(BindValue value) {
        if (!value.isArray()) {
            return scalarWireValue(value);
        }
        List<Object> values = new ArrayList<>(value.size());
        for (BindValue element : value.elements()) {
            values.add(value.elementKind() == BindValue.Kind.STRING ? element.asText() : element.hostValue());
        }
        return values;
    }

    private static Object scalarWireValue(BindValue value) {
        return switch (value.kind()) {
            case INT, FLOAT -> value.hostValue();
            case STRING, TIMESTAMP -> value.asText();
            case ARRAY -> throw new IllegalStateException("Array passed as scalar");
        };
    }

    private static String scalarType(BindValue.Kind kind) {
        return switch (kind) {
            case INT -> "INT64";
            case FLOAT -> "FLOAT64";
            case STRING, TIMESTAMP -> "STRING";
            case ARRAY -> throw new IllegalStateException("Nested arrays are not supported");
        };
    }
}
