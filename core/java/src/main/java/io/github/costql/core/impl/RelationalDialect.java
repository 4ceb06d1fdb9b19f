package io.github.costql.core.impl;

import io.github.costql.core.model.BindValue;

import java.util.Locale;

/**
 * Dialect of the row-oriented relational store.
 * <p>
 * Placeholders are {@code :name}, bound by name at execution time with host
 * values ({@code String}, {@code Long}, {@code Double}, {@code LocalDateTime},
 * or a {@code List} of those for {@code IN (:name)}). Metadata keys are read
 * with {@code JSON_UNQUOTE(JSON_EXTRACT(column, '$.key'))}.
 * </p>
 *
 * @since 1.0.0
 */
public final class RelationalDialect extends AbstractPredicateDialect {

    public static final RelationalDialect INSTANCE = new RelationalDialect();

    private RelationalDialect() {
    }

    @Override
    public String name() {
        return "relational";
    }

    @Override
    public String placeholder(String parameterName) {
        return ":" + parameterName;
    }

    @Override
    public String metaExtraction(String column, String key) {
        return "JSON_UNQUOTE(JSON_EXTRACT(" + column + ", '$." + key + "'))";
    }

    @Override
    public String declaredType(BindValue value) {
        if (value.isArray()) {
            return "array<" + value.elementKind().name().toLowerCase(Locale.ROOT) + ">";
        }
        return value.kind().name().toLowerCase(Locale.ROOT);
    }

    @Override
    public Object wireValue(BindValue value) {
        return value.hostValue();
    }
}
