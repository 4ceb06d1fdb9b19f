package io.github.costql.core.impl;

import io.github.costql.core.api.Op;
import io.github.costql.core.model.BindValue;
import io.github.costql.core.spi.PredicateDialect;

/**
 * Spelling shared by both dialects: {@code <column> <symbol> <placeholder>}.
 *
 * @since 1.0.0
 */
public abstract class AbstractPredicateDialect implements PredicateDialect {

    @Override
    public String comparison(String column, Op op, String parameterName, BindValue value) {
        return column + " " + op.getSymbol() + " " + placeholder(parameterName);
    }

    @Override
    public String membership(String column, Op op, String parameterName) {
        return column + " " + op.getSymbol() + " (" + placeholder(parameterName) + ")";
    }

    @Override
    public String toString() {
        return name();
    }
}
