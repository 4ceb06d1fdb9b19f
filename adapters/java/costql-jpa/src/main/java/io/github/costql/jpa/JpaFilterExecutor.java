package io.github.costql.jpa;

import io.github.costql.core.impl.PredicateCompiler;
import io.github.costql.core.impl.RelationalDialect;
import io.github.costql.core.model.CompiledPredicate;
import io.github.costql.core.model.FilterModel;
import io.github.costql.jpa.strategies.NativeExecutionStrategy;
import jakarta.persistence.EntityManager;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Runs filters against the relational store through an {@link EntityManager}.
 * <p>
 * Each call compiles the filter with {@link RelationalDialect}, then hands the
 * predicate to a {@link NativeExecutionStrategy}. Persistence errors propagate
 * unchanged.
 * </p>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * JpaFilterExecutor executor = new JpaFilterExecutor(entityManager);
 * long count = executor.execute(new CountStrategy("sample"), filters);
 * }</pre>
 *
 * @since 1.0.0
 */
public class JpaFilterExecutor {

    private final EntityManager em;
    private final Map<String, String> columnOverrides;

    public JpaFilterExecutor(EntityManager em) {
        this(em, Map.of());
    }

    /**
     * @param em              the entity manager
     * @param columnOverrides field name to column, for fields stored under another name;
     *                        only overrides whose field is present in a filter are applied
     */
    public JpaFilterExecutor(EntityManager em, Map<String, String> columnOverrides) {
        this.em = Objects.requireNonNull(em, "em must not be null");
        this.columnOverrides = Map.copyOf(Objects.requireNonNull(columnOverrides, "columnOverrides must not be null"));
    }

    public <R> R execute(NativeExecutionStrategy<R> strategy, FilterModel filters) {
        Objects.requireNonNull(strategy, "strategy must not be null");
        return strategy.execute(em, compile(filters));
    }

    /**
     * @param filters the filter, {@code null} for none
     * @return the relational predicate
     */
    public CompiledPredicate compile(FilterModel filters) {
        FilterModel model = filters == null ? FilterModel.empty() : filters;
        Map<String, String> applicable = new LinkedHashMap<>();
        columnOverrides.forEach((field, column) -> {
            if (model.contains(field)) {
                applicable.put(field, column);
            }
        });
        return PredicateCompiler.compile(model, RelationalDialect.INSTANCE, applicable);
    }
}
