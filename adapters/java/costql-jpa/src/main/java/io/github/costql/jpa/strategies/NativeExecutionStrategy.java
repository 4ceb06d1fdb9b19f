package io.github.costql.jpa.strategies;

import io.github.costql.core.model.CompiledPredicate;
import jakarta.persistence.EntityManager;

/**
 * Turns a compiled relational predicate into a native query and runs it.
 *
 * @param <R> the result type
 * @since 1.0.0
 */
@FunctionalInterface
public interface NativeExecutionStrategy<R> {

    /**
     * @param em        the entity manager the query runs on
     * @param predicate the compiled {@code WHERE} clause and its bindings
     * @return the result
     * @throws jakarta.persistence.PersistenceException if the query fails; it is not retried
     */
    R execute(EntityManager em, CompiledPredicate predicate);
}
