package io.github.costql.jpa.strategies;

import io.github.costql.core.model.CompiledPredicate;
import io.github.costql.jpa.NativeQueryBinder;
import jakarta.persistence.EntityManager;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Counts the rows of one table matching a predicate.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * CompiledPredicate predicate = PredicateCompiler.compile(filters, RelationalDialect.INSTANCE);
 * long matches = new CountStrategy("analysis").execute(entityManager, predicate);
 * // SELECT COUNT(*) FROM analysis WHERE <predicate>
 * }</pre>
 *
 * @param table the table to count, a plain identifier
 * @since 1.0.0
 */
public record CountStrategy(String table) implements NativeExecutionStrategy<Long> {
    private static final Logger logger = Logger.getLogger(CountStrategy.class.getName());

    public CountStrategy {
        Objects.requireNonNull(table, "table must not be null");
        NativeQueryBinder.identifier(table);
    }

    @Override
    public Long execute(EntityManager em, CompiledPredicate predicate) {
        long startTime = System.nanoTime();

        String sql = "SELECT COUNT(*) FROM " + table + " WHERE " + predicate.text();
        Object result = NativeQueryBinder.create(em, sql, predicate).getSingleResult();
        long count = ((Number) result).longValue();

        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        logger.info(() -> String.format("Count query on %s completed in %dms: %d matches", table, durationMs, count));

        return count;
    }
}
