package io.github.costql.jpa.strategies;

import io.github.costql.core.exception.InternalQueryException;
import io.github.costql.core.model.CompiledPredicate;
import io.github.costql.jpa.NativeQueryBinder;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Fetches selected columns of the rows matching a predicate, as ordered maps.
 * <p>
 * The query is {@code SELECT <columns> FROM <table> WHERE <predicate>} followed by
 * an optional {@code ORDER BY}. Paging goes through
 * {@link Query#setFirstResult(int)} and {@link Query#setMaxResults(int)}, so no
 * value is ever written into the query text.
 * </p>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * RowFetchStrategy strategy = RowFetchStrategy.builder("sample")
 *     .columns(List.of("id", "external_id", "type"))
 *     .orderBy("id")
 *     .limit(100)
 *     .build();
 * List<Map<String, Object>> rows = strategy.execute(entityManager, predicate);
 * }</pre>
 *
 * @param table   the table, a plain identifier
 * @param columns the selected columns, in row order
 * @param orderBy columns to sort on, ascending, may be empty
 * @param limit   maximum number of rows, {@code null} for all
 * @param offset  rows to skip, {@code null} for none
 * @since 1.0.0
 */
public record RowFetchStrategy(
        String table,
        List<String> columns,
        List<String> orderBy,
        Integer limit,
        Integer offset
) implements NativeExecutionStrategy<List<Map<String, Object>>> {
    private static final Logger logger = Logger.getLogger(RowFetchStrategy.class.getName());

    public RowFetchStrategy {
        NativeQueryBinder.identifier(table);
        if (columns == null || columns.isEmpty()) {
            throw new InternalQueryException("At least one column must be selected from " + table);
        }
        columns.forEach(NativeQueryBinder::identifier);
        columns = List.copyOf(columns);
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
        orderBy.forEach(NativeQueryBinder::identifier);
        if (limit != null && limit < 0) {
            throw new InternalQueryException("limit must not be negative, got: " + limit);
        }
        if (offset != null && offset < 0) {
            throw new InternalQueryException("offset must not be negative, got: " + offset);
        }
    }

    public static Builder builder(String table) {
        return new Builder(table);
    }

    /**
     * @return the query text, without paging
     */
    public String sql(CompiledPredicate predicate) {
        StringBuilder sql = new StringBuilder("SELECT ")
                .append(String.join(", ", columns))
                .append(" FROM ").append(table)
                .append(" WHERE ").append(predicate.text());
        if (!orderBy.isEmpty()) {
            sql.append(" ORDER BY ").append(String.join(", ", orderBy));
        }
        return sql.toString();
    }

    @Override
    public List<Map<String, Object>> execute(EntityManager em, CompiledPredicate predicate) {
        long startTime = System.nanoTime();

        Query query = NativeQueryBinder.create(em, sql(predicate), predicate);
        if (offset != null) {
            query.setFirstResult(offset);
        }
        if (limit != null) {
            query.setMaxResults(limit);
        }

        List<?> results = query.getResultList();
        List<Map<String, Object>> rows = new ArrayList<>(results.size());
        for (Object result : results) {
            rows.add(toRow(result));
        }

        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        logger.info(() -> String.format("Fetch on %s completed in %dms: %d rows", table, durationMs, rows.size()));
        return rows;
    }

    private Map<String, Object> toRow(Object result) {
        Map<String, Object> row = new LinkedHashMap<>();
        if (result instanceof Object[] values) {
            if (values.length != columns.size()) {
                throw new InternalQueryException(String.format(
                        "Expected %d columns from %s, got %d", columns.size(), table, values.length));
            }
            for (int i = 0; i < values.length; i++) {
                row.put(columns.get(i), values[i]);
            }
        } else {
            // single-column selects come back unwrapped
            row.put(columns.get(0), result);
        }
        return Collections.unmodifiableMap(row);
    }

    public static class Builder {
        private final String _table;
        private List<String> _columns = List.of();
        private final List<String> _orderBy = new ArrayList<>();
        private Integer _limit;
        private Integer _offset;

        private Builder(String table) {
            this._table = Objects.requireNonNull(table, "table must not be null");
        }

        public Builder columns(List<String> columns) {
            this._columns = columns;
            return this;
        }

        public Builder orderBy(String column) {
            this._orderBy.add(column);
            return this;
        }

        public Builder limit(Integer limit) {
            this._limit = limit;
            return this;
        }

        public Builder offset(Integer offset) {
            this._offset = offset;
            return this;
        }

        public RowFetchStrategy build() {
            return new RowFetchStrategy(_table, _columns, _orderBy, _limit, _offset);
        }
    }
}
