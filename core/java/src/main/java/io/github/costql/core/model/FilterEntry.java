package io.github.costql.core.model;

import io.github.costql.core.api.FilterComparator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One named entry of a {@link FilterModel}.
 *
 * @since 1.0.0
 */
public interface FilterEntry {

    /**
     * Plain column comparison.
     */
    record Field(FilterComparator<BindValue> comparator) implements FilterEntry {
        public Field {
            Objects.requireNonNull(comparator, "comparator must not be null");
        }
    }

    /**
     * Structured sub-field; child columns are qualified as {@code <parent>.<child>}.
     */
    record Nested(FilterModel model) implements FilterEntry {
        public Nested {
            Objects.requireNonNull(model, "model must not be null");
        }
    }

    /**
     * Free-form metadata map compiled through the dialect's JSON extraction.
     */
    record Meta(Map<String, FilterComparator<BindValue>> keys) implements FilterEntry {
        public Meta {
            Objects.requireNonNull(keys, "keys must not be null");
            keys = Collections.unmodifiableMap(new LinkedHashMap<>(keys));
        }
    }
}
