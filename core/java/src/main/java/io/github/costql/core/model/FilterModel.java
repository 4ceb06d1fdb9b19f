package io.github.costql.core.model;

import io.github.costql.core.api.FilterComparator;
import io.github.costql.core.exception.InternalQueryException;
import io.github.costql.core.exception.InvalidFilterException;
import io.github.costql.core.utils.Identifiers;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, ordered set of named filters.
 * <p>
 * Each name maps to a {@link FilterEntry}: a comparator on a plain column, a
 * nested model for structured sub-fields, or a metadata map of key to comparator.
 * Raw inputs are normalized when the model is built:
 * </p>
 * <ul>
 *   <li>a list or array becomes {@code oneOf}</li>
 *   <li>a scalar becomes {@code equalTo}</li>
 *   <li>a {@link FilterComparator} is kept as it is</li>
 *   <li>{@code null} leaves the field absent</li>
 * </ul>
 * <p>
 * Values are lowered to {@link BindValue} at this point, so a built model carries
 * only typed values.
 * </p>
 *
 * <pre>{@code
 * FilterModel model = FilterModel.builder()
 *     .field("topic", List.of("hail", "seqr"))
 *     .field("day", "2024-03-01")
 *     .meta("labels", Map.of("batch_id", "1234"))
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class FilterModel {

    private static final FilterModel EMPTY = new FilterModel(Map.of(), FilterOp.AND);

    private final Map<String, FilterEntry> entries;
    private final FilterOp filtersOp;

    private FilterModel(Map<String, FilterEntry> entries, FilterOp filtersOp) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        this.filtersOp = filtersOp;
    }

    public static FilterModel empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-filled with this model's entries and operator
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.entries.putAll(entries);
        builder.filtersOp = filtersOp;
        return builder;
    }

    /**
     * @return the entries in declaration order
     */
    public Map<String, FilterEntry> entries() {
        return entries;
    }

    public FilterOp filtersOp() {
        return filtersOp;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    public FilterEntry get(String name) {
        return entries.get(name);
    }

    /**
     * Normalizes a raw value into a typed comparator.
     *
     * @param raw a comparator, a list or array, or a scalar
     * @return the comparator, or {@code null} when {@code raw} is {@code null}
     * @throws InvalidFilterException for the single-{@code null} list and for empty lists
     */
    public static FilterComparator<BindValue> normalize(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof FilterComparator<?> comparator) {
            return comparator.map(BindValue::of);
        }
        if (raw instanceof Object[] array) {
            return normalize(Arrays.asList(array));
        }
        if (raw instanceof Collection<?> values) {
            if (values.size() == 1 && values.iterator().next() == null) {
                throw new InvalidFilterException(
                        "Filter value is a single-element list holding null; check for a trailing comma");
            }
            List<BindValue> typed = values.stream().map(BindValue::of).toList();
            return FilterComparator.oneOf(typed);
        }
        return FilterComparator.equalTo(BindValue.of(raw));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterModel that)) return false;
        return entries.equals(that.entries) && filtersOp == that.filtersOp;
    }

    @Override
    public int hashCode() {
        return Objects.hash(entries, filtersOp);
    }

    @Override
    public String toString() {
        return "FilterModel[filtersOp=" + filtersOp + ", entries=" + entries + "]";
    }

    /**
     * Builder collecting entries in declaration order. Declaring a name twice
     * replaces the first entry and keeps its position.
     */
    public static class Builder {
        private final Map<String, FilterEntry> entries = new LinkedHashMap<>();
        private FilterOp filtersOp = FilterOp.AND;

        private Builder() {
        }

        /**
         * Adds a column filter. Maps are treated as metadata filters and
         * {@link FilterModel} instances as nested filters.
         *
         * @param name the field name, a plain identifier
         * @param raw  the raw value; {@code null} leaves the field absent
         * @return this builder
         * @throws InvalidFilterException if {@code name} is not a plain identifier
         */
        public Builder field(String name, Object raw) {
            checkName(name);
            if (raw == null) {
                return this;
            }
            if (raw instanceof FilterModel nested) {
                return nested(name, nested);
            }
            if (raw instanceof Map<?, ?> map) {
                return meta(name, map);
            }
            entries.put(name, new FilterEntry.Field(normalize(raw)));
            return this;
        }

        public Builder nested(String name, FilterModel model) {
            checkName(name);
            if (model != null) {
                entries.put(name, new FilterEntry.Nested(model));
            }
            return this;
        }

        /**
         * Adds a metadata filter keyed by free-form strings.
         *
         * @param name the column holding the metadata document
         * @param raw  key to raw value
         * @return this builder
         * @throws InvalidFilterException if a key is blank or contains a quote or backslash
         */
        public Builder meta(String name, Map<?, ?> raw) {
            checkName(name);
            if (raw == null) {
                return this;
            }
            Map<String, FilterComparator<BindValue>> keys = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : raw.entrySet()) {
                String key = checkMetaKey(entry.getKey());
                FilterComparator<BindValue> comparator = normalize(entry.getValue());
                if (comparator != null) {
                    keys.put(key, comparator);
                }
            }
            if (!keys.isEmpty()) {
                entries.put(name, new FilterEntry.Meta(keys));
            }
            return this;
        }

        public Builder remove(String name) {
            entries.remove(name);
            return this;
        }

        public Builder filtersOp(FilterOp filtersOp) {
            this.filtersOp = Objects.requireNonNull(filtersOp, "filtersOp must not be null");
            return this;
        }

        public FilterModel build() {
            if (entries.isEmpty() && filtersOp == FilterOp.AND) {
                return EMPTY;
            }
            return new FilterModel(entries, filtersOp);
        }

        private static void checkName(String name) {
            if (name == null || name.isBlank()) {
                throw new InternalQueryException("Filter field names must be non-blank strings");
            }
            if (!Identifiers.isSimple(name)) {
                throw new InvalidFilterException("Filter field name is not a plain column name: " + name);
            }
        }

        private static String checkMetaKey(Object key) {
            if (!(key instanceof String text) || text.isBlank()) {
                throw new InvalidFilterException("Metadata keys must be non-blank strings, got: " + key);
            }
            if (text.indexOf('"') >= 0 || text.indexOf('\'') >= 0 || text.indexOf('\\') >= 0) {
                throw new InvalidFilterException("Metadata key must not contain quote or backslash characters: " + text);
            }
            return text;
        }
    }
}
