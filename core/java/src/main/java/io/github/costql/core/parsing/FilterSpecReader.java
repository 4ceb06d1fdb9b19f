package io.github.costql.core.parsing;

import io.github.costql.core.api.FilterComparator;
import io.github.costql.core.exception.InvalidFilterException;
import io.github.costql.core.model.FilterModel;
import io.github.costql.core.model.FilterOp;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a filter definition in map form, as produced by a JSON binder, into a
 * {@link FilterModel}.
 * <p>
 * Each field maps to one of:
 * </p>
 * <ul>
 *   <li>a scalar or a list: {@code equalTo} or {@code oneOf}</li>
 *   <li>an operator object whose keys are all operator names
 *       ({@code equals}, {@code oneOf}, {@code notOneOf}, {@code greaterThan},
 *       {@code greaterOrEqual}, {@code lessThan}, {@code lessOrEqual}, or the short
 *       forms {@code eq}, {@code in_}, {@code nin}, {@code gt}, {@code gte},
 *       {@code lt}, {@code lte})</li>
 *   <li>any other object: a metadata map whose values follow the same two rules</li>
 * </ul>
 *
 * <pre>{@code
 * Map<String, Object> spec = objectMapper.readValue(json, new TypeReference<>() {});
 * FilterModel model = FilterSpecReader.read(spec, FilterOp.AND);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class FilterSpecReader {

    private static final Map<String, String> OPERATOR_KEYS = operatorKeys();

    private FilterSpecReader() {
    }

    public static FilterModel read(Map<String, ?> spec) {
        return read(spec, FilterOp.AND);
    }

    /**
     * @param spec      field name to raw filter, may be {@code null}
     * @param filtersOp the join of top-level fields
     * @return the normalized model
     * @throws InvalidFilterException if an operator object is malformed
     */
    public static FilterModel read(Map<String, ?> spec, FilterOp filtersOp) {
        FilterModel.Builder builder = FilterModel.builder().filtersOp(filtersOp);
        if (spec == null) {
            return builder.build();
        }
        for (Map.Entry<String, ?> entry : spec.entrySet()) {
            Object raw = entry.getValue();
            if (raw instanceof Map<?, ?> map) {
                if (isOperatorObject(map)) {
                    builder.field(entry.getKey(), comparator(entry.getKey(), map));
                } else {
                    builder.meta(entry.getKey(), metaValues(entry.getKey(), map));
                }
            } else {
                builder.field(entry.getKey(), raw);
            }
        }
        return builder.build();
    }

    private static Map<Object, Object> metaValues(String field, Map<?, ?> raw) {
        Map<Object, Object> values = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> map) {
                if (!isOperatorObject(map)) {
                    throw new InvalidFilterException(
                            String.format("Metadata filter '%s.%s' must be a value, a list or an operator object",
                                    field, entry.getKey()));
                }
                values.put(entry.getKey(), comparator(field + "." + entry.getKey(), map));
            } else {
                values.put(entry.getKey(), value);
            }
        }
        return values;
    }

    private static boolean isOperatorObject(Map<?, ?> map) {
        if (map.isEmpty()) {
            return false;
        }
        for (Object key : map.keySet()) {
            if (!(key instanceof String name) || !OPERATOR_KEYS.containsKey(name)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns {@code null} when every operator value is {@code null}, leaving the field absent.
     */
    private static FilterComparator<Object> comparator(String field, Map<?, ?> map) {
        FilterComparator.Builder<Object> builder = FilterComparator.builder();
        boolean any = false;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            any = true;
            switch (OPERATOR_KEYS.get((String) entry.getKey())) {
                case "equals" -> builder.equalTo(value);
                case "oneOf" -> builder.oneOf(list(field, "oneOf", value));
                case "notOneOf" -> builder.notOneOf(list(field, "notOneOf", value));
                case "greaterThan" -> builder.greaterThan(value);
                case "greaterOrEqual" -> builder.greaterOrEqual(value);
                case "lessThan" -> builder.lessThan(value);
                case "lessOrEqual" -> builder.lessOrEqual(value);
                default -> throw new IllegalStateException("Unmapped operator key: " + entry.getKey());
            }
        }
        return any ? builder.build() : null;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> list(String field, String operator, Object value) {
        if (value instanceof List<?> list) {
            if (list.size() == 1 && list.get(0) == null) {
                throw new InvalidFilterException(String.format(
                        "%s of '%s' is a single-element list holding null; check for a trailing comma",
                        operator, field));
            }
            return (List<Object>) list;
        }
        throw new InvalidFilterException(String.format("%s of '%s' must be a list", operator, field));
    }

    private static Map<String, String> operatorKeys() {
        Map<String, String> keys = new LinkedHashMap<>();
        for (String canonical : Set.of("equals", "oneOf", "notOneOf", "greaterThan",
                "greaterOrEqual", "lessThan", "lessOrEqual")) {
            keys.put(canonical, canonical);
        }
        keys.put("eq", "equals");
        keys.put("in_", "oneOf");
        keys.put("nin", "notOneOf");
        keys.put("gt", "greaterThan");
        keys.put("gte", "greaterOrEqual");
        keys.put("lt", "lessThan");
        keys.put("lte", "lessOrEqual");
        return Map.copyOf(keys);
    }
}
