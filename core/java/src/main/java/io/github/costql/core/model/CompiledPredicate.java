package io.github.costql.core.model;

import io.github.costql.core.exception.InternalQueryException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Predicate text plus the parameters it references.
 *
 * @param text     the predicate, {@code TRUE} for an empty filter
 * @param bindings the parameters in placeholder order
 * @since 1.0.0
 */
public record CompiledPredicate(String text, List<ParameterBinding> bindings) {

    /**
     * The predicate of an empty filter.
     */
    public static final CompiledPredicate TRUE = new CompiledPredicate("TRUE", List.of());

    public CompiledPredicate {
        Objects.requireNonNull(text, "text must not be null");
        bindings = List.copyOf(bindings);
    }

    /**
     * @return parameter name to wire value, in placeholder order
     */
    public Map<String, Object> parameters() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        for (ParameterBinding binding : bindings) {
            parameters.put(binding.name(), binding.wireValue());
        }
        return Collections.unmodifiableMap(parameters);
    }

    /**
     * Joins this predicate and {@code other} with {@code AND}. A {@code TRUE}
     * side is dropped.
     *
     * @param other the predicate to append
     * @return the conjunction
     * @throws InternalQueryException if both sides bind the same parameter name
     */
    public CompiledPredicate and(CompiledPredicate other) {
        if (isTrue()) {
            return other;
        }
        if (other.isTrue()) {
            return this;
        }
        Map<String, Object> names = parameters();
        for (ParameterBinding binding : other.bindings) {
            if (names.containsKey(binding.name())) {
                throw new InternalQueryException("Duplicate parameter name: " + binding.name());
            }
        }
        List<ParameterBinding> all = new ArrayList<>(bindings);
        all.addAll(other.bindings);
        return new CompiledPredicate(text + " AND " + other.text, all);
    }

    public boolean isTrue() {
        return "TRUE".equals(text) && bindings.isEmpty();
    }
}
