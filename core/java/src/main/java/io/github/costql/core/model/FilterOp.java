package io.github.costql.core.model;

import java.util.Locale;

/**
 * Operator joining the top-level fields of a {@link FilterModel}.
 *
 * @since 1.0.0
 */
public enum FilterOp {
    AND,
    OR;

    /**
     * @return the joiner placed between compiled field predicates
     */
    public String joiner() {
        return " " + name() + " ";
    }

    /**
     * Parses {@code "AND"} or {@code "OR"}, ignoring case. {@code null} or blank means AND.
     *
     * @param value the text
     * @return the operator
     * @throws IllegalArgumentException if the value is neither AND nor OR
     */
    public static FilterOp parse(String value) {
        if (value == null || value.isBlank()) {
            return AND;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "AND" -> AND;
            case "OR" -> OR;
            default -> throw new IllegalArgumentException("Unknown filters operator: " + value);
        };
    }
}
