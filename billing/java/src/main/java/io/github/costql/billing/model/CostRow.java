package io.github.costql.billing.model;

import java.util.Objects;

/**
 * One (field, cost category) row of a running-cost query.
 *
 * @param field        grouping value, {@code N/A} when the column was null
 * @param costCategory free-text category, e.g. {@code Compute Engine}
 * @param monthlyCost  cost of the invoice month so far
 * @param dailyCost    cost of the last fully loaded day, {@code null} when not queried
 * @since 1.0.0
 */
public record CostRow(String field, String costCategory, double monthlyCost, Double dailyCost) {

    public CostRow {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(costCategory, "costCategory must not be null");
    }
}
