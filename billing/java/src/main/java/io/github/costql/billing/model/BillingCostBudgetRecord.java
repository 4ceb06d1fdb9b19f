package io.github.costql.billing.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Running cost of one grouping value, or of all of them for the synthetic total.
 * <p>
 * {@code totalMonthly == computeMonthly + storageMonthly} always holds, and the same
 * for daily figures when they are present. Daily figures are {@code null} for
 * historical invoice months.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"field", "total_monthly", "total_daily", "compute_monthly", "compute_daily",
        "storage_monthly", "storage_daily", "details", "budget_spent", "budget", "last_loaded_day"})
public record BillingCostBudgetRecord(
        @JsonProperty("field") String field,
        @JsonProperty("total_monthly") double totalMonthly,
        @JsonProperty("total_daily") Double totalDaily,
        @JsonProperty("compute_monthly") double computeMonthly,
        @JsonProperty("compute_daily") Double computeDaily,
        @JsonProperty("storage_monthly") double storageMonthly,
        @JsonProperty("storage_daily") Double storageDaily,
        @JsonProperty("details") List<CostDetail> details,
        @JsonProperty("budget_spent") Double budgetSpentPercent,
        @JsonProperty("budget") Double budget,
        @JsonProperty("last_loaded_day") String lastLoadedDay
) {

    public BillingCostBudgetRecord {
        Objects.requireNonNull(field, "field must not be null");
        details = details == null ? List.of() : List.copyOf(details);
    }
}
