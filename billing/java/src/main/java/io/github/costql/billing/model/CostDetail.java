package io.github.costql.billing.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Per-category line of a {@link BillingCostBudgetRecord}.
 *
 * @param costGroup    compute or storage
 * @param costCategory the category
 * @param dailyCost    last loaded day cost, {@code null} for historical months
 * @param monthlyCost  invoice month cost
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"cost_group", "cost_category", "daily_cost", "monthly_cost"})
public record CostDetail(
        @JsonProperty("cost_group") String costGroup,
        @JsonProperty("cost_category") String costCategory,
        @JsonProperty("daily_cost") Double dailyCost,
        @JsonProperty("monthly_cost") double monthlyCost
) {

    public static CostDetail of(CostGroup group, String costCategory, Double dailyCost, double monthlyCost) {
        return new CostDetail(group.getCode(), costCategory, dailyCost, monthlyCost);
    }
}
