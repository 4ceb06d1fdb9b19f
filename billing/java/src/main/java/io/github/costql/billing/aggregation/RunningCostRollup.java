package io.github.costql.billing.aggregation;

import io.github.costql.billing.model.BillingColumn;
import io.github.costql.billing.model.BillingCostBudgetRecord;
import io.github.costql.billing.model.CostDetail;
import io.github.costql.billing.model.CostGroup;
import io.github.costql.billing.model.CostRow;
import io.github.costql.billing.model.MonthState;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Folds running-cost rows into budget records.
 * <p>
 * The first record is the synthetic total ({@link BillingColumn#allTitle()}) whose
 * details hold one line per cost category. One record per field value follows, in
 * the order the values first appear, with one detail line per row. Daily figures
 * are only kept for {@link MonthState#CURRENT_MONTH}.
 * </p>
 *
 * <pre>{@code
 * RunningCostRollup rollup = new RunningCostRollup(BillingColumn.TOPIC, MonthState.CURRENT_MONTH,
 *     "Mar 05", CostCategoryClassifier.prefixHeuristic());
 * rows.forEach(rollup::add);
 * List<BillingCostBudgetRecord> records = rollup.build(Map.of());
 * }</pre>
 *
 * @since 1.0.0
 */
public class RunningCostRollup {

    private final BillingColumn field;
    private final MonthState state;
    private final String lastLoadedDay;
    private final CostCategoryClassifier classifier;

    private final CostCounters all = new CostCounters();
    private final Map<String, CostCounters> perField = new LinkedHashMap<>();
    private final Map<String, List<CostDetail>> fieldDetails = new LinkedHashMap<>();
    private final Map<String, Double> monthlyByCategory = new LinkedHashMap<>();
    private final Map<String, Double> dailyByCategory = new LinkedHashMap<>();

    /**
     * @param field         the grouping column
     * @param state         whether the month is still accruing cost
     * @param lastLoadedDay display form of the last loaded day, may be {@code null}
     * @param classifier    compute/storage split
     */
    public RunningCostRollup(BillingColumn field, MonthState state, String lastLoadedDay,
                             CostCategoryClassifier classifier) {
        this.field = Objects.requireNonNull(field, "field must not be null");
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.lastLoadedDay = lastLoadedDay;
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    public void add(CostRow row) {
        CostGroup group = classifier.classify(row.costCategory());
        boolean current = state.isCurrent();
        Double daily = current ? row.dailyCost() : null;

        fieldDetails.computeIfAbsent(row.field(), k -> new ArrayList<>())
                .add(CostDetail.of(group, row.costCategory(), daily, row.monthlyCost()));
        CostCounters counters = perField.computeIfAbsent(row.field(), k -> new CostCounters());

        monthlyByCategory.merge(row.costCategory(), row.monthlyCost(), Double::sum);
        all.addMonthly(group, row.monthlyCost());
        counters.addMonthly(group, row.monthlyCost());

        if (daily != null) {
            dailyByCategory.merge(row.costCategory(), daily, Double::sum);
            all.addDaily(group, daily);
            counters.addDaily(group, daily);
        }
    }

    public boolean isEmpty() {
        return perField.isEmpty();
    }

    /**
     * @param budgets budget per field value; only consulted for the per-field records
     * @return the total record followed by one record per field value, empty when no row was added
     */
    public List<BillingCostBudgetRecord> build(Map<String, Double> budgets) {
        if (isEmpty()) {
            return List.of();
        }
        List<BillingCostBudgetRecord> records = new ArrayList<>(perField.size() + 1);
        records.add(totalRecord());

        for (Map.Entry<String, CostCounters> entry : perField.entrySet()) {
            CostCounters counters = entry.getValue();
            Double budget = budgets == null ? null : budgets.get(entry.getKey());
            Double spent = budget != null && budget != 0d ? 100d * counters.totalMonthly() / budget : null;
            records.add(record(entry.getKey(), counters, fieldDetails.get(entry.getKey()), spent, budget));
        }
        return records;
    }

    private BillingCostBudgetRecord totalRecord() {
        List<CostDetail> details = new ArrayList<>(monthlyByCategory.size());
        for (Map.Entry<String, Double> category : monthlyByCategory.entrySet()) {
            Double daily = state.isCurrent() ? dailyByCategory.getOrDefault(category.getKey(), 0d) : null;
            details.add(CostDetail.of(classifier.classify(category.getKey()), category.getKey(),
                    daily, category.getValue()));
        }
        return record(field.allTitle(), all, details, null, null);
    }

    private BillingCostBudgetRecord record(String name, CostCounters counters, List<CostDetail> details,
                                           Double spent, Double budget) {
        boolean current = state.isCurrent();
        return new BillingCostBudgetRecord(
                name,
                counters.totalMonthly(),
                current ? counters.totalDaily() : null,
                counters.computeMonthly(),
                current ? counters.computeDaily() : null,
                counters.storageMonthly(),
                current ? counters.storageDaily() : null,
                details,
                spent,
                budget,
                lastLoadedDay);
    }
}
