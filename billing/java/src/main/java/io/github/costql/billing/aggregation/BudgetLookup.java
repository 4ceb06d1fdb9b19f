package io.github.costql.billing.aggregation;

import io.github.costql.billing.warehouse.WarehouseConnection;
import io.github.costql.billing.warehouse.WarehouseStatement;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the latest budget of every GCP project.
 *
 * @since 1.0.0
 */
final class BudgetLookup {

    private BudgetLookup() {
    }

    static WarehouseStatement statement(String budgetView) {
        String view = "`" + budgetView + "`";
        String sql = "WITH t AS (\n"
                + "    SELECT gcp_project, MAX(created_at) as last_created_at\n"
                + "    FROM " + view + "\n"
                + "    GROUP BY gcp_project\n"
                + ")\n"
                + "SELECT t.gcp_project, d.budget\n"
                + "FROM t inner join " + view + " d\n"
                + "ON d.gcp_project = t.gcp_project AND d.created_at = t.last_created_at";
        return new WarehouseStatement(sql, List.of());
    }

    /**
     * @return budget per GCP project; projects with a {@code null} budget are left out
     */
    static Map<String, Double> fetch(WarehouseConnection connection) {
        Map<String, Double> budgets = new LinkedHashMap<>();
        for (Map<String, Object> row : statement(connection.getConfig().getBudgetView()).executeOn(connection)) {
            Object project = row.get("gcp_project");
            Object budget = row.get("budget");
            if (project != null && budget instanceof Number number) {
                budgets.put(project.toString(), number.doubleValue());
            }
        }
        return budgets;
    }
}
