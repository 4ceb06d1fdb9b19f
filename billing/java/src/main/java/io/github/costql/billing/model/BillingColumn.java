package io.github.costql.billing.model;

import io.github.costql.core.api.BindableEnum;
import io.github.costql.core.exception.DisallowedFieldException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Columns of the billing views.
 * <p>
 * Extended columns only exist in the extended aggregate view; requesting one
 * switches a query to that view. {@link #COST} and {@link #LABELS} can be selected
 * but never grouped on.
 * </p>
 *
 * @since 1.0.0
 */
public enum BillingColumn implements BindableEnum {
    // aggregate views
    TOPIC("topic", false, true),
    GCP_PROJECT("gcp_project", false, true),
    SKU("sku", false, true),
    CURRENCY("currency", false, true),
    COST("cost", false, false),
    LABELS("labels", false, false),
    DAY("day", false, true),
    COST_CATEGORY("cost_category", false, true),
    INVOICE_MONTH("invoice_month", false, true),
    AR_GUID("ar_guid", false, true),

    // extended view
    DATASET("dataset", true, true),
    BATCH_ID("batch_id", true, true),
    SEQUENCING_TYPE("sequencing_type", true, true),
    STAGE("stage", true, true),
    SEQUENCING_GROUP("sequencing_group", true, true),
    COMPUTE_CATEGORY("compute_category", true, true),
    CROMWELL_SUB_WORKFLOW_NAME("cromwell_sub_workflow_name", true, true),
    CROMWELL_WORKFLOW_ID("cromwell_workflow_id", true, true),
    GOOG_PIPELINES_WORKER("goog_pipelines_worker", true, true),
    WDL_TASK_NAME("wdl_task_name", true, true),
    NAMESPACE("namespace", true, true),

    // raw consolidated table
    ID("id", false, true),
    SERVICE("service", false, true),
    USAGE_START_TIME("usage_start_time", false, true),
    USAGE_END_TIME("usage_end_time", false, true),
    PROJECT("project", false, true),
    LOCATION("location", false, true),
    EXPORT_TIME("export_time", false, true),
    COST_TYPE("cost_type", false, true);

    private final String column;
    private final boolean extended;
    private final boolean groupable;

    BillingColumn(String column, boolean extended, boolean groupable) {
        this.column = column;
        this.extended = extended;
        this.groupable = groupable;
    }

    public String getColumn() {
        return column;
    }

    public boolean isExtended() {
        return extended;
    }

    public boolean canGroupBy() {
        return groupable;
    }

    @Override
    public String bindValue() {
        return column;
    }

    public static Set<BillingColumn> extendedColumns() {
        Set<BillingColumn> columns = EnumSet.noneOf(BillingColumn.class);
        for (BillingColumn column : values()) {
            if (column.extended) {
                columns.add(column);
            }
        }
        return columns;
    }

    /**
     * Title of the synthetic total record of a running-cost rollup, e.g.
     * {@code All Topics} or {@code All GCP Projects}.
     */
    public String allTitle() {
        if (this == GCP_PROJECT) {
            return "All GCP Projects";
        }
        StringBuilder title = new StringBuilder("All");
        for (String word : column.split("_")) {
            title.append(' ').append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return title.append('s').toString();
    }

    /**
     * @param value the column name, case-insensitive
     * @return the column
     * @throws DisallowedFieldException if no billing column has that name
     */
    public static BillingColumn parse(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (BillingColumn column : values()) {
                if (column.column.equals(normalized)) {
                    return column;
                }
            }
        }
        List<String> known = new ArrayList<>();
        Arrays.stream(values()).forEach(c -> known.add(c.column));
        throw new DisallowedFieldException(value, known);
    }
}
