package io.github.costql.billing.aggregation;

import io.github.costql.billing.tables.BillingTable;
import io.github.costql.billing.warehouse.WarehouseParameters;
import io.github.costql.billing.warehouse.WarehouseStatement;
import io.github.costql.core.model.BindValue;
import io.github.costql.core.model.ParameterBinding;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the summary query of an analysis run or of a set of batches.
 * <p>
 * All usage rows of the scope are read once into the {@code d} CTE; every breakdown
 * is folded from it and the result is one row per analysis run with the columns
 * {@code total}, {@code topics}, {@code categories}, {@code batches}, {@code skus},
 * {@code wdl_tasks}, {@code cromwell_sub_workflows}, {@code cromwell_workflows},
 * {@code seq_groups} and {@code dataproc}.
 * </p>
 * <p>
 * Usage rows without a compute category but with a batch id are counted as
 * {@value #HAIL_BATCH}.
 * </p>
 *
 * @since 1.0.0
 */
final class BatchCostStatement {

    static final String HAIL_BATCH = "hail batch";

    private static final String INDENT = "    ";

    private BatchCostStatement() {
    }

    /**
     * @param table the extended view
     * @param scope the run or batches and their day range
     * @return the statement
     */
    static WarehouseStatement build(BillingTable table, BatchLookup.Scope scope) {
        List<ParameterBinding> parameters = new ArrayList<>();
        parameters.add(WarehouseParameters.of("start_time", BindValue.ofTimestamp(scope.start())));
        parameters.add(WarehouseParameters.of("end_time", BindValue.ofTimestamp(scope.end())));

        String condition;
        if (scope.arGuid() != null) {
            condition = "ar_guid = @ar_guid";
            parameters.add(WarehouseParameters.string("ar_guid", scope.arGuid()));
        } else {
            condition = "batch_id IN UNNEST(@batch_ids)";
            List<BindValue> ids = new ArrayList<>(scope.batchIds().size());
            for (String batchId : scope.batchIds()) {
                ids.add(BindValue.ofString(batchId));
            }
            parameters.add(WarehouseParameters.of("batch_ids", BindValue.ofArray(ids)));
        }

        StringBuilder sql = new StringBuilder();
        usage(sql, table, condition);
        totals(sql);
        batches(sql);
        named(sql, "wdl", "wdl_task_name", "wdl_tasks");
        named(sql, "cwi", "cromwell_workflow_id", "cromwell_workflows");
        named(sql, "csw", "cromwell_sub_workflow_name", "cromwell_sub_workflows");
        dataproc(sql);
        sql.append("SELECT t.total, t3acc.topics, ccacc.categories, bacc.batches, arskuacc.skus,\n")
                .append(INDENT).append("wdlacc.wdl_tasks, cswacc.cromwell_sub_workflows, cwiacc.cromwell_workflows,\n")
                .append(INDENT).append("seqgrpacc.seq_groups, dprocacc.dataproc\n")
                .append("FROM t, t3acc, ccacc, bacc, arskuacc, wdlacc, cswacc, cwiacc, seqgrpacc, dprocacc");
        return new WarehouseStatement(sql.toString(), parameters);
    }

    private static void usage(StringBuilder sql, BillingTable table, String condition) {
        sql.append("WITH d AS (\n")
                .append(INDENT).append("SELECT topic, ar_guid,\n")
                .append(INDENT).append("CASE WHEN compute_category IS NULL AND batch_id IS NOT NULL THEN '")
                .append(HAIL_BATCH).append("' ELSE compute_category END AS category,\n")
                .append(INDENT).append("batch_id, CAST(job_id AS INT) job_id, sku, cost,\n")
                .append(INDENT).append("usage_start_time, usage_end_time, sequencing_group, stage,\n")
                .append(INDENT).append("wdl_task_name, cromwell_sub_workflow_name, cromwell_workflow_id,\n")
                .append(INDENT).append("JSON_VALUE(PARSE_JSON(labels), '$.batch_name') as batch_name,\n")
                .append(INDENT).append("JSON_VALUE(PARSE_JSON(labels), '$.job_name') as job_name\n")
                .append(INDENT).append("FROM ").append(table.quoted()).append('\n')
                .append(INDENT).append("WHERE day >= TIMESTAMP(@start_time)\n")
                .append(INDENT).append("AND day <= TIMESTAMP(@end_time)\n")
                .append(INDENT).append("AND ").append(condition).append('\n')
                .append(")\n");
    }

    private static void totals(StringBuilder sql) {
        sql.append(", arsku AS (\n")
                .append(INDENT).append("SELECT sku, SUM(cost) as cost FROM d WHERE cost != 0\n")
                .append(INDENT).append("GROUP BY sku ORDER BY cost DESC\n")
                .append(")\n")
                .append(", arskuacc AS (SELECT ARRAY_AGG(STRUCT(sku, cost)) AS skus FROM arsku)\n")
                .append(", seqgrp AS (\n")
                .append(INDENT).append("SELECT sequencing_group, stage, SUM(cost) as cost FROM d\n")
                .append(INDENT).append("GROUP BY stage, sequencing_group\n")
                .append(")\n")
                .append(", seqgrpacc AS (SELECT ARRAY_AGG(STRUCT(sequencing_group, stage, cost)) AS seq_groups FROM seqgrp)\n")
                .append(", t3 AS (\n")
                .append(INDENT).append("SELECT topic, SUM(cost) AS cost FROM d WHERE topic IS NOT NULL\n")
                .append(INDENT).append("GROUP BY topic ORDER BY cost DESC\n")
                .append(")\n")
                .append(", t3acc AS (SELECT ARRAY_AGG(STRUCT(topic, cost)) AS topics FROM t3)\n")
                .append(", cc AS (\n")
                .append(INDENT).append("SELECT category, SUM(cost) AS cost,\n")
                .append(INDENT).append("CASE WHEN category = '").append(HAIL_BATCH)
                .append("' THEN COUNT(DISTINCT batch_id) ELSE NULL END as workflows\n")
                .append(INDENT).append("FROM d GROUP BY category\n")
                .append(")\n")
                .append(", ccacc AS (SELECT ARRAY_AGG(STRUCT(cc.category, cc.cost, cc.workflows)) AS categories FROM cc)\n")
                .append(", t AS (\n")
                .append(INDENT).append("SELECT STRUCT(ar_guid, SUM(d.cost) AS cost,\n")
                .append(INDENT).append("MIN(usage_start_time) AS usage_start_time,\n")
                .append(INDENT).append("MAX(usage_end_time) AS usage_end_time) AS total\n")
                .append(INDENT).append("FROM d GROUP BY ar_guid\n")
                .append(")\n");
    }

    private static void batches(StringBuilder sql) {
        sql.append(", jsku AS (\n")
                .append(INDENT).append("SELECT batch_id, job_id, sku, SUM(cost) as cost FROM d\n")
                .append(INDENT).append("WHERE cost != 0 AND batch_id IS NOT NULL AND job_id IS NOT NULL\n")
                .append(INDENT).append("GROUP BY batch_id, job_id, sku ORDER BY batch_id, job_id, cost DESC\n")
                .append(")\n")
                .append(", jskuacc AS (\n")
                .append(INDENT).append("SELECT batch_id, job_id, ARRAY_AGG(STRUCT(sku, cost)) as skus\n")
                .append(INDENT).append("FROM jsku GROUP BY batch_id, job_id\n")
                .append(")\n")
                .append(", j AS (\n")
                .append(INDENT).append("SELECT d.batch_id, d.job_id, d.job_name, SUM(d.cost) AS cost,\n")
                .append(INDENT).append("MIN(usage_start_time) AS usage_start_time, MAX(usage_end_time) AS usage_end_time\n")
                .append(INDENT).append("FROM d WHERE d.batch_id IS NOT NULL AND d.job_id IS NOT NULL\n")
                .append(INDENT).append("GROUP BY d.batch_id, d.job_id, d.job_name ORDER BY job_id\n")
                .append(")\n")
                .append(", jacc AS (\n")
                .append(INDENT).append("SELECT j.batch_id, ARRAY_AGG(STRUCT(j.job_id, j.batch_id, job_name, cost,\n")
                .append(INDENT).append("usage_start_time, usage_end_time, jskuacc.skus)) AS jobs\n")
                .append(INDENT).append("FROM j INNER JOIN jskuacc ON jskuacc.batch_id = j.batch_id AND jskuacc.job_id = j.job_id\n")
                .append(INDENT).append("GROUP BY j.batch_id\n")
                .append(")\n")
                .append(", bsku AS (\n")
                .append(INDENT).append("SELECT batch_id, sku, SUM(cost) as cost FROM d\n")
                .append(INDENT).append("WHERE cost != 0 AND batch_id IS NOT NULL\n")
                .append(INDENT).append("GROUP BY batch_id, sku ORDER BY batch_id, cost DESC\n")
                .append(")\n")
                .append(", bskuacc AS (\n")
                .append(INDENT).append("SELECT batch_id, ARRAY_AGG(STRUCT(sku, cost)) as skus FROM bsku GROUP BY batch_id\n")
                .append(")\n")
                .append(", b AS (\n")
                .append(INDENT).append("SELECT d.batch_id, d.batch_name, SUM(d.cost) AS cost,\n")
                .append(INDENT).append("MIN(d.usage_start_time) AS usage_start_time, MAX(d.usage_end_time) AS usage_end_time,\n")
                .append(INDENT).append("MAX(d.job_id) as jobs_cnt\n")
                .append(INDENT).append("FROM d WHERE d.batch_id IS NOT NULL\n")
                .append(INDENT).append("GROUP BY batch_id, batch_name ORDER BY batch_id\n")
                .append(")\n")
                .append(", bseqgrp AS (\n")
                .append(INDENT).append("SELECT batch_id, sequencing_group, stage, SUM(cost) as cost FROM d\n")
                .append(INDENT).append("GROUP BY batch_id, sequencing_group, stage\n")
                .append(")\n")
                .append(", bseqgrpacc AS (\n")
                .append(INDENT).append("SELECT batch_id, ARRAY_AGG(STRUCT(sequencing_group, stage, cost)) as seq_groups\n")
                .append(INDENT).append("FROM bseqgrp GROUP BY batch_id\n")
                .append(")\n")
                .append(", bacc AS (\n")
                .append(INDENT).append("SELECT ARRAY_AGG(STRUCT(b.batch_id, batch_name, cost, usage_start_time, usage_end_time,\n")
                .append(INDENT).append("jobs_cnt, bskuacc.skus, jacc.jobs, bseqgrpacc.seq_groups)) AS batches\n")
                .append(INDENT).append("FROM b\n")
                .append(INDENT).append("INNER JOIN bskuacc ON bskuacc.batch_id = b.batch_id\n")
                .append(INDENT).append("INNER JOIN jacc ON jacc.batch_id = b.batch_id\n")
                .append(INDENT).append("INNER JOIN bseqgrpacc ON bseqgrpacc.batch_id = b.batch_id\n")
                .append(")\n");
    }

    /**
     * Breakdown keyed by one workflow column: {@code <alias>sku}, {@code <alias>skuacc},
     * {@code <alias>} and {@code <alias>acc} holding the array {@code arrayName}.
     */
    private static void named(StringBuilder sql, String alias, String column, String arrayName) {
        sql.append(", ").append(alias).append("sku AS (\n")
                .append(INDENT).append("SELECT ").append(column).append(", sku, SUM(cost) as cost FROM d\n")
                .append(INDENT).append("WHERE cost != 0 AND ").append(column).append(" IS NOT NULL\n")
                .append(INDENT).append("GROUP BY ").append(column).append(", sku ORDER BY ")
                .append(column).append(", cost DESC\n")
                .append(")\n")
                .append(", ").append(alias).append("skuacc AS (\n")
                .append(INDENT).append("SELECT ").append(column).append(", ARRAY_AGG(STRUCT(sku, cost)) as skus\n")
                .append(INDENT).append("FROM ").append(alias).append("sku GROUP BY ").append(column).append('\n')
                .append(")\n")
                .append(", ").append(alias).append(" AS (\n")
                .append(INDENT).append("SELECT d.").append(column).append(", SUM(d.cost) AS cost,\n")
                .append(INDENT).append("MIN(d.usage_start_time) AS usage_start_time, MAX(d.usage_end_time) AS usage_end_time\n")
                .append(INDENT).append("FROM d WHERE d.").append(column).append(" IS NOT NULL\n")
                .append(INDENT).append("GROUP BY ").append(column).append(" ORDER BY ").append(column).append('\n')
                .append(")\n")
                .append(", ").append(alias).append("acc AS (\n")
                .append(INDENT).append("SELECT ARRAY_AGG(STRUCT(").append(alias).append('.').append(column)
                .append(", cost, usage_start_time, usage_end_time, ").append(alias).append("skuacc.skus)) AS ")
                .append(arrayName).append('\n')
                .append(INDENT).append("FROM ").append(alias).append('\n')
                .append(INDENT).append("INNER JOIN ").append(alias).append("skuacc ON ")
                .append(alias).append("skuacc.").append(column).append(" = ")
                .append(alias).append('.').append(column).append('\n')
                .append(")\n");
    }

    private static void dataproc(StringBuilder sql) {
        sql.append(", dprocsku AS (\n")
                .append(INDENT).append("SELECT category as dataproc, sku, SUM(cost) as cost FROM d\n")
                .append(INDENT).append("WHERE category = 'dataproc' AND cost != 0\n")
                .append(INDENT).append("GROUP BY dataproc, sku ORDER BY cost DESC\n")
                .append(")\n")
                .append(", dprocskuacc AS (\n")
                .append(INDENT).append("SELECT dataproc, ARRAY_AGG(STRUCT(sku, cost)) AS skus FROM dprocsku GROUP BY dataproc\n")
                .append(")\n")
                .append(", dproc AS (\n")
                .append(INDENT).append("SELECT category as dataproc, SUM(cost) AS cost,\n")
                .append(INDENT).append("MIN(usage_start_time) AS usage_start_time, MAX(usage_end_time) AS usage_end_time\n")
                .append(INDENT).append("FROM d WHERE category = 'dataproc' GROUP BY dataproc\n")
                .append(")\n")
                .append(", dprocacc AS (\n")
                .append(INDENT).append("SELECT ARRAY_AGG(STRUCT(dproc.dataproc, cost, usage_start_time, usage_end_time,\n")
                .append(INDENT).append("dprocskuacc.skus)) AS dataproc\n")
                .append(INDENT).append("FROM dproc INNER JOIN dprocskuacc ON dprocskuacc.dataproc = dproc.dataproc\n")
                .append(")\n");
    }
}
