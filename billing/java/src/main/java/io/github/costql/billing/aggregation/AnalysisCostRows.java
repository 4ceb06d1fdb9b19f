package io.github.costql.billing.aggregation;

import io.github.costql.billing.model.AnalysisCostRecord;
import io.github.costql.billing.model.AnalysisCostRecord.BatchCost;
import io.github.costql.billing.model.AnalysisCostRecord.CategoryCost;
import io.github.costql.billing.model.AnalysisCostRecord.CromwellSubWorkflowCost;
import io.github.costql.billing.model.AnalysisCostRecord.CromwellWorkflowCost;
import io.github.costql.billing.model.AnalysisCostRecord.DataprocCost;
import io.github.costql.billing.model.AnalysisCostRecord.JobCost;
import io.github.costql.billing.model.AnalysisCostRecord.SequencingGroupCost;
import io.github.costql.billing.model.AnalysisCostRecord.SkuCost;
import io.github.costql.billing.model.AnalysisCostRecord.TopicCost;
import io.github.costql.billing.model.AnalysisCostRecord.Total;
import io.github.costql.billing.model.AnalysisCostRecord.WdlTaskCost;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static io.github.costql.billing.aggregation.WarehouseValues.array;
import static io.github.costql.billing.aggregation.WarehouseValues.dateTime;
import static io.github.costql.billing.aggregation.WarehouseValues.integer;
import static io.github.costql.billing.aggregation.WarehouseValues.number;
import static io.github.costql.billing.aggregation.WarehouseValues.struct;
import static io.github.costql.billing.aggregation.WarehouseValues.text;

/**
 * Maps summary rows of {@link BatchCostStatement} to {@link AnalysisCostRecord}s.
 */
final class AnalysisCostRows {

    private AnalysisCostRows() {
    }

    static AnalysisCostRecord toRecord(Map<String, Object> row) {
        Map<String, Object> total = struct(row.get("total"));
        return new AnalysisCostRecord(
                new Total(
                        text(total.get("ar_guid")),
                        number(total.get("cost")),
                        dateTime(total.get("usage_end_time")),
                        dateTime(total.get("usage_start_time"))),
                list(row.get("topics"), s -> new TopicCost(text(s.get("topic")), number(s.get("cost")))),
                list(row.get("categories"), s -> new CategoryCost(
                        text(s.get("category")), number(s.get("cost")), integer(s.get("workflows")))),
                list(row.get("batches"), AnalysisCostRows::batch),
                skus(row.get("skus")),
                seqGroups(row.get("seq_groups")),
                list(row.get("wdl_tasks"), s -> new WdlTaskCost(
                        text(s.get("wdl_task_name")), number(s.get("cost")),
                        dateTime(s.get("usage_start_time")), dateTime(s.get("usage_end_time")),
                        skus(s.get("skus")))),
                list(row.get("cromwell_sub_workflows"), s -> new CromwellSubWorkflowCost(
                        text(s.get("cromwell_sub_workflow_name")), number(s.get("cost")),
                        dateTime(s.get("usage_start_time")), dateTime(s.get("usage_end_time")),
                        skus(s.get("skus")))),
                list(row.get("cromwell_workflows"), s -> new CromwellWorkflowCost(
                        text(s.get("cromwell_workflow_id")), number(s.get("cost")),
                        dateTime(s.get("usage_start_time")), dateTime(s.get("usage_end_time")),
                        skus(s.get("skus")))),
                list(row.get("dataproc"), s -> new DataprocCost(
                        text(s.get("dataproc")), number(s.get("cost")),
                        dateTime(s.get("usage_start_time")), dateTime(s.get("usage_end_time")),
                        skus(s.get("skus")))));
    }

    private static BatchCost batch(Map<String, Object> s) {
        return new BatchCost(
                text(s.get("batch_id")),
                text(s.get("batch_name")),
                number(s.get("cost")),
                dateTime(s.get("usage_start_time")),
                dateTime(s.get("usage_end_time")),
                integer(s.get("jobs_cnt")),
                skus(s.get("skus")),
                list(s.get("jobs"), job -> new JobCost(
                        integer(job.get("job_id")),
                        text(job.get("batch_id")),
                        text(job.get("job_name")),
                        number(job.get("cost")),
                        dateTime(job.get("usage_start_time")),
                        dateTime(job.get("usage_end_time")),
                        skus(job.get("skus")))),
                seqGroups(s.get("seq_groups")));
    }

    private static List<SkuCost> skus(Object value) {
        return list(value, s -> new SkuCost(text(s.get("sku")), number(s.get("cost"))));
    }

    private static List<SequencingGroupCost> seqGroups(Object value) {
        return list(value, s -> new SequencingGroupCost(
                text(s.get("sequencing_group")), text(s.get("stage")), number(s.get("cost"))));
    }

    private static <T> List<T> list(Object value, Function<Map<String, Object>, T> mapper) {
        List<?> structs = array(value);
        List<T> mapped = new ArrayList<>(structs.size());
        for (Object element : structs) {
            mapped.add(mapper.apply(struct(element)));
        }
        return mapped;
    }
}
