package io.github.costql.billing.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Cost summary of one analysis run, or of one batch that belongs to no run.
 * <p>
 * Every breakdown is computed by a single warehouse query over the extended view:
 * cost per topic, per category, per SKU and per sequencing group, then one entry
 * per Hail batch (with its jobs), per WDL task, per Cromwell workflow and
 * sub-workflow, and for Dataproc. Usage times are UTC.
 * </p>
 * <p>
 * Usage times are {@link LocalDateTime}s: the serializing {@code ObjectMapper} needs the
 * Java time module, with {@code WRITE_DATES_AS_TIMESTAMPS} disabled for ISO text.
 * </p>
 *
 * @param total                 the run total
 * @param topics                cost per topic, highest first
 * @param categories            cost per category; Hail batch categories count distinct batches
 * @param batches               one entry per Hail batch
 * @param skus                  cost per SKU, highest first
 * @param seqGroups             cost per sequencing group and stage
 * @param wdlTasks              one entry per WDL task
 * @param cromwellSubWorkflows  one entry per Cromwell sub-workflow
 * @param cromwellWorkflows     one entry per Cromwell workflow
 * @param dataproc              Dataproc usage, at most one entry
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"total", "topics", "categories", "batches", "skus", "seq_groups", "wdl_tasks",
        "cromwell_sub_workflows", "cromwell_workflows", "dataproc"})
public record AnalysisCostRecord(
        @JsonProperty("total") Total total,
        @JsonProperty("topics") List<TopicCost> topics,
        @JsonProperty("categories") List<CategoryCost> categories,
        @JsonProperty("batches") List<BatchCost> batches,
        @JsonProperty("skus") List<SkuCost> skus,
        @JsonProperty("seq_groups") List<SequencingGroupCost> seqGroups,
        @JsonProperty("wdl_tasks") List<WdlTaskCost> wdlTasks,
        @JsonProperty("cromwell_sub_workflows") List<CromwellSubWorkflowCost> cromwellSubWorkflows,
        @JsonProperty("cromwell_workflows") List<CromwellWorkflowCost> cromwellWorkflows,
        @JsonProperty("dataproc") List<DataprocCost> dataproc
) {

    public AnalysisCostRecord {
        topics = copy(topics);
        categories = copy(categories);
        batches = copy(batches);
        skus = copy(skus);
        seqGroups = copy(seqGroups);
        wdlTasks = copy(wdlTasks);
        cromwellSubWorkflows = copy(cromwellSubWorkflows);
        cromwellWorkflows = copy(cromwellWorkflows);
        dataproc = copy(dataproc);
    }

    private static <T> List<T> copy(List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }

    @JsonPropertyOrder({"ar_guid", "cost", "usage_end_time", "usage_start_time"})
    public record Total(
            @JsonProperty("ar_guid") String arGuid,
            @JsonProperty("cost") double cost,
            @JsonProperty("usage_end_time") LocalDateTime usageEndTime,
            @JsonProperty("usage_start_time") LocalDateTime usageStartTime
    ) {
    }

    public record TopicCost(@JsonProperty("topic") String topic, @JsonProperty("cost") double cost) {
    }

    /**
     * @param workflows distinct batches for the Hail batch category, {@code null} for the others
     */
    public record CategoryCost(
            @JsonProperty("category") String category,
            @JsonProperty("cost") double cost,
            @JsonProperty("workflows") Long workflows
    ) {
    }

    public record SkuCost(@JsonProperty("sku") String sku, @JsonProperty("cost") double cost) {
    }

    public record SequencingGroupCost(
            @JsonProperty("sequencing_group") String sequencingGroup,
            @JsonProperty("stage") String stage,
            @JsonProperty("cost") double cost
    ) {
    }

    @JsonPropertyOrder({"job_id", "batch_id", "job_name", "cost", "usage_start_time", "usage_end_time", "skus"})
    public record JobCost(
            @JsonProperty("job_id") Long jobId,
            @JsonProperty("batch_id") String batchId,
            @JsonProperty("job_name") String jobName,
            @JsonProperty("cost") double cost,
            @JsonProperty("usage_start_time") LocalDateTime usageStartTime,
            @JsonProperty("usage_end_time") LocalDateTime usageEndTime,
            @JsonProperty("skus") List<SkuCost> skus
    ) {
        public JobCost {
            skus = copy(skus);
        }
    }

    /**
     * @param jobsCnt the highest job id of the batch
     */
    @JsonPropertyOrder({"batch_id", "batch_name", "cost", "usage_start_time", "usage_end_time", "jobs_cnt",
            "skus", "jobs", "seq_groups"})
    public record BatchCost(
            @JsonProperty("batch_id") String batchId,
            @JsonProperty("batch_name") String batchName,
            @JsonProperty("cost") double cost,
            @JsonProperty("usage_start_time") LocalDateTime usageStartTime,
            @JsonProperty("usage_end_time") LocalDateTime usageEndTime,
            @JsonProperty("jobs_cnt") Long jobsCnt,
            @JsonProperty("skus") List<SkuCost> skus,
            @JsonProperty("jobs") List<JobCost> jobs,
            @JsonProperty("seq_groups") List<SequencingGroupCost> seqGroups
    ) {
        public BatchCost {
            skus = copy(skus);
            jobs = copy(jobs);
            seqGroups = copy(seqGroups);
        }
    }

    @JsonPropertyOrder({"wdl_task_name", "cost", "usage_start_time", "usage_end_time", "skus"})
    public record WdlTaskCost(
            @JsonProperty("wdl_task_name") String wdlTaskName,
            @JsonProperty("cost") double cost,
            @JsonProperty("usage_start_time") LocalDateTime usageStartTime,
            @JsonProperty("usage_end_time") LocalDateTime usageEndTime,
            @JsonProperty("skus") List<SkuCost> skus
    ) {
        public WdlTaskCost {
            skus = copy(skus);
        }
    }

    @JsonPropertyOrder({"cromwell_sub_workflow_name", "cost", "usage_start_time", "usage_end_time", "skus"})
    public record CromwellSubWorkflowCost(
            @JsonProperty("cromwell_sub_workflow_name") String cromwellSubWorkflowName,
            @JsonProperty("cost") double cost,
            @JsonProperty("usage_start_time") LocalDateTime usageStartTime,
            @JsonProperty("usage_end_time") LocalDateTime usageEndTime,
            @JsonProperty("skus") List<SkuCost> skus
    ) {
        public CromwellSubWorkflowCost {
            skus = copy(skus);
        }
    }

    @JsonPropertyOrder({"cromwell_workflow_id", "cost", "usage_start_time", "usage_end_time", "skus"})
    public record CromwellWorkflowCost(
            @JsonProperty("cromwell_workflow_id") String cromwellWorkflowId,
            @JsonProperty("cost") double cost,
            @JsonProperty("usage_start_time") LocalDateTime usageStartTime,
            @JsonProperty("usage_end_time") LocalDateTime usageEndTime,
            @JsonProperty("skus") List<SkuCost> skus
    ) {
        public CromwellWorkflowCost {
            skus = copy(skus);
        }
    }

    @JsonPropertyOrder({"dataproc", "cost", "usage_start_time", "usage_end_time", "skus"})
    public record DataprocCost(
            @JsonProperty("dataproc") String dataproc,
            @JsonProperty("cost") double cost,
            @JsonProperty("usage_start_time") LocalDateTime usageStartTime,
            @JsonProperty("usage_end_time") LocalDateTime usageEndTime,
            @JsonProperty("skus") List<SkuCost> skus
    ) {
        public DataprocCost {
            skus = copy(skus);
        }
    }
}
