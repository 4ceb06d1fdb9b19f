package io.github.costql.billing.aggregation;

import io.github.costql.billing.config.BillingConfig;
import io.github.costql.billing.model.AnalysisCostRecord;
import io.github.costql.billing.model.AnalysisCostRecord.BatchCost;
import io.github.costql.billing.model.AnalysisCostRecord.JobCost;
import io.github.costql.billing.tables.BillingBackendSelector;
import io.github.costql.billing.tables.BillingTables;
import io.github.costql.billing.warehouse.WarehouseClient;
import io.github.costql.billing.warehouse.WarehouseConnection;
import io.github.costql.billing.warehouse.WarehouseStatement;
import io.github.costql.core.exception.InternalQueryException;
import io.github.costql.core.exception.InvalidParameterException;
import io.github.costql.core.exception.MissingParameterException;
import io.github.costql.core.model.ParameterBinding;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("Batch cost summary Tests")
class BatchCostSummaryTest {

    private static final String LOOKUP_MARKER = "MIN(min_day)";
    private static final String SUMMARY_MARKER = "WITH d AS";

    @Mock
    private WarehouseClient client;

    private CostAggregator aggregator;
    private WarehouseConnection connection;

    @BeforeEach
    void setUp() {
        BillingConfig config = BillingConfig.defaults();
        aggregator = new CostAggregator(new BillingBackendSelector(BillingTables.from(config)),
                Clock.fixed(Instant.parse("2024-03-10T08:00:00Z"), ZoneOffset.UTC),
                CostCategoryClassifier.prefixHeuristic());
        connection = new WarehouseConnection(client, config);
        when(client.dryRun(anyString(), anyList(), anyMap())).thenReturn(0L);
    }

    private static Map<String, Object> lookupRow(String key, String value, LocalDate start, LocalDate end) {
        Map<String, Object> row = new HashMap<>();
        row.put(key, value);
        row.put("start_day", start);
        row.put("end_day", end);
        return row;
    }

    @SafeVarargs
    private void lookupRows(Map<String, Object>... rows) {
        when(client.query(contains(LOOKUP_MARKER), anyList(), anyMap())).thenReturn(Arrays.asList(rows));
    }

    private void summaryRows(List<Map<String, Object>> rows) {
        when(client.query(contains(SUMMARY_MARKER), anyList(), anyMap())).thenReturn(rows);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> summaryParameters() {
        ArgumentCaptor<List<ParameterBinding>> captor = ArgumentCaptor.forClass(List.class);
        verify(client).query(contains(SUMMARY_MARKER), captor.capture(), anyMap());
        return captor.getValue().stream()
                .collect(Collectors.toMap(ParameterBinding::name, ParameterBinding::wireValue));
    }

    private static Map<String, Object> sku(String name, double cost) {
        return Map.of("sku", name, "cost", cost);
    }

    private static Map<String, Object> summaryRow() {
        Map<String, Object> total = new HashMap<>();
        total.put("ar_guid", "ar-1");
        total.put("cost", 12.5);
        total.put("usage_start_time", Instant.parse("2024-01-01T10:00:00Z"));
        total.put("usage_end_time", "2024-01-02 11:30:00");

        Map<String, Object> job = new HashMap<>();
        job.put("job_id", 3L);
        job.put("batch_id", "b-1");
        job.put("job_name", "align");
        job.put("cost", 7.5);
        job.put("usage_start_time", Instant.parse("2024-01-01T10:00:00Z"));
        job.put("usage_end_time", Instant.parse("2024-01-01T12:00:00Z"));
        job.put("skus", List.of(sku("CPU", 7.5)));

        Map<String, Object> batch = new HashMap<>();
        batch.put("batch_id", "b-1");
        batch.put("batch_name", "align samples");
        batch.put("cost", 12.5);
        batch.put("usage_start_time", Instant.parse("2024-01-01T10:00:00Z"));
        batch.put("usage_end_time", Instant.parse("2024-01-02T11:30:00Z"));
        batch.put("jobs_cnt", 3L);
        batch.put("skus", List.of(sku("CPU", 10.0), sku("RAM", 2.5)));
        batch.put("jobs", List.of(job));
        batch.put("seq_groups", List.of(Map.of("sequencing_group", "CPG1", "stage", "align", "cost", 12.5)));

        Map<String, Object> category = new HashMap<>();
        category.put("category", "hail batch");
        category.put("cost", 12.5);
        category.put("workflows", 1L);

        Map<String, Object> row = new LinkedHashMap<>();
        row.put("total", total);
        row.put("topics", List.of(Map.of("topic", "seqr", "cost", 12.5)));
        row.put("categories", List.of(category));
        row.put("batches", List.of(batch));
        row.put("skus", List.of(sku("CPU", 10.0), sku("RAM", 2.5)));
        row.put("wdl_tasks", null);
        row.put("cromwell_sub_workflows", null);
        row.put("cromwell_workflows", null);
        row.put("seq_groups", List.of(Map.of("sequencing_group", "CPG1", "stage", "align", "cost", 12.5)));
        row.put("dataproc", null);
        return row;
    }

    @Nested
    @DisplayName("By analysis run")
    class ByAnalysisRun {

        @Test
        @DisplayName("Should scan from the first batch day through the day after the last one")
        void shouldScanBatchWindow() {
            // Given
            lookupRows(
                    lookupRow("batch_id", "b-1", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2)),
                    lookupRow("batch_id", "b-2", LocalDate.of(2023, 12, 30), LocalDate.of(2024, 1, 1)));
            summaryRows(List.of(summaryRow()));

            // When
            List<AnalysisCostRecord> records = aggregator.getCostByArGuid(connection, "ar-1");

            // Then
            assertEquals(1, records.size());
            Map<String, Object> parameters = summaryParameters();
            assertEquals("2023-12-30 00:00:00", parameters.get("start_time"));
            assertEquals("2024-01-03 00:00:00", parameters.get("end_time"));
            assertEquals("ar-1", parameters.get("ar_guid"));
            assertFalse(parameters.containsKey("batch_ids"));
        }

        @Test
        @DisplayName("Should read the batch lookup view and the extended view")
        void shouldQueryConfiguredViews() {
            // Given
            lookupRows(lookupRow("batch_id", "b-1", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 1)));
            summaryRows(List.of());

            // When
            aggregator.getCostByArGuid(connection, "ar-1");

            // Then
            ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
            verify(client, times(2)).query(captor.capture(), anyList(), anyMap());
            assertTrue(captor.getAllValues().get(0).contains("FROM `billing_aggregate.ar_batch_lookup`"));
            String summary = captor.getAllValues().get(1);
            assertTrue(summary.contains("FROM `billing_aggregate.aggregate_daily_cost_extended`"));
            assertTrue(summary.contains("WHERE day >= TIMESTAMP(@start_time)"));
            assertTrue(summary.contains("AND ar_guid = @ar_guid"));
        }

        @Test
        @DisplayName("Should map the summary row into an analysis cost record")
        void shouldMapSummaryRow() {
            // Given
            lookupRows(lookupRow("batch_id", "b-1", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2)));
            summaryRows(List.of(summaryRow()));

            // When
            AnalysisCostRecord record = aggregator.getCostByArGuid(connection, "ar-1").get(0);

            // Then
            assertEquals("ar-1", record.total().arGuid());
            assertEquals(12.5, record.total().cost());
            assertEquals(LocalDateTime.of(2024, 1, 1, 10, 0), record.total().usageStartTime());
            assertEquals(LocalDateTime.of(2024, 1, 2, 11, 30), record.total().usageEndTime());
            assertEquals("seqr", record.topics().get(0).topic());
            assertEquals(1L, record.categories().get(0).workflows());
            assertEquals(List.of("CPU", "RAM"),
                    record.skus().stream().map(AnalysisCostRecord.SkuCost::sku).collect(Collectors.toList()));
            assertTrue(record.wdlTasks().isEmpty());
            assertTrue(record.dataproc().isEmpty());

            BatchCost batch = record.batches().get(0);
            assertEquals("align samples", batch.batchName());
            assertEquals(3L, batch.jobsCnt());
            assertEquals("CPG1", batch.seqGroups().get(0).sequencingGroup());

            JobCost job = batch.jobs().get(0);
            assertEquals(3L, job.jobId());
            assertEquals("align", job.jobName());
            assertEquals(LocalDateTime.of(2024, 1, 1, 12, 0), job.usageEndTime());
        }

        @Test
        @DisplayName("Should return nothing without running the summary when the run has no batches")
        void shouldSkipSummaryForUnknownRun() {
            // Given
            lookupRows();

            // When
            List<AnalysisCostRecord> records = aggregator.getCostByArGuid(connection, "ar-unknown");

            // Then
            assertTrue(records.isEmpty());
            verify(client, never()).query(contains(SUMMARY_MARKER), anyList(), anyMap());
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"  "})
        @DisplayName("Should reject a missing analysis run before any query")
        void shouldRejectMissingRun(String arGuid) {
            assertThrows(MissingParameterException.class, () -> aggregator.getCostByArGuid(connection, arGuid));
            verifyNoInteractions(client);
        }
    }

    @Nested
    @DisplayName("By batch")
    class ByBatch {

        @Test
        @DisplayName("Should summarize the whole analysis run of the batch")
        void shouldSummarizeRunOfBatch() {
            // Given
            lookupRows(
                    lookupRow("ar_guid", "ar-1", LocalDate.of(2024, 1, 5), LocalDate.of(2024, 1, 6)),
                    lookupRow("ar_guid", null, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 1)));
            summaryRows(List.of(summaryRow()));

            // When
            aggregator.getCostByBatchId(connection, "b-1");

            // Then
            Map<String, Object> parameters = summaryParameters();
            assertEquals("ar-1", parameters.get("ar_guid"));
            assertEquals("2024-01-05 00:00:00", parameters.get("start_time"));
            assertEquals("2024-01-07 00:00:00", parameters.get("end_time"));
        }

        @Test
        @DisplayName("Should summarize the batch alone when it belongs to no analysis run")
        void shouldSummarizeBatchWithoutRun() {
            // Given
            lookupRows(lookupRow("ar_guid", null, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 1)));
            summaryRows(List.of());

            // When
            List<AnalysisCostRecord> records = aggregator.getCostByBatchId(connection, "b-9");

            // Then
            assertTrue(records.isEmpty());
            Map<String, Object> parameters = summaryParameters();
            assertEquals(List.of("b-9"), parameters.get("batch_ids"));
            assertFalse(parameters.containsKey("ar_guid"));
        }

        @Test
        @DisplayName("Should reject a batch shared by several analysis runs")
        void shouldRejectSharedBatch() {
            // Given
            lookupRows(
                    lookupRow("ar_guid", "ar-2", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 1)),
                    lookupRow("ar_guid", "ar-1", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 1)));

            // When
            InvalidParameterException error = assertThrows(InvalidParameterException.class,
                    () -> aggregator.getCostByBatchId(connection, "b-1"));

            // Then
            assertTrue(error.getMessage().contains("b-1"));
            verify(client, never()).query(contains(SUMMARY_MARKER), anyList(), anyMap());
        }

        @Test
        @DisplayName("Should return nothing for an unknown batch")
        void shouldReturnNothingForUnknownBatch() {
            lookupRows();

            assertTrue(aggregator.getCostByBatchId(connection, "b-unknown").isEmpty());
        }
    }

    @Nested
    @DisplayName("Summary statement")
    class Statement {

        @Test
        @DisplayName("Should filter by batch ids and build every breakdown")
        void shouldBuildBatchStatement() {
            // Given
            BatchLookup.Scope scope = new BatchLookup.Scope(LocalDateTime.of(2024, 1, 1, 0, 0),
                    LocalDateTime.of(2024, 1, 3, 0, 0), null, List.of("b-1", "b-2"));

            // When
            WarehouseStatement statement = BatchCostStatement.build(
                    BillingTables.from(BillingConfig.defaults()).extended(), scope);

            // Then
            assertTrue(statement.sql().contains("AND batch_id IN UNNEST(@batch_ids)"));
            assertTrue(statement.sql().contains("THEN 'hail batch' ELSE compute_category END AS category"));
            for (String array : List.of("wdl_tasks", "cromwell_workflows", "cromwell_sub_workflows", "dataproc")) {
                assertTrue(statement.sql().contains(") AS " + array + "\n"), array);
            }
            assertTrue(statement.sql().endsWith(
                    "FROM t, t3acc, ccacc, bacc, arskuacc, wdlacc, cswacc, cwiacc, seqgrpacc, dprocacc"));
            ParameterBinding batchIds = statement.parameters().get(2);
            assertEquals("batch_ids", batchIds.name());
            assertEquals("ARRAY<STRING>", batchIds.declaredType());
        }

        @Test
        @DisplayName("Should refuse a scope with neither run nor batches")
        void shouldRefuseEmptyScope() {
            assertThrows(InternalQueryException.class, () -> new BatchLookup.Scope(
                    LocalDateTime.of(2024, 1, 1, 0, 0), LocalDateTime.of(2024, 1, 2, 0, 0), null, List.of()));
        }
    }
}
