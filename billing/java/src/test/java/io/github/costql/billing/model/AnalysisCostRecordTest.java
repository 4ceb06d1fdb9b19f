package io.github.costql.billing.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.InvalidDefinitionException;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.costql.billing.model.AnalysisCostRecord.BatchCost;
import io.github.costql.billing.model.AnalysisCostRecord.JobCost;
import io.github.costql.billing.model.AnalysisCostRecord.SkuCost;
import io.github.costql.billing.model.AnalysisCostRecord.Total;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AnalysisCostRecord JSON Tests")
class AnalysisCostRecordTest {

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 10, 0);
    private static final LocalDateTime END = LocalDateTime.of(2024, 1, 2, 11, 30, 15);

    private static AnalysisCostRecord record() {
        JobCost job = new JobCost(3L, "b-1", "align", 7.5, START, END, List.of(new SkuCost("CPU", 7.5)));
        BatchCost batch = new BatchCost("b-1", "align samples", 7.5, START, END, 3L,
                List.of(new SkuCost("CPU", 7.5)), List.of(job), null);
        return new AnalysisCostRecord(new Total("ar-1", 7.5, END, START), null, null, List.of(batch),
                null, null, null, null, null, null);
    }

    @Test
    @DisplayName("Should write usage times as ISO text and keep the field order")
    void shouldSerializeUsageTimes() throws Exception {
        // When
        JsonNode json = mapper.readTree(mapper.writeValueAsString(record()));

        // Then
        List<String> names = new ArrayList<>();
        for (Iterator<String> it = json.fieldNames(); it.hasNext(); ) {
            names.add(it.next());
        }
        assertEquals(List.of("total", "topics", "categories", "batches", "skus", "seq_groups", "wdl_tasks",
                "cromwell_sub_workflows", "cromwell_workflows", "dataproc"), names);
        assertEquals("2024-01-02T11:30:15", json.get("total").get("usage_end_time").asText());
        assertEquals("2024-01-01T10:00:00", json.get("total").get("usage_start_time").asText());

        JsonNode batch = json.get("batches").get(0);
        assertEquals(3, batch.get("jobs_cnt").asInt());
        assertEquals("2024-01-01T10:00:00", batch.get("jobs").get(0).get("usage_start_time").asText());
        assertTrue(batch.get("seq_groups").isArray());
        assertEquals(0, json.get("topics").size());
    }

    @Test
    @DisplayName("Should read back usage times")
    void shouldDeserialize() throws Exception {
        // Given
        String json = mapper.writeValueAsString(record());

        // When
        AnalysisCostRecord read = mapper.readValue(json, AnalysisCostRecord.class);

        // Then
        assertEquals(record(), read);
        assertEquals(END, read.batches().get(0).jobs().get(0).usageEndTime());
    }

    @Test
    @DisplayName("Should not serialize usage times without the Java time module")
    void shouldNeedJavaTimeModule() {
        ObjectMapper plain = new ObjectMapper();

        assertThrows(InvalidDefinitionException.class,
                () -> plain.writeValueAsString(record()));
    }
}
