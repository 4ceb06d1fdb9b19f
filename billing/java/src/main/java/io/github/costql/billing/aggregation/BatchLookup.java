package io.github.costql.billing.aggregation;

import io.github.costql.billing.warehouse.WarehouseConnection;
import io.github.costql.billing.warehouse.WarehouseParameters;
import io.github.costql.billing.warehouse.WarehouseStatement;
import io.github.costql.core.exception.InternalQueryException;
import io.github.costql.core.exception.InvalidParameterException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves an analysis run or a batch to the batches and the day range to summarize,
 * through the batch lookup view ({@code ar_guid, batch_id, min_day, max_day}).
 * <p>
 * The range ends one day after the last usage day, so the whole last day is scanned.
 * </p>
 *
 * @since 1.0.0
 */
final class BatchLookup {

    private BatchLookup() {
    }

    /**
     * Batches and day range of one summary query. Exactly one of {@code arGuid} and
     * {@code batchIds} selects the rows: the run when known, the batches otherwise.
     */
    record Scope(LocalDateTime start, LocalDateTime end, String arGuid, List<String> batchIds) {

        Scope {
            Objects.requireNonNull(start, "start must not be null");
            Objects.requireNonNull(end, "end must not be null");
            batchIds = batchIds == null ? List.of() : List.copyOf(batchIds);
            if (arGuid == null && batchIds.isEmpty()) {
                throw new InternalQueryException("A batch summary needs an analysis run or batch ids");
            }
        }
    }

    static WarehouseStatement batchesOfRun(String batchesView, String arGuid) {
        String sql = "SELECT\n"
                + "    batch_id,\n"
                + "    MIN(min_day) as start_day,\n"
                + "    MAX(max_day) as end_day\n"
                + "FROM `" + batchesView + "`\n"
                + "WHERE ar_guid = @ar_guid\n"
                + "AND batch_id IS NOT NULL\n"
                + "GROUP BY batch_id\n"
                + "ORDER BY batch_id";
        return new WarehouseStatement(sql, List.of(WarehouseParameters.string("ar_guid", arGuid)));
    }

    /**
     * {@code NULL} runs sort last, so the first row holds the run when there is one.
     */
    static WarehouseStatement runOfBatch(String batchesView, String batchId) {
        String sql = "SELECT ar_guid,\n"
                + "    MIN(min_day) as start_day,\n"
                + "    MAX(max_day) as end_day\n"
                + "FROM `" + batchesView + "`\n"
                + "WHERE batch_id = @batch_id\n"
                + "GROUP BY ar_guid\n"
                + "ORDER BY ar_guid DESC";
        return new WarehouseStatement(sql, List.of(WarehouseParameters.string("batch_id", batchId)));
    }

    /**
     * @return the run's scope, {@code null} when the run has no batches
     */
    static Scope forRun(WarehouseConnection connection, String arGuid) {
        List<Map<String, Object>> rows = batchesOfRun(connection.getConfig().getBatchesView(), arGuid)
                .executeOn(connection);
        if (rows.isEmpty()) {
            return null;
        }
        LocalDateTime start = null;
        LocalDateTime end = null;
        List<String> batchIds = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            LocalDateTime rowStart = WarehouseValues.dateTime(row.get("start_day"));
            LocalDateTime rowEnd = WarehouseValues.dateTime(row.get("end_day"));
            if (rowStart != null && (start == null || rowStart.isBefore(start))) {
                start = rowStart;
            }
            if (rowEnd != null && (end == null || rowEnd.isAfter(end))) {
                end = rowEnd;
            }
            batchIds.add(WarehouseValues.text(row.get("batch_id")));
        }
        if (start == null || end == null) {
            throw new InternalQueryException("Batch lookup returned no usage days for analysis run " + arGuid);
        }
        return new Scope(start, end.plusDays(1), arGuid, batchIds);
    }

    /**
     * @return the scope of the batch's run, or of the batch alone when it has no run;
     *         {@code null} when the batch is unknown
     * @throws InvalidParameterException if the batch belongs to more than one run
     */
    static Scope forBatch(WarehouseConnection connection, String batchId) {
        List<Map<String, Object>> rows = runOfBatch(connection.getConfig().getBatchesView(), batchId)
                .executeOn(connection);
        if (rows.isEmpty()) {
            return null;
        }
        if (rows.size() > 1 && rows.get(1).get("ar_guid") != null) {
            throw new InvalidParameterException("Multiple analysis runs found for batch_id: " + batchId);
        }
        Map<String, Object> first = rows.get(0);
        String arGuid = WarehouseValues.text(first.get("ar_guid"));
        LocalDateTime start = WarehouseValues.dateTime(first.get("start_day"));
        LocalDateTime end = WarehouseValues.dateTime(first.get("end_day"));
        if (start == null || end == null) {
            throw new InternalQueryException("Batch lookup returned no usage days for batch " + batchId);
        }
        return arGuid != null
                ? new Scope(start, end.plusDays(1), arGuid, List.of())
                : new Scope(start, end.plusDays(1), null, List.of(batchId));
    }
}
