package io.github.costql.billing.tables;

import io.github.costql.billing.config.BillingConfig;
import io.github.costql.billing.model.BillingColumn;
import io.github.costql.billing.model.BillingSource;
import io.github.costql.core.exception.DisallowedFieldException;
import io.github.costql.core.model.FilterModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BillingBackendSelector Tests")
class BillingBackendSelectorTest {

    private final BillingTables tables = BillingTables.from(BillingConfig.defaults());
    private final BillingBackendSelector selector = new BillingBackendSelector(tables);

    @Nested
    @DisplayName("Total cost")
    class TotalCost {

        @Test
        @DisplayName("Should serve plain columns from the requested source")
        void shouldUseRequestedSource() {
            assertSame(tables.aggregate(),
                    selector.selectForTotalCost(null, List.of(BillingColumn.TOPIC), FilterModel.empty()));
            assertSame(tables.gcpBilling(), selector.selectForTotalCost(BillingSource.GCP_BILLING,
                    List.of(BillingColumn.GCP_PROJECT), FilterModel.empty()));
            assertSame(tables.raw(), selector.selectForTotalCost(BillingSource.RAW,
                    List.of(BillingColumn.SERVICE), FilterModel.empty()));
        }

        @Test
        @DisplayName("Should switch to the extended view for a selected extended column")
        void shouldSwitchOnField() {
            BillingTable table = selector.selectForTotalCost(BillingSource.AGGREGATE,
                    List.of(BillingColumn.TOPIC, BillingColumn.WDL_TASK_NAME), FilterModel.empty());

            assertSame(tables.extended(), table);
            assertEquals(BillingSource.EXTENDED, table.getSource());
        }

        @Test
        @DisplayName("Should switch to the extended view for a filtered extended column")
        void shouldSwitchOnFilter() {
            FilterModel filters = FilterModel.builder().field("ar_guid", "abc").field("dataset", "acute-care").build();

            assertSame(tables.extended(),
                    selector.selectForTotalCost(BillingSource.AGGREGATE, List.of(BillingColumn.TOPIC), filters));
        }

        @Test
        @DisplayName("Should reject a column the chosen table lacks")
        void shouldRejectMissingColumn() {
            DisallowedFieldException exception = assertThrows(DisallowedFieldException.class, () ->
                    selector.selectForTotalCost(BillingSource.AGGREGATE, List.of(BillingColumn.USAGE_START_TIME),
                            FilterModel.empty()));
            assertEquals("usage_start_time", exception.getField());
        }

        @Test
        @DisplayName("Should reject filters on unknown columns")
        void shouldRejectUnknownFilter() {
            FilterModel filters = FilterModel.builder().field("colour", "blue").build();

            assertThrows(DisallowedFieldException.class, () ->
                    selector.selectForTotalCost(null, List.of(BillingColumn.TOPIC), filters));
        }
    }

    @Nested
    @DisplayName("Running cost")
    class RunningCost {

        @Test
        @DisplayName("Should accept only running-cost fields")
        void shouldRejectOtherFields() {
            assertThrows(DisallowedFieldException.class, () ->
                    selector.selectForRunningCost(null, BillingColumn.SKU, FilterModel.empty()));
            assertThrows(DisallowedFieldException.class, () ->
                    selector.selectForRunningCost(null, null, FilterModel.empty()));
        }

        @Test
        @DisplayName("Should pick the table from field, filters and source")
        void shouldPickTable() {
            assertSame(tables.aggregate(), selector.selectForRunningCost(null, BillingColumn.TOPIC, FilterModel.empty()));
            assertSame(tables.extended(), selector.selectForRunningCost(null, BillingColumn.NAMESPACE, FilterModel.empty()));
            assertSame(tables.gcpBilling(), selector.selectForRunningCost(BillingSource.GCP_BILLING,
                    BillingColumn.GCP_PROJECT, FilterModel.empty()));
            assertSame(tables.extended(), selector.selectForRunningCost(BillingSource.GCP_BILLING,
                    BillingColumn.GCP_PROJECT, FilterModel.builder().field("stage", "qc").build()));
        }

        @Test
        @DisplayName("Should fall back to the aggregate view for the raw source")
        void shouldFallBackFromRaw() {
            assertSame(tables.aggregate(), selector.selectForRunningCost(BillingSource.RAW,
                    BillingColumn.TOPIC, FilterModel.empty()));
        }
    }
}
