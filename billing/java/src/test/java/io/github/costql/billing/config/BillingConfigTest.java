package io.github.costql.billing.config;

import io.github.costql.core.exception.InternalQueryException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BillingConfig Tests")
class BillingConfigTest {

    @Test
    @DisplayName("Should provide deployment defaults")
    void shouldProvideDefaults() {
        BillingConfig config = BillingConfig.defaults();

        assertEquals("billing_aggregate.aggregate_daily_cost", config.getAggregateView());
        assertEquals("billing_aggregate.aggregate_daily_cost_extended", config.getExtendedView());
        assertEquals("billing.gcp_billing_daily", config.getGcpBillingView());
        assertEquals("billing_aggregate.budget", config.getBudgetView());
        assertEquals("billing_aggregate.ar_batch_lookup", config.getBatchesView());
        assertEquals(40, config.getDaysBackOptimal());
        assertEquals(6.25, config.getCostPerTb());
        assertEquals(Map.of("source", "costql"), config.getQueryLabels());
    }

    @Test
    @DisplayName("Should read costql.billing properties from the classpath")
    void shouldReadProperties() throws IOException {
        // Given
        Properties properties = new Properties();
        try (InputStream in = getClass().getResourceAsStream("/costql-test.properties")) {
            assertNotNull(in);
            properties.load(in);
        }

        // When
        BillingConfig config = BillingConfig.fromProperties(properties);

        // Then
        assertEquals("test_billing.aggregate_daily_cost", config.getAggregateView());
        assertEquals(14, config.getDaysBackOptimal());
        assertEquals(5.0, config.getCostPerTb());
        assertEquals("billing-tests", config.getQueryLabels().get("team"));
        assertEquals("costql", config.getQueryLabels().get("source"));
        assertEquals("billing_aggregate.budget", config.getBudgetView());
        assertEquals("test_billing.ar_batch_lookup", config.getBatchesView());
    }

    @Test
    @DisplayName("Should reject malformed numbers and names")
    void shouldRejectInvalidValues() {
        Properties properties = new Properties();
        properties.setProperty("costql.billing.days-back-optimal", "forty");

        assertThrows(InternalQueryException.class, () -> BillingConfig.fromProperties(properties));
        assertThrows(InternalQueryException.class, () -> BillingConfig.builder().daysBackOptimal(0));
        assertThrows(InternalQueryException.class, () -> BillingConfig.builder().aggregateView("a`; DROP"));
        assertThrows(InternalQueryException.class, () -> BillingConfig.builder().batchesView("lookup`"));
    }
}
