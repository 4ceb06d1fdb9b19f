package io.github.costql.billing.warehouse;

import io.github.costql.billing.config.BillingConfig;
import io.github.costql.core.model.ParameterBinding;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("WarehouseConnection Tests")
class WarehouseConnectionTest {

    private static final long ONE_TB = 1024L * 1024L * 1024L * 1024L;

    @Mock
    private WarehouseClient client;

    private WarehouseConnection connection;

    @BeforeEach
    void setUp() {
        connection = new WarehouseConnection(client, BillingConfig.builder().costPerTb(5.0).build());
    }

    @Test
    @DisplayName("Should dry-run before running and accumulate the estimated cost")
    void shouldAccumulateCost() {
        // Given
        List<ParameterBinding> parameters = List.of(WarehouseParameters.int64("days", -40));
        when(client.dryRun(anyString(), anyList(), anyMap())).thenReturn(ONE_TB, ONE_TB / 2);
        when(client.query(anyString(), anyList(), anyMap())).thenReturn(List.of(Map.of("topic", "hail")));

        // When
        List<Map<String, Object>> first = connection.execute("SELECT 1", parameters);
        connection.execute("SELECT 2", parameters);

        // Then
        assertEquals(List.of(Map.of("topic", "hail")), first);
        assertEquals(7.5, connection.getEstimatedCost(), 1e-9);
        assertEquals(2, connection.getQueryCount());

        InOrder order = inOrder(client);
        order.verify(client).dryRun("SELECT 1", parameters, Map.of("source", "costql"));
        order.verify(client).query("SELECT 1", parameters, Map.of("source", "costql"));
    }

    @Test
    @DisplayName("Should not run a query the dry run rejected")
    void shouldPropagateDryRunFailure() {
        // Given
        when(client.dryRun(anyString(), anyList(), anyMap())).thenThrow(new WarehouseException("Syntax error"));

        // When
        WarehouseException exception = assertThrows(WarehouseException.class,
                () -> connection.execute("SELEC 1", List.of()));

        // Then
        assertEquals("Syntax error", exception.getMessage());
        verify(client, never()).query(anyString(), anyList(), any());
        assertEquals(0.0, connection.getEstimatedCost());
    }

    @Test
    @DisplayName("Should keep the dry-run cost when the query fails")
    void shouldKeepCostOfFailedQuery() {
        // Given
        when(client.dryRun(anyString(), anyList(), anyMap())).thenReturn(ONE_TB);
        when(client.query(eq("SELECT 1"), anyList(), anyMap())).thenThrow(new WarehouseException("Quota exceeded"));

        // When
        assertThrows(WarehouseException.class, () -> connection.execute("SELECT 1", List.of()));

        // Then
        assertEquals(5.0, connection.getEstimatedCost(), 1e-9);
    }

    @Test
    @DisplayName("Should type hand-written parameters like compiled ones")
    void shouldTypeParameters() {
        assertEquals("STRING", WarehouseParameters.string("invoice_month", "202403").declaredType());
        assertEquals("INT64", WarehouseParameters.int64("limit_val", 10).declaredType());
        assertEquals("FLOAT64", WarehouseParameters.float64("min_cost", 0.5).declaredType());
        assertEquals(10L, WarehouseParameters.int64("limit_val", 10).wireValue());
    }
}
