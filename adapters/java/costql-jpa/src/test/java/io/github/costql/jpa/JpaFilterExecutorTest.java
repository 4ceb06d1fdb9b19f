package io.github.costql.jpa;

import io.github.costql.core.exception.InternalQueryException;
import io.github.costql.core.impl.PredicateCompiler;
import io.github.costql.core.impl.WarehouseDialect;
import io.github.costql.core.model.CompiledPredicate;
import io.github.costql.core.model.FilterModel;
import io.github.costql.jpa.strategies.CountStrategy;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Query;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class JpaFilterExecutorTest {

    @Test
    @DisplayName("Should apply column overrides only for fields present in the filter")
    void shouldApplyOverrides() {
        // Given
        EntityManager em = mock(EntityManager.class);
        JpaFilterExecutor executor = new JpaFilterExecutor(em,
                Map.of("sample_type", "type", "project", "project_id"));

        // When
        CompiledPredicate predicate = executor.compile(FilterModel.builder().field("sample_type", "blood").build());

        // Then
        assertEquals("type = :sample_type_eq", predicate.text());
        assertEquals("TRUE", executor.compile(null).text());
    }

    @Test
    @DisplayName("Should run the strategy on its entity manager")
    void shouldExecuteStrategy() {
        EntityManager em = mock(EntityManager.class);
        Query query = mock(Query.class);
        when(em.createNativeQuery("SELECT COUNT(*) FROM analysis WHERE status = :status_eq")).thenReturn(query);
        when(query.getSingleResult()).thenReturn(3L);

        long count = new JpaFilterExecutor(em).execute(new CountStrategy("analysis"),
                FilterModel.builder().field("status", "completed").build());

        assertEquals(3L, count);
        verify(query).setParameter("status_eq", "completed");
    }

    @Test
    @DisplayName("Should refuse to bind a predicate compiled for the warehouse")
    void shouldRejectWarehousePredicate() {
        Query query = mock(Query.class);
        CompiledPredicate predicate = PredicateCompiler.compile(
                FilterModel.builder().field("topic", "hail").build(), WarehouseDialect.INSTANCE);

        assertThrows(InternalQueryException.class, () -> NativeQueryBinder.bind(query, predicate));
        verifyNoInteractions(query);
    }

    @Test
    @DisplayName("Should accept qualified identifiers only")
    void shouldCheckIdentifiers() {
        assertEquals("sm.sample", NativeQueryBinder.identifier("sm.sample"));
        assertThrows(InternalQueryException.class, () -> NativeQueryBinder.identifier("sample s"));
        assertThrows(InternalQueryException.class, () -> NativeQueryBinder.identifier(null));
    }

    @Test
    @DisplayName("Should refuse an override column that is not an identifier")
    void shouldRejectExpressionOverride() {
        EntityManager em = mock(EntityManager.class);
        JpaFilterExecutor executor = new JpaFilterExecutor(em, Map.of("status", "status) OR (1=1"));

        assertThrows(InternalQueryException.class,
                () -> executor.compile(FilterModel.builder().field("status", "completed").build()));
        verifyNoInteractions(em);
    }
}
