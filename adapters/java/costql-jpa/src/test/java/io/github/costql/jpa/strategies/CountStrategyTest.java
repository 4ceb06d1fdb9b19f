package io.github.costql.jpa.strategies;

import io.github.costql.core.exception.InternalQueryException;
import io.github.costql.core.impl.PredicateCompiler;
import io.github.costql.core.impl.RelationalDialect;
import io.github.costql.core.model.CompiledPredicate;
import io.github.costql.core.model.FilterModel;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Query;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CountStrategyTest {

    @Mock
    private EntityManager em;

    @Mock
    private Query query;

    @Test
    @DisplayName("Should count with the compiled predicate and bind every parameter")
    void shouldCountMatchingRows() {
        // Given
        CompiledPredicate predicate = PredicateCompiler.compile(FilterModel.builder()
                .field("type", List.of("blood", "saliva"))
                .field("active", true)
                .build(), RelationalDialect.INSTANCE);
        String sql = "SELECT COUNT(*) FROM sample WHERE type IN (:type_in) AND active = :active_eq";
        when(em.createNativeQuery(sql)).thenReturn(query);
        when(query.getSingleResult()).thenReturn(BigInteger.valueOf(42));

        // When
        Long count = new CountStrategy("sample").execute(em, predicate);

        // Then
        assertEquals(42L, count);
        verify(query).setParameter("type_in", List.of("blood", "saliva"));
        verify(query).setParameter("active_eq", "true");
    }

    @Test
    @DisplayName("Should count every row for an empty filter")
    void shouldCountAllRows() {
        CompiledPredicate predicate = PredicateCompiler.compile(FilterModel.empty(), RelationalDialect.INSTANCE);
        when(em.createNativeQuery("SELECT COUNT(*) FROM sample WHERE TRUE")).thenReturn(query);
        when(query.getSingleResult()).thenReturn(7L);

        assertEquals(7L, new CountStrategy("sample").execute(em, predicate));
        verify(query, never()).setParameter(anyString(), any());
    }

    @Test
    @DisplayName("Should reject table names that are not identifiers")
    void shouldRejectUnsafeTable() {
        assertThrows(InternalQueryException.class, () -> new CountStrategy("sample; DROP TABLE sample"));
        assertThrows(NullPointerException.class, () -> new CountStrategy(null));
    }
}
