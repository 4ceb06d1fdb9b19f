package io.github.costql.core.model;

import io.github.costql.core.api.BindableEnum;
import io.github.costql.core.exception.InvalidFilterException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BindValueTest {

    enum Topic { HAIL, SEQR }

    enum CostSource implements BindableEnum {
        GCP_BILLING;

        @Override
        public String bindValue() {
            return "gcp_billing";
        }
    }

    @Test
    @DisplayName("Should infer scalar kinds from host types")
    void shouldInferScalarKinds() {
        assertEquals(BindValue.Kind.INT, BindValue.of(42).kind());
        assertEquals(BindValue.Kind.INT, BindValue.of(42L).kind());
        assertEquals(BindValue.Kind.FLOAT, BindValue.of(1.5).kind());
        assertEquals(BindValue.Kind.FLOAT, BindValue.of(new BigDecimal("2.25")).kind());
        assertEquals(BindValue.Kind.STRING, BindValue.of("hail").kind());
        assertEquals(BindValue.Kind.TIMESTAMP, BindValue.of(LocalDate.of(2024, 1, 1)).kind());
    }

    @Test
    @DisplayName("Should lower enums to their bound string")
    void shouldLowerEnums() {
        assertEquals(BindValue.ofString("HAIL"), BindValue.of(Topic.HAIL));
        assertEquals(BindValue.ofString("gcp_billing"), BindValue.of(CostSource.GCP_BILLING));
    }

    @Test
    @DisplayName("Should format timestamps canonically")
    void shouldFormatTimestamps() {
        assertEquals("2024-01-01 00:00:00", BindValue.of(LocalDate.of(2024, 1, 1)).asText());
        assertEquals("2024-03-05 13:04:09", BindValue.of(LocalDateTime.of(2024, 3, 5, 13, 4, 9)).asText());
        assertEquals("2024-03-05 11:00:00",
                BindValue.of(OffsetDateTime.of(2024, 3, 5, 13, 0, 0, 0, ZoneOffset.ofHours(2))).asText());
    }

    @Test
    @DisplayName("Should type arrays by their elements")
    void shouldTypeArrays() {
        assertEquals(BindValue.Kind.INT, BindValue.of(List.of(1, 2, 3)).elementKind());
        assertEquals(BindValue.Kind.FLOAT, BindValue.of(List.of(1.0, 2.5)).elementKind());
        assertEquals(BindValue.Kind.STRING, BindValue.of(List.of(1, 2.5)).elementKind());
        assertEquals(BindValue.Kind.STRING, BindValue.of(List.of(1, "a")).elementKind());
        assertEquals(BindValue.Kind.STRING, BindValue.of(new String[]{"a", "b"}).elementKind());
        assertEquals(2, BindValue.of(List.of("a", "b")).size());
    }

    @Test
    @DisplayName("Should expose host values")
    void shouldExposeHostValues() {
        assertEquals(7L, BindValue.of(7).hostValue());
        assertEquals(List.of("a", "b"), BindValue.of(List.of("a", "b")).hostValue());
        assertEquals(LocalDateTime.of(2024, 1, 1, 0, 0), BindValue.of(LocalDate.of(2024, 1, 1)).hostValue());
    }

    @Test
    @DisplayName("Should reject nulls and nested arrays")
    void shouldRejectInvalidValues() {
        assertThrows(InvalidFilterException.class, () -> BindValue.of(null));
        assertThrows(InvalidFilterException.class, () -> BindValue.of(Arrays.asList("a", null)));
        assertThrows(InvalidFilterException.class, () -> BindValue.of(List.of(List.of(1))));
    }

    @Test
    @DisplayName("Should refuse scalar text of arrays")
    void shouldRefuseScalarTextOfArrays() {
        BindValue array = BindValue.of(List.of(1));
        assertThrows(IllegalStateException.class, array::asText);
        assertThrows(IllegalStateException.class, () -> BindValue.of(1).elements());
    }
}
