package io.github.costql.core.api;

import io.github.costql.core.exception.InvalidFilterException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FilterComparatorTest {

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Should reject a comparator without operators")
        void shouldRejectEmptyComparator() {
            assertThrows(InvalidFilterException.class, () -> FilterComparator.builder().build());
        }

        @Test
        @DisplayName("Should reject an empty oneOf")
        void shouldRejectEmptyOneOf() {
            InvalidFilterException e = assertThrows(InvalidFilterException.class,
                    () -> FilterComparator.oneOf(List.of()));
            assertTrue(e.getMessage().contains("oneOf"));
        }

        @Test
        @DisplayName("Should accept an empty notOneOf")
        void shouldAcceptEmptyNotOneOf() {
            FilterComparator<String> comparator = FilterComparator.notOneOf(List.of());
            assertEquals(List.of(), comparator.notOneOf());
        }

        @Test
        @DisplayName("Should reject null list elements")
        void shouldRejectNullElements() {
            List<String> values = Arrays.asList("a", null);
            assertThrows(InvalidFilterException.class, () -> FilterComparator.oneOf(values));
        }

        @Test
        @DisplayName("Should copy lists on construction")
        void shouldCopyLists() {
            // Given
            List<String> values = new ArrayList<>(List.of("a", "b"));

            // When
            FilterComparator<String> comparator = FilterComparator.oneOf(values);
            values.add("c");

            // Then
            assertEquals(List.of("a", "b"), comparator.oneOf());
            assertThrows(UnsupportedOperationException.class, () -> comparator.oneOf().add("d"));
        }

        @Test
        @DisplayName("Should keep a single-element oneOf as given")
        void shouldKeepSingleElementOneOf() {
            FilterComparator<String> comparator = FilterComparator.oneOf(List.of("hail"));

            assertNull(comparator.equalTo());
            assertEquals(List.of("hail"), comparator.oneOf());
        }
    }

    @Nested
    @DisplayName("Operators")
    class Operators {

        @Test
        @DisplayName("Should list operators in compilation order")
        void shouldListOperatorsInOrder() {
            // Given
            FilterComparator<Integer> comparator = FilterComparator.<Integer>builder()
                    .lessOrEqual(10)
                    .greaterThan(1)
                    .equalTo(5)
                    .build();

            // When
            Map<Op, Object> operators = comparator.operators();

            // Then
            assertEquals(List.of(Op.EQ, Op.GT, Op.LTE), new ArrayList<>(operators.keySet()));
            assertEquals(5, operators.get(Op.EQ));
        }

        @Test
        @DisplayName("Should map every value and keep the layout")
        void shouldMapValues() {
            FilterComparator<Integer> comparator = FilterComparator.<Integer>builder()
                    .oneOf(List.of(1, 2))
                    .greaterOrEqual(0)
                    .build();

            FilterComparator<String> mapped = comparator.map(String::valueOf);

            assertEquals(List.of("1", "2"), mapped.oneOf());
            assertEquals("0", mapped.greaterOrEqual());
            assertNull(mapped.equalTo());
        }

        @Test
        @DisplayName("Should build inclusive ranges")
        void shouldBuildRanges() {
            FilterComparator<Integer> range = FilterComparator.between(1, 9);

            assertEquals(1, range.greaterOrEqual());
            assertEquals(9, range.lessOrEqual());
        }

        @Test
        @DisplayName("Should resolve operators from symbol, code or name")
        void shouldResolveOperators() {
            assertEquals(Op.NOT_IN, Op.fromString("nin"));
            assertEquals(Op.GTE, Op.fromString(">="));
            assertEquals(Op.IN, Op.fromString("in"));
            assertEquals(Op.LT, Op.fromString("LT"));
            assertNull(Op.fromString("LIKE"));
            assertTrue(Op.NOT_IN.supportsMultipleValues());
            assertFalse(Op.EQ.supportsMultipleValues());
        }
    }
}
