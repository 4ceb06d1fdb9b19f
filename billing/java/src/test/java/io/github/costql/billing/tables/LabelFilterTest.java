package io.github.costql.billing.tables;

import io.github.costql.core.api.FilterComparator;
import io.github.costql.core.exception.InvalidFilterException;
import io.github.costql.core.model.CompiledPredicate;
import io.github.costql.core.model.FilterModel;
import io.github.costql.core.model.FilterOp;
import io.github.costql.core.model.ParameterBinding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LabelFilter Tests")
class LabelFilterTest {

    private static CompiledPredicate compile(Map<String, Object> labels, FilterOp op) {
        FilterModel model = FilterModel.builder().meta("labels", labels).build();
        return LabelFilter.compile(model.get("labels"), op);
    }

    @Test
    @DisplayName("Should parameterize both the label key and the value")
    void shouldParameterizeKeyAndValue() {
        // Given
        Map<String, Object> labels = new LinkedHashMap<>();
        labels.put("team", "variants");
        labels.put("env", List.of("dev", "prod"));

        // When
        CompiledPredicate predicate = compile(labels, FilterOp.AND);

        // Then
        assertEquals("(getLabelValue(labels,@label_key_1) = @label_value_1_eq"
                + " AND getLabelValue(labels,@label_key_2) IN UNNEST(@label_value_2_in))", predicate.text());
        Map<String, Object> parameters = predicate.parameters();
        assertEquals("team", parameters.get("label_key_1"));
        assertEquals("variants", parameters.get("label_value_1_eq"));
        assertEquals("env", parameters.get("label_key_2"));
        assertEquals(List.of("dev", "prod"), parameters.get("label_value_2_in"));
        assertEquals(List.of("STRING", "STRING", "STRING", "ARRAY<STRING>"),
                predicate.bindings().stream().map(ParameterBinding::declaredType).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Should join label conditions with the filter operator")
    void shouldJoinWithOr() {
        // Given
        Map<String, Object> labels = new LinkedHashMap<>();
        labels.put("team", "variants");
        labels.put("env", "dev");

        // When
        CompiledPredicate predicate = compile(labels, FilterOp.OR);

        // Then
        assertEquals("(getLabelValue(labels,@label_key_1) = @label_value_1_eq"
                + " OR getLabelValue(labels,@label_key_2) = @label_value_2_eq)", predicate.text());
    }

    @Test
    @DisplayName("Should support exclusion and single-element lists")
    void shouldSupportOtherOperators() {
        // Given
        Map<String, Object> labels = new LinkedHashMap<>();
        labels.put("team", List.of("variants"));
        labels.put("env", FilterComparator.notOneOf(List.of("test", "ci")));

        // When
        CompiledPredicate predicate = compile(labels, FilterOp.AND);

        // Then
        assertEquals("(getLabelValue(labels,@label_key_1) = @label_value_1_eq"
                + " AND getLabelValue(labels,@label_key_2) NOT IN UNNEST(@label_value_2_nin))", predicate.text());
    }

    @Test
    @DisplayName("Should require a key to value map")
    void shouldRejectPlainValue() {
        FilterModel model = FilterModel.builder().field("labels", "team").build();

        assertThrows(InvalidFilterException.class, () -> LabelFilter.compile(model.get("labels"), FilterOp.AND));
    }
}
