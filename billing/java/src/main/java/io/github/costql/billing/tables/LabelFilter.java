package io.github.costql.billing.tables;

import io.github.costql.billing.model.BillingColumn;
import io.github.costql.core.api.FilterComparator;
import io.github.costql.core.api.Op;
import io.github.costql.core.exception.InvalidFilterException;
import io.github.costql.core.impl.WarehouseDialect;
import io.github.costql.core.model.BindValue;
import io.github.costql.core.model.CompiledPredicate;
import io.github.costql.core.model.FilterEntry;
import io.github.costql.core.model.FilterOp;
import io.github.costql.core.model.ParameterBinding;
import io.github.costql.core.utils.ParameterNames;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Filter on the {@code labels} array of key/value structs.
 * <p>
 * Labels are read through a temporary function declared in front of the query, so
 * both the label key and the compared value are parameters:
 * </p>
 * <pre>
 * (getLabelValue(labels,@label_key_1) = @label_value_1_eq AND getLabelValue(labels,@label_key_2) IN UNNEST(@label_value_2_in))
 * </pre>
 * <p>
 * Label conditions are joined with the filter's operator and the whole group is
 * always ANDed onto the rest of the predicate.
 * </p>
 *
 * @since 1.0.0
 */
public final class LabelFilter {

    public static final String FUNCTION_NAME = "getLabelValue";

    public static final String FUNCTION_DEFINITION =
            "CREATE TEMP FUNCTION getLabelValue(\n"
                    + "    labels ARRAY<STRUCT<key STRING, value STRING>>, label STRING\n"
                    + ") AS (\n"
                    + "    (SELECT value FROM UNNEST(labels) WHERE key = label LIMIT 1)\n"
                    + ");";

    private LabelFilter() {
    }

    /**
     * @param entry     the {@code labels} filter entry
     * @param filtersOp join of the label conditions
     * @return the label predicate, {@code TRUE} when there is nothing to filter
     * @throws InvalidFilterException if the entry is not a key to value map
     */
    public static CompiledPredicate compile(FilterEntry entry, FilterOp filtersOp) {
        if (!(entry instanceof FilterEntry.Meta meta)) {
            throw new InvalidFilterException("Filters on labels must map label keys to values");
        }
        WarehouseDialect dialect = WarehouseDialect.INSTANCE;
        ParameterNames names = new ParameterNames();
        List<ParameterBinding> bindings = new ArrayList<>();
        List<String> conditions = new ArrayList<>();

        int index = 0;
        for (Map.Entry<String, FilterComparator<BindValue>> key : meta.keys().entrySet()) {
            index++;
            String keyName = names.allocate("label_key_" + index);
            BindValue keyValue = BindValue.ofString(key.getKey());
            bindings.add(new ParameterBinding(keyName, keyValue, dialect.declaredType(keyValue), dialect.wireValue(keyValue)));
            String expression = FUNCTION_NAME + "(" + BillingColumn.LABELS.getColumn() + "," + dialect.placeholder(keyName) + ")";

            for (Map.Entry<Op, Object> operator : key.getValue().operators().entrySet()) {
                String base = "label_value_" + index + "_";
                Op op = operator.getKey();
                if (op == Op.IN || op == Op.NOT_IN) {
                    @SuppressWarnings("unchecked")
                    List<BindValue> values = (List<BindValue>) operator.getValue();
                    if (values.isEmpty()) {
                        continue;
                    }
                    if (op == Op.IN && values.size() == 1) {
                        conditions.add(scalar(expression, Op.EQ, names.allocate(base + Op.EQ.getCode()), values.get(0), bindings));
                    } else {
                        BindValue array = BindValue.ofArray(values);
                        String name = names.allocate(base + op.getCode());
                        bindings.add(new ParameterBinding(name, array, dialect.declaredType(array), dialect.wireValue(array)));
                        conditions.add(dialect.membership(expression, op, name));
                    }
                } else {
                    conditions.add(scalar(expression, op, names.allocate(base + op.getCode()), (BindValue) operator.getValue(), bindings));
                }
            }
        }

        if (conditions.isEmpty()) {
            return CompiledPredicate.TRUE;
        }
        return new CompiledPredicate("(" + String.join(filtersOp.joiner(), conditions) + ")", bindings);
    }

    private static String scalar(String expression, Op op, String name, BindValue value, List<ParameterBinding> bindings) {
        WarehouseDialect dialect = WarehouseDialect.INSTANCE;
        bindings.add(new ParameterBinding(name, value, dialect.declaredType(value), dialect.wireValue(value)));
        return dialect.comparison(expression, op, name, value);
    }
}
