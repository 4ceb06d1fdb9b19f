package io.github.costql.core.impl;

import io.github.costql.core.api.FilterComparator;
import io.github.costql.core.api.Op;
import io.github.costql.core.exception.InternalQueryException;
import io.github.costql.core.model.BindValue;
import io.github.costql.core.model.CompiledPredicate;
import io.github.costql.core.model.FilterEntry;
import io.github.costql.core.model.FilterModel;
import io.github.costql.core.model.FilterOp;
import io.github.costql.core.model.ParameterBinding;
import io.github.costql.core.spi.PredicateDialect;
import io.github.costql.core.utils.Identifiers;
import io.github.costql.core.utils.ParameterNames;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Compiles a {@link FilterModel} into predicate text and parameter bindings.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Fields are emitted in declaration order; the operators of one comparator in
 *       {@link Op} order, joined with {@code AND}.</li>
 *   <li>{@code oneOf} with one element is emitted exactly like {@code equalTo}
 *       (same text, same {@code <field>_eq} parameter); with more elements it binds
 *       one array parameter {@code <field>_in}.</li>
 *   <li>{@code notOneOf} binds {@code <field>_nin}; an empty list adds nothing.</li>
 *   <li>Fields are joined with the model's {@link FilterOp}; an {@code OR} join is
 *       parenthesised.</li>
 *   <li>Nested models qualify their columns as {@code <field>.<child>} and are
 *       parenthesised. Metadata keys compile against the dialect's extraction
 *       expression with the parameter base {@code <column>_<key>}.</li>
 *   <li>Field names are plain identifiers (checked by {@link FilterModel}), so
 *       column text never carries request input beyond a column name.</li>
 *   <li>An empty model compiles to {@code TRUE}.</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * FilterModel model = FilterModel.builder()
 *     .field("topic", List.of("hail", "seqr"))
 *     .field("day", "2024-03-01")
 *     .build();
 *
 * CompiledPredicate predicate = PredicateCompiler.compile(model, RelationalDialect.INSTANCE);
 * // topic IN (:topic_in) AND day = :day_eq
 * }</pre>
 *
 * <p>Instances are not reused: every call compiles the exact filter it receives.</p>
 *
 * @since 1.0.0
 */
public final class PredicateCompiler {

    private static final Logger log = Logger.getLogger(PredicateCompiler.class.getName());

    private final PredicateDialect dialect;
    private final ParameterNames names = new ParameterNames();
    private final List<ParameterBinding> bindings = new ArrayList<>();

    private PredicateCompiler(PredicateDialect dialect) {
        this.dialect = dialect;
    }

    public static CompiledPredicate compile(FilterModel model, PredicateDialect dialect) {
        return compile(model, dialect, Map.of());
    }

    /**
     * Compiles {@code model} for {@code dialect}.
     *
     * @param model           the filter
     * @param dialect         the target dialect
     * @param columnOverrides field name to physical column, for top-level fields whose
     *                        column differs from the field name
     * @return the predicate and its bindings
     * @throws InternalQueryException if an override names a field absent from the model
     *                                or maps it to something other than a column name
     */
    public static CompiledPredicate compile(FilterModel model, PredicateDialect dialect,
                                            Map<String, String> columnOverrides) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(dialect, "dialect must not be null");
        Map<String, String> overrides = columnOverrides == null ? Map.of() : columnOverrides;
        for (Map.Entry<String, String> override : overrides.entrySet()) {
            if (!model.contains(override.getKey())) {
                throw new InternalQueryException("Column override for unknown field: " + override.getKey());
            }
            if (!Identifiers.isQualified(override.getValue())) {
                throw new InternalQueryException(
                        String.format("Column for field %s is not an identifier: %s", override.getKey(), override.getValue()));
            }
        }

        PredicateCompiler compiler = new PredicateCompiler(dialect);
        String text = compiler.model(model, null, overrides);
        CompiledPredicate compiled = new CompiledPredicate(text.isEmpty() ? "TRUE" : text, compiler.bindings);

        log.fine(() -> String.format("Compiled %s predicate: %s, parameters=%s",
                dialect.name(), compiled.text(),
                compiled.bindings().stream().map(ParameterBinding::name).collect(Collectors.toList())));
        return compiled;
    }

    private String model(FilterModel model, String qualifier, Map<String, String> overrides) {
        List<String> parts = new ArrayList<>();
        boolean grouped = model.filtersOp() == FilterOp.OR;

        for (Map.Entry<String, FilterEntry> entry : model.entries().entrySet()) {
            String column = overrides.getOrDefault(entry.getKey(),
                    qualifier == null ? entry.getKey() : qualifier + "." + entry.getKey());

            String part;
            if (entry.getValue() instanceof FilterEntry.Field field) {
                part = comparator(column, column, field.comparator(), grouped);
            } else if (entry.getValue() instanceof FilterEntry.Nested nested) {
                String inner = model(nested.model(), column, Map.of());
                part = inner.isEmpty() ? "" : "(" + inner + ")";
            } else if (entry.getValue() instanceof FilterEntry.Meta meta) {
                part = meta(column, meta, grouped);
            } else {
                throw new InternalQueryException("Unsupported filter entry: " + entry.getValue());
            }

            if (!part.isEmpty()) {
                parts.add(part);
            }
        }

        String joined = String.join(model.filtersOp().joiner(), parts);
        return grouped && parts.size() > 1 ? "(" + joined + ")" : joined;
    }

    private String meta(String column, FilterEntry.Meta meta, boolean grouped) {
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, FilterComparator<BindValue>> key : meta.keys().entrySet()) {
            String expression = dialect.metaExtraction(column, key.getKey());
            String part = comparator(expression, column + "_" + key.getKey(), key.getValue(), false);
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        String joined = String.join(" AND ", parts);
        return grouped && parts.size() > 1 ? "(" + joined + ")" : joined;
    }

    private String comparator(String column, String base, FilterComparator<BindValue> comparator, boolean grouped) {
        List<String> parts = new ArrayList<>();

        for (Map.Entry<Op, Object> operator : comparator.operators().entrySet()) {
            Op op = operator.getKey();
            switch (op) {
                case IN -> {
                    List<BindValue> values = comparator.oneOf();
                    if (values.size() == 1) {
                        parts.add(scalar(column, Op.EQ, base, values.get(0)));
                    } else {
                        parts.add(array(column, Op.IN, base, values));
                    }
                }
                case NOT_IN -> {
                    List<BindValue> values = comparator.notOneOf();
                    if (!values.isEmpty()) {
                        parts.add(array(column, Op.NOT_IN, base, values));
                    }
                }
                default -> parts.add(scalar(column, op, base, (BindValue) operator.getValue()));
            }
        }

        String joined = String.join(" AND ", parts);
        return grouped && parts.size() > 1 ? "(" + joined + ")" : joined;
    }

    private String scalar(String column, Op op, String base, BindValue value) {
        String name = bind(base + "_" + op.getCode(), value);
        return dialect.comparison(column, op, name, value);
    }

    private String array(String column, Op op, String base, List<BindValue> values) {
        String name = bind(base + "_" + op.getCode(), BindValue.ofArray(values));
        return dialect.membership(column, op, name);
    }

    private String bind(String base, BindValue value) {
        String name = names.allocate(base);
        bindings.add(new ParameterBinding(name, value, dialect.declaredType(value), dialect.wireValue(value)));
        return name;
    }
}
