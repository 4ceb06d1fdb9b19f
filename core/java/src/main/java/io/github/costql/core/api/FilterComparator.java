package io.github.costql.core.api;

import io.github.costql.core.exception.InvalidFilterException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Operator/value pairs applied to one field.
 * <p>
 * A comparator carries any combination of {@code equalTo}, {@code oneOf},
 * {@code notOneOf}, {@code greaterThan}, {@code greaterOrEqual}, {@code lessThan}
 * and {@code lessOrEqual}. Every present operator becomes one predicate and all of
 * them are joined with {@code AND}, so {@code equalTo=B} together with
 * {@code oneOf=[A]} is a conjunction that matches nothing.
 * </p>
 *
 * <p>A single-element {@code oneOf} is kept as given; the compiler emits it exactly
 * like {@code equalTo}.</p>
 *
 * <pre>{@code
 * FilterComparator<String> topic = FilterComparator.oneOf(List.of("hail", "seqr"));
 * FilterComparator<LocalDate> window = FilterComparator.<LocalDate>builder()
 *     .greaterOrEqual(LocalDate.of(2024, 1, 1))
 *     .lessOrEqual(LocalDate.of(2024, 1, 31))
 *     .build();
 * }</pre>
 *
 * @param <T> the value type
 * @since 1.0.0
 */
public record FilterComparator<T>(
        T equalTo,
        List<T> oneOf,
        List<T> notOneOf,
        T greaterThan,
        T greaterOrEqual,
        T lessThan,
        T lessOrEqual
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws InvalidFilterException if no operator is present, {@code oneOf} is empty,
     *                                or a list contains {@code null}
     */
    public FilterComparator {
        oneOf = copyOf(oneOf, "oneOf");
        notOneOf = copyOf(notOneOf, "notOneOf");
        if (oneOf != null && oneOf.isEmpty()) {
            throw new InvalidFilterException("oneOf requires at least one value");
        }
        if (equalTo == null && oneOf == null && notOneOf == null && greaterThan == null
                && greaterOrEqual == null && lessThan == null && lessOrEqual == null) {
            throw new InvalidFilterException("A comparator requires at least one operator");
        }
    }

    private static <T> List<T> copyOf(List<T> values, String operator) {
        if (values == null) {
            return null;
        }
        List<T> copy = new ArrayList<>(values.size());
        for (T value : values) {
            if (value == null) {
                throw new InvalidFilterException(operator + " must not contain null values");
            }
            copy.add(value);
        }
        return Collections.unmodifiableList(copy);
    }

    public static <T> FilterComparator<T> equalTo(T value) {
        return FilterComparator.<T>builder().equalTo(value).build();
    }

    public static <T> FilterComparator<T> oneOf(List<T> values) {
        return FilterComparator.<T>builder().oneOf(values).build();
    }

    public static <T> FilterComparator<T> notOneOf(List<T> values) {
        return FilterComparator.<T>builder().notOneOf(values).build();
    }

    /**
     * Inclusive range; either bound may be {@code null}.
     */
    public static <T> FilterComparator<T> between(T lowerInclusive, T upperInclusive) {
        return FilterComparator.<T>builder()
                .greaterOrEqual(lowerInclusive)
                .lessOrEqual(upperInclusive)
                .build();
    }

    /**
     * Returns the operators present on this comparator, in compilation order.
     * List-valued operators map to the list itself.
     *
     * @return an ordered, unmodifiable view of operator to value
     */
    public Map<Op, Object> operators() {
        Map<Op, Object> present = new LinkedHashMap<>();
        if (equalTo != null) present.put(Op.EQ, equalTo);
        if (oneOf != null) present.put(Op.IN, oneOf);
        if (notOneOf != null) present.put(Op.NOT_IN, notOneOf);
        if (greaterThan != null) present.put(Op.GT, greaterThan);
        if (greaterOrEqual != null) present.put(Op.GTE, greaterOrEqual);
        if (lessThan != null) present.put(Op.LT, lessThan);
        if (lessOrEqual != null) present.put(Op.LTE, lessOrEqual);
        return Collections.unmodifiableMap(present);
    }

    /**
     * Applies {@code fn} to every value, keeping the operator layout.
     *
     * @param fn  the conversion
     * @param <R> the new value type
     * @return the converted comparator
     */
    public <R> FilterComparator<R> map(Function<? super T, ? extends R> fn) {
        Objects.requireNonNull(fn, "fn must not be null");
        return new FilterComparator<>(
                apply(equalTo, fn),
                applyAll(oneOf, fn),
                applyAll(notOneOf, fn),
                apply(greaterThan, fn),
                apply(greaterOrEqual, fn),
                apply(lessThan, fn),
                apply(lessOrEqual, fn));
    }

    private static <T, R> R apply(T value, Function<? super T, ? extends R> fn) {
        return value == null ? null : fn.apply(value);
    }

    private static <T, R> List<R> applyAll(List<T> values, Function<? super T, ? extends R> fn) {
        if (values == null) {
            return null;
        }
        List<R> mapped = new ArrayList<>(values.size());
        for (T value : values) {
            mapped.add(fn.apply(value));
        }
        return mapped;
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    /**
     * Builder for comparators combining several operators.
     *
     * @param <T> the value type
     */
    public static class Builder<T> {
        private T _equalTo;
        private List<T> _oneOf;
        private List<T> _notOneOf;
        private T _greaterThan;
        private T _greaterOrEqual;
        private T _lessThan;
        private T _lessOrEqual;

        private Builder() {
        }

        public Builder<T> equalTo(T value) {
            this._equalTo = value;
            return this;
        }

        public Builder<T> oneOf(List<T> values) {
            this._oneOf = values;
            return this;
        }

        public Builder<T> notOneOf(List<T> values) {
            this._notOneOf = values;
            return this;
        }

        public Builder<T> greaterThan(T value) {
            this._greaterThan = value;
            return this;
        }

        public Builder<T> greaterOrEqual(T value) {
            this._greaterOrEqual = value;
            return this;
        }

        public Builder<T> lessThan(T value) {
            this._lessThan = value;
            return this;
        }

        public Builder<T> lessOrEqual(T value) {
            this._lessOrEqual = value;
            return this;
        }

        public FilterComparator<T> build() {
            return new FilterComparator<>(_equalTo, _oneOf, _notOneOf,
                    _greaterThan, _greaterOrEqual, _lessThan, _lessOrEqual);
        }
    }
}
