package io.github.costql.core.model;

import io.github.costql.core.api.BindableEnum;
import io.github.costql.core.exception.InvalidFilterException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Typed value bound to a query parameter.
 * <p>
 * A {@code BindValue} is one of {@link Kind#STRING}, {@link Kind#INT},
 * {@link Kind#FLOAT}, {@link Kind#TIMESTAMP} or {@link Kind#ARRAY} of one of
 * the scalar kinds. The kind is decided once, when a {@link FilterModel} is
 * normalized, so dialects never inspect host types again.
 * </p>
 *
 * <h2>Inference rules of {@link #of(Object)}</h2>
 * <ul>
 *   <li>{@code Integer}, {@code Long}, {@code Short}, {@code Byte}, {@code BigInteger} become INT</li>
 *   <li>{@code Float}, {@code Double}, {@code BigDecimal} become FLOAT</li>
 *   <li>{@code LocalDateTime}, {@code LocalDate} (start of day) and zoned instants (UTC) become TIMESTAMP</li>
 *   <li>enums become STRING of {@link BindableEnum#bindValue()} or {@link Enum#name()}</li>
 *   <li>collections and arrays become ARRAY; the element kind is INT or FLOAT only when
 *       every element has that kind, otherwise STRING of each element's text</li>
 *   <li>anything else becomes STRING of {@code toString()}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class BindValue {

    /**
     * Canonical text form of timestamp parameters.
     */
    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /**
     * Kinds of bound values.
     */
    public enum Kind {
        STRING, INT, FLOAT, TIMESTAMP, ARRAY
    }

    private final Kind kind;
    private final Kind elementKind;
    private final Object value;
    private final List<BindValue> elements;

    private BindValue(Kind kind, Kind elementKind, Object value, List<BindValue> elements) {
        this.kind = kind;
        this.elementKind = elementKind;
        this.value = value;
        this.elements = elements;
    }

    public static BindValue ofString(String value) {
        return new BindValue(Kind.STRING, null, Objects.requireNonNull(value, "value must not be null"), null);
    }

    public static BindValue ofInt(long value) {
        return new BindValue(Kind.INT, null, value, null);
    }

    public static BindValue ofFloat(double value) {
        return new BindValue(Kind.FLOAT, null, value, null);
    }

    public static BindValue ofTimestamp(LocalDateTime value) {
        return new BindValue(Kind.TIMESTAMP, null, Objects.requireNonNull(value, "value must not be null"), null);
    }

    /**
     * Builds an array value from already typed elements.
     *
     * @param elements scalar elements, never nested arrays
     * @return the array value
     * @throws InvalidFilterException if an element is null or itself an array
     */
    public static BindValue ofArray(List<BindValue> elements) {
        Objects.requireNonNull(elements, "elements must not be null");
        List<BindValue> copy = new ArrayList<>(elements.size());
        for (BindValue element : elements) {
            if (element == null) {
                throw new InvalidFilterException("Array values must not contain null elements");
            }
            if (element.kind == Kind.ARRAY) {
                throw new InvalidFilterException("Nested arrays cannot be bound as parameters");
            }
            copy.add(element);
        }
        return new BindValue(Kind.ARRAY, elementKindOf(copy), null, Collections.unmodifiableList(copy));
    }

    /**
     * Infers the bound value of a host object.
     *
     * @param raw the host value
     * @return the typed value
     * @throws InvalidFilterException if {@code raw} is null or contains null elements
     */
    public static BindValue of(Object raw) {
        if (raw == null) {
            throw new InvalidFilterException("Filter values must not be null");
        }
        if (raw instanceof BindValue bindValue) {
            return bindValue;
        }
        if (raw instanceof Collection<?> collection) {
            List<BindValue> values = new ArrayList<>(collection.size());
            for (Object item : collection) {
                values.add(of(item));
            }
            return ofArray(values);
        }
        if (raw instanceof Object[] array) {
            return of(Arrays.asList(array));
        }
        if (raw instanceof BindableEnum bindable) {
            return ofString(bindable.bindValue());
        }
        if (raw instanceof Enum<?> constant) {
            return ofString(constant.name());
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return ofInt(((Number) raw).longValue());
        }
        if (raw instanceof BigInteger big) {
            try {
                return ofInt(big.longValueExact());
            } catch (ArithmeticException e) {
                throw new InvalidFilterException("Integer value out of range: " + big, e);
            }
        }
        if (raw instanceof Float || raw instanceof Double || raw instanceof BigDecimal) {
            return ofFloat(((Number) raw).doubleValue());
        }
        if (raw instanceof LocalDateTime dateTime) {
            return ofTimestamp(dateTime);
        }
        if (raw instanceof LocalDate date) {
            return ofTimestamp(date.atStartOfDay());
        }
        if (raw instanceof OffsetDateTime offset) {
            return ofTimestamp(offset.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
        }
        if (raw instanceof ZonedDateTime zoned) {
            return ofTimestamp(zoned.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime());
        }
        if (raw instanceof Instant instant) {
            return ofTimestamp(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
        }
        return ofString(raw.toString());
    }

    private static Kind elementKindOf(List<BindValue> elements) {
        if (elements.isEmpty()) {
            return Kind.STRING;
        }
        Kind first = elements.get(0).kind;
        if (first != Kind.INT && first != Kind.FLOAT) {
            return Kind.STRING;
        }
        for (BindValue element : elements) {
            if (element.kind != first) {
                return Kind.STRING;
            }
        }
        return first;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return the element kind of an array value, or {@code null} for scalars
     */
    public Kind elementKind() {
        return elementKind;
    }

    public boolean isArray() {
        return kind == Kind.ARRAY;
    }

    /**
     * @return the array elements
     * @throws IllegalStateException if this value is a scalar
     */
    public List<BindValue> elements() {
        if (kind != Kind.ARRAY) {
            throw new IllegalStateException("Not an array value: " + kind);
        }
        return elements;
    }

    /**
     * @return the number of elements of an array, 1 for a scalar
     */
    public int size() {
        return kind == Kind.ARRAY ? elements.size() : 1;
    }

    /**
     * Host representation: {@code String}, {@code Long}, {@code Double},
     * {@code LocalDateTime}, or an unmodifiable list of those for arrays.
     *
     * @return the host value
     */
    public Object hostValue() {
        if (kind == Kind.ARRAY) {
            List<Object> values = new ArrayList<>(elements.size());
            for (BindValue element : elements) {
                values.add(element.hostValue());
            }
            return Collections.unmodifiableList(values);
        }
        return value;
    }

    /**
     * Text form of a scalar value; timestamps use {@link #TIMESTAMP_FORMAT}.
     *
     * @return the text
     * @throws IllegalStateException if this value is an array
     */
    public String asText() {
        return switch (kind) {
            case STRING -> (String) value;
            case INT, FLOAT -> String.valueOf(value);
            case TIMESTAMP -> TIMESTAMP_FORMAT.format((LocalDateTime) value);
            case ARRAY -> throw new IllegalStateException("Array values have no scalar text form");
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BindValue that)) return false;
        return kind == that.kind
                && elementKind == that.elementKind
                && Objects.equals(value, that.value)
                && Objects.equals(elements, that.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, elementKind, value, elements);
    }

    @Override
    public String toString() {
        if (kind == Kind.ARRAY) {
            return "ARRAY<" + elementKind + ">" + elements;
        }
        return kind + "(" + asText() + ")";
    }
}
