package io.github.costql.billing.aggregation;

import io.github.costql.core.exception.InternalQueryException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Conversions of result row cells, which arrive as the driver's Java types:
 * numbers, text, date-times, nested maps for structs and lists for arrays.
 * Date-times are normalized to UTC.
 */
final class WarehouseValues {

    private WarehouseValues() {
    }

    static String text(Object value) {
        return value == null ? null : value.toString();
    }

    static double number(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return value == null ? 0d : Double.parseDouble(value.toString());
    }

    static Long integer(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        return value == null ? null : Long.valueOf(value.toString());
    }

    /**
     * @throws InternalQueryException if a text value is neither ISO nor {@code yyyy-MM-dd HH:mm:ss}
     */
    static LocalDateTime dateTime(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime local) {
            return local;
        }
        if (value instanceof Instant instant) {
            return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        }
        if (value instanceof OffsetDateTime offset) {
            return offset.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (value instanceof ZonedDateTime zoned) {
            return zoned.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay();
        }
        return parse(value.toString());
    }

    private static LocalDateTime parse(String text) {
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay();
            }
            if (text.endsWith("Z") || text.matches(".*[+-]\\d\\d:\\d\\d$")) {
                return OffsetDateTime.parse(text.replace(' ', 'T'))
                        .withOffsetSameInstant(ZoneOffset.UTC)
                        .toLocalDateTime();
            }
            return LocalDateTime.parse(text.replace(' ', 'T'));
        } catch (DateTimeParseException e) {
            throw new InternalQueryException("Unexpected date-time in result row: " + text, e);
        }
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> struct(Object value) {
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new InternalQueryException("Expected a struct in result row, got " + value.getClass().getSimpleName());
    }

    static List<?> array(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list;
        }
        throw new InternalQueryException("Expected an array in result row, got " + value.getClass().getSimpleName());
    }
}
