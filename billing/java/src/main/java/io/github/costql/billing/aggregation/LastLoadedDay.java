package io.github.costql.billing.aggregation;

import io.github.costql.core.exception.InternalQueryException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Text forms of the last fully loaded day.
 * <p>
 * The warehouse returns the value as a UTC timestamp; it is bound back into the
 * daily delta query as {@code yyyy-MM-dd HH:mm:ss+00:00} and shown to callers as
 * {@code MMM dd}, e.g. {@code Mar 05}.
 * </p>
 *
 * @since 1.0.0
 */
final class LastLoadedDay {

    static final DateTimeFormatter PARAMETER_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss'+00:00'");
    static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("MMM dd", Locale.ENGLISH);

    private LastLoadedDay() {
    }

    /**
     * @param raw the {@code last_loaded_day} value of the lookup row
     * @return the parameter text, {@code null} when {@code raw} is null
     */
    static String toParameter(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Instant instant) {
            return PARAMETER_FORMAT.format(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
        }
        if (raw instanceof OffsetDateTime offset) {
            return PARAMETER_FORMAT.format(offset.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
        }
        if (raw instanceof ZonedDateTime zoned) {
            return PARAMETER_FORMAT.format(zoned.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime());
        }
        if (raw instanceof LocalDateTime local) {
            return PARAMETER_FORMAT.format(local);
        }
        if (raw instanceof LocalDate date) {
            return PARAMETER_FORMAT.format(date.atStartOfDay());
        }
        return raw.toString();
    }

    /**
     * @param parameter the parameter text
     * @return the display text, {@code null} when {@code parameter} is null
     * @throws InternalQueryException if the text is not a UTC timestamp
     */
    static String toDisplay(String parameter) {
        if (parameter == null) {
            return null;
        }
        try {
            return DISPLAY_FORMAT.format(LocalDateTime.parse(parameter, PARAMETER_FORMAT));
        } catch (DateTimeParseException e) {
            throw new InternalQueryException("Unexpected last loaded day: " + parameter, e);
        }
    }
}
