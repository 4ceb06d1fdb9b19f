package io.github.costql.core.time;

import io.github.costql.core.exception.InvalidParameterException;

import java.util.Locale;

/**
 * Buckets a total-cost query can group rows into.
 *
 * @since 1.0.0
 */
public enum TimeGranularity {
    DAY("day"),
    WEEK("week"),
    MONTH("month"),
    INVOICE_MONTH("invoice_month");

    private final String code;

    TimeGranularity(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Parses {@code day}, {@code week}, {@code month}, {@code invoice_month} or
     * {@code invoiceMonth}, ignoring case.
     *
     * @param value the text, may be {@code null}
     * @return the granularity, or {@code null} for a {@code null} or blank value
     * @throws InvalidParameterException for any other text
     */
    public static TimeGranularity parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("invoicemonth".equals(normalized)) {
            return INVOICE_MONTH;
        }
        for (TimeGranularity granularity : values()) {
            if (granularity.code.equals(normalized)) {
                return granularity;
            }
        }
        throw new InvalidParameterException("Unknown time period: " + value);
    }
}
