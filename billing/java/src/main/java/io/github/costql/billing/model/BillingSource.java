package io.github.costql.billing.model;

import io.github.costql.core.exception.InvalidParameterException;

import java.util.Locale;

/**
 * Family of billing tables a query asks for.
 *
 * @since 1.0.0
 */
public enum BillingSource {
    /** Daily aggregate view, the default. */
    AGGREGATE("aggregate"),
    /** Daily aggregate view with the batch/workflow columns. */
    EXTENDED("extended"),
    /** View over the raw cloud billing export. */
    GCP_BILLING("gcp_billing"),
    /** Consolidated raw table. */
    RAW("raw");

    private final String code;

    BillingSource(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * @param value the code, may be {@code null}
     * @return the source, {@link #AGGREGATE} for {@code null} or blank
     * @throws InvalidParameterException for an unknown code
     */
    public static BillingSource parse(String value) {
        if (value == null || value.isBlank()) {
            return AGGREGATE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (BillingSource source : values()) {
            if (source.code.equals(normalized)) {
                return source;
            }
        }
        throw new InvalidParameterException("Unknown billing source: " + value);
    }
}
