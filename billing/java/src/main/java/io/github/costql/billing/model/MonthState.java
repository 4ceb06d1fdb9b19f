package io.github.costql.billing.model;

import java.time.LocalDate;

/**
 * Whether an invoice month is still accruing cost.
 *
 * @since 1.0.0
 */
public enum MonthState {
    CURRENT_MONTH,
    HISTORICAL_MONTH;

    /**
     * @param month the invoice month
     * @param today the current date
     * @return {@link #CURRENT_MONTH} when the month's last calendar day is today or later
     */
    public static MonthState of(InvoiceMonth month, LocalDate today) {
        return month.lastDay().isBefore(today) ? HISTORICAL_MONTH : CURRENT_MONTH;
    }

    public boolean isCurrent() {
        return this == CURRENT_MONTH;
    }
}
