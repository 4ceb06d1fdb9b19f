package io.github.costql.billing.model;

import io.github.costql.core.exception.InvalidParameterException;
import io.github.costql.core.exception.MissingParameterException;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Billing period identifier in {@code YYYYMM} form.
 * <p>
 * Rows of one invoice month can carry usage days slightly outside the calendar
 * month, so {@link #scanStart()} and {@link #scanEnd()} widen the calendar range by
 * {@value #SCAN_MARGIN_DAYS} days on each side. Those bounds only limit the
 * partitions scanned; rows are still selected by {@code invoice_month}.
 * </p>
 *
 * @param month the calendar month
 * @since 1.0.0
 */
public record InvoiceMonth(YearMonth month) {

    public static final int SCAN_MARGIN_DAYS = 3;

    private static final Pattern SIX_DIGITS = Pattern.compile("\\d{6}");
    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("uuuuMM");

    public InvoiceMonth {
        Objects.requireNonNull(month, "month must not be null");
    }

    /**
     * @param value the invoice month, exactly six digits
     * @return the parsed month
     * @throws MissingParameterException if {@code value} is null or blank
     * @throws InvalidParameterException if it is not six digits or not a calendar month
     */
    public static InvoiceMonth parse(String value) {
        if (value == null || value.isBlank()) {
            throw new MissingParameterException("Invoice month is required");
        }
        if (!SIX_DIGITS.matcher(value).matches()) {
            throw new InvalidParameterException("Invalid invoice month: " + value);
        }
        YearMonth month;
        try {
            month = YearMonth.parse(value, FORMAT);
        } catch (DateTimeParseException e) {
            throw new InvalidParameterException("Invalid invoice month: " + value, e);
        }
        if (!value.equals(month.format(FORMAT))) {
            throw new InvalidParameterException("Invalid invoice month: " + value);
        }
        return new InvoiceMonth(month);
    }

    public LocalDate firstDay() {
        return month.atDay(1);
    }

    public LocalDate lastDay() {
        return month.atEndOfMonth();
    }

    public LocalDate scanStart() {
        return firstDay().minusDays(SCAN_MARGIN_DAYS);
    }

    public LocalDate scanEnd() {
        return lastDay().plusDays(SCAN_MARGIN_DAYS);
    }

    /**
     * @return the {@code YYYYMM} text
     */
    public String code() {
        return month.format(FORMAT);
    }

    @Override
    public String toString() {
        return code();
    }
}
