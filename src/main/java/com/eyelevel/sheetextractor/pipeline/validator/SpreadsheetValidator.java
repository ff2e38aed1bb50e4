package com.eyelevel.sheetextractor.pipeline.validator;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Validates data extracted from spreadsheets.
 * <p>
 * The data type is {@code invoice} when {@code invoice_number} or {@code line_items} is present and
 * {@code table} otherwise. Invoices need a string {@code invoice_number}, a numeric {@code total_amount} and
 * a non-empty {@code line_items} list whose entries carry a {@code description} and a numeric
 * {@code amount}. A line-item sum (plus tax and shipping, minus discount) that does not match the total and an
 * unreadable {@code invoice_date} are warnings. Tables need at least one non-empty field.
 */
@Slf4j
@Component
public class SpreadsheetValidator implements Validator {

    public static final String INVOICE = "invoice";
    public static final String TABLE = "table";

    private static final BigDecimal TOTAL_TOLERANCE = new BigDecimal("0.01");

    @Override
    public ValidationOutcome validate(final Map<String, Object> data) {
        final List<String> errors = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();
        if (data == null || data.isEmpty()) {
            errors.add("no_data_extracted");
            return ValidationOutcome.of(errors, warnings, TABLE);
        }

        final String dataType = detectDataType(data);
        if (INVOICE.equals(dataType)) {
            validateInvoice(data, errors, warnings);
        } else {
            validateTable(data, errors);
        }
        log.debug("Validated {} data: {} errors, {} warnings.", dataType, errors.size(), warnings.size());
        return ValidationOutcome.of(errors, warnings, dataType);
    }

    static String detectDataType(final Map<String, Object> data) {
        return data.containsKey("invoice_number") || data.containsKey("line_items") ? INVOICE : TABLE;
    }

    private void validateInvoice(final Map<String, Object> data, final List<String> errors,
                                 final List<String> warnings) {
        final Object invoiceNumber = data.get("invoice_number");
        if (invoiceNumber == null) {
            errors.add("missing required field: invoice_number");
        } else if (!(invoiceNumber instanceof String text) || text.isBlank()) {
            errors.add("invoice_number must be a non-empty string");
        }

        final BigDecimal total = toDecimal(data.get("total_amount"));
        if (data.get("total_amount") == null) {
            errors.add("missing required field: total_amount");
        } else if (total == null) {
            errors.add("total_amount must be a number");
        }

        final Object lineItems = data.get("line_items");
        BigDecimal lineSum = BigDecimal.ZERO;
        boolean lineSumComplete = true;
        if (!(lineItems instanceof List<?> items) || items.isEmpty()) {
            errors.add("line_items must be a non-empty list");
            lineSumComplete = false;
        } else {
            for (int i = 0; i < items.size(); i++) {
                if (!(items.get(i) instanceof Map<?, ?> item)) {
                    errors.add("line_items[" + i + "] must be an object");
                    lineSumComplete = false;
                    continue;
                }
                final Object description = item.get("description");
                if (description == null || description.toString().isBlank()) {
                    errors.add("line_items[" + i + "] is missing description");
                }
                final BigDecimal amount = toDecimal(item.get("amount"));
                if (amount == null) {
                    errors.add("line_items[" + i + "].amount must be a number");
                    lineSumComplete = false;
                } else {
                    lineSum = lineSum.add(amount);
                }
            }
        }

        if (total != null && lineSumComplete) {
            final BigDecimal expected = lineSum.add(adjustments(data));
            if (expected.subtract(total).abs().compareTo(TOTAL_TOLERANCE) > 0) {
                warnings.add("sum of line_items amounts (" + expected.toPlainString()
                             + ") does not match total_amount (" + total.toPlainString() + ")");
            }
        }

        final Object invoiceDate = data.get("invoice_date");
        if (invoiceDate != null && !isIsoDate(invoiceDate)) {
            warnings.add("invoice_date is not an ISO date: " + invoiceDate);
        }
    }

    private void validateTable(final Map<String, Object> data, final List<String> errors) {
        final boolean hasContent = data.values().stream().anyMatch(value -> value != null
                                                                            && !(value instanceof String s && s.isBlank())
                                                                            && !(value instanceof Collection<?> c && c.isEmpty())
                                                                            && !(value instanceof Map<?, ?> m && m.isEmpty()));
        if (!hasContent) {
            errors.add("no_data_extracted");
        }
    }

    /**
     * Tax and shipping added to the line items, discount taken off.
     */
    private static BigDecimal adjustments(final Map<String, Object> data) {
        BigDecimal adjustment = BigDecimal.ZERO;
        for (final String key : List.of("tax_amount", "shipping_amount")) {
            final BigDecimal value = toDecimal(data.get(key));
            if (value != null) {
                adjustment = adjustment.add(value);
            }
        }
        final BigDecimal discount = toDecimal(data.get("discount_amount"));
        return discount == null ? adjustment : adjustment.subtract(discount.abs());
    }

    static BigDecimal toDecimal(final Object value) {
        if (value instanceof Number number) {
            try {
                return new BigDecimal(number.toString());
            } catch (final NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static boolean isIsoDate(final Object value) {
        try {
            LocalDate.parse(value.toString());
            return true;
        } catch (final DateTimeParseException e) {
            return false;
        }
    }
}
