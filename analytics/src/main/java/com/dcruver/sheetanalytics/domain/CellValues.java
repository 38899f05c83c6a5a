package com.dcruver.sheetanalytics.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Lenient conversions for untyped cell values. Malformed input yields null, never an exception.
 */
public final class CellValues {

    private CellValues() {
    }

    /**
     * A cell is empty when it is null or an empty string.
     */
    public static boolean isEmpty(Object value) {
        return value == null || (value instanceof String && ((String) value).isEmpty());
    }

    /**
     * Render a cell as text. Whole numbers lose their fractional part so that
     * a predecessor id of 3.0 reads as "3".
     */
    public static String asText(Object value) {
        if (value == null) {
            return null;
        }
        if ((value instanceof Double || value instanceof Float) && !Double.isFinite(((Number) value).doubleValue())) {
            return value.toString();
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            BigDecimal decimal = new BigDecimal(value.toString()).stripTrailingZeros();
            return decimal.scale() <= 0 ? decimal.toBigInteger().toString() : decimal.toPlainString();
        }
        return value.toString();
    }

    /**
     * Parse an ISO date, local date-time or offset date-time to a calendar date.
     */
    public static LocalDate asDate(Object value) {
        if (isEmpty(value)) {
            return null;
        }
        String text = value.toString().trim();
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException ignored) {
            // fall through to the date-time forms
        }
        try {
            return LocalDateTime.parse(text).toLocalDate();
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        try {
            return OffsetDateTime.parse(text).withOffsetSameInstant(ZoneOffset.UTC).toLocalDate();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static boolean isParsableDate(Object value) {
        return asDate(value) != null;
    }

    /**
     * Numeric value of a cell, or null when the text is not a number.
     */
    public static Double asNumber(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String && !((String) value).isBlank()) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
