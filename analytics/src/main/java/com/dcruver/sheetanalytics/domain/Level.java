package com.dcruver.sheetanalytics.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Three-step classification shared by risk, utilization and complexity ratings.
 */
public enum Level {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Classify a count against strict thresholds: above {@code highAbove} is HIGH,
     * above {@code mediumAbove} is MEDIUM, anything else LOW.
     */
    public static Level classify(long value, long mediumAbove, long highAbove) {
        if (value > highAbove) {
            return HIGH;
        }
        if (value > mediumAbove) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
