package com.dcruver.sheetanalytics.domain.health;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SizeCategory {
    SMALL,
    MEDIUM,
    LARGE;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
