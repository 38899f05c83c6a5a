package com.dcruver.sheetanalytics.reporting;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StructureType {
    PROJECT_PLAN,
    GENERAL,

    /**
     * Sheet could not be analyzed
     */
    UNKNOWN;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
