package com.dcruver.sheetanalytics.domain.dependency;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Predecessor link types. Declaration order is the order in which markers are checked.
 */
public enum DependencyType {
    FINISH_TO_START("FS", "Finish-to-Start"),
    START_TO_START("SS", "Start-to-Start"),
    FINISH_TO_FINISH("FF", "Finish-to-Finish"),
    START_TO_FINISH("SF", "Start-to-Finish");

    private final String marker;
    private final String label;

    DependencyType(String marker, String label) {
        this.marker = marker;
        this.label = label;
    }

    /**
     * Infer the link type from raw predecessor text; finish-to-start when no marker is present.
     */
    public static DependencyType infer(String dependencyText) {
        if (dependencyText != null) {
            for (DependencyType type : values()) {
                if (dependencyText.contains(type.marker)) {
                    return type;
                }
            }
        }
        return FINISH_TO_START;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
