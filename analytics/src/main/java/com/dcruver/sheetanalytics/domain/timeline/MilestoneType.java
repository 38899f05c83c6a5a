package com.dcruver.sheetanalytics.domain.timeline;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Kinds of milestone, recognised from keywords in the task name.
 * Declaration order is the matching priority.
 */
public enum MilestoneType {
    PROJECT_START("kickoff", "start"),
    DELIVERY("delivery", "launch", "go-live"),
    CHECKPOINT("review", "approval"),
    MILESTONE;

    private final List<String> keywords;

    MilestoneType(String... keywords) {
        this.keywords = List.of(keywords);
    }

    public static MilestoneType fromTaskName(String taskName) {
        String name = taskName.toLowerCase(Locale.ROOT);
        for (MilestoneType type : values()) {
            if (type.keywords.stream().anyMatch(name::contains)) {
                return type;
            }
        }
        return MILESTONE;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
