package com.dcruver.sheetanalytics.domain;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

/**
 * A sheet row reinterpreted as a schedulable unit of work.
 */
@Data
@Builder
public class DerivedTask {
    /**
     * 1-based position of the source row in the snapshot
     */
    private final int id;
    private final String name;
    private final LocalDate start;
    private final LocalDate end;
    private final String duration;
    private final String dependencies;
    private final String assignee;

    // 0-100
    private final int progress;

    public boolean hasDates() {
        return start != null || end != null;
    }
}
