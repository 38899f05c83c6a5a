package com.dcruver.sheetanalytics.domain.timeline;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;

/**
 * Project bounds and milestones. All bounds are null when no task carries a date.
 * Whenever both bounds are present, projectStart is not after projectEnd.
 */
@Data
@Builder
public class Timeline {
    private final LocalDate projectStart;
    private final LocalDate projectEnd;
    private final Long spanDays;
    private final List<Milestone> milestones;

    public static Timeline empty() {
        return Timeline.builder().milestones(List.of()).build();
    }
}
