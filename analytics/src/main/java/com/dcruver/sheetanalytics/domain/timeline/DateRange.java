package com.dcruver.sheetanalytics.domain.timeline;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

/**
 * Earliest and latest of every start and end date in a task list.
 */
@Data
@Builder
public class DateRange {
    private final LocalDate earliest;
    private final LocalDate latest;
    private final Long spanDays;

    public static DateRange empty() {
        return DateRange.builder().build();
    }
}
