package com.dcruver.sheetanalytics.domain.timeline;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

@Data
@Builder
public class Milestone {
    private final String name;
    private final LocalDate date;
    private final MilestoneType type;
}
