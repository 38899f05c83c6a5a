package com.dcruver.sheetanalytics.domain.health;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

/**
 * Which project-plan features a sheet's columns support.
 */
@Data
@Builder
public class StructureHealth {
    @JsonProperty("is_project_plan")
    private final boolean projectPlan;
    private final boolean hasDates;
    private final boolean hasAssignments;
    private final boolean hasStatus;
    private final double completenessPct;
}
