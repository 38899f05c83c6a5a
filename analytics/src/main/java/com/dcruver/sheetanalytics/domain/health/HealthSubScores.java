package com.dcruver.sheetanalytics.domain.health;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class HealthSubScores {
    private final DataQuality dataQuality;
    private final FormulaHealth formulaHealth;
    private final PerformanceMetrics performance;
    private final StructureHealth structure;
}
