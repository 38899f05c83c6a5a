package com.dcruver.sheetanalytics.domain.health;

import com.dcruver.sheetanalytics.domain.Level;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class PerformanceMetrics {
    private final int totalRows;
    private final int totalColumns;
    private final long totalCells;
    private final SizeCategory sizeCategory;
    private final Level performanceRisk;
}
