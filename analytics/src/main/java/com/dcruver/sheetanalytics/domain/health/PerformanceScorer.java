package com.dcruver.sheetanalytics.domain.health;

import com.dcruver.sheetanalytics.domain.Level;
import com.dcruver.sheetanalytics.domain.RawSnapshot;
import org.springframework.stereotype.Component;

/**
 * Rates sheet size from the source's total row count, not the delivered rows.
 */
@Component
public class PerformanceScorer {

    static final long MEDIUM_SIZE_ABOVE = 10_000;
    static final long LARGE_SIZE_ABOVE = 50_000;
    static final long HIGH_RISK_ABOVE = 100_000;

    public PerformanceMetrics score(RawSnapshot snapshot) {
        long totalCells = (long) snapshot.getRowCount() * snapshot.getColumnCount();

        return PerformanceMetrics.builder()
            .totalRows(snapshot.getRowCount())
            .totalColumns(snapshot.getColumnCount())
            .totalCells(totalCells)
            .sizeCategory(sizeCategory(totalCells))
            .performanceRisk(Level.classify(totalCells, LARGE_SIZE_ABOVE, HIGH_RISK_ABOVE))
            .build();
    }

    private static SizeCategory sizeCategory(long totalCells) {
        if (totalCells > LARGE_SIZE_ABOVE) {
            return SizeCategory.LARGE;
        }
        return totalCells > MEDIUM_SIZE_ABOVE ? SizeCategory.MEDIUM : SizeCategory.SMALL;
    }
}
