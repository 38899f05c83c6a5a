package com.dcruver.sheetanalytics.workspace;

import com.dcruver.sheetanalytics.reporting.SheetSummary;
import com.dcruver.sheetanalytics.reporting.StructureType;
import org.springframework.stereotype.Component;

/**
 * Quick 0-100 health score used to rank sheets within a workspace.
 */
@Component
public class SheetScoreCalculator {

    static final double COMPLETENESS_TARGET = 80;
    static final int MIN_ROWS = 5;
    static final int SPARSE_SHEET_PENALTY = 20;
    static final int PROJECT_PLAN_BONUS = 10;

    public int calculateScore(SheetSummary summary) {
        double score = 100;

        double completeness = summary.getHealthIndicators().getDataCompleteness();
        if (completeness < COMPLETENESS_TARGET) {
            score -= COMPLETENESS_TARGET - completeness;
        }

        if (summary.getMetadata().getTotalRows() < MIN_ROWS) {
            score -= SPARSE_SHEET_PENALTY;
        }

        if (summary.getHealthIndicators().getStructureType() == StructureType.PROJECT_PLAN) {
            score += PROJECT_PLAN_BONUS;
        }

        return (int) Math.round(Math.max(0, Math.min(100, score)));
    }
}
