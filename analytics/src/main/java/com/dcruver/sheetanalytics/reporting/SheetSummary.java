package com.dcruver.sheetanalytics.reporting;

import com.dcruver.sheetanalytics.domain.ColumnType;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Structural overview of one sheet.
 */
@Data
@Builder
public class SheetSummary {
    private final String sheetId;
    private final String name;
    private final Metadata metadata;
    private final List<ColumnAnalysis> columnAnalysis;

    // Null when the sheet has no status column or no status values
    private final List<StatusCount> statusDistribution;
    private final HealthIndicators healthIndicators;
    private final List<String> insights;
    private final Instant generatedAt;

    @Data
    @Builder
    public static class Metadata {
        private final int totalRows;
        private final int totalColumns;
        private final Instant lastUpdated;
    }

    @Data
    @Builder
    public static class ColumnAnalysis {
        private final String name;
        private final ColumnType type;
        private final boolean hasData;
    }

    @Data
    @Builder
    public static class StatusCount {
        private final String status;
        private final int count;
    }

    @Data
    @Builder
    public static class HealthIndicators {
        /**
         * Percent of rows whose status reads as complete; null without status data
         */
        private final Double completionRate;

        /**
         * Percent of columns holding at least one value
         */
        private final double dataCompleteness;
        private final StructureType structureType;
    }
}
