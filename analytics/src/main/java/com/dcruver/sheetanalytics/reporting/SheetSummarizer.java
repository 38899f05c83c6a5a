package com.dcruver.sheetanalytics.reporting;

import com.dcruver.sheetanalytics.domain.CellValues;
import com.dcruver.sheetanalytics.domain.ColumnDescriptor;
import com.dcruver.sheetanalytics.domain.ColumnRole;
import com.dcruver.sheetanalytics.domain.ColumnRoleMap;
import com.dcruver.sheetanalytics.domain.ColumnType;
import com.dcruver.sheetanalytics.domain.RawSnapshot;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the column analysis, status distribution and free-text insights for a sheet.
 */
@Component
public class SheetSummarizer {

    static final int LARGE_SHEET_ROWS = 1000;
    private static final List<String> NEGATED_COMPLETE = List.of("incomplete", "not complete", "uncomplete");

    public SheetSummary summarize(RawSnapshot snapshot, ColumnRoleMap roles) {
        List<SheetSummary.ColumnAnalysis> columnAnalysis = snapshot.getColumns().stream()
            .map(column -> SheetSummary.ColumnAnalysis.builder()
                .name(column.getTitle())
                .type(column.getDeclaredType())
                .hasData(hasData(column, snapshot.getRows()))
                .build())
            .toList();

        List<SheetSummary.StatusCount> statusDistribution = statusDistribution(snapshot, roles);

        return SheetSummary.builder()
            .sheetId(snapshot.getSheetId())
            .name(snapshot.getName())
            .metadata(SheetSummary.Metadata.builder()
                .totalRows(snapshot.getRowCount())
                .totalColumns(snapshot.getColumnCount())
                .lastUpdated(snapshot.getModifiedAt())
                .build())
            .columnAnalysis(columnAnalysis)
            .statusDistribution(statusDistribution)
            .healthIndicators(SheetSummary.HealthIndicators.builder()
                .completionRate(completionRate(statusDistribution, snapshot.getRows().size()))
                .dataCompleteness(dataCompleteness(columnAnalysis))
                .structureType(structureType(snapshot))
                .build())
            .insights(insights(snapshot, columnAnalysis))
            .generatedAt(Instant.now())
            .build();
    }

    public StructureType structureType(RawSnapshot snapshot) {
        boolean projectPlan = snapshot.getColumns().stream()
            .anyMatch(column -> column.getDeclaredType() == ColumnType.PREDECESSOR);
        return projectPlan ? StructureType.PROJECT_PLAN : StructureType.GENERAL;
    }

    List<String> insights(RawSnapshot snapshot, List<SheetSummary.ColumnAnalysis> columnAnalysis) {
        List<String> insights = new ArrayList<>();

        if (structureType(snapshot) == StructureType.PROJECT_PLAN) {
            insights.add("This appears to be a project plan with dependency tracking");
        }

        long emptyColumns = columnAnalysis.stream().filter(column -> !column.isHasData()).count();
        if (emptyColumns > 0) {
            insights.add(String.format("%d columns appear to have no data", emptyColumns));
        }

        if (snapshot.getRowCount() > LARGE_SHEET_ROWS) {
            insights.add("Large sheet - consider performance optimization");
        }

        if (snapshot.getColumns().stream().anyMatch(column -> column.titleContains("parent"))) {
            insights.add("Sheet may have hierarchical structure");
        }

        if (snapshot.getRows().isEmpty()) {
            insights.add("No sample data available - sheet may be empty or access limited");
        }

        return insights;
    }

    private List<SheetSummary.StatusCount> statusDistribution(RawSnapshot snapshot, ColumnRoleMap roles) {
        String statusTitle = roles.titleOf(ColumnRole.STATUS);
        if (statusTitle == null) {
            return null;
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Map<String, Object> row : snapshot.getRows()) {
            Object value = row.get(statusTitle);
            if (!CellValues.isEmpty(value)) {
                counts.merge(CellValues.asText(value), 1, Integer::sum);
            }
        }

        if (counts.isEmpty()) {
            return null;
        }

        return counts.entrySet().stream()
            .map(entry -> SheetSummary.StatusCount.builder()
                .status(entry.getKey())
                .count(entry.getValue())
                .build())
            .toList();
    }

    private static Double completionRate(List<SheetSummary.StatusCount> distribution, int rows) {
        if (distribution == null || rows == 0) {
            return null;
        }
        int complete = distribution.stream()
            .filter(status -> isCompleteStatus(status.getStatus()))
            .mapToInt(SheetSummary.StatusCount::getCount)
            .sum();
        return (double) complete / rows * 100;
    }

    static boolean isCompleteStatus(String status) {
        String text = status.toLowerCase(Locale.ROOT);
        return text.contains("complete") && NEGATED_COMPLETE.stream().noneMatch(text::contains);
    }

    private static double dataCompleteness(List<SheetSummary.ColumnAnalysis> columnAnalysis) {
        if (columnAnalysis.isEmpty()) {
            return 0;
        }
        long withData = columnAnalysis.stream().filter(SheetSummary.ColumnAnalysis::isHasData).count();
        return (double) withData / columnAnalysis.size() * 100;
    }

    private static boolean hasData(ColumnDescriptor column, List<Map<String, Object>> rows) {
        return rows.stream().anyMatch(row -> !CellValues.isEmpty(row.get(column.getTitle())));
    }
}
