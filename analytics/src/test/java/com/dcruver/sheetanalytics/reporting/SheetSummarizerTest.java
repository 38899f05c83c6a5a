package com.dcruver.sheetanalytics.reporting;

import com.dcruver.sheetanalytics.domain.ColumnDescriptor;
import com.dcruver.sheetanalytics.domain.ColumnRoleClassifier;
import com.dcruver.sheetanalytics.domain.ColumnType;
import com.dcruver.sheetanalytics.domain.RawSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SheetSummarizerTest {

    private SheetSummarizer summarizer;
    private ColumnRoleClassifier classifier;

    @BeforeEach
    void setUp() {
        summarizer = new SheetSummarizer();
        classifier = new ColumnRoleClassifier();
    }

    @Test
    void testProjectPlanSummary() {
        RawSnapshot snapshot = RawSnapshot.builder()
            .sheetId("42")
            .name("Website Relaunch")
            .modifiedAt(Instant.parse("2024-05-01T10:00:00Z"))
            .columns(List.of(
                ColumnDescriptor.builder().title("Task Name").declaredType(ColumnType.TEXT_NUMBER).primary(true).build(),
                ColumnDescriptor.of("Status", ColumnType.PICKLIST),
                ColumnDescriptor.of("Predecessors", ColumnType.PREDECESSOR),
                ColumnDescriptor.of("Parent Task", ColumnType.TEXT_NUMBER)))
            .rows(List.of(
                row("Task Name", "Design", "Status", "Complete"),
                row("Task Name", "Build", "Status", "In Progress", "Predecessors", "1"),
                row("Task Name", "Test", "Status", "Complete", "Predecessors", "2"),
                row("Task Name", "Launch")))
            .rowCount(4)
            .build();

        SheetSummary summary = summarizer.summarize(snapshot, classifier.classify(snapshot.getColumns()));

        assertEquals("42", summary.getSheetId());
        assertEquals("Website Relaunch", summary.getName());
        assertEquals(4, summary.getMetadata().getTotalRows());
        assertEquals(4, summary.getMetadata().getTotalColumns());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), summary.getMetadata().getLastUpdated());

        List<SheetSummary.StatusCount> distribution = summary.getStatusDistribution();
        assertEquals(2, distribution.size());
        assertEquals("Complete", distribution.get(0).getStatus());
        assertEquals(2, distribution.get(0).getCount());
        assertEquals("In Progress", distribution.get(1).getStatus());

        SheetSummary.HealthIndicators indicators = summary.getHealthIndicators();
        assertEquals(50.0, indicators.getCompletionRate());
        assertEquals(75.0, indicators.getDataCompleteness());
        assertEquals(StructureType.PROJECT_PLAN, indicators.getStructureType());

        assertFalse(summary.getColumnAnalysis().get(3).isHasData());
        assertEquals(List.of(
            "This appears to be a project plan with dependency tracking",
            "1 columns appear to have no data",
            "Sheet may have hierarchical structure"
        ), summary.getInsights());
    }

    @Test
    void testEmptyGeneralSheet() {
        RawSnapshot snapshot = RawSnapshot.builder()
            .sheetId("7")
            .name("Contacts")
            .columns(List.of(ColumnDescriptor.of("Name", ColumnType.TEXT_NUMBER)))
            .rows(List.of())
            .rowCount(1500)
            .build();

        SheetSummary summary = summarizer.summarize(snapshot, classifier.classify(snapshot.getColumns()));

        assertNull(summary.getStatusDistribution());
        assertNull(summary.getHealthIndicators().getCompletionRate());
        assertEquals(0.0, summary.getHealthIndicators().getDataCompleteness());
        assertEquals(StructureType.GENERAL, summary.getHealthIndicators().getStructureType());
        assertEquals(List.of(
            "1 columns appear to have no data",
            "Large sheet - consider performance optimization",
            "No sample data available - sheet may be empty or access limited"
        ), summary.getInsights());
    }

    @Test
    void testStatusColumnWithoutValues() {
        RawSnapshot snapshot = RawSnapshot.builder()
            .sheetId("8")
            .columns(List.of(
                ColumnDescriptor.builder().title("Item").declaredType(ColumnType.TEXT_NUMBER).primary(true).build(),
                ColumnDescriptor.of("Status", ColumnType.PICKLIST)))
            .rows(List.of(row("Item", "Chairs"), row("Item", "Tables", "Status", "")))
            .rowCount(2)
            .build();

        SheetSummary summary = summarizer.summarize(snapshot, classifier.classify(snapshot.getColumns()));

        assertNull(summary.getStatusDistribution());
        assertNull(summary.getHealthIndicators().getCompletionRate());
    }

    @Test
    void testNegatedStatusesAreNotComplete() {
        RawSnapshot snapshot = RawSnapshot.builder()
            .sheetId("9")
            .columns(List.of(
                ColumnDescriptor.builder().title("Task Name").declaredType(ColumnType.TEXT_NUMBER).primary(true).build(),
                ColumnDescriptor.of("Status", ColumnType.PICKLIST)))
            .rows(List.of(
                row("Task Name", "Design", "Status", "Complete"),
                row("Task Name", "Build", "Status", "Completed"),
                row("Task Name", "Test", "Status", "Incomplete"),
                row("Task Name", "Docs", "Status", "Not Complete")))
            .rowCount(4)
            .build();

        SheetSummary summary = summarizer.summarize(snapshot, classifier.classify(snapshot.getColumns()));

        assertEquals(4, summary.getStatusDistribution().size());
        assertEquals(50.0, summary.getHealthIndicators().getCompletionRate());
        assertFalse(SheetSummarizer.isCompleteStatus("INCOMPLETE"));
        assertTrue(SheetSummarizer.isCompleteStatus("Completed"));
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }
}
