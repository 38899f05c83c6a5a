package com.dcruver.sheetanalytics.reporting;

import com.dcruver.sheetanalytics.domain.DerivedTask;
import com.dcruver.sheetanalytics.domain.dependency.DependencyBottleneck;
import com.dcruver.sheetanalytics.domain.dependency.DependencyEntry;
import com.dcruver.sheetanalytics.domain.resource.ResourceAllocation;
import com.dcruver.sheetanalytics.domain.timeline.DateRange;
import com.dcruver.sheetanalytics.domain.timeline.Timeline;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Gantt-style timeline of a project sheet.
 */
@Data
@Builder
public class GanttView {
    static final String NO_TASK_COLUMN = "No task name column found - cannot generate Gantt data";

    private final String sheetId;
    private final List<DerivedTask> tasks;
    private final Timeline timeline;
    private final boolean hasCriticalPath;
    private final List<DependencyEntry> criticalTasks;
    private final List<DependencyBottleneck> dependencyBottlenecks;
    private final ResourceAllocation resourceUtilization;
    private final Metadata metadata;

    // Set only when the view could not be generated
    private final String message;
    private final Instant generatedAt;

    @Data
    @Builder
    public static class Metadata {
        private final int totalTasks;
        private final boolean hasDependencies;
        private final boolean hasResources;
        private final DateRange dateRange;
    }

    public static GanttView withoutTaskColumn(String sheetId) {
        return GanttView.builder()
            .sheetId(sheetId)
            .tasks(List.of())
            .timeline(Timeline.empty())
            .criticalTasks(List.of())
            .dependencyBottlenecks(List.of())
            .resourceUtilization(ResourceAllocation.empty())
            .metadata(Metadata.builder().dateRange(DateRange.empty()).build())
            .message(NO_TASK_COLUMN)
            .generatedAt(Instant.now())
            .build();
    }
}
