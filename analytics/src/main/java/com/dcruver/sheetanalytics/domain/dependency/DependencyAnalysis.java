package com.dcruver.sheetanalytics.domain.dependency;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Best-effort dependency summary. {@code hasCriticalPath} only records that some
 * task declares predecessors; it is not a computed critical path.
 */
@Data
@Builder
public class DependencyAnalysis {
    private final int totalDependentTasks;
    private final List<DependencyEntry> dependencyMap;
    private final boolean hasCriticalPath;
    private final List<DependencyEntry> criticalTasks;
    private final List<DependencyBottleneck> bottlenecks;

    public static DependencyAnalysis empty() {
        return DependencyAnalysis.builder()
            .dependencyMap(List.of())
            .criticalTasks(List.of())
            .bottlenecks(List.of())
            .build();
    }
}
