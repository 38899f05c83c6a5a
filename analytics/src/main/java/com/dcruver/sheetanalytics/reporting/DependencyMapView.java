package com.dcruver.sheetanalytics.reporting;

import com.dcruver.sheetanalytics.domain.dependency.DependencyAnalysis;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class DependencyMapView {
    static final String NO_DEPENDENCY_COLUMN = "No dependency column found in this sheet";
    static final String NO_TASK_COLUMN = "No task name column found - cannot map dependencies";

    private final String sheetId;
    private final boolean hasDependencies;
    private final DependencyAnalysis dependencyAnalysis;
    private final String message;
    private final Instant generatedAt;

    public static DependencyMapView unavailable(String sheetId, String message) {
        return DependencyMapView.builder()
            .sheetId(sheetId)
            .hasDependencies(false)
            .dependencyAnalysis(DependencyAnalysis.empty())
            .message(message)
            .generatedAt(Instant.now())
            .build();
    }

    public static DependencyMapView withoutDependencyColumn(String sheetId) {
        return unavailable(sheetId, NO_DEPENDENCY_COLUMN);
    }

    public static DependencyMapView withoutTaskColumn(String sheetId) {
        return unavailable(sheetId, NO_TASK_COLUMN);
    }
}
