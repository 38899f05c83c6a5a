package com.dcruver.sheetanalytics.workspace;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class WorkspaceOverview {
    private final String workspaceId;
    private final String workspaceName;
    private final Summary summary;
    private final List<SheetHealthEntry> sheetAnalysis;
    private final List<String> recommendations;
    private final Instant generatedAt;

    @Data
    @Builder
    public static class Summary {
        private final int totalSheets;
        private final int analyzedSheets;
        private final int failedSheets;
        private final int projectPlans;
        private final int generalSheets;

        // Mean over analyzed sheets only
        private final double averageHealthScore;
    }
}
