package com.dcruver.sheetanalytics.domain.dependency;

import com.dcruver.sheetanalytics.domain.Level;
import lombok.Builder;
import lombok.Data;

/**
 * A task identifier that many other tasks wait on.
 */
@Data
@Builder
public class DependencyBottleneck {
    private final String taskId;
    private final String taskName;
    private final int blockingCount;
    private final Level riskLevel;
}
