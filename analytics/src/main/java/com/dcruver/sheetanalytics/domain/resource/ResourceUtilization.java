package com.dcruver.sheetanalytics.domain.resource;

import com.dcruver.sheetanalytics.domain.Level;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ResourceUtilization {
    private final String resource;
    private final int assignedTasks;
    private final Level utilizationLevel;
}
