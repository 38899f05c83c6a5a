package com.dcruver.sheetanalytics.domain.dependency;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class DependencyEntry {
    private final int taskId;
    private final String taskName;
    private final List<String> dependencies;
    private final DependencyType dependencyType;
}
