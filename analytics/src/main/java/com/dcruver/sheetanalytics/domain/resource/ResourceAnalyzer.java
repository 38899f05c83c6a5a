package com.dcruver.sheetanalytics.domain.resource;

import com.dcruver.sheetanalytics.domain.DerivedTask;
import com.dcruver.sheetanalytics.domain.Level;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts task assignments per resource.
 */
@Component
public class ResourceAnalyzer {

    static final int MEDIUM_ABOVE = 2;
    static final int HIGH_ABOVE = 5;

    public ResourceAllocation analyze(List<DerivedTask> tasks) {
        Map<String, Integer> assignments = new LinkedHashMap<>();
        for (DerivedTask task : tasks) {
            if (task.getAssignee() != null) {
                assignments.merge(task.getAssignee(), 1, Integer::sum);
            }
        }

        if (assignments.isEmpty()) {
            return ResourceAllocation.empty();
        }

        List<ResourceUtilization> utilization = assignments.entrySet().stream()
            .map(entry -> ResourceUtilization.builder()
                .resource(entry.getKey())
                .assignedTasks(entry.getValue())
                .utilizationLevel(Level.classify(entry.getValue(), MEDIUM_ABOVE, HIGH_ABOVE))
                .build())
            .toList();

        return ResourceAllocation.builder()
            .totalResources(assignments.size())
            .resourceUtilization(utilization)
            .overallocatedResources(utilization.stream()
                .filter(resource -> resource.getUtilizationLevel() == Level.HIGH)
                .toList())
            .build();
    }
}
