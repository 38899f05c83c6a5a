package com.dcruver.sheetanalytics.domain.resource;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Assignment load per resource; overallocated resources are those at HIGH utilization.
 */
@Data
@Builder
public class ResourceAllocation {
    private final int totalResources;
    private final List<ResourceUtilization> resourceUtilization;
    private final List<ResourceUtilization> overallocatedResources;

    public static ResourceAllocation empty() {
        return ResourceAllocation.builder()
            .resourceUtilization(List.of())
            .overallocatedResources(List.of())
            .build();
    }
}
