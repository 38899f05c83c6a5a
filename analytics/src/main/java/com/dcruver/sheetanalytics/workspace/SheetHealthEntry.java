package com.dcruver.sheetanalytics.workspace;

import com.dcruver.sheetanalytics.reporting.StructureType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * One sheet's line in a workspace overview. {@code error} is set only for sheets
 * that could not be analyzed, which always score 0.
 */
@Data
@Builder
public class SheetHealthEntry {
    static final String ANALYSIS_FAILED = "Failed to analyze";

    private final String id;
    private final String name;
    private final StructureType type;
    private final int healthScore;
    private final Instant lastModified;
    private final int rowCount;
    private final String error;

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }
}
