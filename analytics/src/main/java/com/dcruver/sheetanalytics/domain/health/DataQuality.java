package com.dcruver.sheetanalytics.domain.health;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DataQuality {
    private final double completenessPct;

    // Unparsable values in date-typed columns
    private final int consistencyIssues;
    private final int emptyColumnCount;
}
