package com.dcruver.sheetanalytics.domain.health;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class HealthReport {
    private final String sheetId;
    private final int overallScore;
    private final HealthSubScores subScores;
    private final List<String> recommendations;
    private final Instant generatedAt;
}
