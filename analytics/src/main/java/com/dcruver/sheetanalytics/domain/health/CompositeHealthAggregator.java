package com.dcruver.sheetanalytics.domain.health;

import com.dcruver.sheetanalytics.domain.Level;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Combines the four sub-scores into one health score with recommendations.
 * Each contribution is {@code componentScore * weight / 100}. The data quality
 * component is {@code completeness * 0.8 + (100 - issues * 10)} and is not
 * normalised before weighting; no clamp is applied to the total.
 */
@Component
@ConfigurationProperties(prefix = "analytics.health.weights")
@Data
public class CompositeHealthAggregator {
    private double dataQuality = 0.4;
    private double formulaHealth = 0.2;
    private double performance = 0.2;
    private double structure = 0.2;

    static final double COMPLETENESS_TARGET = 80;

    public HealthReport aggregate(String sheetId, HealthSubScores subScores) {
        return HealthReport.builder()
            .sheetId(sheetId)
            .overallScore(calculateScore(subScores))
            .subScores(subScores)
            .recommendations(recommendations(subScores))
            .generatedAt(Instant.now())
            .build();
    }

    /**
     * Weighted composite score, rounded half up
     */
    public int calculateScore(HealthSubScores subScores) {
        DataQuality quality = subScores.getDataQuality();
        double score = 0;

        score += (quality.getCompletenessPct() * 0.8 + (100 - quality.getConsistencyIssues() * 10))
            * dataQuality / 100;

        double formulaScore = subScores.getFormulaHealth().isHasFormulas() ? 80 : 100;
        score += formulaScore * formulaHealth / 100;

        score += performanceScore(subScores.getPerformance().getPerformanceRisk()) * performance / 100;

        score += subScores.getStructure().getCompletenessPct() * structure / 100;

        return (int) Math.round(score);
    }

    /**
     * Independent findings; every condition that holds contributes one line.
     */
    public List<String> recommendations(HealthSubScores subScores) {
        List<String> recommendations = new ArrayList<>();
        DataQuality quality = subScores.getDataQuality();

        if (quality.getCompletenessPct() < COMPLETENESS_TARGET) {
            recommendations.add("Improve data completeness - consider making key fields required");
        }

        if (quality.getEmptyColumnCount() > 0) {
            recommendations.add(String.format("Remove or populate %d empty columns", quality.getEmptyColumnCount()));
        }

        if (subScores.getPerformance().getPerformanceRisk() == Level.HIGH) {
            recommendations.add("Consider archiving old data or splitting into multiple sheets for better performance");
        }

        if (!subScores.getStructure().isHasStatus()) {
            recommendations.add("Add status tracking column for better project visibility");
        }

        if (subScores.getFormulaHealth().getComplexity() == Level.HIGH) {
            recommendations.add("Review complex formulas for optimization opportunities");
        }

        return recommendations;
    }

    private static int performanceScore(Level risk) {
        switch (risk) {
            case LOW:
                return 100;
            case MEDIUM:
                return 70;
            default:
                return 40;
        }
    }
}
