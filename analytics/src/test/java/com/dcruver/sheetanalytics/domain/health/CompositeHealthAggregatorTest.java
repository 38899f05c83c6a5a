package com.dcruver.sheetanalytics.domain.health;

import com.dcruver.sheetanalytics.domain.Level;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompositeHealthAggregatorTest {

    private CompositeHealthAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new CompositeHealthAggregator();
    }

    @Test
    void testIdealSheetScore() {
        HealthSubScores ideal = subScores(100, 0, 0, false, Level.LOW, Level.LOW, true, 100);

        // 0.72 + 0.2 + 0.2 + 0.2
        assertEquals(1, aggregator.calculateScore(ideal));
        assertTrue(aggregator.recommendations(ideal).isEmpty());
    }

    @Test
    void testScoreIsNotClamped() {
        HealthSubScores poor = subScores(50, 50, 0, true, Level.LOW, Level.HIGH, true, 0);

        assertEquals(-1, aggregator.calculateScore(poor));
    }

    @Test
    void testWeightsAreConfigurable() {
        aggregator.setDataQuality(40);
        aggregator.setFormulaHealth(20);
        aggregator.setPerformance(20);
        aggregator.setStructure(20);

        HealthSubScores ideal = subScores(100, 0, 0, false, Level.LOW, Level.LOW, true, 100);
        assertEquals(132, aggregator.calculateScore(ideal));

        HealthSubScores mixed = subScores(50, 2, 0, true, Level.LOW, Level.MEDIUM, true, 50);
        // (40 + 80) * 0.4 + 80 * 0.2 + 70 * 0.2 + 50 * 0.2
        assertEquals(88, aggregator.calculateScore(mixed));
    }

    @Test
    void testAllRecommendationsInOrder() {
        HealthSubScores troubled = subScores(40, 3, 2, true, Level.HIGH, Level.HIGH, false, 25);

        List<String> recommendations = aggregator.recommendations(troubled);

        assertEquals(List.of(
            "Improve data completeness - consider making key fields required",
            "Remove or populate 2 empty columns",
            "Consider archiving old data or splitting into multiple sheets for better performance",
            "Add status tracking column for better project visibility",
            "Review complex formulas for optimization opportunities"
        ), recommendations);
    }

    @Test
    void testMediumLevelsDoNotRecommend() {
        HealthSubScores moderate = subScores(80, 0, 0, true, Level.MEDIUM, Level.MEDIUM, true, 75);

        assertTrue(aggregator.recommendations(moderate).isEmpty());
    }

    @Test
    void testAggregateIsDeterministic() {
        HealthSubScores subScores = subScores(66.67, 1, 1, false, Level.LOW, Level.LOW, false, 50);

        HealthReport first = aggregator.aggregate("sheet-1", subScores);
        HealthReport second = aggregator.aggregate("sheet-1", subScores);

        assertEquals("sheet-1", first.getSheetId());
        assertEquals(first.getOverallScore(), second.getOverallScore());
        assertEquals(first.getRecommendations(), second.getRecommendations());
        assertSame(subScores, first.getSubScores());
        assertNotNull(first.getGeneratedAt());
    }

    static HealthSubScores subScores(double completeness, int issues, int emptyColumns,
                                     boolean hasFormulas, Level formulaComplexity,
                                     Level performanceRisk, boolean hasStatus, double structureCompleteness) {
        return HealthSubScores.builder()
            .dataQuality(DataQuality.builder()
                .completenessPct(completeness)
                .consistencyIssues(issues)
                .emptyColumnCount(emptyColumns)
                .build())
            .formulaHealth(FormulaHealth.builder()
                .formulaColumnCount(hasFormulas ? 1 : 0)
                .hasFormulas(hasFormulas)
                .complexity(formulaComplexity)
                .build())
            .performance(PerformanceMetrics.builder()
                .performanceRisk(performanceRisk)
                .sizeCategory(SizeCategory.SMALL)
                .build())
            .structure(StructureHealth.builder()
                .hasStatus(hasStatus)
                .completenessPct(structureCompleteness)
                .build())
            .build();
    }
}
