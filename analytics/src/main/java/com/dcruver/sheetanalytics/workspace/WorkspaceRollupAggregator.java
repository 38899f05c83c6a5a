package com.dcruver.sheetanalytics.workspace;

import com.dcruver.sheetanalytics.domain.ColumnRoleClassifier;
import com.dcruver.sheetanalytics.domain.ColumnRoleMap;
import com.dcruver.sheetanalytics.domain.RawSnapshot;
import com.dcruver.sheetanalytics.io.SheetDataSource;
import com.dcruver.sheetanalytics.io.WorkspaceListing;
import com.dcruver.sheetanalytics.reporting.SheetSummarizer;
import com.dcruver.sheetanalytics.reporting.SheetSummary;
import com.dcruver.sheetanalytics.reporting.StructureType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Analyzes the sheets of a workspace concurrently and rolls their health up.
 *
 * Each sheet is fetched and analyzed independently; a sheet that fails is
 * recorded with a zero score and does not affect the others.
 */
@Component
@Slf4j
public class WorkspaceRollupAggregator {

    static final int LOW_HEALTH_THRESHOLD = 60;

    private final SheetDataSource dataSource;
    private final ColumnRoleClassifier classifier;
    private final SheetSummarizer summarizer;
    private final SheetScoreCalculator scoreCalculator;
    private final Executor executor;
    private final int maxSheets;

    public WorkspaceRollupAggregator(SheetDataSource dataSource,
                                     ColumnRoleClassifier classifier,
                                     SheetSummarizer summarizer,
                                     SheetScoreCalculator scoreCalculator,
                                     @Qualifier("sheetAnalysisExecutor") Executor executor,
                                     @Value("${analytics.workspace.max-sheets:10}") int maxSheets) {
        this.dataSource = dataSource;
        this.classifier = classifier;
        this.summarizer = summarizer;
        this.scoreCalculator = scoreCalculator;
        this.executor = executor;
        this.maxSheets = maxSheets;
    }

    /**
     * Build the workspace overview. A failure to list the workspace propagates;
     * failures of individual sheets are absorbed into their entries.
     */
    public WorkspaceOverview rollup(String workspaceId) {
        WorkspaceListing listing = dataSource.fetchWorkspace(workspaceId);
        List<WorkspaceListing.SheetRef> sheets = listing.getSheets() != null ? listing.getSheets() : List.of();

        log.info("Analyzing {} of {} sheets in workspace {}",
            Math.min(maxSheets, sheets.size()), sheets.size(), workspaceId);

        List<CompletableFuture<SheetHealthEntry>> futures = sheets.stream()
            .limit(maxSheets)
            .map(sheet -> CompletableFuture.supplyAsync(() -> analyzeSheet(sheet), executor)
                .exceptionally(error -> failedEntry(sheet, error)))
            .toList();

        List<SheetHealthEntry> entries = futures.stream()
            .map(CompletableFuture::join)
            .toList();

        List<SheetHealthEntry> analyzed = entries.stream()
            .filter(entry -> !entry.isFailed())
            .toList();

        double averageHealth = analyzed.stream()
            .mapToInt(SheetHealthEntry::getHealthScore)
            .average()
            .orElse(0.0);

        return WorkspaceOverview.builder()
            .workspaceId(workspaceId)
            .workspaceName(listing.getName() != null ? listing.getName() : "Unknown Workspace")
            .summary(WorkspaceOverview.Summary.builder()
                .totalSheets(sheets.size())
                .analyzedSheets(analyzed.size())
                .failedSheets(entries.size() - analyzed.size())
                .projectPlans(countOfType(entries, StructureType.PROJECT_PLAN))
                .generalSheets(countOfType(entries, StructureType.GENERAL))
                .averageHealthScore(averageHealth)
                .build())
            .sheetAnalysis(entries)
            .recommendations(recommendations(entries))
            .generatedAt(Instant.now())
            .build();
    }

    /**
     * Roll-up findings over all entries, failed ones included.
     */
    List<String> recommendations(List<SheetHealthEntry> entries) {
        List<String> recommendations = new ArrayList<>();

        long lowHealth = entries.stream().filter(entry -> entry.getHealthScore() < LOW_HEALTH_THRESHOLD).count();
        if (lowHealth > 0) {
            recommendations.add(String.format("%d sheets have low health scores and may need attention", lowHealth));
        }

        long empty = entries.stream().filter(entry -> entry.getRowCount() == 0).count();
        if (empty > 0) {
            recommendations.add(String.format("%d sheets appear to be empty and could be archived", empty));
        }

        int projectPlans = countOfType(entries, StructureType.PROJECT_PLAN);
        if (projectPlans > 0) {
            recommendations.add(String.format(
                "Consider creating a portfolio dashboard to track %d project plans", projectPlans));
        }

        return recommendations;
    }

    private SheetHealthEntry analyzeSheet(WorkspaceListing.SheetRef sheet) {
        RawSnapshot snapshot = dataSource.fetchSnapshot(sheet.getSheetId());
        ColumnRoleMap roles = classifier.classify(snapshot.getColumns());
        SheetSummary summary = summarizer.summarize(snapshot, roles);

        return SheetHealthEntry.builder()
            .id(sheet.getSheetId())
            .name(sheet.getName())
            .type(summary.getHealthIndicators().getStructureType())
            .healthScore(scoreCalculator.calculateScore(summary))
            .lastModified(sheet.getModifiedAt())
            .rowCount(summary.getMetadata().getTotalRows())
            .build();
    }

    private SheetHealthEntry failedEntry(WorkspaceListing.SheetRef sheet, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
            ? error.getCause()
            : error;
        log.warn("Failed to analyze sheet {} ({}): {}", sheet.getSheetId(), sheet.getName(), cause.getMessage());

        return SheetHealthEntry.builder()
            .id(sheet.getSheetId())
            .name(sheet.getName())
            .type(StructureType.UNKNOWN)
            .healthScore(0)
            .lastModified(sheet.getModifiedAt())
            .rowCount(0)
            .error(SheetHealthEntry.ANALYSIS_FAILED)
            .build();
    }

    private static int countOfType(List<SheetHealthEntry> entries, StructureType type) {
        return (int) entries.stream().filter(entry -> entry.getType() == type).count();
    }
}
