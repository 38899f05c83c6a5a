package com.dcruver.sheetanalytics.app;

import com.dcruver.sheetanalytics.domain.ColumnRole;
import com.dcruver.sheetanalytics.domain.ColumnRoleClassifier;
import com.dcruver.sheetanalytics.domain.ColumnRoleMap;
import com.dcruver.sheetanalytics.domain.DerivedTask;
import com.dcruver.sheetanalytics.domain.RawSnapshot;
import com.dcruver.sheetanalytics.domain.RowProjector;
import com.dcruver.sheetanalytics.domain.dependency.DependencyAnalysis;
import com.dcruver.sheetanalytics.domain.dependency.DependencyAnalyzer;
import com.dcruver.sheetanalytics.domain.health.CompositeHealthAggregator;
import com.dcruver.sheetanalytics.domain.health.DataQualityScorer;
import com.dcruver.sheetanalytics.domain.health.FormulaHealthScorer;
import com.dcruver.sheetanalytics.domain.health.HealthReport;
import com.dcruver.sheetanalytics.domain.health.HealthSubScores;
import com.dcruver.sheetanalytics.domain.health.PerformanceScorer;
import com.dcruver.sheetanalytics.domain.health.StructureScorer;
import com.dcruver.sheetanalytics.domain.resource.ResourceAnalyzer;
import com.dcruver.sheetanalytics.domain.timeline.TimelineSynthesizer;
import com.dcruver.sheetanalytics.io.SheetDataSource;
import com.dcruver.sheetanalytics.reporting.DependencyMapView;
import com.dcruver.sheetanalytics.reporting.GanttView;
import com.dcruver.sheetanalytics.reporting.SheetSummarizer;
import com.dcruver.sheetanalytics.reporting.SheetSummary;
import com.dcruver.sheetanalytics.workspace.WorkspaceOverview;
import com.dcruver.sheetanalytics.workspace.WorkspaceRollupAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Read-only analytical views over sheets.
 *
 * Every operation fetches one fresh snapshot and runs the derivation stages over it;
 * nothing is cached between calls. Fetch failures propagate as
 * {@link com.dcruver.sheetanalytics.io.SheetFetchException}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SheetAnalyticsService {

    private final SheetDataSource dataSource;
    private final ColumnRoleClassifier classifier;
    private final RowProjector projector;
    private final TimelineSynthesizer timelineSynthesizer;
    private final DependencyAnalyzer dependencyAnalyzer;
    private final ResourceAnalyzer resourceAnalyzer;
    private final DataQualityScorer dataQualityScorer;
    private final FormulaHealthScorer formulaHealthScorer;
    private final PerformanceScorer performanceScorer;
    private final StructureScorer structureScorer;
    private final CompositeHealthAggregator healthAggregator;
    private final SheetSummarizer summarizer;
    private final WorkspaceRollupAggregator workspaceRollup;

    public SheetSummary summary(String sheetId) {
        log.info("Generating summary for sheet {}", sheetId);
        RawSnapshot snapshot = dataSource.fetchSnapshot(sheetId);
        return summarizer.summarize(snapshot, classifier.classify(snapshot.getColumns()));
    }

    public GanttView timeline(String sheetId) {
        log.info("Generating timeline for sheet {}", sheetId);
        RawSnapshot snapshot = dataSource.fetchSnapshot(sheetId);
        ColumnRoleMap roles = classifier.classify(snapshot.getColumns());

        if (!roles.has(ColumnRole.TASK_NAME)) {
            log.info("Sheet {} has no task name column", sheetId);
            return GanttView.withoutTaskColumn(sheetId);
        }

        List<DerivedTask> tasks = projector.project(snapshot.getRows(), roles);
        DependencyAnalysis dependencies = dependencyAnalyzer.analyze(tasks);

        return GanttView.builder()
            .sheetId(sheetId)
            .tasks(tasks)
            .timeline(timelineSynthesizer.synthesize(tasks))
            .hasCriticalPath(dependencies.isHasCriticalPath())
            .criticalTasks(dependencies.getCriticalTasks())
            .dependencyBottlenecks(dependencies.getBottlenecks())
            .resourceUtilization(resourceAnalyzer.analyze(tasks))
            .metadata(GanttView.Metadata.builder()
                .totalTasks(tasks.size())
                .hasDependencies(roles.has(ColumnRole.PREDECESSOR))
                .hasResources(roles.has(ColumnRole.ASSIGNEE))
                .dateRange(timelineSynthesizer.dateRange(tasks))
                .build())
            .generatedAt(Instant.now())
            .build();
    }

    public DependencyMapView dependencyMap(String sheetId) {
        log.info("Generating dependency map for sheet {}", sheetId);
        RawSnapshot snapshot = dataSource.fetchSnapshot(sheetId);
        ColumnRoleMap roles = classifier.classify(snapshot.getColumns());

        if (!roles.has(ColumnRole.PREDECESSOR)) {
            return DependencyMapView.withoutDependencyColumn(sheetId);
        }
        if (!roles.has(ColumnRole.TASK_NAME)) {
            return DependencyMapView.withoutTaskColumn(sheetId);
        }

        List<DerivedTask> tasks = projector.project(snapshot.getRows(), roles);
        return DependencyMapView.builder()
            .sheetId(sheetId)
            .hasDependencies(true)
            .dependencyAnalysis(dependencyAnalyzer.analyze(tasks))
            .generatedAt(Instant.now())
            .build();
    }

    public HealthReport healthReport(String sheetId) {
        log.info("Generating health report for sheet {}", sheetId);
        RawSnapshot snapshot = dataSource.fetchSnapshot(sheetId);

        HealthSubScores subScores = HealthSubScores.builder()
            .dataQuality(dataQualityScorer.score(snapshot))
            .formulaHealth(formulaHealthScorer.score(snapshot))
            .performance(performanceScorer.score(snapshot))
            .structure(structureScorer.score(snapshot))
            .build();

        return healthAggregator.aggregate(sheetId, subScores);
    }

    public WorkspaceOverview workspaceOverview(String workspaceId) {
        log.info("Generating overview for workspace {}", workspaceId);
        return workspaceRollup.rollup(workspaceId);
    }
}
