package com.dcruver.sheetanalytics.domain.dependency;

import com.dcruver.sheetanalytics.domain.DerivedTask;
import com.dcruver.sheetanalytics.domain.Level;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Tallies predecessor references across tasks and flags heavily cited tasks.
 */
@Component
public class DependencyAnalyzer {

    static final int BOTTLENECK_THRESHOLD = 2;
    static final int HIGH_RISK_THRESHOLD = 4;
    private static final int CRITICAL_TASK_LIMIT = 5;

    public DependencyAnalysis analyze(List<DerivedTask> tasks) {
        List<DependencyEntry> entries = tasks.stream()
            .filter(task -> task.getDependencies() != null)
            .map(this::toEntry)
            .toList();

        if (entries.isEmpty()) {
            return DependencyAnalysis.empty();
        }

        return DependencyAnalysis.builder()
            .totalDependentTasks(entries.size())
            .dependencyMap(entries)
            .hasCriticalPath(true)
            .criticalTasks(entries.stream().limit(CRITICAL_TASK_LIMIT).toList())
            .bottlenecks(findBottlenecks(entries, tasks))
            .build();
    }

    /**
     * Identifiers cited more than twice, in order of first citation.
     */
    List<DependencyBottleneck> findBottlenecks(List<DependencyEntry> entries, List<DerivedTask> tasks) {
        Map<String, Integer> citations = new LinkedHashMap<>();
        for (DependencyEntry entry : entries) {
            for (String reference : entry.getDependencies()) {
                citations.merge(reference, 1, Integer::sum);
            }
        }

        Map<String, String> namesById = tasks.stream()
            .collect(Collectors.toMap(task -> String.valueOf(task.getId()), DerivedTask::getName,
                (first, second) -> first));

        return citations.entrySet().stream()
            .filter(citation -> citation.getValue() > BOTTLENECK_THRESHOLD)
            .map(citation -> DependencyBottleneck.builder()
                .taskId(citation.getKey())
                .taskName(namesById.getOrDefault(citation.getKey(), "Task " + citation.getKey()))
                .blockingCount(citation.getValue())
                .riskLevel(riskLevel(citation.getValue()))
                .build())
            .toList();
    }

    static Level riskLevel(int blockingCount) {
        return Level.classify(blockingCount, BOTTLENECK_THRESHOLD, HIGH_RISK_THRESHOLD);
    }

    private DependencyEntry toEntry(DerivedTask task) {
        String raw = task.getDependencies();
        return DependencyEntry.builder()
            .taskId(task.getId())
            .taskName(task.getName())
            .dependencies(Arrays.stream(raw.split(","))
                .map(String::trim)
                .toList())
            .dependencyType(DependencyType.infer(raw))
            .build();
    }
}
