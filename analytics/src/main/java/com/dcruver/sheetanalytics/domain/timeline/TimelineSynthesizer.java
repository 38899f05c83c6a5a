package com.dcruver.sheetanalytics.domain.timeline;

import com.dcruver.sheetanalytics.domain.CellValues;
import com.dcruver.sheetanalytics.domain.DerivedTask;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Derives the project timeline, overall date range and milestone list from tasks.
 */
@Component
public class TimelineSynthesizer {

    private static final List<String> MILESTONE_KEYWORDS = List.of("milestone", "kickoff", "delivery", "launch");
    private static final String ZERO_DURATION = "0d";

    public Timeline synthesize(List<DerivedTask> tasks) {
        List<DerivedTask> dated = tasks.stream()
            .filter(DerivedTask::hasDates)
            .toList();

        if (dated.isEmpty()) {
            return Timeline.empty();
        }

        DateRange range = dateRange(dated);

        // Each bound comes from its own kind of date; a missing or inverted
        // bound is widened from the overall range so start never passes end.
        LocalDate projectStart = dated.stream()
            .map(DerivedTask::getStart)
            .filter(Objects::nonNull)
            .min(Comparator.naturalOrder())
            .orElse(range.getEarliest());
        LocalDate projectEnd = dated.stream()
            .map(DerivedTask::getEnd)
            .filter(Objects::nonNull)
            .max(Comparator.naturalOrder())
            .orElse(range.getLatest());
        if (projectEnd.isBefore(projectStart)) {
            projectEnd = range.getLatest();
        }

        List<Milestone> milestones = tasks.stream()
            .filter(this::isMilestone)
            .map(task -> Milestone.builder()
                .name(task.getName())
                .date(task.getStart() != null ? task.getStart() : task.getEnd())
                .type(MilestoneType.fromTaskName(task.getName()))
                .build())
            .toList();

        return Timeline.builder()
            .projectStart(projectStart)
            .projectEnd(projectEnd)
            .spanDays(ChronoUnit.DAYS.between(projectStart, projectEnd))
            .milestones(milestones)
            .build();
    }

    /**
     * Earliest and latest of all start and end dates.
     */
    public DateRange dateRange(List<DerivedTask> tasks) {
        List<LocalDate> dates = tasks.stream()
            .flatMap(task -> Stream.of(task.getStart(), task.getEnd()))
            .filter(Objects::nonNull)
            .sorted()
            .toList();

        if (dates.isEmpty()) {
            return DateRange.empty();
        }

        LocalDate earliest = dates.get(0);
        LocalDate latest = dates.get(dates.size() - 1);
        return DateRange.builder()
            .earliest(earliest)
            .latest(latest)
            .spanDays(ChronoUnit.DAYS.between(earliest, latest))
            .build();
    }

    boolean isMilestone(DerivedTask task) {
        String duration = task.getDuration();
        if (ZERO_DURATION.equals(duration)) {
            return true;
        }
        Double numeric = Optional.ofNullable(duration).map(CellValues::asNumber).orElse(null);
        if (numeric != null && numeric == 0) {
            return true;
        }
        String name = task.getName().toLowerCase(Locale.ROOT);
        return MILESTONE_KEYWORDS.stream().anyMatch(name::contains);
    }
}
