package com.dcruver.sheetanalytics.domain.health;

import com.dcruver.sheetanalytics.domain.ColumnDescriptor;
import com.dcruver.sheetanalytics.domain.ColumnType;
import com.dcruver.sheetanalytics.domain.RawSnapshot;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;

@Component
public class StructureScorer {

    public StructureHealth score(RawSnapshot snapshot) {
        List<ColumnDescriptor> columns = snapshot.getColumns();

        boolean projectPlan = anyColumn(columns, column -> column.getDeclaredType() == ColumnType.PREDECESSOR);
        boolean hasDates = anyColumn(columns, column -> column.getDeclaredType() != null
            && column.getDeclaredType().isDateLike());
        boolean hasAssignments = anyColumn(columns, column -> column.getDeclaredType() != null
            && column.getDeclaredType().isContact());
        boolean hasStatus = anyColumn(columns, column -> column.getDeclaredType() == ColumnType.PICKLIST);

        long present = Stream.of(projectPlan, hasDates, hasAssignments, hasStatus)
            .filter(Boolean::booleanValue)
            .count();

        return StructureHealth.builder()
            .projectPlan(projectPlan)
            .hasDates(hasDates)
            .hasAssignments(hasAssignments)
            .hasStatus(hasStatus)
            .completenessPct(present / 4.0 * 100)
            .build();
    }

    private static boolean anyColumn(List<ColumnDescriptor> columns, Predicate<ColumnDescriptor> test) {
        return columns.stream().anyMatch(test);
    }
}
