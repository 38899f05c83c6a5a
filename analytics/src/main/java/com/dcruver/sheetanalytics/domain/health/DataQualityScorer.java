package com.dcruver.sheetanalytics.domain.health;

import com.dcruver.sheetanalytics.domain.CellValues;
import com.dcruver.sheetanalytics.domain.ColumnDescriptor;
import com.dcruver.sheetanalytics.domain.RawSnapshot;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Measures how filled-in and well-formed the delivered rows are.
 */
@Component
public class DataQualityScorer {

    public DataQuality score(RawSnapshot snapshot) {
        List<ColumnDescriptor> columns = snapshot.getColumns();
        List<Map<String, Object>> rows = snapshot.getRows();

        long totalCells = (long) columns.size() * rows.size();
        long filledCells = 0;
        int consistencyIssues = 0;
        int emptyColumns = 0;

        for (ColumnDescriptor column : columns) {
            boolean dateTyped = column.getDeclaredType() != null && column.getDeclaredType().isDateLike();
            int filled = 0;

            for (Map<String, Object> row : rows) {
                Object value = row.get(column.getTitle());
                if (CellValues.isEmpty(value)) {
                    continue;
                }
                filled++;
                if (dateTyped && !CellValues.isParsableDate(value)) {
                    consistencyIssues++;
                }
            }

            filledCells += filled;
            if (filled == 0) {
                emptyColumns++;
            }
        }

        return DataQuality.builder()
            .completenessPct(totalCells > 0 ? (double) filledCells / totalCells * 100 : 0)
            .consistencyIssues(consistencyIssues)
            .emptyColumnCount(emptyColumns)
            .build();
    }
}
