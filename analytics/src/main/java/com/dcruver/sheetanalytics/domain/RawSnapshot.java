package com.dcruver.sheetanalytics.domain;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of a sheet as delivered by the data source.
 * Row maps are keyed by column title; cell values are String, Number, Boolean or null.
 */
@Data
@Builder
public class RawSnapshot {
    private final String sheetId;
    private final String name;
    private final Instant modifiedAt;
    private final List<ColumnDescriptor> columns;
    private final List<Map<String, Object>> rows;

    /**
     * Total rows in the sheet, which may exceed the rows delivered
     */
    private final int rowCount;

    public int getColumnCount() {
        return columns.size();
    }
}
