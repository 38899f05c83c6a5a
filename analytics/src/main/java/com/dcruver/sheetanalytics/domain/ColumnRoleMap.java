package com.dcruver.sheetanalytics.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolved role assignments for one snapshot. Each role maps to at most one column;
 * an absent role means the corresponding feature is unavailable for the sheet.
 */
public class ColumnRoleMap {

    private final Map<ColumnRole, ColumnDescriptor> columns;

    public ColumnRoleMap(Map<ColumnRole, ColumnDescriptor> columns) {
        this.columns = columns.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(columns));
    }

    public Optional<ColumnDescriptor> get(ColumnRole role) {
        return Optional.ofNullable(columns.get(role));
    }

    public boolean has(ColumnRole role) {
        return columns.containsKey(role);
    }

    /**
     * Title of the column holding the role, or null when unresolved
     */
    public String titleOf(ColumnRole role) {
        ColumnDescriptor column = columns.get(role);
        return column != null ? column.getTitle() : null;
    }

    public Map<ColumnRole, ColumnDescriptor> asMap() {
        return columns;
    }
}
