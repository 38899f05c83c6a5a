package com.dcruver.sheetanalytics.domain;

import lombok.Builder;
import lombok.Data;

import java.util.Locale;

/**
 * Column metadata from a sheet snapshot. Titles are unique within a sheet.
 */
@Data
@Builder
public class ColumnDescriptor {
    private final String title;
    private final ColumnType declaredType;
    private final boolean primary;

    // Column formula text, if the column carries one
    private final String formula;

    public boolean titleContains(String fragment) {
        return title != null && title.toLowerCase(Locale.ROOT).contains(fragment);
    }

    public boolean isFormulaColumn() {
        return declaredType == ColumnType.FORMULA || (formula != null && !formula.isBlank());
    }

    public static ColumnDescriptor of(String title, ColumnType type) {
        return ColumnDescriptor.builder().title(title).declaredType(type).build();
    }
}
