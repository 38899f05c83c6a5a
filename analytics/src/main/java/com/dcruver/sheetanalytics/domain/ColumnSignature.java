package com.dcruver.sheetanalytics.domain;

import java.util.function.Predicate;

/**
 * A single matching rule used to recognise a column's role.
 */
@FunctionalInterface
public interface ColumnSignature extends Predicate<ColumnDescriptor> {

    static ColumnSignature primary() {
        return ColumnDescriptor::isPrimary;
    }

    static ColumnSignature titleContains(String fragment) {
        return column -> column.titleContains(fragment);
    }

    static ColumnSignature typed(ColumnType type) {
        return column -> column.getDeclaredType() == type;
    }

    static ColumnSignature dateTitled(String fragment) {
        return column -> column.getDeclaredType() != null
            && column.getDeclaredType().isDateLike()
            && column.titleContains(fragment);
    }

    static ColumnSignature contact() {
        return column -> column.getDeclaredType() != null && column.getDeclaredType().isContact();
    }

    static ColumnSignature anyOf(ColumnSignature first, ColumnSignature second) {
        return column -> first.test(column) || second.test(column);
    }
}
