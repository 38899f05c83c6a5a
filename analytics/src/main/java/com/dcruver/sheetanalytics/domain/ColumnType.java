package com.dcruver.sheetanalytics.domain;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Declared column types as reported by Smartsheet.
 */
public enum ColumnType {
    TEXT_NUMBER,
    DATE,
    DATETIME,
    ABSTRACT_DATETIME,
    CONTACT_LIST,
    MULTI_CONTACT_LIST,
    CHECKBOX,
    PICKLIST,
    MULTI_PICKLIST,
    DURATION,
    PREDECESSOR,
    AUTO_NUMBER,
    CREATED_DATE,
    MODIFIED_DATE,
    CREATED_BY,
    MODIFIED_BY,
    FORMULA,

    /**
     * Type name not recognised by this client
     */
    UNKNOWN;

    private static final Set<ColumnType> DATE_TYPES = EnumSet.of(DATE, DATETIME, ABSTRACT_DATETIME);
    private static final Set<ColumnType> CONTACT_TYPES = EnumSet.of(CONTACT_LIST, MULTI_CONTACT_LIST);

    public boolean isDateLike() {
        return DATE_TYPES.contains(this);
    }

    public boolean isContact() {
        return CONTACT_TYPES.contains(this);
    }

    /**
     * Resolve a type name from the API. Missing names default to TEXT_NUMBER,
     * which is what Smartsheet assumes for untyped columns.
     */
    public static ColumnType fromName(String name) {
        if (name == null || name.isBlank()) {
            return TEXT_NUMBER;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
