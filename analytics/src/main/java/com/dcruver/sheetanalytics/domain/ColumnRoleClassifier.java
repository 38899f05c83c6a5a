package com.dcruver.sheetanalytics.domain;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns semantic roles to columns by walking each role's signature table.
 * Classification is best-effort and never fails; unmatched roles stay absent.
 */
@Component
public class ColumnRoleClassifier {

    public ColumnRoleMap classify(List<ColumnDescriptor> columns) {
        Map<ColumnRole, ColumnDescriptor> resolved = new EnumMap<>(ColumnRole.class);

        for (ColumnRole role : ColumnRole.values()) {
            ColumnDescriptor match = findFirst(role, columns);
            if (match != null) {
                resolved.put(role, match);
            }
        }

        return new ColumnRoleMap(resolved);
    }

    private ColumnDescriptor findFirst(ColumnRole role, List<ColumnDescriptor> columns) {
        for (ColumnSignature signature : role.getSignatures()) {
            for (ColumnDescriptor column : columns) {
                if (signature.test(column)) {
                    return column;
                }
            }
        }
        return null;
    }
}
