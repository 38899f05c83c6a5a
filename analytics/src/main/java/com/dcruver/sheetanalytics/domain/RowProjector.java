package com.dcruver.sheetanalytics.domain;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts raw rows into derived tasks using resolved column roles.
 */
@Component
public class RowProjector {

    /**
     * Project every row of a snapshot. Rows whose task name is empty or
     * whitespace-only are dropped. Returns an empty list when no task name
     * column was resolved.
     */
    public List<DerivedTask> project(List<Map<String, Object>> rows, ColumnRoleMap roles) {
        if (!roles.has(ColumnRole.TASK_NAME)) {
            return List.of();
        }

        List<DerivedTask> tasks = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            DerivedTask task = projectRow(i + 1, rows.get(i), roles);
            if (task != null) {
                tasks.add(task);
            }
        }
        return tasks;
    }

    /**
     * Build a task for one row, or null if the row has a blank name.
     */
    public DerivedTask projectRow(int position, Map<String, Object> row, ColumnRoleMap roles) {
        Object rawName = cell(row, roles, ColumnRole.TASK_NAME);
        String name = rawName != null ? CellValues.asText(rawName) : "Task " + position;
        if (name.isBlank()) {
            return null;
        }

        return DerivedTask.builder()
            .id(position)
            .name(name)
            .start(CellValues.asDate(cell(row, roles, ColumnRole.START)))
            .end(CellValues.asDate(cell(row, roles, ColumnRole.FINISH)))
            .duration(CellValues.asText(cell(row, roles, ColumnRole.DURATION)))
            .dependencies(textOrNull(cell(row, roles, ColumnRole.PREDECESSOR)))
            .assignee(textOrNull(cell(row, roles, ColumnRole.ASSIGNEE)))
            .progress(progressOf(cell(row, roles, ColumnRole.PROGRESS)))
            .build();
    }

    /**
     * Progress as a percentage: "75%" is 75, a fraction such as 0.5 is 50,
     * any larger number is taken as-is. Everything else counts as no progress.
     */
    static int progressOf(Object value) {
        if (value instanceof String && ((String) value).contains("%")) {
            return leadingInteger(((String) value).replace("%", "").trim());
        }
        if (value instanceof Number) {
            double progress = ((Number) value).doubleValue();
            if (progress == 0) {
                return 0;
            }
            return (int) Math.round(progress > 1 ? progress : progress * 100);
        }
        return 0;
    }

    private static int leadingInteger(String text) {
        int end = 0;
        if (end < text.length() && (text.charAt(end) == '-' || text.charAt(end) == '+')) {
            end++;
        }
        while (end < text.length() && Character.isDigit(text.charAt(end))) {
            end++;
        }
        String digits = text.substring(0, end);
        if (digits.isEmpty() || digits.equals("-") || digits.equals("+")) {
            return 0;
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static Object cell(Map<String, Object> row, ColumnRoleMap roles, ColumnRole role) {
        String title = roles.titleOf(role);
        return title != null && row != null ? row.get(title) : null;
    }

    private static String textOrNull(Object value) {
        return CellValues.isEmpty(value) ? null : CellValues.asText(value);
    }
}
