package com.dcruver.sheetanalytics.domain;

import java.util.List;

import static com.dcruver.sheetanalytics.domain.ColumnSignature.*;

/**
 * Semantic roles a column can play in a project plan.
 * Each role lists its signatures in priority order; a later signature is only
 * consulted when no column matches an earlier one.
 */
public enum ColumnRole {
    TASK_NAME(primary(), titleContains("task")),
    START(dateTitled("start")),
    FINISH(dateTitled("finish")),
    DURATION(typed(ColumnType.DURATION)),
    PREDECESSOR(typed(ColumnType.PREDECESSOR)),
    ASSIGNEE(contact()),
    STATUS(titleContains("status"), typed(ColumnType.PICKLIST)),
    PROGRESS(anyOf(titleContains("progress"), titleContains("complete")));

    private final List<ColumnSignature> signatures;

    ColumnRole(ColumnSignature... signatures) {
        this.signatures = List.of(signatures);
    }

    public List<ColumnSignature> getSignatures() {
        return signatures;
    }
}
