package com.dcruver.sheetanalytics.io;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class WorkspaceListing {
    private final String workspaceId;
    private final String name;
    private final List<SheetRef> sheets;

    @Data
    @Builder
    public static class SheetRef {
        private final String sheetId;
        private final String name;
        private final Instant modifiedAt;
    }
}
