package com.dcruver.sheetanalytics.io;

import com.dcruver.sheetanalytics.domain.RawSnapshot;

/**
 * Boundary to the spreadsheet service. Calls may be slow and may fail;
 * failures surface as {@link SheetFetchException}.
 */
public interface SheetDataSource {

    RawSnapshot fetchSnapshot(String sheetId);

    WorkspaceListing fetchWorkspace(String workspaceId);
}
