package com.dcruver.sheetanalytics.io;

/**
 * The data source could not produce a sheet snapshot or workspace listing.
 */
public class SheetFetchException extends RuntimeException {

    private final String resourceId;

    public SheetFetchException(String resourceId, String message) {
        super(message);
        this.resourceId = resourceId;
    }

    public SheetFetchException(String resourceId, String message, Throwable cause) {
        super(message, cause);
        this.resourceId = resourceId;
    }

    /**
     * Sheet or workspace identifier the fetch was for
     */
    public String getResourceId() {
        return resourceId;
    }
}
