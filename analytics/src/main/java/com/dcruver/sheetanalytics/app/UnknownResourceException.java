package com.dcruver.sheetanalytics.app;

public class UnknownResourceException extends RuntimeException {

    public UnknownResourceException(String uri) {
        super("Unknown resource URI: " + uri);
    }
}
