package com.sermonarchive.collector.exception;

public class IngestionAlreadyRunningException extends RuntimeException {

    public IngestionAlreadyRunningException() {
        super("An ingestion pass is already running");
    }
}
