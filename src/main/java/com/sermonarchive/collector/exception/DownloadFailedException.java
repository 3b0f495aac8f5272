package com.sermonarchive.collector.exception;

public class DownloadFailedException extends RuntimeException {

    public DownloadFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
