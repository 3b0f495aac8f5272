package com.sermonarchive.collector.exception;

/**
 * Thrown when the metadata store cannot be reached; aborts the current pass.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
