package com.sermonarchive.collector.exception;

/**
 * Thrown when a whole source (page listing or feed) cannot be retrieved or parsed.
 */
public class SourceUnavailableException extends RuntimeException {

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
