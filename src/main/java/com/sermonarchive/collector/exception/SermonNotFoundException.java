package com.sermonarchive.collector.exception;

public class SermonNotFoundException extends RuntimeException {

    public SermonNotFoundException(String id) {
        super("Sermon not found: " + id);
    }
}
