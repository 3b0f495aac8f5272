package com.sermonarchive.collector.domain.enums;

public enum IngestionStatus {
    RUNNING,
    SUCCESS,
    PARTIAL,
    SOURCE_UNAVAILABLE,
    FAILED
}
