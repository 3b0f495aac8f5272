package com.sermonarchive.collector.domain.enums;

public enum CandidateOutcome {
    INSERTED,
    DUPLICATE,
    FAILED
}
