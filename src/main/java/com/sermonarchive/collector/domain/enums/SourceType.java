package com.sermonarchive.collector.domain.enums;

public enum SourceType {
    /** Paginated HTML listing, one request per page. */
    PAGE_SCRAPE,
    /** Single RSS/podcast XML document. */
    FEED
}
