package com.sermonarchive.collector.domain.dto;

import com.sermonarchive.collector.domain.enums.SourceType;

/**
 * Where a pass reads its candidates from. For {@link SourceType#PAGE_SCRAPE} the url is the
 * listing base and page {@code n} lives at {@code url + n + "/"}; {@code maxPages} is ignored for feeds.
 */
public record SourceDescriptor(SourceType type, String url, int maxPages) {

    public static SourceDescriptor feed(String url) {
        return new SourceDescriptor(SourceType.FEED, url, 1);
    }

    public static SourceDescriptor pages(String baseUrl, int maxPages) {
        return new SourceDescriptor(SourceType.PAGE_SCRAPE, baseUrl, maxPages);
    }
}
