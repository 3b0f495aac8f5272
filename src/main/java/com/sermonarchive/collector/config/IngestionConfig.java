package com.sermonarchive.collector.config;

import com.sermonarchive.collector.domain.dto.SourceDescriptor;
import com.sermonarchive.collector.domain.enums.SourceType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class IngestionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public SourceDescriptor defaultSourceDescriptor(
            @Value("${sermons.source.type:PAGE_SCRAPE}") SourceType type,
            @Value("${sermons.source.page-url:https://tcfky.com/sermons/page/}") String pageUrl,
            @Value("${sermons.source.max-pages:37}") int maxPages,
            @Value("${sermons.source.feed-url:}") String feedUrl
    ) {
        return switch (type) {
            case PAGE_SCRAPE -> SourceDescriptor.pages(pageUrl, maxPages);
            case FEED -> SourceDescriptor.feed(feedUrl);
        };
    }
}
