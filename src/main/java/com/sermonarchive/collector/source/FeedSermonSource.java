package com.sermonarchive.collector.source;

import com.rometools.rome.feed.synd.SyndCategory;
import com.rometools.rome.feed.synd.SyndEnclosure;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import com.sermonarchive.collector.domain.dto.SermonCandidateDto;
import com.sermonarchive.collector.domain.dto.SourceDescriptor;
import com.sermonarchive.collector.domain.enums.SourceType;
import com.sermonarchive.collector.exception.SourceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Slf4j
@Component
public class FeedSermonSource implements SermonSource {

    @Value("${crawler.user-agent:SermonArchiveCollector/1.0}")
    private String userAgent;

    @Value("${crawler.feed-timeout-seconds:15}")
    private int feedTimeoutSeconds;

    private final HttpClient httpClient = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(7))
            .version(HttpClient.Version.HTTP_1_1)
            .build();

    @Override
    public SourceType type() {
        return SourceType.FEED;
    }

    @Override
    public List<SermonCandidateDto> fetchCandidates(SourceDescriptor descriptor) {
        String feedUrl = descriptor.url();
        if (feedUrl == null || feedUrl.isBlank()) {
            throw new SourceUnavailableException("Feed url is not configured", null);
        }

        log.info("Feed: fetching feedUrl={}", feedUrl);
        long t0 = System.currentTimeMillis();

        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(feedUrl.trim()))
                    .timeout(Duration.ofSeconds(feedTimeoutSeconds))
                    .GET()
                    .header("User-Agent", userAgent)
                    .header("Accept", "application/rss+xml, application/xml;q=0.9, text/xml;q=0.8, */*;q=0.1")
                    .build();

            HttpResponse<InputStream> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofInputStream());
            int status = resp.statusCode();
            if (status < 200 || status >= 300) {
                throw new SourceUnavailableException("Feed fetch non-2xx status=" + status + " feedUrl=" + feedUrl, null);
            }

            List<SermonCandidateDto> out = new ArrayList<>();
            int seen = 0;

            try (InputStream is = resp.body(); XmlReader reader = new XmlReader(is)) {
                SyndFeed feed = new SyndFeedInput().build(reader);

                for (SyndEntry entry : feed.getEntries()) {
                    seen++;
                    String audioUrl = audioEnclosureUrl(entry);
                    if (audioUrl == null) {
                        log.debug("Feed: skip item without audio enclosure title='{}'", entry.getTitle());
                        continue;
                    }

                    List<String> categories = entry.getCategories().stream()
                            .map(SyndCategory::getName)
                            .toList();

                    out.add(SermonCandidateDto.of(entry.getTitle(), audioUrl, categories));
                }
            }

            log.info("Feed: done feedUrl={} items={} candidates={} tookMs={}",
                    feedUrl, seen, out.size(), System.currentTimeMillis() - t0);
            return out;

        } catch (SourceUnavailableException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException("Interrupted while fetching feedUrl=" + feedUrl, e);
        } catch (Exception e) {
            throw new SourceUnavailableException("Failed to read feed feedUrl=" + feedUrl, e);
        }
    }

    private static String audioEnclosureUrl(SyndEntry entry) {
        for (SyndEnclosure enclosure : entry.getEnclosures()) {
            String type = enclosure.getType();
            String url = enclosure.getUrl();
            if (type != null && type.toLowerCase(Locale.ROOT).startsWith("audio/") && url != null && !url.isBlank()) {
                return url.trim();
            }
        }
        return null;
    }
}
