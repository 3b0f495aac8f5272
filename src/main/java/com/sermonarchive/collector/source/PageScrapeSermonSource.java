package com.sermonarchive.collector.source;

import com.sermonarchive.collector.domain.dto.SermonCandidateDto;
import com.sermonarchive.collector.domain.dto.SourceDescriptor;
import com.sermonarchive.collector.domain.enums.SourceType;
import com.sermonarchive.collector.exception.SourceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Scrapes the paginated sermon listing. Each sermon is a {@code div.fusion-post-timeline} block.
 */
@Slf4j
@Component
public class PageScrapeSermonSource implements SermonSource {

    @Value("${crawler.browser-user-agent:Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/119.0.0.0 Safari/537.36}")
    private String userAgent;

    @Value("${crawler.page-timeout-seconds:20}")
    private int pageTimeoutSeconds;

    private final HttpClient httpClient = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(7))
            .version(HttpClient.Version.HTTP_1_1)
            .build();

    @Override
    public SourceType type() {
        return SourceType.PAGE_SCRAPE;
    }

    @Override
    public List<SermonCandidateDto> fetchCandidates(SourceDescriptor descriptor) {
        String baseUrl = descriptor.url();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new SourceUnavailableException("Page listing url is not configured", null);
        }

        int maxPages = Math.max(1, descriptor.maxPages());
        List<SermonCandidateDto> out = new ArrayList<>();
        long t0 = System.currentTimeMillis();
        int pagesRead = 0;

        for (int page = 1; page <= maxPages; page++) {
            String pageUrl = pageUrl(baseUrl, page);
            log.info("Pages: fetching page={} url={}", page, pageUrl);

            HttpResponse<String> resp;
            try {
                resp = httpClient.send(buildRequest(pageUrl), HttpResponse.BodyHandlers.ofString());
            } catch (IOException | IllegalArgumentException e) {
                if (page == 1) {
                    throw new SourceUnavailableException("Failed to fetch first listing page url=" + pageUrl, e);
                }
                log.warn("Pages: request failed page={} url={} err={}; keeping {} candidates",
                        page, pageUrl, e.toString(), out.size());
                break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SourceUnavailableException("Interrupted while fetching url=" + pageUrl, e);
            }

            int status = resp.statusCode();
            if (status < 200 || status >= 300) {
                log.info("Pages: page={} returned status={}, treating as end of listing", page, status);
                break;
            }

            List<SermonCandidateDto> found = extract(resp.body(), pageUrl);
            if (found.isEmpty()) {
                log.info("Pages: no sermons on page={}, stopping", page);
                break;
            }

            pagesRead++;
            out.addAll(found);
            log.debug("Pages: page={} candidates={}", page, found.size());
        }

        log.info("Pages: done pages={} candidates={} tookMs={}", pagesRead, out.size(), System.currentTimeMillis() - t0);
        return out;
    }

    List<SermonCandidateDto> extract(String html, String pageUrl) {
        if (html == null || html.isBlank()) return List.of();

        Document doc = Jsoup.parse(html, pageUrl);
        List<SermonCandidateDto> out = new ArrayList<>();

        for (Element block : doc.select("div.fusion-post-timeline")) {
            Element titleEl = block.selectFirst("h2.entry-title");
            String title = titleEl != null ? titleEl.text() : null;

            List<String> categories = block.select("a[rel]").stream()
                    .filter(a -> "category tag".equals(a.attr("rel")))
                    .map(Element::text)
                    .toList();

            Element source = block.selectFirst("audio.wp-audio-shortcode source[src]");
            if (source == null) {
                log.debug("Pages: skip block without audio title='{}' url={}", title, pageUrl);
                continue;
            }
            String audioUrl = source.absUrl("src");
            if (audioUrl.isBlank()) audioUrl = source.attr("src");

            SermonCandidateDto candidate = SermonCandidateDto.of(title, audioUrl, categories);
            if (candidate.getAudioUrl() != null) {
                out.add(candidate);
            }
        }
        return out;
    }

    private HttpRequest buildRequest(String pageUrl) {
        return HttpRequest.newBuilder()
                .uri(URI.create(pageUrl))
                .timeout(Duration.ofSeconds(pageTimeoutSeconds))
                .GET()
                .header("User-Agent", userAgent)
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.9")
                .build();
    }

    static String pageUrl(String baseUrl, int page) {
        String base = baseUrl.trim();
        if (!base.endsWith("/")) base = base + "/";
        return base + page + "/";
    }
}
