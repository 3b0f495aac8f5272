package com.sermonarchive.collector.source;

import com.sermonarchive.collector.domain.dto.SermonCandidateDto;
import com.sermonarchive.collector.domain.dto.SourceDescriptor;
import com.sermonarchive.collector.exception.SourceUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FeedSermonSourceTest {

    private static final String FEED_URL = "https://church.example/feed/podcast";

    @Mock HttpClient httpClient;
    @Mock HttpResponse<InputStream> httpResponse;

    FeedSermonSource source;

    @BeforeEach
    void setUp() {
        source = new FeedSermonSource();
        ReflectionTestUtils.setField(source, "userAgent", "TestAgent/1.0");
        ReflectionTestUtils.setField(source, "feedTimeoutSeconds", 1);
        ReflectionTestUtils.setField(source, "httpClient", httpClient);
    }

    @Test
    @SuppressWarnings("unchecked")
    void fetchCandidates_readsAudioEnclosuresAndCategories() throws Exception {
        String rss = """
                <?xml version="1.0" encoding="UTF-8"?>
                <rss version="2.0">
                  <channel>
                    <title>Sermons</title>
                    <link>https://church.example</link>
                    <description>Weekly sermons</description>
                    <item>
                      <title>Sermon A</title>
                      <category>Faith</category>
                      <category>Grace</category>
                      <enclosure url="https://cdn.example/a.mp3" length="1000" type="audio/mpeg"/>
                    </item>
                    <item>
                      <title>Video Only</title>
                      <enclosure url="https://cdn.example/v.mp4" length="1000" type="video/mp4"/>
                    </item>
                    <item>
                      <enclosure url="https://cdn.example/b.m4a" length="1000" type="audio/x-m4a"/>
                    </item>
                    <item>
                      <title>No Enclosure</title>
                    </item>
                  </channel>
                </rss>
                """;

        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(httpResponse);
        when(httpResponse.statusCode()).thenReturn(200);
        when(httpResponse.body()).thenReturn(new ByteArrayInputStream(rss.getBytes(StandardCharsets.UTF_8)));

        List<SermonCandidateDto> out = source.fetchCandidates(SourceDescriptor.feed(FEED_URL));

        assertEquals(2, out.size());
        assertEquals(new SermonCandidateDto("Sermon A", "https://cdn.example/a.mp3", "Faith, Grace"), out.get(0));
        assertEquals(new SermonCandidateDto(SermonCandidateDto.UNKNOWN_TITLE, "https://cdn.example/b.m4a",
                SermonCandidateDto.UNCATEGORIZED), out.get(1));
    }

    @Test
    @SuppressWarnings("unchecked")
    void fetchCandidates_non2xx_isSourceUnavailable() throws Exception {
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(httpResponse);
        when(httpResponse.statusCode()).thenReturn(500);

        assertThrows(SourceUnavailableException.class, () -> source.fetchCandidates(SourceDescriptor.feed(FEED_URL)));
    }

    @Test
    @SuppressWarnings("unchecked")
    void fetchCandidates_malformedXml_isSourceUnavailable() throws Exception {
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(httpResponse);
        when(httpResponse.statusCode()).thenReturn(200);
        when(httpResponse.body()).thenReturn(new ByteArrayInputStream("<rss><channel>".getBytes(StandardCharsets.UTF_8)));

        assertThrows(SourceUnavailableException.class, () -> source.fetchCandidates(SourceDescriptor.feed(FEED_URL)));
    }

    @Test
    @SuppressWarnings("unchecked")
    void fetchCandidates_timeout_isSourceUnavailable() throws Exception {
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenThrow(new HttpTimeoutException("timed out"));

        SourceUnavailableException e = assertThrows(SourceUnavailableException.class,
                () -> source.fetchCandidates(SourceDescriptor.feed(FEED_URL)));
        assertInstanceOf(HttpTimeoutException.class, e.getCause());
    }

    @Test
    void fetchCandidates_missingUrl_isSourceUnavailable() {
        assertThrows(SourceUnavailableException.class, () -> source.fetchCandidates(SourceDescriptor.feed("")));
        verifyNoInteractions(httpClient);
    }
}
