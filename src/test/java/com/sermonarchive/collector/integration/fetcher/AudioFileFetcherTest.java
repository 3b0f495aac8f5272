package com.sermonarchive.collector.integration.fetcher;

import com.sermonarchive.collector.exception.DownloadFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AudioFileFetcherTest {

    @TempDir Path audioDir;

    @Mock HttpClient httpClient;
    @Mock HttpResponse<InputStream> httpResponse;

    AudioFileFetcher fetcher;

    @BeforeEach
    void setUp() {
        fetcher = new AudioFileFetcher(audioDir.toString());
        ReflectionTestUtils.setField(fetcher, "userAgent", "TestBrowser/1.0");
        ReflectionTestUtils.setField(fetcher, "downloadTimeoutSeconds", 5);
        ReflectionTestUtils.setField(fetcher, "httpClient", httpClient);
    }

    @Test
    void derivePath_usesLastSegmentAndIgnoresQuery() {
        assertEquals(audioDir.resolve("2024-01-07.mp3"),
                fetcher.derivePath("https://cdn.example/wp-content/uploads/2024/01/2024-01-07.mp3?_=1#t=3"));
    }

    @Test
    void derivePath_sameFileForUrlsDifferingOnlyInQuery() {
        assertEquals(fetcher.derivePath("http://x/a.mp3?v=1"), fetcher.derivePath("http://x/a.mp3?v=2"));
    }

    @Test
    void derivePath_noFileName_throws() {
        assertThrows(DownloadFailedException.class, () -> fetcher.derivePath("https://cdn.example/"));
        assertThrows(DownloadFailedException.class, () -> fetcher.derivePath("https://cdn.example"));
        assertThrows(DownloadFailedException.class, () -> fetcher.derivePath(" "));
    }

    @Test
    void derivePath_urlWithSpaces_fallsBackToRawPath() {
        assertEquals(audioDir.resolve("Easter Sunday.mp3"), fetcher.derivePath("https://cdn.example/a/Easter Sunday.mp3?x=1"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void fetchToPath_urlWithSpaces_isEncodedForTheRequest() throws Exception {
        byte[] audio = "easter".getBytes(StandardCharsets.UTF_8);
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(httpResponse);
        when(httpResponse.statusCode()).thenReturn(200);
        when(httpResponse.body()).thenReturn(new ByteArrayInputStream(audio));

        Path out = fetcher.fetchToPath("https://cdn.example/a/Easter Sunday.mp3");

        ArgumentCaptor<HttpRequest> sent = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(sent.capture(), any(HttpResponse.BodyHandler.class));
        assertEquals(URI.create("https://cdn.example/a/Easter%20Sunday.mp3"), sent.getValue().uri());
        assertEquals(audioDir.resolve("Easter Sunday.mp3"), out);
        assertArrayEquals(audio, Files.readAllBytes(out));
    }

    @Test
    void requestUri_leavesEncodedUrlsAlone() {
        assertEquals(URI.create("https://cdn.example/a/Easter%20Sunday.mp3?_=1"),
                AudioFileFetcher.requestUri(" https://cdn.example/a/Easter%20Sunday.mp3?_=1 "));
    }

    @Test
    void fetchToPath_existingFile_skipsDownload() throws Exception {
        Path existing = Files.writeString(audioDir.resolve("a.mp3"), "already here");

        Path out = fetcher.fetchToPath("https://cdn.example/a.mp3?_=2");

        assertEquals(existing, out);
        assertEquals("already here", Files.readString(out));
        verifyNoInteractions(httpClient);
    }

    @Test
    @SuppressWarnings("unchecked")
    void fetchToPath_success_writesCompleteFile() throws Exception {
        byte[] audio = "ID3-fake-audio-bytes".getBytes(StandardCharsets.UTF_8);
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(httpResponse);
        when(httpResponse.statusCode()).thenReturn(200);
        when(httpResponse.body()).thenReturn(new ByteArrayInputStream(audio));

        Path out = fetcher.fetchToPath("https://cdn.example/uploads/b.mp3");

        assertEquals(audioDir.resolve("b.mp3"), out);
        assertArrayEquals(audio, Files.readAllBytes(out));
        assertThat(listDir()).containsExactly("b.mp3");
    }

    @Test
    @SuppressWarnings("unchecked")
    void fetchToPath_non2xx_failsWithoutLeavingFile() throws Exception {
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(httpResponse);
        when(httpResponse.statusCode()).thenReturn(404);
        when(httpResponse.body()).thenReturn(new ByteArrayInputStream(new byte[0]));

        assertThrows(DownloadFailedException.class, () -> fetcher.fetchToPath("https://cdn.example/missing.mp3"));
        assertThat(listDir()).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    void fetchToPath_streamBreaksMidway_leavesNoPartialFile() throws Exception {
        InputStream broken = new InputStream() {
            private int served;

            @Override
            public int read() throws IOException {
                if (served++ < 1024) return 'x';
                throw new IOException("connection reset");
            }
        };

        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(httpResponse);
        when(httpResponse.statusCode()).thenReturn(200);
        when(httpResponse.body()).thenReturn(broken);

        DownloadFailedException e = assertThrows(DownloadFailedException.class,
                () -> fetcher.fetchToPath("https://cdn.example/c.mp3"));

        assertInstanceOf(IOException.class, e.getCause());
        assertFalse(Files.exists(audioDir.resolve("c.mp3")));
        assertThat(listDir()).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    void fetchToPath_transportError_isDownloadFailed() throws Exception {
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenThrow(new IOException("unreachable"));

        assertThrows(DownloadFailedException.class, () -> fetcher.fetchToPath("https://cdn.example/d.mp3"));
        assertThat(listDir()).isEmpty();
    }

    private java.util.List<String> listDir() throws IOException {
        try (Stream<Path> files = Files.list(audioDir)) {
            return files.map(p -> p.getFileName().toString()).toList();
        }
    }
}
