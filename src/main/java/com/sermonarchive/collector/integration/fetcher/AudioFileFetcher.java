package com.sermonarchive.collector.integration.fetcher;

import com.sermonarchive.collector.exception.DownloadFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;

/**
 * Downloads sermon audio into the audio directory. The file name is the last path segment of the URL,
 * so two URLs differing only in their query string map to the same file.
 */
@Slf4j
@Component
public class AudioFileFetcher {

    private final Path audioDir;

    @Value("${crawler.browser-user-agent:Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/119.0.0.0 Safari/537.36}")
    private String userAgent;

    @Value("${crawler.download-timeout-seconds:600}")
    private int downloadTimeoutSeconds;

    private final HttpClient httpClient = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(10))
            .version(HttpClient.Version.HTTP_1_1)
            .build();

    public AudioFileFetcher(@Value("${sermons.storage.audio-dir:/data/audiofiles}") String audioDir) {
        this.audioDir = Path.of(audioDir).toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.audioDir);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create audio directory " + this.audioDir, e);
        }
    }

    /**
     * Where {@link #fetchToPath(String)} would store the given URL.
     *
     * @throws DownloadFailedException if the URL has no usable file name
     */
    public Path derivePath(String audioUrl) {
        return audioDir.resolve(fileName(audioUrl));
    }

    /**
     * Returns the local path of the audio, downloading it first unless a file already sits at the derived path.
     * The body is streamed to a temporary file and only moved onto the final path after a complete transfer.
     */
    public Path fetchToPath(String audioUrl) {
        Path target = derivePath(audioUrl);
        if (Files.exists(target)) {
            log.info("Audio already on disk, skipping download path={}", target);
            return target;
        }

        Path tmp = null;
        long t0 = System.currentTimeMillis();
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(requestUri(audioUrl))
                    .timeout(Duration.ofSeconds(downloadTimeoutSeconds))
                    .GET()
                    .header("User-Agent", userAgent)
                    .header("Accept", "audio/*,*/*;q=0.8")
                    .build();

            HttpResponse<InputStream> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofInputStream());
            int status = resp.statusCode();

            try (InputStream in = resp.body()) {
                if (status < 200 || status >= 300) {
                    throw new DownloadFailedException("Non-2xx status=" + status + " url=" + audioUrl, null);
                }

                tmp = Files.createTempFile(audioDir, target.getFileName().toString() + ".", ".part");
                long bytes = Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
                moveIntoPlace(tmp, target);

                log.info("Downloaded audio path={} bytes={} tookMs={}", target, bytes, System.currentTimeMillis() - t0);
                return target;
            }

        } catch (DownloadFailedException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DownloadFailedException("Interrupted while downloading url=" + audioUrl, e);
        } catch (IOException | IllegalArgumentException e) {
            throw new DownloadFailedException("Failed to download url=" + audioUrl + " cause=" + e.getClass().getSimpleName(), e);
        } finally {
            if (tmp != null) {
                deleteTemp(tmp);
            }
        }
    }

    static String fileName(String audioUrl) {
        if (audioUrl == null || audioUrl.isBlank()) {
            throw new DownloadFailedException("Audio url is empty", null);
        }

        String path;
        try {
            path = URI.create(audioUrl.trim()).getPath();
        } catch (IllegalArgumentException e) {
            path = stripQueryAndFragment(audioUrl.trim());
        }

        if (path == null) path = "";
        int slash = path.lastIndexOf('/');
        String name = slash >= 0 ? path.substring(slash + 1) : path;

        if (name.isBlank() || name.equals(".") || name.equals("..") || name.contains("\\")) {
            throw new DownloadFailedException("Cannot derive a file name from url=" + audioUrl, null);
        }
        return name;
    }

    /**
     * Listing pages sometimes carry unencoded audio links (spaces in file names). Those are percent-encoded;
     * URLs that already parse are sent unchanged.
     */
    static URI requestUri(String audioUrl) {
        String url = audioUrl.trim();
        try {
            return URI.create(url);
        } catch (IllegalArgumentException e) {
            return UriComponentsBuilder.fromUriString(url).build().encode().toUri();
        }
    }

    private static String stripQueryAndFragment(String url) {
        int cut = url.length();
        int q = url.indexOf('?');
        int h = url.indexOf('#');
        if (q >= 0) cut = Math.min(cut, q);
        if (h >= 0) cut = Math.min(cut, h);
        String noQuery = url.substring(0, cut);
        int scheme = noQuery.indexOf("://");
        if (scheme < 0) return noQuery;
        int pathStart = noQuery.indexOf('/', scheme + 3);
        return pathStart < 0 ? "" : noQuery.substring(pathStart);
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteTemp(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temporary download file path={} err={}", tmp, e.toString());
        }
    }
}
