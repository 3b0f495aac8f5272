package com.sermonarchive.collector.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sermonarchive.collector.domain.entity.Sermon;
import com.sermonarchive.collector.exception.SermonNotFoundException;
import com.sermonarchive.collector.repository.SermonRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.UUID;

@Slf4j
@RestController
@RequiredArgsConstructor
public class SermonController {

    static final DateTimeFormatter FETCHED_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final SermonRepository sermonRepository;

    /**
     * Sermons fetched on or after the given day, newest first.
     */
    @GetMapping("/sermons")
    public ResponseEntity<List<SermonResponse>> listSermons(@RequestParam(name = "date", required = false) String date) {
        if (date == null || date.isBlank()) {
            throw new IllegalArgumentException("Missing date parameter. Expected format: YYYY-MM-DD");
        }

        LocalDate since;
        try {
            since = LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date format. Expected format: YYYY-MM-DD");
        }

        String downloadBase = ServletUriComponentsBuilder.fromCurrentContextPath().path("/download/").toUriString();

        List<SermonResponse> sermons = sermonRepository
                .findByFetchedDateGreaterThanEqualOrderByFetchedDateDesc(since.atStartOfDay())
                .stream()
                .map(s -> SermonResponse.from(s, downloadBase))
                .toList();

        log.info("Listing sermons since={} count={}", since, sermons.size());
        return ResponseEntity.ok(sermons);
    }

    @GetMapping("/download/{id}")
    public ResponseEntity<Resource> download(@PathVariable("id") String id) {
        UUID sermonId;
        try {
            sermonId = UUID.fromString(id);
        } catch (IllegalArgumentException e) {
            throw new SermonNotFoundException(id);
        }

        Sermon sermon = sermonRepository.findById(sermonId)
                .orElseThrow(() -> new SermonNotFoundException(id));

        Path file = Path.of(sermon.getFilePath());
        if (!Files.isRegularFile(file)) {
            log.error("Audio file missing for sermon id={} path={}", id, file);
            throw new SermonNotFoundException(id);
        }

        log.info("Serving audio for sermon id={} path={}", id, file);
        MediaType type = MediaTypeFactory.getMediaType(file.getFileName().toString())
                .orElse(MediaType.APPLICATION_OCTET_STREAM);

        return ResponseEntity.ok()
                .contentType(type)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(file.getFileName().toString()).build().toString())
                .body(new FileSystemResource(file));
    }

    public record SermonResponse(
            String id,
            String title,
            @JsonProperty("audio_url") String audioUrl,
            String categories,
            @JsonProperty("fetched_date") String fetchedDate,
            @JsonProperty("download_url") String downloadUrl
    ) {
        static SermonResponse from(Sermon s, String downloadBase) {
            String id = s.getId().toString();
            return new SermonResponse(
                    id,
                    s.getTitle(),
                    s.getAudioUrl(),
                    s.getCategories(),
                    s.getFetchedDate() != null ? FETCHED_DATE_FORMAT.format(s.getFetchedDate()) : null,
                    downloadBase + id
            );
        }
    }
}
