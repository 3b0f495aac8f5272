package com.sermonarchive.collector.controller;

import com.sermonarchive.collector.domain.dto.IngestionSummary;
import com.sermonarchive.collector.domain.dto.SourceDescriptor;
import com.sermonarchive.collector.domain.entity.IngestionLog;
import com.sermonarchive.collector.domain.enums.IngestionStatus;
import com.sermonarchive.collector.domain.enums.SourceType;
import com.sermonarchive.collector.exception.IngestionAlreadyRunningException;
import com.sermonarchive.collector.repository.IngestionLogRepository;
import com.sermonarchive.collector.service.IngestionCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/admin/ingestion")
@RequiredArgsConstructor
public class IngestionController {

    private static final int MAX_PAGE_SIZE = 200;

    private final IngestionCoordinator ingestionCoordinator;
    private final IngestionLogRepository ingestionLogRepository;

    @Value("${sermons.source.max-pages:37}")
    private int configuredMaxPages;

    /**
     * Runs a pass synchronously. Without {@code type} the configured source is used; with it, {@code url}
     * replaces the configured url for that type and {@code maxPages} defaults to the configured limit.
     */
    @PostMapping("/run")
    public ResponseEntity<IngestionSummary> runIngestion(
            @RequestParam(required = false) SourceType type,
            @RequestParam(required = false) String url,
            @RequestParam(required = false) Integer maxPages,
            @RequestParam(required = false) String correlationId
    ) {
        UUID cid = parseCorrelationId(correlationId);
        SourceDescriptor source = resolveSource(type, url, maxPages);

        log.info("Manual ingestion trigger, correlationId={} type={}", cid, source.type());
        IngestionSummary summary = ingestionCoordinator.tryRun(source, cid)
                .orElseThrow(IngestionAlreadyRunningException::new);

        return ResponseEntity.ok(summary);
    }

    /**
     * Pass history, most recent start first.
     */
    @GetMapping("/logs")
    public ResponseEntity<RunLogPage> listLogs(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        Page<IngestionLog> result = ingestionLogRepository.findAll(newestFirst(page, size));
        return ResponseEntity.ok(RunLogPage.from(result));
    }

    @GetMapping("/runs/{id}")
    public ResponseEntity<RunView> getRun(@PathVariable("id") Long runId) {
        return ingestionLogRepository.findById(runId)
                .map(RunView::from)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new IllegalArgumentException("Ingestion run not found: " + runId));
    }

    private static PageRequest newestFirst(int page, int size) {
        if (page < 0) {
            throw new IllegalArgumentException("page must be >= 0");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("size must be between 1 and " + MAX_PAGE_SIZE);
        }
        return PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "startedAt"));
    }

    private SourceDescriptor resolveSource(SourceType type, String url, Integer maxPages) {
        SourceDescriptor configured = ingestionCoordinator.defaultSource();
        if (type == null) {
            return configured;
        }
        String effectiveUrl = (url != null && !url.isBlank()) ? url.trim()
                : (type == configured.type() ? configured.url() : null);
        if (effectiveUrl == null) {
            throw new IllegalArgumentException("url is required for source type " + type);
        }
        int pages = maxPages != null ? maxPages : configuredMaxPages;
        if (pages < 1) {
            throw new IllegalArgumentException("maxPages must be >= 1");
        }
        return type == SourceType.FEED ? SourceDescriptor.feed(effectiveUrl) : SourceDescriptor.pages(effectiveUrl, pages);
    }

    private static UUID parseCorrelationId(String correlationId) {
        if (correlationId == null || correlationId.isBlank()) {
            return UUID.randomUUID();
        }
        try {
            return UUID.fromString(correlationId.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("correlationId must be a UUID");
        }
    }

    public record RunLogPage(int page, int size, long totalElements, int totalPages, List<RunView> runs) {
        static RunLogPage from(Page<IngestionLog> result) {
            return new RunLogPage(
                    result.getNumber(),
                    result.getSize(),
                    result.getTotalElements(),
                    result.getTotalPages(),
                    result.map(RunView::from).getContent());
        }
    }

    public record RunView(
            Long id,
            String correlationId,
            SourceType sourceType,
            String sourceUrl,
            Instant startedAt,
            Instant completedAt,
            int candidatesFound,
            int inserted,
            int skippedDuplicates,
            int failed,
            IngestionStatus status,
            String errorDetails
    ) {
        static RunView from(IngestionLog run) {
            return new RunView(
                    run.getId(),
                    run.getCorrelationId(),
                    run.getSourceType(),
                    run.getSourceUrl(),
                    run.getStartedAt(),
                    run.getCompletedAt(),
                    run.getCandidatesFound(),
                    run.getInserted(),
                    run.getSkippedDuplicates(),
                    run.getFailed(),
                    run.getStatus(),
                    run.getErrorDetails());
        }
    }
}
