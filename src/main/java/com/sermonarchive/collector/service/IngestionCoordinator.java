package com.sermonarchive.collector.service;

import com.sermonarchive.collector.domain.dto.IngestionSummary;
import com.sermonarchive.collector.domain.dto.SourceDescriptor;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lets at most one ingestion pass run at a time. Triggers arriving while a pass is running are dropped.
 * On shutdown the running pass stops before its next candidate.
 */
@Slf4j
@Service
public class IngestionCoordinator {

    private final SermonIngestionService ingestionService;
    private final SourceDescriptor defaultSource;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean shuttingDown;

    public IngestionCoordinator(SermonIngestionService ingestionService, SourceDescriptor defaultSource) {
        this.ingestionService = ingestionService;
        this.defaultSource = defaultSource;
    }

    /**
     * Runs a pass on the calling thread.
     *
     * @param source source to read, or {@code null} for the configured default
     * @return the pass summary, or empty if another pass was already running
     */
    public Optional<IngestionSummary> tryRun(SourceDescriptor source, UUID correlationId) {
        if (shuttingDown) {
            log.info("Shutdown in progress, ignoring ingestion trigger correlationId={}", correlationId);
            return Optional.empty();
        }
        if (!running.compareAndSet(false, true)) {
            log.warn("Ingestion already running; dropping trigger correlationId={}", correlationId);
            return Optional.empty();
        }

        try {
            SourceDescriptor effective = source != null ? source : defaultSource;
            return Optional.of(ingestionService.ingestOnce(effective, correlationId, () -> shuttingDown));
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public SourceDescriptor defaultSource() {
        return defaultSource;
    }

    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        if (running.get()) {
            log.info("Shutdown requested; running pass will stop before its next candidate");
        }
    }
}
