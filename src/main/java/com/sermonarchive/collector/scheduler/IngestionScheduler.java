package com.sermonarchive.collector.scheduler;

import com.sermonarchive.collector.exception.StoreUnavailableException;
import com.sermonarchive.collector.service.IngestionCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class IngestionScheduler {

    private final IngestionCoordinator ingestionCoordinator;

    @Scheduled(
            fixedDelayString = "${sermons.ingestion.interval:PT20M}",
            initialDelayString = "${sermons.ingestion.initial-delay:PT1M}"
    )
    public void run() {
        UUID correlationId = UUID.randomUUID();
        log.info("Scheduled ingestion started correlationId={}", correlationId);
        try {
            ingestionCoordinator.tryRun(null, correlationId).ifPresentOrElse(
                    summary -> log.info("Scheduled ingestion finished correlationId={} status={} inserted={}",
                            correlationId, summary.status(), summary.inserted()),
                    () -> log.info("Scheduled ingestion skipped correlationId={}", correlationId));
        } catch (StoreUnavailableException e) {
            log.error("Scheduled ingestion aborted, metadata store unavailable correlationId={}", correlationId);
        }
    }
}
