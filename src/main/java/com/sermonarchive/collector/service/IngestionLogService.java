package com.sermonarchive.collector.service;

import com.sermonarchive.collector.domain.dto.IngestionSummary;
import com.sermonarchive.collector.domain.dto.SourceDescriptor;
import com.sermonarchive.collector.domain.entity.IngestionLog;
import com.sermonarchive.collector.domain.enums.IngestionStatus;
import com.sermonarchive.collector.repository.IngestionLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Keeps one {@link IngestionLog} row per pass. Write failures are logged and never break the pass.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionLogService {

    private static final int MAX_ERROR_DETAILS = 4000;

    private final IngestionLogRepository ingestionLogRepository;

    public Long start(UUID correlationId, SourceDescriptor source, Instant startedAt) {
        try {
            IngestionLog entry = IngestionLog.builder()
                    .status(IngestionStatus.RUNNING)
                    .correlationId(correlationId.toString())
                    .sourceType(source.type())
                    .sourceUrl(source.url())
                    .startedAt(startedAt)
                    .build();
            return ingestionLogRepository.save(entry).getId();
        } catch (DataAccessException e) {
            log.warn("Could not record ingestion start correlationId={} err={}", correlationId, e.toString());
            return null;
        }
    }

    public void complete(Long logId, Instant completedAt, IngestionSummary summary) {
        update(logId, entry -> {
            entry.setCompletedAt(completedAt);
            entry.setCandidatesFound(summary.candidates());
            entry.setInserted(summary.inserted());
            entry.setSkippedDuplicates(summary.skippedDuplicates());
            entry.setFailed(summary.failed());
            entry.setStatus(summary.status());
        });
    }

    public void sourceUnavailable(Long logId, Instant completedAt, Exception e) {
        update(logId, entry -> {
            entry.setCompletedAt(completedAt);
            entry.setStatus(IngestionStatus.SOURCE_UNAVAILABLE);
            entry.setErrorDetails(describe(e));
        });
    }

    public void fail(UUID correlationId, Long logId, Instant completedAt, Exception e) {
        try {
            IngestionLog entry = logId == null ? null : ingestionLogRepository.findById(logId).orElse(null);
            if (entry == null) {
                entry = IngestionLog.builder()
                        .correlationId(correlationId.toString())
                        .startedAt(completedAt)
                        .build();
            }
            entry.setCompletedAt(completedAt);
            entry.setStatus(IngestionStatus.FAILED);
            entry.setErrorDetails(describe(e));
            ingestionLogRepository.save(entry);
        } catch (DataAccessException dae) {
            log.warn("Could not record ingestion failure correlationId={} err={}", correlationId, dae.toString());
        }
    }

    private void update(Long logId, Consumer<IngestionLog> change) {
        if (logId == null) return;
        try {
            IngestionLog entry = ingestionLogRepository.findById(logId)
                    .orElseThrow(() -> new IllegalStateException("IngestionLog not found: " + logId));
            change.accept(entry);
            ingestionLogRepository.save(entry);
        } catch (DataAccessException | IllegalStateException e) {
            log.warn("Could not update ingestion log id={} err={}", logId, e.toString());
        }
    }

    private static String describe(Exception e) {
        String details = e.getCause() == null ? e.toString() : e + " / cause: " + e.getCause();
        return details.length() <= MAX_ERROR_DETAILS ? details : details.substring(0, MAX_ERROR_DETAILS);
    }
}
