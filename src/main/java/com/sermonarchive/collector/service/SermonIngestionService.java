package com.sermonarchive.collector.service;

import com.sermonarchive.collector.domain.dto.IngestionSummary;
import com.sermonarchive.collector.domain.dto.SermonCandidateDto;
import com.sermonarchive.collector.domain.dto.SourceDescriptor;
import com.sermonarchive.collector.exception.SourceUnavailableException;
import com.sermonarchive.collector.exception.StoreUnavailableException;
import com.sermonarchive.collector.processor.SermonCandidateProcessor;
import com.sermonarchive.collector.repository.SermonRepository;
import com.sermonarchive.collector.source.SermonSourceRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Runs one pass over one source. Callers must not invoke this concurrently; {@link IngestionCoordinator} enforces that.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SermonIngestionService {

    private final SermonSourceRegistry sourceRegistry;
    private final SermonCandidateProcessor candidateProcessor;
    private final SermonIngestionPipeline ingestionPipeline;
    private final IngestionLogService ingestionLogService;
    private final SermonRepository sermonRepository;
    private final Clock clock;

    public IngestionSummary ingestOnce(SourceDescriptor source, UUID correlationId, BooleanSupplier stopRequested) {
        Instant start = clock.instant();
        Long logId = null;
        try (MDC.MDCCloseable ignored = MDC.putCloseable("corrId", correlationId.toString())) {
            try {
                probeStore();
                logId = ingestionLogService.start(correlationId, source, start);

                List<SermonCandidateDto> raw;
                try {
                    raw = sourceRegistry.forType(source.type()).fetchCandidates(source);
                } catch (SourceUnavailableException e) {
                    log.warn("Source unavailable type={} url={}: {}", source.type(), source.url(), e.toString());
                    ingestionLogService.sourceUnavailable(logId, clock.instant(), e);
                    return IngestionSummary.sourceUnavailable(correlationId);
                }

                List<SermonCandidateDto> candidates = candidateProcessor.process(raw);
                log.info("Candidates after validation raw={} candidates={}", raw.size(), candidates.size());

                IngestionSummary summary = ingestionPipeline.ingestAll(candidates, correlationId, stopRequested);

                ingestionLogService.complete(logId, clock.instant(), summary);
                log.info("Ingestion done candidates={} inserted={} skippedDuplicates={} failed={} status={}",
                        summary.candidates(), summary.inserted(), summary.skippedDuplicates(), summary.failed(), summary.status());
                return summary;

            } catch (RuntimeException e) {
                log.error("Ingestion failed correlationId={}", correlationId, e);
                ingestionLogService.fail(correlationId, logId, clock.instant(), e);
                throw e;
            }
        }
    }

    private void probeStore() {
        try {
            long stored = sermonRepository.count();
            log.debug("Metadata store reachable sermons={}", stored);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Metadata store unavailable", e);
        }
    }
}
