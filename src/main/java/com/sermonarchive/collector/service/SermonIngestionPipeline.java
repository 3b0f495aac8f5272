package com.sermonarchive.collector.service;

import com.sermonarchive.collector.domain.dto.IngestionSummary;
import com.sermonarchive.collector.domain.dto.SermonCandidateDto;
import com.sermonarchive.collector.domain.entity.Sermon;
import com.sermonarchive.collector.domain.enums.CandidateOutcome;
import com.sermonarchive.collector.domain.enums.DuplicateKey;
import com.sermonarchive.collector.exception.DownloadFailedException;
import com.sermonarchive.collector.exception.StoreUnavailableException;
import com.sermonarchive.collector.integration.fetcher.AudioFileFetcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Takes candidates one at a time through dedup, disk reconciliation, download and insert.
 * A failing candidate is logged and counted; the loop always moves on to the next one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SermonIngestionPipeline {

    private final SermonDeduplicationResolver deduplicationResolver;
    private final AudioFileFetcher audioFileFetcher;
    private final SermonRecordService sermonRecordService;

    public IngestionSummary ingestAll(List<SermonCandidateDto> candidates, UUID correlationId, BooleanSupplier stopRequested) {
        IngestionSummary.Builder summary = IngestionSummary.builder(correlationId);
        if (candidates == null || candidates.isEmpty()) return summary.build();

        summary.candidates(candidates.size());
        int index = 0;

        for (SermonCandidateDto candidate : candidates) {
            if (stopRequested.getAsBoolean()) {
                log.info("Stop requested, leaving {} of {} candidates unprocessed", candidates.size() - index, candidates.size());
                summary.cancelled();
                break;
            }
            summary.record(ingestOne(candidate));
            index++;
        }

        return summary.build();
    }

    CandidateOutcome ingestOne(SermonCandidateDto candidate) {
        String title = candidate.getTitle();
        String audioUrl = candidate.getAudioUrl();

        try {
            Path derivedPath = audioFileFetcher.derivePath(audioUrl);

            Optional<DuplicateKey> duplicate = deduplicationResolver.findDuplicate(candidate, derivedPath);
            if (duplicate.isPresent()) {
                log.info("Duplicate already stored key={} title='{}' path={}", duplicate.get(), title, derivedPath);
                return CandidateOutcome.DUPLICATE;
            }

            // No row references derivedPath at this point, so a file there is left over from an interrupted pass.
            if (Files.exists(derivedPath)) {
                log.info("Audio file exists without a record, removing to force re-download path={}", derivedPath);
                try {
                    Files.delete(derivedPath);
                } catch (IOException e) {
                    log.error("Failed to remove stale audio file path={} err={}", derivedPath, e.toString());
                    return CandidateOutcome.FAILED;
                }
            }

            log.debug("Processing sermon title='{}' audioUrl={} categories='{}'", title, audioUrl, candidate.getCategories());
            Path storedPath = audioFileFetcher.fetchToPath(audioUrl);

            if (!storedPath.equals(derivedPath)) {
                log.warn("Derived path {} differs from downloaded path {} for sermon '{}'", derivedPath, storedPath, title);
            }

            try {
                Sermon saved = sermonRecordService.insert(candidate, storedPath);
                log.info("Inserted sermon id={} title='{}'", saved.getId(), title);
                return CandidateOutcome.INSERTED;
            } catch (DuplicateKeyException dup) {
                log.info("Sermon already exists (detected at insert) title='{}' path={}", title, storedPath);
                return CandidateOutcome.DUPLICATE;
            }

        } catch (DownloadFailedException e) {
            log.warn("Download failed for sermon '{}': {}", title, e.getMessage());
            return CandidateOutcome.FAILED;
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new StoreUnavailableException("Metadata store unavailable while processing audioUrl=" + audioUrl, e);
        } catch (DataIntegrityViolationException e) {
            log.error("Insert rejected for sermon '{}' audioUrl={}: {}", title, audioUrl, e.getMostSpecificCause().toString());
            return CandidateOutcome.FAILED;
        } catch (Exception e) {
            log.error("Failed processing sermon '{}' audioUrl={}", title, audioUrl, e);
            return CandidateOutcome.FAILED;
        }
    }
}
