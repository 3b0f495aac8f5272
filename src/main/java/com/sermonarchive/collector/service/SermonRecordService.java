package com.sermonarchive.collector.service;

import com.sermonarchive.collector.domain.dto.SermonCandidateDto;
import com.sermonarchive.collector.domain.entity.Sermon;
import com.sermonarchive.collector.repository.SermonRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

@Service
@RequiredArgsConstructor
public class SermonRecordService {

    private final SermonRepository sermonRepository;
    private final Clock clock;

    /**
     * Inserts one sermon row and flushes so unique constraint violations surface here,
     * as a {@link org.springframework.dao.DataIntegrityViolationException}, with the transaction rolled back.
     */
    @Transactional
    public Sermon insert(SermonCandidateDto candidate, Path filePath) {
        Sermon sermon = Sermon.builder()
                .title(candidate.getTitle())
                .audioUrl(candidate.getAudioUrl())
                .filePath(filePath.toString())
                .categories(candidate.getCategories())
                .fetchedDate(LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS))
                .build();
        return sermonRepository.saveAndFlush(sermon);
    }
}
