package com.sermonarchive.collector.service;

import com.sermonarchive.collector.domain.dto.SermonCandidateDto;
import com.sermonarchive.collector.domain.enums.DuplicateKey;
import com.sermonarchive.collector.repository.SermonRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Decides whether a candidate is already stored. A match on audio URL, derived file path or title is enough;
 * two different sermons sharing a title are therefore treated as one.
 */
@Service
@RequiredArgsConstructor
public class SermonDeduplicationResolver {

    private final SermonRepository sermonRepository;

    public Optional<DuplicateKey> findDuplicate(SermonCandidateDto candidate, Path derivedPath) {
        if (sermonRepository.existsByAudioUrl(candidate.getAudioUrl())) {
            return Optional.of(DuplicateKey.AUDIO_URL);
        }
        if (isReferenced(derivedPath)) {
            return Optional.of(DuplicateKey.FILE_PATH);
        }
        if (sermonRepository.existsByTitle(candidate.getTitle())) {
            return Optional.of(DuplicateKey.TITLE);
        }
        return Optional.empty();
    }

    public boolean isReferenced(Path filePath) {
        return sermonRepository.existsByFilePath(filePath.toString());
    }
}
