package com.sermonarchive.collector.service;

import com.sermonarchive.collector.domain.dto.SermonCandidateDto;
import com.sermonarchive.collector.domain.enums.DuplicateKey;
import com.sermonarchive.collector.repository.SermonRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SermonDeduplicationResolverTest {

    private static final Path PATH = Path.of("/data/audiofiles/a.mp3");
    private static final SermonCandidateDto CANDIDATE = new SermonCandidateDto("Sermon A", "http://x/a.mp3", "Faith");

    @Mock SermonRepository sermonRepository;
    @InjectMocks SermonDeduplicationResolver resolver;

    @Test
    void findDuplicate_audioUrlMatch_shortCircuits() {
        when(sermonRepository.existsByAudioUrl("http://x/a.mp3")).thenReturn(true);

        assertEquals(Optional.of(DuplicateKey.AUDIO_URL), resolver.findDuplicate(CANDIDATE, PATH));
        verify(sermonRepository, never()).existsByFilePath(anyString());
        verify(sermonRepository, never()).existsByTitle(anyString());
    }

    @Test
    void findDuplicate_filePathMatch() {
        when(sermonRepository.existsByAudioUrl("http://x/a.mp3")).thenReturn(false);
        when(sermonRepository.existsByFilePath(PATH.toString())).thenReturn(true);

        assertEquals(Optional.of(DuplicateKey.FILE_PATH), resolver.findDuplicate(CANDIDATE, PATH));
    }

    @Test
    void findDuplicate_titleOnlyMatch_stillDuplicate() {
        when(sermonRepository.existsByAudioUrl("http://x/a.mp3")).thenReturn(false);
        when(sermonRepository.existsByFilePath(PATH.toString())).thenReturn(false);
        when(sermonRepository.existsByTitle("Sermon A")).thenReturn(true);

        assertEquals(Optional.of(DuplicateKey.TITLE), resolver.findDuplicate(CANDIDATE, PATH));
    }

    @Test
    void findDuplicate_noMatch_isEmpty() {
        when(sermonRepository.existsByAudioUrl(anyString())).thenReturn(false);
        when(sermonRepository.existsByFilePath(anyString())).thenReturn(false);
        when(sermonRepository.existsByTitle(anyString())).thenReturn(false);

        assertTrue(resolver.findDuplicate(CANDIDATE, PATH).isEmpty());
    }
}
