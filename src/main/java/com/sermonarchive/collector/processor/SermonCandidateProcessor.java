package com.sermonarchive.collector.processor;

import com.sermonarchive.collector.domain.dto.SermonCandidateDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cleans candidates coming out of a source: drops entries without audio, collapses whitespace,
 * re-applies the title/category placeholders and keeps the first candidate per audio URL.
 */
@Slf4j
@Component
public class SermonCandidateProcessor extends BaseProcessor<SermonCandidateDto> {

    @Override
    protected List<SermonCandidateDto> validate(List<SermonCandidateDto> data) {
        return data.stream()
                .filter(c -> c != null && validateField(c.toString(), "audioUrl", c.getAudioUrl()))
                .toList();
    }

    @Override
    protected List<SermonCandidateDto> map(List<SermonCandidateDto> data) {
        Map<String, SermonCandidateDto> byUrl = new LinkedHashMap<>();
        for (SermonCandidateDto c : data) {
            SermonCandidateDto normalized = normalize(c);
            SermonCandidateDto previous = byUrl.putIfAbsent(normalized.getAudioUrl(), normalized);
            if (previous != null) {
                log.debug("Dropping repeated audioUrl={} title='{}'", normalized.getAudioUrl(), normalized.getTitle());
            }
        }
        return List.copyOf(byUrl.values());
    }

    private static SermonCandidateDto normalize(SermonCandidateDto in) {
        String title = clean(in.getTitle());
        String categories = clean(in.getCategories());
        return new SermonCandidateDto(
                title == null || title.isEmpty() ? SermonCandidateDto.UNKNOWN_TITLE : title,
                in.getAudioUrl().trim(),
                categories == null || categories.isEmpty() ? SermonCandidateDto.UNCATEGORIZED : categories
        );
    }

    private static String clean(String s) {
        return s == null ? null : s.trim().replaceAll("\\s+", " ");
    }
}
