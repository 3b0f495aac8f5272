package com.sermonarchive.collector.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Objects;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SermonCandidateDto {

    public static final String UNKNOWN_TITLE = "Unknown Sermon";
    public static final String UNCATEGORIZED = "Uncategorized";

    private String title;
    private String audioUrl;
    private String categories;

    /**
     * Builds a candidate with the title and category placeholders applied.
     */
    public static SermonCandidateDto of(String title, String audioUrl, List<String> categoryNames) {
        String joined = categoryNames == null ? "" : categoryNames.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .reduce((a, b) -> a + ", " + b)
                .orElse("");

        return new SermonCandidateDto(
                title == null || title.isBlank() ? UNKNOWN_TITLE : title.trim(),
                audioUrl == null || audioUrl.isBlank() ? null : audioUrl.trim(),
                joined.isEmpty() ? UNCATEGORIZED : joined
        );
    }
}
