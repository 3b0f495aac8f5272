package com.sermonarchive.collector.source;

import com.sermonarchive.collector.domain.dto.SermonCandidateDto;
import com.sermonarchive.collector.domain.dto.SourceDescriptor;
import com.sermonarchive.collector.domain.enums.SourceType;
import com.sermonarchive.collector.exception.SourceUnavailableException;

import java.util.List;

public interface SermonSource {

    SourceType type();

    /**
     * Reads every candidate the source currently lists. Candidates without an audio URL are not returned.
     *
     * @throws SourceUnavailableException if nothing could be retrieved from the source at all
     */
    List<SermonCandidateDto> fetchCandidates(SourceDescriptor descriptor);
}
