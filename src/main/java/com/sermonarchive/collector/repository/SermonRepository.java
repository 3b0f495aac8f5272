package com.sermonarchive.collector.repository;

import com.sermonarchive.collector.domain.entity.Sermon;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public interface SermonRepository extends JpaRepository<Sermon, UUID> {

    boolean existsByAudioUrl(String audioUrl);

    boolean existsByFilePath(String filePath);

    boolean existsByTitle(String title);

    List<Sermon> findByFetchedDateGreaterThanEqualOrderByFetchedDateDesc(LocalDateTime since);
}
