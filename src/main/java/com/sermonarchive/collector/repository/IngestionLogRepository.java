package com.sermonarchive.collector.repository;

import com.sermonarchive.collector.domain.entity.IngestionLog;
import org.springframework.data.jpa.repository.JpaRepository;

public interface IngestionLogRepository extends JpaRepository<IngestionLog, Long> {
}
