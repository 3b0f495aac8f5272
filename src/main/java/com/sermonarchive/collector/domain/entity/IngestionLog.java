package com.sermonarchive.collector.domain.entity;

import com.sermonarchive.collector.domain.enums.IngestionStatus;
import com.sermonarchive.collector.domain.enums.SourceType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "ingestion_logs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IngestionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "correlation_id", length = 64)
    private String correlationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", length = 20)
    private SourceType sourceType;

    @Column(name = "source_url", length = 2048)
    private String sourceUrl;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "candidates_found", nullable = false)
    private int candidatesFound;

    @Column(nullable = false)
    private int inserted;

    @Column(name = "skipped_duplicates", nullable = false)
    private int skippedDuplicates;

    @Column(nullable = false)
    private int failed;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private IngestionStatus status;

    @Column(name = "error_details", length = 4000)
    private String errorDetails;
}
