package com.sermonarchive.collector.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "sermons")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Sermon {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(nullable = false, length = 1000)
    private String title;

    @Column(name = "audio_url", nullable = false, unique = true, length = 2048)
    private String audioUrl;

    @Column(name = "file_path", nullable = false, unique = true, length = 1024)
    private String filePath;

    @Column(length = 1000)
    private String categories;

    @Column(name = "fetched_date", nullable = false)
    private LocalDateTime fetchedDate;
}
