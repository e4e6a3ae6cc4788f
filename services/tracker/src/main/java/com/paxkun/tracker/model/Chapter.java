package com.paxkun.tracker.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A discovered chapter. The (mapping, chapter number) unique key is the dedup guard for
 * concurrent tracking jobs.
 */
@Entity
@Table(
        name = "chapters",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_chapters_mapping_number",
                columnNames = {"manga_scanlator_id", "chapter_number"}
        ),
        indexes = @Index(name = "idx_chapters_detected", columnList = "detected_date")
)
@Getter
@Setter
@NoArgsConstructor
public class Chapter {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "manga_scanlator_id", nullable = false)
    private Long mangaScanlatorId;

    @Column(name = "chapter_number", nullable = false, length = 50)
    private String chapterNumber;

    @Column(name = "chapter_title", length = 500)
    private String chapterTitle;

    @Column(name = "chapter_url", nullable = false, length = 500)
    private String chapterUrl;

    @Column(name = "published_date")
    private LocalDateTime publishedDate;

    @Column(name = "detected_date", nullable = false)
    private LocalDateTime detectedDate;

    @Column(name = "is_read", nullable = false)
    private boolean read;
}
