package com.paxkun.tracker.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A tracked work, independent of any scanlator.
 */
@Entity
@Table(name = "mangas")
@Getter
@Setter
@NoArgsConstructor
public class Manga {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(name = "alternative_titles", length = 4000)
    private String alternativeTitles;

    @Column(name = "cover_filename")
    private String coverFilename;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private MangaStatus status = MangaStatus.PLAN_TO_READ;

    @Column(name = "last_checked")
    private LocalDateTime lastChecked;

    public Manga(String title) {
        this.title = title;
    }
}
