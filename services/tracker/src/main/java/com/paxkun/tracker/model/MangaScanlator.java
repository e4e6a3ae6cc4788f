package com.paxkun.tracker.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Association of a manga with a scanlator, carrying the site URL chapters are extracted from.
 * Only manually verified mappings are tracked.
 */
@Entity
@Table(
        name = "manga_scanlator",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_manga_scanlator",
                columnNames = {"manga_id", "scanlator_id"}
        )
)
@Getter
@Setter
@NoArgsConstructor
public class MangaScanlator {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "manga_id", nullable = false)
    private Manga manga;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "scanlator_id", nullable = false)
    private Scanlator scanlator;

    @Column(name = "scanlator_manga_url", nullable = false, length = 500)
    private String scanlatorMangaUrl;

    @Column(name = "manually_verified", nullable = false)
    private boolean manuallyVerified;

    @Column(length = 4000)
    private String notes;

    public MangaScanlator(Manga manga, Scanlator scanlator, String scanlatorMangaUrl, boolean manuallyVerified) {
        this.manga = manga;
        this.scanlator = scanlator;
        this.scanlatorMangaUrl = scanlatorMangaUrl;
        this.manuallyVerified = manuallyVerified;
    }
}
