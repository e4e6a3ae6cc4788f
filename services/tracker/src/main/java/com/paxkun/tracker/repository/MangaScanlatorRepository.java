package com.paxkun.tracker.repository;

import com.paxkun.tracker.model.MangaScanlator;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MangaScanlatorRepository extends JpaRepository<MangaScanlator, Long> {

    @EntityGraph(attributePaths = {"manga", "scanlator"})
    List<MangaScanlator> findByManuallyVerifiedTrueAndScanlatorActiveTrueOrderByIdAsc();

    @EntityGraph(attributePaths = {"manga", "scanlator"})
    List<MangaScanlator> findByManuallyVerifiedTrueAndScanlatorActiveTrueAndMangaIdOrderByIdAsc(Long mangaId);

    @EntityGraph(attributePaths = {"manga", "scanlator"})
    List<MangaScanlator> findByManuallyVerifiedTrueAndScanlatorActiveTrueAndScanlatorIdOrderByIdAsc(Long scanlatorId);

    @EntityGraph(attributePaths = {"manga", "scanlator"})
    List<MangaScanlator> findByManuallyVerifiedTrueAndScanlatorActiveTrueAndMangaIdAndScanlatorIdOrderByIdAsc(
            Long mangaId,
            Long scanlatorId
    );

    /**
     * Mappings a tracking job should visit: manually verified, on an active scanlator,
     * optionally narrowed to one manga and/or one scanlator. Manga and scanlator are loaded
     * eagerly because the job reads them outside any transaction.
     */
    default List<MangaScanlator> findTrackable(Long mangaId, Long scanlatorId) {
        if (mangaId != null && scanlatorId != null) {
            return findByManuallyVerifiedTrueAndScanlatorActiveTrueAndMangaIdAndScanlatorIdOrderByIdAsc(mangaId, scanlatorId);
        }
        if (mangaId != null) {
            return findByManuallyVerifiedTrueAndScanlatorActiveTrueAndMangaIdOrderByIdAsc(mangaId);
        }
        if (scanlatorId != null) {
            return findByManuallyVerifiedTrueAndScanlatorActiveTrueAndScanlatorIdOrderByIdAsc(scanlatorId);
        }
        return findByManuallyVerifiedTrueAndScanlatorActiveTrueOrderByIdAsc();
    }
}
