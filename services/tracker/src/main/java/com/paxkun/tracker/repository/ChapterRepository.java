package com.paxkun.tracker.repository;

import com.paxkun.tracker.model.Chapter;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ChapterRepository extends JpaRepository<Chapter, Long> {

    boolean existsByMangaScanlatorIdAndChapterNumber(Long mangaScanlatorId, String chapterNumber);

    long countByMangaScanlatorId(Long mangaScanlatorId);
}
