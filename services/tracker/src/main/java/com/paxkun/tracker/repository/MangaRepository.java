package com.paxkun.tracker.repository;

import com.paxkun.tracker.model.Manga;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

@Repository
public interface MangaRepository extends JpaRepository<Manga, Long> {

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE Manga m SET m.lastChecked = :checkedAt WHERE m.id = :mangaId")
    int updateLastChecked(@Param("mangaId") Long mangaId, @Param("checkedAt") LocalDateTime checkedAt);
}
