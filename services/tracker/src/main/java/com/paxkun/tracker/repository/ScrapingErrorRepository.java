package com.paxkun.tracker.repository;

import com.paxkun.tracker.model.ScrapingError;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ScrapingErrorRepository extends JpaRepository<ScrapingError, Long> {
}
