package com.paxkun.tracker.repository;

import com.paxkun.tracker.model.Scanlator;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ScanlatorRepository extends JpaRepository<Scanlator, Long> {
    Optional<Scanlator> findByPluginKey(String pluginKey);
}
