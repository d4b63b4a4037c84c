package dev.resumescreener.repository;

import dev.resumescreener.entity.MatchRunEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for persisted scoring runs.
 */
@Repository
public interface MatchRunRepository extends JpaRepository<MatchRunEntity, String> {

    /**
     * Runs for one resume, newest first.
     */
    List<MatchRunEntity> findByResumeIdOrderByCreatedAtDesc(String resumeId);
}
