package dev.resumescreener.repository;

import dev.resumescreener.entity.ResumeProfileEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for ingested resume profiles, keyed by resume id.
 */
@Repository
public interface ResumeProfileRepository extends JpaRepository<ResumeProfileEntity, String> {
}
