package dev.resumescreener.repository;

import dev.resumescreener.entity.ResumeChunkEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for resume chunks.
 */
@Repository
public interface ResumeChunkRepository extends JpaRepository<ResumeChunkEntity, Long> {

    /**
     * All chunks of one resume in document order.
     */
    List<ResumeChunkEntity> findByResumeIdOrderBySequenceIndexAsc(String resumeId);

    long countByResumeId(String resumeId);

    /**
     * Remove every chunk of a resume before re-ingestion.
     */
    @Modifying
    @Query("DELETE FROM ResumeChunkEntity c WHERE c.resumeId = :resumeId")
    int deleteAllByResumeId(@Param("resumeId") String resumeId);
}
