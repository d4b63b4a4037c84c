package dev.resumescreener.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One ingested resume. The whole skill-experience map lives in a single JSON column
 * so re-ingestion swaps it in one row update.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "resume_profiles")
public class ResumeProfileEntity {

    @Id
    @Column(length = 64)
    private String resumeId;

    @Column(columnDefinition = "TEXT")
    private String candidateName;

    @Column(columnDefinition = "TEXT")
    private String title;

    @Column(nullable = false)
    private double totalYears;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String resumeText;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String profileJson;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String workHistoryJson;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String skillExperienceJson;

    @Column(nullable = false)
    private int chunkCount;

    @Column(nullable = false)
    private LocalDateTime ingestedAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;
}
