package dev.resumescreener.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A persisted scoring request: the job requirements used and the resulting scores.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "match_runs", indexes = {
        @Index(name = "idx_match_resume", columnList = "resumeId"),
        @Index(name = "idx_match_created_at", columnList = "createdAt")
})
public class MatchRunEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 64)
    private String resumeId;

    @Column(length = 500)
    private String jobTitle;

    @Column(nullable = false)
    private int overallScore;

    @Column(nullable = false)
    private double coreSkillsScore;

    @Column(nullable = false)
    private double experienceScore;

    @Column(nullable = false)
    private double additionalScore;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String requirementsJson;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String resultJson;

    @Column(nullable = false)
    private LocalDateTime createdAt;
}
