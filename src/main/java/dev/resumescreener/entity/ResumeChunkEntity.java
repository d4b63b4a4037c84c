package dev.resumescreener.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A stored resume chunk with the work-history entry it was associated with.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "resume_chunks", indexes = {
        @Index(name = "idx_chunk_resume", columnList = "resumeId"),
        @Index(name = "idx_chunk_vector_key", columnList = "vectorKey", unique = true)
})
public class ResumeChunkEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String resumeId;

    @Column(nullable = false)
    private int sequenceIndex;

    @Column(nullable = false, length = 128)
    private String vectorKey;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String text;

    @Column(nullable = false)
    private int startWord;

    @Column(nullable = false)
    private int wordCount;

    @Column(nullable = false)
    private int overlapWords;

    @Column(length = 500)
    private String jobCompany;

    @Column(length = 500)
    private String jobTitle;
}
