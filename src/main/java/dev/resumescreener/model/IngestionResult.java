package dev.resumescreener.model;

/**
 * Summary of one resume ingestion.
 */
public record IngestionResult(
        String resumeId,
        int chunkCount,
        int workHistoryCount,
        int skillCount,
        int skillsWithExperience,
        long durationMs) {
}
