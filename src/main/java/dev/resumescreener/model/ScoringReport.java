package dev.resumescreener.model;

/**
 * What a scoring request hands back to its caller. {@code matchRunId} is null when
 * the run could not be persisted.
 */
public record ScoringReport(String matchRunId, String resumeId, JobRequirements requirements, ScoreResult result) {
}
