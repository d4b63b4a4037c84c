package dev.resumescreener.model;

import java.time.Instant;

/**
 * Normalized resume text as handed over by the ingestion boundary.
 */
public record ResumeDocument(String resumeId, String text, Instant ingestedAt) {
}
