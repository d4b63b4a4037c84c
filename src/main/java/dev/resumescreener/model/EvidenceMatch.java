package dev.resumescreener.model;

/**
 * The graded best evidence chunk for one skill. Lives only for one scoring request.
 *
 * @param skillName      skill the evidence was retrieved for
 * @param chunkId        vector key of the chunk, null for the sentinel
 * @param chunkText      chunk text, empty for the sentinel
 * @param relevanceScore retrieval score after the keyword boost
 * @param matched        whether the oracle judged the skill as present
 * @param strength       oracle evidence grade
 * @param quote          short supporting quote from the chunk
 * @param reasoning      one-sentence justification from the oracle
 * @param status         how the evidence was obtained
 */
public record EvidenceMatch(
        String skillName,
        String chunkId,
        String chunkText,
        double relevanceScore,
        boolean matched,
        EvidenceStrength strength,
        String quote,
        String reasoning,
        EvidenceStatus status) {

    public static EvidenceMatch noEvidence(String skillName) {
        return new EvidenceMatch(skillName, null, "", 0.0, false, EvidenceStrength.NONE, "",
                "No supporting evidence found", EvidenceStatus.NO_EVIDENCE_FOUND);
    }

    public static EvidenceMatch unavailable(String skillName, String reason) {
        return new EvidenceMatch(skillName, null, "", 0.0, false, EvidenceStrength.NONE, "",
                reason, EvidenceStatus.EVIDENCE_UNAVAILABLE);
    }
}
