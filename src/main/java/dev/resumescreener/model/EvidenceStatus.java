package dev.resumescreener.model;

/**
 * How a skill's evidence was obtained. Lets a report tell "graded and found nothing"
 * apart from "could not be evaluated".
 */
public enum EvidenceStatus {
    /** Best chunk retrieved and graded by the oracle. */
    GRADED,
    /** The vector index held no candidate chunk for the resume. */
    NO_EVIDENCE_FOUND,
    /** Retrieval or grading failed; the skill is scored as unmatched. */
    EVIDENCE_UNAVAILABLE
}
