package dev.resumescreener.model;

import java.util.List;

/**
 * Per-skill outcome of a scoring request. {@code matched} and {@code meetsRequirement}
 * are reported independently: strong evidence with a years shortfall is matched but
 * does not meet the requirement.
 */
public record SkillScore(
        String skillName,
        double score,
        double yearsFound,
        double yearsRequired,
        boolean meetsRequirement,
        boolean matched,
        EvidenceStrength evidenceStrength,
        EvidenceStatus evidenceStatus,
        String quote,
        String reasoning,
        List<JobBreakdown> jobBreakdown) {

    public SkillScore {
        jobBreakdown = jobBreakdown == null ? List.of() : List.copyOf(jobBreakdown);
    }
}
