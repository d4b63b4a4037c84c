package dev.resumescreener.service;

import dev.resumescreener.model.EvidenceMatch;
import dev.resumescreener.model.EvidenceStrength;
import dev.resumescreener.model.JobRequirement;
import dev.resumescreener.model.SkillExperience;
import dev.resumescreener.model.SkillScore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Combines graded evidence with looked-up experience into a per-skill score in [0, 1].
 */
@Slf4j
@Service
public class SkillScoringService {

    static final double EVIDENCE_WEIGHT = 0.6;
    static final double YEARS_WEIGHT = 0.4;
    static final double SHORTFALL_PENALTY_PER_YEAR = 0.15;

    public SkillScore score(EvidenceMatch evidence, SkillExperience experience, JobRequirement requirement) {
        if (evidence == null || experience == null || requirement == null) {
            throw new IllegalArgumentException("Evidence, experience and requirement are all required");
        }
        double yearsFound = experience.totalYears();
        double yearsRequired = requirement.getMinYears();
        checkYears("total years", yearsFound);
        checkYears("minimum years", yearsRequired);

        EvidenceStrength strength = evidence.strength() == null ? EvidenceStrength.NONE : evidence.strength();
        double evidenceValue = strength.value();
        double yearsValue = yearsValue(yearsFound, yearsRequired);
        double score = clamp(evidenceValue * EVIDENCE_WEIGHT + yearsValue * YEARS_WEIGHT);
        boolean meets = yearsFound >= yearsRequired;

        log.debug("Skill '{}': evidence={} years={}/{} -> {}", requirement.getSkillName(), strength,
                yearsFound, yearsRequired, score);

        return new SkillScore(
                requirement.getSkillName(),
                score,
                yearsFound,
                yearsRequired,
                meets,
                evidence.matched(),
                strength,
                evidence.status(),
                evidence.quote(),
                evidence.reasoning(),
                experience.jobBreakdown());
    }

    /**
     * 1.0 when the requirement is met, otherwise a linear 0.15-per-year decay floored at 0.
     */
    static double yearsValue(double yearsFound, double yearsRequired) {
        if (yearsFound >= yearsRequired) {
            return 1.0;
        }
        return Math.max(0.0, 1.0 - (yearsRequired - yearsFound) * SHORTFALL_PENALTY_PER_YEAR);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static void checkYears(String label, double years) {
        if (Double.isNaN(years) || Double.isInfinite(years) || years < 0) {
            throw new IllegalArgumentException(label + " must be a non-negative number, got " + years);
        }
    }
}
