package dev.resumescreener.service;

import dev.resumescreener.model.EvidenceStatus;
import dev.resumescreener.model.JobRequirement;
import dev.resumescreener.model.ScoreResult;
import dev.resumescreener.model.SkillScore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Folds per-skill scores, total experience and additional factors into one overall score.
 * Weights are fixed product constants.
 */
@Slf4j
@Service
public class ScoreAggregationService {

    static final BigDecimal CORE_WEIGHT = new BigDecimal("0.60");
    static final BigDecimal EXPERIENCE_WEIGHT = new BigDecimal("0.25");
    static final BigDecimal ADDITIONAL_WEIGHT = new BigDecimal("0.15");
    static final double EXPERIENCE_PENALTY_PER_YEAR = 10.0;

    /**
     * Aggregate one scoring request.
     *
     * @param skillScores      one score per evaluated requirement; core requirements without a score count as unmatched
     * @param requirements     all requirements of the job
     * @param resumeTotalYears candidate's total professional experience
     * @param jdRequiredYears  total experience the job asks for
     * @throws IllegalArgumentException  for null, negative or non-finite inputs
     * @throws AggregationInputException if a score has no requirement or a skill is scored twice
     */
    public ScoreResult aggregate(List<SkillScore> skillScores, List<JobRequirement> requirements,
            double resumeTotalYears, double jdRequiredYears, boolean hasCertifications, boolean hasProjects) {
        if (skillScores == null || requirements == null) {
            throw new IllegalArgumentException("Skill scores and requirements must not be null");
        }
        checkYears("resume total years", resumeTotalYears);
        checkYears("required total years", jdRequiredYears);

        Map<String, JobRequirement> requirementsByName = new HashMap<>();
        for (JobRequirement requirement : requirements) {
            if (requirement == null || requirement.getSkillName() == null) {
                throw new IllegalArgumentException("Requirement without a skill name");
            }
            requirementsByName.putIfAbsent(key(requirement.getSkillName()), requirement);
        }

        Map<String, SkillScore> scoresByName = new HashMap<>();
        for (SkillScore score : skillScores) {
            if (score == null || score.skillName() == null) {
                throw new IllegalArgumentException("Skill score without a skill name");
            }
            if (Double.isNaN(score.score()) || score.score() < 0.0 || score.score() > 1.0) {
                throw new IllegalArgumentException("Skill score for '" + score.skillName() + "' out of [0, 1]: "
                        + score.score());
            }
            String key = key(score.skillName());
            if (!requirementsByName.containsKey(key)) {
                throw new AggregationInputException("Skill score for '" + score.skillName()
                        + "' has no matching requirement");
            }
            if (scoresByName.put(key, score) != null) {
                throw new AggregationInputException("Skill '" + score.skillName() + "' was scored more than once");
            }
        }

        int totalCore = 0;
        int matchedCore = 0;
        for (JobRequirement requirement : requirementsByName.values()) {
            if (requirement.getImportance() == null || !requirement.getImportance().isCore()) {
                continue;
            }
            totalCore++;
            SkillScore score = scoresByName.get(key(requirement.getSkillName()));
            if (score != null && score.matched()) {
                matchedCore++;
            }
        }

        double coreScore = totalCore == 0 ? 100.0 : (double) matchedCore / totalCore * 100.0;
        double experienceScore = experienceScore(resumeTotalYears, jdRequiredYears);
        double additionalScore = (hasCertifications ? 50.0 : 0.0) + (hasProjects ? 50.0 : 0.0);
        int overall = overall(coreScore, experienceScore, additionalScore);

        log.info("Aggregated score {} (core {}/{} = {}, experience {}, additional {})",
                overall, matchedCore, totalCore, coreScore, experienceScore, additionalScore);

        return new ScoreResult(overall, coreScore, experienceScore, additionalScore, skillScores,
                matchedCore, totalCore, notes(skillScores));
    }

    static double experienceScore(double resumeTotalYears, double jdRequiredYears) {
        if (resumeTotalYears >= jdRequiredYears) {
            return 100.0;
        }
        return Math.max(0.0, 100.0 - (jdRequiredYears - resumeTotalYears) * EXPERIENCE_PENALTY_PER_YEAR);
    }

    static int overall(double coreScore, double experienceScore, double additionalScore) {
        BigDecimal weighted = BigDecimal.valueOf(coreScore).multiply(CORE_WEIGHT)
                .add(BigDecimal.valueOf(experienceScore).multiply(EXPERIENCE_WEIGHT))
                .add(BigDecimal.valueOf(additionalScore).multiply(ADDITIONAL_WEIGHT));
        int rounded = weighted.setScale(0, RoundingMode.HALF_UP).intValue();
        return Math.max(0, Math.min(100, rounded));
    }

    private static List<String> notes(List<SkillScore> skillScores) {
        List<String> notes = new ArrayList<>();
        for (SkillScore score : skillScores) {
            if (score.evidenceStatus() == EvidenceStatus.NO_EVIDENCE_FOUND) {
                notes.add("No evidence found for " + score.skillName());
            } else if (score.evidenceStatus() == EvidenceStatus.EVIDENCE_UNAVAILABLE) {
                notes.add("Evidence unavailable for " + score.skillName()
                        + (score.reasoning() == null || score.reasoning().isBlank() ? "" : ": " + score.reasoning()));
            }
        }
        return notes;
    }

    private static String key(String skillName) {
        return skillName.trim().toLowerCase(Locale.ROOT);
    }

    private static void checkYears(String label, double years) {
        if (Double.isNaN(years) || Double.isInfinite(years) || years < 0) {
            throw new IllegalArgumentException(label + " must be a non-negative number, got " + years);
        }
    }
}
