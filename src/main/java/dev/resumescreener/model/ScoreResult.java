package dev.resumescreener.model;

import java.util.List;

/**
 * Terminal output of one scoring request.
 *
 * @param overallScore     weighted overall score, integer in [0, 100]
 * @param coreSkillsScore  share of matched core skills, in [0, 100]
 * @param experienceScore  total-experience fit, in [0, 100]
 * @param additionalScore  certifications and projects, in [0, 100]
 * @param skillScores      one entry per evaluated requirement
 * @param matchedCoreSkills number of matched critical/required skills
 * @param totalCoreSkills  number of critical/required skills
 * @param notes            skills whose evidence was missing or unavailable
 */
public record ScoreResult(
        int overallScore,
        double coreSkillsScore,
        double experienceScore,
        double additionalScore,
        List<SkillScore> skillScores,
        int matchedCoreSkills,
        int totalCoreSkills,
        List<String> notes) {

    public ScoreResult {
        skillScores = skillScores == null ? List.of() : List.copyOf(skillScores);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
}
