package dev.resumescreener.model;

/**
 * The oracle's judgement of one resume excerpt against one skill.
 */
public record EvidenceGrade(
        boolean hasSkill,
        EvidenceStrength strength,
        String quote,
        String reasoning,
        double confidence) {

    /**
     * A skill counts as matched only when the oracle says it is present
     * and the grade is above {@link EvidenceStrength#NONE}.
     */
    public boolean matched() {
        return hasSkill && strength != null && strength != EvidenceStrength.NONE;
    }
}
