package dev.resumescreener.ai;

/**
 * The structured prompts the pipeline sends to the oracle, with their default output budgets.
 */
public enum PromptType {
    RESUME_PROFILE(2500),
    WORK_HISTORY(6000),
    SKILL_EXPERIENCE(4000),
    JOB_REQUIREMENTS(2500),
    EVIDENCE_GRADE(900),
    SKILL_VARIANT_MATCH(500);

    private final int defaultMaxOutputTokens;

    PromptType(int defaultMaxOutputTokens) {
        this.defaultMaxOutputTokens = defaultMaxOutputTokens;
    }

    public int getDefaultMaxOutputTokens() {
        return defaultMaxOutputTokens;
    }
}
