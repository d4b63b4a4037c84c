package dev.resumescreener.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Pre-aggregated tenure for one skill on one resume.
 * {@code totalYears} keeps full precision; use {@link #displayYears()} when presenting.
 */
public record SkillExperience(String skillName, double totalYears, List<JobBreakdown> jobBreakdown) {

    public SkillExperience {
        jobBreakdown = jobBreakdown == null ? List.of() : List.copyOf(jobBreakdown);
    }

    public static SkillExperience empty(String skillName) {
        return new SkillExperience(skillName, 0.0, List.of());
    }

    public double displayYears() {
        return BigDecimal.valueOf(totalYears).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
