package dev.resumescreener.ai.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.resumescreener.ai.OracleParseException;
import dev.resumescreener.model.Importance;
import dev.resumescreener.model.JobRequirement;
import dev.resumescreener.model.JobRequirements;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Requirements extracted from a job description.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobRequirementsResponse(
        @JsonProperty("job_title") String jobTitle,
        @JsonProperty("core_skills") List<SkillSpec> coreSkills,
        @JsonProperty("secondary_skills") List<SkillSpec> secondarySkills,
        @JsonProperty("nice_to_have_skills") List<SkillSpec> niceToHaveSkills,
        List<String> keywords,
        @JsonProperty("experience_requirements") ExperienceRequirements experienceRequirements)
        implements OracleResponse {

    @Override
    public void validate() {
        if (coreSkills == null && secondarySkills == null && niceToHaveSkills == null) {
            throw new OracleParseException("Job requirements response has no skill lists");
        }
        if (experienceRequirements != null && experienceRequirements.totalYears() != null
                && experienceRequirements.totalYears() < 0) {
            throw new OracleParseException("Negative experience_requirements.total_years");
        }
        Stream.of(coreSkills, secondarySkills, niceToHaveSkills)
                .filter(Objects::nonNull)
                .flatMap(List::stream)
                .filter(spec -> spec != null && spec.minYears() != null && spec.minYears() < 0)
                .findFirst()
                .ifPresent(spec -> {
                    throw new OracleParseException("Negative min_years for skill " + spec.name());
                });
    }

    /**
     * Flatten the three lists into requirements. Every core or secondary skill counts toward
     * the core score whatever its label; nice-to-have skills never do. A skill named twice
     * keeps its first, most important occurrence; blank names are dropped.
     */
    public JobRequirements toRequirements() {
        List<JobRequirement> requirements = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        addAll(requirements, seen, coreSkills, Importance.REQUIRED);
        addAll(requirements, seen, secondarySkills, Importance.REQUIRED);
        addAll(requirements, seen, niceToHaveSkills, Importance.NICE_TO_HAVE);

        double totalYears = experienceRequirements != null && experienceRequirements.totalYears() != null
                ? experienceRequirements.totalYears()
                : 0.0;
        List<String> cleanKeywords = keywords == null ? List.of()
                : keywords.stream().filter(k -> k != null && !k.isBlank()).map(String::trim).toList();
        return new JobRequirements(jobTitle, requirements, totalYears, cleanKeywords);
    }

    private static void addAll(List<JobRequirement> out, Set<String> seen, List<SkillSpec> specs,
            Importance defaultImportance) {
        if (specs == null) {
            return;
        }
        for (SkillSpec spec : specs) {
            if (spec == null || spec.name() == null || spec.name().isBlank()) {
                continue;
            }
            String name = spec.name().trim();
            if (!seen.add(name.toLowerCase(Locale.ROOT))) {
                continue;
            }
            JobRequirement.JobRequirementBuilder builder = JobRequirement.builder()
                    .skillName(name)
                    .importance(importanceOf(spec, defaultImportance))
                    .minYears(spec.minYears() != null ? spec.minYears() : 0.0);
            if (spec.variants() != null) {
                spec.variants().stream()
                        .filter(v -> v != null && !v.isBlank())
                        .map(String::trim)
                        .forEach(builder::nameVariant);
            }
            out.add(builder.build());
        }
    }

    private static Importance importanceOf(SkillSpec spec, Importance listImportance) {
        if (!listImportance.isCore()) {
            return listImportance;
        }
        return Importance.fromLabel(spec.importance(), listImportance);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SkillSpec(
            String name,
            String importance,
            @JsonProperty("min_years") Double minYears,
            List<String> variants) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExperienceRequirements(@JsonProperty("total_years") Double totalYears) {
    }
}
