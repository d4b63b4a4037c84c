package dev.resumescreener.model;

import java.util.List;

/**
 * Everything the scoring pipeline needs from one job description.
 */
public record JobRequirements(
        String jobTitle,
        List<JobRequirement> requirements,
        double requiredTotalYears,
        List<String> keywords) {

    public JobRequirements {
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public List<JobRequirement> coreRequirements() {
        return requirements.stream()
                .filter(r -> r.getImportance() != null && r.getImportance().isCore())
                .toList();
    }
}
