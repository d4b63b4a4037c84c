package dev.resumescreener.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Candidate-level facts extracted from a resume.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ResumeProfile {
    String name;
    String email;
    String phone;
    String location;
    String linkedinUrl;
    String title;
    String summary;
    double totalYears;
    @Singular
    List<String> skills;
    @Singular
    List<String> certifications;
    @Singular
    List<String> projects;

    public static ResumeProfile empty() {
        return ResumeProfile.builder().build();
    }

    public boolean hasCertifications() {
        return certifications.stream().anyMatch(c -> c != null && !c.isBlank());
    }

    public boolean hasProjects() {
        return projects.stream().anyMatch(p -> p != null && !p.isBlank());
    }
}
