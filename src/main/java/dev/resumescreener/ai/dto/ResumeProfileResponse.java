package dev.resumescreener.ai.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.resumescreener.ai.OracleParseException;
import dev.resumescreener.model.ResumeProfile;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Candidate facts and categorized skills extracted from resume text.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResumeProfileResponse(
        String name,
        String email,
        String phone,
        String location,
        @JsonProperty("linkedin_url") String linkedinUrl,
        String title,
        @JsonProperty("years_exp") String yearsExp,
        @JsonProperty("summary_one_line") String summary,
        Map<String, List<String>> skills,
        @JsonProperty("skills_flat_unique") List<String> skillsFlatUnique,
        List<String> certifications,
        List<String> projects) implements OracleResponse {

    private static final Pattern NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?");

    @Override
    public void validate() {
        if (skills == null && skillsFlatUnique == null) {
            throw new OracleParseException("Resume profile response has no skills field");
        }
    }

    /**
     * Flat skill list: the explicit unique list first, then anything only present in a category,
     * de-duplicated case-insensitively in first-seen order.
     */
    public List<String> allSkills() {
        Map<String, String> unique = new LinkedHashMap<>();
        addAll(unique, skillsFlatUnique);
        if (skills != null) {
            skills.values().forEach(category -> addAll(unique, category));
        }
        return new ArrayList<>(unique.values());
    }

    public double totalYears() {
        if (yearsExp == null) {
            return 0.0;
        }
        Matcher m = NUMBER.matcher(yearsExp);
        return m.find() ? Double.parseDouble(m.group()) : 0.0;
    }

    public ResumeProfile toProfile() {
        return ResumeProfile.builder()
                .name(name)
                .email(email)
                .phone(phone)
                .location(location)
                .linkedinUrl(linkedinUrl)
                .title(title)
                .summary(summary)
                .totalYears(totalYears())
                .skills(allSkills())
                .certifications(nonBlank(certifications))
                .projects(nonBlank(projects))
                .build();
    }

    private static void addAll(Map<String, String> unique, List<String> values) {
        if (values == null) {
            return;
        }
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                unique.putIfAbsent(value.trim().toLowerCase(Locale.ROOT), value.trim());
            }
        }
    }

    private static List<String> nonBlank(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(v -> v != null && !v.isBlank()).map(String::trim).toList();
    }
}
